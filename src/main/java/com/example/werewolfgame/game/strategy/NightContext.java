package com.example.werewolfgame.game.strategy;

import com.example.werewolfgame.game.domain.GameSession;
import com.example.werewolfgame.game.domain.NightResult;

import lombok.Getter;
import lombok.Setter;

/**
 * 한 밤 동안 단계들이 공유하는 보류 상태
 * 치료는 적용 전 보류 후보를 지우는 것이므로 이미 적용된 사망은 되돌리지 않는다.
 */
@Getter
@Setter
public class NightContext {

    private final GameSession session;

    private String killCandidate;
    private String poisonCandidate;
    private boolean healedTonight;
    private NightResult.Investigation investigation;

    public NightContext(GameSession session) {
        this.session = session;
    }

    public NightResult toResult() {
        return new NightResult(killCandidate, poisonCandidate, investigation);
    }
}
