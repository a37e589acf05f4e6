package com.example.werewolfgame.game.domain;

import java.util.ArrayList;
import java.util.List;

import lombok.Builder;
import lombok.Getter;
import lombok.Setter;

/**
 * 한 판의 게임 상태
 * GameEngine 루프가 단독으로 소유하고 변경한다. 외부에는 GameStatusResponse 스냅샷만 노출.
 */
@Getter
@Builder
public class GameSession {

    private final String sessionId;

    private final Roster<PlayerRole> roster;

    @Builder.Default
    private final AbilityBudget abilities = new AbilityBudget();

    @Builder.Default
    private GamePhase phase = GamePhase.LOBBY;

    @Builder.Default
    private int round = 0;

    @Setter
    @Builder.Default
    private List<String> lastNightEliminated = new ArrayList<>();

    @Builder.Default
    private final List<String> eliminationLog = new ArrayList<>();

    private GameOutcome outcome;

    public void moveTo(GamePhase next) {
        if (!phase.canTransitionTo(next)) {
            throw new IllegalStateException("허용되지 않는 페이즈 전환: " + phase + " -> " + next);
        }
        this.phase = next;
    }

    public int nextRound() {
        return ++round;
    }

    public void recordEliminations(List<String> identities) {
        eliminationLog.addAll(identities);
    }

    public void finish(GameOutcome outcome) {
        if (this.outcome == null) {
            this.outcome = outcome;
        }
    }

    public boolean isFinished() {
        return outcome != null;
    }
}
