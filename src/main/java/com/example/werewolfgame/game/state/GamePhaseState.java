package com.example.werewolfgame.game.state;

import com.example.werewolfgame.game.domain.GamePhase;
import com.example.werewolfgame.game.domain.GameSession;

/**
 * 게임 페이즈 상태 인터페이스 (State Pattern)
 */
public interface GamePhaseState {

    /**
     * 현재 페이즈 진행 (메시지 전송, 집계, 사망 처리, 승리 판정)
     *
     * @param session 게임 상태 (엔진 스레드 단독 소유)
     */
    void process(GameSession session);

    /**
     * 다음 페이즈 결정
     * 승패가 결정되었으면 TERMINAL.
     */
    GamePhase nextPhase(GameSession session);
}
