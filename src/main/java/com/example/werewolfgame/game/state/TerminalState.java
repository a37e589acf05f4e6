package com.example.werewolfgame.game.state;

import org.springframework.stereotype.Component;

import com.example.werewolfgame.game.domain.GamePhase;
import com.example.werewolfgame.game.domain.GameSession;
import com.example.werewolfgame.game.service.ModeratorMessages;
import com.example.werewolfgame.game.service.RoleFanoutService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 종료 상태 (흡수 상태)
 * 최종 결과 공지 외에는 메시지를 보내지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TerminalState implements GamePhaseState {

    private final RoleFanoutService fanoutService;
    private final ModeratorMessages messages;

    @Override
    public void process(GameSession session) {
        log.info("[종료] {} (round={}, 생존자={})",
                session.getOutcome(), session.getRound(), session.getRoster().survivors());
        fanoutService.broadcast(session.getRoster(), messages.outcome(session.getOutcome(), session.getRound()));
    }

    @Override
    public GamePhase nextPhase(GameSession session) {
        throw new IllegalStateException("종료된 게임은 다음 페이즈가 없습니다.");
    }
}
