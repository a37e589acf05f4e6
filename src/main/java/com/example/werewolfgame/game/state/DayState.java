package com.example.werewolfgame.game.state;

import java.util.List;

import org.springframework.stereotype.Component;

import com.example.werewolfgame.game.domain.GameOutcome;
import com.example.werewolfgame.game.domain.GamePhase;
import com.example.werewolfgame.game.domain.GameSession;
import com.example.werewolfgame.game.service.DayPhaseService;
import com.example.werewolfgame.game.service.WinEvaluator;
import com.example.werewolfgame.global.config.GameProperties;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 낮 상태
 * 토론/투표 후 승리 판정, 최대 라운드에 도달하면 승자 없음으로 종료
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DayState implements GamePhaseState {

    private final DayPhaseService dayPhaseService;
    private final WinEvaluator winEvaluator;
    private final GameProperties properties;

    @Override
    public void process(GameSession session) {
        dayPhaseService.runDay(session)
                .ifPresent(eliminated -> session.recordEliminations(List.of(eliminated)));

        winEvaluator.evaluate(session.getRoster())
                .ifPresent(team -> session.finish(GameOutcome.winnerOf(team)));

        if (!session.isFinished() && session.getRound() >= properties.maxRounds()) {
            log.info("[낮] 최대 라운드 도달: {}", properties.maxRounds());
            session.finish(GameOutcome.NO_WINNER);
        }
    }

    @Override
    public GamePhase nextPhase(GameSession session) {
        return session.isFinished() ? GamePhase.TERMINAL : GamePhase.NIGHT;
    }
}
