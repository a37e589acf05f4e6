package com.example.werewolfgame.game.state;

import java.util.List;

import org.springframework.stereotype.Component;

import com.example.werewolfgame.game.domain.GameOutcome;
import com.example.werewolfgame.game.domain.GamePhase;
import com.example.werewolfgame.game.domain.GameSession;
import com.example.werewolfgame.game.domain.NightResult;
import com.example.werewolfgame.game.service.ModeratorMessages;
import com.example.werewolfgame.game.service.NightActionService;
import com.example.werewolfgame.game.service.RoleFanoutService;
import com.example.werewolfgame.game.service.WinEvaluator;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 밤 상태
 * 새 라운드 시작 -> 밤 행동 -> 제거 적용 -> 승리 판정 (두 후보 모두 적용한 뒤 한 번)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NightState implements GamePhaseState {

    private final NightActionService nightActionService;
    private final RoleFanoutService fanoutService;
    private final ModeratorMessages messages;
    private final WinEvaluator winEvaluator;

    @Override
    public void process(GameSession session) {
        int round = session.nextRound();
        log.info("[밤] 라운드 {} 시작: 생존자={}", round, session.getRoster().survivors());
        fanoutService.broadcast(session.getRoster(), messages.nightOpening(session.getRoster().survivors()));

        NightResult result = nightActionService.runNight(session);
        List<String> eliminated = nightActionService.applyEliminations(session.getRoster(), result);
        session.setLastNightEliminated(eliminated);
        session.recordEliminations(eliminated);
        log.info("[밤] 라운드 {} 사망자: {}", round, eliminated);

        winEvaluator.evaluate(session.getRoster())
                .ifPresent(team -> session.finish(GameOutcome.winnerOf(team)));
    }

    @Override
    public GamePhase nextPhase(GameSession session) {
        return session.isFinished() ? GamePhase.TERMINAL : GamePhase.DAY;
    }
}
