package com.example.werewolfgame.game.service;

import java.util.Optional;
import java.util.Random;
import java.util.concurrent.atomic.AtomicBoolean;

import org.springframework.stereotype.Service;

import com.example.werewolfgame.game.domain.GamePhase;
import com.example.werewolfgame.game.domain.GameSession;
import com.example.werewolfgame.game.domain.PlayerRole;
import com.example.werewolfgame.game.domain.Roster;
import com.example.werewolfgame.game.dto.response.GameStatusResponse;
import com.example.werewolfgame.game.state.GamePhaseFactory;
import com.example.werewolfgame.game.state.GamePhaseState;
import com.example.werewolfgame.global.config.GameProperties;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 게임 엔진 (페이즈 상태 머신)
 * <p>
 * LOBBY -> NIGHT -> DAY -> (NIGHT | TERMINAL)
 * 한 스레드에서 run 을 끝까지 실행하며 GameSession 은 이 스레드만 변경한다.
 * 외부에서는 currentStatus 스냅샷만 읽는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GameEngine {

    private final GamePhaseFactory phaseFactory;
    private final GameProperties properties;
    private final Random random;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile GameStatusResponse status;

    public GameSession run() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("이미 진행 중이거나 종료된 게임입니다: " + properties.sessionId());
        }

        GameSession session = GameSession.builder()
                .sessionId(properties.sessionId())
                .roster(new Roster<>(properties.roleSlots(), random))
                .build();
        publish(session);
        log.info("[게임] 세션 시작: sessionId={}, slots={}", session.getSessionId(), properties.roleSlots());

        GamePhaseState state = phaseFactory.getState(session.getPhase());
        while (true) {
            state.process(session);
            publish(session);
            if (session.getPhase() == GamePhase.TERMINAL) {
                break;
            }

            GamePhase next = state.nextPhase(session);
            log.debug("[게임] 페이즈 전환: {} -> {}", session.getPhase(), next);
            session.moveTo(next);
            publish(session);
            state = phaseFactory.getState(next);
        }

        log.info("[게임] 세션 종료: outcome={}, rounds={}", session.getOutcome(), session.getRound());
        return session;
    }

    public Optional<GameStatusResponse> currentStatus() {
        return Optional.ofNullable(status);
    }

    private void publish(GameSession session) {
        status = GameStatusResponse.from(session);
    }
}
