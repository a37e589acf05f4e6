package com.example.werewolfgame.game.service;

import java.util.concurrent.Executor;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import com.example.werewolfgame.duel.DuelEngine;
import com.example.werewolfgame.duel.MoveRules;
import com.example.werewolfgame.game.domain.GameMode;
import com.example.werewolfgame.global.config.GameProperties;

import lombok.extern.slf4j.Slf4j;

/**
 * 애플리케이션 기동 후 게임 루프를 엔진 전용 스레드에서 시작한다 (game.auto-start=true 일 때)
 */
@Slf4j
@Component
public class GameRunner {

    private final GameEngine gameEngine;
    private final DuelEngine duelEngine;
    private final ObjectProvider<MoveRules> moveRules;
    private final Executor engineExecutor;
    private final GameProperties properties;

    public GameRunner(GameEngine gameEngine,
                      DuelEngine duelEngine,
                      ObjectProvider<MoveRules> moveRules,
                      @Qualifier("engineExecutor") Executor engineExecutor,
                      GameProperties properties) {
        this.gameEngine = gameEngine;
        this.duelEngine = duelEngine;
        this.moveRules = moveRules;
        this.engineExecutor = engineExecutor;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (!properties.autoStart()) {
            log.info("[게임] 자동 시작 비활성화 (game.auto-start=false)");
            return;
        }
        start();
    }

    public void start() {
        if (properties.mode() == GameMode.DUEL) {
            MoveRules rules = moveRules.getIfAvailable();
            if (rules == null) {
                throw new IllegalStateException("DUEL 모드에는 MoveRules 빈이 필요합니다.");
            }
            engineExecutor.execute(() -> duelEngine.play(rules));
        } else {
            engineExecutor.execute(gameEngine::run);
        }
        log.info("[게임] {} 모드 게임 루프 시작: sessionId={}", properties.mode(), properties.sessionId());
    }
}
