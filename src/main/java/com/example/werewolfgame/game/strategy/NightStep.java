package com.example.werewolfgame.game.strategy;

/**
 * 역할별 밤 행동 단계 (Strategy Pattern)
 * NightActionService 가 고정된 순서로 실행한다.
 */
public interface NightStep {

    /**
     * 이번 밤에 이 단계를 실행할지 여부 (역할 생존, 능력 잔여 등)
     */
    boolean isApplicable(NightContext context);

    /**
     * 밤 행동 실행. 결과는 context 에 기록한다.
     */
    void execute(NightContext context);
}
