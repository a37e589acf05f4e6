package com.example.werewolfgame.duel;

/**
 * 대국 결과
 *
 * @param winner 승자 식별자 (WIN 일 때만)
 * @param turns  요청한 수의 개수
 */
public record DuelResult(DuelOutcome outcome, String winner, int turns) {

    public enum DuelOutcome {
        WIN,
        DRAW,      // 규칙상 종료, 승자 없음
        NO_WINNER, // 최대 수 도달
        ABORTED    // 로비 시간 초과
    }
}
