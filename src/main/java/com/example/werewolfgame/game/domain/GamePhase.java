package com.example.werewolfgame.game.domain;

public enum GamePhase {
    LOBBY, // 참가자 등록
    NIGHT, // 밤 행동
    DAY, // 낮 토론 + 투표
    TERMINAL; // 게임 종료 (더 이상 전환 없음)

    public boolean canTransitionTo(GamePhase next) {
        return switch (this) {
            case LOBBY -> next == NIGHT || next == TERMINAL;
            case NIGHT -> next == DAY || next == TERMINAL;
            case DAY -> next == NIGHT || next == TERMINAL;
            case TERMINAL -> false;
        };
    }
}
