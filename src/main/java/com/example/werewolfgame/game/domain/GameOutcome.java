package com.example.werewolfgame.game.domain;

import lombok.Getter;

@Getter
public enum GameOutcome {
    WOLF_WIN("Game over: wolf win"),
    VILLAGE_WIN("Game over: village win"),
    NO_WINNER("Game over: no winner"), // 최대 라운드 도달
    ABORTED("Registration timeout, game cannot start"); // 로비 시간 초과

    private final String notice;

    GameOutcome(String notice) {
        this.notice = notice;
    }

    public static GameOutcome winnerOf(Team team) {
        return team == Team.WOLF ? WOLF_WIN : VILLAGE_WIN;
    }
}
