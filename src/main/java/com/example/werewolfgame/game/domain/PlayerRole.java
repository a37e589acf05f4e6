package com.example.werewolfgame.game.domain;

import lombok.Getter;

@Getter
public enum PlayerRole implements GameRole {
    WOLF("wolf", Team.WOLF), // 늑대인간
    VILLAGER("village", Team.VILLAGE), // 시민
    SEER("seer", Team.VILLAGE), // 예언자
    WITCH("witch", Team.VILLAGE); // 마녀

    private final String wireName;
    private final Team team;

    PlayerRole(String wireName, Team team) {
        this.wireName = wireName;
        this.team = team;
    }
}
