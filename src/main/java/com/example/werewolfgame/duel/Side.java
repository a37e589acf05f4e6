package com.example.werewolfgame.duel;

import com.example.werewolfgame.game.domain.GameRole;

import lombok.Getter;

@Getter
public enum Side implements GameRole {
    WHITE("white"), // 선공
    BLACK("black");

    private final String wireName;

    Side(String wireName) {
        this.wireName = wireName;
    }

    public Side opposite() {
        return this == WHITE ? BLACK : WHITE;
    }
}
