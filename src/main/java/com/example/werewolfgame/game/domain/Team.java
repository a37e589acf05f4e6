package com.example.werewolfgame.game.domain;

public enum Team {
    WOLF,
    VILLAGE
}
