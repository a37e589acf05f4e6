package com.example.werewolfgame.game.domain;

public enum GameMode {
    WEREWOLF, // 늑대인간 (다인 역할 게임)
    DUEL // 2인 턴제 대국
}
