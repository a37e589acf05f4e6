package com.example.werewolfgame.game.state;

import org.springframework.stereotype.Component;

import com.example.werewolfgame.game.domain.GamePhase;

import lombok.RequiredArgsConstructor;

/**
 * 페이즈별 상태를 제공하는 Factory
 */
@Component
@RequiredArgsConstructor
public class GamePhaseFactory {

    private final LobbyState lobbyState;
    private final NightState nightState;
    private final DayState dayState;
    private final TerminalState terminalState;

    public GamePhaseState getState(GamePhase phase) {
        return switch (phase) {
            case LOBBY -> lobbyState;
            case NIGHT -> nightState;
            case DAY -> dayState;
            case TERMINAL -> terminalState;
        };
    }
}
