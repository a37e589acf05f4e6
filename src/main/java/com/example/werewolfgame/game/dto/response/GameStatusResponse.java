package com.example.werewolfgame.game.dto.response;

import java.util.List;

import com.example.werewolfgame.game.domain.GameOutcome;
import com.example.werewolfgame.game.domain.GamePhase;
import com.example.werewolfgame.game.domain.GameSession;

import lombok.Builder;

/**
 * 게임 진행 상황 스냅샷 (읽기 전용)
 */
@Builder
public record GameStatusResponse(
        String sessionId,
        GamePhase phase,
        int round,
        List<String> survivors,
        List<String> lastNightEliminated,
        List<String> eliminated,
        GameOutcome outcome) {

    public static GameStatusResponse from(GameSession session) {
        return GameStatusResponse.builder()
                .sessionId(session.getSessionId())
                .phase(session.getPhase())
                .round(session.getRound())
                .survivors(List.copyOf(session.getRoster().survivors()))
                .lastNightEliminated(List.copyOf(session.getLastNightEliminated()))
                .eliminated(List.copyOf(session.getEliminationLog()))
                .outcome(session.getOutcome())
                .build();
    }
}
