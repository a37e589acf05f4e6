package com.example.werewolfgame.game.state;

import org.springframework.stereotype.Component;

import com.example.werewolfgame.game.domain.GameOutcome;
import com.example.werewolfgame.game.domain.GamePhase;
import com.example.werewolfgame.game.domain.GameSession;
import com.example.werewolfgame.game.domain.PlayerRole;
import com.example.werewolfgame.game.domain.Roster;
import com.example.werewolfgame.game.service.LobbyService;
import com.example.werewolfgame.game.service.ModeratorMessages;
import com.example.werewolfgame.game.service.RoleFanoutService;
import com.example.werewolfgame.global.config.GameProperties;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 로비 상태
 * - 전원 등록되면 늑대에게 동료 명단 공개
 * - 시간 초과면 게임 중단 (밤으로 진입하지 않음)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LobbyState implements GamePhaseState {

    private final LobbyService lobbyService;
    private final RoleFanoutService fanoutService;
    private final ModeratorMessages messages;
    private final GameProperties properties;

    @Override
    public void process(GameSession session) {
        Roster<PlayerRole> roster = session.getRoster();
        log.info("[로비] 참가자 등록 대기 시작: slots={}, timeout={}", roster.totalSlots(), properties.registrationTimeout());

        boolean full = lobbyService.awaitRegistrations(roster,
                properties.registrationTimeout(), properties.registrationPollInterval());
        if (!full) {
            session.finish(GameOutcome.ABORTED);
            return;
        }

        log.info("[로비] 게임 시작");
        fanoutService.fanoutToRole(roster, messages.teammates(roster.identitiesOfRole(PlayerRole.WOLF)),
                PlayerRole.WOLF);
    }

    @Override
    public GamePhase nextPhase(GameSession session) {
        return session.isFinished() ? GamePhase.TERMINAL : GamePhase.NIGHT;
    }
}
