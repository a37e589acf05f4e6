package com.example.werewolfgame.game.strategy;

import java.util.Optional;

import org.springframework.stereotype.Component;

import com.example.werewolfgame.game.domain.NightResult;
import com.example.werewolfgame.game.domain.Participant;
import com.example.werewolfgame.game.domain.PlayerRole;
import com.example.werewolfgame.game.domain.Roster;
import com.example.werewolfgame.game.service.ModeratorMessages;
import com.example.werewolfgame.game.service.NameResolver;
import com.example.werewolfgame.game.service.RoleFanoutService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 예언자 조사
 * 조사 결과는 예언자에게만 알린다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SeerDivineStep implements NightStep {

    private final RoleFanoutService fanoutService;
    private final NameResolver nameResolver;
    private final ModeratorMessages messages;

    @Override
    public boolean isApplicable(NightContext context) {
        return context.getSession().getRoster().hasAlive(PlayerRole.SEER);
    }

    @Override
    public void execute(NightContext context) {
        Roster<PlayerRole> roster = context.getSession().getRoster();
        Optional<Participant<PlayerRole>> checked = fanoutService
                .fanoutToRole(roster, messages.divineRequest(roster.survivors()), PlayerRole.SEER)
                .stream()
                .findFirst()
                .flatMap(reply -> nameResolver.resolve(reply.content(), roster.survivors()))
                .flatMap(roster::findAlive);

        if (checked.isEmpty()) {
            return;
        }
        Participant<PlayerRole> target = checked.get();
        context.setInvestigation(new NightResult.Investigation(target.getIdentity(), target.getRole()));
        log.info("[밤] 예언자 조사: target={}, role={}", target.getIdentity(), target.getRole());
        fanoutService.fanoutToRole(roster, messages.roleReveal(target.getIdentity(), target.getRole()),
                PlayerRole.SEER);
    }
}
