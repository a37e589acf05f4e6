package com.example.werewolfgame.game.strategy;

import java.util.Locale;

import org.springframework.stereotype.Component;

import com.example.werewolfgame.game.domain.AbilityBudget;
import com.example.werewolfgame.game.domain.PlayerRole;
import com.example.werewolfgame.game.service.ModeratorMessages;
import com.example.werewolfgame.game.service.RoleFanoutService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 마녀 치료약
 * "yes" 응답이면 치료약을 소모하고 오늘 밤 제거 후보를 취소한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WitchSaveStep implements NightStep {

    private final RoleFanoutService fanoutService;
    private final ModeratorMessages messages;

    @Override
    public boolean isApplicable(NightContext context) {
        return context.getSession().getAbilities().isHealAvailable()
                && context.getSession().getRoster().hasAlive(PlayerRole.WITCH);
    }

    @Override
    public void execute(NightContext context) {
        String answer = fanoutService
                .fanoutToRole(context.getSession().getRoster(), messages.saveRequest(), PlayerRole.WITCH)
                .stream()
                .findFirst()
                .map(reply -> reply.content().trim().toLowerCase(Locale.ROOT))
                .orElse("");

        if (!answer.equals("yes")) {
            return;
        }
        AbilityBudget abilities = context.getSession().getAbilities();
        if (abilities.useHeal()) {
            log.info("[밤] 마녀 치료약 사용: 취소된 후보={}", context.getKillCandidate());
            context.setKillCandidate(null);
            context.setHealedTonight(true);
        }
    }
}
