package com.example.werewolfgame.game.strategy;

import java.util.Optional;

import org.springframework.stereotype.Component;

import com.example.werewolfgame.game.domain.Participant;
import com.example.werewolfgame.game.domain.PlayerRole;
import com.example.werewolfgame.game.domain.Roster;
import com.example.werewolfgame.game.service.ModeratorMessages;
import com.example.werewolfgame.game.service.NameResolver;
import com.example.werewolfgame.game.service.RoleFanoutService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 마녀 독약
 * - 같은 밤에 치료약을 썼으면 실행하지 않음
 * - "no" 가 아닌 응답이면 독약을 소모하고 두 번째 제거 후보로 추가 (늑대 후보를 대체하지 않음)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WitchPoisonStep implements NightStep {

    private final RoleFanoutService fanoutService;
    private final NameResolver nameResolver;
    private final ModeratorMessages messages;

    @Override
    public boolean isApplicable(NightContext context) {
        return !context.isHealedTonight()
                && context.getSession().getAbilities().isPoisonAvailable()
                && context.getSession().getRoster().hasAlive(PlayerRole.WITCH);
    }

    @Override
    public void execute(NightContext context) {
        Roster<PlayerRole> roster = context.getSession().getRoster();
        Optional<String> answer = fanoutService
                .fanoutToRole(roster, messages.poisonRequest(), PlayerRole.WITCH)
                .stream()
                .findFirst()
                .map(reply -> reply.content().trim())
                .filter(content -> !content.isEmpty() && !content.equalsIgnoreCase("no"));

        if (answer.isEmpty()) {
            return;
        }
        context.getSession().getAbilities().usePoison();

        String target = nameResolver.resolve(answer.get(), roster.survivors())
                .flatMap(roster::findAlive)
                .map(Participant::getIdentity)
                .orElse(null);
        if (target == null) {
            log.warn("[밤] 독약 대상 해석 실패 (독약은 소모됨): content={}", answer.get());
        } else {
            log.info("[밤] 마녀 독약 대상: {}", target);
        }
        context.setPoisonCandidate(target);
    }
}
