package com.example.werewolfgame.game.strategy;

import java.util.List;

import org.springframework.stereotype.Component;

import com.example.werewolfgame.game.domain.Participant;
import com.example.werewolfgame.game.domain.PlayerRole;
import com.example.werewolfgame.game.domain.Roster;
import com.example.werewolfgame.game.service.ModeratorMessages;
import com.example.werewolfgame.game.service.RoleFanoutService;
import com.example.werewolfgame.game.service.VoteTally;
import com.example.werewolfgame.game.transport.Reply;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 늑대인간 밤 행동
 * - 살아있는 늑대에게 제거 대상 투표 요청
 * - 늑대 투표만 집계해 제거 후보 결정, 결과를 늑대에게 알림
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WolfKillStep implements NightStep {

    private final RoleFanoutService fanoutService;
    private final VoteTally voteTally;
    private final ModeratorMessages messages;

    @Override
    public boolean isApplicable(NightContext context) {
        return context.getSession().getRoster().hasAlive(PlayerRole.WOLF);
    }

    @Override
    public void execute(NightContext context) {
        Roster<PlayerRole> roster = context.getSession().getRoster();

        List<Reply> replies = fanoutService.fanoutToRole(roster, messages.nightKillRequest(), PlayerRole.WOLF);
        String target = voteTally.tally(roster, replies, p -> p.getRole() == PlayerRole.WOLF)
                .flatMap(roster::findAlive)
                .map(Participant::getIdentity)
                .orElse(null);

        context.setKillCandidate(target);
        log.info("[밤] 늑대 제거 후보: {}", target);
        fanoutService.fanoutToRole(roster, messages.wolfTargetNotice(target), PlayerRole.WOLF);
    }
}
