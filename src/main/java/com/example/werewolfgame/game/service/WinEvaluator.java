package com.example.werewolfgame.game.service;

import java.util.Optional;

import org.springframework.stereotype.Component;

import com.example.werewolfgame.game.domain.PlayerRole;
import com.example.werewolfgame.game.domain.Roster;
import com.example.werewolfgame.game.domain.Team;

/**
 * 승리 조건 판정
 * - 늑대 수 * 2 >= 생존자 수 : 늑대 승리
 * - 늑대 0명 : 마을 승리
 */
@Component
public class WinEvaluator {

    public Optional<Team> evaluate(Roster<PlayerRole> roster) {
        long aliveTotal = roster.alive().size();
        long aliveWolves = roster.countAlive(p -> p.getRole().getTeam() == Team.WOLF);

        if (aliveWolves * 2 >= aliveTotal) {
            return Optional.of(Team.WOLF);
        }
        if (aliveWolves == 0) {
            return Optional.of(Team.VILLAGE);
        }
        return Optional.empty();
    }
}
