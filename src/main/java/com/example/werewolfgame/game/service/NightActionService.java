package com.example.werewolfgame.game.service;

import java.util.ArrayList;
import java.util.List;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import com.example.werewolfgame.game.domain.GameSession;
import com.example.werewolfgame.game.domain.NightResult;
import com.example.werewolfgame.game.domain.PlayerRole;
import com.example.werewolfgame.game.domain.Roster;
import com.example.werewolfgame.game.strategy.NightContext;
import com.example.werewolfgame.game.strategy.NightStep;
import com.example.werewolfgame.game.strategy.SeerDivineStep;
import com.example.werewolfgame.game.strategy.WitchPoisonStep;
import com.example.werewolfgame.game.strategy.WitchSaveStep;
import com.example.werewolfgame.game.strategy.WolfKillStep;

import lombok.extern.slf4j.Slf4j;

/**
 * 밤 행동 서비스
 * - 늑대 투표 -> 마녀 치료 -> 마녀 독약 -> 예언자 조사 순서로 한 번씩 실행
 * - 제거 적용은 늑대 후보 먼저, 독약 후보 다음
 */
@Slf4j
@Service
public class NightActionService {

    private final List<NightStep> steps;

    @Autowired
    public NightActionService(WolfKillStep wolfKillStep,
                              WitchSaveStep witchSaveStep,
                              WitchPoisonStep witchPoisonStep,
                              SeerDivineStep seerDivineStep) {
        this(List.of(wolfKillStep, witchSaveStep, witchPoisonStep, seerDivineStep));
    }

    public NightActionService(List<NightStep> steps) {
        this.steps = List.copyOf(steps);
    }

    public NightResult runNight(GameSession session) {
        NightContext context = new NightContext(session);
        for (NightStep step : steps) {
            if (step.isApplicable(context)) {
                step.execute(context);
            } else {
                log.debug("[밤] 단계 건너뜀: {}", step.getClass().getSimpleName());
            }
        }
        NightResult result = context.toResult();
        log.info("[밤] 라운드 {} 결과: kill={}, poison={}, seer={}",
                session.getRound(), result.killCandidate(), result.poisonCandidate(), result.investigation());
        return result;
    }

    /**
     * @return 이번 밤 실제로 사망 처리된 참가자 (적용 순서)
     */
    public List<String> applyEliminations(Roster<PlayerRole> roster, NightResult result) {
        List<String> eliminated = new ArrayList<>();
        result.kill().flatMap(roster::markDead).ifPresent(eliminated::add);
        result.poison().flatMap(roster::markDead).ifPresent(eliminated::add);
        return eliminated;
    }
}
