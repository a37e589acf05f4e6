package com.example.werewolfgame.game.domain;

import java.util.Optional;

/**
 * 밤 파이프라인 결과
 * - killCandidate: 늑대 투표 대상 (치료 시 null)
 * - poisonCandidate: 마녀 독약 대상
 * - investigation: 예언자 조사 결과
 */
public record NightResult(String killCandidate, String poisonCandidate, Investigation investigation) {

    public Optional<String> kill() {
        return Optional.ofNullable(killCandidate);
    }

    public Optional<String> poison() {
        return Optional.ofNullable(poisonCandidate);
    }

    public Optional<Investigation> seerCheck() {
        return Optional.ofNullable(investigation);
    }

    public record Investigation(String target, PlayerRole role) {
    }
}
