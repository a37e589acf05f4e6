package com.example.werewolfgame.game.domain;

import lombok.Getter;

/**
 * 마녀의 1회용 능력 (치료약, 독약)
 * 각각 한 번 사용되면 다시 채워지지 않는다.
 */
@Getter
public class AbilityBudget {

    private boolean healAvailable = true;
    private boolean poisonAvailable = true;

    /**
     * @return 이번 호출로 치료약을 사용했으면 true
     */
    public boolean useHeal() {
        if (!healAvailable) {
            return false;
        }
        healAvailable = false;
        return true;
    }

    /**
     * @return 이번 호출로 독약을 사용했으면 true
     */
    public boolean usePoison() {
        if (!poisonAvailable) {
            return false;
        }
        poisonAvailable = false;
        return true;
    }
}
