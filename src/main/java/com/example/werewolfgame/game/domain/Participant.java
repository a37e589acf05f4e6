package com.example.werewolfgame.game.domain;

import lombok.Getter;

/**
 * 슬롯에 등록된 참가자
 * - 역할은 등록 시 한 번만 배정되고 바뀌지 않음
 * - alive는 true -> false 로만 전환 (Roster를 통해서만)
 */
@Getter
public class Participant<R> {

    private final String identity;
    private final R role;
    private boolean alive = true;

    Participant(String identity, R role) {
        this.identity = identity;
        this.role = role;
    }

    boolean kill() {
        if (!alive) {
            return false;
        }
        alive = false;
        return true;
    }

    public boolean hasIdentity(String name) {
        return name != null && identity.equalsIgnoreCase(name.trim());
    }

    @Override
    public String toString() {
        return identity + "(" + role + (alive ? ")" : ", dead)");
    }
}
