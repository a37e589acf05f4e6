package com.example.werewolfgame.game.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * 역할 슬롯 고정 참가자 명단
 * <p>
 * 슬롯은 역할 테이블 순서대로 생성되며, 모든 조회 결과는 슬롯 순서를 따른다 (등록 도착 순서 아님).
 * 식별자는 대소문자를 구분하지 않고 유일하다.
 * 게임 엔진 루프에서만 변경한다.
 */
public class Roster<R extends GameRole> {

    private final List<R> slotRoles;
    private final List<Participant<R>> occupants;
    private final Random random;

    public Roster(Map<R, Integer> roleSlots, Random random) {
        Objects.requireNonNull(roleSlots, "roleSlots");
        this.random = Objects.requireNonNull(random, "random");

        List<R> roles = new ArrayList<>();
        roleSlots.forEach((role, count) -> {
            if (count == null || count < 0) {
                throw new IllegalArgumentException("슬롯 수가 올바르지 않습니다: " + role + "=" + count);
            }
            for (int i = 0; i < count; i++) {
                roles.add(role);
            }
        });
        this.slotRoles = List.copyOf(roles);
        this.occupants = new ArrayList<>(Collections.nCopies(slotRoles.size(), null));
    }

    // ================= 등록 =================

    /**
     * 빈 슬롯 중 하나를 무작위로 배정한다.
     *
     * @return 배정된 역할, 이미 등록된 이름이거나 빈 슬롯이 없으면 empty
     */
    public Optional<R> register(String identity) {
        if (identity == null || identity.isBlank()) {
            return Optional.empty();
        }
        if (findByIdentity(identity).isPresent()) {
            return Optional.empty();
        }

        List<Integer> open = openSlots();
        if (open.isEmpty()) {
            return Optional.empty();
        }

        int slot = open.get(random.nextInt(open.size()));
        R role = slotRoles.get(slot);
        occupants.set(slot, new Participant<>(identity, role));
        return Optional.of(role);
    }

    /**
     * 살아있는 참가자를 사망 처리한다.
     *
     * @return 저장된 정식 식별자, 없거나 이미 사망했으면 empty
     */
    public Optional<String> markDead(String identity) {
        return findByIdentity(identity)
                .filter(Participant::kill)
                .map(Participant::getIdentity);
    }

    // ================= 조회 =================

    public List<Integer> openSlots() {
        List<Integer> open = new ArrayList<>();
        for (int i = 0; i < occupants.size(); i++) {
            if (occupants.get(i) == null) {
                open.add(i);
            }
        }
        return open;
    }

    public int openSlotCount() {
        return (int) occupants.stream().filter(Objects::isNull).count();
    }

    public int totalSlots() {
        return slotRoles.size();
    }

    public boolean isFull() {
        return openSlotCount() == 0;
    }

    public Optional<Participant<R>> findByIdentity(String identity) {
        return participants().stream()
                .filter(p -> p.hasIdentity(identity))
                .findFirst();
    }

    public Optional<Participant<R>> findAlive(String identity) {
        return findByIdentity(identity).filter(Participant::isAlive);
    }

    /**
     * 등록된 참가자 전체 (슬롯 순서)
     */
    public List<Participant<R>> participants() {
        return occupants.stream()
                .filter(Objects::nonNull)
                .toList();
    }

    /**
     * 역할 "*" 에 해당하는 살아있는 전체 참가자
     */
    public List<Participant<R>> alive() {
        return aliveMatching(p -> true);
    }

    public List<Participant<R>> aliveOfRole(R role) {
        return aliveMatching(p -> p.getRole().equals(role));
    }

    public List<Participant<R>> aliveMatching(Predicate<Participant<R>> filter) {
        return participants().stream()
                .filter(Participant::isAlive)
                .filter(filter)
                .toList();
    }

    public boolean hasAlive(R role) {
        return !aliveOfRole(role).isEmpty();
    }

    public List<String> survivors() {
        return alive().stream().map(Participant::getIdentity).toList();
    }

    /**
     * 같은 역할 동료 목록 (늑대인간에게 동료 공개 시 사용)
     */
    public List<String> identitiesOfRole(R role) {
        return participants().stream()
                .filter(p -> p.getRole().equals(role))
                .map(Participant::getIdentity)
                .toList();
    }

    public long countAlive(Predicate<Participant<R>> filter) {
        return aliveMatching(filter).size();
    }

    @Override
    public String toString() {
        return participants().stream().map(Participant::toString).collect(Collectors.joining(", ", "[", "]"));
    }
}
