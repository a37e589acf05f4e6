package com.example.werewolfgame.game.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.example.werewolfgame.game.domain.GameSession;
import com.example.werewolfgame.game.domain.NightResult;
import com.example.werewolfgame.game.domain.PlayerRole;
import com.example.werewolfgame.game.domain.Roster;
import com.example.werewolfgame.game.message.GameMessage;
import com.example.werewolfgame.game.message.MessageKind;
import com.example.werewolfgame.game.transport.RoutingParticipantHandler;
import com.example.werewolfgame.support.FixedSlotRandom;
import com.example.werewolfgame.support.ScriptedTable;
import com.example.werewolfgame.support.TestGameProperties;

class NightActionServiceTest {

    private ScriptedTable table;
    private Roster<PlayerRole> roster;
    private GameSession session;

    private final Map<String, RoutingParticipantHandler> handlers = new ConcurrentHashMap<>();
    private final Map<String, List<MessageKind>> asked = new ConcurrentHashMap<>();

    @BeforeEach
    void setUp() {
        table = new ScriptedTable(TestGameProperties.defaults(), new Random(5));
        roster = new Roster<>(TestGameProperties.standardSlots(), new FixedSlotRandom());
        session = GameSession.builder().sessionId("night-test").roster(roster).build();
    }

    @AfterEach
    void tearDown() {
        table.close();
    }

    /**
     * 등록 순서대로 첫 빈 슬롯 배정: a, c 늑대 / b, d 시민 / e 예언자 / f 마녀
     */
    private void seatAll(String wolfVote, Function<GameMessage, String> witch, String seerCheck) {
        join("a", message -> wolfVote);
        join("c", message -> wolfVote);
        join("b", message -> "");
        join("d", message -> "");
        join("e", message -> seerCheck);
        join("f", witch);
    }

    private void join(String name, Function<GameMessage, String> decision) {
        roster.register(name);
        List<MessageKind> kinds = asked.computeIfAbsent(name, key -> new CopyOnWriteArrayList<>());
        RoutingParticipantHandler handler = new RoutingParticipantHandler(name, message -> {
            kinds.add(message.kind());
            return decision.apply(message);
        });
        handlers.put(name, handler);
        table.getTransport().register(name, handler);
    }

    private List<String> notices(String name) {
        return handlers.get(name).getNotices().stream().map(GameMessage::content).toList();
    }

    @Test
    @DisplayName("늑대 두 명이 b 를 지목하고 마녀가 모두 거절하면 b 만 제거된다")
    void runNight_wolfKillOnly() {
        // given
        seatAll("b", message -> "no", "");

        // when
        NightResult result = table.getNightActionService().runNight(session);
        List<String> eliminated = table.getNightActionService().applyEliminations(roster, result);

        // then
        assertThat(result.kill()).contains("b");
        assertThat(result.poison()).isEmpty();
        assertThat(eliminated).containsExactly("b");
        assertThat(session.getAbilities().isHealAvailable()).isTrue();
        assertThat(session.getAbilities().isPoisonAvailable()).isTrue();
        assertThat(asked.get("f")).containsExactly(MessageKind.SAVE, MessageKind.POISON);
        assertThat(table.getWinEvaluator().evaluate(roster)).isEmpty();
    }

    @Test
    @DisplayName("늑대에게 집계된 제거 대상을 알린다")
    void runNight_wolvesHearTarget() {
        seatAll("b", message -> "no", "");

        table.getNightActionService().runNight(session);

        assertThat(notices("a")).contains("The player with the most votes is: b");
        assertThat(notices("c")).contains("The player with the most votes is: b");
        assertThat(notices("b")).isEmpty();
    }

    @Test
    @DisplayName("치료약을 쓰면 제거가 취소되고 같은 밤에는 독약을 묻지 않는다")
    void runNight_healSkipsPoison() {
        // given
        seatAll("b", message -> message.kind() == MessageKind.SAVE ? "Yes" : "d", "");

        // when
        NightResult result = table.getNightActionService().runNight(session);
        List<String> eliminated = table.getNightActionService().applyEliminations(roster, result);

        // then
        assertThat(result.kill()).isEmpty();
        assertThat(result.poison()).isEmpty();
        assertThat(eliminated).isEmpty();
        assertThat(session.getAbilities().isHealAvailable()).isFalse();
        assertThat(session.getAbilities().isPoisonAvailable()).isTrue();
        assertThat(asked.get("f")).containsExactly(MessageKind.SAVE);
    }

    @Test
    @DisplayName("치료약을 이미 쓴 뒤에는 독약을 묻고 늑대 제거와 함께 적용한다")
    void runNight_poisonAfterHealUsed() {
        // given
        session.getAbilities().useHeal();
        seatAll("b", message -> "d", "");

        // when
        NightResult result = table.getNightActionService().runNight(session);
        List<String> eliminated = table.getNightActionService().applyEliminations(roster, result);

        // then
        assertThat(asked.get("f")).containsExactly(MessageKind.POISON);
        assertThat(result.kill()).contains("b");
        assertThat(result.poison()).contains("d");
        assertThat(eliminated).containsExactly("b", "d");
        assertThat(session.getAbilities().isPoisonAvailable()).isFalse();
    }

    @Test
    @DisplayName("예언자 조사 결과는 예언자에게만 전달된다")
    void runNight_seerRevealOnlyToSeer() {
        // given
        seatAll("b", message -> "no", "I want to check a");

        // when
        NightResult result = table.getNightActionService().runNight(session);

        // then
        assertThat(result.seerCheck()).contains(new NightResult.Investigation("a", PlayerRole.WOLF));
        assertThat(notices("e")).contains("The role of a is wolf");
        for (String other : List.of("a", "b", "c", "d", "f")) {
            assertThat(notices(other)).noneMatch(notice -> notice.startsWith("The role of"));
        }
    }

    @Test
    @DisplayName("늑대 응답이 해석되지 않으면 제거 후보가 없다")
    void runNight_noKillWhenUnresolved() {
        seatAll("", message -> "no", "");

        NightResult result = table.getNightActionService().runNight(session);

        assertThat(result.kill()).isEmpty();
        assertThat(table.getNightActionService().applyEliminations(roster, result)).isEmpty();
    }

    @Test
    @DisplayName("늑대 한 명이 응답하지 못해도 남은 늑대의 표로 제거 대상이 정해진다")
    void runNight_partialWolfQuorum() {
        // given: a 는 b 를 지목, c 는 연결 끊김
        join("a", message -> "b");
        join("c", message -> "d");
        join("b", message -> "");
        join("d", message -> "");
        join("e", message -> "");
        join("f", message -> "no");
        table.getTransport().unregister("c");

        // when
        NightResult result = table.getNightActionService().runNight(session);

        // then
        assertThat(result.kill()).contains("b");
        assertThat(asked.get("c")).isEmpty();
        assertThat(table.getNightActionService().applyEliminations(roster, result)).containsExactly("b");
    }

    @Test
    @DisplayName("시민을 조사하면 village 로 알려준다")
    void runNight_seerSeesVillage() {
        seatAll("", message -> "no", "b");

        NightResult result = table.getNightActionService().runNight(session);

        assertThat(result.seerCheck()).contains(new NightResult.Investigation("b", PlayerRole.VILLAGER));
        assertThat(notices("e")).contains("The role of b is village");
    }
}
