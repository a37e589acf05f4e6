package com.example.werewolfgame.duel;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.example.werewolfgame.game.message.GameMessage;
import com.example.werewolfgame.game.message.MessageKind;
import com.example.werewolfgame.game.transport.RoutingParticipantHandler;
import com.example.werewolfgame.global.config.GameProperties;
import com.example.werewolfgame.support.ScriptedTable;
import com.example.werewolfgame.support.TestGameProperties;

class DuelEngineTest {

    private ScriptedTable table;
    private final Map<String, String> sides = new ConcurrentHashMap<>();

    @AfterEach
    void tearDown() {
        table.close();
    }

    /**
     * "step" 만 합법, 먼저 3번 전진한 쪽이 승리
     */
    static class RaceToThree implements MoveRules {

        private final Map<Side, Integer> steps = new EnumMap<>(Map.of(Side.WHITE, 0, Side.BLACK, 0));
        private final List<String> applied = new CopyOnWriteArrayList<>();

        @Override
        public String describe(Side toMove) {
            return "You are " + toMove.getWireName() + ". score: " + steps + ". Possible moves: step";
        }

        @Override
        public boolean isLegal(Side side, String move) {
            return move.equals("step");
        }

        @Override
        public void apply(Side side, String move) {
            steps.merge(side, 1, Integer::sum);
            applied.add(side.getWireName());
        }

        @Override
        public boolean isGameOver() {
            return winner().isPresent();
        }

        @Override
        public Optional<Side> winner() {
            return steps.entrySet().stream()
                    .filter(entry -> entry.getValue() >= 3)
                    .map(Map.Entry::getKey)
                    .findFirst();
        }
    }

    private DuelEngine duelEngine(GameProperties properties) {
        table = new ScriptedTable(properties, new Random(3));
        return new DuelEngine(table.getLobbyService(), table.getFanoutService(), table.getMessages(),
                new MoveReplyParser(), properties, new Random(3));
    }

    private CompletableFuture<Optional<String>> join(String identity, String reply) {
        return join(identity, side -> reply);
    }

    /**
     * 배정된 진영에 따라 응답을 정한다.
     */
    private CompletableFuture<Optional<String>> join(String identity, Function<String, String> replyForSide) {
        return table.getLobbyService().submit(identity, side -> {
            sides.put(side, identity);
            String reply = replyForSide.apply(side);
            table.getTransport().register(identity, new RoutingParticipantHandler(identity, message -> reply));
        });
    }

    @Test
    @DisplayName("불법 수는 건너뛰고 규칙 엔진이 알려준 승자의 이름을 돌려준다")
    void play_skipsIllegalMovesAndReportsWinner() throws Exception {
        // given
        DuelEngine engine = duelEngine(TestGameProperties.defaults());
        RaceToThree rules = new RaceToThree();
        CompletableFuture<DuelResult> duel = CompletableFuture.supplyAsync(() -> engine.play(rules));

        // 백은 합법 수, 흑은 불법 수만 둔다
        Function<String, String> bySide = side -> side.equals("white")
                ? "thinking: keep going\nmove: step"
                : "thinking: try something\nmove: jump";
        join("alice", bySide).join();
        join("bob", bySide).join();

        // when
        DuelResult result = duel.get(10, TimeUnit.SECONDS);

        // then
        assertThat(result.outcome()).isEqualTo(DuelResult.DuelOutcome.WIN);
        assertThat(result.winner()).isEqualTo(sides.get("white"));
        assertThat(result.turns()).isEqualTo(5);
        assertThat(rules.applied).containsExactly("white", "white", "white");
    }

    @Test
    @DisplayName("최대 수에 도달하면 승자 없이 끝난다")
    void play_turnCap() throws Exception {
        // given
        DuelEngine engine = duelEngine(TestGameProperties.defaults());
        CompletableFuture<DuelResult> duel = CompletableFuture.supplyAsync(() -> engine.play(new RaceToThree()));
        join("alice", "move: jump").join();
        join("bob", "no idea").join();

        // when
        DuelResult result = duel.get(10, TimeUnit.SECONDS);

        // then
        assertThat(result.outcome()).isEqualTo(DuelResult.DuelOutcome.NO_WINNER);
        assertThat(result.turns()).isEqualTo(TestGameProperties.defaults().maxDuelTurns());
        assertThat(result.winner()).isNull();
    }

    @Test
    @DisplayName("상대가 오지 않으면 대국을 시작하지 않는다")
    void play_abortsWithoutOpponent() throws Exception {
        // given
        DuelEngine engine = duelEngine(TestGameProperties.of(TestGameProperties.standardSlots(), 10,
                Duration.ofMillis(200)));
        List<GameMessage> heard = new CopyOnWriteArrayList<>();
        RoutingParticipantHandler lonely = new RoutingParticipantHandler("alice", message -> "");
        lonely.on(MessageKind.SYSTEM_NOTICE, message -> {
            heard.add(message);
            return "";
        });
        CompletableFuture<DuelResult> duel = CompletableFuture.supplyAsync(() -> engine.play(new RaceToThree()));
        table.getLobbyService().submit("alice", side -> table.getTransport().register("alice", lonely)).join();

        // when
        DuelResult result = duel.get(10, TimeUnit.SECONDS);

        // then
        assertThat(result.outcome()).isEqualTo(DuelResult.DuelOutcome.ABORTED);
        assertThat(heard).extracting(GameMessage::content).containsExactly("Registration timeout, game cannot start");
    }
}
