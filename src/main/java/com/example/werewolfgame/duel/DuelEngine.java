package com.example.werewolfgame.duel;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.atomic.AtomicBoolean;

import org.springframework.stereotype.Service;

import com.example.werewolfgame.game.domain.Participant;
import com.example.werewolfgame.game.domain.Roster;
import com.example.werewolfgame.game.service.LobbyService;
import com.example.werewolfgame.game.service.ModeratorMessages;
import com.example.werewolfgame.game.service.RoleFanoutService;
import com.example.werewolfgame.game.transport.Reply;
import com.example.werewolfgame.global.config.GameProperties;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 2인 대국 진행
 * - 백/흑 슬롯 각 1개, 백부터 번갈아 수를 요청
 * - 불법 수/해석 불가 응답은 기록만 하고 차례를 넘긴다
 * - 규칙 엔진이 종료를 알리거나 최대 수에 도달하면 끝
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DuelEngine {

    private final LobbyService lobbyService;
    private final RoleFanoutService fanoutService;
    private final ModeratorMessages messages;
    private final MoveReplyParser replyParser;
    private final GameProperties properties;
    private final Random random;

    private final AtomicBoolean started = new AtomicBoolean(false);

    public DuelResult play(MoveRules rules) {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("이미 진행 중이거나 종료된 대국입니다: " + properties.sessionId());
        }

        Map<Side, Integer> slots = new LinkedHashMap<>();
        slots.put(Side.WHITE, 1);
        slots.put(Side.BLACK, 1);
        Roster<Side> roster = new Roster<>(slots, random);

        boolean full = lobbyService.awaitRegistrations(roster,
                properties.registrationTimeout(), properties.registrationPollInterval());
        if (!full) {
            fanoutService.broadcast(roster, messages.duelNotice("Registration timeout, game cannot start"));
            return new DuelResult(DuelResult.DuelOutcome.ABORTED, null, 0);
        }

        log.info("[대국] 시작: {}", roster);
        fanoutService.broadcast(roster, messages.duelNotice("Game started, white player your move."));

        Side toMove = Side.WHITE;
        int turns = 0;
        while (turns < properties.maxDuelTurns() && !rules.isGameOver()) {
            turns++;
            takeTurn(roster, rules, toMove, turns);
            toMove = toMove.opposite();
        }

        DuelResult result = conclude(roster, rules, turns);
        fanoutService.broadcast(roster, messages.duelNotice(resultNotice(result)));
        log.info("[대국] 종료: {}", result);
        return result;
    }

    private void takeTurn(Roster<Side> roster, MoveRules rules, Side side, int turn) {
        Optional<Reply> reply = fanoutService
                .fanoutToRole(roster, messages.moveRequest(rules.describe(side)), side)
                .stream()
                .findFirst();
        if (reply.isEmpty()) {
            log.warn("[대국] {}수 {} 응답 없음, 차례 넘김", turn, side.getWireName());
            return;
        }

        Optional<MoveReplyParser.ParsedMove> parsed = replyParser.parse(reply.get().content());
        if (parsed.isEmpty()) {
            log.warn("[대국] {}수 {} 응답 형식 오류: {}", turn, side.getWireName(), reply.get().content());
            return;
        }

        String move = parsed.get().move();
        if (!rules.isLegal(side, move)) {
            log.warn("[대국] {}수 {} 불법 수 무시: move={}", turn, side.getWireName(), move);
            return;
        }
        rules.apply(side, move);
        log.info("[대국] {}수 {}: move={}, thinking={}", turn, side.getWireName(), move, parsed.get().thinking());
    }

    private DuelResult conclude(Roster<Side> roster, MoveRules rules, int turns) {
        if (!rules.isGameOver()) {
            return new DuelResult(DuelResult.DuelOutcome.NO_WINNER, null, turns);
        }
        return rules.winner()
                .flatMap(side -> roster.aliveOfRole(side).stream().findFirst())
                .map(Participant::getIdentity)
                .map(identity -> new DuelResult(DuelResult.DuelOutcome.WIN, identity, turns))
                .orElseGet(() -> new DuelResult(DuelResult.DuelOutcome.DRAW, null, turns));
    }

    private String resultNotice(DuelResult result) {
        return switch (result.outcome()) {
            case WIN -> "Game over: " + result.winner() + " wins";
            case DRAW -> "Game over: draw";
            case NO_WINNER -> "Game over, no winner after " + result.turns() + " moves";
            case ABORTED -> "Registration timeout, game cannot start";
        };
    }
}
