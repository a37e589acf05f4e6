package com.example.werewolfgame.game.service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Predicate;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.example.werewolfgame.game.domain.GameRole;
import com.example.werewolfgame.game.domain.Participant;
import com.example.werewolfgame.game.domain.Roster;
import com.example.werewolfgame.game.message.GameMessage;
import com.example.werewolfgame.game.transport.DeliveryResult;
import com.example.werewolfgame.game.transport.Messenger;
import com.example.werewolfgame.game.transport.Reply;
import com.example.werewolfgame.global.config.GameProperties;

import lombok.extern.slf4j.Slf4j;

/**
 * 역할 단위 팬아웃
 * - 수신자 스냅샷은 호출 시점에 한 번만 만든다
 * - 병렬 전송이어도 결과는 명단 순서로 조립
 * - 전송 실패는 Messenger 에서 로깅되고 결과에서 빠진다 (부분 응답 허용)
 */
@Slf4j
@Service
public class RoleFanoutService {

    private final Messenger messenger;
    private final Executor executor;
    private final boolean parallel;

    @Autowired
    public RoleFanoutService(Messenger messenger,
                             @Qualifier("fanoutExecutor") Executor executor,
                             GameProperties properties) {
        this(messenger, executor, properties.parallelFanout());
    }

    public RoleFanoutService(Messenger messenger, Executor executor, boolean parallel) {
        this.messenger = messenger;
        this.executor = executor;
        this.parallel = parallel;
    }

    public <R extends GameRole> List<Reply> fanout(Roster<R> roster, GameMessage request,
                                                   Predicate<Participant<R>> filter) {
        List<String> recipients = roster.aliveMatching(filter).stream()
                .map(Participant::getIdentity)
                .toList();
        if (recipients.isEmpty()) {
            return List.of();
        }

        List<DeliveryResult> results = parallel
                ? sendParallel(request, recipients)
                : recipients.stream().map(recipient -> messenger.send(request, recipient)).toList();

        List<Reply> replies = new ArrayList<>();
        for (DeliveryResult result : results) {
            if (result.isDelivered()) {
                replies.add(new Reply(result.recipient(), result.response()));
            }
        }
        log.debug("[전송] 팬아웃 완료: kind={}, 대상={}명, 응답={}명", request.kind(), recipients.size(), replies.size());
        return replies;
    }

    public <R extends GameRole> List<Reply> fanoutToRole(Roster<R> roster, GameMessage request, R role) {
        return fanout(roster, request, p -> p.getRole().equals(role));
    }

    public <R extends GameRole> List<Reply> fanoutToAll(Roster<R> roster, GameMessage request) {
        return fanout(roster, request, p -> true);
    }

    /**
     * 살아있는 전체에게 공지 (응답 무시)
     */
    public <R extends GameRole> void broadcast(Roster<R> roster, GameMessage notice) {
        fanoutToAll(roster, notice);
    }

    private List<DeliveryResult> sendParallel(GameMessage request, List<String> recipients) {
        List<CompletableFuture<DeliveryResult>> futures = recipients.stream()
                .map(recipient -> CompletableFuture.supplyAsync(() -> messenger.send(request, recipient), executor))
                .toList();
        // Messenger 는 예외를 던지지 않으므로 join 은 결과만 기다린다
        return futures.stream().map(CompletableFuture::join).toList();
    }
}
