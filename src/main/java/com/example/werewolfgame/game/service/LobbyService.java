package com.example.werewolfgame.game.service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import org.springframework.stereotype.Service;

import com.example.werewolfgame.game.domain.GameRole;
import com.example.werewolfgame.game.domain.Roster;

import lombok.extern.slf4j.Slf4j;

/**
 * 로비 (참가 신청 대기열)
 * <p>
 * HTTP 스레드는 신청을 큐에 넣고 결과 future 를 기다린다.
 * 명단 변경은 게임 엔진 스레드가 awaitRegistrations 안에서만 수행한다.
 * 로비가 닫힌 뒤 들어온 신청은 즉시 거절(empty).
 */
@Slf4j
@Service
public class LobbyService {

    private final BlockingQueue<PendingRegistration> queue = new LinkedBlockingQueue<>();
    private volatile boolean closed;

    /**
     * 참가 신청
     *
     * @param onAccepted 슬롯이 배정된 직후 엔진 스레드에서 배정 역할의 wire 이름으로 호출 (전송 핸들러 등록 등)
     * @return 배정된 역할의 wire 이름, 거절이면 empty
     */
    public synchronized CompletableFuture<Optional<String>> submit(String identity, Consumer<String> onAccepted) {
        CompletableFuture<Optional<String>> result = new CompletableFuture<>();
        if (closed) {
            log.info("[로비] 마감 후 참가 신청 거절: identity={}", identity);
            result.complete(Optional.empty());
            return result;
        }
        queue.add(new PendingRegistration(identity, onAccepted, result));
        return result;
    }

    /**
     * 모든 슬롯이 찰 때까지 또는 제한 시간까지 신청을 처리한다.
     *
     * @return 명단이 가득 찼으면 true, 시간 초과/중단이면 false
     */
    public <R extends GameRole> boolean awaitRegistrations(Roster<R> roster, Duration timeout, Duration pollInterval) {
        long deadline = System.nanoTime() + timeout.toNanos();
        long lastReport = System.nanoTime();
        try {
            while (!roster.isFull()) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    log.warn("[로비] 등록 시간 초과: 남은 슬롯={}", roster.openSlotCount());
                    return false;
                }

                PendingRegistration pending = queue.poll(Math.min(remaining, pollInterval.toNanos()), TimeUnit.NANOSECONDS);
                if (pending != null) {
                    apply(roster, pending);
                }
                if (System.nanoTime() - lastReport >= pollInterval.toNanos() && !roster.isFull()) {
                    log.info("[로비] {}명 더 등록 대기 중...", roster.openSlotCount());
                    lastReport = System.nanoTime();
                }
            }
            log.info("[로비] 전원 등록 완료: {}", roster);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[로비] 등록 대기 중단");
            return false;
        } finally {
            close();
        }
    }

    private <R extends GameRole> void apply(Roster<R> roster, PendingRegistration pending) {
        Optional<String> role = roster.register(pending.identity()).map(GameRole::getWireName);
        if (role.isPresent()) {
            pending.onAccepted().accept(role.get());
            log.info("[로비] 참가 등록: identity={}, 남은 슬롯={}", pending.identity(), roster.openSlotCount());
        } else {
            log.info("[로비] 참가 거절 (중복 또는 정원 초과): identity={}", pending.identity());
        }
        pending.result().complete(role);
    }

    private synchronized void close() {
        closed = true;
        List<PendingRegistration> leftovers = new ArrayList<>();
        queue.drainTo(leftovers);
        leftovers.forEach(pending -> pending.result().complete(Optional.empty()));
    }

    public boolean isClosed() {
        return closed;
    }

    private record PendingRegistration(String identity, Consumer<String> onAccepted,
                                       CompletableFuture<Optional<String>> result) {
    }
}
