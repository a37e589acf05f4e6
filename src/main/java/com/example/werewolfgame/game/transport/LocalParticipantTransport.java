package com.example.werewolfgame.game.transport;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import com.example.werewolfgame.game.message.GameMessage;
import com.example.werewolfgame.global.config.GameProperties;

import lombok.extern.slf4j.Slf4j;

/**
 * 식별자 -> 핸들러 레지스트리 기반 전송
 * - 핸들러는 transportExecutor 에서 실행되고 sendTimeout 을 넘기면 DeliveryException
 * - 원격 참가자는 HttpParticipantHandler 로 등록된다
 */
@Slf4j
@Component
public class LocalParticipantTransport implements ParticipantTransport {

    // 참가자별 핸들러 (소문자 식별자 -> 핸들러)
    private final Map<String, ParticipantHandler> handlers = new ConcurrentHashMap<>();

    private final Executor executor;
    private final Duration sendTimeout;

    @Autowired
    public LocalParticipantTransport(@Qualifier("transportExecutor") Executor executor, GameProperties properties) {
        this(executor, properties.sendTimeout());
    }

    public LocalParticipantTransport(Executor executor, Duration sendTimeout) {
        this.executor = executor;
        this.sendTimeout = sendTimeout;
    }

    @Override
    public void register(String identity, ParticipantHandler handler) {
        handlers.put(key(identity), handler);
        log.info("[전송] 참가자 핸들러 등록: identity={}", identity);
    }

    @Override
    public void unregister(String identity) {
        if (handlers.remove(key(identity)) != null) {
            log.info("[전송] 참가자 핸들러 해제: identity={}", identity);
        }
    }

    @Override
    public GameMessage send(GameMessage message, String recipient, String sender) {
        ParticipantHandler handler = handlers.get(key(recipient));
        if (handler == null) {
            throw new DeliveryException("등록되지 않은 참가자: " + recipient);
        }

        log.debug("[전송] {} -> {}: kind={}", sender, recipient, message.kind());
        // 시간 초과 시 cancel(true) 로 핸들러 스레드를 인터럽트 (HTTP 소켓 읽기는 RestClient 읽기 타임아웃으로 끊긴다)
        FutureTask<GameMessage> task = new FutureTask<>(() -> handler.handle(message));
        executor.execute(task);
        try {
            return task.get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            task.cancel(true);
            throw new DeliveryException("응답 시간 초과: " + recipient + " (" + sendTimeout.toMillis() + "ms)", e);
        } catch (ExecutionException e) {
            throw new DeliveryException("참가자 처리 오류: " + recipient, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeliveryException("전송 중단: " + recipient, e);
        }
    }

    private String key(String identity) {
        return identity.trim().toLowerCase(Locale.ROOT);
    }
}
