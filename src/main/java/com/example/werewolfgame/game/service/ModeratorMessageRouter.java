package com.example.werewolfgame.game.service;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

import com.example.werewolfgame.game.dto.request.InboundMessageRequest;
import com.example.werewolfgame.game.message.GameMessage;
import com.example.werewolfgame.game.message.MessageKind;
import com.example.werewolfgame.game.transport.HttpParticipantHandler;
import com.example.werewolfgame.game.transport.ParticipantTransport;
import com.example.werewolfgame.global.auth.SessionAuthVerifier;
import com.example.werewolfgame.global.config.GameProperties;
import com.example.werewolfgame.global.error.ErrorCode;

import lombok.extern.slf4j.Slf4j;

/**
 * 사회자가 받는 메시지 분기 (kind -> 처리 함수)
 * 현재 처리하는 kind 는 register 뿐이며 나머지는 빈 응답.
 */
@Slf4j
@Service
public class ModeratorMessageRouter {

    private final Map<MessageKind, Function<InboundMessageRequest, GameMessage>> handlers =
            new EnumMap<>(MessageKind.class);

    private final LobbyService lobbyService;
    private final ParticipantTransport transport;
    private final SessionAuthVerifier authVerifier;
    private final RestClient restClient;
    private final GameProperties properties;

    public ModeratorMessageRouter(LobbyService lobbyService,
                                  ParticipantTransport transport,
                                  SessionAuthVerifier authVerifier,
                                  RestClient participantRestClient,
                                  GameProperties properties) {
        this.lobbyService = lobbyService;
        this.transport = transport;
        this.authVerifier = authVerifier;
        this.restClient = participantRestClient;
        this.properties = properties;
        handlers.put(MessageKind.REGISTER, this::register);
    }

    public GameMessage route(InboundMessageRequest request) {
        Function<InboundMessageRequest, GameMessage> handler = handlers.get(request.kind());
        if (handler == null) {
            log.debug("[메시지] 처리하지 않는 kind: kind={}, source={}", request.kind(), request.source());
            return GameMessage.response(properties.moderatorId(), "");
        }
        return handler.apply(request);
    }

    private GameMessage register(InboundMessageRequest request) {
        String identity = request.source().trim();
        authVerifier.verifyAuth(properties.sessionId(), identity, request.timestamp(), request.signature());
        if (request.callbackUrl() == null || request.callbackUrl().isBlank()) {
            throw ErrorCode.INVALID_CALLBACK.commonException();
        }

        String callbackUrl = request.callbackUrl().trim();
        CompletableFuture<Optional<String>> role = lobbyService.submit(identity,
                assignedRole -> transport.register(identity, new HttpParticipantHandler(restClient, callbackUrl)));

        String assigned = await(role, properties.registrationTimeout()).orElse("");
        log.info("[로비] 참가 신청 처리: identity={}, role={}", identity, assigned.isEmpty() ? "(거절)" : assigned);
        return GameMessage.response(properties.moderatorId(), assigned);
    }

    private Optional<String> await(CompletableFuture<Optional<String>> future, Duration timeout) {
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw ErrorCode.REGISTRATION_TIMEOUT.commonException();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ErrorCode.REGISTRATION_TIMEOUT.commonException();
        } catch (ExecutionException e) {
            throw new IllegalStateException("참가 등록 처리 실패: " + e.getCause().getMessage(), e.getCause());
        }
    }
}
