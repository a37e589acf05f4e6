package com.example.werewolfgame.game.transport;

import org.springframework.stereotype.Component;

import com.example.werewolfgame.game.message.GameMessage;
import com.example.werewolfgame.game.message.MessageKind;
import com.example.werewolfgame.global.config.GameProperties;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 참가자 한 명에게 요청 1회 전송
 * 어떤 실패도 예외로 던지지 않고 DeliveryResult.failed 로 돌려준다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class Messenger {

    private final ParticipantTransport transport;
    private final GameProperties properties;

    public DeliveryResult send(GameMessage request, String recipient) {
        try {
            GameMessage response = transport.send(request, recipient, properties.moderatorId());
            if (response == null) {
                return fail(request, recipient, "빈 응답");
            }
            if (response.kind() != MessageKind.RESPONSE) {
                return fail(request, recipient, "잘못된 응답 kind=" + response.kind());
            }
            return DeliveryResult.delivered(recipient, response);
        } catch (Exception e) {
            return fail(request, recipient, e.getMessage());
        }
    }

    private DeliveryResult fail(GameMessage request, String recipient, String reason) {
        log.warn("[전송] 실패 (이번 라운드 집계에서 제외): recipient={}, kind={}, reason={}",
                recipient, request.kind(), reason);
        return DeliveryResult.failed(recipient, reason);
    }
}
