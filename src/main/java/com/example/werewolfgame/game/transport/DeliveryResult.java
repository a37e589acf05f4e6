package com.example.werewolfgame.game.transport;

import com.example.werewolfgame.game.message.GameMessage;

/**
 * send 1회의 결과 (응답 또는 전달 실패)
 */
public record DeliveryResult(String recipient, GameMessage response, String failureReason) {

    public static DeliveryResult delivered(String recipient, GameMessage response) {
        return new DeliveryResult(recipient, response, null);
    }

    public static DeliveryResult failed(String recipient, String reason) {
        return new DeliveryResult(recipient, null, reason);
    }

    public boolean isDelivered() {
        return response != null;
    }
}
