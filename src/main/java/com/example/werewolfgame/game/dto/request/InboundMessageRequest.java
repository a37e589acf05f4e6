package com.example.werewolfgame.game.dto.request;

import com.example.werewolfgame.game.message.MessageKind;
import com.fasterxml.jackson.annotation.JsonAlias;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * 참가자 -> 사회자 메시지
 * register 는 callbackUrl 과 (인증 사용 시) timestamp, signature 를 함께 보낸다.
 */
public record InboundMessageRequest(
        @NotNull @JsonAlias("type") MessageKind kind,
        @NotBlank String source,
        String content,
        String callbackUrl,
        String timestamp,
        String signature) {
}
