package com.example.werewolfgame.game.message;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonAlias;

/**
 * 사회자와 참가자가 주고받는 메시지 { kind, source, content }
 */
public record GameMessage(
        @JsonAlias("type") MessageKind kind,
        String source,
        String content) {

    public GameMessage {
        Objects.requireNonNull(kind, "kind");
        content = content == null ? "" : content;
    }

    public static GameMessage of(MessageKind kind, String source, String content) {
        return new GameMessage(kind, source, content);
    }

    public static GameMessage response(String source, String content) {
        return new GameMessage(MessageKind.RESPONSE, source, content);
    }
}
