package com.example.werewolfgame.game.transport;

import com.example.werewolfgame.game.message.GameMessage;

/**
 * 팬아웃으로 받은 응답 (요청을 받은 참가자의 정식 식별자 + 응답 메시지)
 */
public record Reply(String identity, GameMessage message) {

    public String content() {
        return message.content();
    }
}
