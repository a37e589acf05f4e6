package com.example.werewolfgame.game.transport;

import com.example.werewolfgame.game.message.GameMessage;

/**
 * 참가자 한 명의 요청 처리기
 * 사회자가 보낸 메시지 하나에 응답 메시지 하나를 돌려준다.
 */
@FunctionalInterface
public interface ParticipantHandler {

    GameMessage handle(GameMessage message);
}
