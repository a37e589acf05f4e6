package com.example.werewolfgame.game.transport;

import com.example.werewolfgame.game.message.GameMessage;

/**
 * 메시지 전달 기반 (참가자 등록 + 요청/응답 1회 왕복)
 * 브로드캐스트는 제공하지 않는다. 코어가 send 를 반복해서 구현.
 */
public interface ParticipantTransport {

    void register(String identity, ParticipantHandler handler);

    void unregister(String identity);

    /**
     * @throws DeliveryException 수신자 미등록, 타임아웃, 처리 오류
     */
    GameMessage send(GameMessage message, String recipient, String sender);
}
