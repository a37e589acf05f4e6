package com.example.werewolfgame.game.transport;

import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import com.example.werewolfgame.game.message.GameMessage;

import lombok.RequiredArgsConstructor;

/**
 * 원격 참가자의 콜백 URL 로 메시지를 POST 하고 응답 메시지를 받는다.
 * 네트워크 오류/타임아웃은 RestClientException 으로 올라가 전송 실패로 처리됨.
 */
@RequiredArgsConstructor
public class HttpParticipantHandler implements ParticipantHandler {

    private final RestClient restClient;
    private final String callbackUrl;

    @Override
    public GameMessage handle(GameMessage message) {
        return restClient.post()
                .uri(callbackUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .body(message)
                .retrieve()
                .body(GameMessage.class);
    }
}
