package com.example.werewolfgame.game.transport;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

import com.example.werewolfgame.game.message.GameMessage;
import com.example.werewolfgame.game.message.MessageKind;

import lombok.Getter;

/**
 * 참가자 측 메시지 분기 처리기 (kind -> 처리 함수)
 * - system-notice: 기록만 하고 빈 응답
 * - important-info: 보관하고 빈 응답
 * - 그 외 행동 요청: decision 함수의 결과를 응답 내용으로 사용
 */
public class RoutingParticipantHandler implements ParticipantHandler {

    @Getter
    private final String identity;

    private final Map<MessageKind, Function<GameMessage, String>> routes = new EnumMap<>(MessageKind.class);

    @Getter
    private final List<GameMessage> notices = new CopyOnWriteArrayList<>();

    @Getter
    private volatile String importantInfo;

    public RoutingParticipantHandler(String identity, Function<GameMessage, String> decision) {
        this.identity = identity;
        routes.put(MessageKind.SYSTEM_NOTICE, message -> {
            notices.add(message);
            return "";
        });
        routes.put(MessageKind.IMPORTANT_INFO, message -> {
            importantInfo = message.content();
            return "";
        });
        for (MessageKind kind : List.of(MessageKind.NIGHT_KILL, MessageKind.DIVINE, MessageKind.SAVE,
                MessageKind.POISON, MessageKind.DAY_DISCUSS, MessageKind.DAY_VOTE, MessageKind.MOVE)) {
            routes.put(kind, decision);
        }
    }

    /**
     * 특정 kind 의 처리 함수를 교체한다.
     */
    public RoutingParticipantHandler on(MessageKind kind, Function<GameMessage, String> route) {
        routes.put(kind, route);
        return this;
    }

    @Override
    public GameMessage handle(GameMessage message) {
        Function<GameMessage, String> route = routes.getOrDefault(message.kind(), ignored -> "");
        return GameMessage.response(identity, route.apply(message));
    }
}
