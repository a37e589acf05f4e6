package com.example.werewolfgame.game.message;

import java.util.Arrays;
import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum MessageKind {
    REGISTER("register"), // 참가 등록
    SYSTEM_NOTICE("system-notice"), // 사회자 공지
    RESPONSE("response"), // 참가자 응답
    IMPORTANT_INFO("important-info"), // 비공개 정보 (늑대 동료 공개)

    NIGHT_KILL("night-kill"), // 늑대 살해 투표
    DIVINE("divine"), // 예언자 조사
    SAVE("save"), // 마녀 치료약
    POISON("poison"), // 마녀 독약

    DAY_DISCUSS("day-discuss"), // 낮 토론
    DAY_VOTE("day-vote"), // 낮 투표

    MOVE("move"); // 2인 대국 수 요청

    private final String wireName;

    MessageKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * 와이어 이름을 변환한다. 구버전 참가자가 보내는 밑줄 표기(system_notice)도 허용.
     */
    @JsonCreator
    public static MessageKind fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("message kind is null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        return Arrays.stream(values())
                .filter(kind -> kind.wireName.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("unknown message kind: " + value));
    }
}
