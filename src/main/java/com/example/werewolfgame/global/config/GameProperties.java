package com.example.werewolfgame.global.config;

import java.time.Duration;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import com.example.werewolfgame.game.domain.GameMode;
import com.example.werewolfgame.game.domain.PlayerRole;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

@Validated
@ConfigurationProperties(prefix = "game")
public record GameProperties(
        @NotBlank String sessionId,      // 세션(태스크) ID, 필수
        @NotBlank String moderatorId,    // 사회자 식별자, 필수
        @NotNull @DefaultValue("WEREWOLF") GameMode mode,

        // 역할 -> 슬롯 수 (선언 순서가 명단 순서)
        @NotEmpty Map<PlayerRole, @NotNull @PositiveOrZero Integer> roleSlots,

        // 시간 설정
        @NotNull @DefaultValue("300s") Duration registrationTimeout,     // 로비 대기 제한
        @NotNull @DefaultValue("5s") Duration registrationPollInterval,  // 로비 재확인 주기
        @NotNull @DefaultValue("60s") Duration sendTimeout,              // 참가자 1회 응답 제한

        // 게임 룰 설정
        @Positive @DefaultValue("10") int maxRounds,       // 밤+낮 최대 반복 수
        @Positive @DefaultValue("100") int maxDuelTurns,   // 2인 대국 최대 수

        @DefaultValue("true") boolean parallelFanout,  // 팬아웃 병렬 전송 여부
        Long randomSeed,                               // 지정 시 재현 가능한 난수 (테스트/리플레이용)
        @DefaultValue("true") boolean autoStart,       // 애플리케이션 기동 후 게임 루프 자동 시작
        @DefaultValue("false") boolean authRequired    // 체인 인증 필수 여부
) {
}
