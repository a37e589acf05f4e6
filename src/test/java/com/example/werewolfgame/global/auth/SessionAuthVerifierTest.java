package com.example.werewolfgame.global.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.example.werewolfgame.global.error.CommonException;
import com.example.werewolfgame.global.error.ErrorCode;

@ExtendWith(MockitoExtension.class)
class SessionAuthVerifierTest {

    private static final long NOW = 1_700_000_000L;

    @Mock
    private ChainAuthClient chainAuthClient;

    private SessionAuthVerifier verifier;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC);
        verifier = new SessionAuthVerifier(chainAuthClient, clock);
    }

    @Test
    @DisplayName("권한과 서명이 모두 유효하면 통과한다")
    void verifyAuth_success() {
        // given
        when(chainAuthClient.hasAuth("session", "alice")).thenReturn(true);
        when(chainAuthClient.getAgentAddress("alice")).thenReturn("0xabc");
        when(chainAuthClient.isValidSignature(String.valueOf(NOW - 10), "sig", "0xabc")).thenReturn(true);

        // when & then
        assertThatCode(() -> verifier.verifyAuth("session", "alice", String.valueOf(NOW - 10), "sig"))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("필수 값이 빠지면 UNAUTHORIZED")
    void verifyAuth_missingField() {
        assertThatThrownBy(() -> verifier.verifyAuth("session", "alice", null, "sig"))
                .isInstanceOfSatisfying(CommonException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.UNAUTHORIZED));
        verifyNoInteractions(chainAuthClient);
    }

    @Test
    @DisplayName("타임스탬프가 숫자가 아니면 INVALID_TIMESTAMP")
    void verifyAuth_invalidTimestamp() {
        assertThatThrownBy(() -> verifier.verifyAuth("session", "alice", "yesterday", "sig"))
                .isInstanceOf(CommonException.class)
                .hasMessage(ErrorCode.INVALID_TIMESTAMP.getMessage());
    }

    @Test
    @DisplayName("300초보다 오래된 요청은 TOKEN_EXPIRED")
    void verifyAuth_expired() {
        assertThatThrownBy(() -> verifier.verifyAuth("session", "alice", String.valueOf(NOW - 301), "sig"))
                .isInstanceOf(CommonException.class)
                .hasMessage(ErrorCode.TOKEN_EXPIRED.getMessage());
        verifyNoInteractions(chainAuthClient);
    }

    @Test
    @DisplayName("세션 권한이 없으면 서명을 확인하지 않고 NOT_AUTHORIZED")
    void verifyAuth_notAuthorized() {
        when(chainAuthClient.hasAuth("session", "alice")).thenReturn(false);

        assertThatThrownBy(() -> verifier.verifyAuth("session", "alice", String.valueOf(NOW), "sig"))
                .isInstanceOf(CommonException.class)
                .hasMessage(ErrorCode.NOT_AUTHORIZED.getMessage());
        verify(chainAuthClient, never()).isValidSignature(any(), any(), any());
    }

    @Test
    @DisplayName("서명자가 에이전트 주소와 다르면 INVALID_SIGNATURE")
    void verifyAuth_invalidSignature() {
        when(chainAuthClient.hasAuth("session", "alice")).thenReturn(true);
        when(chainAuthClient.getAgentAddress("alice")).thenReturn("0xabc");
        when(chainAuthClient.isValidSignature(String.valueOf(NOW), "forged", "0xabc")).thenReturn(false);

        assertThatThrownBy(() -> verifier.verifyAuth("session", "alice", String.valueOf(NOW), "forged"))
                .isInstanceOf(CommonException.class)
                .hasMessage(ErrorCode.INVALID_SIGNATURE.getMessage());
    }

    @Test
    @DisplayName("체인 클라이언트가 없으면 검사하지 않는다")
    void verifyAuth_disabled() {
        SessionAuthVerifier disabled = new SessionAuthVerifier(null, Clock.systemUTC());

        assertThatCode(() -> disabled.verifyAuth("session", "alice", null, null)).doesNotThrowAnyException();
    }
}
