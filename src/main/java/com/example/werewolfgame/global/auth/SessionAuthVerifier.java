package com.example.werewolfgame.global.auth;

import java.time.Clock;

import com.example.werewolfgame.global.error.ErrorCode;

import lombok.extern.slf4j.Slf4j;

/**
 * 참가 신청 인증
 * - 필수 값 누락, 타임스탬프 형식, 만료(300초), 세션 권한, 서명 순서로 검사
 * - ChainAuthClient 가 없으면 검사하지 않는다
 */
@Slf4j
public class SessionAuthVerifier {

    private static final long EXPIRY_SECONDS = 300;

    private final ChainAuthClient chainAuthClient;
    private final Clock clock;

    public SessionAuthVerifier(ChainAuthClient chainAuthClient, Clock clock) {
        this.chainAuthClient = chainAuthClient;
        this.clock = clock;
    }

    public boolean isEnabled() {
        return chainAuthClient != null;
    }

    public void verifyAuth(String sessionId, String agentId, String timestamp, String signature) {
        if (!isEnabled()) {
            log.debug("[인증] 인증 비활성화 상태, 검사 생략: agentId={}", agentId);
            return;
        }
        if (isBlank(sessionId) || isBlank(agentId) || isBlank(timestamp) || isBlank(signature)) {
            throw ErrorCode.UNAUTHORIZED.commonException();
        }

        long issuedAt;
        try {
            issuedAt = Long.parseLong(timestamp.trim());
        } catch (NumberFormatException e) {
            throw ErrorCode.INVALID_TIMESTAMP.commonException();
        }

        long now = clock.instant().getEpochSecond();
        if (now - issuedAt > EXPIRY_SECONDS) {
            log.info("[인증] 만료된 요청: agentId={}, issuedAt={}, now={}", agentId, issuedAt, now);
            throw ErrorCode.TOKEN_EXPIRED.commonException();
        }

        if (!chainAuthClient.hasAuth(sessionId, agentId)) {
            log.info("[인증] 세션 권한 없음: sessionId={}, agentId={}", sessionId, agentId);
            throw ErrorCode.NOT_AUTHORIZED.commonException();
        }

        String address = chainAuthClient.getAgentAddress(agentId);
        if (address == null || !chainAuthClient.isValidSignature(String.valueOf(issuedAt), signature, address)) {
            log.info("[인증] 서명 불일치: agentId={}", agentId);
            throw ErrorCode.INVALID_SIGNATURE.commonException();
        }
        log.info("[인증] 인증 성공: agentId={}", agentId);
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
