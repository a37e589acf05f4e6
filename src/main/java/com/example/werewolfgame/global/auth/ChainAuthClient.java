package com.example.werewolfgame.global.auth;

/**
 * 체인 기반 권한 조회 / 서명 검증 클라이언트
 * 구현은 외부에서 빈으로 제공한다 (코어는 암호 연산을 하지 않음).
 */
public interface ChainAuthClient {

    /**
     * 에이전트가 세션(태스크)에 참가할 권한이 있는지
     */
    boolean hasAuth(String sessionId, String agentId);

    /**
     * 에이전트 식별자에 등록된 서명 주소
     */
    String getAgentAddress(String agentId);

    /**
     * message 에 대한 signature 의 서명자가 address 인지
     */
    boolean isValidSignature(String message, String signature, String address);
}
