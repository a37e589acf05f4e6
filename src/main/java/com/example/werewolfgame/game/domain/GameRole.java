package com.example.werewolfgame.game.domain;

/**
 * Roster 슬롯에 배정되는 역할의 공통 인터페이스
 * - 늑대인간 게임의 PlayerRole, 2인 대국의 Side가 구현
 */
public interface GameRole {

    /**
     * 참가자에게 전달되는 역할 이름 (register 응답, 점술 결과 등)
     */
    String getWireName();
}
