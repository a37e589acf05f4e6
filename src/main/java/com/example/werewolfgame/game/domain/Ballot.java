package com.example.werewolfgame.game.domain;

/**
 * 투표 한 건 (투표자 식별자, 지목 대상 원문 또는 정식 식별자)
 */
public record Ballot(String voter, String target) {
}
