package com.example.werewolfgame.game.service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.springframework.stereotype.Component;

/**
 * 자유 텍스트 응답 -> 참가자 정식 식별자
 * 소문자로 맞춘 뒤 식별자가 응답에 포함되어 있으면 매칭. 후보 순서(명단 순서)에서 첫 매칭 우선.
 */
@Component
public class NameResolver {

    public Optional<String> resolve(String content, List<String> candidates) {
        if (content == null || content.isBlank()) {
            return Optional.empty();
        }
        String folded = content.toLowerCase(Locale.ROOT);
        return candidates.stream()
                .filter(candidate -> !candidate.isBlank())
                .filter(candidate -> folded.contains(candidate.toLowerCase(Locale.ROOT)))
                .findFirst();
    }
}
