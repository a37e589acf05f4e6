package com.example.werewolfgame.duel;

import java.util.Locale;
import java.util.Optional;

import org.springframework.stereotype.Component;

/**
 * "thinking: ... move: ..." 형식 응답 파서
 * move 항목이 없거나 비어 있으면 empty. thinking 은 생략 가능.
 */
@Component
public class MoveReplyParser {

    private static final String THINKING = "thinking:";
    private static final String MOVE = "move:";

    public Optional<ParsedMove> parse(String content) {
        if (content == null) {
            return Optional.empty();
        }
        String lower = content.toLowerCase(Locale.ROOT);
        int moveIndex = lower.lastIndexOf(MOVE);
        if (moveIndex < 0) {
            return Optional.empty();
        }

        String move = firstLine(content.substring(moveIndex + MOVE.length()));
        if (move.isEmpty()) {
            return Optional.empty();
        }

        int thinkingIndex = lower.indexOf(THINKING);
        String thinking = thinkingIndex >= 0 && thinkingIndex < moveIndex
                ? content.substring(thinkingIndex + THINKING.length(), moveIndex).trim()
                : "";
        return Optional.of(new ParsedMove(thinking, move));
    }

    private String firstLine(String text) {
        String trimmed = text.trim();
        int newline = trimmed.indexOf('\n');
        return (newline < 0 ? trimmed : trimmed.substring(0, newline)).trim();
    }

    public record ParsedMove(String thinking, String move) {
    }
}
