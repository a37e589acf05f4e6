package com.example.werewolfgame.global.error;

import lombok.Builder;

@Builder
public record ErrorResponse(String code, String message) {
}
