package com.example.werewolfgame.global.error;

import org.springframework.http.HttpStatus;

import lombok.Getter;

@Getter
public enum ErrorCode {
    // 인증
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "UNAUTHORIZED", "Missing authentication information"),
    INVALID_TIMESTAMP(HttpStatus.BAD_REQUEST, "INVALID_TIMESTAMP", "Invalid timestamp format"),
    TOKEN_EXPIRED(HttpStatus.UNAUTHORIZED, "TOKEN_EXPIRED", "Token expired"),
    NOT_AUTHORIZED(HttpStatus.FORBIDDEN, "NOT_AUTHORIZED", "Agent is not authorized for this session"),
    INVALID_SIGNATURE(HttpStatus.UNAUTHORIZED, "INVALID_SIGNATURE", "Invalid signature"),

    // 참가 / 메시지
    INVALID_CALLBACK(HttpStatus.BAD_REQUEST, "INVALID_CALLBACK", "Callback URL is required for registration"),
    INVALID_REQUEST(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", "Invalid request"),
    REGISTRATION_TIMEOUT(HttpStatus.SERVICE_UNAVAILABLE, "REGISTRATION_TIMEOUT", "Registration was not processed in time"),
    GAME_NOT_STARTED(HttpStatus.NOT_FOUND, "GAME_NOT_STARTED", "Game has not started yet"),
    ;
    private final String code;
    private final String message;
    private final HttpStatus status;

    ErrorCode(HttpStatus status, String code, String message) {
        this.status = status;
        this.message = message;
        this.code = code;
    }

    public CommonException commonException() {
        return new CommonException(this);
    }
}
