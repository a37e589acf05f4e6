package com.example.werewolfgame.game.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.example.werewolfgame.game.dto.request.InboundMessageRequest;
import com.example.werewolfgame.game.dto.response.GameStatusResponse;
import com.example.werewolfgame.game.message.GameMessage;
import com.example.werewolfgame.game.service.GameEngine;
import com.example.werewolfgame.game.service.ModeratorMessageRouter;
import com.example.werewolfgame.global.dto.CommonResponse;
import com.example.werewolfgame.global.error.ErrorCode;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@Tag(name = "ModeratorController", description = "사회자 API (참가 신청, 진행 상황 조회)")
@RestController
@RequestMapping("/api/moderator")
@RequiredArgsConstructor
public class ModeratorController {

    private final ModeratorMessageRouter messageRouter;
    private final GameEngine gameEngine;

    @Operation(summary = "참가자 메시지 수신", description = "register 요청이면 역할을 배정하고 역할 이름을 응답합니다. 거절 시 빈 문자열.")
    @PostMapping("/messages")
    public ResponseEntity<GameMessage> receive(@Valid @RequestBody InboundMessageRequest request) {
        return ResponseEntity.ok(messageRouter.route(request));
    }

    @Operation(summary = "게임 진행 상황 조회", description = "현재 페이즈, 라운드, 생존자, 결과를 조회합니다.")
    @GetMapping("/status")
    public ResponseEntity<CommonResponse<GameStatusResponse>> status() {
        GameStatusResponse status = gameEngine.currentStatus()
                .orElseThrow(ErrorCode.GAME_NOT_STARTED::commonException);
        return ResponseEntity.ok(CommonResponse.success(status, "게임 상태 조회 성공"));
    }
}
