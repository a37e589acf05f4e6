package com.example.werewolfgame.game.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import com.example.werewolfgame.game.domain.GamePhase;
import com.example.werewolfgame.game.dto.response.GameStatusResponse;
import com.example.werewolfgame.game.message.GameMessage;
import com.example.werewolfgame.game.service.GameEngine;
import com.example.werewolfgame.game.service.ModeratorMessageRouter;
import com.example.werewolfgame.global.error.ErrorCode;

@WebMvcTest(ModeratorController.class)
class ModeratorControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ModeratorMessageRouter messageRouter;

    @MockBean
    private GameEngine gameEngine;

    @Test
    @DisplayName("참가 등록 요청에 배정된 역할을 response 메시지로 돌려준다")
    void receive_register() throws Exception {
        // given
        when(messageRouter.route(any())).thenReturn(GameMessage.response("moderator", "seer"));

        // when & then
        mockMvc.perform(post("/api/moderator/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"type": "register", "source": "alice", "content": "join werewolf game",
                                 "callbackUrl": "http://localhost:9001/agent"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.kind").value("response"))
                .andExpect(jsonPath("$.source").value("moderator"))
                .andExpect(jsonPath("$.content").value("seer"));
    }

    @Test
    @DisplayName("인증 오류는 에러 코드와 HTTP 상태로 응답한다")
    void receive_authError() throws Exception {
        when(messageRouter.route(any())).thenThrow(ErrorCode.TOKEN_EXPIRED.commonException());

        mockMvc.perform(post("/api/moderator/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"kind": "register", "source": "alice", "timestamp": "1", "signature": "0x00"}
                                """))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("TOKEN_EXPIRED"));
    }

    @Test
    @DisplayName("kind 가 없거나 알 수 없는 kind 면 400")
    void receive_invalidKind() throws Exception {
        mockMvc.perform(post("/api/moderator/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"source": "alice"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));

        mockMvc.perform(post("/api/moderator/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"kind": "teleport", "source": "alice"}
                                """))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(messageRouter);
    }

    @Test
    @DisplayName("게임이 시작되지 않았으면 상태 조회는 404")
    void status_notStarted() throws Exception {
        when(gameEngine.currentStatus()).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/moderator/status"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("GAME_NOT_STARTED"));
    }

    @Test
    @DisplayName("진행 중인 게임의 상태를 조회한다")
    void status_running() throws Exception {
        GameStatusResponse snapshot = GameStatusResponse.builder()
                .sessionId("session")
                .phase(GamePhase.NIGHT)
                .round(2)
                .survivors(List.of("a", "c", "d"))
                .lastNightEliminated(List.of("b"))
                .eliminated(List.of("e", "b"))
                .build();
        when(gameEngine.currentStatus()).thenReturn(Optional.of(snapshot));

        mockMvc.perform(get("/api/moderator/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.phase").value("NIGHT"))
                .andExpect(jsonPath("$.data.round").value(2))
                .andExpect(jsonPath("$.data.survivors[0]").value("a"))
                .andExpect(jsonPath("$.data.lastNightEliminated[0]").value("b"));
    }
}
