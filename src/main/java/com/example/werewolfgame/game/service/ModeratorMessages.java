package com.example.werewolfgame.game.service;

import java.util.List;

import org.springframework.stereotype.Component;

import com.example.werewolfgame.game.domain.GameOutcome;
import com.example.werewolfgame.game.domain.PlayerRole;
import com.example.werewolfgame.game.message.GameMessage;
import com.example.werewolfgame.game.message.MessageKind;
import com.example.werewolfgame.global.config.GameProperties;

import lombok.RequiredArgsConstructor;

/**
 * 사회자가 보내는 공지/요청 문구
 * 참가자(에이전트)가 읽는 문구이므로 영어로 고정한다.
 */
@Component
@RequiredArgsConstructor
public class ModeratorMessages {

    private final GameProperties properties;

    // ================= 로비 =================

    public GameMessage teammates(List<String> wolves) {
        return moderator(MessageKind.IMPORTANT_INFO, "The wolves are: " + String.join(", ", wolves));
    }

    // ================= 밤 =================

    public GameMessage nightOpening(List<String> survivors) {
        return moderator(MessageKind.SYSTEM_NOTICE,
                "New night comes. There are survive players: " + String.join(", ", survivors));
    }

    public GameMessage nightKillRequest() {
        return moderator(MessageKind.NIGHT_KILL, "Which player do you vote to eliminate?");
    }

    public GameMessage wolfTargetNotice(String target) {
        return moderator(MessageKind.SYSTEM_NOTICE,
                "The player with the most votes is: " + (target == null ? "nobody" : target));
    }

    public GameMessage saveRequest() {
        return moderator(MessageKind.SAVE,
                "You're the witch. Tonight one player is eliminated. Would you like to resurrect this player?");
    }

    public GameMessage poisonRequest() {
        return moderator(MessageKind.POISON,
                "Would you like to eliminate one player? If yes, specify the player name.");
    }

    public GameMessage divineRequest(List<String> survivors) {
        return moderator(MessageKind.DIVINE,
                "You're the seer. Which player in: " + String.join(", ", survivors)
                        + " would you like to check tonight?");
    }

    public GameMessage roleReveal(String target, PlayerRole role) {
        return moderator(MessageKind.SYSTEM_NOTICE, "The role of " + target + " is " + role.getWireName());
    }

    // ================= 낮 =================

    public GameMessage nightResult(List<String> eliminated) {
        String content = eliminated.isEmpty()
                ? "The day is coming, all the players open your eyes. "
                        + "Last night is peaceful, no player is eliminated."
                : "The day is coming, all the players open your eyes. "
                        + "Last night, the following player(s) has been eliminated: " + String.join(", ", eliminated);
        return moderator(MessageKind.SYSTEM_NOTICE, content);
    }

    public GameMessage discussRequest(List<String> survivors) {
        return moderator(MessageKind.DAY_DISCUSS,
                "Now the alive players are: " + String.join(", ", survivors)
                        + ". Given the game rules and your role, based on the situation and the information you gain,"
                        + " what do you want to say to others?");
    }

    /**
     * 토론 발언 재방송 (source 는 발언자)
     */
    public GameMessage speech(String speaker, String content) {
        return GameMessage.of(MessageKind.SYSTEM_NOTICE, speaker, content);
    }

    public GameMessage voteRequest() {
        return moderator(MessageKind.DAY_VOTE, "It's time to vote. Which player do you suspect to be a wolf?");
    }

    public GameMessage voteResult(String eliminated) {
        return moderator(MessageKind.SYSTEM_NOTICE,
                "The voting result is: Player " + eliminated + " has been eliminated.");
    }

    // ================= 종료 =================

    public GameMessage outcome(GameOutcome outcome, int rounds) {
        String content = outcome == GameOutcome.NO_WINNER
                ? outcome.getNotice() + " after " + rounds + " rounds"
                : outcome.getNotice();
        return moderator(MessageKind.SYSTEM_NOTICE, content);
    }

    // ================= 대국 =================

    public GameMessage moveRequest(String board) {
        return moderator(MessageKind.MOVE, board);
    }

    public GameMessage duelNotice(String content) {
        return moderator(MessageKind.SYSTEM_NOTICE, content);
    }

    private GameMessage moderator(MessageKind kind, String content) {
        return GameMessage.of(kind, properties.moderatorId(), content);
    }
}
