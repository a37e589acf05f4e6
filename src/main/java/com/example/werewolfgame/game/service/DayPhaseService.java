package com.example.werewolfgame.game.service;

import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.example.werewolfgame.game.domain.GameSession;
import com.example.werewolfgame.game.domain.Participant;
import com.example.werewolfgame.game.domain.PlayerRole;
import com.example.werewolfgame.game.domain.Roster;
import com.example.werewolfgame.game.message.GameMessage;
import com.example.werewolfgame.game.transport.DeliveryResult;
import com.example.werewolfgame.game.transport.Messenger;
import com.example.werewolfgame.game.transport.Reply;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 낮 페이즈 서비스
 * 밤 결과 공지 -> 토론 (명단 순서로 한 명씩, 발언 즉시 재방송) -> 투표
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DayPhaseService {

    private final Messenger messenger;
    private final RoleFanoutService fanoutService;
    private final VoteTally voteTally;
    private final ModeratorMessages messages;

    /**
     * @return 투표로 제거된 참가자
     */
    public Optional<String> runDay(GameSession session) {
        Roster<PlayerRole> roster = session.getRoster();

        fanoutService.broadcast(roster, messages.nightResult(session.getLastNightEliminated()));
        discuss(roster);
        return vote(roster);
    }

    private void discuss(Roster<PlayerRole> roster) {
        List<String> speakers = roster.survivors();
        GameMessage request = messages.discussRequest(speakers);
        for (String speaker : speakers) {
            DeliveryResult result = messenger.send(request, speaker);
            if (!result.isDelivered() || result.response().content().isBlank()) {
                continue;
            }
            fanoutService.broadcast(roster, messages.speech(speaker, result.response().content()));
        }
    }

    private Optional<String> vote(Roster<PlayerRole> roster) {
        List<Reply> votes = fanoutService.fanoutToAll(roster, messages.voteRequest());
        Optional<String> eliminated = voteTally.tally(roster, votes, Participant::isAlive)
                .flatMap(roster::findAlive)
                .map(Participant::getIdentity);

        eliminated.ifPresentOrElse(target -> {
            // 제거 대상도 결과를 듣도록 공지 후 사망 처리
            fanoutService.broadcast(roster, messages.voteResult(target));
            roster.markDead(target);
            log.info("[낮] 투표로 제거: {}", target);
        }, () -> log.info("[낮] 유효 투표 없음, 제거 없음"));
        return eliminated;
    }
}
