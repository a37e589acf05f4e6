package com.example.werewolfgame.game.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.TreeMap;
import java.util.function.Predicate;

import org.springframework.stereotype.Component;

import com.example.werewolfgame.game.domain.Ballot;
import com.example.werewolfgame.game.domain.GameRole;
import com.example.werewolfgame.game.domain.Participant;
import com.example.werewolfgame.game.domain.Roster;
import com.example.werewolfgame.game.transport.Reply;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 투표 집계
 * - 최다 득표 1명이면 그 대상
 * - 동점이면 동점자 중 무작위 1명 (주입된 Random, 동점자 정렬 후 추첨)
 * - 유효 투표가 없으면 empty
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VoteTally {

    private final NameResolver nameResolver;
    private final Random random;

    public Optional<String> collectVotes(List<Ballot> ballots) {
        // 정렬된 맵이므로 동점자 목록이 도착 순서와 무관
        Map<String, Integer> voteCount = new TreeMap<>();
        for (Ballot ballot : ballots) {
            if (ballot.target() == null) {
                continue;
            }
            String target = ballot.target().trim().toLowerCase(Locale.ROOT);
            if (target.isEmpty()) {
                continue;
            }
            voteCount.merge(target, 1, Integer::sum);
        }

        if (voteCount.isEmpty()) {
            return Optional.empty();
        }

        int maxVotes = voteCount.values().stream().max(Integer::compareTo).orElse(0);
        List<String> topVoted = new ArrayList<>();
        voteCount.forEach((target, count) -> {
            if (count == maxVotes) {
                topVoted.add(target);
            }
        });

        if (topVoted.size() == 1) {
            return Optional.of(topVoted.get(0));
        }
        String picked = topVoted.get(random.nextInt(topVoted.size()));
        log.info("[투표] 동점 {}명 중 무작위 선택: tied={}, picked={}", topVoted.size(), topVoted, picked);
        return Optional.of(picked);
    }

    /**
     * 응답을 투표로 변환해 집계한다.
     * 대상이 해석되지 않거나 투표 자격이 없는 응답은 버린다.
     */
    public <R extends GameRole> Optional<String> tally(Roster<R> roster, List<Reply> replies,
                                                       Predicate<Participant<R>> voterFilter) {
        List<String> candidates = roster.survivors();
        List<Ballot> ballots = new ArrayList<>();
        for (Reply reply : replies) {
            boolean eligible = roster.findByIdentity(reply.identity())
                    .filter(Participant::isAlive)
                    .filter(voterFilter)
                    .isPresent();
            if (!eligible) {
                log.debug("[투표] 자격 없는 투표 제외: voter={}", reply.identity());
                continue;
            }
            Optional<String> target = nameResolver.resolve(reply.content(), candidates);
            if (target.isEmpty()) {
                log.debug("[투표] 대상 해석 실패로 제외: voter={}, content={}", reply.identity(), reply.content());
                continue;
            }
            ballots.add(new Ballot(reply.identity(), target.get()));
        }
        log.info("[투표] 유효 투표 {}건: {}", ballots.size(), ballots);
        return collectVotes(ballots);
    }
}
