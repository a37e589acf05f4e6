package com.example.werewolfgame.duel;

import java.util.Optional;

/**
 * 2인 대국 규칙 엔진 (외부 구현)
 * 사회자는 합법 여부, 수 적용, 종료 여부만 묻는다.
 */
public interface MoveRules {

    /**
     * 수를 둘 쪽에게 보낼 현재 판 설명 (가능한 수 포함)
     */
    String describe(Side toMove);

    boolean isLegal(Side side, String move);

    void apply(Side side, String move);

    boolean isGameOver();

    /**
     * 종료된 대국의 승자, 무승부거나 진행 중이면 empty
     */
    Optional<Side> winner();
}
