package com.tictachub.gameservice.games.tictactoe.domain.model;

import com.tictachub.gameservice.games.tictactoe.domain.enums.MoveRejection;
import com.tictachub.gameservice.games.tictactoe.domain.rule.Outcome;

/**
 * 一次落子的结果：要么 applied（带实际落下的 Move 与落子后的结果），要么 rejected（带拒绝原因）。
 * 拒绝不抛异常，调用方按值判断。
 */
public record MoveResult(Move move, Outcome outcome, MoveRejection rejection) {

    public static MoveResult applied(Move move, Outcome outcome) {
        return new MoveResult(move, outcome, null);
    }

    public static MoveResult rejected(MoveRejection rejection) {
        return new MoveResult(null, null, rejection);
    }

    public boolean isApplied() {
        return rejection == null;
    }
}
