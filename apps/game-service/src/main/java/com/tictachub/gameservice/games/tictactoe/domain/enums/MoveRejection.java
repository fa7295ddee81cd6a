package com.tictachub.gameservice.games.tictactoe.domain.enums;

import com.tictachub.gameservice.games.tictactoe.domain.constants.GameMessages;

/**
 * 落子被拒的原因。按校验顺序排列：先看对局是否结束，再看越界，最后看占用。
 */
public enum MoveRejection {

    /** 对局已结束 */
    GAME_OVER(GameMessages.GAME_OVER),
    /** 行列不在 [0,3) 内 */
    OUT_OF_BOUNDS(GameMessages.OUT_OF_BOUNDS),
    /** 目标格已有标记 */
    CELL_OCCUPIED(GameMessages.CELL_OCCUPIED);

    private final String message;

    MoveRejection(String message) {
        this.message = message;
    }

    public String message() { return message; }
}
