package com.tictachub.gameservice.games.tictactoe.domain.rule;

import com.tictachub.gameservice.games.tictactoe.domain.enums.Side;

/** 对局结果（按标记统计）：未结束 / A 成线 / B 成线 / 和棋 */
public enum Outcome {
    /** 对局进行中 */
    IN_PROGRESS,
    /** A 标记三连 */
    A_WON,
    /** B 标记三连 */
    B_WON,
    /** 棋盘已满且无人成线 */
    DRAW;

    /**
     * 根据成线的标记返回对应结果。
     *
     * @param side 成线的标记
     * @return A 返回 {@link #A_WON}，B 返回 {@link #B_WON}
     */
    public static Outcome winOf(Side side) {
        return side == Side.A ? A_WON : B_WON;
    }

    /** 成线的标记；非胜负结果返回 null */
    public Side winningSide() {
        switch (this) {
            case A_WON: return Side.A;
            case B_WON: return Side.B;
            default: return null;
        }
    }

    public boolean isOver() {
        return this != IN_PROGRESS;
    }
}
