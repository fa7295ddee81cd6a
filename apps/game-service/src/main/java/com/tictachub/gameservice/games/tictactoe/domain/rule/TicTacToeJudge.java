package com.tictachub.gameservice.games.tictactoe.domain.rule;

import com.tictachub.gameservice.games.tictactoe.domain.enums.Side;
import com.tictachub.gameservice.games.tictactoe.domain.model.Board;

/**
 * 核心规则判断
 * 井字棋规则判定：合法性、胜负、和棋。只包含纯判断逻辑，不修改棋盘。
 */
public class TicTacToeJudge {

    // 8 条成线：3 行、3 列、2 条对角线，顺序即扫描顺序
    private static final int[][][] LINES = {
            {{0, 0}, {0, 1}, {0, 2}},
            {{1, 0}, {1, 1}, {1, 2}},
            {{2, 0}, {2, 1}, {2, 2}},
            {{0, 0}, {1, 0}, {2, 0}},
            {{0, 1}, {1, 1}, {2, 1}},
            {{0, 2}, {1, 2}, {2, 2}},
            {{0, 0}, {1, 1}, {2, 2}},  // ↘
            {{0, 2}, {1, 1}, {2, 0}}   // ↙
    };

    private TicTacToeJudge() {
    }

    /** 该落点是否“棋盘内为空” */
    public static boolean isLegal(Board b, int row, int col) {
        return b.inBounds(row, col) && b.isEmpty(row, col);
    }

    /**
     * 扫描全部 8 条线，返回第一条三连的标记；没有则返回 null。
     * 每步落子后都会调用一次，所以不会出现两种标记同时成线。
     */
    public static Side lineWinner(Board b) {
        for (int[][] line : LINES) {
            Side first = b.get(line[0][0], line[0][1]);
            if (first == null) continue;
            if (first == b.get(line[1][0], line[1][1]) && first == b.get(line[2][0], line[2][1])) {
                return first;
            }
        }
        return null;
    }

    /** 棋盘是否已满（用于和棋判断） */
    public static boolean isFull(Board b) {
        return b.emptyCount() == 0;
    }

    /**
     * 根据当前局面返回对局结果。
     * （TicTacToeState.apply() 落子后调用）
     */
    public static Outcome outcomeOf(Board b) {
        Side winner = lineWinner(b);
        if (winner != null) {
            return Outcome.winOf(winner);
        }
        if (isFull(b)) {
            return Outcome.DRAW;
        }
        return Outcome.IN_PROGRESS;
    }
}
