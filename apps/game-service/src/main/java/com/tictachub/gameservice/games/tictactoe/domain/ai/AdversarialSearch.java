package com.tictachub.gameservice.games.tictactoe.domain.ai;

import com.tictachub.gameservice.engine.core.OpponentStrategy;
import com.tictachub.gameservice.games.tictactoe.domain.constants.GameMessages;
import com.tictachub.gameservice.games.tictactoe.domain.enums.GameMode;
import com.tictachub.gameservice.games.tictactoe.domain.enums.Party;
import com.tictachub.gameservice.games.tictactoe.domain.enums.Side;
import com.tictachub.gameservice.games.tictactoe.domain.exception.InvalidModeOperationException;
import com.tictachub.gameservice.games.tictactoe.domain.model.Board;
import com.tictachub.gameservice.games.tictactoe.domain.model.Move;
import com.tictachub.gameservice.games.tictactoe.domain.model.MoveResult;
import com.tictachub.gameservice.games.tictactoe.domain.model.SideAssignment;
import com.tictachub.gameservice.games.tictactoe.domain.model.TicTacToeState;
import com.tictachub.gameservice.games.tictactoe.domain.rule.TicTacToeJudge;

import java.util.Optional;

/**
 * AdversarialSearch：完整深度的极小化极大搜索（固定模式专用）。
 * 1) 终局打分：对手胜 +10，人类胜 -10，和棋 0，不按深度折扣
 * 2) 对手回合取最大，人类回合取最小；既能替对手走，也能替人类走（自对弈）
 * 3) 同分时取行优先顺序下第一个达到最优分的格子
 * 4) 在棋盘副本上“落子-回退”，不会改动实盘；选定后走 state.apply() 真正落子
 * 3x3 最多 9! 个局面，无需剪枝/置换表。
 */
public class AdversarialSearch implements OpponentStrategy<TicTacToeState, Move> {

    static final int WIN_SCORE = 10;
    static final int LOSS_SCORE = -10;
    static final int DRAW_SCORE = 0;

    /**
     * 为当前执子方选出最优格子并通过 {@code state.apply} 落子。
     *
     * @return 实际落下的一手；对局已结束或无空位时为空
     * @throws InvalidModeOperationException 对局不是固定模式
     */
    @Override
    public Optional<Move> chooseMove(TicTacToeState state) {
        if (state.getMode() != GameMode.DETERMINISTIC) {
            throw new InvalidModeOperationException(GameMessages.SEARCH_ONLY_IN_DETERMINISTIC);
        }
        if (state.getOutcome().isOver()) {
            return Optional.empty();
        }

        Board scratch = state.getBoard();
        SideAssignment sides = state.getSides();
        Party mover = state.getCurrent();
        boolean maximizing = mover == Party.OPPONENT;
        Side mark = sides.sideOf(mover);

        int bestScore = maximizing ? Integer.MIN_VALUE : Integer.MAX_VALUE;
        int[] best = null;
        for (int[] p : scratch.emptyCells()) {
            scratch.place(p[0], p[1], mark);
            int score = minimax(scratch, mover.other(), sides);
            scratch.clear(p[0], p[1]);
            // 严格优于才替换：同分保留先遍历到的格子
            if (maximizing ? score > bestScore : score < bestScore) {
                bestScore = score;
                best = p;
            }
        }
        if (best == null) {
            return Optional.empty();
        }

        MoveResult result = state.apply(best[0], best[1]);
        return Optional.of(result.move());
    }

    /**
     * 极小化极大（toMove 当前走子方；分值始终站在对手视角）
     */
    private int minimax(Board b, Party toMove, SideAssignment sides) {
        Side winner = TicTacToeJudge.lineWinner(b);
        if (winner != null) {
            return sides.partyOf(winner) == Party.OPPONENT ? WIN_SCORE : LOSS_SCORE;
        }
        if (TicTacToeJudge.isFull(b)) {
            return DRAW_SCORE;
        }

        boolean maximizing = toMove == Party.OPPONENT;
        Side mark = sides.sideOf(toMove);
        int best = maximizing ? Integer.MIN_VALUE : Integer.MAX_VALUE;
        for (int x = 0; x < Board.SIZE; x++) {
            for (int y = 0; y < Board.SIZE; y++) {
                if (!b.isEmpty(x, y)) continue;
                b.place(x, y, mark);
                int val = minimax(b, toMove.other(), sides);
                b.clear(x, y);
                best = maximizing ? Math.max(best, val) : Math.min(best, val);
            }
        }
        return best;
    }
}
