package com.tictachub.gameservice.games.tictactoe.domain.ai;

import com.tictachub.gameservice.engine.core.OpponentStrategy;
import com.tictachub.gameservice.games.tictactoe.domain.model.Move;
import com.tictachub.gameservice.games.tictactoe.domain.model.TicTacToeState;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;

/**
 * 随机落子：在所有空格中均匀随机选一个，交给 state.apply() 落子。
 * 随机模式下每回合有两次独立随机：这里选格子，apply() 里再抽标记。
 */
public class RandomPlacement implements OpponentStrategy<TicTacToeState, Move> {

    private final Random random;

    public RandomPlacement(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public Optional<Move> chooseMove(TicTacToeState state) {
        if (state.getOutcome().isOver()) {
            return Optional.empty();
        }
        List<int[]> empty = state.getBoard().emptyCells();
        if (empty.isEmpty()) {
            return Optional.empty();
        }
        int[] cell = empty.get(random.nextInt(empty.size()));
        return Optional.of(state.apply(cell[0], cell[1]).move());
    }
}
