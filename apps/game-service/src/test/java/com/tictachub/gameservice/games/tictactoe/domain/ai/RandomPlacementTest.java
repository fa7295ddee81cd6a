package com.tictachub.gameservice.games.tictactoe.domain.ai;

import com.tictachub.gameservice.games.tictactoe.domain.enums.GameMode;
import com.tictachub.gameservice.games.tictactoe.domain.model.Move;
import com.tictachub.gameservice.games.tictactoe.domain.model.TicTacToeState;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RandomPlacementTest {

    @Test
    void shouldOccupyExactlyOnePreviouslyEmptyCell() {
        Random random = new Random(42);
        RandomPlacement placement = new RandomPlacement(random);
        for (int game = 0; game < 200; game++) {
            TicTacToeState state = TicTacToeState.randomized(random);
            while (!state.getOutcome().isOver()) {
                char[][] before = state.getBoard().view();
                int emptyBefore = state.getBoard().emptyCount();

                Move move = placement.chooseMove(state).orElseThrow();

                assertEquals('.', before[move.row()][move.col()]);
                assertEquals(move.mark(), state.getBoard().get(move.row(), move.col()));
                assertEquals(emptyBefore - 1, state.getBoard().emptyCount());
            }
        }
    }

    @Test
    void shouldWorkInDeterministicModeToo() {
        TicTacToeState state = TicTacToeState.deterministic();
        state.apply(1, 1);
        Move move = new RandomPlacement(new Random(8)).chooseMove(state).orElseThrow();
        assertNotNull(move.mark());
        assertEquals(7, state.getBoard().emptyCount());
    }

    @Test
    void shouldReturnEmptyWhenGameIsOver() {
        Random random = new Random(3);
        RandomPlacement placement = new RandomPlacement(random);
        TicTacToeState state = TicTacToeState.randomized(random);
        while (placement.chooseMove(state).isPresent()) {
            // 一直随机下到终局
        }
        assertTrue(state.getOutcome().isOver());
        int moves = state.getMoveCount();
        assertEquals(Optional.empty(), placement.chooseMove(state));
        assertEquals(moves, state.getMoveCount());
    }

    @Test
    void shouldBindStrategyByMode() {
        Random random = new Random();
        assertInstanceOf(AdversarialSearch.class, OpponentStrategies.forMode(GameMode.DETERMINISTIC, random));
        assertInstanceOf(RandomPlacement.class, OpponentStrategies.forMode(GameMode.RANDOMIZED, random));
    }
}
