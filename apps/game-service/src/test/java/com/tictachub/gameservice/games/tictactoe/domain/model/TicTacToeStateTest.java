package com.tictachub.gameservice.games.tictactoe.domain.model;

import com.tictachub.gameservice.games.tictactoe.domain.enums.GameMode;
import com.tictachub.gameservice.games.tictactoe.domain.enums.MoveRejection;
import com.tictachub.gameservice.games.tictactoe.domain.enums.Party;
import com.tictachub.gameservice.games.tictactoe.domain.enums.Side;
import com.tictachub.gameservice.games.tictactoe.domain.enums.Winner;
import com.tictachub.gameservice.games.tictactoe.domain.exception.InvalidModeOperationException;
import com.tictachub.gameservice.games.tictactoe.domain.rule.Outcome;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TicTacToeStateTest {

    @Test
    void shouldPlaceMoverSideAndAlternateTurnsInDeterministicMode() {
        TicTacToeState state = TicTacToeState.deterministic();

        MoveResult first = state.apply(1, 1);
        assertTrue(first.isApplied());
        assertEquals(new Move(1, 1, Side.A), first.move());
        assertEquals(Party.OPPONENT, state.getCurrent());

        MoveResult second = state.apply(0, 0);
        assertEquals(Side.B, second.move().mark());
        assertEquals(Party.HUMAN, state.getCurrent());
        assertEquals(2, state.getMoveCount());
        assertEquals(second.move(), state.getLastMove());
    }

    @Test
    void shouldRejectOutOfBoundsWithoutMutation() {
        TicTacToeState state = TicTacToeState.deterministic();
        for (int[] p : new int[][]{{-1, 0}, {0, 3}, {3, 3}, {0, -1}}) {
            MoveResult r = state.apply(p[0], p[1]);
            assertFalse(r.isApplied());
            assertEquals(MoveRejection.OUT_OF_BOUNDS, r.rejection());
        }
        assertEquals(0, state.getMoveCount());
        assertEquals(Party.HUMAN, state.getCurrent());
        assertEquals(9, state.getBoard().emptyCount());
    }

    @Test
    void shouldRejectOccupiedCellWithoutMutation() {
        TicTacToeState state = TicTacToeState.deterministic();
        state.apply(0, 0);
        char[][] before = state.getBoard().view();

        MoveResult r = state.apply(0, 0);

        assertEquals(MoveRejection.CELL_OCCUPIED, r.rejection());
        assertArrayEquals(before, state.getBoard().view());
        assertEquals(Party.OPPONENT, state.getCurrent());
        assertEquals(1, state.getMoveCount());
    }

    @Test
    void shouldCheckGameOverBeforeBoundsAndOccupancy() {
        TicTacToeState state = playDeterministic(0, 0, 1, 0, 0, 1, 1, 1, 0, 2);
        assertEquals(Outcome.A_WON, state.getOutcome());

        assertEquals(MoveRejection.GAME_OVER, state.apply(5, 5).rejection());
        assertEquals(MoveRejection.GAME_OVER, state.apply(0, 0).rejection());
        assertEquals(MoveRejection.GAME_OVER, state.apply(2, 2).rejection());
        assertTrue(state.getBoard().isEmpty(2, 2));
    }

    @Test
    void shouldAttributeRowWinToHuman() {
        // A(0,0) B(1,0) A(0,1) B(1,1) A(0,2)
        TicTacToeState state = playDeterministic(0, 0, 1, 0, 0, 1, 1, 1, 0, 2);

        assertEquals(Outcome.A_WON, state.getOutcome());
        assertEquals(Winner.HUMAN, state.resolveWinner());
        // 终局后不再换手
        assertEquals(Party.HUMAN, state.getCurrent());
    }

    @Test
    void shouldReportDrawAfterNineMovesWithoutLine() {
        TicTacToeState state = playDeterministic(
                0, 0, 1, 1, 0, 2, 0, 1, 2, 1, 1, 2, 1, 0, 2, 0, 2, 2);

        assertEquals(Outcome.DRAW, state.getOutcome());
        assertEquals(Winner.DRAW, state.resolveWinner());
        assertEquals(0, state.getBoard().emptyCount());
    }

    @Test
    void shouldAttributeWinBySideAssignmentInRandomizedMode() {
        // 每一步都落 A；人类执 B，对手执 A
        TicTacToeState state = TicTacToeState.randomized(new FixedMarkRandom(true),
                new SideAssignment(Side.B, Side.A));
        int[][] moves = {{0, 0}, {1, 0}, {0, 1}, {1, 1}, {0, 2}};
        for (int[] m : moves) {
            assertEquals(Outcome.IN_PROGRESS, state.getOutcome());
            assertEquals(Side.A, state.apply(m[0], m[1]).move().mark());
        }

        assertEquals(Outcome.A_WON, state.getOutcome());
        assertEquals(Winner.OPPONENT, state.resolveWinner());
    }

    @Test
    void shouldAlternateMoverEvenThoughMarkIsRandom() {
        TicTacToeState state = TicTacToeState.randomized(new FixedMarkRandom(false),
                SideAssignment.FIXED);
        state.apply(0, 0);
        assertEquals(Party.OPPONENT, state.getCurrent());
        state.apply(2, 2);
        assertEquals(Party.HUMAN, state.getCurrent());
        assertEquals(Side.B, state.getBoard().get(0, 0));
        assertEquals(Side.B, state.getBoard().get(2, 2));
    }

    @Test
    void shouldDrawMarksUniformlyInRandomizedMode() {
        Random random = new Random(7);
        TicTacToeState state = TicTacToeState.randomized(random);
        int total = 10_000;
        int a = 0;
        for (int applied = 0; applied < total; applied++) {
            if (state.getOutcome().isOver()) {
                state.reset();
            }
            List<int[]> empty = state.getBoard().emptyCells();
            int[] cell = empty.get(random.nextInt(empty.size()));
            if (state.apply(cell[0], cell[1]).move().mark() == Side.A) a++;
        }
        double ratio = a / (double) total;
        assertTrue(ratio > 0.45 && ratio < 0.55, "ratio of A = " + ratio);
    }

    @Test
    void shouldKeepVerdictStableAcrossCalls() {
        TicTacToeState state = TicTacToeState.deterministic();
        assertEquals(Winner.NONE, state.resolveWinner());
        assertEquals(Winner.NONE, state.resolveWinner());

        state = playDeterministic(0, 0, 1, 0, 0, 1, 1, 1, 0, 2);
        Winner first = state.resolveWinner();
        assertEquals(first, state.resolveWinner());
    }

    @Test
    void shouldRestoreInitialStateOnResetButKeepModeAndSides() {
        SideAssignment sides = new SideAssignment(Side.B, Side.A);
        TicTacToeState state = TicTacToeState.randomized(new Random(3), sides);
        state.apply(0, 0);
        state.apply(1, 1);
        state.apply(2, 2);

        state.reset();

        assertEquals(9, state.getBoard().emptyCount());
        assertEquals(Outcome.IN_PROGRESS, state.getOutcome());
        assertEquals(Party.HUMAN, state.getCurrent());
        assertEquals(0, state.getMoveCount());
        assertNull(state.getLastMove());
        assertEquals(GameMode.RANDOMIZED, state.getMode());
        assertSame(sides, state.getSides());
    }

    @Test
    void shouldResetFinishedDeterministicGame() {
        TicTacToeState state = playDeterministic(0, 0, 1, 0, 0, 1, 1, 1, 0, 2);
        state.reset();
        assertEquals(Outcome.IN_PROGRESS, state.getOutcome());
        assertTrue(state.apply(0, 0).isApplied());
        assertEquals(GameMode.DETERMINISTIC, state.getMode());
        assertEquals(SideAssignment.FIXED, state.getSides());
    }

    @Test
    void shouldAssignDisjointSidesWhenRandomizedGameStarts() {
        TicTacToeState state = TicTacToeState.randomized(new Random(11));
        SideAssignment sides = state.getSides();
        assertNotEquals(sides.humanSide(), sides.opponentSide());
    }

    @Test
    void shouldRejectSideAssignmentInDeterministicMode() {
        TicTacToeState state = TicTacToeState.deterministic();
        assertThrows(InvalidModeOperationException.class, state::assignSidesRandomly);
        assertEquals(SideAssignment.FIXED, state.getSides());
    }

    @Test
    void shouldRejectSideAssignmentAfterFirstMove() {
        TicTacToeState state = TicTacToeState.randomized(new Random(5));
        SideAssignment before = state.getSides();
        state.apply(1, 1);

        assertThrows(InvalidModeOperationException.class, state::assignSidesRandomly);
        assertSame(before, state.getSides());
    }

    @Test
    void shouldAllowSideAssignmentAgainAfterReset() {
        TicTacToeState state = TicTacToeState.randomized(new FixedMarkRandom(false));
        assertEquals(new SideAssignment(Side.B, Side.A), state.getSides());
        state.apply(0, 0);
        state.reset();
        assertEquals(new SideAssignment(Side.B, Side.A), state.assignSidesRandomly());
    }

    @Test
    void shouldCopyIndependently() {
        TicTacToeState state = TicTacToeState.deterministic();
        state.apply(0, 0);
        TicTacToeState copy = state.copy();

        copy.apply(1, 1);

        assertTrue(state.getBoard().isEmpty(1, 1));
        assertEquals(1, state.getMoveCount());
        assertEquals(Party.OPPONENT, state.getCurrent());
        assertEquals(Party.HUMAN, copy.getCurrent());
        assertEquals(Side.A, copy.getBoard().get(0, 0));
    }

    @Test
    void shouldNotLetReturnedBoardChangeTheGame() {
        TicTacToeState state = TicTacToeState.deterministic();

        Board board = state.getBoard();
        board.place(0, 0, Side.A);
        board.place(0, 1, Side.A);
        board.place(0, 2, Side.A);

        assertEquals(9, state.getBoard().emptyCount());
        assertEquals(Outcome.IN_PROGRESS, state.getOutcome());
        MoveResult next = state.apply(1, 1);
        assertTrue(next.isApplied());
        assertEquals(Outcome.IN_PROGRESS, next.outcome());
        assertTrue(state.apply(0, 0).isApplied());
    }

    /** 依次落子，参数为 row,col 成对出现 */
    static TicTacToeState playDeterministic(int... coords) {
        TicTacToeState state = TicTacToeState.deterministic();
        for (int i = 0; i < coords.length; i += 2) {
            assertTrue(state.apply(coords[i], coords[i + 1]).isApplied());
        }
        return state;
    }
}
