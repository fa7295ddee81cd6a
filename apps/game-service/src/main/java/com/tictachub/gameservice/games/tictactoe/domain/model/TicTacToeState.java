package com.tictachub.gameservice.games.tictactoe.domain.model;

import com.tictachub.gameservice.engine.core.GameState;
import com.tictachub.gameservice.games.tictactoe.domain.constants.GameMessages;
import com.tictachub.gameservice.games.tictactoe.domain.enums.GameMode;
import com.tictachub.gameservice.games.tictactoe.domain.enums.MoveRejection;
import com.tictachub.gameservice.games.tictactoe.domain.enums.Party;
import com.tictachub.gameservice.games.tictactoe.domain.enums.Side;
import com.tictachub.gameservice.games.tictactoe.domain.enums.Winner;
import com.tictachub.gameservice.games.tictactoe.domain.exception.InvalidModeOperationException;
import com.tictachub.gameservice.games.tictactoe.domain.rule.Outcome;
import com.tictachub.gameservice.games.tictactoe.domain.rule.TicTacToeJudge;
import lombok.AccessLevel;
import lombok.Getter;

import java.util.Objects;
import java.util.Random;

/**
 * 对局状态。
 * 作用：整盘对局的“单一事实来源”（棋盘、轮到谁、模式、阵营分配、结果缓存、上一手）。
 * - 唯一的变更入口是 {@link #apply(int, int)}，每一步落子后立即重算结果，不做批量判定；
 * - 固定模式：落下的标记就是执子方的阵营（人类 A，对手 B）；
 * - 随机模式：落下的标记与执子方无关，均匀随机 A/B；阵营分配只决定胜负归属；
 * - copy() 深拷贝棋盘与元信息，随机源共享。
 */
@Getter
public class TicTacToeState implements GameState {

    /** 实盘只经 apply/reset 修改，对外只给副本 */
    @Getter(AccessLevel.NONE)
    private final Board board = new Board();

    private final GameMode mode;

    /** 随机模式的标记/阵营随机源；固定模式可为 null */
    @Getter(AccessLevel.NONE)
    private final Random random;

    /** 阵营分配：固定模式恒为 {@link SideAssignment#FIXED} */
    private SideAssignment sides;

    /** 当前轮到谁，人类先手 */
    private Party current = Party.HUMAN;

    /** 结果缓存，每步落子后更新 */
    private Outcome outcome = Outcome.IN_PROGRESS;

    /** 已落子数 */
    private int moveCount;

    /** 上一手，未落子为 null */
    private Move lastMove;

    private TicTacToeState(GameMode mode, SideAssignment sides, Random random) {
        this.mode = Objects.requireNonNull(mode, "mode");
        this.sides = Objects.requireNonNull(sides, "sides");
        this.random = random;
    }

    /** 固定模式新局 */
    public static TicTacToeState deterministic() {
        return new TicTacToeState(GameMode.DETERMINISTIC, SideAssignment.FIXED, null);
    }

    /** 随机模式新局：开局即随机分配阵营 */
    public static TicTacToeState randomized(Random random) {
        TicTacToeState s = new TicTacToeState(GameMode.RANDOMIZED, SideAssignment.FIXED,
                Objects.requireNonNull(random, "random"));
        s.assignSidesRandomly();
        return s;
    }

    /** 随机模式新局，阵营由调用方指定 */
    public static TicTacToeState randomized(Random random, SideAssignment sides) {
        return new TicTacToeState(GameMode.RANDOMIZED, sides, Objects.requireNonNull(random, "random"));
    }

    public static TicTacToeState of(GameMode mode, Random random) {
        return mode == GameMode.RANDOMIZED ? randomized(random) : deterministic();
    }

    /** 棋盘副本；改动副本不影响对局 */
    public Board getBoard() {
        return board.copy();
    }

    // --------- 状态变更 ----------

    /**
     * 落子。按顺序校验：对局已结束 → 越界 → 已占用，任一不满足直接返回拒绝结果，不修改任何状态。
     *
     * @return applied：实际落下的标记与落子后的结果；rejected：拒绝原因
     */
    public MoveResult apply(int row, int col) {
        if (outcome.isOver()) {
            return MoveResult.rejected(MoveRejection.GAME_OVER);
        }
        if (!board.inBounds(row, col)) {
            return MoveResult.rejected(MoveRejection.OUT_OF_BOUNDS);
        }
        if (!TicTacToeJudge.isLegal(board, row, col)) {
            return MoveResult.rejected(MoveRejection.CELL_OCCUPIED);
        }

        Side mark = markFor(current);
        board.place(row, col, mark);
        Move move = new Move(row, col, mark);
        lastMove = move;
        moveCount++;

        outcome = TicTacToeJudge.outcomeOf(board);
        if (!outcome.isOver()) {
            current = current.other();
        }
        return MoveResult.applied(move, outcome);
    }

    /**
     * 把“哪个标记成线”映射为“哪一方赢”。多次调用结果相同，不修改状态。
     */
    public Winner resolveWinner() {
        switch (outcome) {
            case IN_PROGRESS: return Winner.NONE;
            case DRAW: return Winner.DRAW;
            default: return Winner.of(sides.partyOf(outcome.winningSide()));
        }
    }

    /** 重开本局：清盘、人类先手；模式与阵营分配保留 */
    public void reset() {
        board.clearAll();
        current = Party.HUMAN;
        outcome = Outcome.IN_PROGRESS;
        moveCount = 0;
        lastMove = null;
    }

    /**
     * 随机分配阵营（各 50%）。仅随机模式、且尚未落子时可用。
     *
     * @throws InvalidModeOperationException 固定模式或对局已开始
     */
    public SideAssignment assignSidesRandomly() {
        if (mode != GameMode.RANDOMIZED) {
            throw new InvalidModeOperationException(GameMessages.SIDES_ONLY_IN_RANDOMIZED);
        }
        if (moveCount > 0) {
            throw new InvalidModeOperationException(GameMessages.SIDES_AFTER_FIRST_MOVE);
        }
        sides = SideAssignment.random(random);
        return sides;
    }

    /** 当前执子方落子时使用的标记 */
    private Side markFor(Party mover) {
        if (mode == GameMode.RANDOMIZED) {
            return random.nextBoolean() ? Side.A : Side.B;
        }
        return SideAssignment.FIXED.sideOf(mover);
    }

    /** 深拷贝：复制棋盘与对局元信息 */
    @Override
    public TicTacToeState copy() {
        TicTacToeState s = new TicTacToeState(mode, sides, random);
        for (int i = 0; i < Board.SIZE; i++) {
            for (int j = 0; j < Board.SIZE; j++) {
                Side p = board.get(i, j);
                if (p != null) s.board.place(i, j, p);
            }
        }
        s.current = this.current;
        s.outcome = this.outcome;
        s.moveCount = this.moveCount;
        s.lastMove = this.lastMove; // Move 是不可变 record，引用即可
        return s;
    }
}
