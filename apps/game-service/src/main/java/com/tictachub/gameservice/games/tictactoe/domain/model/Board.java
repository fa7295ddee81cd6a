package com.tictachub.gameservice.games.tictactoe.domain.model;

import com.tictachub.gameservice.games.tictactoe.domain.enums.Side;

import java.util.ArrayList;
import java.util.List;

/**
 * 井字棋棋盘：3x3 网格。
 * 约定：null 表示空格，否则为该格的标记 A / B。
 */
public class Board {
    /** 棋盘尺寸（3x3），不支持其他尺寸。 */
    public static final int SIZE = 3;
    /** 快照/日志里空格的字符。 */
    public static final char EMPTY = '.';

    /** 棋盘二维数组，存放当前局面状态。 */
    private final Side[][] grid = new Side[SIZE][SIZE];

    /** 是否在棋盘内 */
    public boolean inBounds(int row, int col) {
        return row >= 0 && row < SIZE && col >= 0 && col < SIZE;
    }

    /** 读取该格的标记，空格返回 null */
    public Side get(int row, int col) { return grid[row][col]; }

    /** 该格是否为空（越界视为非空） */
    public boolean isEmpty(int row, int col) {
        return inBounds(row, col) && grid[row][col] == null;
    }

    /** 在(row,col)写入标记（不做合法性校验，由上层规则判定） */
    public void place(int row, int col, Side mark) { grid[row][col] = mark; }

    /** 清空一格（搜索回退用） */
    public void clear(int row, int col) { grid[row][col] = null; }

    /** 清空整盘 */
    public void clearAll() {
        for (int i = 0; i < SIZE; i++)
            for (int j = 0; j < SIZE; j++)
                grid[i][j] = null;
    }

    /** 空格数量 */
    public int emptyCount() {
        int n = 0;
        for (int i = 0; i < SIZE; i++)
            for (int j = 0; j < SIZE; j++)
                if (grid[i][j] == null) n++;
        return n;
    }

    /** 按行优先顺序列出所有空格坐标 {row, col} */
    public List<int[]> emptyCells() {
        List<int[]> cells = new ArrayList<>();
        for (int i = 0; i < SIZE; i++)
            for (int j = 0; j < SIZE; j++)
                if (grid[i][j] == null) cells.add(new int[]{i, j});
        return cells;
    }

    /** 深拷贝棋盘（供状态复制/AI模拟使用） */
    public Board copy() {
        Board b = new Board();
        for (int i = 0; i < SIZE; i++) b.grid[i] = grid[i].clone();
        return b;
    }

    /** 返回字符视图副本（用于快照/日志）：'A' / 'B' / '.' */
    public char[][] view() {
        char[][] v = new char[SIZE][SIZE];
        for (int i = 0; i < SIZE; i++)
            for (int j = 0; j < SIZE; j++)
                v[i][j] = grid[i][j] == null ? EMPTY : grid[i][j].symbol();
        return v;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        char[][] v = view();
        for (int i = 0; i < SIZE; i++) {
            if (i > 0) sb.append('/');
            sb.append(v[i]);
        }
        return sb.toString();
    }
}
