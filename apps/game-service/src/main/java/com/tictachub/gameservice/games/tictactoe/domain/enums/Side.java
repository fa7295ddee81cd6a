package com.tictachub.gameservice.games.tictactoe.domain.enums;

/**
 * 棋盘上的两种标记。
 * 与“谁下的”无关：随机模式下任何一方都可能落下 A 或 B。
 */
public enum Side {

    A('A'),
    B('B');

    /** 渲染/快照中使用的字符 */
    private final char symbol;

    Side(char symbol) {
        this.symbol = symbol;
    }

    public char symbol() { return symbol; }
}
