package com.tictachub.gameservice.engine.core;

/**
 * 游戏状态快照接口。
 * - 必须可 copy：便于 AI 搜索、自对弈模拟等。
 * - 具体游戏（如 TicTacToeState）实现此接口。
 */
public interface GameState {

    /**
     * 返回当前状态的深拷贝快照，对拷贝的修改不影响原对局。
     */
    GameState copy();
}
