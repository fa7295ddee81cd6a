package com.tictachub.gameservice.games.tictactoe.domain.model;

import com.tictachub.gameservice.games.tictactoe.domain.enums.Side;

/**
 * 一步棋：在 (row,col) 实际落下的标记 mark。
 * 随机模式下 mark 无法从执子方推出，所以必须随结果一起返回。
 */
public record Move(int row, int col, Side mark) {
}
