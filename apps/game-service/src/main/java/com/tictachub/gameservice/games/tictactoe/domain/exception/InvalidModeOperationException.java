package com.tictachub.gameservice.games.tictactoe.domain.exception;

/**
 * 调用方违反模式约定，例如在随机模式下使用博弈树搜索、对局开始后重新分配阵营。
 * 属于调用方错误，不是可恢复的落子拒绝。
 */
public class InvalidModeOperationException extends IllegalStateException {

    public InvalidModeOperationException(String message) {
        super(message);
    }
}
