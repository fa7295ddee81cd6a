package com.tictachub.gameservice.games.tictactoe.domain.enums;

/** 对局参与方：人类玩家 / 自动对手 */
public enum Party {

    HUMAN,
    OPPONENT;

    public Party other() {
        return this == HUMAN ? OPPONENT : HUMAN;
    }
}
