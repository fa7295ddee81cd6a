package com.tictachub.gameservice.games.tictactoe.domain.enums;

/** 终局归属到“参与方”之后的结果；对局进行中为 NONE */
public enum Winner {

    HUMAN,
    OPPONENT,
    DRAW,
    NONE;

    public static Winner of(Party party) {
        return party == Party.HUMAN ? HUMAN : OPPONENT;
    }
}
