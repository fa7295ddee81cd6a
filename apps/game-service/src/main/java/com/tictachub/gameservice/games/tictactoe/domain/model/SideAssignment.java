package com.tictachub.gameservice.games.tictactoe.domain.model;

import com.tictachub.gameservice.games.tictactoe.domain.enums.Party;
import com.tictachub.gameservice.games.tictactoe.domain.enums.Side;

import java.util.Random;

/**
 * 阵营分配：人类与对手各自“拥有”哪个标记。只用于胜负归属。
 * 两个标记互斥且覆盖 {A, B}。
 */
public record SideAssignment(Side humanSide, Side opponentSide) {

    /** 固定模式下的分配：人类 A，对手 B */
    public static final SideAssignment FIXED = new SideAssignment(Side.A, Side.B);

    public SideAssignment {
        if (humanSide == null || opponentSide == null || humanSide == opponentSide) {
            throw new IllegalArgumentException("sides must be disjoint: " + humanSide + "/" + opponentSide);
        }
    }

    /** 两种分配各 50% */
    public static SideAssignment random(Random random) {
        return random.nextBoolean() ? FIXED : new SideAssignment(Side.B, Side.A);
    }

    public Side sideOf(Party party) {
        return party == Party.HUMAN ? humanSide : opponentSide;
    }

    public Party partyOf(Side side) {
        return side == humanSide ? Party.HUMAN : Party.OPPONENT;
    }
}
