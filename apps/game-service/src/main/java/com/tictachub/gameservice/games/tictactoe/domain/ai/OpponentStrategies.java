package com.tictachub.gameservice.games.tictactoe.domain.ai;

import com.tictachub.gameservice.engine.core.OpponentStrategy;
import com.tictachub.gameservice.games.tictactoe.domain.enums.GameMode;
import com.tictachub.gameservice.games.tictactoe.domain.model.Move;
import com.tictachub.gameservice.games.tictactoe.domain.model.TicTacToeState;

import java.util.Random;

/**
 * 按模式选择对手策略，在开新局时确定一次，对局中不再切换。
 * 固定模式 → 博弈树搜索；随机模式 → 随机落子。
 */
public final class OpponentStrategies {

    private OpponentStrategies() {
    }

    public static OpponentStrategy<TicTacToeState, Move> forMode(GameMode mode, Random random) {
        switch (mode) {
            case DETERMINISTIC: return new AdversarialSearch();
            case RANDOMIZED: return new RandomPlacement(random);
            default: throw new IllegalArgumentException("unsupported mode: " + mode);
        }
    }
}
