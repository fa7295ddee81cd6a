package com.tictachub.gameservice.games.tictactoe.domain.model;

import com.tictachub.gameservice.engine.core.OpponentStrategy;
import com.tictachub.gameservice.games.tictactoe.domain.enums.Winner;
import lombok.Data;
import lombok.Getter;

import java.util.UUID;

/**
 * 一个会话（一个聊天/一个用户）名下的对局实体。
 * - 持有当前盘 state 以及开局时绑定的对手策略；
 * - 开新局时整体替换 state/strategy，不做合并；
 * - series 记录该会话的累计战绩，跨局保留。
 * 不做加锁：同一会话的串行化由服务层负责。
 */
@Getter
public class GameSession {

    private final String sessionKey;
    private final Series series;

    private String gameId;                 // UUID
    private int index;                     // 第几盘（从 1 开始）
    private TicTacToeState state;
    private OpponentStrategy<TicTacToeState, Move> strategy;
    /** 当前盘结果是否已计入 series，避免重复统计 */
    private boolean recorded;

    public GameSession(String sessionKey, TicTacToeState state, OpponentStrategy<TicTacToeState, Move> strategy) {
        this.sessionKey = sessionKey;
        this.series = new Series();
        this.index = 0;
        begin(state, strategy);
    }

    /** 开新一盘：换 state/strategy 与 gameId，局号自增 */
    public void begin(TicTacToeState state, OpponentStrategy<TicTacToeState, Move> strategy) {
        this.state = state;
        this.strategy = strategy;
        this.gameId = UUID.randomUUID().toString();
        this.index++;
        this.recorded = false;
    }

    /** 同一盘重开（state.reset()），允许重新计分 */
    public void restart() {
        state.reset();
        recorded = false;
    }

    /**
     * 若当前盘已结束且尚未统计，则计入 series。
     *
     * @return 本次是否新计入
     */
    public boolean recordIfFinished() {
        if (recorded || !state.getOutcome().isOver()) {
            return false;
        }
        Winner w = state.resolveWinner();
        switch (w) {
            case HUMAN: series.incHumanWins(); break;
            case OPPONENT: series.incOpponentWins(); break;
            default: series.incDraws(); break;
        }
        recorded = true;
        return true;
    }

    public SeriesView seriesView() {
        return new SeriesView(index, gameId, series.getHumanWins(), series.getOpponentWins(),
                series.getDraws(), state.getOutcome().isOver(), state.resolveWinner());
    }

    // ---- 会话内对局信息 ----
    @Data
    public static class Series {
        // 人类胜局数
        private int humanWins;
        // 对手胜局数
        private int opponentWins;
        // 平局局数
        private int draws;

        public void incHumanWins()    { this.humanWins++; }
        public void incOpponentWins() { this.opponentWins++; }
        public void incDraws()        { this.draws++; }
    }
}
