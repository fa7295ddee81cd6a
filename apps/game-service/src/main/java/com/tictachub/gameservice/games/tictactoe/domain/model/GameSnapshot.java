package com.tictachub.gameservice.games.tictactoe.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.tictachub.gameservice.games.tictactoe.domain.enums.GameMode;
import com.tictachub.gameservice.games.tictactoe.domain.enums.Party;
import com.tictachub.gameservice.games.tictactoe.domain.enums.Side;
import com.tictachub.gameservice.games.tictactoe.domain.enums.Winner;
import com.tictachub.gameservice.games.tictactoe.domain.rule.Outcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 渲染用的只读快照。
 * 棋盘总是展示真实标记（随机模式也一样），延后揭晓的只是“哪个标记属于谁”的含义。
 * 不持有任何可变内部状态。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GameSnapshot {

    private String sessionKey;
    private String gameId;
    private int index;
    private GameMode mode;

    /** 按行的字符视图："A.B" 这样的三行 */
    private String[] board;

    private Party current;
    private Outcome outcome;
    private Winner winner;

    private Side humanSide;
    private Side opponentSide;

    /** 上一手，未落子时不输出 */
    private Move lastMove;

    private SeriesView series;

    public static GameSnapshot of(GameSession session) {
        TicTacToeState s = session.getState();
        char[][] v = s.getBoard().view();
        String[] rows = new String[Board.SIZE];
        for (int i = 0; i < Board.SIZE; i++) rows[i] = new String(v[i]);
        return GameSnapshot.builder()
                .sessionKey(session.getSessionKey())
                .gameId(session.getGameId())
                .index(session.getIndex())
                .mode(s.getMode())
                .board(rows)
                .current(s.getCurrent())
                .outcome(s.getOutcome())
                .winner(s.resolveWinner())
                .humanSide(s.getSides().humanSide())
                .opponentSide(s.getSides().opponentSide())
                .lastMove(s.getLastMove())
                .series(session.seriesView())
                .build();
    }
}
