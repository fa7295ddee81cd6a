package com.tictachub.gameservice.games.tictactoe.service;

import com.tictachub.gameservice.games.tictactoe.domain.enums.GameMode;
import com.tictachub.gameservice.games.tictactoe.domain.model.GameSnapshot;
import com.tictachub.gameservice.games.tictactoe.domain.model.Move;
import com.tictachub.gameservice.games.tictactoe.domain.model.MoveResult;
import com.tictachub.gameservice.games.tictactoe.domain.model.SeriesView;
import com.tictachub.gameservice.games.tictactoe.domain.model.SideAssignment;

/**
 * 井字棋会话服务：每个会话 key 对应一盘独立对局。
 * 同一会话上的调用在实现内串行化；不同会话之间不共享可变状态。
 */
public interface TicTacToeService {

    /** 以指定模式开新局（mode 为 null 时用配置的默认模式）；随机模式会重新分配阵营 */
    GameSnapshot startNewGame(String sessionKey, GameMode mode);

    /** 沿用上一局模式开新局（会话还没有对局时用默认模式） */
    GameSnapshot newGame(String sessionKey);

    /**
     * 一站式下子：
     *   - 会话不存在时按默认模式建局；
     *   - 先执行人类这一步，被拒则原样返回拒绝结果，对手不走；
     *   - 对局仍在进行则由开局时绑定的策略替对手走一步；
     *   - 结束的对局计入战绩（每局只计一次）。
     */
    PlayResult play(String sessionKey, int row, int col);

    /**
     * 重新分配阵营（仅随机模式、尚未落子）
     * @throws com.tictachub.gameservice.games.tictactoe.domain.exception.InvalidModeOperationException 模式不符或对局已开始
     */
    SideAssignment reassignSides(String sessionKey);

    /** 同一盘重开：清盘，保留模式与阵营 */
    GameSnapshot restart(String sessionKey);

    /** 只读快照（渲染用） */
    GameSnapshot snapshot(String sessionKey);

    /** 返回人类/对手/和统计 */
    SeriesView getSeries(String sessionKey);

    /** 结束并移除会话 */
    void endSession(String sessionKey);

    /**
     * @param human    人类这一步的结果
     * @param opponent 对手应答的一步；被拒、终局或无空位时为 null
     * @param snapshot 两步之后的最新快照
     */
    record PlayResult(MoveResult human, Move opponent, GameSnapshot snapshot) {}
}
