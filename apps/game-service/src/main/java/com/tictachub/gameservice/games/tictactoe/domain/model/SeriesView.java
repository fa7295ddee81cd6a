package com.tictachub.gameservice.games.tictactoe.domain.model;

import com.tictachub.gameservice.games.tictactoe.domain.enums.Winner;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 会话战绩（Series）概要视图：
 * 用于展示比分、第几盘、当前局 ID。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SeriesView {
    /** 当前第几盘（从 1 开始） */
    private int index;

    /** 当前局唯一ID（gameId） */
    private String gameId;

    /** 人类胜场 */
    private int humanWins;

    /** 对手胜场 */
    private int opponentWins;

    /** 平局数 */
    private int draws;

    /** 当前局是否结束 */
    private boolean over;

    /** 当前局胜方（进行中为 NONE） */
    private Winner winner;
}
