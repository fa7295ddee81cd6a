package com.tictachub.gameservice.games.tictactoe.domain.enums;

/** 对局模式：DETERMINISTIC=标记即执子方；RANDOMIZED=每步随机标记，阵营开局时分配 */
public enum GameMode {

    //人类固定 A，对手固定 B，对手用完整博弈树搜索
    DETERMINISTIC,
    //每一步（双方）都随机落下 A 或 B，胜负按开局分配的阵营归属
    RANDOMIZED
}
