package com.tictachub.gameservice.games.tictactoe.domain.constants;

/**
 * 井字棋相关的消息常量
 * 统一管理落子拒绝原因与调用方错误提示，避免硬编码
 */
public final class GameMessages {

    private GameMessages() {
        // 工具类，禁止实例化
    }

    // ========== 落子拒绝 ==========

    /** 对局已结束 */
    public static final String GAME_OVER = "对局已结束，请开始新的一局";

    /** 坐标越界 */
    public static final String OUT_OF_BOUNDS = "坐标越界，行列必须在 0-2 之间";

    /** 目标格已占用 */
    public static final String CELL_OCCUPIED = "该格已有标记，请选择空格";

    // ========== 模式约定 ==========

    /** 阵营分配只在随机模式有效 */
    public static final String SIDES_ONLY_IN_RANDOMIZED = "只有随机模式可以分配阵营";

    /** 对局开始后不允许重新分配阵营 */
    public static final String SIDES_AFTER_FIRST_MOVE = "对局已开始，不能重新分配阵营";

    /** 博弈树搜索只支持固定模式 */
    public static final String SEARCH_ONLY_IN_DETERMINISTIC = "博弈树搜索只支持固定模式";

    // ========== 会话 ==========

    /** 会话不存在 */
    public static final String SESSION_NOT_FOUND = "会话不存在: %s";

    /**
     * 格式化会话不存在消息
     */
    public static String formatSessionNotFound(String sessionKey) {
        return String.format(SESSION_NOT_FOUND, sessionKey);
    }
}
