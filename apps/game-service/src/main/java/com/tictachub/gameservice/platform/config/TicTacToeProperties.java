package com.tictachub.gameservice.platform.config;

import com.tictachub.gameservice.games.tictactoe.domain.enums.GameMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 井字棋服务相关配置。
 *
 * 支持通过 application.yml 或环境变量覆盖。
 */
@Component
@ConfigurationProperties(prefix = "tictactoe")
public class TicTacToeProperties {

    /**
     * 会话首次开局（或未指定模式）时使用的模式
     */
    private GameMode defaultMode = GameMode.DETERMINISTIC;

    /**
     * 随机源种子；不配置则每次启动不同。测试里固定它以复现随机模式对局
     */
    private Long randomSeed;

    // getters and setters
    public GameMode getDefaultMode() {
        return defaultMode;
    }

    public void setDefaultMode(GameMode defaultMode) {
        this.defaultMode = defaultMode;
    }

    public Long getRandomSeed() {
        return randomSeed;
    }

    public void setRandomSeed(Long randomSeed) {
        this.randomSeed = randomSeed;
    }
}
