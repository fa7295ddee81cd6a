package com.tictachub.gameservice.infrastructure.random;

import com.tictachub.gameservice.platform.config.TicTacToeProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Random;

/**
 * 对局随机源：随机模式的标记、阵营分配、随机落子共用这一个实例。
 * 配置了 tictactoe.random-seed 时使用固定种子。
 */
@Slf4j
@Configuration
public class RandomConfig {

	@Bean("gameRandom")
	public Random gameRandom(TicTacToeProperties properties) {
		Long seed = properties.getRandomSeed();
		if (seed == null) {
			return new Random();
		}
		log.info("使用固定随机种子: {}", seed);
		return new Random(seed);
	}
}
