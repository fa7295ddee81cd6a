package com.tictachub.gameservice.engine.core;

import java.util.Optional;

/**
 * 对手策略抽象：给定状态，选出一步并直接落到该状态上。
 * - 与 AiAdvisor 不同：这里不是“只建议”，选中后通过状态自身的落子入口执行，调用方无需再 apply 一次。
 * - 对局已结束或无空位时返回 empty。
 * - 泛型 S、M 保持与具体游戏解耦。
 */
public interface OpponentStrategy<S extends GameState, M> {

    Optional<M> chooseMove(S state);
}
