package com.tictachub.gameservice.games.tictactoe.domain.repository;

import com.tictachub.gameservice.games.tictactoe.domain.model.GameSession;

import java.util.Optional;

/**
 * 会话仓储：会话 key → 该会话唯一的对局实体。
 */
public interface GameSessionRepository {

    Optional<GameSession> find(String sessionKey);

    void save(GameSession session);

    void delete(String sessionKey);
}
