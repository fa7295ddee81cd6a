package com.tictachub.gameservice.infrastructure.memory;

import com.tictachub.gameservice.games.tictactoe.domain.model.GameSession;
import com.tictachub.gameservice.games.tictactoe.domain.repository.GameSessionRepository;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存会话表，生命周期与进程一致，不做持久化。
 */
@Repository
public class InMemoryGameSessionRepository implements GameSessionRepository {

    private final Map<String, GameSession> sessions = new ConcurrentHashMap<>();

    @Override
    public Optional<GameSession> find(String sessionKey) {
        if (sessionKey == null || sessionKey.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.get(sessionKey));
    }

    @Override
    public void save(GameSession session) {
        sessions.put(session.getSessionKey(), session);
    }

    @Override
    public void delete(String sessionKey) {
        if (sessionKey == null || sessionKey.isBlank()) {
            return;
        }
        sessions.remove(sessionKey);
    }
}
