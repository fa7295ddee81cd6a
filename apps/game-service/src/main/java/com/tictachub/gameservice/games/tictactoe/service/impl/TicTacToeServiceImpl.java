package com.tictachub.gameservice.games.tictactoe.service.impl;

import com.tictachub.gameservice.games.tictactoe.domain.ai.OpponentStrategies;
import com.tictachub.gameservice.games.tictactoe.domain.constants.GameMessages;
import com.tictachub.gameservice.games.tictactoe.domain.enums.GameMode;
import com.tictachub.gameservice.games.tictactoe.domain.model.GameSession;
import com.tictachub.gameservice.games.tictactoe.domain.model.GameSnapshot;
import com.tictachub.gameservice.games.tictactoe.domain.model.Move;
import com.tictachub.gameservice.games.tictactoe.domain.model.MoveResult;
import com.tictachub.gameservice.games.tictactoe.domain.model.SeriesView;
import com.tictachub.gameservice.games.tictactoe.domain.model.SideAssignment;
import com.tictachub.gameservice.games.tictactoe.domain.model.TicTacToeState;
import com.tictachub.gameservice.games.tictactoe.domain.repository.GameSessionRepository;
import com.tictachub.gameservice.games.tictactoe.service.TicTacToeService;
import com.tictachub.gameservice.platform.config.TicTacToeProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;


@Slf4j
@Service
@RequiredArgsConstructor
public class TicTacToeServiceImpl implements TicTacToeService {

    private final GameSessionRepository sessionRepo;
    private final TicTacToeProperties properties;
    private final Random random;

    // ====== 会话锁：同一会话 key 上的操作串行执行 ======
    // 只有建局路径（play/startNewGame/newGame）创建锁；endSession 持锁时移除
    private final Map<String, Object> locks = new ConcurrentHashMap<>();

    /**
     * 以指定模式开新局
     */
    @Override
    public GameSnapshot startNewGame(String sessionKey, GameMode mode) {
        GameMode m = (mode == null ? properties.getDefaultMode() : mode);
        return locked(sessionKey, true, () -> GameSnapshot.of(begin(sessionKey, m)));
    }

    /**
     * 沿用上一局模式开新局
     */
    @Override
    public GameSnapshot newGame(String sessionKey) {
        return locked(sessionKey, true, () -> {
            GameMode m = sessionRepo.find(sessionKey)
                    .map(s -> s.getState().getMode())
                    .orElse(properties.getDefaultMode());
            return GameSnapshot.of(begin(sessionKey, m));
        });
    }

    /**
     * 人类落子 + 对手应答
     */
    @Override
    public PlayResult play(String sessionKey, int row, int col) {
        return locked(sessionKey, true, () -> {
            GameSession session = sessionRepo.find(sessionKey)
                    .orElseGet(() -> begin(sessionKey, properties.getDefaultMode()));
            TicTacToeState s = session.getState();

            // 1) 人类这一步
            MoveResult human = s.apply(row, col);
            if (!human.isApplied()) {
                log.debug("落子被拒 session={} ({},{}) reason={}", sessionKey, row, col, human.rejection().message());
                return new PlayResult(human, null, GameSnapshot.of(session));
            }
            log.debug("人类落子 session={} move={} outcome={}", sessionKey, human.move(), human.outcome());

            // 2) 对局未结束则对手应答
            Move opponent = null;
            if (!s.getOutcome().isOver()) {
                opponent = session.getStrategy().chooseMove(s).orElse(null);
                log.debug("对手落子 session={} move={} outcome={}", sessionKey, opponent, s.getOutcome());
            }

            // 3) 终局统计
            if (session.recordIfFinished()) {
                log.info("对局结束 session={} gameId={} outcome={} winner={} board={}",
                        sessionKey, session.getGameId(), s.getOutcome(), s.resolveWinner(), s.getBoard());
            }
            return new PlayResult(human, opponent, GameSnapshot.of(session));
        });
    }

    /**
     * 重新分配阵营
     */
    @Override
    public SideAssignment reassignSides(String sessionKey) {
        return locked(sessionKey, false, () -> {
            GameSession session = getOrThrow(sessionKey);
            SideAssignment sides = session.getState().assignSidesRandomly();
            log.info("重新分配阵营 session={} human={} opponent={}",
                    sessionKey, sides.humanSide(), sides.opponentSide());
            return sides;
        });
    }

    /**
     * 同一盘重开（保留模式与阵营）
     */
    @Override
    public GameSnapshot restart(String sessionKey) {
        return locked(sessionKey, false, () -> {
            GameSession session = getOrThrow(sessionKey);
            session.restart();
            log.info("重开对局 session={} gameId={}", sessionKey, session.getGameId());
            return GameSnapshot.of(session);
        });
    }

    @Override
    public GameSnapshot snapshot(String sessionKey) {
        return locked(sessionKey, false, () -> GameSnapshot.of(getOrThrow(sessionKey)));
    }

    @Override
    public SeriesView getSeries(String sessionKey) {
        return locked(sessionKey, false, () -> getOrThrow(sessionKey).seriesView());
    }

    /**
     * 结束并移除会话；会话不存在时直接返回
     */
    @Override
    public void endSession(String sessionKey) {
        requireKey(sessionKey);
        while (true) {
            Object lock = locks.get(sessionKey);
            if (lock == null) {
                return;
            }
            synchronized (lock) {
                // 等锁期间已被其他 endSession 移除，重新取
                if (locks.get(sessionKey) != lock) continue;
                sessionRepo.delete(sessionKey);
                locks.remove(sessionKey, lock);
            }
            log.info("会话结束 session={}", sessionKey);
            return;
        }
    }

    /** 当前持有的会话锁数量 */
    int lockCount() {
        return locks.size();
    }

    // ----------- private helpers -----------

    /**
     * 在会话锁内执行 action。
     * create=false 时锁不存在即视为会话不存在；拿到锁后若它已被 endSession 移除则重试，
     * 保证同一 key 同一时刻只有一把有效锁。
     */
    private <T> T locked(String sessionKey, boolean create, Supplier<T> action) {
        requireKey(sessionKey);
        while (true) {
            Object lock = create
                    ? locks.computeIfAbsent(sessionKey, k -> new Object())
                    : locks.get(sessionKey);
            if (lock == null) {
                throw new IllegalArgumentException(GameMessages.formatSessionNotFound(sessionKey));
            }
            synchronized (lock) {
                if (locks.get(sessionKey) == lock) {
                    return action.get();
                }
            }
        }
    }

    /**
     * 开新局：已有会话则整体替换 state/strategy（保留战绩），否则新建会话
     */
    private GameSession begin(String sessionKey, GameMode mode) {
        TicTacToeState state = TicTacToeState.of(mode, random);
        GameSession session = sessionRepo.find(sessionKey).orElse(null);
        if (session == null) {
            session = new GameSession(sessionKey, state, OpponentStrategies.forMode(mode, random));
        } else {
            session.begin(state, OpponentStrategies.forMode(mode, random));
        }
        sessionRepo.save(session);
        log.info("新开对局 session={} gameId={} index={} mode={} human={} opponent={}",
                sessionKey, session.getGameId(), session.getIndex(), mode,
                state.getSides().humanSide(), state.getSides().opponentSide());
        return session;
    }

    private GameSession getOrThrow(String sessionKey) {
        return sessionRepo.find(sessionKey)
                .orElseThrow(() -> new IllegalArgumentException(GameMessages.formatSessionNotFound(sessionKey)));
    }

    private static void requireKey(String sessionKey) {
        if (sessionKey == null || sessionKey.isBlank()) {
            throw new IllegalArgumentException(GameMessages.formatSessionNotFound(sessionKey));
        }
    }
}
