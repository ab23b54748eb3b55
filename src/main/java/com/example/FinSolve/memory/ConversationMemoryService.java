package com.example.FinSolve.memory;

import com.example.FinSolve.config.FinSolveProperties;
import com.example.FinSolve.model.SourceCitation;
import com.example.FinSolve.model.Turn;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Per-user conversation memory held in process.
 *
 * Each user has one {@link Session} with its own lock: appends and reads for the same user
 * serialize, different users never share a lock. Sessions live until cleared or until the
 * process stops; nothing is written to disk. A cleared session is closed under its lock, so an
 * append that looked it up before the clear is retried against the user's new session.
 */
@Service
public class ConversationMemoryService {

    private static final Logger log = LoggerFactory.getLogger(ConversationMemoryService.class);

    private final Map<String, Session> sessions;
    private final int windowSize;
    private final Clock clock;

    @Autowired
    public ConversationMemoryService(FinSolveProperties properties, Clock clock) {
        this(new ConcurrentHashMap<>(), properties.getMemory().getWindowSize(), clock);
    }

    ConversationMemoryService(Map<String, Session> sessions, int windowSize, Clock clock) {
        if (windowSize <= 0) {
            throw new IllegalArgumentException("Memory window size must be positive, got " + windowSize);
        }
        this.sessions = sessions;
        this.windowSize = windowSize;
        this.clock = clock;
    }

    public int windowSize() {
        return windowSize;
    }

    /**
     * Append a prepared turn. Rejects a turn older than the newest one already stored.
     */
    public void append(String userId, Turn turn) {
        Objects.requireNonNull(turn, "turn");
        while (!sessionFor(userId).append(turn)) {
            log.debug("Session for user={} was cleared during append, retrying", userId);
        }
    }

    /**
     * Append a turn stamped at the moment it enters the session, so session order is
     * the order in which callers finished generating.
     */
    public Turn appendCompleted(String userId, String query, String answer, List<SourceCitation> sources) {
        Turn turn = null;
        while (turn == null) {
            // null: the session was cleared after lookup; the turn goes to the fresh one
            turn = sessionFor(userId).appendStamped(
                    clock.instant(),
                    stamp -> new Turn(query, answer, sources, stamp)
            );
        }
        log.debug("Appended turn for user={} at {}", userId, turn.timestamp());
        return turn;
    }

    /**
     * The last {@code maxTurns} turns for the user, oldest first.
     */
    public List<Turn> recent(String userId, int maxTurns) {
        Objects.requireNonNull(userId, "userId");
        if (maxTurns <= 0) {
            return List.of();
        }
        Session session = sessions.get(userId);
        if (session == null) {
            return List.of();
        }
        return session.recent(maxTurns);
    }

    public void clear(String userId) {
        Objects.requireNonNull(userId, "userId");
        Session removed = sessions.remove(userId);
        if (removed != null) {
            removed.close();
            log.info("Cleared conversation memory for user={}", userId);
        } else {
            log.info("No conversation memory found for user={}", userId);
        }
    }

    public int sessionCount() {
        return sessions.size();
    }

    @PreDestroy
    public void clearAll() {
        int count = sessions.size();
        sessions.values().forEach(Session::close);
        sessions.clear();
        log.info("Dropped {} conversation sessions", count);
    }

    /**
     * Render history text for the prompt as "User:/Assistant:" lines.
     */
    public String renderHistory(List<Turn> turns) {
        if (turns == null || turns.isEmpty()) {
            return "(no prior conversation)";
        }
        return turns.stream()
                .map(t -> "User: " + t.query() + "\nAssistant: " + t.answer())
                .collect(Collectors.joining("\n"));
    }

    private Session sessionFor(String userId) {
        Objects.requireNonNull(userId, "userId");
        return sessions.computeIfAbsent(userId, id -> {
            log.info("Created conversation memory for user={}", id);
            return new Session(windowSize);
        });
    }
}
