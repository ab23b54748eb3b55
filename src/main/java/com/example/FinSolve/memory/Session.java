package com.example.FinSolve.memory;

import com.example.FinSolve.model.Turn;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Ordered, bounded turn buffer for one user. All access goes through the session lock.
 */
final class Session {

    private final int capacity;
    private final Deque<Turn> turns;
    private final ReentrantLock lock = new ReentrantLock();
    private boolean closed;

    Session(int capacity) {
        this.capacity = capacity;
        this.turns = new ArrayDeque<>(capacity);
    }

    /**
     * @return false when the session was closed and the turn was not stored
     */
    boolean append(Turn turn) {
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            appendLocked(turn);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Builds the turn while holding the lock, so its timestamp is never older than the newest turn.
     *
     * @return the stored turn, or null when the session was closed
     */
    Turn appendStamped(Instant now, Function<Instant, Turn> factory) {
        lock.lock();
        try {
            if (closed) {
                return null;
            }
            Turn last = turns.peekLast();
            Instant stamp = now;
            if (last != null && !stamp.isAfter(last.timestamp())) {
                stamp = last.timestamp().plusNanos(1);
            }
            Turn turn = factory.apply(stamp);
            appendLocked(turn);
            return turn;
        } finally {
            lock.unlock();
        }
    }

    List<Turn> recent(int maxTurns) {
        lock.lock();
        try {
            int skip = Math.max(0, turns.size() - maxTurns);
            List<Turn> window = new ArrayList<>(turns.size() - skip);
            int idx = 0;
            for (Turn turn : turns) {
                if (idx++ >= skip) {
                    window.add(turn);
                }
            }
            return List.copyOf(window);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks the session as removed from memory. Later appends are refused so the caller
     * can retry against the user's current session.
     */
    void close() {
        lock.lock();
        try {
            closed = true;
            turns.clear();
        } finally {
            lock.unlock();
        }
    }

    private void appendLocked(Turn turn) {
        Turn last = turns.peekLast();
        if (last != null && turn.timestamp().isBefore(last.timestamp())) {
            throw new IllegalArgumentException(
                    "Turn at " + turn.timestamp() + " is older than the newest turn at " + last.timestamp());
        }
        turns.addLast(turn);
        while (turns.size() > capacity) {
            turns.removeFirst();
        }
    }
}
