package com.auditflow.core.framework;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;

/**
 * 토큰 카운팅 방식의 협조적 일시정지.
 *  - pause(token) 는 토큰 횟수를 1 올리고, resume(token) 은 같은 토큰만 1 내린다
 *  - 어떤 토큰이든 남아 있으면 paused
 *  - awaitIfPaused() 는 정지 중이면 최대 pollMillis 간격으로 다시 확인하며 대기
 */
public final class PauseGate {

    public static final long DEFAULT_POLL_MILLIS = 1000L;

    private final Map<Object, Integer> tokens = new HashMap<>(); // guarded by this
    private final long pollMillis;

    public PauseGate() {
        this(DEFAULT_POLL_MILLIS);
    }

    public PauseGate(long pollMillis) {
        if (pollMillis <= 0) throw new IllegalArgumentException("pollMillis must be > 0");
        this.pollMillis = pollMillis;
    }

    public synchronized void pause(Object token) {
        Objects.requireNonNull(token, "token");
        tokens.merge(token, 1, Integer::sum);
    }

    /** @return 해당 토큰이 없어서 아무 일도 하지 않았으면 false */
    public synchronized boolean resume(Object token) {
        if (token == null) return false;
        Integer c = tokens.get(token);
        if (c == null) return false;
        if (c <= 1) tokens.remove(token); else tokens.put(token, c - 1);
        notifyAll();
        return true;
    }

    public synchronized boolean isPaused() {
        return !tokens.isEmpty();
    }

    /** 남은 pause 요청 총 횟수 */
    public synchronized int pending() {
        int n = 0;
        for (int c : tokens.values()) n += c;
        return n;
    }

    public synchronized void clear() {
        tokens.clear();
        notifyAll();
    }

    /**
     * @throws CancellationException 대기 중 인터럽트(인터럽트 플래그는 복원)
     */
    public void awaitIfPaused() {
        synchronized (this) {
            while (!tokens.isEmpty()) {
                try {
                    wait(pollMillis);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new CancellationException("Interrupted while paused");
                }
            }
        }
    }
}
