package com.auditflow.core.framework;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * FIFO 큐 + 누적 push 횟수. 누적 횟수는 통계용이며 reset() 외에는 줄지 않는다.
 * HTTP 콜백 스레드(생산자)와 드레인 루프(소비자)가 동시에 접근한다.
 */
final class CountingQueue<T> {

    private final Queue<T> queue = new ConcurrentLinkedQueue<>();
    private final AtomicLong totalPushed = new AtomicLong();

    void push(T item) {
        queue.add(item);
        totalPushed.incrementAndGet();
    }

    T poll() {
        return queue.poll();
    }

    boolean isEmpty() {
        return queue.isEmpty();
    }

    int size() {
        return queue.size();
    }

    long totalPushed() {
        return totalPushed.get();
    }

    void reset() {
        queue.clear();
        totalPushed.set(0);
    }
}
