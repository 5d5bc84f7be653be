package com.auditflow.core.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/** "{group}-{n}" 데몬 스레드. 잡히지 않은 예외는 stderr 대신 로그로 */
public final class NamedThreadFactory implements ThreadFactory {
    private static final Logger LOG = LoggerFactory.getLogger(NamedThreadFactory.class);

    private final String group;
    private final AtomicInteger counter = new AtomicInteger();

    public NamedThreadFactory(String group) {
        if (group == null || group.isBlank()) throw new IllegalArgumentException("group");
        this.group = group;
    }

    @Override public Thread newThread(Runnable task) {
        Thread worker = new Thread(task, group + "-" + counter.incrementAndGet());
        worker.setDaemon(true);
        worker.setUncaughtExceptionHandler((th, e) ->
                LOG.error("Uncaught failure on {}", th.getName(), e));
        return worker;
    }

    /** 지금까지 만든 스레드 수 */
    public int created() {
        return counter.get();
    }
}
