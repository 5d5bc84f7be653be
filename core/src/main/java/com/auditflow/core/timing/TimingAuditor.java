package com.auditflow.core.timing;

import com.auditflow.core.api.Resettable;
import com.auditflow.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * 타이밍 채널 점검 공유 상태.
 *  - 모듈은 페이지 감사 중 schedule() 로 연산만 적재하고,
 *    일반 감사가 끝난 뒤 오케스트레이터가 run() 으로 일괄 실행한다.
 *  - total/pending 은 진행률 계산용. running 은 run() 이 한 번 시작되면 reset 전까지 유지된다.
 */
public final class TimingAuditor implements Resettable {

    private static final Logger LOG = LoggerFactory.getLogger(TimingAuditor.class);
    private static final StructuredLog SLOG = StructuredLog.get(TimingAuditor.class);

    private final Set<String> loadedModules = ConcurrentHashMap.newKeySet();
    private final Queue<TimingOperation> operations = new ConcurrentLinkedQueue<>();
    private final AtomicInteger total = new AtomicInteger();
    private final AtomicInteger pending = new AtomicInteger();
    private volatile boolean running = false;

    /** 연산 없이 모듈만 등록(진행률 50/50 분할 대상이 된다) */
    public void register(String module) {
        if (module != null && !module.isBlank()) loadedModules.add(module);
    }

    public void schedule(String module, String action, Runnable task) {
        schedule(new TimingOperation(module, action, task));
    }

    public void schedule(TimingOperation op) {
        loadedModules.add(op.module());
        operations.add(op);
        total.incrementAndGet();
        pending.incrementAndGet();
    }

    public boolean hasLoadedModules() { return !loadedModules.isEmpty(); }
    public List<String> loadedModules() { return List.copyOf(loadedModules); }
    public boolean hasPending() { return !operations.isEmpty(); }
    public boolean isRunning() { return running; }
    public int totalOperations() { return total.get(); }
    public int pendingOperations() { return pending.get(); }

    /**
     * 적재된 연산을 순서대로 실행.
     * 연산 도중 새로 적재된 연산도 같은 배치에서 처리한다.
     *
     * @param beforeEach 각 연산 직전(현재 URL 갱신 등)
     * @param afterEach  각 연산 직후(harvest 등)
     */
    public void run(Consumer<TimingOperation> beforeEach, Runnable afterEach) {
        running = true;
        LOG.info("Timing batch start: modules={}, operations={}", loadedModules.size(), pending.get());
        SLOG.info("timing-start", "modules", loadedModules.size(), "operations", pending.get());

        TimingOperation op;
        while ((op = operations.poll()) != null) {
            if (beforeEach != null) beforeEach.accept(op);
            try {
                op.task().run();
            } catch (RuntimeException e) {
                LOG.warn("Timing operation failed: module={}, action={}", op.module(), op.action(), e);
                SLOG.warn("timing-fault", "module", op.module(), "action", op.action(), "error", e.toString());
            } finally {
                pending.decrementAndGet();
            }
            if (afterEach != null) afterEach.run();
        }
        LOG.info("Timing batch done: total={}", total.get());
    }

    @Override
    public void reset() {
        loadedModules.clear();
        operations.clear();
        total.set(0);
        pending.set(0);
        running = false;
    }
}
