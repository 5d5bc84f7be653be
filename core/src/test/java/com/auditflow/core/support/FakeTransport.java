package com.auditflow.core.support;

import com.auditflow.core.api.IHttpTransport;
import com.auditflow.core.http.AuditRequest;
import com.auditflow.core.http.AuditResponse;
import com.auditflow.core.http.HttpCounters;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * 동기식 테스트 트랜스포트: runQueued() 가 호출 스레드에서 응답을 만들고 콜백을 부른다.
 * 콜백이 다시 queue() 한 요청도 같은 runQueued() 안에서 처리된다.
 */
public final class FakeTransport implements IHttpTransport {

    private final Deque<Object[]> queue = new ArrayDeque<>();
    private final List<Consumer<AuditResponse>> listeners = new CopyOnWriteArrayList<>();
    private Function<AuditRequest, AuditResponse> responder = FakeTransport::html;

    public final List<AuditRequest> sent = new ArrayList<>();
    public int runQueuedCalls = 0;
    public int resets = 0;
    private long requests = 0;
    private long responses = 0;
    private long timeouts = 0;

    public FakeTransport respond(Function<AuditRequest, AuditResponse> responder) {
        this.responder = responder;
        return this;
    }

    /** 200 text/html, 빈 문서 */
    public static AuditResponse html(AuditRequest req) {
        return html(req, "<html><body></body></html>");
    }

    public static AuditResponse html(AuditRequest req, String body) {
        return new AuditResponse(req, req.url(), 200,
                Map.of("Content-Type", List.of("text/html; charset=utf-8")), body, 1, false);
    }

    @Override
    public synchronized void queue(AuditRequest request, Consumer<AuditResponse> onComplete) {
        queue.addLast(new Object[]{request, onComplete});
    }

    @Override
    @SuppressWarnings("unchecked")
    public void runQueued() {
        runQueuedCalls++;
        while (true) {
            Object[] next;
            synchronized (this) {
                next = queue.pollFirst();
            }
            if (next == null) return;
            AuditRequest req = (AuditRequest) next[0];
            sent.add(req);
            requests++;
            AuditResponse resp = responder.apply(req);
            responses++;
            if (resp.timedOut()) timeouts++;
            for (Consumer<AuditResponse> l : listeners) l.accept(resp);
            Consumer<AuditResponse> cb = (Consumer<AuditResponse>) next[1];
            if (cb != null) cb.accept(resp);
        }
    }

    public synchronized int pending() {
        return queue.size();
    }

    @Override
    public void addResponseListener(Consumer<AuditResponse> listener) {
        listeners.add(listener);
    }

    @Override
    public void removeResponseListener(Consumer<AuditResponse> listener) {
        listeners.remove(listener);
    }

    public int listenerCount() {
        return listeners.size();
    }

    @Override
    public HttpCounters counters() {
        return new HttpCounters(requests, responses, timeouts, 1.0, responses, 0.0, 1.0, 1);
    }

    @Override
    public synchronized void reset() {
        resets++;
        queue.clear();
        listeners.clear();
        requests = 0;
        responses = 0;
        timeouts = 0;
    }
}
