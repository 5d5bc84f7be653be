package com.auditflow.core.http;

import com.auditflow.core.api.IHttpTransport;
import com.auditflow.core.model.ScanOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * java.net.http 기반 비동기 트랜스포트.
 *  - queue(): 요청 적재만 한다(전송 X)
 *  - runQueued(): 동시성 상한(semaphore) 안에서 전송, 콜백이 새로 적재한 요청까지 모두 끝나면 반환
 *  - 완료 콜백은 HttpClient 실행기 스레드에서 호출될 수 있다
 */
public class AsyncHttpTransport implements IHttpTransport {

    private static final Logger LOG = LoggerFactory.getLogger(AsyncHttpTransport.class);

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        CompletableFuture<HttpResponse<String>> send(HttpRequest req);
    }

    private record Pending(AuditRequest request, Consumer<AuditResponse> onComplete) {}

    private final ScanOptions options;
    private final HttpSender sender;
    private final int maxConcurrency;
    private final Semaphore permits;

    private final Object lock = new Object();
    private final Deque<Pending> queue = new ArrayDeque<>(); // guarded by lock
    private int inFlight = 0;                                // guarded by lock

    private final List<Consumer<AuditResponse>> listeners = new CopyOnWriteArrayList<>();

    // 누적 카운터
    private final AtomicLong requestCount = new AtomicLong();
    private final AtomicLong responseCount = new AtomicLong();
    private final AtomicLong timeoutCount = new AtomicLong();
    private final AtomicLong totalResponseTimeMs = new AtomicLong();

    // 현재 버스트(= 마지막 runQueued 호출) 카운터
    private final AtomicLong burstResponseCount = new AtomicLong();
    private final AtomicLong burstResponseTimeMs = new AtomicLong();
    private volatile long burstStartNanos = System.nanoTime();

    public AsyncHttpTransport(ScanOptions options) {
        this(options, defaultSender(options));
    }

    public AsyncHttpTransport(ScanOptions options, HttpSender sender) {
        this.options = Objects.requireNonNull(options, "options");
        this.sender = Objects.requireNonNull(sender, "sender");
        this.maxConcurrency = Math.max(1, options.getHttpConcurrency());
        this.permits = new Semaphore(maxConcurrency);
    }

    private static HttpSender defaultSender(ScanOptions options) {
        HttpClient client = HttpClient.newBuilder()
                .followRedirects(options.isFollowRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .connectTimeout(options.getTimeout())
                .build();
        return req -> client.sendAsync(req, HttpResponse.BodyHandlers.ofString());
    }

    @Override
    public void queue(AuditRequest request, Consumer<AuditResponse> onComplete) {
        Objects.requireNonNull(request, "request");
        synchronized (lock) {
            queue.addLast(new Pending(request, onComplete == null ? r -> {} : onComplete));
            lock.notifyAll();
        }
    }

    @Override
    public void runQueued() {
        burstStartNanos = System.nanoTime();
        burstResponseCount.set(0);
        burstResponseTimeMs.set(0);

        try {
            Pending next;
            while ((next = takeNext()) != null) {
                dispatch(next);
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while harvesting HTTP responses");
        }
    }

    /** 전송 슬롯을 확보한 뒤 다음 요청을 꺼낸다. 큐도 비고 진행 중 요청도 없으면 null */
    private Pending takeNext() throws InterruptedException {
        permits.acquire();
        boolean handedOff = false;
        try {
            synchronized (lock) {
                while (queue.isEmpty() && inFlight > 0) {
                    lock.wait(TimeUnit.SECONDS.toMillis(1));
                }
                Pending p = queue.pollFirst();
                if (p != null) {
                    inFlight++;
                    handedOff = true;
                }
                return p;
            }
        } finally {
            if (!handedOff) permits.release();
        }
    }

    private void dispatch(Pending p) {
        final long t0 = System.nanoTime();
        requestCount.incrementAndGet();

        CompletableFuture<HttpResponse<String>> future;
        try {
            future = sender.send(toHttpRequest(p.request()));
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }

        future.whenComplete((resp, err) -> {
            long ms = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);
            AuditResponse out;
            if (err != null || resp == null) {
                Throwable cause = unwrap(err);
                boolean timedOut = cause instanceof HttpTimeoutException;
                if (timedOut) timeoutCount.incrementAndGet();
                LOG.debug("Request failed: {} {} ({})", p.request().method(), p.request().url(),
                        cause == null ? "no response" : cause.toString());
                out = AuditResponse.failure(p.request(), ms, timedOut);
            } else {
                out = new AuditResponse(p.request(), resp.uri(), resp.statusCode(),
                        resp.headers().map(), resp.body(), ms, false);
            }
            complete(p, out);
        });
    }

    private void complete(Pending p, AuditResponse out) {
        try {
            responseCount.incrementAndGet();
            totalResponseTimeMs.addAndGet(out.timeMs());
            burstResponseCount.incrementAndGet();
            burstResponseTimeMs.addAndGet(out.timeMs());

            for (Consumer<AuditResponse> l : listeners) {
                try {
                    l.accept(out);
                } catch (RuntimeException e) {
                    LOG.warn("Response listener failed for {}", out.request().url(), e);
                }
            }
            try {
                p.onComplete().accept(out);
            } catch (RuntimeException e) {
                LOG.warn("Response callback failed for {}", out.request().url(), e);
            }
        } finally {
            permits.release();
            synchronized (lock) {
                inFlight--;
                lock.notifyAll();
            }
        }
    }

    private HttpRequest toHttpRequest(AuditRequest r) {
        HttpRequest.Builder b = HttpRequest.newBuilder(r.url())
                .timeout(options.getTimeout());
        if (options.getUserAgent() != null) b.header("User-Agent", options.getUserAgent());
        for (Map.Entry<String, String> h : r.headers().entrySet()) {
            b.header(h.getKey(), h.getValue());
        }
        HttpRequest.BodyPublisher body = (r.body() == null)
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(r.body());
        return b.method(r.method(), body).build();
    }

    private static Throwable unwrap(Throwable t) {
        while (t instanceof CompletionException && t.getCause() != null) t = t.getCause();
        return t;
    }

    @Override
    public void addResponseListener(Consumer<AuditResponse> listener) {
        if (listener != null) listeners.add(listener);
    }

    @Override
    public void removeResponseListener(Consumer<AuditResponse> listener) {
        listeners.remove(listener);
    }

    @Override
    public HttpCounters counters() {
        long responses = responseCount.get();
        long burstCnt = burstResponseCount.get();
        double burstSecs = (System.nanoTime() - burstStartNanos) / 1_000_000_000.0;
        return new HttpCounters(
                requestCount.get(),
                responses,
                timeoutCount.get(),
                burstCnt > 0 ? (double) burstResponseTimeMs.get() / burstCnt : 0.0,
                burstCnt,
                burstSecs > 0 ? burstCnt / burstSecs : 0.0,
                responses > 0 ? (double) totalResponseTimeMs.get() / responses : 0.0,
                maxConcurrency
        );
    }

    /** 카운터/대기열/리스너 초기화. 진행 중 요청은 건드리지 않는다. */
    @Override
    public void reset() {
        synchronized (lock) {
            queue.clear();
        }
        listeners.clear();
        requestCount.set(0);
        responseCount.set(0);
        timeoutCount.set(0);
        totalResponseTimeMs.set(0);
        burstResponseCount.set(0);
        burstResponseTimeMs.set(0);
        burstStartNanos = System.nanoTime();
    }
}
