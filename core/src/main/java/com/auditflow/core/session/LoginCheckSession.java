package com.auditflow.core.session;

import com.auditflow.core.api.IHttpTransport;
import com.auditflow.core.api.ISession;
import com.auditflow.core.http.AuditRequest;
import com.auditflow.core.http.AuditResponse;
import com.auditflow.core.model.ScanOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Pattern;

/**
 * loginCheckUrl 응답에 loginCheckPattern 이 보이는지로 세션 생존을 확인.
 *  - 설정이 없으면 no-op
 *  - harvest 마다 불리므로 checkInterval 안에서는 다시 확인하지 않는다
 *  - 패턴이 사라지면 경고 후 relogin 훅(있으면)을 실행
 */
public final class LoginCheckSession implements ISession {

    private static final Logger LOG = LoggerFactory.getLogger(LoginCheckSession.class);

    public static final Duration DEFAULT_CHECK_INTERVAL = Duration.ofSeconds(30);

    private final ScanOptions options;
    private final IHttpTransport http;
    private final Clock clock;
    private final Duration checkInterval;
    private final Runnable relogin;
    private final Pattern pattern;
    private final AtomicBoolean checking = new AtomicBoolean(false);
    private volatile Instant lastCheck;
    private volatile boolean loggedIn = true;

    public LoginCheckSession(ScanOptions options, IHttpTransport http) {
        this(options, http, Clock.systemUTC(), DEFAULT_CHECK_INTERVAL, null);
    }

    public LoginCheckSession(ScanOptions options, IHttpTransport http, Clock clock,
                             Duration checkInterval, Runnable relogin) {
        this.options = Objects.requireNonNull(options, "options");
        this.http = Objects.requireNonNull(http, "http");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.checkInterval = (checkInterval == null) ? DEFAULT_CHECK_INTERVAL : checkInterval;
        this.relogin = relogin;
        String p = options.getLoginCheckPattern();
        this.pattern = (p == null || p.isBlank()) ? null : Pattern.compile(p);
    }

    @Override
    public void ensureLoggedIn() {
        String url = options.getLoginCheckUrl();
        if (url == null || url.isBlank() || pattern == null) return;

        Instant now = clock.instant();
        Instant last = lastCheck;
        if (last != null && Duration.between(last, now).compareTo(checkInterval) < 0) return;
        // 확인 요청의 harvest 가 다시 ensureLoggedIn 을 부르는 재진입 방지
        if (!checking.compareAndSet(false, true)) return;
        try {
            lastCheck = now;
            http.queue(AuditRequest.get(URI.create(url)), this::onCheck);
            http.runQueued();
        } catch (IllegalArgumentException e) {
            LOG.warn("Invalid loginCheckUrl: {}", url);
        } finally {
            checking.set(false);
        }
    }

    private void onCheck(AuditResponse resp) {
        boolean ok = !resp.isFailure() && pattern.matcher(resp.body()).find();
        loggedIn = ok;
        if (ok) return;

        LOG.warn("Session check failed at {} (status={}), pattern '{}' not found",
                options.getLoginCheckUrl(), resp.status(), pattern.pattern());
        if (relogin != null) {
            try {
                relogin.run();
            } catch (RuntimeException e) {
                LOG.warn("Re-login hook failed", e);
            }
        }
    }

    /** 마지막 확인 결과(확인 전에는 true) */
    public boolean isLoggedIn() {
        return loggedIn;
    }
}
