package com.auditflow.core.session;

import com.auditflow.core.http.AuditResponse;
import com.auditflow.core.model.ScanOptions;
import com.auditflow.core.support.FakeTransport;
import com.auditflow.core.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class LoginCheckSessionTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2025-03-01T10:00:00Z"));

    private static ScanOptions opts() {
        return ScanOptions.defaults().setTarget("http://example.test/")
                .setLoginCheckUrl("http://example.test/account")
                .setLoginCheckPattern("Log ?out");
    }

    @Test
    @DisplayName("설정이 없으면 요청을 보내지 않는다")
    void noop_without_settings() {
        FakeTransport http = new FakeTransport();
        LoginCheckSession s = new LoginCheckSession(
                ScanOptions.defaults().setTarget("http://example.test/"), http);

        s.ensureLoggedIn();

        assertThat(http.sent).isEmpty();
        assertThat(s.isLoggedIn()).isTrue();
    }

    @Test
    @DisplayName("패턴이 보이면 로그인 유지, 간격 안에서는 다시 확인하지 않는다")
    void logged_in_and_rate_limited() {
        FakeTransport http = new FakeTransport().respond(r -> FakeTransport.html(r, "<a>Logout</a>"));
        LoginCheckSession s = new LoginCheckSession(opts(), http, clock, Duration.ofSeconds(30), null);

        s.ensureLoggedIn();
        s.ensureLoggedIn();
        assertThat(http.sent).hasSize(1);
        assertThat(s.isLoggedIn()).isTrue();

        clock.advance(Duration.ofSeconds(31));
        s.ensureLoggedIn();
        assertThat(http.sent).hasSize(2);
    }

    @Test
    @DisplayName("패턴이 사라지면 로그아웃으로 보고 relogin 훅 실행")
    void logged_out_triggers_relogin() {
        AtomicBoolean loggedIn = new AtomicBoolean(false);
        FakeTransport http = new FakeTransport().respond(r ->
                FakeTransport.html(r, loggedIn.get() ? "Log out" : "<form>Sign in</form>"));
        AtomicInteger relogins = new AtomicInteger();
        LoginCheckSession s = new LoginCheckSession(opts(), http, clock, Duration.ZERO, () -> {
            relogins.incrementAndGet();
            loggedIn.set(true);
        });

        s.ensureLoggedIn();
        assertThat(s.isLoggedIn()).isFalse();
        assertThat(relogins).hasValue(1);

        s.ensureLoggedIn();
        assertThat(s.isLoggedIn()).isTrue();
        assertThat(relogins).hasValue(1);
    }

    @Test
    @DisplayName("확인 요청 실패(네트워크)도 로그아웃으로 취급, 훅 예외는 로그만 남긴다")
    void failure_counts_as_logged_out() {
        FakeTransport http = new FakeTransport().respond(r -> AuditResponse.failure(r, 0, true));
        LoginCheckSession s = new LoginCheckSession(opts(), http, clock, Duration.ZERO,
                () -> { throw new IllegalStateException("relogin failed"); });

        s.ensureLoggedIn();

        assertThat(s.isLoggedIn()).isFalse();
    }
}
