package com.auditflow.core.framework;

import com.auditflow.core.api.IHttpTransport;
import com.auditflow.core.api.Resettable;
import com.auditflow.core.timing.TimingAuditor;
import com.auditflow.core.trainer.ElementFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 오케스트레이터 인스턴스를 넘어 공유되는 협력자 상태.
 * 같은 SharedState 로 새 오케스트레이터를 만들기 전, 그리고 인스턴스 reset 전에 reset() 해야 한다.
 * reset 순서: 트랜스포트 → 타이밍 → 요소 필터 → 추가 등록분
 * (타이밍 카운터가 트랜스포트 기준으로 측정되므로 트랜스포트가 먼저)
 */
public final class SharedState implements Resettable {

    private static final Logger LOG = LoggerFactory.getLogger(SharedState.class);

    private final IHttpTransport http;
    private final TimingAuditor timing;
    private final ElementFilter elementFilter;
    private final List<Resettable> extras = new CopyOnWriteArrayList<>();

    public SharedState(IHttpTransport http) {
        this(http, new TimingAuditor(), new ElementFilter());
    }

    public SharedState(IHttpTransport http, TimingAuditor timing, ElementFilter elementFilter) {
        this.http = Objects.requireNonNull(http, "http");
        this.timing = Objects.requireNonNull(timing, "timing");
        this.elementFilter = Objects.requireNonNull(elementFilter, "elementFilter");
    }

    public IHttpTransport http() { return http; }
    public TimingAuditor timing() { return timing; }
    public ElementFilter elementFilter() { return elementFilter; }

    /** 다른 공유 상태(캐시 등)를 reset 체인 끝에 추가 */
    public void register(Resettable r) {
        if (r != null) extras.add(r);
    }

    @Override
    public void reset() {
        http.reset();
        timing.reset();
        elementFilter.reset();
        for (Resettable r : extras) r.reset();
        LOG.debug("Shared collaborator state reset ({} extra)", extras.size());
    }
}
