package com.auditflow.core.framework;

import com.auditflow.core.api.IHttpTransport;
import com.auditflow.core.api.IPageFactory;
import com.auditflow.core.api.ISession;
import com.auditflow.core.api.ISpider;
import com.auditflow.core.api.ITrainer;
import com.auditflow.core.component.ComponentInfo;
import com.auditflow.core.component.ComponentProvider;
import com.auditflow.core.component.ModuleManager;
import com.auditflow.core.component.PluginManager;
import com.auditflow.core.component.ReportManager;
import com.auditflow.core.component.ScanContext;
import com.auditflow.core.crawler.LinkSpider;
import com.auditflow.core.http.AsyncHttpTransport;
import com.auditflow.core.http.HttpCounters;
import com.auditflow.core.http.PageFetcher;
import com.auditflow.core.model.AuditStore;
import com.auditflow.core.model.Issue;
import com.auditflow.core.model.Page;
import com.auditflow.core.model.RedundancyRule;
import com.auditflow.core.model.ScanOptions;
import com.auditflow.core.model.ScanPhase;
import com.auditflow.core.model.StatsSnapshot;
import com.auditflow.core.session.LoginCheckSession;
import com.auditflow.core.timing.TimingAuditor;
import com.auditflow.core.trainer.Trainer;
import com.auditflow.core.util.StructuredLog;
import com.auditflow.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * 스캔 오케스트레이터:
 *  - prepare → audit(crawl → 큐 드레인 → 타이밍 배치 → 재드레인) → cleanUp → (finalizer) → done → 리포트
 *  - URL 큐 / 페이지 큐는 HTTP 콜백(생산자)과 드레인 루프(소비자)가 동시에 건드린다
 *  - 모든 push/drain 단계 뒤에 harvest 해서 콜백이 채운 큐를 바로 소비한다
 *  - 모듈/페이지 단위 실패는 가장 좁은 범위에서 흡수, FatalScanError(및 모든 Error)는 그대로 전파
 *
 * 한 인스턴스는 한 번에 하나의 스캔만 돌린다. 재사용하려면 reset().
 */
public class ScanOrchestrator implements ScanContext {

    private static final Logger LOG = LoggerFactory.getLogger(ScanOrchestrator.class);
    private static final StructuredLog SLOG = StructuredLog.get(ScanOrchestrator.class);

    public static final String VERSION = "0.3.0";
    public static final String REVISION = "0.1.0";

    /** 페이지 팩토리 최대 시도 횟수 */
    static final int FETCH_PRECISION = 2;

    // ---------- 구성 ----------
    private final ScanOptions options;
    private final SharedState shared;
    private final Function<ScanOrchestrator, ISpider> spiderFactory;
    private final Function<ScanOrchestrator, ITrainer> trainerFactory;
    private final IPageFactory pageFactory;
    private final ISession session;
    private final Clock clock;
    private final ProgressTracker tracker;

    private final ModuleManager modules;
    private final PluginManager plugins;
    private final ReportManager reports;

    // ---------- 상태 ----------
    private final CountingQueue<String> urlQueue = new CountingQueue<>();
    private final CountingQueue<Page> pageQueue = new CountingQueue<>();
    private final Set<String> sitemap = ConcurrentHashMap.newKeySet();
    private final Set<String> auditmap = ConcurrentHashMap.newKeySet();
    private final PauseGate pauseGate;
    private final List<Consumer<Page>> onRunModules = new CopyOnWriteArrayList<>();
    private final List<RunFault> faults = new CopyOnWriteArrayList<>();
    private final Object statsLock = new Object();

    private volatile List<RedundancyRule> originalRedundant;
    private volatile ScanPhase phase = ScanPhase.READY;
    private volatile boolean running = false;
    private volatile String currentUrl = "";
    private volatile ISpider spider;
    private volatile ITrainer trainer;

    protected ScanOrchestrator(Builder b) {
        this.options = b.options;
        this.shared = b.shared;
        this.spiderFactory = b.spiderFactory;
        this.trainerFactory = b.trainerFactory;
        this.pageFactory = b.pageFactory;
        this.session = b.session;
        this.clock = b.clock;
        this.tracker = new ProgressTracker(clock);
        this.pauseGate = new PauseGate(b.pausePollMillis);

        // 스캔 중 소모되는 카운터와 분리된 원본 규칙
        this.originalRedundant = RedundancyRule.deepCopy(options.getRedundant());

        this.modules = new ModuleManager(this);
        this.plugins = new PluginManager(this);
        this.reports = new ReportManager(this);
        if (b.discover) {
            ClassLoader cl = ScanOrchestrator.class.getClassLoader();
            modules.discover(ComponentProvider::modules, cl);
            plugins.discover(ComponentProvider::plugins, cl);
            reports.discover(ComponentProvider::reports, cl);
        }

        this.trainer = trainerFactory.apply(this);
        this.spider = spiderFactory.apply(this);
    }

    /* =========================
       수명주기
       ========================= */

    /**
     * 전체 스캔. audit/finalizer 의 Exception 은 기록 후 흡수되어 cleanUp 과 리포트가 항상 실행된다.
     * Error(FatalScanError 포함)는 잡지 않으므로 cleanUp 도 건너뛴다.
     *
     * @param finalizer cleanUp 직후 실행할 호출자 작업(null 가능)
     */
    public void run(Runnable finalizer) {
        prepare();

        barrier("audit", this::audit);

        cleanUp();
        if (finalizer != null) barrier("finalize", finalizer);
        phase = ScanPhase.DONE;

        StatsSnapshot s = stats(false, false);
        LOG.info("Scan done. sitemap={}, auditmap={}, issues={}, faults={}, elapsed={}",
                s.sitemapSize(), s.auditmapSize(), modules.results().size(), faults.size(), s.time());
        SLOG.info("scan-done",
                "sitemap", s.sitemapSize(),
                "auditmap", s.auditmapSize(),
                "issues", modules.results().size(),
                "faults", faults.size());

        if (!reports.isEmpty()) {
            barrier("report", () -> reports.run(snapshot()));
        }
    }

    public void run() {
        run(null);
    }

    private void barrier(String stage, Runnable body) {
        try {
            body.run();
        } catch (Exception e) {
            faults.add(new RunFault(stage, e, clock.instant()));
            LOG.error("Scan stage '{}' failed, continuing to clean-up", stage, e);
            SLOG.error("stage-fault", e, "stage", stage);
        }
    }

    /**
     * phase=preparing, 시작 시각 기록, 설정된 컴포넌트 로드 후 플러그인 시작(대기하지 않음).
     */
    public void prepare() {
        phase = ScanPhase.PREPARING;
        running = true;
        options.setStartDatetime(clock.instant());
        loadComponents();

        LOG.info("Scan start: target={}, modules={}, plugins={}, reports={}",
                options.getTarget(), modules.loaded(), plugins.loaded(), reports.loaded());
        SLOG.info("scan-start",
                "target", options.getTarget(),
                "modules", modules.loaded().size(),
                "plugins", plugins.loaded().size(),
                "restricted", !options.getRestrictPaths().isEmpty());

        plugins.run();
    }

    /** 옵션의 modules/plugins/reports 이름 목록을 로드(이미 로드된 것은 유지) */
    public void loadComponents() {
        modules.load(options.getModules());
        plugins.load(options.getPlugins());
        reports.load(options.getReports());
    }

    /**
     * crawl(또는 restrictPaths 직접 적재) → 드레인 → 타이밍 배치 → 재드레인.
     */
    public void audit() {
        pauseGate.awaitIfPaused();

        setPhase(ScanPhase.CRAWLING);
        List<String> restrict = options.getRestrictPaths();
        if (restrict != null && !restrict.isEmpty()) {
            // 경로 제한이 있으면 스파이더는 돌리지 않는다
            List<String> abs = new ArrayList<>(restrict.size());
            for (String p : restrict) {
                String a = UrlUtils.toAbsolute(p, options.getTarget());
                abs.add(a != null ? a : p);
            }
            options.setRestrictPaths(abs);
            sitemap.addAll(abs);
            for (String url : abs) pushUrl(url);
        } else {
            final ISpider sp = spider;
            sp.run(true, url -> {
                sitemap.addAll(sp.sitemap());
                pushUrl(url);
            });
        }

        setPhase(ScanPhase.AUDITING);
        drainQueues();

        try {
            TimingAuditor timing = timing();
            if (timing.hasPending()) {
                LOG.info("Running timing attacks: modules={}, operations={}",
                        timing.loadedModules(), timing.pendingOperations());
                timing.run(op -> {
                    if (!op.action().isEmpty()) currentUrl = op.action();
                }, this::harvest);
            }
            drainQueues();
        } catch (Exception e) {
            faults.add(new RunFault("timing", e, clock.instant()));
            LOG.error("Timing phase failed", e);
            SLOG.error("stage-fault", e, "stage", "timing");
        }
    }

    /**
     * URL 큐가 빌 때까지: URL 하나 → 페이지 fetch → harvest → 페이지 큐 드레인 → harvest.
     * 마지막에 페이지 큐를 한 번 더 드레인(마지막 harvest 이후 Trainer 가 채운 페이지).
     */
    public void drainQueues() {
        String url;
        while ((url = urlQueue.poll()) != null) {
            pageFactory.fetch(url, FETCH_PRECISION, this::pushPage, this::onFetchFailure);
            harvest();

            drainPageQueue();

            harvest();
        }
        drainPageQueue();
    }

    /** 루프 조건은 매 반복 다시 확인(모듈 실행 중 새 페이지가 들어올 수 있음) */
    public void drainPageQueue() {
        Page page;
        while ((page = pageQueue.poll()) != null) {
            runModulesOn(page);
            harvest();
        }
    }

    /** 페이지로 만들지 못한 URL: 더 진행하지 않고 "시도함"으로만 기록 */
    private void onFetchFailure(String url) {
        sitemap.add(url);
        auditmap.add(url);
        LOG.debug("Could not materialize page, skipping: {}", url);
    }

    /**
     * 페이지 하나에 대해 스케줄된 모듈을 순서대로 실행.
     * 스케줄은 페이지마다 다시 읽는다(중간에 켜고 끈 모듈은 다음 페이지부터 반영).
     */
    public void runModulesOn(Page page) {
        if (page == null) return;
        if (modules.isEmpty()) {
            LOG.warn("No modules loaded, nothing to run on {}", page.getUrl());
            return;
        }

        // 건너뛰더라도 "검토함"으로 남긴다. 감사맵 ⊆ 사이트맵 유지를 위해 사이트맵 먼저
        sitemap.add(page.getUrl());
        auditmap.add(page.getUrl());

        if (options.isExcludeBinaries() && !page.isText()) {
            LOG.info("Ignoring page due to non text-based content-type: {}", page.getUrl());
            return;
        }

        LOG.info("Auditing: [HTTP: {}] {}", page.getCode(), page.getUrl());
        SLOG.debug("page-audit", "url", page.getUrl(), "code", page.getCode());

        for (Consumer<Page> l : onRunModules) {
            try {
                l.accept(page);
            } catch (RuntimeException e) {
                LOG.warn("on-run-modules listener failed for {}", page.getUrl(), e);
            }
        }

        currentUrl = page.getUrl();

        for (String name : modules.schedule()) {
            pauseGate.awaitIfPaused();
            modules.runOne(name, page);
        }

        harvest();
    }

    /** 큐/진행 중 HTTP 요청을 모두 해소한 뒤 세션 확인 */
    public void harvest() {
        http().runQueued();
        session.ensureLoggedIn();
    }

    /**
     * phase=cleanup, 종료 시각 기록, onlyPositives 강제 해제, 플러그인 종료 대기.
     */
    public void cleanUp() {
        setPhase(ScanPhase.CLEANUP);

        Instant now = clock.instant();
        options.setFinishDatetime(now);
        if (options.getStartDatetime() == null) options.setStartDatetime(now);
        options.setDeltaTime(Duration.between(options.getStartDatetime(), now));

        // 켜진 채로 두면 리포트 출력이 깨진다
        options.setOnlyPositives(false);

        running = false;

        plugins.block();
    }

    /* =========================
       큐 / 맵
       ========================= */

    @Override
    public void pushUrl(String url) {
        if (url == null) return;
        String abs = UrlUtils.toAbsolute(url, options.getTarget());
        String u = (abs != null) ? abs : url;
        urlQueue.push(u);
        sitemap.add(u);
    }

    @Override
    public void pushPage(Page page) {
        if (page == null) return;
        pageQueue.push(page);
        sitemap.add(page.getUrl());
    }

    public long urlQueueTotalSize() { return urlQueue.totalPushed(); }
    public long pageQueueTotalSize() { return pageQueue.totalPushed(); }

    /** 읽기 전용 뷰 */
    public Set<String> sitemap() { return Collections.unmodifiableSet(sitemap); }
    public Set<String> auditmap() { return Collections.unmodifiableSet(auditmap); }

    public String currentUrl() { return currentUrl; }

    /* =========================
       일시정지
       ========================= */

    /** 새 토큰으로 일시정지. 같은 토큰으로 resume 해야 풀린다. */
    public Object pause() {
        Object token = new Object();
        pause(token);
        return token;
    }

    public void pause(Object token) {
        pauseGate.pause(token);
        spider.pause();
        LOG.info("Pause requested ({} pending)", pauseGate.pending());
    }

    /** @return 일치하는 토큰이 없어 아무 일도 하지 않았으면 false */
    public boolean resume(Object token) {
        if (!pauseGate.resume(token)) return false;
        spider.resume();
        LOG.info("Resume requested ({} pending)", pauseGate.pending());
        return true;
    }

    public boolean isPaused() { return pauseGate.isPaused(); }

    public boolean isRunning() { return running; }

    /** "paused" 또는 현재 phase 이름 */
    public String status() {
        return pauseGate.isPaused() ? "paused" : phase.label();
    }

    public ScanPhase phase() { return phase; }

    private void setPhase(ScanPhase p) {
        phase = p;
        SLOG.info("phase", "phase", p.label());
    }

    /* =========================
       통계
       ========================= */

    public StatsSnapshot stats() {
        return stats(false, false);
    }

    /**
     * @param refreshTime     경과 시간 재계산 요청(감사맵 == 사이트맵이면 무시)
     * @param overrideRefresh 무조건 재계산
     */
    public StatsSnapshot stats(boolean refreshTime, boolean overrideRefresh) {
        HttpCounters http = http().counters();
        Instant now = clock.instant();

        int auditSz = auditmap.size();
        int siteSz = sitemap.size();

        Duration delta;
        synchronized (statsLock) {
            if (options.getStartDatetime() == null) options.setStartDatetime(now);
            Instant start = options.getStartDatetime();
            if ((!refreshTime || auditSz == siteSz) && !overrideRefresh) {
                // 한 번 기록되면 고정
                if (options.getDeltaTime() == null) options.setDeltaTime(Duration.between(start, now));
            } else {
                options.setDeltaTime(Duration.between(start, now));
            }
            delta = options.getDeltaTime();
        }

        long avg = 0;
        double secs = delta.toMillis() / 1000.0;
        if (http.responseCount() > 0 && secs > 0) avg = (long) (http.responseCount() / secs);

        int redirects = spider.redirects().size();
        TimingAuditor timing = timing();
        double progress = ProgressTracker.progress(auditSz, siteSz, redirects,
                timing.hasLoadedModules(), timing.isRunning(),
                timing.totalOperations(), timing.pendingOperations());

        return new StatsSnapshot(
                http.requestCount(),
                http.responseCount(),
                http.timeoutCount(),
                delta,
                avg,
                siteSz,
                auditSz,
                progress,
                http.currentResponseTime(),
                http.currentResponseCount(),
                http.currentResponsesPerSecond(),
                http.averageResponseTime(),
                http.maxConcurrency(),
                currentUrl,
                tracker.eta(progress, options.getStartDatetime())
        );
    }

    /* =========================
       결과
       ========================= */

    /** 리포트용 스냅샷. 중복 규칙 카운터는 스캔 시작 전 값으로 복원된다. */
    public AuditStore snapshot() {
        Map<String, Object> opts = options.toMap();
        opts.put("redundant", RedundancyRule.toMaps(originalRedundant));
        opts.put("mods", modules.loaded());

        List<String> site = new ArrayList<>(sitemap);
        Collections.sort(site);

        return AuditStore.builder()
                .version(version())
                .revision(revision())
                .options(opts)
                .sitemap(site)
                .issues(modules.results())
                .plugins(plugins.results())
                .startDatetime(options.getStartDatetime())
                .finishDatetime(options.getFinishDatetime())
                .deltaTime(options.getDeltaTime())
                .build();
    }

    public String version() { return VERSION; }
    public String revision() { return REVISION; }

    public List<RunFault> faults() { return List.copyOf(faults); }

    /* =========================
       재사용
       ========================= */

    /**
     * 인스턴스 초기화. 공유 상태를 먼저 reset 한 뒤 Trainer/Spider 를 다시 만들고
     * 컴포넌트 로드, 큐, 맵, 실행 시각을 비운다. 옵션 객체는 유지된다.
     */
    public void reset() {
        urlQueue.reset();
        pageQueue.reset();

        // 트랜스포트 카운터/리스너가 나머지보다 먼저 비워져야 한다
        resetShared();

        onRunModules.clear();
        ITrainer old = trainer;
        if (old != null) old.close();
        trainer = trainerFactory.apply(this);
        spider = spiderFactory.apply(this);

        modules.clear();
        reports.clear();
        plugins.clear();

        auditmap.clear();
        sitemap.clear();
        faults.clear();
        pauseGate.clear();

        phase = ScanPhase.READY;
        running = false;
        currentUrl = "";
        options.clearRuntimeStamps();
        originalRedundant = RedundancyRule.deepCopy(options.getRedundant());
        LOG.debug("Orchestrator reset");
    }

    /**
     * 공유 협력자 상태 초기화(트랜스포트 → 타이밍 → 요소 필터).
     * 트랜스포트 reset 은 응답 리스너도 지우므로 현재 Trainer 를 다시 붙인다.
     */
    public void resetShared() {
        shared.reset();
        ITrainer t = trainer;
        if (t != null) t.reattach();
    }

    /** 모듈 루프 직전마다 호출될 리스너 */
    public void onRunModules(Consumer<Page> listener) {
        if (listener != null) onRunModules.add(listener);
    }

    /* =========================
       목록 조회(lsmod/lsplug/lsrep 필터)
       ========================= */

    public List<ComponentInfo> listModules() { return modules.list(options.getLsmod()); }
    public List<ComponentInfo> listPlugins() { return plugins.list(options.getLsplug()); }
    public List<ComponentInfo> listReports() { return reports.list(options.getLsrep()); }

    public ModuleManager modules() { return modules; }
    public PluginManager plugins() { return plugins; }
    public ReportManager reports() { return reports; }
    public ISpider spider() { return spider; }
    public ITrainer trainer() { return trainer; }
    public SharedState shared() { return shared; }

    /* =========================
       ScanContext
       ========================= */

    @Override public ScanOptions options() { return options; }
    @Override public IHttpTransport http() { return shared.http(); }
    @Override public TimingAuditor timing() { return shared.timing(); }

    @Override
    public void registerIssue(Issue issue) {
        modules.register(issue);
    }

    /* =========================
       Builder
       ========================= */

    public static Builder builder(ScanOptions options) {
        return new Builder(options);
    }

    public static final class Builder {
        private final ScanOptions options;
        private SharedState shared;
        private Function<ScanOrchestrator, ISpider> spiderFactory;
        private Function<ScanOrchestrator, ITrainer> trainerFactory;
        private IPageFactory pageFactory;
        private ISession session;
        private Clock clock = Clock.systemUTC();
        private long pausePollMillis = PauseGate.DEFAULT_POLL_MILLIS;
        private boolean discover = true;

        private Builder(ScanOptions options) {
            this.options = Objects.requireNonNull(options, "options");
        }

        /** 같은 프로세스의 다른 오케스트레이터와 공유할 상태(기본: 새 AsyncHttpTransport) */
        public Builder shared(SharedState shared) { this.shared = shared; return this; }
        public Builder spider(Function<ScanOrchestrator, ISpider> f) { this.spiderFactory = f; return this; }
        public Builder trainer(Function<ScanOrchestrator, ITrainer> f) { this.trainerFactory = f; return this; }
        public Builder pageFactory(IPageFactory pf) { this.pageFactory = pf; return this; }
        public Builder session(ISession s) { this.session = s; return this; }
        public Builder clock(Clock c) { this.clock = Objects.requireNonNull(c, "clock"); return this; }
        public Builder pausePollMillis(long ms) { this.pausePollMillis = ms; return this; }
        /** ServiceLoader 로 ComponentProvider 자동 등록 여부(기본 true) */
        public Builder discover(boolean d) { this.discover = d; return this; }

        public ScanOrchestrator build() {
            options.validate();
            if (shared == null) shared = new SharedState(new AsyncHttpTransport(options));
            final IHttpTransport http = shared.http();
            if (pageFactory == null) pageFactory = new PageFetcher(http);
            if (session == null) session = new LoginCheckSession(options, http);
            if (spiderFactory == null) spiderFactory = o -> new LinkSpider(o.options(), o.http());
            if (trainerFactory == null) trainerFactory = Builder::defaultTrainer;
            return new ScanOrchestrator(this);
        }

        private static ITrainer defaultTrainer(ScanOrchestrator o) {
            Trainer t = new Trainer(o.http(), o.shared().elementFilter(), o.options(), o::pushPage);
            o.onRunModules(t::seed);
            return t;
        }
    }
}
