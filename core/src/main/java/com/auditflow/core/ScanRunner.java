package com.auditflow.core;

import com.auditflow.core.component.ComponentInfo;
import com.auditflow.core.framework.ScanOrchestrator;
import com.auditflow.core.model.ScanOptions;
import com.auditflow.core.model.StatsSnapshot;
import com.auditflow.core.util.LogSetup;
import com.auditflow.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * CLI 진입점.
 *   java -jar auditflow-core.jar [scan.yml] [--lsmod | --lsplug | --lsrep]
 * 로그는 -Daf.out.dir(기본 옵션의 outputDir)/logs 아래에 쌓인다.
 */
public final class ScanRunner {

    private static final Logger LOG = LoggerFactory.getLogger(ScanRunner.class);

    private ScanRunner() {}

    public static void main(String[] args) throws Exception {
        Path config = Path.of("scan.yml");
        String listing = null;
        for (String a : args) {
            if (a.startsWith("--ls")) listing = a.substring(2);
            else config = Path.of(a);
        }

        ScanOptions options = YamlConfigLoader.load(config);
        Path outRoot = Path.of(System.getProperty("af.out.dir", options.getOutputDir().toString()));
        LogSetup.configure(outRoot);

        Thread.setDefaultUncaughtExceptionHandler((t, e) ->
                LOG.error("Uncaught exception in {}", t.getName(), e));

        ScanOrchestrator orchestrator = ScanOrchestrator.builder(options).build();

        if (listing != null) {
            for (String line : list(orchestrator, listing)) System.out.println(line);
            return;
        }

        orchestrator.run(null);

        StatsSnapshot s = orchestrator.stats(true, true);
        LOG.info("Finished: requests={}, responses={}, timeouts={}, sitemap={}, audited={}, progress={}%, elapsed={}",
                s.requests(), s.responses(), s.timeOutCount(), s.sitemapSize(), s.auditmapSize(),
                s.progress(), s.time());
        System.out.println("Issues: " + orchestrator.modules().results().size()
                + ", faults: " + orchestrator.faults().size());
    }

    static List<String> list(ScanOrchestrator o, String which) {
        List<ComponentInfo> infos;
        switch (which) {
            case "lsmod":  infos = o.listModules(); break;
            case "lsplug": infos = o.listPlugins(); break;
            case "lsrep":  infos = o.listReports(); break;
            default: throw new IllegalArgumentException("Unknown listing: --" + which);
        }
        List<String> out = new ArrayList<>();
        for (ComponentInfo i : infos) {
            out.add(String.format("%-20s %-30s %s", i.name(), i.path(), i.description()));
        }
        return out;
    }
}
