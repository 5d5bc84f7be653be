package com.auditflow.core.util;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Properties;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Filter;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * 스캐너 프로세스의 java.util.logging 설정. SLF4J 호출은 slf4j-jdk14 를 거쳐 여기로 온다.
 *
 * 출력 두 갈래:
 *  - 사람용 로그: 콘솔 + {logDir}/auditflow-%g.log (한 줄 포맷, 예외 스택 포함)
 *  - 구조화 이벤트(StructuredLog, 로거 이름이 ".events" 로 끝남): {logDir}/events-%g.jsonl, 원문 JSON 한 줄
 *
 * System props:
 *  -Daf.log.level=FINE|INFO|WARNING|SEVERE
 *  -Daf.log.sizeMb=2
 *  -Daf.log.files=5
 *  -Daf.log.console=true|false (기본 true)
 */
public final class LogSetup {
    private LogSetup() {}

    static final String EVENTS_SUFFIX = ".events";

    private static volatile boolean initialized = false;

    /** 롤링/레벨 설정값 */
    record Settings(Level level, int sizeMb, int files, boolean console) {
        static Settings from(Properties p) {
            return new Settings(
                    levelOf(p.getProperty("af.log.level", "INFO")),
                    Math.max(1, parseInt(p.getProperty("af.log.sizeMb"), 2)),
                    Math.max(1, parseInt(p.getProperty("af.log.files"), 5)),
                    !"false".equalsIgnoreCase(p.getProperty("af.log.console", "true")));
        }

        int limitBytes() {
            return sizeMb * 1024 * 1024;
        }
    }

    /** outRoot/logs 아래에 기록 */
    public static synchronized void configure(Path outRoot) {
        init(outRoot.resolve("logs"));
    }

    public static synchronized void init(Path logDir) {
        if (initialized) return;
        initialized = true;

        Settings s = Settings.from(System.getProperties());
        LogManager.getLogManager().reset();
        Logger root = Logger.getLogger("");
        root.setLevel(s.level());

        Filter humanOnly = r -> !isEvent(r);
        if (s.console()) {
            root.addHandler(handler(new ConsoleHandler(), s.level(), new LineFormatter(), humanOnly));
        }

        try {
            Files.createDirectories(logDir);
            root.addHandler(handler(
                    new FileHandler(logDir.resolve("auditflow-%g.log").toString(), s.limitBytes(), s.files(), true),
                    s.level(), new LineFormatter(), humanOnly));
            root.addHandler(handler(
                    new FileHandler(logDir.resolve("events-%g.jsonl").toString(), s.limitBytes(), s.files(), true),
                    s.level(), new EventFormatter(), LogSetup::isEvent));
        } catch (IOException e) {
            // 파일을 못 열면 콘솔만으로 진행
            Logger.getLogger(LogSetup.class.getName()).log(Level.WARNING,
                    "Log files unavailable under " + logDir.toAbsolutePath() + ": " + e.getMessage(), e);
            return;
        }

        Logger.getLogger(LogSetup.class.getName()).log(Level.INFO,
                () -> "Logging to " + logDir.toAbsolutePath() + " (level=" + s.level().getName()
                        + ", " + s.sizeMb() + "MB x " + s.files() + ")");
    }

    private static Handler handler(Handler h, Level level, Formatter f, Filter filter) {
        h.setLevel(level);
        h.setFormatter(f);
        h.setFilter(filter);
        return h;
    }

    static boolean isEvent(LogRecord r) {
        String name = r.getLoggerName();
        return name != null && name.endsWith(EVENTS_SUFFIX);
    }

    /** 실행 중 레벨 변경(루트 + 모든 핸들러) */
    public static void setLevel(Level level) {
        Level l = (level == null) ? Level.INFO : level;
        Logger root = Logger.getLogger("");
        root.setLevel(l);
        for (Handler h : root.getHandlers()) h.setLevel(l);
    }

    /** 문자열을 Level 로(실패 시 INFO). SLF4J 식 이름(DEBUG, WARN, ERROR)도 받는다 */
    public static Level levelOf(String s) {
        if (s == null) return Level.INFO;
        String n = s.trim().toUpperCase(Locale.ROOT);
        switch (n) {
            case "TRACE": return Level.FINEST;
            case "DEBUG": return Level.FINE;
            case "WARN":  return Level.WARNING;
            case "ERROR": return Level.SEVERE;
            default:
                try {
                    return Level.parse(n);
                } catch (IllegalArgumentException e) {
                    return Level.INFO;
                }
        }
    }

    private static int parseInt(String s, int def) {
        try {
            return (s == null || s.isBlank()) ? def : Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            return def;
        }
    }

    /** 시각 [레벨] (스레드) 로거 - 메시지, 예외가 있으면 스택 */
    static final class LineFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            StringBuilder sb = new StringBuilder(160);
            sb.append(String.format(Locale.ROOT, "%1$tF %1$tT.%1$tL [%2$s] (%3$s) %4$s - %5$s",
                    r.getMillis(), r.getLevel().getName(), Thread.currentThread().getName(),
                    r.getLoggerName(), formatMessage(r)));
            sb.append(System.lineSeparator());
            if (r.getThrown() != null) {
                StringWriter sw = new StringWriter(256);
                r.getThrown().printStackTrace(new PrintWriter(sw));
                sb.append(sw);
            }
            return sb.toString();
        }
    }

    /** 이벤트 메시지는 이미 JSON 한 줄이므로 그대로 */
    static final class EventFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            return r.getMessage() + "\n";
        }
    }
}
