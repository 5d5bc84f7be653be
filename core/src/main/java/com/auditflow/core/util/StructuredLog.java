package com.auditflow.core.util;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * JSON 라인 기반 구조화 로거.
 * 로거 이름이 "<클래스>.events" 이므로 LogSetup 이 events-%g.jsonl 로 따로 모은다.
 *
 * 사용: SLOG.info("scan-start", "target", url, "modules", 3)
 */
public final class StructuredLog {

    enum Lvl { DEBUG, INFO, WARN, ERROR }

    private final Logger log;
    private final String comp;

    private StructuredLog(Class<?> cls) {
        this.log = LoggerFactory.getLogger(cls.getName() + ".events");
        this.comp = cls.getSimpleName();
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(cls);
    }

    public void debug(String event, Object... kvs) { emit(Lvl.DEBUG, event, null, kvs); }
    public void info (String event, Object... kvs) { emit(Lvl.INFO,  event, null, kvs); }
    public void warn (String event, Object... kvs) { emit(Lvl.WARN,  event, null, kvs); }
    public void error(String event, Throwable t, Object... kvs) { emit(Lvl.ERROR, event, t, kvs); }

    private void emit(Lvl lvl, String event, Throwable t, Object... kvs) {
        switch (lvl) {
            case DEBUG: if (log.isDebugEnabled()) log.debug(line(lvl, event, t, kvs)); break;
            case INFO:  if (log.isInfoEnabled())  log.info(line(lvl, event, t, kvs));  break;
            case WARN:  if (log.isWarnEnabled())  log.warn(line(lvl, event, t, kvs));  break;
            default:
                if (log.isErrorEnabled()) {
                    if (t == null) log.error(line(lvl, event, null, kvs));
                    else log.error(line(lvl, event, t, kvs), t);
                }
        }
    }

    /** 한 줄 JSON. 테스트에서 포맷 확인용으로 package-private */
    String line(Lvl lvl, String event, Throwable t, Object... kvs) {
        ObjectNode n = JsonNodeFactory.instance.objectNode();
        n.put("ts", Instant.now().toString());
        n.put("lvl", lvl.name());
        n.put("comp", comp);
        n.put("thread", Thread.currentThread().getName());
        n.put("event", event);

        if (kvs != null && kvs.length > 0) {
            for (int i = 0; i + 1 < kvs.length; i += 2) {
                put(n, String.valueOf(kvs[i]), kvs[i + 1]);
            }
            if (kvs.length % 2 == 1) n.put("_kv_mismatch", true);
        }
        if (t != null) {
            n.put("error", t.getClass().getSimpleName());
            n.put("message", t.getMessage());
        }
        return n.toString();
    }

    String line(String event, Object... kvs) {
        return line(Lvl.INFO, event, null, kvs);
    }

    private static void put(ObjectNode n, String k, Object v) {
        if (v == null) n.putNull(k);
        else if (v instanceof Integer i) n.put(k, i);
        else if (v instanceof Long l) n.put(k, l);
        else if (v instanceof Double d) n.put(k, d);
        else if (v instanceof Number num) n.put(k, num.doubleValue());
        else if (v instanceof Boolean b) n.put(k, b);
        else n.put(k, String.valueOf(v));
    }
}
