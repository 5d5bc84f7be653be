package com.auditflow.core.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StructuredLogTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final StructuredLog slog = StructuredLog.get(StructuredLogTest.class);

    @Test
    void line_is_single_json_object() throws Exception {
        String line = slog.line("scan-start", "target", "http://example.test/", "modules", 3, "restricted", false,
                "ratio", 0.5, "none", null);

        assertThat(line).doesNotContain("\n");
        JsonNode n = mapper.readTree(line);
        assertThat(n.get("event").asText()).isEqualTo("scan-start");
        assertThat(n.get("lvl").asText()).isEqualTo("INFO");
        assertThat(n.get("comp").asText()).isEqualTo("StructuredLogTest");
        assertThat(n.get("target").asText()).isEqualTo("http://example.test/");
        assertThat(n.get("modules").asInt()).isEqualTo(3);
        assertThat(n.get("restricted").asBoolean()).isFalse();
        assertThat(n.get("ratio").asDouble()).isEqualTo(0.5);
        assertThat(n.get("none").isNull()).isTrue();
        assertThat(n.has("_kv_mismatch")).isFalse();
    }

    @Test
    void odd_kvs_and_error() throws Exception {
        String line = slog.line(StructuredLog.Lvl.ERROR, "stage-fault",
                new IllegalStateException("quote \" inside"), "stage", "audit", "dangling");

        JsonNode n = mapper.readTree(line);
        assertThat(n.get("lvl").asText()).isEqualTo("ERROR");
        assertThat(n.get("_kv_mismatch").asBoolean()).isTrue();
        assertThat(n.get("error").asText()).isEqualTo("IllegalStateException");
        assertThat(n.get("message").asText()).isEqualTo("quote \" inside");
        assertThat(n.has("dangling")).isFalse();

        // 실제 출력 경로도 예외 없이 동작
        slog.info("smoke", "k", "v");
        slog.error("smoke", new RuntimeException("x"));
    }
}
