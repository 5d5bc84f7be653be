package com.auditflow.core.trainer;

import com.auditflow.core.http.AuditRequest;
import com.auditflow.core.model.Page;
import com.auditflow.core.model.ScanOptions;
import com.auditflow.core.support.FakeTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TrainerTest {

    private static final String FORM = "<form action='/search?x=1' method='post'>"
            + "<input name='q'><input name='lang'><textarea name='note'></textarea></form>";

    private FakeTransport http;
    private ElementFilter filter;
    private ScanOptions options;
    private List<Page> sink;
    private Trainer trainer;

    @BeforeEach
    void setUp() {
        http = new FakeTransport().respond(req -> FakeTransport.html(req, FORM));
        filter = new ElementFilter();
        options = ScanOptions.defaults().setTarget("http://example.test/");
        sink = new ArrayList<>();
        trainer = new Trainer(http, filter, options, sink::add);
    }

    private void send(String url, boolean train) {
        http.queue(AuditRequest.get(url).withTrain(train), r -> {});
        http.runQueued();
    }

    @Test
    @DisplayName("train 응답에서 새 폼을 찾으면 페이지 큐로, 같은 폼은 다시 보내지 않는다")
    void new_elements_are_pushed_once() {
        send("http://example.test/p1", true);
        send("http://example.test/p2", true);

        assertThat(sink).extracting(Page::getUrl).containsExactly("http://example.test/p1");
        assertThat(filter.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("train 플래그가 없는 응답은 보지 않는다")
    void ignores_untrained_responses() {
        send("http://example.test/p1", false);

        assertThat(sink).isEmpty();
        assertThat(filter.size()).isZero();
    }

    @Test
    @DisplayName("sameDomainOnly 면 다른 도메인 응답은 무시")
    void ignores_foreign_domain() {
        send("http://elsewhere.test/p", true);
        assertThat(sink).isEmpty();

        options.setSameDomainOnly(false);
        send("http://elsewhere.test/p", true);
        assertThat(sink).hasSize(1);
    }

    @Test
    @DisplayName("seed 로 등록된 페이지의 요소는 새 요소가 아니다")
    void seeded_pages_are_known() {
        trainer.seed(Page.builder().url("http://example.test/p0").body(FORM).build());

        send("http://example.test/p1", true);

        assertThat(sink).isEmpty();
    }

    @Test
    @DisplayName("close 후에는 응답을 관찰하지 않는다")
    void close_detaches_listener() {
        assertThat(http.listenerCount()).isEqualTo(1);
        trainer.close();
        assertThat(http.listenerCount()).isZero();

        send("http://example.test/p1", true);
        assertThat(sink).isEmpty();
    }

    @Test
    @DisplayName("시그니처: 폼은 method/action(쿼리 제외)/정렬된 이름, 링크는 쿼리 파라미터 이름")
    void signatures() {
        String body = FORM
                + "<a href='/list?page=2&sort=asc#top'>n</a>"
                + "<a href='/plain'>no query</a>";

        List<String> sigs = Trainer.signatures("http://example.test/here", body);

        assertThat(sigs).containsExactly(
                "form|POST|http://example.test/search|lang,note,q",
                "link|http://example.test/list|page,sort");
    }

    @Test
    void element_filter_counts_new_only() {
        ElementFilter f = new ElementFilter();
        assertThat(f.registerNew(List.of("a", "b"))).isEqualTo(2);
        assertThat(f.registerNew(List.of("b", "c"))).isEqualTo(1);
        assertThat(f.contains("c")).isTrue();
        f.reset();
        assertThat(f.size()).isZero();
    }
}
