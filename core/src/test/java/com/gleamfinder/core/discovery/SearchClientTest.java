package com.gleamfinder.core.discovery;

import com.gleamfinder.core.model.FinderConfig;
import com.gleamfinder.core.model.FinderError;
import com.gleamfinder.core.model.FinderException;
import com.gleamfinder.core.testing.FakePageFetcher;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SearchClient: 결과 페이지 조회 + 링크 추출")
class SearchClientTest {

    private static final String PAGE0 = "https://www.google.com/search?q=%22gleam.io%22&tbs=qdr%3Ah&filter=0&start=0";
    private static final String PAGE2 = "https://www.google.com/search?q=%22gleam.io%22&tbs=qdr%3Ah&filter=0&start=20";

    private final FinderConfig cfg = FinderConfig.defaults();

    @Test
    @DisplayName("page 번호 → start 오프셋(page * resultsPerPage)")
    void builds_paged_search_url() {
        SearchClient client = new SearchClient(cfg, new FakePageFetcher());
        assertThat(client.searchUrl(0).toString()).isEqualTo(PAGE0);
        assertThat(client.searchUrl(2).toString()).isEqualTo(PAGE2);
        assertThatThrownBy(() -> client.searchUrl(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void returns_accepted_links() throws Exception {
        String body = "<div class=\"g\"><a href=\"https://www.youtube.com/watch?v=1\" data-ved=\"2ah\">v</a></div>"
                + "<div class=\"g\"><a href=\"https://maps.google.com/\" class=\"x\">m</a></div>";
        FakePageFetcher fetcher = new FakePageFetcher().page(PAGE0, body);

        assertThat(new SearchClient(cfg, fetcher).search(0))
                .containsExactly("https://www.youtube.com/watch?v=1");
        assertThat(fetcher.requested()).containsExactly(PAGE0);
    }

    @Test
    void empty_results_page_gives_empty_list() throws Exception {
        FakePageFetcher fetcher = new FakePageFetcher().page(PAGE0, "<html>no results</html>");
        assertThat(new SearchClient(cfg, fetcher).search(0)).isEmpty();
    }

    @Test
    @DisplayName("전송 실패 → TIMEOUT, 비 2xx → INVALID_RESPONSE")
    void maps_fetch_failures() {
        FakePageFetcher down = new FakePageFetcher().unreachable(PAGE0);
        assertThatThrownBy(() -> new SearchClient(cfg, down).search(0))
                .isInstanceOfSatisfying(FinderException.class, e -> assertThat(e.error()).isEqualTo(FinderError.TIMEOUT));

        FakePageFetcher blocked = new FakePageFetcher().status(PAGE0, 429, "unusual traffic");
        assertThatThrownBy(() -> new SearchClient(cfg, blocked).search(0))
                .isInstanceOfSatisfying(FinderException.class,
                        e -> assertThat(e.error()).isEqualTo(FinderError.INVALID_RESPONSE));
    }
}
