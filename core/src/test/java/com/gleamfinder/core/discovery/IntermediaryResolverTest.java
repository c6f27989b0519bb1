package com.gleamfinder.core.discovery;

import com.gleamfinder.core.model.FinderConfig;
import com.gleamfinder.core.model.FinderError;
import com.gleamfinder.core.model.FinderException;
import com.gleamfinder.core.testing.FakePageFetcher;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("IntermediaryResolver: 중개 페이지 → 정규 기브어웨이 URL")
class IntermediaryResolverTest {

    private static final String VIDEO = "https://www.youtube.com/watch?v=abc";

    @Test
    @DisplayName("두 형태 모두 정규 URL로, slug만 다른 링크는 하나로")
    void resolves_and_canonicalizes() throws Exception {
        String body = "Links: https://gleam.io/competitions/lSq1Q-s and "
                + "https://gleam.io/7ayJK/steam-key and https://gleam.io/7ayJK/other-slug "
                + "and https://gleam.io/faq plus https://gleam.io/lSq1Q/dup";
        FakePageFetcher fetcher = new FakePageFetcher().page(VIDEO, body);

        IntermediaryResolver resolver = new IntermediaryResolver(FinderConfig.defaults(), fetcher);

        assertThat(resolver.resolve(VIDEO)).containsExactly(
                "https://gleam.io/lSq1Q/-",
                "https://gleam.io/7ayJK/-");
    }

    @Test
    void page_without_links_gives_empty_list() throws Exception {
        FakePageFetcher fetcher = new FakePageFetcher().page(VIDEO, "just a cooking video");
        assertThat(new IntermediaryResolver(FinderConfig.defaults(), fetcher).resolve(VIDEO)).isEmpty();
    }

    @Test
    void fetch_failures_are_reported() {
        FakePageFetcher fetcher = new FakePageFetcher().undecodable(VIDEO);
        assertThatThrownBy(() -> new IntermediaryResolver(FinderConfig.defaults(), fetcher).resolve(VIDEO))
                .isInstanceOfSatisfying(FinderException.class,
                        e -> assertThat(e.error()).isEqualTo(FinderError.INVALID_RESPONSE));
    }

    @Test
    void malformed_url_is_invalid_response_without_fetch() {
        FakePageFetcher fetcher = new FakePageFetcher();
        assertThatThrownBy(() -> new IntermediaryResolver(FinderConfig.defaults(), fetcher).resolve("http://bad host/x"))
                .isInstanceOf(FinderException.class);
        assertThat(fetcher.requested()).isEmpty();
    }
}
