package com.gleamfinder.core.discovery;

import com.gleamfinder.core.api.IPageFetcher;
import com.gleamfinder.core.model.FetchedPage;
import com.gleamfinder.core.model.FinderConfig;
import com.gleamfinder.core.model.FinderException;
import com.gleamfinder.core.util.EventLog;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/**
 * 1단계(a): 검색 엔진 결과 페이지 한 장을 받아 결과 링크를 뽑는다.
 * 페이지네이션은 호출자가 page 번호로 제어한다(한 번에 한 페이지).
 */
public final class SearchClient {

    private static final EventLog ELOG = EventLog.get(SearchClient.class);

    private final FinderConfig.SearchCfg cfg;
    private final IPageFetcher fetcher;
    private final LinkExtractor extractor;

    public SearchClient(FinderConfig config, IPageFetcher fetcher) {
        this(config.getSearch(), fetcher, new ResultsPageLinkExtractor(config.getSearch()));
    }

    public SearchClient(FinderConfig.SearchCfg cfg, IPageFetcher fetcher, LinkExtractor extractor) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
    }

    /** 예: https://www.google.com/search?q=%22gleam.io%22&tbs=qdr%3Ah&filter=0&start=10 (page=1) */
    public URI searchUrl(int page) {
        if (page < 0) throw new IllegalArgumentException("page must be >= 0");
        String url = cfg.getBaseUrl()
                + "?q=" + enc(cfg.getQuery())
                + "&tbs=" + enc(cfg.getRecency())
                + "&filter=0"
                + "&start=" + ((long) page * cfg.getResultsPerPage());
        return URI.create(url);
    }

    /**
     * 결과 링크 목록(발견 순서). 결과가 없으면 빈 리스트.
     * 조회 실패는 TIMEOUT, 디코딩 불가/비정상 상태코드는 INVALID_RESPONSE.
     */
    public List<String> search(int page) throws FinderException {
        URI url = searchUrl(page);
        FetchedPage fetched = fetcher.fetch(url);
        String body = fetched.requireText();
        List<String> links = extractor.extract(body);
        ELOG.info("search-done", "page", page, "links", links.size(), "ms", fetched.getResponseTimeMs());
        return links;
    }

    private static String enc(String s) {
        return URLEncoder.encode(s == null ? "" : s, StandardCharsets.UTF_8);
    }
}
