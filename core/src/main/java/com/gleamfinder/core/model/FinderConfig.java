package com.gleamfinder.core.model;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * 파인더 설정 (finder.yml 매핑 대상). 순수 설정 보관용.
 * 기본값은 실제 운영에서 쓰던 상수와 같다.
 */
public final class FinderConfig {

    /** 검색 결과 페이지 관련 하위 설정: YAML의 `search:` 섹션과 매핑 */
    public static final class SearchCfg {
        private String baseUrl = "https://www.google.com/search";
        /** 검색어(따옴표 포함, URL 인코딩해서 q= 로 전달) */
        private String query = "\"gleam.io\"";
        /** tbs 파라미터. 기본: 최근 1시간 */
        private String recency = "qdr:h";
        private int resultsPerPage = 10;
        /** 결과 링크 시작 마커 */
        private String linkOpenMarker = "\"><a href=\"";
        /** 결과 링크(URL 텍스트) 끝 마커 */
        private String linkCloseMarker = "\"";
        /** URL 바로 뒤가 이 중 하나로 시작해야 결과 링크로 인정 */
        private List<String> acceptMarkers = List.of(
                "\" onmousedown=\"return rwt(",
                "\" data-ved=\"2a");

        public String getBaseUrl() { return baseUrl; }
        public SearchCfg setBaseUrl(String v) { this.baseUrl = v; return this; }

        public String getQuery() { return query; }
        public SearchCfg setQuery(String v) { this.query = v; return this; }

        public String getRecency() { return recency; }
        public SearchCfg setRecency(String v) { this.recency = v; return this; }

        public int getResultsPerPage() { return resultsPerPage; }
        public SearchCfg setResultsPerPage(int v) { this.resultsPerPage = v; return this; }

        public String getLinkOpenMarker() { return linkOpenMarker; }
        public SearchCfg setLinkOpenMarker(String v) { this.linkOpenMarker = v; return this; }

        public String getLinkCloseMarker() { return linkCloseMarker; }
        public SearchCfg setLinkCloseMarker(String v) { this.linkCloseMarker = v; return this; }

        public List<String> getAcceptMarkers() { return acceptMarkers; }
        public SearchCfg setAcceptMarkers(List<String> v) {
            if (v != null && !v.isEmpty()) this.acceptMarkers = List.copyOf(v);
            return this;
        }
    }

    private Duration timeout = Duration.ofSeconds(10);
    /** 연속 요청 사이 고정 대기(fetchAll, discover) */
    private Duration cooldown = Duration.ofSeconds(5);
    private String userAgent = "Mozilla/5.0 (X11; Linux x86_64; rv:72.0) Gecko/20100101 Firefox/72.0";
    private boolean followRedirects = true;
    /** 임베디드 링크 경로 최대 길이(초과분은 잘라냄) */
    private int maxEmbeddedPathLength = 20;
    /** discover() 기본 검색 페이지 수 */
    private int pages = 1;

    private SearchCfg search = new SearchCfg();

    // ---------- getters ----------
    public Duration getTimeout() { return timeout; }
    public Duration getCooldown() { return cooldown; }
    public String getUserAgent() { return userAgent; }
    public boolean isFollowRedirects() { return followRedirects; }
    public int getMaxEmbeddedPathLength() { return maxEmbeddedPathLength; }
    public int getPages() { return pages; }
    public SearchCfg getSearch() { return search; }

    // ---------- fluent setters ----------
    public FinderConfig setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    public FinderConfig setCooldown(Duration cooldown) { this.cooldown = cooldown; return this; }
    public FinderConfig setUserAgent(String userAgent) { this.userAgent = userAgent; return this; }
    public FinderConfig setFollowRedirects(boolean v) { this.followRedirects = v; return this; }
    public FinderConfig setMaxEmbeddedPathLength(int v) { this.maxEmbeddedPathLength = v; return this; }
    public FinderConfig setPages(int pages) { this.pages = pages; return this; }
    public FinderConfig setSearch(SearchCfg search) { this.search = (search != null ? search : new SearchCfg()); return this; }

    // ---------- validate ----------
    public void validate() {
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");
        if (cooldown == null || cooldown.isNegative())
            throw new IllegalArgumentException("cooldown must be >= 0");
        if (userAgent == null || userAgent.isBlank())
            throw new IllegalArgumentException("userAgent must not be blank");
        if (maxEmbeddedPathLength < 1)
            throw new IllegalArgumentException("maxEmbeddedPathLength must be >= 1");
        if (pages < 0) throw new IllegalArgumentException("pages must be >= 0");

        Objects.requireNonNull(search, "search");
        if (search.getBaseUrl() == null || search.getBaseUrl().isBlank())
            throw new IllegalArgumentException("search.baseUrl must not be blank");
        Objects.requireNonNull(search.getQuery(), "search.query");
        if (search.getResultsPerPage() < 1)
            throw new IllegalArgumentException("search.resultsPerPage must be >= 1");
        if (isBlank(search.getLinkOpenMarker()) || isBlank(search.getLinkCloseMarker()))
            throw new IllegalArgumentException("search link markers must not be empty");
        Objects.requireNonNull(search.getAcceptMarkers(), "search.acceptMarkers");
    }

    private static boolean isBlank(String s) { return s == null || s.isEmpty(); }

    // ---------- helpers ----------
    public static FinderConfig defaults() { return new FinderConfig(); }

    public long getTimeoutMs() { return timeout.toMillis(); }

    public FinderConfig setTimeoutMs(long ms) {
        this.timeout = Duration.ofMillis(Math.max(1, ms));
        return this;
    }
}
