package com.gleamfinder.core.service;

import com.gleamfinder.core.api.IGiveawaySource;
import com.gleamfinder.core.api.IPageFetcher;
import com.gleamfinder.core.discovery.IntermediaryResolver;
import com.gleamfinder.core.discovery.SearchClient;
import com.gleamfinder.core.http.HttpPageFetcher;
import com.gleamfinder.core.model.FinderConfig;
import com.gleamfinder.core.model.FinderException;
import com.gleamfinder.core.model.Giveaway;
import com.gleamfinder.core.util.DefaultSleeper;
import com.gleamfinder.core.util.EpochClock;
import com.gleamfinder.core.util.EventLog;
import com.gleamfinder.core.util.ProgressListener;
import com.gleamfinder.core.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 전체 파이프라인 오케스트레이터:
 *  - search(page 0..pages-1) → resolve(결과 링크마다) → 정규 URL 수집(실행 전체 중복 제거) → fetchAll
 *  - 개별 검색/해석 실패는 로그만 남기고 건너뜀
 *  - 연속 요청 사이에는 cooldown 대기(첫 요청 제외)
 */
public final class DiscoveryService {

    private static final Logger LOG = LoggerFactory.getLogger(DiscoveryService.class);
    private static final EventLog ELOG = EventLog.get(DiscoveryService.class);

    private final FinderConfig config;
    private final SearchClient search;
    private final IntermediaryResolver resolver;
    private final IGiveawaySource giveaways;
    private final Sleeper sleeper;

    /** 기본 구현: 하나의 HttpPageFetcher 공유 */
    public DiscoveryService(FinderConfig config) {
        this(config, new HttpPageFetcher(config), new DefaultSleeper(), EpochClock.SYSTEM);
    }

    /** DI/테스트용 */
    public DiscoveryService(FinderConfig config, IPageFetcher fetcher, Sleeper sleeper, EpochClock clock) {
        this(config,
                new SearchClient(config, fetcher),
                new IntermediaryResolver(config, fetcher),
                new GiveawayService(config, fetcher, sleeper, clock),
                sleeper);
    }

    public DiscoveryService(FinderConfig config, SearchClient search, IntermediaryResolver resolver,
                            IGiveawaySource giveaways, Sleeper sleeper) {
        this.config = Objects.requireNonNull(config, "config");
        this.search = Objects.requireNonNull(search, "search");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.giveaways = Objects.requireNonNull(giveaways, "giveaways");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /** 설정의 pages 사용 */
    public List<Giveaway> discover() throws InterruptedException {
        return discover(config.getPages(), ProgressListener.NONE);
    }

    public List<Giveaway> discover(int pages) throws InterruptedException {
        return discover(pages, ProgressListener.NONE);
    }

    public List<Giveaway> discover(int pages, ProgressListener listener) throws InterruptedException {
        if (pages < 0) throw new IllegalArgumentException("pages must be >= 0");
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;

        LOG.info("Discovery start: pages={}, cooldown={}ms", pages, config.getCooldown().toMillis());
        ELOG.info("discover-start", "pages", pages, "cooldownMs", config.getCooldown().toMillis());

        // ---- 1) 검색 결과 링크 ----
        List<String> outbound = new ArrayList<>();
        boolean first = true;
        for (int page = 0; page < pages; page++) {
            if (!first) sleeper.sleep(config.getCooldown());
            first = false;
            try {
                outbound.addAll(search.search(page));
            } catch (FinderException e) {
                ELOG.warn("search-failed", "page", page, "error", e.error(), "reason", e.getMessage());
            }
            pl.onProgress("search", page + 1, pages);
        }

        // ---- 2) 중개 페이지 해석 → 정규 URL (실행 전체 중복 제거) ----
        Set<String> canonical = new LinkedHashSet<>();
        int done = 0;
        for (String link : outbound) {
            if (!first) sleeper.sleep(config.getCooldown());
            first = false;
            try {
                canonical.addAll(resolver.resolve(link));
            } catch (FinderException e) {
                ELOG.debug("resolve-failed", "url", link, "error", e.error(), "reason", e.getMessage());
            }
            pl.onProgress("resolve", ++done, outbound.size());
        }

        // ---- 3) 기브어웨이 조회 ----
        List<Giveaway> out = giveaways.fetchAll(new ArrayList<>(canonical), config.getCooldown(), pl);

        LOG.info("Discovery done: links={}, giveaways={}, parsed={}", outbound.size(), canonical.size(), out.size());
        ELOG.info("discover-done", "links", outbound.size(), "candidates", canonical.size(), "parsed", out.size());
        return out;
    }
}
