package com.gleamfinder.core.service;

import com.gleamfinder.core.api.IGiveawaySource;
import com.gleamfinder.core.api.IPageFetcher;
import com.gleamfinder.core.giveaway.GiveawayIds;
import com.gleamfinder.core.giveaway.GiveawayLink;
import com.gleamfinder.core.giveaway.GiveawayParser;
import com.gleamfinder.core.http.HttpPageFetcher;
import com.gleamfinder.core.model.FetchedPage;
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

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 2단계: 기브어웨이 페이지 조회 + 파싱.
 *  - fetch: URL 분류 → 정규 URL 조회 → 파싱 (인식 안 되는 URL은 네트워크 접근 없이 실패)
 *  - fetchAll: 순차 처리, 실패 건은 건너뜀, URL이 2개 이상이면 매 시도 뒤 cooldown 대기
 *  - update: 재조회 성공 시 제자리 교체, 실패 시 원래 값 유지
 */
public final class GiveawayService implements IGiveawaySource {

    private static final Logger LOG = LoggerFactory.getLogger(GiveawayService.class);
    private static final EventLog ELOG = EventLog.get(GiveawayService.class);

    private final FinderConfig config;
    private final IPageFetcher fetcher;
    private final Sleeper sleeper;
    private final EpochClock clock;

    /** 기본 구현 */
    public GiveawayService(FinderConfig config) {
        this(config, new HttpPageFetcher(config), new DefaultSleeper(), EpochClock.SYSTEM);
    }

    /** DI/테스트용 */
    public GiveawayService(FinderConfig config, IPageFetcher fetcher, Sleeper sleeper, EpochClock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Giveaway fetch(String url) throws FinderException {
        GiveawayLink link = GiveawayIds.classify(url);
        String id = link.id()
                .orElseThrow(() -> FinderException.invalidResponse("not a giveaway url: " + url));
        String canonical = GiveawayIds.canonicalUrl(id);

        URI uri;
        try {
            uri = URI.create(canonical);
        } catch (IllegalArgumentException e) {
            throw FinderException.invalidResponse("malformed giveaway url: " + url);
        }
        FetchedPage page = fetcher.fetch(uri);
        String body = page.requireText();
        Giveaway g = GiveawayParser.parse(id, body, clock.nowSeconds());
        LOG.debug("Fetched giveaway {} ({}ms)", id, page.getResponseTimeMs());
        return g;
    }

    /** 설정의 cooldown 사용 */
    public List<Giveaway> fetchAll(List<String> urls) throws InterruptedException {
        return fetchAll(urls, config.getCooldown(), ProgressListener.NONE);
    }

    @Override
    public List<Giveaway> fetchAll(List<String> urls, Duration cooldown, ProgressListener listener)
            throws InterruptedException {
        Objects.requireNonNull(urls, "urls");
        Objects.requireNonNull(cooldown, "cooldown");
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        final boolean pace = urls.size() > 1;

        List<Giveaway> out = new ArrayList<>(urls.size());
        int done = 0;
        for (String url : urls) {
            try {
                out.add(fetch(url));
            } catch (FinderException e) {
                ELOG.debug("fetch-failed", "url", url, "error", e.error(), "reason", e.getMessage());
            }
            pl.onProgress("fetch", ++done, urls.size());
            if (pace) {
                sleeper.sleep(cooldown);
            }
        }
        ELOG.info("fetch-all-done", "requested", urls.size(), "parsed", out.size());
        return out;
    }

    @Override
    public boolean update(Giveaway giveaway) {
        Objects.requireNonNull(giveaway, "giveaway");
        try {
            Giveaway fresh = fetch(giveaway.getCanonicalUrl());
            giveaway.replaceWith(fresh);
            return true;
        } catch (FinderException e) {
            ELOG.warn("update-failed", "id", giveaway.getId(), "error", e.error(), "reason", e.getMessage());
            return false;
        }
    }
}
