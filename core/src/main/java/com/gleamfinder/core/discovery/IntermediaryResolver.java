package com.gleamfinder.core.discovery;

import com.gleamfinder.core.api.IPageFetcher;
import com.gleamfinder.core.giveaway.GiveawayIds;
import com.gleamfinder.core.model.FetchedPage;
import com.gleamfinder.core.model.FinderConfig;
import com.gleamfinder.core.model.FinderException;
import com.gleamfinder.core.util.EventLog;

import java.net.URI;
import java.util.List;
import java.util.Objects;

/**
 * 1단계(b): 중개 페이지(동영상/블로그 등)에서 gleam.io 링크를 찾아
 * 정규 URL({@code https://gleam.io/<id>/-}) 목록으로 돌려준다.
 * 기브어웨이 형태가 아닌 링크는 조용히 버린다.
 */
public final class IntermediaryResolver {

    private static final EventLog ELOG = EventLog.get(IntermediaryResolver.class);

    private final IPageFetcher fetcher;
    private final LinkExtractor extractor;

    public IntermediaryResolver(FinderConfig config, IPageFetcher fetcher) {
        this(fetcher, new EmbeddedLinkExtractor(GiveawayIds.PLATFORM_ROOT, config.getMaxEmbeddedPathLength()));
    }

    public IntermediaryResolver(IPageFetcher fetcher, LinkExtractor extractor) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
    }

    public List<String> resolve(String url) throws FinderException {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw FinderException.invalidResponse("malformed intermediary url: " + url);
        }
        FetchedPage page = fetcher.fetch(uri);
        String body = page.requireText();
        return resolveText(url, body);
    }

    /** 이미 받아 둔 원문에서 정규 URL 목록을 만든다. */
    public List<String> resolveText(String source, String body) {
        List<String> candidates = extractor.extract(body);
        List<String> canonical = GiveawayIds.canonicalize(candidates);
        ELOG.debug("resolve-done", "source", source, "candidates", candidates.size(), "giveaways", canonical.size());
        return canonical;
    }
}
