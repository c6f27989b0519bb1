package com.gleamfinder.core.discovery;

import com.gleamfinder.core.model.FinderConfig;
import com.gleamfinder.core.scan.ScanMatch;
import com.gleamfinder.core.scan.TextScan;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 검색 결과 페이지 모드.
 * openMarker ... closeMarker 사이 텍스트를 URL로 보고,
 * URL 바로 뒤가 acceptMarkers 중 하나로 시작할 때만 결과 링크로 인정한다.
 * 다음 스캔은 찾은 URL 텍스트 끝에서 이어진다(별도 중복 제거 없음).
 */
public final class ResultsPageLinkExtractor implements LinkExtractor {

    private final String openMarker;
    private final String closeMarker;
    private final List<String> acceptMarkers;

    public ResultsPageLinkExtractor(FinderConfig.SearchCfg cfg) {
        this(cfg.getLinkOpenMarker(), cfg.getLinkCloseMarker(), cfg.getAcceptMarkers());
    }

    public ResultsPageLinkExtractor(String openMarker, String closeMarker, List<String> acceptMarkers) {
        this.openMarker = Objects.requireNonNull(openMarker, "openMarker");
        this.closeMarker = Objects.requireNonNull(closeMarker, "closeMarker");
        this.acceptMarkers = List.copyOf(acceptMarkers);
    }

    @Override
    public List<String> extract(String pageText) {
        List<String> out = new ArrayList<>();
        if (pageText == null || pageText.isEmpty()) return out;

        TextScan.matches(pageText, openMarker, closeMarker).forEach(m -> {
            if (isAccepted(pageText, m)) out.add(m.value(pageText));
        });
        return out;
    }

    private boolean isAccepted(String text, ScanMatch m) {
        int tail = m.span().end();
        for (String accept : acceptMarkers) {
            if (text.startsWith(accept, tail)) return true;
        }
        return false;
    }
}
