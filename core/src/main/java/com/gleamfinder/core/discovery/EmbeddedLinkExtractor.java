package com.gleamfinder.core.discovery;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 임베디드 링크 모드(동영상 설명, 블로그 글 등 임의 페이지).
 * - prefix(scheme+host) 를 찾으면 [A-Za-z0-9-/_] 가 이어지는 만큼 경로로 읽는다
 * - 경로는 maxPathLength 로 자르고, 비어 있으면 버린다
 * - 다음 스캔은 prefix 직후에서 이어진다(경로 끝이 아님)
 * - 같은 호출 안에서 문자열 완전 일치로 중복 제거
 */
public final class EmbeddedLinkExtractor implements LinkExtractor {

    private final String prefix;
    private final int maxPathLength;

    public EmbeddedLinkExtractor(String prefix, int maxPathLength) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
        if (prefix.isEmpty()) throw new IllegalArgumentException("prefix must not be empty");
        if (maxPathLength < 1) throw new IllegalArgumentException("maxPathLength must be >= 1");
        this.maxPathLength = maxPathLength;
    }

    @Override
    public List<String> extract(String pageText) {
        Set<String> out = new LinkedHashSet<>();
        if (pageText == null || pageText.isEmpty()) return new ArrayList<>(out);

        int pos = 0;
        int at;
        while ((at = pageText.indexOf(prefix, pos)) >= 0) {
            pos = at + prefix.length();
            int len = pathLength(pageText, pos);
            if (len == 0) continue;
            out.add(prefix + pageText.substring(pos, pos + Math.min(len, maxPathLength)));
        }
        return new ArrayList<>(out);
    }

    /** from 부터 허용 문자 연속 길이 */
    static int pathLength(String text, int from) {
        int i = from;
        while (i < text.length() && isPathChar(text.charAt(i))) i++;
        return i - from;
    }

    static boolean isPathChar(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
                || c == '-' || c == '/' || c == '_';
    }
}
