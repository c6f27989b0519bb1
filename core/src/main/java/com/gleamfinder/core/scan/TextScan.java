package com.gleamfinder.core.scan;

import java.util.Objects;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * 위치 기반 부분 문자열 스캔 유틸.
 * <ul>
 *   <li>마커는 항상 "가장 왼쪽 첫 등장"으로만 매칭 (정규식/파싱 없음)</li>
 *   <li>non-strict: 마커가 없으면 전체(before) 또는 빈 문자열(after/between)</li>
 *   <li>strict: 마커가 없으면 Optional.empty()</li>
 * </ul>
 * 모든 오프셋은 Java 문자열 인덱스(char) 기준.
 */
public final class TextScan {
    private TextScan() {}

    public static String before(String text, String marker) {
        return beforeStrict(text, marker).orElse(text);
    }

    public static Optional<String> beforeStrict(String text, String marker) {
        int i = text.indexOf(marker);
        return i < 0 ? Optional.empty() : Optional.of(text.substring(0, i));
    }

    public static String after(String text, String marker) {
        return afterStrict(text, marker).orElse("");
    }

    public static Optional<String> afterStrict(String text, String marker) {
        int i = text.indexOf(marker);
        return i < 0 ? Optional.empty() : Optional.of(text.substring(i + marker.length()));
    }

    /** before(after(text, begin), end). 어느 마커든 없으면 빈 문자열. 호출자가 빈 값을 실패로 판단해야 한다. */
    public static String between(String text, String begin, String end) {
        return betweenStrict(text, begin, end).orElse("");
    }

    public static Optional<String> betweenStrict(String text, String begin, String end) {
        return indexBetweenStrict(text, begin, end).map(s -> s.of(text));
    }

    /** betweenStrict와 같지만 내용의 [start, end) 범위를 돌려준다. */
    public static Optional<Span> indexBetweenStrict(String text, String begin, String end) {
        return find(text, 0, begin, end).map(ScanMatch::span);
    }

    /**
     * from 위치부터 begin...end 를 찾는다.
     * nextPosition 은 end 마커 시작 위치(=내용 끝)이며, 빈 내용이어도 begin 마커 뒤로는 반드시 전진한다.
     */
    public static Optional<ScanMatch> find(String text, int from, String begin, String end) {
        Objects.requireNonNull(text, "text");
        requireMarker(begin, "begin");
        requireMarker(end, "end");
        if (from < 0 || from > text.length()) return Optional.empty();

        int b = text.indexOf(begin, from);
        if (b < 0) return Optional.empty();
        int contentStart = b + begin.length();
        int e = text.indexOf(end, contentStart);
        if (e < 0) return Optional.empty();
        return Optional.of(new ScanMatch(new Span(contentStart, e), Math.max(e, contentStart)));
    }

    /**
     * text 전체에 대한 begin...end 매치의 지연(lazy) 유한 스트림.
     * 각 단계는 이전 매치의 nextPosition 에서 다시 시작한다.
     */
    public static Stream<ScanMatch> matches(String text, String begin, String end) {
        Objects.requireNonNull(text, "text");
        requireMarker(begin, "begin");
        requireMarker(end, "end");
        Spliterator<ScanMatch> it = new Spliterators.AbstractSpliterator<>(Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL) {
            private int pos = 0;

            @Override
            public boolean tryAdvance(Consumer<? super ScanMatch> action) {
                Optional<ScanMatch> m = find(text, pos, begin, end);
                if (m.isEmpty()) return false;
                pos = m.get().nextPosition();
                action.accept(m.get());
                return true;
            }
        };
        return StreamSupport.stream(it, false);
    }

    private static void requireMarker(String marker, String name) {
        Objects.requireNonNull(marker, name);
        if (marker.isEmpty()) throw new IllegalArgumentException(name + " marker must not be empty");
    }
}
