package com.gleamfinder.core.scan;

/**
 * 마커 사이 매치 결과.
 *
 * @param span         begin/end 마커 "사이"의 내용 범위
 * @param nextPosition 다음 스캔을 시작할 위치 (항상 이전 시작 위치보다 큼)
 */
public record ScanMatch(Span span, int nextPosition) {

    public String value(String text) {
        return span.of(text);
    }
}
