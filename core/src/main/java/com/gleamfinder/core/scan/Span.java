package com.gleamfinder.core.scan;

/**
 * 원문 안의 반개구간 [start, end). 항상 원문의 유효한 부분 범위다.
 */
public record Span(int start, int end) {

    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("invalid span [" + start + ", " + end + ")");
        }
    }

    public int length() { return end - start; }

    public boolean isEmpty() { return start == end; }

    /** 원문에서 이 범위의 문자열을 잘라낸다. */
    public String of(String text) {
        return text.substring(start, end);
    }
}
