package com.gleamfinder.core.giveaway;

import com.gleamfinder.core.scan.Span;
import com.gleamfinder.core.scan.TextScan;

import java.util.Optional;

/**
 * 캠페인 이름/설명 텍스트 디코더.
 * 어느 페이로드에서 왔는지에 따라 두 경로 중 하나만 쓴다(섞지 않음).
 * <ul>
 *   <li>{@link #decodeHtml}: ng-init 페이로드(JSON 파싱 완료 문자열)</li>
 *   <li>{@link #decodeScriptText}: 스크립트 안 JSON을 디코딩 없이 잘라낸 원문 필드</li>
 * </ul>
 */
public final class DescriptionDecoder {
    private DescriptionDecoder() {}

    static final String TAG_OPEN = "<";
    static final String TAG_CLOSE = ">";
    static final char NBSP = '\u00a0';
    static final String APOS_ENTITY = "&#39;";

    // 백슬래시 + u + 4자리 (소스 유니코드 이스케이프 처리를 피하려고 이어 붙임)
    static final String ESCAPE_PREFIX = "\\" + "u";
    static final String ESCAPED_TAG_OPEN = ESCAPE_PREFIX + "003c";
    static final String ESCAPED_TAG_CLOSE = ESCAPE_PREFIX + "003e";
    static final String NUMERIC_REF = "&#";
    static final String ESCAPED_NUMERIC_REF = ESCAPE_PREFIX + "0026#";

    /**
     * 1) {@code <...>} 태그 제거(태그 사이 텍스트는 유지)
     * 2) NBSP → 줄바꿈
     * 3) {@code &#39;} → {@code '}
     */
    public static String decodeHtml(String text) {
        if (text == null || text.isEmpty()) return "";
        String s = stripSpans(text, TAG_OPEN, TAG_CLOSE);
        s = s.replace(String.valueOf(NBSP), "\n");
        return s.replace(APOS_ENTITY, "'");
    }

    /**
     * 1) 이스케이프된 태그 span 제거
     * 2) 첫 미완성 이스케이프 위치에서 자르기
     * 3) {@code &#39;} → {@code '}
     * 4) 남은 숫자 문자 참조를 코드포인트로 치환(잘못된 코드면 거기서 중단, 나머지는 그대로)
     */
    public static String decodeScriptText(String text) {
        if (text == null || text.isEmpty()) return "";
        String s = stripSpans(text, ESCAPED_TAG_OPEN, ESCAPED_TAG_CLOSE);
        s = truncateAtDanglingEscape(s);
        s = s.replace(APOS_ENTITY, "'");
        return resolveNumericReferences(s);
    }

    /** 가장 왼쪽 open 과 그 뒤 첫 close 로 감싼 구간을 구분자째 반복 제거. */
    static String stripSpans(String text, String open, String close) {
        String s = text;
        Optional<Span> span;
        while ((span = TextScan.indexBetweenStrict(s, open, close)).isPresent()) {
            Span in = span.get();
            s = s.substring(0, in.start() - open.length()) + s.substring(in.end() + close.length());
        }
        return s;
    }

    /**
     * 닫히지 않은 이스케이프 태그 시작, 또는 4자리 hex 가 뒤따르지 않는 이스케이프 접두어 중
     * 먼저 나오는 위치에서 자른다. 필드 끝이 이스케이프 중간에서 잘린 경우 대비.
     */
    static String truncateAtDanglingEscape(String s) {
        int cut = s.indexOf(ESCAPED_TAG_OPEN);
        int from = 0;
        int i;
        while ((i = s.indexOf(ESCAPE_PREFIX, from)) >= 0 && (cut < 0 || i < cut)) {
            if (!hasHexDigits(s, i + ESCAPE_PREFIX.length(), 4)) {
                cut = i;
                break;
            }
            from = i + ESCAPE_PREFIX.length();
        }
        return cut < 0 ? s : s.substring(0, cut);
    }

    static String resolveNumericReferences(String s) {
        StringBuilder out = new StringBuilder(s.length());
        int pos = 0;
        while (pos < s.length()) {
            int plain = s.indexOf(NUMERIC_REF, pos);
            int escaped = s.indexOf(ESCAPED_NUMERIC_REF, pos);
            int at;
            String marker;
            if (escaped >= 0 && (plain < 0 || escaped < plain)) {
                at = escaped;
                marker = ESCAPED_NUMERIC_REF;
            } else if (plain >= 0) {
                at = plain;
                marker = NUMERIC_REF;
            } else {
                break;
            }
            int digitsStart = at + marker.length();
            int semi = s.indexOf(';', digitsStart);
            int codePoint = semi < 0 ? -1 : parseCodePoint(s.substring(digitsStart, semi));
            if (codePoint < 0) {
                // 잘못된 참조: 더 이상 치환하지 않는다
                break;
            }
            out.append(s, pos, at).appendCodePoint(codePoint);
            pos = semi + 1;
        }
        return out.append(s, pos, s.length()).toString();
    }

    /** 부호 없는 10진 정수 → 유효 코드포인트. 아니면 -1. */
    private static int parseCodePoint(String digits) {
        if (digits.isEmpty()) return -1;
        for (int i = 0; i < digits.length(); i++) {
            char c = digits.charAt(i);
            if (c < '0' || c > '9') return -1;
        }
        try {
            int cp = Integer.parseUnsignedInt(digits);
            boolean surrogate = cp >= Character.MIN_SURROGATE && cp <= Character.MAX_SURROGATE;
            return (Character.isValidCodePoint(cp) && !surrogate) ? cp : -1;
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private static boolean hasHexDigits(String s, int from, int count) {
        if (from + count > s.length()) return false;
        for (int i = from; i < from + count; i++) {
            if (Character.digit(s.charAt(i), 16) < 0) return false;
        }
        return true;
    }
}
