package com.gleamfinder.core.model;

import java.net.URI;
import java.util.Objects;
import java.util.Optional;

/** 페이지 조회 결과 캡처(본문은 텍스트 기준). 전송 실패도 예외 대신 failure 로 표현한다. */
public final class FetchedPage {

    /** 전송 계층 실패 구분 */
    public enum Failure {
        NONE,
        /** 연결/타임아웃 등으로 응답을 못 받음 */
        UNREACHABLE,
        /** 응답은 받았으나 본문을 텍스트로 디코딩할 수 없음 */
        UNDECODABLE
    }

    private final URI url;
    private final int statusCode;
    private final String body;
    private final long responseTimeMs;
    private final Failure failure;
    private final String error;

    private FetchedPage(Builder b) {
        this.url = b.url;
        this.statusCode = b.statusCode;
        this.body = (b.body == null) ? "" : b.body;
        this.responseTimeMs = b.responseTimeMs;
        this.failure = (b.failure == null) ? Failure.NONE : b.failure;
        this.error = b.error;
    }

    public static FetchedPage ok(URI url, int statusCode, String body) {
        return builder().url(url).statusCode(statusCode).body(body).build();
    }

    public static FetchedPage unreachable(URI url, String error) {
        return builder().url(url).statusCode(-1).failure(Failure.UNREACHABLE).error(error).build();
    }

    public static FetchedPage undecodable(URI url, int statusCode, String error) {
        return builder().url(url).statusCode(statusCode).failure(Failure.UNDECODABLE).error(error).build();
    }

    public URI getUrl() { return url; }
    public int getStatusCode() { return statusCode; }
    public String getBody() { return body; }
    public long getResponseTimeMs() { return responseTimeMs; }
    public Failure getFailure() { return failure; }
    public Optional<String> getError() { return Optional.ofNullable(error); }

    public boolean isSuccess() {
        return failure == Failure.NONE && statusCode >= 200 && statusCode < 300;
    }

    /**
     * 본문 텍스트를 돌려주거나 실패 종류에 맞는 예외를 던진다.
     * UNREACHABLE → TIMEOUT, UNDECODABLE/비 2xx → INVALID_RESPONSE.
     */
    public String requireText() throws FinderException {
        switch (failure) {
            case UNREACHABLE:
                throw FinderException.timeout("fetch failed for " + url + ": " + error);
            case UNDECODABLE:
                throw FinderException.invalidResponse("body of " + url + " is not text: " + error);
            default:
                break;
        }
        if (statusCode < 200 || statusCode >= 300) {
            throw FinderException.invalidResponse("unexpected status " + statusCode + " for " + url);
        }
        return body;
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private URI url;
        private int statusCode;
        private String body;
        private long responseTimeMs;
        private Failure failure;
        private String error;

        public Builder url(URI url) { this.url = url; return this; }
        public Builder statusCode(int statusCode) { this.statusCode = statusCode; return this; }
        public Builder body(String body) { this.body = body; return this; }
        public Builder responseTimeMs(long responseTimeMs) { this.responseTimeMs = responseTimeMs; return this; }
        public Builder failure(Failure failure) { this.failure = failure; return this; }
        public Builder error(String error) { this.error = error; return this; }

        public FetchedPage build() {
            Objects.requireNonNull(url, "url");
            return new FetchedPage(this);
        }
    }
}
