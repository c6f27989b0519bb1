package com.gleamfinder.core.http;

import com.gleamfinder.core.api.IPageFetcher;
import com.gleamfinder.core.model.FetchedPage;
import com.gleamfinder.core.model.FinderConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * java.net.http 기반 기본 페이지 조회기.
 * - 본문은 UTF-8 엄격 디코딩(깨진 바이트 → UNDECODABLE)
 * - 전송 예외(연결/타임아웃) → UNREACHABLE
 * - 재시도 없음: 한 번 보내고 결과를 그대로 돌려준다
 */
public class HttpPageFetcher implements IPageFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(HttpPageFetcher.class);

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<byte[]> send(HttpRequest req) throws Exception;
    }

    private final FinderConfig config;
    private final String accept;
    private final HttpClient client;   // 프로덕션 경로
    private final HttpSender sender;   // 테스트 경로(있으면 이걸 사용)

    public HttpPageFetcher(FinderConfig config) {
        this(config, "text/html,text/plain");
    }

    public HttpPageFetcher(FinderConfig config, String accept) {
        this.config = Objects.requireNonNull(config, "config");
        this.accept = Objects.requireNonNull(accept, "accept");
        this.client = HttpClient.newBuilder()
                .followRedirects(config.isFollowRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .connectTimeout(config.getTimeout())
                .build();
        this.sender = null;
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public HttpPageFetcher(FinderConfig config, String accept, HttpSender testSender) {
        this.config = Objects.requireNonNull(config, "config");
        this.accept = Objects.requireNonNull(accept, "accept");
        this.client = null;
        this.sender = Objects.requireNonNull(testSender, "testSender");
    }

    @Override
    public FetchedPage fetch(URI url) {
        Objects.requireNonNull(url, "url");
        long start = System.nanoTime();

        HttpResponse<byte[]> resp;
        try {
            HttpRequest req = HttpRequest.newBuilder(url)
                    .timeout(config.getTimeout())
                    .header("User-Agent", config.getUserAgent())
                    .header("Accept", accept)
                    .GET()
                    .build();
            resp = (sender != null)
                    ? sender.send(req)
                    : client.send(req, HttpResponse.BodyHandlers.ofByteArray());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FetchedPage.unreachable(url, "interrupted");
        } catch (Exception e) {
            LOG.debug("fetch failed: url={}, error={}", url, e.toString());
            return FetchedPage.unreachable(url, e.toString());
        }

        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        byte[] raw = resp.body() == null ? new byte[0] : resp.body();
        String body;
        try {
            body = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(raw))
                    .toString();
        } catch (CharacterCodingException e) {
            return FetchedPage.undecodable(url, resp.statusCode(), e.toString());
        }

        return FetchedPage.builder()
                .url(url)
                .statusCode(resp.statusCode())
                .body(body)
                .responseTimeMs(elapsedMs)
                .build();
    }
}
