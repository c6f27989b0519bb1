package com.gleamfinder.core.http;

import com.gleamfinder.core.model.FetchedPage;
import com.gleamfinder.core.model.FinderConfig;
import com.gleamfinder.core.model.FinderError;
import com.gleamfinder.core.model.FinderException;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpPageFetcherTest {

    private static final URI URL = URI.create("https://gleam.io/lSq1Q/-");

    /** 테스트용 HttpResponse<byte[]> */
    static class Resp implements HttpResponse<byte[]> {
        final int code; final Map<String, List<String>> headers; final byte[] body;
        Resp(int code, Map<String, List<String>> headers, byte[] body) {
            this.code = code; this.headers = headers; this.body = body;
        }
        @Override public int statusCode() { return code; }
        @Override public HttpRequest request() { return null; }
        @Override public Optional<HttpResponse<byte[]>> previousResponse() { return Optional.empty(); }
        @Override public HttpHeaders headers() { return HttpHeaders.of(headers, (a, b) -> true); }
        @Override public byte[] body() { return body; }
        @Override public Optional<javax.net.ssl.SSLSession> sslSession() { return Optional.empty(); }
        @Override public URI uri() { return URL; }
        @Override public HttpClient.Version version() { return HttpClient.Version.HTTP_1_1; }
    }

    private HttpServer server;

    @AfterEach
    void stop() {
        if (server != null) server.stop(0);
    }

    @Test
    @DisplayName("User-Agent/Accept 헤더와 타임아웃을 요청에 싣는다")
    void sends_configured_headers() throws Exception {
        FinderConfig cfg = FinderConfig.defaults().setUserAgent("finder-test/1.0").setTimeoutMs(1500);
        List<HttpRequest> seen = new ArrayList<>();
        HttpPageFetcher fetcher = new HttpPageFetcher(cfg, "text/html", req -> {
            seen.add(req);
            return new Resp(200, Map.of("Content-Type", List.of("text/html")),
                    "<html>ok</html>".getBytes(StandardCharsets.UTF_8));
        });

        FetchedPage page = fetcher.fetch(URL);

        assertThat(page.isSuccess()).isTrue();
        assertThat(page.requireText()).isEqualTo("<html>ok</html>");
        assertThat(seen).hasSize(1);
        assertThat(seen.get(0).headers().firstValue("User-Agent")).contains("finder-test/1.0");
        assertThat(seen.get(0).headers().firstValue("Accept")).contains("text/html");
        assertThat(seen.get(0).timeout()).contains(cfg.getTimeout());
    }

    @Test
    @DisplayName("깨진 UTF-8 본문 → UNDECODABLE → INVALID_RESPONSE")
    void malformed_utf8_is_undecodable() {
        byte[] bad = {'o', 'k', (byte) 0xC3, (byte) 0x28};
        HttpPageFetcher fetcher = new HttpPageFetcher(FinderConfig.defaults(), "text/html",
                req -> new Resp(200, Map.of(), bad));

        FetchedPage page = fetcher.fetch(URL);

        assertThat(page.getFailure()).isEqualTo(FetchedPage.Failure.UNDECODABLE);
        assertThatThrownBy(page::requireText)
                .isInstanceOfSatisfying(FinderException.class,
                        e -> assertThat(e.error()).isEqualTo(FinderError.INVALID_RESPONSE));
    }

    @Test
    @DisplayName("전송 예외 → UNREACHABLE → TIMEOUT")
    void transport_error_is_unreachable() {
        HttpPageFetcher fetcher = new HttpPageFetcher(FinderConfig.defaults(), "text/html",
                req -> { throw new HttpTimeoutException("request timed out"); });

        FetchedPage page = fetcher.fetch(URL);

        assertThat(page.getFailure()).isEqualTo(FetchedPage.Failure.UNREACHABLE);
        assertThat(page.getStatusCode()).isEqualTo(-1);
        assertThat(page.getError()).hasValueSatisfying(e -> assertThat(e).contains("timed out"));
        assertThatThrownBy(page::requireText)
                .isInstanceOfSatisfying(FinderException.class, e -> assertThat(e.isTimeout()).isTrue());
    }

    @Test
    void non_2xx_is_invalid_response() {
        HttpPageFetcher fetcher = new HttpPageFetcher(FinderConfig.defaults(), "text/html",
                req -> new Resp(404, Map.of(), "gone".getBytes(StandardCharsets.UTF_8)));

        FetchedPage page = fetcher.fetch(URL);

        assertThat(page.getFailure()).isEqualTo(FetchedPage.Failure.NONE);
        assertThat(page.isSuccess()).isFalse();
        assertThatThrownBy(page::requireText)
                .isInstanceOfSatisfying(FinderException.class,
                        e -> assertThat(e.error()).isEqualTo(FinderError.INVALID_RESPONSE));
    }

    @Test
    @DisplayName("실제 로컬 서버 왕복")
    void real_client_against_local_server() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/page", ex -> {
            byte[] body = "<p>café</p>".getBytes(StandardCharsets.UTF_8);
            ex.getResponseHeaders().add("Content-Type", "text/html; charset=utf-8");
            ex.sendResponseHeaders(200, body.length);
            try (OutputStream os = ex.getResponseBody()) { os.write(body); }
        });
        server.start();

        URI uri = URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/page");
        FetchedPage page = new HttpPageFetcher(FinderConfig.defaults().setTimeoutMs(3000)).fetch(uri);

        assertThat(page.getStatusCode()).isEqualTo(200);
        assertThat(page.getBody()).isEqualTo("<p>café</p>");
        assertThat(page.getResponseTimeMs()).isGreaterThanOrEqualTo(0);
    }
}
