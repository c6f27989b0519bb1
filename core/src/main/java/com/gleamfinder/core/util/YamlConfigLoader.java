package com.gleamfinder.core.util;

import com.gleamfinder.core.model.FinderConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * 루트 finder.yml을 읽어 FinderConfig로 변환.
 *
 * 예상 YAML 키:
 * timeoutMs: 10000
 * cooldownMs: 5000
 * userAgent: "Mozilla/5.0 ..."
 * followRedirects: true
 * maxEmbeddedPathLength: 20
 * pages: 1
 *
 * # 검색 결과 페이지(옵션)
 * search:
 *   baseUrl: "https://www.google.com/search"
 *   query: "\"gleam.io\""
 *   recency: "qdr:h"
 *   resultsPerPage: 10
 *   linkOpenMarker: "\"><a href=\""
 *   linkCloseMarker: "\""
 *   acceptMarkers: ["\" onmousedown=\"return rwt(", "\" data-ved=\"2a"]
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    public static FinderConfig loadDefault() throws IOException {
        return load(Path.of("finder.yml"));
    }

    public static FinderConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("finder.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            Object root = yaml.load(in);

            FinderConfig cfg = FinderConfig.defaults();

            if (!(root instanceof Map<?, ?> map)) {
                // 비어있거나 단순 스칼라면 defaults 유지
                cfg.validate();
                return cfg;
            }

            // 1) 평면 키
            setMillis(map, "timeoutMs", cfg::setTimeout, false);
            setMillis(map, "cooldownMs", cfg::setCooldown, true);
            setString(map, "userAgent", cfg::setUserAgent);
            setBoolean(map, "followRedirects", cfg::setFollowRedirects);
            setInt(map, "maxEmbeddedPathLength", cfg::setMaxEmbeddedPathLength);
            setInt(map, "pages", cfg::setPages);

            // 2) search.*
            Map<String, Object> search = getMap(map, "search");
            if (search != null) {
                var s = cfg.getSearch();
                setString(search, "baseUrl", s::setBaseUrl);
                setString(search, "query", s::setQuery);
                setString(search, "recency", s::setRecency);
                setInt(search, "resultsPerPage", s::setResultsPerPage);
                setString(search, "linkOpenMarker", s::setLinkOpenMarker);
                setString(search, "linkCloseMarker", s::setLinkCloseMarker);
                setStringList(search, "acceptMarkers", s::setAcceptMarkers);
            }

            cfg.validate();
            return cfg;
        }
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (!(v instanceof List<?> list)) return;
        List<String> out = new ArrayList<>();
        for (Object o : list) if (o != null) out.add(String.valueOf(o));
        if (!out.isEmpty()) setter.accept(List.copyOf(out));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    /** 밀리초 정수 → Duration. allowZero=false 면 0 이하는 무시(기본값 유지). */
    private static void setMillis(Map<?, ?> map, String key, Consumer<Duration> setter, boolean allowZero) {
        Object v = map.get(key);
        if (v == null) return;
        long ms = (v instanceof Number n) ? n.longValue() : Long.parseLong(String.valueOf(v).trim());
        if (ms > 0 || (allowZero && ms == 0)) setter.accept(Duration.ofMillis(ms));
    }
}
