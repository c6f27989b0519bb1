package com.gleamfinder.core.giveaway;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * gleam.io URL → 기브어웨이 ID(5자 코드) 정규화.
 * 두 형태만 인정하고 나머지는 조용히 UNRECOGNIZED 로 분류한다.
 * 정규 URL은 항상 {@code https://gleam.io/<code>/-} 로 재구성 → slug만 다른 링크가 하나로 합쳐진다.
 */
public final class GiveawayIds {
    private GiveawayIds() {}

    public static final String PLATFORM_ROOT = "https://gleam.io/";
    static final String COMPETITIONS_PREFIX = PLATFORM_ROOT + "competitions/";

    static final int CODE_LENGTH = 5;
    /** COMPETITION 형태 전체 길이: prefix(30) + code(5) + "-x"(2) */
    static final int COMPETITION_URL_LENGTH = COMPETITIONS_PREFIX.length() + CODE_LENGTH + 2;
    /** SLUG 형태 최소 길이: root(17) + code(5) + "/"(1) */
    static final int SLUG_MIN_LENGTH = PLATFORM_ROOT.length() + CODE_LENGTH + 1;

    public static GiveawayLink classify(String url) {
        if (url == null) return GiveawayLink.UNRECOGNIZED;

        if (url.length() == COMPETITION_URL_LENGTH && url.startsWith(COMPETITIONS_PREFIX)) {
            int at = COMPETITIONS_PREFIX.length();
            return GiveawayLink.competition(url.substring(at, at + CODE_LENGTH));
        }
        int at = PLATFORM_ROOT.length();
        if (url.length() >= SLUG_MIN_LENGTH
                && url.startsWith(PLATFORM_ROOT)
                && url.charAt(at + CODE_LENGTH) == '/') {
            return GiveawayLink.slug(url.substring(at, at + CODE_LENGTH));
        }
        return GiveawayLink.UNRECOGNIZED;
    }

    public static Optional<String> extractId(String url) {
        return classify(url).id();
    }

    public static String canonicalUrl(String code) {
        return PLATFORM_ROOT + code + "/-";
    }

    /** 인식된 URL만 정규 URL로 바꾸고 첫 등장 순서를 유지하며 중복 제거. */
    public static List<String> canonicalize(Collection<String> urls) {
        Set<String> out = new LinkedHashSet<>();
        for (String u : urls) {
            classify(u).canonicalUrl().ifPresent(out::add);
        }
        return List.copyOf(out);
    }
}
