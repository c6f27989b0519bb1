package com.gleamfinder.core.giveaway;

import java.util.Objects;
import java.util.Optional;

/**
 * URL 형태 분류 결과.
 * COMPETITION/SLUG 이면 code 가 있고, UNRECOGNIZED 이면 code 가 없다.
 */
public record GiveawayLink(Kind kind, String code) {

    public enum Kind {
        /** https://gleam.io/competitions/XXXXX-s (고정 길이) */
        COMPETITION,
        /** https://gleam.io/XXXXX/어떤-slug */
        SLUG,
        /** 기브어웨이 링크 아님 */
        UNRECOGNIZED
    }

    public static final GiveawayLink UNRECOGNIZED = new GiveawayLink(Kind.UNRECOGNIZED, null);

    public GiveawayLink {
        Objects.requireNonNull(kind, "kind");
        if ((kind == Kind.UNRECOGNIZED) != (code == null)) {
            throw new IllegalArgumentException("code must be present iff kind is recognized");
        }
    }

    static GiveawayLink competition(String code) { return new GiveawayLink(Kind.COMPETITION, code); }

    static GiveawayLink slug(String code) { return new GiveawayLink(Kind.SLUG, code); }

    public boolean isRecognized() { return kind != Kind.UNRECOGNIZED; }

    public Optional<String> id() { return Optional.ofNullable(code); }

    /** 인식된 링크의 정규 URL. 미인식이면 empty. */
    public Optional<String> canonicalUrl() { return id().map(GiveawayIds::canonicalUrl); }
}
