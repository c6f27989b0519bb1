package com.gleamfinder.core.model;

/**
 * 캠페인 페이로드에서 필수 필드가 없거나 타입이 다름.
 * field 는 점/인덱스 경로 (예: {@code campaign.ends_at}, {@code entry_methods[1].worth}).
 */
public final class MissingFieldException extends FinderException {
    private static final long serialVersionUID = 1L;

    private final String field;

    public MissingFieldException(String field, String expected) {
        super(FinderError.INVALID_RESPONSE, "payload field '" + field + "' missing or not " + expected);
        this.field = field;
    }

    public String field() { return field; }
}
