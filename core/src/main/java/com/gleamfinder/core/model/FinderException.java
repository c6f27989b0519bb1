package com.gleamfinder.core.model;

import java.util.Objects;

/** 검색/해석/기브어웨이 조회 실패. {@link #error()} 로 종류를 구분한다. */
public class FinderException extends Exception {
    private static final long serialVersionUID = 1L;

    private final FinderError error;

    public FinderException(FinderError error, String message) {
        super(message);
        this.error = Objects.requireNonNull(error, "error");
    }

    public FinderException(FinderError error, String message, Throwable cause) {
        super(message, cause);
        this.error = Objects.requireNonNull(error, "error");
    }

    public static FinderException timeout(String message) {
        return new FinderException(FinderError.TIMEOUT, message);
    }

    public static FinderException invalidResponse(String message) {
        return new FinderException(FinderError.INVALID_RESPONSE, message);
    }

    public FinderError error() { return error; }

    public boolean isTimeout() { return error == FinderError.TIMEOUT; }
}
