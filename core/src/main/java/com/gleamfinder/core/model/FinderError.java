package com.gleamfinder.core.model;

/** 파이프라인 실패 종류 (두 가지만 구분한다). */
public enum FinderError {
    /** 요청 자체를 끝내지 못함(연결 실패, 타임아웃 등). */
    TIMEOUT,
    /** 응답은 받았으나 필요한 내용이 없음(형태 불일치, 키 누락, 디코딩 불가). */
    INVALID_RESPONSE
}
