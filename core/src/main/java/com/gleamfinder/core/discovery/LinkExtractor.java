package com.gleamfinder.core.discovery;

import java.util.List;

/** 페이지 원문에서 후보 URL을 뽑는 전략 인터페이스. 순수 함수(네트워크 없음). */
public interface LinkExtractor {
    /**
     * 발견 순서대로 후보 URL 목록을 돌려준다. 못 찾으면 빈 리스트.
     */
    List<String> extract(String pageText);
}
