package com.gleamfinder.core.api;

import com.gleamfinder.core.model.FetchedPage;
import java.net.URI;

/** 페이지 조회 최소 계약: URL 하나를 막힘(blocking) 방식으로 받아온다. 실패도 FetchedPage로 돌려준다. */
public interface IPageFetcher extends AutoCloseable {
    FetchedPage fetch(URI url);
    @Override default void close() throws Exception {}
}
