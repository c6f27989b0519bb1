package com.gleamfinder.core.api;

import com.gleamfinder.core.model.FinderException;
import com.gleamfinder.core.model.Giveaway;
import com.gleamfinder.core.util.ProgressListener;

import java.time.Duration;
import java.util.List;

/** 기브어웨이 조회 계약: 단건 fetch / 일괄 fetchAll / 재조회 update. */
public interface IGiveawaySource {
    Giveaway fetch(String url) throws FinderException;

    /** 진행률(phase="fetch") 보고 포함 */
    List<Giveaway> fetchAll(List<String> urls, Duration cooldown, ProgressListener listener)
            throws InterruptedException;

    default List<Giveaway> fetchAll(List<String> urls, Duration cooldown) throws InterruptedException {
        return fetchAll(urls, cooldown, ProgressListener.NONE);
    }

    boolean update(Giveaway giveaway);
}
