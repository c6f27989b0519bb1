package com.gleamfinder.core.giveaway;

import com.gleamfinder.core.giveaway.payload.PayloadValue;
import com.gleamfinder.core.model.EntryMethod;
import com.gleamfinder.core.model.FinderException;
import com.gleamfinder.core.model.Giveaway;
import com.gleamfinder.core.scan.TextScan;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * 기브어웨이 페이지 원문 → {@link Giveaway}.
 * <ol>
 *   <li>ng-init 의 initCampaign(...) 페이로드(필수): &amp;quot; 복원 → JSON 파싱 → 필수 키 조회</li>
 *   <li>initEntryCount(...) 호출(선택): 없거나 정수가 아니면 entryCount 없음</li>
 * </ol>
 * 둘 중 1단계가 실패하면 레코드를 만들지 않는다.
 */
public final class GiveawayParser {
    private GiveawayParser() {}

    static final String CAMPAIGN_OPEN = "<div class='popup-blocks-container' ng-init='initCampaign(";
    static final String CAMPAIGN_CLOSE = ")'>";
    static final String QUOTE_ENTITY = "&quot;";
    static final String ENTRY_COUNT_OPEN = "initEntryCount(";
    static final String ENTRY_COUNT_CLOSE = ")";

    /**
     * @param id   정규화된 기브어웨이 코드
     * @param page 페이지 원문
     * @param now  파싱 시각(unix seconds) → lastFetchedAt
     */
    public static Giveaway parse(String id, String page, long now) throws FinderException {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(page, "page");

        String blob = TextScan.betweenStrict(page, CAMPAIGN_OPEN, CAMPAIGN_CLOSE)
                .orElseThrow(() -> FinderException.invalidResponse("no campaign payload on page of " + id));
        PayloadValue root = PayloadValue.parse(blob.replace(QUOTE_ENTITY, "\""));

        PayloadValue campaign = root.requireObject("campaign");
        PayloadValue incentive = root.requireObject("incentive");
        List<PayloadValue> methodsJson = root.requireArray("entry_methods");

        List<EntryMethod> methods = new ArrayList<>(methodsJson.size());
        for (PayloadValue m : methodsJson) {
            methods.add(new EntryMethod(m.requireString("entry_type"), m.requireUnsignedLong("worth")));
        }

        return Giveaway.builder()
                .id(id)
                .name(DescriptionDecoder.decodeHtml(campaign.requireString("name")))
                .description(DescriptionDecoder.decodeHtml(incentive.requireString("description")))
                .entryMethods(methods)
                .startDate(campaign.requireUnsignedLong("starts_at"))
                .endDate(campaign.requireUnsignedLong("ends_at"))
                .entryCount(parseEntryCount(page))
                .lastFetchedAt(now)
                .build();
    }

    /** 2단계: 페이로드와 별개 위치의 카운터 초기화 호출. 실패는 "값 없음"으로 취급. */
    static OptionalLong parseEntryCount(String page) {
        Optional<String> raw = TextScan.betweenStrict(page, ENTRY_COUNT_OPEN, ENTRY_COUNT_CLOSE);
        if (raw.isEmpty()) return OptionalLong.empty();
        try {
            long count = Long.parseLong(raw.get());
            return count < 0 ? OptionalLong.empty() : OptionalLong.of(count);
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }
}
