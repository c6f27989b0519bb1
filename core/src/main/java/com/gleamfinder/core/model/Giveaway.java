package com.gleamfinder.core.model;

import com.gleamfinder.core.giveaway.GiveawayIds;

import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * gleam.io 기브어웨이 한 건.
 * - 항상 완전한 상태로만 생성된다(build()에서 필수값 검사)
 * - startDate/endDate 사이 순서는 검증하지 않는다(페이지 데이터가 어길 수 있음)
 * - 스레드 안전하지 않음: {@link #replaceWith(Giveaway)} 가 제자리 갱신한다
 */
public final class Giveaway {
    private final String id;
    private String name;
    private String description;
    private OptionalLong entryCount;
    private List<EntryMethod> entryMethods;
    private long startDate;
    private long endDate;
    private long lastFetchedAt;

    private Giveaway(Builder b) {
        this.id = b.id;
        this.name = b.name;
        this.description = b.description;
        this.entryCount = b.entryCount;
        this.entryMethods = List.copyOf(b.entryMethods);
        this.startDate = b.startDate;
        this.endDate = b.endDate;
        this.lastFetchedAt = b.lastFetchedAt;
    }

    public String getId() { return id; }
    /** id에서 결정적으로 만든 slug 없는 URL */
    public String getCanonicalUrl() { return GiveawayIds.canonicalUrl(id); }
    public String getName() { return name; }
    public String getDescription() { return description; }
    public OptionalLong getEntryCount() { return entryCount; }
    public List<EntryMethod> getEntryMethods() { return entryMethods; }
    /** unix seconds */
    public long getStartDate() { return startDate; }
    /** unix seconds */
    public long getEndDate() { return endDate; }
    /** 파싱 시각(unix seconds). 페이지에서 온 값이 아님 */
    public long getLastFetchedAt() { return lastFetchedAt; }

    /** now(unix seconds) 기준 진행 중 여부: start <= now < end */
    public boolean isRunning(long now) {
        return startDate <= now && now < endDate;
    }

    /** 계정당 최대 응모 수 = 모든 응모 방법 worth 합 */
    public long getMaxEntriesPerAccount() {
        return entryMethods.stream().mapToLong(EntryMethod::worth).sum();
    }

    /** 같은 id의 새 레코드로 모든 필드를 교체한다. */
    public void replaceWith(Giveaway fresh) {
        Objects.requireNonNull(fresh, "fresh");
        if (!id.equals(fresh.id)) {
            throw new IllegalArgumentException("id mismatch: " + id + " vs " + fresh.id);
        }
        this.name = fresh.name;
        this.description = fresh.description;
        this.entryCount = fresh.entryCount;
        this.entryMethods = fresh.entryMethods;
        this.startDate = fresh.startDate;
        this.endDate = fresh.endDate;
        this.lastFetchedAt = fresh.lastFetchedAt;
    }

    @Override
    public String toString() {
        return "Giveaway{id=" + id + ", name=" + name + ", entryCount=" + entryCount
                + ", entryMethods=" + entryMethods.size() + ", start=" + startDate + ", end=" + endDate + "}";
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String id;
        private String name;
        private String description;
        private OptionalLong entryCount = OptionalLong.empty();
        private List<EntryMethod> entryMethods = List.of();
        private long startDate;
        private long endDate;
        private long lastFetchedAt;

        public Builder id(String id) { this.id = id; return this; }
        public Builder name(String name) { this.name = name; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder entryCount(OptionalLong entryCount) { this.entryCount = entryCount; return this; }
        public Builder entryMethods(List<EntryMethod> entryMethods) { this.entryMethods = entryMethods; return this; }
        public Builder startDate(long startDate) { this.startDate = startDate; return this; }
        public Builder endDate(long endDate) { this.endDate = endDate; return this; }
        public Builder lastFetchedAt(long lastFetchedAt) { this.lastFetchedAt = lastFetchedAt; return this; }

        public Giveaway build() {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(description, "description");
            Objects.requireNonNull(entryCount, "entryCount");
            Objects.requireNonNull(entryMethods, "entryMethods");
            return new Giveaway(this);
        }
    }
}
