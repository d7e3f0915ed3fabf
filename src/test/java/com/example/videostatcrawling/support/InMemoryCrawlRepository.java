package com.example.videostatcrawling.support;

import com.example.videostatcrawling.entity.CrawlerIdentity;
import com.example.videostatcrawling.entity.HeavyVideoRecord;
import com.example.videostatcrawling.entity.LightVideoRecord;
import com.example.videostatcrawling.entity.TargetAccount;
import com.example.videostatcrawling.repository.CrawlRepository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 메모리 기반 CrawlRepository (정렬/배정 규칙은 JPA 구현과 동일)
 * 
 * 호출 순서는 {@link #getEvents()} 에 기록됩니다.
 */
public class InMemoryCrawlRepository implements CrawlRepository {

    private static final Comparator<TargetAccount> TARGET_ORDER = Comparator
            .comparing(TargetAccount::getPriority, Comparator.reverseOrder())
            .thenComparing(TargetAccount::getLastCrawledAt, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(TargetAccount::getId);

    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong(1);
    private final Map<Long, CrawlerIdentity> identities = new LinkedHashMap<>();
    private final Map<Long, TargetAccount> targets = new LinkedHashMap<>();
    private final List<HeavyVideoRecord> heavyRecords = new ArrayList<>();
    private final List<LightVideoRecord> lightRecords = new ArrayList<>();
    private final List<String> events = new ArrayList<>();

    public InMemoryCrawlRepository(Clock clock) {
        this.clock = clock;
    }

    public synchronized CrawlerIdentity addIdentity(String username) {
        CrawlerIdentity identity = CrawlerIdentity.builder().username(username).password("pw-" + username).alive(true).build();
        identity.setId(sequence.getAndIncrement());
        identities.put(identity.getId(), identity);
        return identity;
    }

    public synchronized TargetAccount addTarget(String username, int priority) {
        TargetAccount target = TargetAccount.builder().username(username).alive(true).priority(priority).build();
        target.setId(sequence.getAndIncrement());
        targets.put(target.getId(), target);
        return target;
    }

    @Override
    public synchronized Optional<CrawlerIdentity> nextIdentity(Long requestedId) {
        Stream<CrawlerIdentity> candidates = identities.values().stream().filter(CrawlerIdentity::isAlive);
        if (requestedId != null) {
            candidates = candidates.filter(identity -> identity.getId().equals(requestedId));
        }
        Optional<CrawlerIdentity> next = candidates
                .min(Comparator.comparing(CrawlerIdentity::getLastUsedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
                        .thenComparing(CrawlerIdentity::getId));
        next.ifPresent(identity -> {
            identity.setLastUsedAt(LocalDateTime.now(clock));
            events.add("claimIdentity " + identity.getUsername());
        });
        return next;
    }

    @Override
    public synchronized List<TargetAccount> nextTargets(Long identityId, int max, boolean recrawl) {
        List<TargetAccount> eligible = targets.values().stream()
                .filter(TargetAccount::isAlive)
                .filter(target -> recrawl || target.getLastCrawledAt() == null)
                .collect(Collectors.toList());
        List<TargetAccount> result = eligible.stream()
                .filter(target -> identityId.equals(target.getCrawlerIdentityId()))
                .sorted(TARGET_ORDER)
                .limit(max)
                .collect(Collectors.toList());
        eligible.stream()
                .filter(target -> target.getCrawlerIdentityId() == null)
                .sorted(TARGET_ORDER)
                .limit(max - result.size())
                .forEach(result::add);
        return result;
    }

    @Override
    public synchronized void saveHeavy(HeavyVideoRecord record) {
        heavyRecords.add(record);
        events.add("saveHeavy " + record.getTargetAccountId());
    }

    @Override
    public synchronized void saveLight(LightVideoRecord record) {
        lightRecords.add(record);
        events.add("saveLight " + record.getTargetAccountId());
    }

    @Override
    public synchronized void markTargetDead(Long targetId) {
        targets.get(targetId).setAlive(false);
        events.add("markTargetDead " + targetId);
    }

    @Override
    public synchronized void touchTarget(Long targetId, LocalDateTime crawledAt) {
        TargetAccount target = targets.get(targetId);
        if (target.getLastCrawledAt() == null || target.getLastCrawledAt().isBefore(crawledAt)) {
            target.setLastCrawledAt(crawledAt);
        }
        events.add("touchTarget " + targetId);
    }

    @Override
    public synchronized boolean assignTarget(Long targetId, Long identityId) {
        TargetAccount target = targets.get(targetId);
        if (target.getCrawlerIdentityId() != null && !Objects.equals(target.getCrawlerIdentityId(), identityId)) {
            return false;
        }
        target.setCrawlerIdentityId(identityId);
        events.add("assignTarget " + targetId);
        return true;
    }

    @Override
    public synchronized void releaseTarget(Long targetId, Long identityId) {
        TargetAccount target = targets.get(targetId);
        if (Objects.equals(target.getCrawlerIdentityId(), identityId)) {
            target.setCrawlerIdentityId(null);
        }
        events.add("releaseTarget " + targetId);
    }

    @Override
    public synchronized void markIdentityDead(Long identityId) {
        identities.get(identityId).setAlive(false);
        targets.values().stream()
                .filter(target -> identityId.equals(target.getCrawlerIdentityId()))
                .forEach(target -> target.setCrawlerIdentityId(null));
        events.add("markIdentityDead " + identityId);
    }

    public synchronized List<HeavyVideoRecord> getHeavyRecords() {
        return new ArrayList<>(heavyRecords);
    }

    public synchronized List<LightVideoRecord> getLightRecords() {
        return new ArrayList<>(lightRecords);
    }

    public synchronized List<String> getEvents() {
        return new ArrayList<>(events);
    }

    public synchronized TargetAccount target(Long id) {
        return targets.get(id);
    }

    public synchronized CrawlerIdentity identity(Long id) {
        return identities.get(id);
    }
}
