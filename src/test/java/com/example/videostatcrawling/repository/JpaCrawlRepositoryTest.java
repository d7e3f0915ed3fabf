package com.example.videostatcrawling.repository;

import com.example.videostatcrawling.entity.CrawlerIdentity;
import com.example.videostatcrawling.entity.ExtractionMethod;
import com.example.videostatcrawling.entity.HeavyVideoRecord;
import com.example.videostatcrawling.entity.LightVideoRecord;
import com.example.videostatcrawling.entity.TargetAccount;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.test.context.ActiveProfiles;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * JpaCrawlRepository 테스트 (H2)
 */
@DataJpaTest
@ActiveProfiles("test")
class JpaCrawlRepositoryTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-10T03:00:00Z"), ZoneOffset.UTC);
    private static final LocalDateTime NOW = LocalDateTime.now(CLOCK);

    @Autowired
    private TestEntityManager entityManager;
    @Autowired
    private CrawlerIdentityRepository crawlerIdentityRepository;
    @Autowired
    private TargetAccountRepository targetAccountRepository;
    @Autowired
    private HeavyVideoRecordRepository heavyVideoRecordRepository;
    @Autowired
    private LightVideoRecordRepository lightVideoRecordRepository;

    private JpaCrawlRepository repository;

    @BeforeEach
    void setUp() {
        repository = new JpaCrawlRepository(crawlerIdentityRepository, targetAccountRepository,
                heavyVideoRecordRepository, lightVideoRecordRepository, CLOCK);
    }

    @Test
    void shouldClaimNeverUsedIdentityFirstThenLeastRecentlyUsed() {
        CrawlerIdentity used = identity("used", true, NOW.minusHours(1));
        CrawlerIdentity fresh = identity("fresh", true, null);
        identity("dead", false, null);
        entityManager.clear();

        Optional<CrawlerIdentity> first = repository.nextIdentity(null);
        Optional<CrawlerIdentity> second = repository.nextIdentity(null);

        assertThat(first).map(CrawlerIdentity::getId).contains(fresh.getId());
        assertThat(second).map(CrawlerIdentity::getId).contains(used.getId());
        assertThat(crawlerIdentityRepository.findById(fresh.getId()).orElseThrow().getLastUsedAt()).isEqualTo(NOW);
        assertThat(crawlerIdentityRepository.findById(used.getId()).orElseThrow().getLastUsedAt()).isEqualTo(NOW);
    }

    @Test
    void shouldClaimRequestedIdentityOnlyWhenAlive() {
        CrawlerIdentity alive = identity("alive", true, NOW.minusDays(1));
        CrawlerIdentity dead = identity("dead", false, null);
        entityManager.clear();

        assertThat(repository.nextIdentity(alive.getId())).map(CrawlerIdentity::getUsername).contains("alive");
        assertThat(repository.nextIdentity(dead.getId())).isEmpty();
        assertThat(repository.nextIdentity(9_999L)).isEmpty();
    }

    @Test
    void shouldReturnEmptyWhenNoIdentityAlive() {
        identity("dead", false, null);
        entityManager.clear();

        assertThat(repository.nextIdentity(null)).isEmpty();
    }

    @Test
    void shouldOrderTargetsByPriorityThenLastCrawled() {
        TargetAccount lowNew = target("low-new", 1, null, null);
        TargetAccount highOld = target("high-old", 5, NOW.minusDays(2), null);
        TargetAccount highNew = target("high-new", 5, null, null);
        TargetAccount highRecent = target("high-recent", 5, NOW.minusHours(1), null);
        target("dead", 9, null, null).setAlive(false);
        entityManager.flush();
        entityManager.clear();

        assertThat(repository.nextTargets(1L, 10, true))
                .extracting(TargetAccount::getId)
                .containsExactly(highNew.getId(), highOld.getId(), highRecent.getId(), lowNew.getId());
        assertThat(repository.nextTargets(1L, 10, false))
                .extracting(TargetAccount::getId)
                .containsExactly(highNew.getId(), lowNew.getId());
        assertThat(repository.nextTargets(1L, 2, true)).hasSize(2);
    }

    @Test
    void shouldPreferTargetsAlreadyAssignedToIdentity() {
        TargetAccount unassigned = target("unassigned", 9, null, null);
        TargetAccount mine = target("mine", 1, null, 1L);
        target("theirs", 9, null, 2L);
        entityManager.clear();

        assertThat(repository.nextTargets(1L, 10, false))
                .extracting(TargetAccount::getId)
                .containsExactly(mine.getId(), unassigned.getId());
        assertThat(repository.nextTargets(1L, 1, false))
                .extracting(TargetAccount::getId)
                .containsExactly(mine.getId());
    }

    @Test
    void shouldAssignTargetAtMostOnce() {
        TargetAccount target = target("target", 1, null, null);
        entityManager.clear();

        assertThat(repository.assignTarget(target.getId(), 1L)).isTrue();
        assertThat(repository.assignTarget(target.getId(), 1L)).isTrue();
        assertThat(repository.assignTarget(target.getId(), 2L)).isFalse();
        assertThat(targetAccountRepository.findById(target.getId()).orElseThrow().getCrawlerIdentityId()).isEqualTo(1L);
    }

    @Test
    void shouldReleaseTargetOnlyForOwningIdentity() {
        TargetAccount target = target("target", 1, null, 1L);
        entityManager.clear();

        repository.releaseTarget(target.getId(), 2L);
        assertThat(targetAccountRepository.findById(target.getId()).orElseThrow().getCrawlerIdentityId()).isEqualTo(1L);

        repository.releaseTarget(target.getId(), 1L);
        assertThat(targetAccountRepository.findById(target.getId()).orElseThrow().getCrawlerIdentityId()).isNull();
        assertThat(repository.assignTarget(target.getId(), 2L)).isTrue();
    }

    @Test
    void shouldHandTargetsOfDeadIdentityToAnotherIdentity() {
        CrawlerIdentity blocked = identity("blocked", true, null);
        CrawlerIdentity other = identity("other", true, null);
        TargetAccount target = target("target", 1, null, null);
        TargetAccount unrelated = target("unrelated", 1, null, 999L);
        entityManager.clear();

        assertThat(repository.assignTarget(target.getId(), blocked.getId())).isTrue();
        repository.markIdentityDead(blocked.getId());

        assertThat(repository.nextTargets(other.getId(), 10, true))
                .extracting(TargetAccount::getId)
                .containsExactly(target.getId());
        assertThat(repository.assignTarget(target.getId(), other.getId())).isTrue();
        assertThat(targetAccountRepository.findById(unrelated.getId()).orElseThrow().getCrawlerIdentityId()).isEqualTo(999L);
    }

    @Test
    void shouldOnlyMoveLastCrawledForward() {
        TargetAccount target = target("target", 1, null, null);
        entityManager.clear();

        repository.touchTarget(target.getId(), NOW);
        repository.touchTarget(target.getId(), NOW.minusDays(1));

        assertThat(targetAccountRepository.findById(target.getId()).orElseThrow().getLastCrawledAt()).isEqualTo(NOW);
    }

    @Test
    void shouldMarkTargetAndIdentityDead() {
        TargetAccount target = target("target", 1, null, null);
        CrawlerIdentity identity = identity("crawler", true, null);
        entityManager.clear();

        repository.markTargetDead(target.getId());
        repository.markIdentityDead(identity.getId());

        assertThat(targetAccountRepository.findById(target.getId()).orElseThrow().isAlive()).isFalse();
        assertThat(crawlerIdentityRepository.findById(identity.getId()).orElseThrow().isAlive()).isFalse();
        assertThat(targetAccountRepository.countByAliveTrue()).isZero();
        assertThat(crawlerIdentityRepository.countByAliveTrue()).isZero();
    }

    @Test
    void shouldAppendRecords() {
        repository.saveHeavy(HeavyVideoRecord.builder()
                .targetAccountId(1L).videoId("1").url("https://www.tiktok.com/@a/video/1")
                .likeCountText("1K").likeCount(1000L)
                .crawledAt(NOW).extractionMethod(ExtractionMethod.VIDEO_PAGE).build());
        repository.saveHeavy(HeavyVideoRecord.builder()
                .targetAccountId(1L).videoId("1").url("https://www.tiktok.com/@a/video/1")
                .likeCountText("2K").likeCount(2000L)
                .crawledAt(NOW.plusHours(1)).extractionMethod(ExtractionMethod.VIDEO_PAGE).build());
        repository.saveLight(LightVideoRecord.builder()
                .targetAccountId(1L).videoId("1").thumbnailUrl("https://cdn/1.jpg")
                .crawledAt(NOW).extractionMethod(ExtractionMethod.PUBLISHER_LISTING_MERGE).build());

        assertThat(heavyVideoRecordRepository.findByTargetAccountIdOrderByCrawledAtAsc(1L))
                .extracting(HeavyVideoRecord::getLikeCount)
                .containsExactly(1000L, 2000L);
        assertThat(lightVideoRecordRepository.findByTargetAccountIdOrderByCrawledAtAsc(1L)).hasSize(1);
    }

    private CrawlerIdentity identity(String username, boolean alive, LocalDateTime lastUsedAt) {
        return entityManager.persistAndFlush(CrawlerIdentity.builder()
                .username(username).password("pw").alive(alive).lastUsedAt(lastUsedAt).build());
    }

    private TargetAccount target(String username, int priority, LocalDateTime lastCrawledAt, Long identityId) {
        return entityManager.persistAndFlush(TargetAccount.builder()
                .username(username).alive(true).priority(priority).lastCrawledAt(lastCrawledAt)
                .crawlerIdentityId(identityId).build());
    }
}
