package com.example.videostatcrawling.repository;

import com.example.videostatcrawling.entity.TargetAccount;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * TargetAccount 엔티티를 위한 Spring Data JPA 레포지토리
 * 
 * 정렬 기준: 우선순위 내림차순 → 마지막 크롤링 시간 오름차순 (처음인 계정 먼저)
 * recrawl=false 이면 한 번도 크롤링하지 않은 계정만 대상이 됩니다.
 */
@Repository
public interface TargetAccountRepository extends JpaRepository<TargetAccount, Long> {

    /**
     * 해당 크롤러 계정에 이미 배정된 대상 조회
     */
    @Query("select t from TargetAccount t where t.crawlerIdentityId = :identityId and t.alive = true"
            + " and (:recrawl = true or t.lastCrawledAt is null)"
            + " order by t.priority desc, t.lastCrawledAt asc nulls first, t.id asc")
    List<TargetAccount> findAssigned(@Param("identityId") Long identityId, @Param("recrawl") boolean recrawl, Pageable pageable);

    /**
     * 아직 어느 크롤러 계정에도 배정되지 않은 대상 조회
     */
    @Query("select t from TargetAccount t where t.crawlerIdentityId is null and t.alive = true"
            + " and (:recrawl = true or t.lastCrawledAt is null)"
            + " order by t.priority desc, t.lastCrawledAt asc nulls first, t.id asc")
    List<TargetAccount> findUnassigned(@Param("recrawl") boolean recrawl, Pageable pageable);

    /**
     * 대상 배정 (미배정이거나 이미 같은 계정에 배정된 경우에만 성공)
     *
     * @return 갱신된 행 수 (0이면 다른 크롤러 계정이 점유 중)
     */
    @Modifying(clearAutomatically = true)
    @Query("update TargetAccount t set t.crawlerIdentityId = :identityId where t.id = :id"
            + " and (t.crawlerIdentityId is null or t.crawlerIdentityId = :identityId)")
    int assign(@Param("id") Long id, @Param("identityId") Long identityId);

    /**
     * 마지막 크롤링 시간 갱신 (시간은 앞으로만 이동)
     */
    @Modifying(clearAutomatically = true)
    @Query("update TargetAccount t set t.lastCrawledAt = :crawledAt where t.id = :id"
            + " and (t.lastCrawledAt is null or t.lastCrawledAt < :crawledAt)")
    int touch(@Param("id") Long id, @Param("crawledAt") LocalDateTime crawledAt);

    /**
     * 배정 해제 (해당 크롤러 계정이 아직 점유 중일 때만)
     */
    @Modifying(clearAutomatically = true)
    @Query("update TargetAccount t set t.crawlerIdentityId = null where t.id = :id and t.crawlerIdentityId = :identityId")
    int release(@Param("id") Long id, @Param("identityId") Long identityId);

    @Modifying(clearAutomatically = true)
    @Query("update TargetAccount t set t.crawlerIdentityId = null where t.crawlerIdentityId = :identityId")
    int releaseAllOf(@Param("identityId") Long identityId);

    @Modifying(clearAutomatically = true)
    @Query("update TargetAccount t set t.alive = false where t.id = :id")
    int markDead(@Param("id") Long id);

    long countByAliveTrue();
}
