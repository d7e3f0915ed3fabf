package com.example.videostatcrawling.repository;

import com.example.videostatcrawling.entity.CrawlerIdentity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * CrawlerIdentity 엔티티를 위한 Spring Data JPA 레포지토리
 * 
 * 배정(claim)은 행 단위 조건부 UPDATE 로 처리하여, 동시에 여러 스레드가 요청해도
 * 같은 계정이 두 번 배정되지 않도록 합니다.
 */
@Repository
public interface CrawlerIdentityRepository extends JpaRepository<CrawlerIdentity, Long> {

    /**
     * 배정 후보 조회 (한 번도 사용하지 않은 계정 우선, 그 다음 가장 오래전에 사용한 계정)
     *
     * @param pageable 조회 개수
     * @return 살아있는 계정 목록
     */
    @Query("select c from CrawlerIdentity c where c.alive = true order by c.lastUsedAt asc nulls first, c.id asc")
    List<CrawlerIdentity> findClaimCandidates(Pageable pageable);

    /**
     * 한 번도 사용하지 않은 계정을 배정 (다른 스레드가 먼저 배정했으면 0 반환)
     */
    @Modifying(clearAutomatically = true)
    @Query("update CrawlerIdentity c set c.lastUsedAt = :now where c.id = :id and c.alive = true and c.lastUsedAt is null")
    int claimUnused(@Param("id") Long id, @Param("now") LocalDateTime now);

    /**
     * 이전 사용 시간이 그대로인 경우에만 배정 (compare-and-set)
     */
    @Modifying(clearAutomatically = true)
    @Query("update CrawlerIdentity c set c.lastUsedAt = :now where c.id = :id and c.alive = true and c.lastUsedAt = :previous")
    int claimUsedAt(@Param("id") Long id, @Param("previous") LocalDateTime previous, @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true)
    @Query("update CrawlerIdentity c set c.alive = false where c.id = :id")
    int markDead(@Param("id") Long id);

    long countByAliveTrue();
}
