package com.example.videostatcrawling.repository;

import com.example.videostatcrawling.entity.HeavyVideoRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * HeavyVideoRecord 엔티티를 위한 Spring Data JPA 레포지토리 (추가 전용)
 */
@Repository
public interface HeavyVideoRecordRepository extends JpaRepository<HeavyVideoRecord, Long> {

    List<HeavyVideoRecord> findByTargetAccountIdOrderByCrawledAtAsc(Long targetAccountId);
}
