package com.example.videostatcrawling.repository;

import com.example.videostatcrawling.entity.LightVideoRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * LightVideoRecord 엔티티를 위한 Spring Data JPA 레포지토리 (추가 전용)
 */
@Repository
public interface LightVideoRecordRepository extends JpaRepository<LightVideoRecord, Long> {

    List<LightVideoRecord> findByTargetAccountIdOrderByCrawledAtAsc(Long targetAccountId);
}
