package com.jdc.pantry_service.domain.repository;

import com.jdc.pantry_service.domain.entity.WasteRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface WasteRecordRepository extends JpaRepository<WasteRecord, Long> {

    List<WasteRecord> findAllByUserIdOrderByWastedAtDesc(Long userId);

    List<WasteRecord> findAllByUserIdAndWastedAtGreaterThanEqualOrderByWastedAtDesc(Long userId, LocalDateTime since);
}
