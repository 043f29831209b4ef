package com.jdc.pantry_service.domain.repository;

import com.jdc.pantry_service.domain.entity.InventoryUsageLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface InventoryUsageLogRepository extends JpaRepository<InventoryUsageLog, Long> {

    List<InventoryUsageLog> findAllByInventoryItemIdOrderByUsedAtDescIdDesc(Long inventoryItemId);
}
