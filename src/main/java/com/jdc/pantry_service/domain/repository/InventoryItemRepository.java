package com.jdc.pantry_service.domain.repository;

import com.jdc.pantry_service.domain.entity.InventoryItem;
import com.jdc.pantry_service.domain.type.InventoryStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface InventoryItemRepository extends JpaRepository<InventoryItem, Long> {

    /** 사용자 전체 재고 (재료 정보 함께 로딩) */
    @EntityGraph(attributePaths = "ingredient")
    List<InventoryItem> findAllByUserId(Long userId);

    /** 종료 상태를 제외한 사용자 재고 */
    @EntityGraph(attributePaths = "ingredient")
    List<InventoryItem> findAllByUserIdAndStatusNotIn(Long userId, Collection<InventoryStatus> statuses);

    /** 재분류 배치용 */
    List<InventoryItem> findAllByStatusNotIn(Collection<InventoryStatus> statuses);

    /** 사용/폐기 처리 시 동시 차감을 막기 위한 행 잠금 조회 */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM InventoryItem i WHERE i.id = :id")
    Optional<InventoryItem> findByIdForUpdate(@Param("id") Long id);
}
