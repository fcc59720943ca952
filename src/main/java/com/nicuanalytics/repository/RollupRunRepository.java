package com.nicuanalytics.repository;

import com.nicuanalytics.entity.RollupRunRecord;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.UUID;

public interface RollupRunRepository extends JpaRepository<RollupRunRecord, UUID> {

    @Query("""
        SELECT r FROM RollupRunRecord r
        WHERE (:clientId IS NULL OR r.clientId = :clientId)
        ORDER BY r.createdAt DESC
    """)
    Page<RollupRunRecord> findHistory(@Param("clientId") String clientId, Pageable pageable);
}
