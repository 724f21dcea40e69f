package com.threadline.notificationservice.repository;

import com.threadline.notificationservice.model.RealtimeEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.UUID;

@Repository
public interface RealtimeEventRepository extends JpaRepository<RealtimeEvent, UUID> {

    /**
     * Sets processed_at only if it is still null, so the first write wins.
     *
     * @return number of rows updated (0 when already processed or unknown id)
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("""
            UPDATE RealtimeEvent e SET e.processedAt = :processedAt
            WHERE e.id = :id
              AND e.processedAt IS NULL
            """)
    int markProcessed(@Param("id") UUID id, @Param("processedAt") Instant processedAt);
}
