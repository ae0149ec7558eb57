package com.roadside.request.repository;

import com.roadside.request.entity.EventOutbox;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface EventOutboxRepository extends JpaRepository<EventOutbox, UUID> {

    /** Oldest PENDING entries first, so one request's events leave in the order they were written. */
    @Query("SELECT o FROM EventOutbox o WHERE o.status = 'PENDING' ORDER BY o.createdAt ASC LIMIT 50")
    List<EventOutbox> findPendingBatch();

    List<EventOutbox> findByRequestIdOrderByCreatedAtAsc(UUID requestId);
}
