package com.roadside.request.repository;

import com.roadside.request.entity.ServiceRequest;
import com.roadside.shared.enums.RequestStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ServiceRequestRepository extends JpaRepository<ServiceRequest, UUID> {

    Optional<ServiceRequest> findByIdempotencyKey(String idempotencyKey);

    boolean existsByClientIdAndStatusIn(String clientId, Collection<RequestStatus> statuses);

    boolean existsByProviderIdAndStatusIn(String providerId, Collection<RequestStatus> statuses);

    List<ServiceRequest> findByStatus(RequestStatus status);

    List<ServiceRequest> findByStatusAndProviderFinishRequestedAtBefore(RequestStatus status, Instant cutoff);
}
