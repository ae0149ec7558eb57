package com.roadside.request.repository;

import com.roadside.request.entity.PaymentAttempt;
import com.roadside.shared.enums.PaymentStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PaymentAttemptRepository extends JpaRepository<PaymentAttempt, UUID> {

    List<PaymentAttempt> findByRequestIdOrderByAttemptNumberAsc(UUID requestId);

    Optional<PaymentAttempt> findByGatewayIntentId(String gatewayIntentId);

    List<PaymentAttempt> findByStatusAndCreatedAtBefore(PaymentStatus status, Instant cutoff);

    List<PaymentAttempt> findByStatusAndGatewayIntentIdIsNotNullAndCreatedAtAfter(PaymentStatus status, Instant since);
}
