package com.callinsight.summary.repo;

import com.callinsight.summary.model.CallSummaryEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface CallSummaryRepository extends JpaRepository<CallSummaryEntity, UUID> {
    Optional<CallSummaryEntity> findByCallId(String callId);

    boolean existsByCallId(String callId);

    boolean existsByCallIdAndErrorMessageIsNull(String callId);
}
