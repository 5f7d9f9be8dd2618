package com.callinsight.calls.repo;

import com.callinsight.calls.model.CallLogEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface CallLogRepository extends JpaRepository<CallLogEntity, UUID> {
    Optional<CallLogEntity> findByCallId(String callId);

    boolean existsByCallId(String callId);
}
