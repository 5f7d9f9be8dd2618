package com.callinsight.calls.service;

import com.callinsight.calls.model.CallLogEntity;
import com.callinsight.calls.model.CdrRecord;
import com.callinsight.calls.repo.CallLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

@Service
public class CallLogService {

    private static final Logger log = LoggerFactory.getLogger(CallLogService.class);

    private final CallLogRepository callLogRepository;

    public CallLogService(CallLogRepository callLogRepository) {
        this.callLogRepository = callLogRepository;
    }

    public boolean recordIfNew(CdrRecord record) {
        if (record.callId() == null || record.callId().isBlank()) {
            return false;
        }
        if (callLogRepository.existsByCallId(record.callId())) {
            return false;
        }
        try {
            callLogRepository.saveAndFlush(CallLogEntity.from(record));
            return true;
        } catch (DataIntegrityViolationException ex) {
            log.warn("Call log for {} was inserted concurrently", record.callId());
            return false;
        }
    }
}
