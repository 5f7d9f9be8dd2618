package com.callinsight.calls.service;

import com.callinsight.TestFixtures;
import com.callinsight.calls.model.CallLogEntity;
import com.callinsight.calls.repo.CallLogRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CallLogServiceTest {

    @Mock
    private CallLogRepository callLogRepository;

    @InjectMocks
    private CallLogService callLogService;

    @Test
    void storesUnseenCalls() {
        when(callLogRepository.existsByCallId("call-1")).thenReturn(false);

        boolean created = callLogService.recordIfNew(TestFixtures.answeredInbound("call-1", "rec.wav"));

        assertThat(created).isTrue();
        ArgumentCaptor<CallLogEntity> saved = ArgumentCaptor.forClass(CallLogEntity.class);
        verify(callLogRepository).saveAndFlush(saved.capture());
        assertThat(saved.getValue().getCallId()).isEqualTo("call-1");
        assertThat(saved.getValue().getRecordingFile()).isEqualTo("rec.wav");
    }

    @Test
    void skipsKnownCalls() {
        when(callLogRepository.existsByCallId("call-1")).thenReturn(true);

        assertThat(callLogService.recordIfNew(TestFixtures.answeredInbound("call-1", "rec.wav"))).isFalse();
        verify(callLogRepository, never()).saveAndFlush(any());
    }

    @Test
    void concurrentInsertCountsAsKnown() {
        when(callLogRepository.existsByCallId("call-1")).thenReturn(false);
        when(callLogRepository.saveAndFlush(any(CallLogEntity.class)))
                .thenThrow(new DataIntegrityViolationException("duplicate key call_id"));

        assertThat(callLogService.recordIfNew(TestFixtures.answeredInbound("call-1", "rec.wav"))).isFalse();
    }

    @Test
    void recordsWithoutIdAreIgnored() {
        assertThat(callLogService.recordIfNew(TestFixtures.answeredInbound(null, "rec.wav"))).isFalse();
        verifyNoInteractions(callLogRepository);
    }
}
