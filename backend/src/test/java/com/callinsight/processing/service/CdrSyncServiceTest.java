package com.callinsight.processing.service;

import com.callinsight.TestFixtures;
import com.callinsight.calls.model.CallDirection;
import com.callinsight.calls.model.CallDisposition;
import com.callinsight.calls.model.CdrRecord;
import com.callinsight.calls.service.CallLogService;
import com.callinsight.pbx.PbxClient;
import com.callinsight.pbx.PbxClientException;
import com.callinsight.processing.queue.BatchResult;
import com.callinsight.processing.queue.ProcessingQueue;
import com.callinsight.processing.queue.QueueRequest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CdrSyncServiceTest {

    @Mock
    private PbxClient pbxClient;

    @Mock
    private CallLogService callLogService;

    @Mock
    private ProcessingCoordinator processingCoordinator;

    @Captor
    private ArgumentCaptor<List<QueueRequest>> batchCaptor;

    @Mock
    private ProcessingQueue processingQueue;

    @Mock
    private TaskScheduler taskScheduler;

    @Test
    void logsNewRecordsAndQueuesProcessableOnes() {
        CdrSyncService service = service(true);
        CdrRecord fresh = TestFixtures.answeredInbound("fresh", "fresh.wav");
        CdrRecord known = TestFixtures.answeredInbound("known", "known.wav");
        CdrRecord missed = TestFixtures.cdr("missed", CallDirection.INBOUND, CallDisposition.MISSED, null,
                LocalDateTime.of(2025, 1, 2, 9, 0));
        CdrRecord summarised = TestFixtures.answeredInbound("summarised", "s.wav");
        when(pbxClient.listCdrs(1, 100)).thenReturn(List.of(fresh, known, missed, summarised));
        when(callLogService.recordIfNew(any(CdrRecord.class))).thenReturn(true);
        when(callLogService.recordIfNew(known)).thenReturn(false);
        when(processingCoordinator.shouldProcess("fresh", false)).thenReturn(true);
        when(processingCoordinator.shouldProcess("summarised", false)).thenReturn(false);
        when(processingQueue.addBatch(anyList())).thenReturn(BatchResult.of(List.of("fresh"), List.of()));

        SyncResult result = service.sync(5);

        assertThat(result.pagesFetched()).isEqualTo(1);
        assertThat(result.recordsSeen()).isEqualTo(4);
        assertThat(result.newRecords()).isEqualTo(3);
        assertThat(result.queued().added()).containsExactly("fresh");

        verify(processingQueue).addBatch(batchCaptor.capture());
        assertThat(batchCaptor.getValue()).containsExactly(new QueueRequest("fresh", "fresh.wav", false));
    }

    @Test
    void followsFullPagesUpToTheLimit() {
        CdrSyncService service = service(true);
        when(pbxClient.listCdrs(anyInt(), eq(100))).thenAnswer(inv -> fullPage(inv.getArgument(0)));
        when(callLogService.recordIfNew(any(CdrRecord.class))).thenReturn(false);

        SyncResult result = service.sync(3);

        assertThat(result.pagesFetched()).isEqualTo(3);
        assertThat(result.recordsSeen()).isEqualTo(300);
        assertThat(result.queued()).isNull();
        verify(pbxClient, never()).listCdrs(4, 100);
        verifyNoInteractions(processingQueue);
    }

    @Test
    void pbxFailureKeepsWhatWasAlreadySynced() {
        CdrSyncService service = service(true);
        when(pbxClient.listCdrs(1, 100)).thenReturn(fullPage(1));
        when(pbxClient.listCdrs(2, 100)).thenThrow(new PbxClientException("PBX request failed: 502"));
        when(callLogService.recordIfNew(any(CdrRecord.class))).thenReturn(true);
        when(processingCoordinator.shouldProcess(anyString(), anyBoolean())).thenReturn(true);
        when(processingQueue.addBatch(anyList())).thenAnswer(inv -> {
            List<QueueRequest> requests = inv.getArgument(0);
            return BatchResult.of(requests.stream().map(QueueRequest::callId).toList(), List.of());
        });

        SyncResult result = service.sync(5);

        assertThat(result.pagesFetched()).isEqualTo(1);
        assertThat(result.newRecords()).isEqualTo(100);
        assertThat(result.queued().addedCount()).isEqualTo(100);
    }

    @Test
    void doesNotQueueWhenAutoProcessingIsOff() {
        CdrSyncService service = service(false);
        when(pbxClient.listCdrs(1, 100)).thenReturn(List.of(TestFixtures.answeredInbound("fresh", "fresh.wav")));
        when(callLogService.recordIfNew(any(CdrRecord.class))).thenReturn(true);
        when(processingCoordinator.shouldProcess("fresh", false)).thenReturn(true);

        SyncResult result = service.sync(1);

        assertThat(result.newRecords()).isEqualTo(1);
        assertThat(result.queued()).isNull();
        verifyNoInteractions(processingQueue);
    }

    @Test
    void startupSyncRunsOnTheScheduler() {
        CdrSyncService service = service(true);

        service.syncOnStartup();

        verify(taskScheduler).schedule(any(Runnable.class), any(Instant.class));
        verifyNoInteractions(pbxClient);
    }

    private CdrSyncService service(boolean autoProcess) {
        return new CdrSyncService(pbxClient, callLogService, processingCoordinator, processingQueue, taskScheduler,
                TestFixtures.appProperties(autoProcess), Clock.systemUTC());
    }

    private static List<CdrRecord> fullPage(int page) {
        List<CdrRecord> records = new ArrayList<>();
        IntStream.range(0, 100).forEach(i -> records.add(TestFixtures.answeredInbound("p" + page + "-" + i, "r.wav")));
        return records;
    }
}
