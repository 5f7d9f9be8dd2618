package com.callinsight.summary.service;

import com.callinsight.processing.service.CallAnalysis;
import com.callinsight.processing.service.TranscriptionResult;
import com.callinsight.summary.model.CallSummaryEntity;
import com.callinsight.summary.repo.CallSummaryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Upserts one summary row per call. A concurrent insert for the same call id loses the unique
 * constraint race; that is logged and ignored since the other writer's row stands.
 */
@Service
public class CallSummaryService {

    private static final Logger log = LoggerFactory.getLogger(CallSummaryService.class);

    public static final String INSUFFICIENT_DATA = "insufficient_data";
    static final int PREVIEW_LENGTH = 500;
    private static final String INSUFFICIENT_SUMMARY = "Not enough data to generate analysis. "
            + "The call may contain only ringing, background noise, or minimal interaction.";

    private final CallSummaryRepository callSummaryRepository;

    public CallSummaryService(CallSummaryRepository callSummaryRepository) {
        this.callSummaryRepository = callSummaryRepository;
    }

    /**
     * A summary counts as completed when it exists and carries no error.
     */
    public boolean hasCompletedSummary(String callId) {
        return callSummaryRepository.existsByCallIdAndErrorMessageIsNull(callId);
    }

    /**
     * Any row, including one that only records an error.
     */
    public boolean hasSummary(String callId) {
        return callSummaryRepository.existsByCallId(callId);
    }

    public Optional<CallSummaryEntity> find(String callId) {
        return callSummaryRepository.findByCallId(callId);
    }

    public void saveAnalysis(String callId,
                             String recordingFile,
                             TranscriptionResult transcription,
                             CallAnalysis analysis,
                             double processingSeconds) {
        upsert(callId, entity -> {
            entity.setRecordingFile(recordingFile);
            entity.setDetectedLanguage(transcription.detectedLanguage());
            entity.setTranscriptPreview(preview(transcription.text()));
            entity.setCallType(analysis.callType());
            entity.setServiceCategory(analysis.serviceCategory());
            entity.setSummary(analysis.summary());
            entity.setStaffName(analysis.staffName());
            entity.setCustomerName(analysis.customerName());
            entity.setCompanyName(analysis.companyName());
            entity.setTopics(new ArrayList<>(analysis.topics()));
            entity.setActionItems(new ArrayList<>(analysis.actionItems()));
            entity.setResolutionStatus(analysis.resolutionStatus());
            entity.setSentiment(analysis.sentiment());
            entity.setAnalysisSkipReason(null);
            entity.setProcessingSeconds(processingSeconds);
            entity.setModelUsed(analysis.modelUsed());
            entity.setErrorMessage(null);
        });
    }

    public void saveInsufficient(String callId,
                                 String recordingFile,
                                 TranscriptionResult transcription,
                                 String reason,
                                 double processingSeconds) {
        upsert(callId, entity -> {
            entity.setRecordingFile(recordingFile);
            entity.setDetectedLanguage(transcription.detectedLanguage());
            entity.setTranscriptPreview(preview(transcription.text()));
            entity.setCallType(INSUFFICIENT_DATA);
            entity.setServiceCategory("Unknown");
            entity.setSummary(INSUFFICIENT_SUMMARY);
            entity.setStaffName(null);
            entity.setCustomerName(null);
            entity.setCompanyName(null);
            entity.setTopics(new ArrayList<>());
            entity.setActionItems(new ArrayList<>());
            entity.setResolutionStatus("unclear");
            entity.setSentiment("neutral");
            entity.setAnalysisSkipReason(reason);
            entity.setProcessingSeconds(processingSeconds);
            entity.setModelUsed("none - insufficient data");
            entity.setErrorMessage(null);
        });
    }

    public void saveError(String callId, String recordingFile, String errorMessage) {
        upsert(callId, entity -> {
            if (recordingFile != null) {
                entity.setRecordingFile(recordingFile);
            }
            entity.setErrorMessage(errorMessage);
        });
    }

    private void upsert(String callId, Consumer<CallSummaryEntity> changes) {
        CallSummaryEntity entity = callSummaryRepository.findByCallId(callId).orElseGet(() -> {
            CallSummaryEntity created = new CallSummaryEntity();
            created.setCallId(callId);
            return created;
        });
        changes.accept(entity);
        try {
            callSummaryRepository.saveAndFlush(entity);
        } catch (DataIntegrityViolationException ex) {
            log.warn("Summary for call {} was written concurrently, keeping the existing row", callId);
        }
    }

    static String preview(String transcript) {
        if (transcript == null) {
            return null;
        }
        if (transcript.length() <= PREVIEW_LENGTH) {
            return transcript;
        }
        return transcript.substring(0, PREVIEW_LENGTH - 3) + "...";
    }
}
