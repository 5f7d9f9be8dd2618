package com.callinsight.processing.service;

import com.callinsight.pbx.PbxClient;
import com.callinsight.pbx.PbxClientException;
import com.callinsight.pbx.RecordingEntry;
import com.callinsight.processing.queue.ProcessingStage;
import com.callinsight.processing.queue.StageListener;
import com.callinsight.processing.queue.StatusBroadcaster;
import com.callinsight.summary.service.CallSummaryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Turns one call recording into a stored summary: locate, download, transcribe, validate,
 * analyze, save.
 *
 * <p>Outcomes that will not change on retry (no recording, transcript too thin) are persisted and
 * return normally. Anything transient is recorded as an error summary and rethrown as
 * {@link RecordingProcessingException}.
 */
@Service
public class RecordingProcessor {

    private static final Logger log = LoggerFactory.getLogger(RecordingProcessor.class);

    public static final String SUMMARY_EVENT = "summary_processed";
    static final String NO_RECORDING = "No recording available for this call";
    static final int RECORDING_PAGE_SIZE = 100;
    static final int RECORDING_MAX_PAGES = 20;

    private final PbxClient pbxClient;
    private final TranscriptionAdapter transcriptionAdapter;
    private final AnalysisAdapter analysisAdapter;
    private final InferenceGate inferenceGate;
    private final TranscriptValidator transcriptValidator;
    private final CallSummaryService callSummaryService;
    private final StatusBroadcaster statusBroadcaster;

    public RecordingProcessor(PbxClient pbxClient,
                              TranscriptionAdapter transcriptionAdapter,
                              AnalysisAdapter analysisAdapter,
                              InferenceGate inferenceGate,
                              TranscriptValidator transcriptValidator,
                              CallSummaryService callSummaryService,
                              StatusBroadcaster statusBroadcaster) {
        this.pbxClient = pbxClient;
        this.transcriptionAdapter = transcriptionAdapter;
        this.analysisAdapter = analysisAdapter;
        this.inferenceGate = inferenceGate;
        this.transcriptValidator = transcriptValidator;
        this.callSummaryService = callSummaryService;
        this.statusBroadcaster = statusBroadcaster;
    }

    public void process(String callId, String recordingFile, boolean force, StageListener stageListener) {
        StageListener stages = stageListener == null ? StageListener.NONE : stageListener;
        Instant start = Instant.now();
        log.info("Processing recording for call {} (force={}, recording={})", callId, force, recordingFile);

        String file = recordingFile;
        try {
            if (file == null || file.isBlank()) {
                file = findRecording(callId);
                if (file == null) {
                    log.warn("No recording found for call {}", callId);
                    callSummaryService.saveError(callId, null, NO_RECORDING);
                    return;
                }
            }
            runPipeline(callId, file, stages, start);
        } catch (RecordingProcessingException | PbxClientException ex) {
            recordFailure(callId, file, ex);
            if (ex instanceof RecordingProcessingException processingException) {
                throw processingException;
            }
            throw new RecordingProcessingException(ex.getMessage(), ex);
        }
        publishProcessed(callId);
    }

    private void runPipeline(String callId, String file, StageListener stages, Instant start) {
        Path tempFile = null;
        try {
            stages.onStage(ProcessingStage.DOWNLOADING);
            String downloadUrl = pbxClient.resolveDownloadUrl(file);
            tempFile = Files.createTempFile("call-" + sanitize(callId) + "-", suffixOf(file));
            pbxClient.download(downloadUrl, tempFile);

            stages.onStage(ProcessingStage.TRANSCRIBING);
            Path audio = tempFile;
            TranscriptionResult transcription = inferenceGate.call("transcription",
                    () -> transcriptionAdapter.transcribe(audio));
            log.info("Transcribed call {} in {} ms ({})", callId, transcription.latencyMs(), transcription.detectedLanguage());

            TranscriptValidator.ValidationResult validation = transcriptValidator.validate(transcription.text());
            if (!validation.valid()) {
                log.info("Skipping analysis for call {}: {}", callId, validation.reason());
                stages.onStage(ProcessingStage.SAVING);
                callSummaryService.saveInsufficient(callId, file, transcription, validation.reason(), elapsedSeconds(start));
                return;
            }

            stages.onStage(ProcessingStage.ANALYZING);
            String context = RecordingContext.fromFileName(file).describe();
            CallAnalysis analysis = inferenceGate.call("analysis",
                    () -> analysisAdapter.analyze(transcription.text(), context));

            stages.onStage(ProcessingStage.SAVING);
            callSummaryService.saveAnalysis(callId, file, transcription, analysis, elapsedSeconds(start));
            log.info("Stored summary for call {}", callId);
        } catch (IOException ex) {
            throw new RecordingProcessingException("Could not stage recording for call " + callId, ex);
        } finally {
            deleteQuietly(tempFile);
        }
    }

    String findRecording(String callId) {
        for (int page = 1; page <= RECORDING_MAX_PAGES; page++) {
            List<RecordingEntry> entries = pbxClient.listRecordings(page, RECORDING_PAGE_SIZE);
            for (RecordingEntry entry : entries) {
                if (callId.equals(entry.uid())) {
                    log.debug("Found recording for call {} on page {}", callId, page);
                    return entry.file();
                }
            }
            if (entries.size() < RECORDING_PAGE_SIZE) {
                break;
            }
        }
        return null;
    }

    private void recordFailure(String callId, String file, RuntimeException failure) {
        try {
            callSummaryService.saveError(callId, file, failure.getMessage());
        } catch (RuntimeException ex) {
            log.warn("Could not record failure for call {}: {}", callId, ex.getMessage());
        }
    }

    private void publishProcessed(String callId) {
        try {
            statusBroadcaster.broadcast(SUMMARY_EVENT, Map.of("callId", callId));
        } catch (Exception ex) {
            log.warn("Summary broadcast for call {} failed: {}", callId, ex.getMessage());
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException ex) {
            log.warn("Could not delete temp recording {}: {}", file, ex.getMessage());
        }
    }

    private static double elapsedSeconds(Instant start) {
        return Duration.between(start, Instant.now()).toMillis() / 1000.0;
    }

    private static String sanitize(String callId) {
        return callId.replaceAll("[^A-Za-z0-9._-]", "_");
    }

    private static String suffixOf(String file) {
        int dot = file.lastIndexOf('.');
        if (dot < 0 || file.length() - dot > 6) {
            return ".wav";
        }
        return file.substring(dot);
    }
}
