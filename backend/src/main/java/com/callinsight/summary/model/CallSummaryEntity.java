package com.callinsight.summary.model;

import com.callinsight.common.persistence.StringListJsonConverter;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "call_summaries")
public class CallSummaryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "call_id", nullable = false, unique = true)
    private String callId;

    @Column(name = "recording_file")
    private String recordingFile;

    @Column(name = "detected_language")
    private String detectedLanguage;

    @Column(name = "transcript_preview", length = 500)
    private String transcriptPreview;

    @Column(name = "call_type")
    private String callType;

    @Column(name = "service_category")
    private String serviceCategory;

    @Column(columnDefinition = "TEXT")
    private String summary;

    @Column(name = "staff_name")
    private String staffName;

    @Column(name = "customer_name")
    private String customerName;

    @Column(name = "company_name")
    private String companyName;

    @Convert(converter = StringListJsonConverter.class)
    @Column(columnDefinition = "TEXT")
    private List<String> topics = new ArrayList<>();

    @Convert(converter = StringListJsonConverter.class)
    @Column(name = "action_items", columnDefinition = "TEXT")
    private List<String> actionItems = new ArrayList<>();

    @Column(name = "resolution_status")
    private String resolutionStatus;

    private String sentiment;

    @Column(name = "analysis_skip_reason")
    private String analysisSkipReason;

    @Column(name = "processing_seconds")
    private Double processingSeconds;

    @Column(name = "model_used")
    private String modelUsed;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    public void prePersist() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = now;
        }
    }

    @PreUpdate
    public void preUpdate() {
        updatedAt = Instant.now();
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public String getCallId() {
        return callId;
    }

    public void setCallId(String callId) {
        this.callId = callId;
    }

    public String getRecordingFile() {
        return recordingFile;
    }

    public void setRecordingFile(String recordingFile) {
        this.recordingFile = recordingFile;
    }

    public String getDetectedLanguage() {
        return detectedLanguage;
    }

    public void setDetectedLanguage(String detectedLanguage) {
        this.detectedLanguage = detectedLanguage;
    }

    public String getTranscriptPreview() {
        return transcriptPreview;
    }

    public void setTranscriptPreview(String transcriptPreview) {
        this.transcriptPreview = transcriptPreview;
    }

    public String getCallType() {
        return callType;
    }

    public void setCallType(String callType) {
        this.callType = callType;
    }

    public String getServiceCategory() {
        return serviceCategory;
    }

    public void setServiceCategory(String serviceCategory) {
        this.serviceCategory = serviceCategory;
    }

    public String getSummary() {
        return summary;
    }

    public void setSummary(String summary) {
        this.summary = summary;
    }

    public String getStaffName() {
        return staffName;
    }

    public void setStaffName(String staffName) {
        this.staffName = staffName;
    }

    public String getCustomerName() {
        return customerName;
    }

    public void setCustomerName(String customerName) {
        this.customerName = customerName;
    }

    public String getCompanyName() {
        return companyName;
    }

    public void setCompanyName(String companyName) {
        this.companyName = companyName;
    }

    public List<String> getTopics() {
        return topics;
    }

    public void setTopics(List<String> topics) {
        this.topics = topics;
    }

    public List<String> getActionItems() {
        return actionItems;
    }

    public void setActionItems(List<String> actionItems) {
        this.actionItems = actionItems;
    }

    public String getResolutionStatus() {
        return resolutionStatus;
    }

    public void setResolutionStatus(String resolutionStatus) {
        this.resolutionStatus = resolutionStatus;
    }

    public String getSentiment() {
        return sentiment;
    }

    public void setSentiment(String sentiment) {
        this.sentiment = sentiment;
    }

    public String getAnalysisSkipReason() {
        return analysisSkipReason;
    }

    public void setAnalysisSkipReason(String analysisSkipReason) {
        this.analysisSkipReason = analysisSkipReason;
    }

    public Double getProcessingSeconds() {
        return processingSeconds;
    }

    public void setProcessingSeconds(Double processingSeconds) {
        this.processingSeconds = processingSeconds;
    }

    public String getModelUsed() {
        return modelUsed;
    }

    public void setModelUsed(String modelUsed) {
        this.modelUsed = modelUsed;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
