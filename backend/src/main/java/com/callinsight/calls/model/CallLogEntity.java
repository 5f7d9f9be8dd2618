package com.callinsight.calls.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "call_logs")
public class CallLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "call_id", nullable = false, unique = true)
    private String callId;

    @Column(name = "caller_number")
    private String callerNumber;

    @Column(name = "caller_name")
    private String callerName;

    @Column(name = "callee_number")
    private String calleeNumber;

    @Column(name = "callee_name")
    private String calleeName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private CallDirection direction;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private CallDisposition disposition;

    @Column(name = "start_time", nullable = false)
    private LocalDateTime startTime;

    @Column(name = "duration_seconds")
    private int durationSeconds;

    @Column(name = "recording_file")
    private String recordingFile;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    public void prePersist() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public static CallLogEntity from(CdrRecord record) {
        CallLogEntity entity = new CallLogEntity();
        entity.setCallId(record.callId());
        entity.setCallerNumber(record.callerNumber());
        entity.setCallerName(record.callerName());
        entity.setCalleeNumber(record.calleeNumber());
        entity.setCalleeName(record.calleeName());
        entity.setDirection(record.direction());
        entity.setDisposition(record.disposition());
        entity.setStartTime(record.startTime() == null ? LocalDateTime.now() : record.startTime());
        entity.setDurationSeconds(record.durationSeconds());
        entity.setRecordingFile(record.recordingFile());
        return entity;
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

    public String getCallerNumber() {
        return callerNumber;
    }

    public void setCallerNumber(String callerNumber) {
        this.callerNumber = callerNumber;
    }

    public String getCallerName() {
        return callerName;
    }

    public void setCallerName(String callerName) {
        this.callerName = callerName;
    }

    public String getCalleeNumber() {
        return calleeNumber;
    }

    public void setCalleeNumber(String calleeNumber) {
        this.calleeNumber = calleeNumber;
    }

    public String getCalleeName() {
        return calleeName;
    }

    public void setCalleeName(String calleeName) {
        this.calleeName = calleeName;
    }

    public CallDirection getDirection() {
        return direction;
    }

    public void setDirection(CallDirection direction) {
        this.direction = direction;
    }

    public CallDisposition getDisposition() {
        return disposition;
    }

    public void setDisposition(CallDisposition disposition) {
        this.disposition = disposition;
    }

    public LocalDateTime getStartTime() {
        return startTime;
    }

    public void setStartTime(LocalDateTime startTime) {
        this.startTime = startTime;
    }

    public int getDurationSeconds() {
        return durationSeconds;
    }

    public void setDurationSeconds(int durationSeconds) {
        this.durationSeconds = durationSeconds;
    }

    public String getRecordingFile() {
        return recordingFile;
    }

    public void setRecordingFile(String recordingFile) {
        this.recordingFile = recordingFile;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
