package com.callinsight.processing.service;

public interface AnalysisAdapter {
    CallAnalysis analyze(String transcript, String recordingContext);
}
