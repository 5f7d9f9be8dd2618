package com.callinsight.processing.queue;

@FunctionalInterface
public interface ProcessingFunction {

    void process(String callId, String recordingFile, boolean force, StageListener stageListener) throws Exception;
}
