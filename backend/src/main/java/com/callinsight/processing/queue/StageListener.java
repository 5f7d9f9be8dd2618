package com.callinsight.processing.queue;

@FunctionalInterface
public interface StageListener {

    StageListener NONE = stage -> {
    };

    void onStage(ProcessingStage stage);
}
