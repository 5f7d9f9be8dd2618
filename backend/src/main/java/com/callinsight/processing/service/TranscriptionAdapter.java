package com.callinsight.processing.service;

import java.nio.file.Path;

public interface TranscriptionAdapter {
    TranscriptionResult transcribe(Path filePath);
}
