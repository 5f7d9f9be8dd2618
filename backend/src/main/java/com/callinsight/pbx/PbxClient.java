package com.callinsight.pbx;

import com.callinsight.calls.model.CdrRecord;

import java.nio.file.Path;
import java.util.List;

public interface PbxClient {

    List<CdrRecord> listCdrs(int page, int pageSize);

    List<RecordingEntry> listRecordings(int page, int pageSize);

    String resolveDownloadUrl(String recordingFile);

    void download(String downloadUrl, Path target);
}
