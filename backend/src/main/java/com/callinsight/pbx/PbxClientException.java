package com.callinsight.pbx;

public class PbxClientException extends RuntimeException {

    public PbxClientException(String message) {
        super(message);
    }

    public PbxClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
