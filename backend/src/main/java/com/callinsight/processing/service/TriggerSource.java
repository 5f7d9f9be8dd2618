package com.callinsight.processing.service;

public enum TriggerSource {
    API,
    WEBHOOK,
    POLLER,
    SYNC
}
