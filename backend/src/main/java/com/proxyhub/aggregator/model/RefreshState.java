package com.proxyhub.aggregator.model;

public enum RefreshState {
    STOPPED,
    RUNNING
}
