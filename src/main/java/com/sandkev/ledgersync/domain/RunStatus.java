package com.sandkev.ledgersync.domain;

public enum RunStatus {
    SUCCESS,
    FAILED
}
