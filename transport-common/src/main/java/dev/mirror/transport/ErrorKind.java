package dev.mirror.transport;

public enum ErrorKind {
    NOT_FOUND,
    STARTUP_TIMEOUT,
    CALL_TIMEOUT,
    CHANNEL_CRASHED,
    CHANNEL_CLOSED,
    RELAY_TIMEOUT,
    NETWORK_ERROR,
    CONSISTENCY_PROBE,
    INVALID_REQUEST,
    FAILED
}
