package io.crawlrelay.runtime;

public enum WorkerState {
    STARTING,
    DRAINING_BACKLOG,
    LISTENING,
    STAGING,
    DISPATCHING,
    COMPLETE,
    RETRY_DECISION,
    STOPPED
}
