package io.streamkit.workers;

public enum WorkerState {
    IDLE,
    BUSY,
    TERMINATING,
    TERMINATED
}
