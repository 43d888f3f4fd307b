package tech.charforge.generationworker.worker;

public enum WorkerState {
    STOPPED,
    STARTING,
    RUNNING,
    STOPPING
}
