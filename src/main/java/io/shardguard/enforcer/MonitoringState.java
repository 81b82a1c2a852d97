package io.shardguard.enforcer;

public enum MonitoringState {
    STOPPED,
    RUNNING
}
