package io.dispatch4j.core;

public enum DaemonState {
    NEW,
    STARTING,
    RUNNING,
    RECONNECTING_DB,
    STOPPING,
    STOPPED
}
