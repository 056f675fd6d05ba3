package io.dispatch4j.core;

public enum StatusLevel {
    DEBUG,
    INFO,
    WARN,
    ERROR
}
