package com.dsflow.config;

public enum Verbosity {
    ERROR,
    WARN,
    INFO,
    DEBUG,   // per-sample failures become visible
    TRACE
}
