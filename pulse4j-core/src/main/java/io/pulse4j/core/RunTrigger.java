package io.pulse4j.core;

public enum RunTrigger {
    SCHEDULED,
    MANUAL,
    STARTUP
}
