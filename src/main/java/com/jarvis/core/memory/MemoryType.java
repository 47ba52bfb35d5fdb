package com.jarvis.core.memory;

public enum MemoryType {
    TASK_EXECUTION,
    USER_FEEDBACK,
    DECISION_OUTCOME,
    SYSTEM_STATE,
    LEARNED_PATTERN,
    ERROR
}
