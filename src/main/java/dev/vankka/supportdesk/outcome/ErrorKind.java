package dev.vankka.supportdesk.outcome;

public enum ErrorKind {

    VALIDATION,
    CONFLICT,
    PERMISSION,
    EXTERNAL_RESOURCE,
    PERSISTENCE,
    TIMED_OUT
}
