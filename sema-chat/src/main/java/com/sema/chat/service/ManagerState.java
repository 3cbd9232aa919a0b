package com.sema.chat.service;

public enum ManagerState {
    UNINITIALIZED,
    INITIALIZING,
    READY,
    SWITCHING,
    FAILED
}
