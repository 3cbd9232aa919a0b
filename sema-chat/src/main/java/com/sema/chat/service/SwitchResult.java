package com.sema.chat.service;

/**
 * @param active the selection serving requests after the call, null if none
 */
public record SwitchResult(boolean success, BackendSelection active, String message) {

    public static SwitchResult succeeded(BackendSelection active, String message) {
        return new SwitchResult(true, active, message);
    }

    public static SwitchResult failed(BackendSelection active, String message) {
        return new SwitchResult(false, active, message);
    }
}
