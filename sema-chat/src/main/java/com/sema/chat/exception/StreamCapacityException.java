package com.sema.chat.exception;

public class StreamCapacityException extends RuntimeException {

    private final int maxConcurrentStreams;

    public StreamCapacityException(int maxConcurrentStreams) {
        super("Maximum concurrent streams (" + maxConcurrentStreams + ") exceeded");
        this.maxConcurrentStreams = maxConcurrentStreams;
    }

    public int getMaxConcurrentStreams() {
        return maxConcurrentStreams;
    }
}
