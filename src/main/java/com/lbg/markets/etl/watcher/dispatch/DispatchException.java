package com.lbg.markets.etl.watcher.dispatch;

/**
 * A unit of work could not be handed to the queue (broker unreachable, serialization failure, rejected call).
 */
public class DispatchException extends Exception {

    public DispatchException(String message) {
        super(message);
    }

    public DispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
