package com.lbg.markets.etl.watcher.dispatch;

/**
 * The broker's underlying list-based queue.
 */
public interface BrokerTransport {

    /**
     * Push one serialized message onto the head of {@code queue}.
     */
    void push(String queue, String message) throws DispatchException;
}
