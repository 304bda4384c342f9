package com.lbg.markets.etl.watcher.dispatch;

import io.quarkus.redis.datasource.RedisDataSource;
import io.quarkus.redis.datasource.list.ListCommands;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Redis list transport, the queue Celery's Redis broker polls with BRPOP.
 * Calls are bounded by {@code quarkus.redis.timeout}.
 */
@ApplicationScoped
public class RedisListTransport implements BrokerTransport {

    private static final Logger LOG = Logger.getLogger(RedisListTransport.class);

    private final ListCommands<String, String> lists;

    @Inject
    public RedisListTransport(RedisDataSource redis) {
        this.lists = redis.list(String.class);
    }

    @Override
    public void push(String queue, String message) throws DispatchException {
        try {
            long length = lists.lpush(queue, message);
            LOG.debugf("LPUSH %s ok, queue length %d", queue, length);
        } catch (RuntimeException e) {
            throw new DispatchException("Redis push to '" + queue + "' failed: " + e.getMessage(), e);
        }
    }
}
