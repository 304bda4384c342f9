package com.lbg.markets.etl.watcher.dispatch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lbg.markets.etl.watcher.config.ConfigHolder;
import com.lbg.markets.etl.watcher.config.DispatchSettings;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jboss.logging.Logger;

import java.time.Clock;

/**
 * Chooses the dispatch strategy named by {@code celery_settings.dispatch_mode} at startup.
 */
@ApplicationScoped
public class DispatchClientProducer {

    private static final Logger LOG = Logger.getLogger(DispatchClientProducer.class);

    @Produces
    @Singleton
    DispatchClient dispatchClient(ConfigHolder config, ObjectMapper mapper,
                                  Instance<BrokerTransport> transport,
                                  @RestClient Instance<FlowerApi> flower) {
        DispatchSettings settings = config.get().dispatch();
        Clock clock = Clock.systemDefaultZone();

        DispatchClient client = switch (settings.mode()) {
            case RAW -> new RawEnvelopeDispatchClient(new CeleryEnvelope(mapper), transport.get(), settings, clock);
            case STRUCTURED -> new StructuredDispatchClient(
                    new FlowerTaskQueueClient(flower.get(), settings.queue()), settings, clock);
        };
        LOG.infof("Dispatching %s to queue '%s' using %s strategy",
                settings.taskName(), settings.queue(), client.strategy());
        return client;
    }
}
