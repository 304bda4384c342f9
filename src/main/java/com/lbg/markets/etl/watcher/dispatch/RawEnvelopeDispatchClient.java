package com.lbg.markets.etl.watcher.dispatch;

import com.lbg.markets.etl.watcher.config.DispatchSettings;
import com.lbg.markets.etl.watcher.domain.DispatchRequest;

import java.time.Clock;
import java.time.Instant;

/**
 * Dispatches by building the Celery envelope by hand and pushing it onto the broker list.
 */
public class RawEnvelopeDispatchClient implements DispatchClient {

    private final CeleryEnvelope envelope;
    private final BrokerTransport transport;
    private final DispatchSettings settings;
    private final Clock clock;

    public RawEnvelopeDispatchClient(CeleryEnvelope envelope, BrokerTransport transport,
                                     DispatchSettings settings, Clock clock) {
        this.envelope = envelope;
        this.transport = transport;
        this.settings = settings;
        this.clock = clock;
    }

    @Override
    public String dispatch(DispatchRequest request, String correlationId) throws DispatchException {
        Instant now = clock.instant();
        DispatchTask task = DispatchTask.forFile(request, settings, now, clock.getZone());

        transport.push(settings.queue(), envelope.encode(task, correlationId, settings.queue()));
        return correlationId;
    }

    @Override
    public String strategy() {
        return "raw";
    }
}
