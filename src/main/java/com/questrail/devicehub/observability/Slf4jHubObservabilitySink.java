package com.questrail.devicehub.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of HubObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jHubObservabilitySink implements HubObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jHubObservabilitySink.class);

    @Override
    public void onLifecycle(DeviceLifecycleEvent event) {
        log.info("{}: {}", event.source(), event.description());
    }

    @Override
    public void onDeviceOutput(DeviceOutputEvent event) {
        switch (event.kind()) {
            case INFO_LINE -> log.info("{}: info: {}", event.source(), event.text());
            case TERM -> log.info("{}: term: {}", event.source(), event.text());
            case UNCLAIMED_DEBUG -> log.info("{}: from_gdbstub: {}", event.source(), event.text());
            default -> log.info("{}: packet: {}", event.source(), event.text());
        }
    }

    @Override
    public void onWarning(HubWarningEvent event) {
        log.warn("{}: {}", event.source(), event.message());
    }

    @Override
    public void onError(HubErrorEvent event) {
        log.error("{}: {}", event.source(), event.message(), event.cause());
    }
}
