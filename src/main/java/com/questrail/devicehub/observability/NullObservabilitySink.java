package com.questrail.devicehub.observability;

/**
 * No-op implementation of HubObservabilitySink.
 */
public final class NullObservabilitySink implements HubObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onLifecycle(DeviceLifecycleEvent event) {}

    @Override
    public void onDeviceOutput(DeviceOutputEvent event) {}

    @Override
    public void onWarning(HubWarningEvent event) {}

    @Override
    public void onError(HubErrorEvent event) {}
}
