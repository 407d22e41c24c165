package com.questrail.devicehub.runtime;

import com.questrail.devicehub.config.HubConfig;
import com.questrail.devicehub.observability.Slf4jHubObservabilitySink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Command line entry point.
 *
 * <p>Reads discovery lines from standard input (one per line, as written by
 * the udev notify scripts or a {@code tail -f} of the kernel log) and runs
 * the hub until input ends.</p>
 *
 * <pre>
 *   DeviceHubMain [syslog-host]
 * </pre>
 */
public final class DeviceHubMain
{
    private static final Logger log = LoggerFactory.getLogger(DeviceHubMain.class);

    private DeviceHubMain() {}

    public static void main(String[] args) throws IOException
    {
        DeviceHubRuntime runtime = DeviceHubRuntime.builder()
                .withConfig(HubConfig.defaults())
                .withObservabilitySink(new Slf4jHubObservabilitySink())
                .withSyslogHost(args.length > 0 ? args[0] : "localhost")
                .build();

        Runtime.getRuntime().addShutdownHook(new Thread(runtime::stop, "device-hub-shutdown"));
        runtime.start();
        log.info("device hub started, reading discovery lines from stdin");

        try (BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = in.readLine()) != null) {
                if (runtime.onDiscoveryLine(line).isEmpty()) {
                    log.debug("ignoring: {}", line);
                }
            }
        }
        log.info("end of input, stopping");
        runtime.stop();
    }
}
