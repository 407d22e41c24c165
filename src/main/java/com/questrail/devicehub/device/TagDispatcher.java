package com.questrail.devicehub.device;

import com.questrail.devicehub.internal.time.WallClock;
import com.questrail.devicehub.observability.DeviceOutputEvent;
import com.questrail.devicehub.observability.HubObservabilitySink;
import com.questrail.devicehub.observability.HubWarningEvent;
import com.questrail.devicehub.protocol.etf.ExternalTerms;
import com.questrail.devicehub.protocol.etf.TermDecodeException;
import com.questrail.devicehub.protocol.etf.Tuple;
import com.questrail.devicehub.rpc.AckCodec;
import com.questrail.devicehub.rpc.AckDecodeException;
import com.questrail.devicehub.rpc.CorrelationTable;
import com.questrail.devicehub.rpc.UnknownTokenException;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.OptionalInt;
import java.util.function.Supplier;

/**
 * TagDispatcher
 * =============================================================================
 * Built-in interpretation of application-mode frames, by tag:
 * <ul>
 *   <li>{@link Tag#DEBUG}: fed to the outstanding RSP call, or logged as
 *       unclaimed</li>
 *   <li>{@link Tag#INFO}: line-buffered and logged one line at a time</li>
 *   <li>{@link Tag#REPLY}: resolves a correlated call</li>
 *   <li>first byte 131: external-format term, decoded best-effort</li>
 *   <li>anything else: logged as bytes</li>
 * </ul>
 *
 * <p>Nothing here is fatal. Undecodable acks and replies nobody waits for are
 * reported as warnings and dropped.</p>
 *
 * <p>Owned by one device actor and only used on its thread.</p>
 */
final class TagDispatcher
{
    /** Tag used by the firmware's term logger for log records. */
    private static final long LOG_RECORD = 123;

    /** Receives debug sub-channel data. */
    @FunctionalInterface
    interface DebugSink {
        /**
         * @return false if no call is waiting for the data
         */
        boolean offer(byte[] payload);
    }

    private final Supplier<String> source;
    private final HubObservabilitySink sink;
    private final WallClock wallClock;
    private final CorrelationTable<PendingCorrelation> correlations;
    private final DebugSink debug;
    private final InfoLineBuffer lines = new InfoLineBuffer();

    TagDispatcher(Supplier<String> source,
                  HubObservabilitySink sink,
                  WallClock wallClock,
                  CorrelationTable<PendingCorrelation> correlations,
                  DebugSink debug)
    {
        this.source = source;
        this.sink = sink;
        this.wallClock = wallClock;
        this.correlations = correlations;
        this.debug = debug;
    }

    void dispatch(byte[] frame)
    {
        if (frame.length == 0) {
            return;
        }

        OptionalInt tag = Tag.of(frame);
        if (tag.isPresent()) {
            switch (tag.getAsInt()) {
                case Tag.DEBUG:
                    onDebug(Arrays.copyOfRange(frame, 2, frame.length));
                    return;
                case Tag.INFO:
                    onInfo(Arrays.copyOfRange(frame, 2, frame.length));
                    return;
                case Tag.REPLY:
                    onReply(frame);
                    return;
                default:
                    break;
            }
        }

        if ((frame[0] & 0xFF) == ExternalTerms.VERSION) {
            onTerm(frame);
        } else {
            output(DeviceOutputEvent.Kind.PACKET, render(frame));
        }
    }

    int pendingInfoBytes()
    {
        return lines.pending();
    }

    private void onDebug(byte[] payload)
    {
        if (!debug.offer(payload)) {
            output(DeviceOutputEvent.Kind.UNCLAIMED_DEBUG, render(payload));
        }
    }

    private void onInfo(byte[] payload)
    {
        for (String line : lines.append(payload)) {
            output(DeviceOutputEvent.Kind.INFO_LINE, line);
        }
    }

    // u16 tag, u8 L, ack (L bytes), payload
    private void onReply(byte[] frame)
    {
        if (frame.length < 3 || 3 + (frame[2] & 0xFF) > frame.length) {
            warn("truncated REPLY frame: " + render(frame));
            return;
        }
        int ackEnd = 3 + (frame[2] & 0xFF);
        byte[] ack = Arrays.copyOfRange(frame, 3, ackEnd);
        byte[] payload = Arrays.copyOfRange(frame, ackEnd, frame.length);

        final int token;
        try {
            token = AckCodec.decode(ack);
        } catch (AckDecodeException e) {
            warn("bad ack in REPLY frame: " + render(frame));
            return;
        }

        final PendingCorrelation call;
        try {
            call = correlations.resolve(token);
        } catch (UnknownTokenException e) {
            warn("reply for token " + token + " received by no one");
            return;
        }
        call.complete(payload);
    }

    private void onTerm(byte[] frame)
    {
        final Object term;
        try {
            term = ExternalTerms.decode(frame);
        } catch (TermDecodeException e) {
            warn("undecodable term (" + e.getMessage() + "): " + render(frame));
            return;
        }

        // [{123, LogData}]
        if (term instanceof List<?> list
                && list.size() == 1
                && list.get(0) instanceof Tuple t
                && t.arity() == 2
                && Long.valueOf(LOG_RECORD).equals(t.get(0))) {
            output(DeviceOutputEvent.Kind.TERM, text(t.get(1)));
        } else {
            output(DeviceOutputEvent.Kind.TERM, "term not understood: " + ExternalTerms.render(term));
        }
    }

    private static String text(Object logData)
    {
        if (logData instanceof byte[] bin) {
            return new String(bin, StandardCharsets.UTF_8).stripTrailing();
        }
        if (logData instanceof List<?> chars) {
            StringBuilder sb = new StringBuilder();
            for (Object c : chars) {
                if (c instanceof Long code) {
                    sb.append((char) code.intValue());
                } else {
                    return ExternalTerms.render(logData);
                }
            }
            return sb.toString().stripTrailing();
        }
        return ExternalTerms.render(logData);
    }

    /**
     * Printable ASCII verbatim, everything else as {@code \xNN}.
     */
    static String render(byte[] bytes)
    {
        StringBuilder sb = new StringBuilder(bytes.length);
        for (byte b : bytes) {
            int c = b & 0xFF;
            if (c >= 0x20 && c < 0x7F && c != '\\') {
                sb.append((char) c);
            } else {
                sb.append(String.format("\\x%02x", c));
            }
        }
        return sb.toString();
    }

    private void output(DeviceOutputEvent.Kind kind, String text)
    {
        sink.onDeviceOutput(new DeviceOutputEvent(wallClock.now(), source.get(), kind, text));
    }

    private void warn(String message)
    {
        sink.onWarning(new HubWarningEvent(wallClock.now(), source.get(), message));
    }
}
