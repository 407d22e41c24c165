package com.questrail.devicehub.hub;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * TcpPortAllocator
 * -----------------------------------------------------------------------------
 * Deterministic debug port per device: {@code basePort} plus the first 14
 * bits of {@code SHA-1(host || devPath)}.
 *
 * <p>The same device always gets the same port, across hub restarts, so GDB
 * configurations can hard-code it. Collisions are not detected; two devices
 * hashing to the same port make the second bind fail.</p>
 */
public final class TcpPortAllocator
{
    public static final int PORT_SPAN = 1 << 14;

    private final int basePort;

    public TcpPortAllocator(int basePort)
    {
        if (basePort < 0 || basePort + PORT_SPAN - 1 > 65535) {
            throw new IllegalArgumentException("basePort out of range: " + basePort);
        }
        this.basePort = basePort;
    }

    public int port(String host, String devPath)
    {
        byte[] digest = sha1(host + devPath);
        int offset = ((digest[0] & 0xFF) << 6) | ((digest[1] & 0xFF) >>> 2);
        return basePort + offset;
    }

    private static byte[] sha1(String key)
    {
        try {
            return MessageDigest.getInstance("SHA-1").digest(key.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-1.
            throw new IllegalStateException(e);
        }
    }
}
