package com.questrail.devicehub.rpc;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * CorrelationTable
 * =============================================================================
 * Pairs outgoing calls with their eventual replies through small integer
 * tokens.
 *
 * <p>{@link #allocate(Object)} hands out the lowest unused token, so tokens
 * stay small (one byte in the common case) and are reused once resolved.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>Not thread-safe. A table is private to its device actor and only touched
 * on the actor thread.</p>
 *
 * @param <C> caller handle, typically the future awaiting the reply
 */
public final class CorrelationTable<C>
{
    private final Map<Integer, C> waiting = new HashMap<>();

    /**
     * Records {@code caller} under the lowest unused token.
     */
    public int allocate(C caller)
    {
        Objects.requireNonNull(caller, "caller");
        int token = 0;
        while (waiting.containsKey(token)) {
            token++;
        }
        waiting.put(token, caller);
        return token;
    }

    /**
     * Removes and returns the caller recorded under {@code token}.
     *
     * @throws UnknownTokenException if no caller is recorded under it
     */
    public C resolve(int token)
    {
        C caller = waiting.remove(token);
        if (caller == null) {
            throw new UnknownTokenException(token);
        }
        return caller;
    }

    /**
     * Removes the entry for {@code token} only if it still belongs to
     * {@code caller}. Used when a call times out, so a token that was already
     * resolved and reissued is left alone.
     *
     * @return true if the entry was removed
     */
    public boolean release(int token, C caller)
    {
        return waiting.remove(token, caller);
    }

    public int size()
    {
        return waiting.size();
    }

    /**
     * Removes every entry and returns them, e.g. to fail all callers when the
     * owning actor terminates.
     */
    public Map<Integer, C> drain()
    {
        Map<Integer, C> copy = new HashMap<>(waiting);
        waiting.clear();
        return copy;
    }
}
