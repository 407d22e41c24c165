package com.questrail.devicehub.protocol.etf;

import java.util.Objects;

/**
 * A decoded atom.
 */
public record Atom(String name) {
    public Atom {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public String toString() {
        return name;
    }
}
