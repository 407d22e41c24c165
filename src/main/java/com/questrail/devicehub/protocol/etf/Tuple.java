package com.questrail.devicehub.protocol.etf;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A decoded tuple.
 */
public record Tuple(List<Object> elements) {
    public Tuple {
        elements = List.copyOf(elements);
    }

    public int arity() {
        return elements.size();
    }

    public Object get(int index) {
        return elements.get(index);
    }

    @Override
    public String toString() {
        return elements.stream()
                .map(ExternalTerms::render)
                .collect(Collectors.joining(",", "{", "}"));
    }
}
