package org.pokerroom.service.poker.util;

import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.function.Supplier;

/** Striped monitors: every mutation of a table runs under the stripe of its id. */
@Component
public class Locks {
    private final Object[] stripes = new Object[128];

    public Locks() { for (int i = 0; i < stripes.length; i++) stripes[i] = new Object(); }

    public Object of(Long tableId) {
        int idx = Objects.hashCode(tableId) & (stripes.length - 1);
        return stripes[idx];
    }

    public void run(Long tableId, Runnable r) {
        synchronized (of(tableId)) { r.run(); }
    }

    public <T> T call(Long tableId, Supplier<T> s) {
        synchronized (of(tableId)) { return s.get(); }
    }
}
