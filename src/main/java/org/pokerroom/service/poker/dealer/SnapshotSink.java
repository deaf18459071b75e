package org.pokerroom.service.poker.dealer;

import org.pokerroom.dto.poker.TableSnapshot;

/** Where the dealer records table snapshots. Implementations may fail; the dealer logs and carries on. */
@FunctionalInterface
public interface SnapshotSink {
    void write(TableSnapshot snapshot);
}
