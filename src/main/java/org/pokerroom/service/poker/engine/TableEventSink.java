package org.pokerroom.service.poker.engine;

@FunctionalInterface
public interface TableEventSink {
    TableEventSink NONE = e -> { };

    void accept(TableEvent event);
}
