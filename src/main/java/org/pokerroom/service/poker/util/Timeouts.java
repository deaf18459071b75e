package org.pokerroom.service.poker.util;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.*;

/**
 * Named one-shot timers grouped by table. Scheduling a name that is already
 * armed cancels the previous handle first, so each (table, name) has at most
 * one live timer.
 */
@Slf4j
@Component
public class Timeouts {
    private final ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(2, r -> {
        Thread t = new Thread(r, "poker-timer");
        t.setDaemon(true);
        return t;
    });
    private final Map<String, ScheduledFuture<?>> tasks = new ConcurrentHashMap<>();

    public void schedule(Long tableId, String name, long delayMs, Runnable task) {
        String key = key(tableId, name);
        ScheduledFuture<?> previous = tasks.remove(key);
        if (previous != null) previous.cancel(false);

        Runnable guarded = () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("timer {} en échec", key, e);
            }
        };
        tasks.put(key, scheduler.schedule(guarded, Math.max(0, delayMs), TimeUnit.MILLISECONDS));
    }

    public void cancel(Long tableId, String name) {
        ScheduledFuture<?> f = tasks.remove(key(tableId, name));
        if (f != null) f.cancel(false);
    }

    public void cancelAllOf(Long tableId) {
        String prefix = tableId + ":";
        tasks.entrySet().removeIf(e -> {
            if (!e.getKey().startsWith(prefix)) return false;
            e.getValue().cancel(false);
            return true;
        });
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdownNow();
    }

    private String key(Long tableId, String name) { return tableId + ":" + name; }
}
