package com.dev.sacudo.session;

import org.slf4j.MDC;

import java.util.ArrayDeque;
import java.util.Queue;
import java.util.concurrent.Executor;

/**
 * Runs tasks one at a time, in submission order, on a shared pool. Each guild session owns one, which gives
 * single-writer access to the session without dedicating a thread to it.
 */
class SerialExecutor implements Executor {

    static final String MDC_GUILD = "guild";

    private final Queue<Runnable> tasks = new ArrayDeque<>();
    private final Executor executor;
    private final String guildId;
    private Runnable active;

    SerialExecutor(Executor executor, String guildId) {
        this.executor = executor;
        this.guildId = guildId;
    }

    @Override
    public synchronized void execute(Runnable task) {
        tasks.add(() -> {
            String previous = MDC.get(MDC_GUILD);
            MDC.put(MDC_GUILD, guildId);
            try {
                task.run();
            } finally {
                if (previous != null) {
                    MDC.put(MDC_GUILD, previous);
                } else {
                    MDC.remove(MDC_GUILD);
                }
                scheduleNext();
            }
        });
        if (active == null) {
            scheduleNext();
        }
    }

    private synchronized void scheduleNext() {
        if ((active = tasks.poll()) != null) {
            executor.execute(active);
        }
    }
}
