package com.settleworks.core.synchronization;

import com.settleworks.core.economy.TickResult;
import com.settleworks.core.managers.Settlement;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Motore a frequenza fissa dell'insediamento. Tutti i tick girano su un unico thread daemon,
 * quindi non si sovrappongono mai.
 * Le modifiche da altri thread devono passare da {@link #submit(Runnable)}.
 */
public class SettlementLoop {

    private final Settlement settlement;
    private final long intervalMillis;
    private final Consumer<TickResult> listener;
    private final ScheduledExecutorService scheduler;
    private final AtomicLong failedTicks = new AtomicLong(0);

    private volatile boolean running = false;
    private volatile TickResult lastResult;

    public SettlementLoop(Settlement settlement, long intervalMillis, Consumer<TickResult> listener) {
        if (intervalMillis <= 0) throw new IllegalArgumentException("intervalMillis must be > 0");
        this.settlement = settlement;
        this.intervalMillis = intervalMillis;
        this.listener = listener;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "sw-settlement-loop");
            t.setDaemon(true);
            return t;
        });
    }

    public SettlementLoop(Settlement settlement) {
        this(settlement, settlement.getSettings().tickIntervalMillis(), null);
    }

    public void start() {
        if (running) return;
        running = true;

        scheduler.scheduleAtFixedRate(this::tickOnce, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        System.out.println("🏕️ [SettlementLoop] Started (" + intervalMillis + " ms per tick).");
    }

    void tickOnce() {
        if (!running) return;
        try {
            TickResult result = settlement.runTick();
            lastResult = result;
            if (listener != null) listener.accept(result);
        } catch (RuntimeException e) {
            failedTicks.incrementAndGet();
            System.err.println("🚨 [SettlementLoop] Tick failed: " + e.getMessage());
            e.printStackTrace();
        }
    }

    /** Esegue il task sul thread del loop, tra due tick. */
    public void submit(Runnable task) {
        scheduler.execute(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                System.err.println("🚨 [SettlementLoop] Submitted task failed: " + e.getMessage());
                e.printStackTrace();
            }
        });
    }

    public void stop() {
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(2, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        System.out.println("[SettlementLoop] Stopped.");
    }

    public boolean isRunning() {
        return running;
    }

    public TickResult getLastResult() {
        return lastResult;
    }

    public long getFailedTicks() {
        return failedTicks.get();
    }
}
