package com.pairtrader.engine.service.monitor;

import com.pairtrader.engine.service.ScheduledTaskGuard;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Long-lived check loop on its own daemon thread. Each iteration goes through
 * {@link ScheduledTaskGuard}, so one failing check never ends the loop. Stopping is
 * cooperative: the flag is read between iterations and the sleep wakes up early.
 */
@Slf4j
public abstract class AbstractOrderMonitor {

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

    private final String name;
    private final ScheduledTaskGuard taskGuard;
    private final AtomicBoolean running = new AtomicBoolean();

    private volatile CountDownLatch stopSignal = new CountDownLatch(1);
    private ExecutorService worker;

    protected AbstractOrderMonitor(String name, ScheduledTaskGuard taskGuard) {
        this.name = name;
        this.taskGuard = taskGuard;
    }

    /** One full check. Public so callers and tests can drive a single iteration. */
    public abstract void runOnce();

    protected abstract Duration checkInterval();

    protected abstract boolean isEnabled();

    /** Extra wait after a failed iteration. */
    protected Duration errorPause() {
        return Duration.ZERO;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (isEnabled()) {
            start();
        } else {
            log.info("{} disabled by configuration", name);
        }
    }

    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        stopSignal = new CountDownLatch(1);
        worker = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, name);
            thread.setDaemon(true);
            return thread;
        });
        worker.submit(this::loop);
        log.info("{} started interval={}s", name, checkInterval().toSeconds());
    }

    @PreDestroy
    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        stopSignal.countDown();
        worker.shutdown();
        try {
            if (!worker.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("{} did not finish its iteration within {}s", name, SHUTDOWN_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("{} stopped", name);
    }

    public boolean isRunning() {
        return running.get();
    }

    public String getName() {
        return name;
    }

    private void loop() {
        while (running.get()) {
            boolean succeeded = taskGuard.run(name, this::runOnce);
            Duration wait = succeeded ? checkInterval() : checkInterval().plus(errorPause());
            if (!sleep(wait)) {
                return;
            }
        }
    }

    /** @return false when a stop was requested while waiting */
    private boolean sleep(Duration wait) {
        try {
            return !stopSignal.await(wait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
