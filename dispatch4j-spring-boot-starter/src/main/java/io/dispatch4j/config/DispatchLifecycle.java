package io.dispatch4j.config;

import io.dispatch4j.DaemonLoop;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges the daemon loop with the Spring container lifecycle.
 *
 * <p>A startup that never reaches storage throws out of {@link #start()}, which fails the context refresh.
 */
public class DispatchLifecycle implements SmartLifecycle {
    private final DaemonLoop daemonLoop;
    private volatile boolean running = false;

    public DispatchLifecycle(DaemonLoop daemonLoop) {
        this.daemonLoop = daemonLoop;
    }

    @Override
    public void start() {
        daemonLoop.start();
        running = true;
    }

    @Override
    public void stop() {
        daemonLoop.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
