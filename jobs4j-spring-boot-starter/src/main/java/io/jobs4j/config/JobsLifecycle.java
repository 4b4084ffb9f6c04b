package io.jobs4j.config;

import io.jobs4j.JobWorker;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges worker start/stop with the Spring container lifecycle.
 */
public class JobsLifecycle implements SmartLifecycle {
    private final JobWorker worker;
    private final boolean startWorker;
    private volatile boolean running = false;

    public JobsLifecycle(JobWorker worker, boolean startWorker) {
        this.worker = worker;
        this.startWorker = startWorker;
    }

    @Override
    public void start() {
        if (startWorker) {
            worker.start();
        }
        running = true;
    }

    @Override
    public void stop() {
        worker.stop();
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
