package com.mentionindex.mention;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 基于单线程守护调度器的实现。任务异常只记录日志，不会静默丢失。
 */
public class ExecutorTaskScheduler implements TaskScheduler, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ExecutorTaskScheduler.class);

    private final ScheduledExecutorService executor;

    public ExecutorTaskScheduler() {
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "mention-incremental-scan");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public void schedule(Runnable task, Duration delay) {
        executor.schedule(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                logger.error("后台任务执行失败", e);
            }
        }, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
