package com.mentionindex.mention;

import java.time.Duration;

/**
 * 延迟执行的调度端口，增量扫描借它在批次之间让出控制权。
 */
public interface TaskScheduler {

    void schedule(Runnable task, Duration delay);
}
