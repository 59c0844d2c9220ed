package com.evenexus.config;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Runs a saturated pool's overflow on the submitting thread. Once the pool is shut down the
 * task is rejected with an exception, so no submitter is left holding a future that never
 * completes.
 */
public class CallerRunsUnlessShutdownPolicy implements RejectedExecutionHandler {

    @Override
    public void rejectedExecution(Runnable task, ThreadPoolExecutor executor) {
        if (executor.isShutdown()) {
            throw new RejectedExecutionException("Executor is shut down, task rejected");
        }
        task.run();
    }
}
