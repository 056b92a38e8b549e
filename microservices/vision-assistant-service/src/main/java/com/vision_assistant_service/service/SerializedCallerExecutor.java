package com.vision_assistant_service.service;

import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs each task on the submitting thread, one at a time. Used when persistence is not
 * asynchronous so that writes and session close still never interleave.
 */
public class SerializedCallerExecutor implements Executor {

    private final ReentrantLock lock = new ReentrantLock(true);

    @Override
    public void execute(Runnable task) {
        lock.lock();
        try {
            task.run();
        } finally {
            lock.unlock();
        }
    }
}
