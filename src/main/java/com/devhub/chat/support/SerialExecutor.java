package com.devhub.chat.support;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Queue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs submitted tasks one at a time, in submission order, on a shared executor.
 * Each live connection owns one of these as its inbound queue.
 */
@Slf4j
public class SerialExecutor implements Executor {

    private final Queue<Runnable> tasks = new ArrayDeque<>();
    private final Executor delegate;
    private Runnable active;
    private boolean closed;

    public SerialExecutor(Executor delegate) {
        this.delegate = delegate;
    }

    @Override
    public synchronized void execute(Runnable task) {
        if (closed) {
            throw new RejectedExecutionException("Inbox is closed");
        }
        tasks.add(() -> {
            try {
                task.run();
            } finally {
                scheduleNext();
            }
        });
        if (active == null) {
            scheduleNext();
        }
    }

    /** Drops queued tasks and refuses new ones; a task already running completes. */
    public synchronized void close() {
        closed = true;
        tasks.clear();
    }

    public synchronized int pending() {
        return tasks.size();
    }

    private synchronized void scheduleNext() {
        active = tasks.poll();
        if (active != null) {
            try {
                delegate.execute(active);
            } catch (RejectedExecutionException e) {
                log.warn("Shared executor rejected a connection task, dropping {} queued task(s)", tasks.size());
                active = null;
                tasks.clear();
                throw e;
            }
        }
    }
}
