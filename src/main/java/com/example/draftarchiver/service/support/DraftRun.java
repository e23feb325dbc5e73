package com.example.draftarchiver.service.support;

import com.example.draftarchiver.exceptions.LifecycleCancelledException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Future;
import java.util.function.Consumer;

/**
 * Exclusive handle on one draft ID for the duration of a lifecycle run.
 * <p>
 * Obtained from the workspace registry and released with {@link #close()}. Besides the lease it carries
 * the run's cancellation flag, the futures of its in-flight asset fetches and a count of fetch tasks
 * currently touching the workspace, so cleanup can wait until nothing is still writing there.
 */
public class DraftRun implements AutoCloseable {

    private final String draftId;
    private final Consumer<DraftRun> onRelease;
    private final Object lock = new Object();
    private final List<Future<?>> futures = new ArrayList<>();

    private boolean cancelled;
    private boolean released;
    private int activeTasks;
    private Thread owner;
    private boolean ownerInterrupted;

    public DraftRun(String draftId, Consumer<DraftRun> onRelease) {
        this.draftId = draftId;
        this.onRelease = onRelease;
    }

    public String getDraftId() {
        return draftId;
    }

    /**
     * Registers the thread driving the run so that {@link #cancel()} can interrupt it
     * while it waits on fetches, permits or storage.
     */
    public void bindOwner(Thread thread) {
        synchronized (lock) {
            owner = thread;
            ownerInterrupted = false;
        }
    }

    /**
     * Stops cancellation from interrupting the owner thread.
     *
     * @return true if cancellation interrupted the owner while it was bound; the caller should clear the flag.
     */
    public boolean unbindOwner() {
        synchronized (lock) {
            owner = null;
            return ownerInterrupted;
        }
    }

    /**
     * Requests cancellation, interrupts every tracked fetch and the bound owner thread.
     *
     * @return false if the run was already cancelled or released.
     */
    public boolean cancel() {
        List<Future<?>> toCancel;
        synchronized (lock) {
            if (cancelled || released) {
                return false;
            }
            cancelled = true;
            toCancel = new ArrayList<>(futures);
            // Interrupted under the lock so an unbound owner is never hit
            if (owner != null && owner != Thread.currentThread()) {
                owner.interrupt();
                ownerInterrupted = true;
            }
        }
        toCancel.forEach(future -> future.cancel(true));
        return true;
    }

    public boolean isCancelled() {
        synchronized (lock) {
            return cancelled;
        }
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new LifecycleCancelledException("Lifecycle run for draft " + draftId + " was cancelled.");
        }
    }

    public void track(Future<?> future) {
        boolean alreadyCancelled;
        synchronized (lock) {
            futures.add(future);
            alreadyCancelled = cancelled;
        }
        if (alreadyCancelled) {
            future.cancel(true);
        }
    }

    /**
     * Called by a fetch task before it touches the workspace.
     *
     * @return false if the run is cancelled; the task must then not start.
     */
    public boolean enterTask() {
        synchronized (lock) {
            if (cancelled) {
                return false;
            }
            activeTasks++;
            return true;
        }
    }

    public void exitTask() {
        synchronized (lock) {
            activeTasks--;
            lock.notifyAll();
        }
    }

    public int getActiveTasks() {
        synchronized (lock) {
            return activeTasks;
        }
    }

    /**
     * @return true if a fetch task is running or a tracked future has not completed.
     */
    public boolean hasPendingWork() {
        synchronized (lock) {
            return activeTasks > 0 || futures.stream().anyMatch(future -> !future.isDone());
        }
    }

    /**
     * Blocks until no fetch task is inside the workspace, or the timeout passes.
     *
     * @return true if idle.
     */
    public boolean awaitTasksIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (lock) {
            while (activeTasks > 0) {
                long remainingMillis = (deadline - System.nanoTime()) / 1_000_000;
                if (remainingMillis <= 0) {
                    return false;
                }
                lock.wait(remainingMillis);
            }
            return true;
        }
    }

    /**
     * Releases the draft ID back to the registry. Idempotent.
     */
    @Override
    public void close() {
        synchronized (lock) {
            if (released) {
                return;
            }
            released = true;
        }
        onRelease.accept(this);
    }
}
