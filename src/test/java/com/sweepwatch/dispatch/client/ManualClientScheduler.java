package com.sweepwatch.dispatch.client;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Virtual-time scheduler: nothing runs until {@link #advance(long)} moves the clock past a task's due time.
 */
class ManualClientScheduler implements ClientScheduler {

    private final List<Task> tasks = new ArrayList<>();
    private final List<Long> oneShotDelays = new ArrayList<>();
    private long now = 1_000_000;
    private long sequence;

    private final class Task {
        final Runnable action;
        final long period;
        final long order = sequence++;
        long due;
        boolean cancelled;

        Task(Runnable action, long due, long period) {
            this.action = action;
            this.due = due;
            this.period = period;
        }
    }

    @Override
    public Cancellable schedule(Runnable task, long delayMs) {
        oneShotDelays.add(delayMs);
        return add(task, delayMs, 0);
    }

    @Override
    public Cancellable scheduleAtFixedRate(Runnable task, long periodMs) {
        return add(task, periodMs, periodMs);
    }

    @Override
    public long nowMillis() {
        return now;
    }

    void advance(long millis) {
        long target = now + millis;
        while (true) {
            Optional<Task> next = tasks.stream()
                    .filter(t -> !t.cancelled && t.due <= target)
                    .min(Comparator.<Task>comparingLong(t -> t.due).thenComparingLong(t -> t.order));
            if (next.isEmpty()) {
                break;
            }
            Task task = next.get();
            now = task.due;
            if (task.period > 0) {
                task.due += task.period;
            } else {
                tasks.remove(task);
            }
            task.action.run();
        }
        now = target;
    }

    /** Delays of every one-shot task scheduled so far, in scheduling order. */
    List<Long> oneShotDelays() {
        return List.copyOf(oneShotDelays);
    }

    long pendingTasks() {
        return tasks.stream().filter(t -> !t.cancelled).count();
    }

    private Cancellable add(Runnable action, long delay, long period) {
        Task task = new Task(action, now + delay, period);
        tasks.add(task);
        return () -> {
            task.cancelled = true;
            tasks.remove(task);
        };
    }
}
