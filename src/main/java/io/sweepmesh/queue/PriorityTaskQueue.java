package io.sweepmesh.queue;

import java.util.Comparator;
import java.util.HashSet;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Thread-safe min-priority queue of tasks. Lower priority values are served first and equal priorities
 * are served in insertion order. A dequeued task stays in flight until it is completed, failed or
 * requeued; a task id that is pending or in flight cannot be put again.
 */
public final class PriorityTaskQueue {
    private static final Comparator<Entry> ORDER = Comparator
            .comparingInt(Entry::priority)
            .thenComparingLong(Entry::sequence);

    private final PriorityQueue<Entry> heap = new PriorityQueue<>(ORDER);
    private final Set<Long> pendingIds = new HashSet<>();
    private final Set<Long> inFlight = new HashSet<>();
    private long sequence = 0L;
    private int completed = 0;
    private int failed = 0;

    public synchronized void put(QueuedTask task, int priority) {
        if (task == null) {
            throw new IllegalArgumentException("task is required");
        }
        long id = task.taskId();
        if (pendingIds.contains(id) || inFlight.contains(id)) {
            throw new IllegalStateException("task already queued or in flight: " + id);
        }
        insert(task, priority);
    }

    /**
     * Waits up to {@code timeout} for the next task and marks it in flight.
     */
    public synchronized Optional<QueuedTask> get(long timeout, TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(Math.max(0L, timeout));
        while (heap.isEmpty()) {
            long remainingNanos = deadline - System.nanoTime();
            if (remainingNanos <= 0L) {
                return Optional.empty();
            }
            TimeUnit.NANOSECONDS.timedWait(this, remainingNanos);
        }
        Entry next = heap.poll();
        pendingIds.remove(next.task().taskId());
        inFlight.add(next.task().taskId());
        return Optional.of(next.task());
    }

    public synchronized void requeue(QueuedTask task, int priority) {
        if (task == null) {
            throw new IllegalArgumentException("task is required");
        }
        inFlight.remove(task.taskId());
        if (pendingIds.contains(task.taskId())) {
            throw new IllegalStateException("task already queued: " + task.taskId());
        }
        insert(task, priority);
    }

    public synchronized void markCompleted(QueuedTask task) {
        inFlight.remove(task.taskId());
        completed++;
        notifyAll();
    }

    public synchronized void markFailed(QueuedTask task) {
        inFlight.remove(task.taskId());
        failed++;
        notifyAll();
    }

    /**
     * Drops the in-flight mark without counting an outcome; used when a claim is abandoned.
     */
    public synchronized void release(QueuedTask task) {
        inFlight.remove(task.taskId());
        notifyAll();
    }

    public synchronized boolean isInFlight(long taskId) {
        return inFlight.contains(taskId);
    }

    public synchronized boolean hasPending() {
        return !heap.isEmpty();
    }

    public synchronized boolean isDrained() {
        return heap.isEmpty() && inFlight.isEmpty();
    }

    public synchronized int size() {
        return heap.size();
    }

    public synchronized QueueStats stats() {
        return new QueueStats(heap.size(), inFlight.size(), completed, failed);
    }

    public synchronized int clear() {
        int dropped = heap.size();
        heap.clear();
        pendingIds.clear();
        notifyAll();
        return dropped;
    }

    private void insert(QueuedTask task, int priority) {
        heap.add(new Entry(priority, sequence++, task));
        pendingIds.add(task.taskId());
        notifyAll();
    }

    private record Entry(int priority, long sequence, QueuedTask task) {
    }
}
