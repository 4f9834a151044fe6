package uk.gegc.tunetrivia.testsupport;

import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Delayed;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link TaskScheduler} driven by a {@link MutableClock}. Nothing runs until the test calls
 * {@link #advance(Duration)} or {@link #runDueTasks()}, and tasks run on the calling thread.
 * Fixed-rate tasks are treated like fixed-delay ones.
 */
public class ManualTaskScheduler implements TaskScheduler {

    private final MutableClock clock;
    private final List<ManualFuture> tasks = new ArrayList<>();

    public ManualTaskScheduler(MutableClock clock) {
        this.clock = clock;
    }

    @Override
    public Clock getClock() {
        return clock;
    }

    /**
     * Move time forward, running every task that falls due on the way, in time order.
     */
    public synchronized void advance(Duration duration) {
        Instant target = clock.instant().plus(duration);
        while (true) {
            Optional<ManualFuture> next = nextDue(target);
            if (next.isEmpty()) {
                break;
            }
            ManualFuture task = next.get();
            if (task.nextRun.isAfter(clock.instant())) {
                clock.setInstant(task.nextRun);
            }
            run(task);
        }
        clock.setInstant(target);
    }

    /**
     * Run the tasks due at the current instant without moving time.
     */
    public synchronized void runDueTasks() {
        advance(Duration.ZERO);
    }

    public synchronized int pendingTaskCount() {
        return (int) tasks.stream().filter(task -> !task.isDone()).count();
    }

    @Override
    public synchronized ScheduledFuture<?> schedule(Runnable task, Trigger trigger) {
        throw new UnsupportedOperationException("Trigger based scheduling is not supported");
    }

    @Override
    public synchronized ScheduledFuture<?> schedule(Runnable task, Instant startTime) {
        return register(task, startTime, null);
    }

    @Override
    public synchronized ScheduledFuture<?> scheduleAtFixedRate(Runnable task, Instant startTime, Duration period) {
        return register(task, startTime, period);
    }

    @Override
    public synchronized ScheduledFuture<?> scheduleAtFixedRate(Runnable task, Duration period) {
        return register(task, clock.instant(), period);
    }

    @Override
    public synchronized ScheduledFuture<?> scheduleWithFixedDelay(Runnable task, Instant startTime, Duration delay) {
        return register(task, startTime, delay);
    }

    @Override
    public synchronized ScheduledFuture<?> scheduleWithFixedDelay(Runnable task, Duration delay) {
        return register(task, clock.instant(), delay);
    }

    private ManualFuture register(Runnable task, Instant startTime, Duration period) {
        ManualFuture future = new ManualFuture(task, startTime, period);
        tasks.add(future);
        return future;
    }

    private Optional<ManualFuture> nextDue(Instant target) {
        tasks.removeIf(ManualFuture::isDone);
        return tasks.stream()
                .filter(task -> !task.nextRun.isAfter(target))
                .min(Comparator.comparing((ManualFuture task) -> task.nextRun));
    }

    private void run(ManualFuture task) {
        try {
            task.runnable.run();
        } finally {
            if (task.period == null) {
                task.completed = true;
            } else {
                task.nextRun = clock.instant().plus(task.period);
            }
        }
    }

    private final class ManualFuture implements ScheduledFuture<Object> {

        private final Runnable runnable;
        private final Duration period;
        private volatile Instant nextRun;
        private volatile boolean cancelled;
        private volatile boolean completed;

        private ManualFuture(Runnable runnable, Instant nextRun, Duration period) {
            this.runnable = runnable;
            this.nextRun = nextRun;
            this.period = period;
        }

        @Override
        public long getDelay(TimeUnit unit) {
            return unit.convert(Duration.between(clock.instant(), nextRun));
        }

        @Override
        public int compareTo(Delayed other) {
            return Long.compare(getDelay(TimeUnit.NANOSECONDS), other.getDelay(TimeUnit.NANOSECONDS));
        }

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            if (completed) {
                return false;
            }
            cancelled = true;
            return true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }

        @Override
        public boolean isDone() {
            return cancelled || completed;
        }

        @Override
        public Object get() {
            return null;
        }

        @Override
        public Object get(long timeout, TimeUnit unit) {
            return null;
        }
    }
}
