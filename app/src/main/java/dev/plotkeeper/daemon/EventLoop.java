package dev.plotkeeper.daemon;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.jspecify.annotations.NullMarked;

/**
 * The single control thread. Every broker and supervisor state change, and every channel
 * callback, runs here in submission order, so that state needs no locking.
 */
@NullMarked
public final class EventLoop implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(EventLoop.class);

    private final String name;
    private final ScheduledExecutorService executor;
    private volatile @Nullable Thread thread;

    public EventLoop(String name) {
        this.name = name;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            thread = t;
            return t;
        });
    }

    public boolean inLoop() {
        return Thread.currentThread() == thread;
    }

    /** Queues {@code task} behind everything already submitted. Tasks submitted after {@link #close()} are dropped. */
    public void execute(Runnable task) {
        try {
            executor.execute(guard(task));
        } catch (RejectedExecutionException e) {
            logger.debug("{} is closed; dropping task", name);
        }
    }

    /** Runs {@code task} inline when already on the loop, otherwise queues it. */
    public void run(Runnable task) {
        if (inLoop()) {
            guard(task).run();
        } else {
            execute(task);
        }
    }

    /** Schedules {@code task} after {@code delay}; returns null when the loop is already closed. */
    public @Nullable ScheduledFuture<?> schedule(Runnable task, Duration delay) {
        try {
            return executor.schedule(guard(task), delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            logger.debug("{} is closed; not scheduling task", name);
            return null;
        }
    }

    public boolean isClosed() {
        return executor.isShutdown();
    }

    private Runnable guard(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                logger.error("Unhandled exception on {}", name, e);
            }
        };
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
