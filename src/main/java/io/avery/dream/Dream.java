package io.avery.dream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A handle to one unit of work running concurrently on its own thread.
 *
 * <p>Work is started in one of four shapes:
 * <ul>
 *     <li>{@link #spawn spawn} - linked, no result
 *     <li>{@link #spawnUnlinked spawnUnlinked} - isolated, no result
 *     <li>{@link #async async} - linked, result retrieved through the returned handle
 *     <li>{@link #asyncUnlinked asyncUnlinked} - isolated, result retrieved through the returned handle
 * </ul>
 *
 * <p>A <em>linked</em> task that crashes (throws from its body) delivers the crash to the thread that spawned it. That
 * thread is interrupted, and throws a {@link LinkedException} at its next suspension point: a read from a
 * {@link Stream Stream}, or an await on a {@code Dream}. An <em>unlinked</em> task's crash never reaches the spawning
 * thread; it is only observable through the handle, or in the log.
 *
 * <p>A handle is resolved at most once, to either a value or a crash reason. The owner retrieves it with one of four
 * awaits: the {@code try} forms return a {@link Result Result} holding the value or an {@link AwaitError AwaitError},
 * while {@link #await()} and {@link #await(Duration)} return the value and throw {@link AwaitException} otherwise.
 * Awaiting again after resolution returns the same outcome. A linked crash is delivered to the spawner only once, so
 * for a linked handle the first await that notices the crash throws {@code LinkedException}, and later awaits report
 * {@link AwaitError.Exit Exit}.
 *
 * <p>Timeouts only bound the waiting. A timed-out await leaves the task running; there is no cancellation.
 *
 * @param <T> the result type
 */
public final class Dream<T> {
    private static final Logger log = LoggerFactory.getLogger(Dream.class);
    
    private static final AtomicLong COUNTER = new AtomicLong();
    private static final ThreadFactory THREADS = runnable -> {
        Thread thread = new Thread(runnable, "dream-" + COUNTER.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    };
    
    /**
     * A unit of work with no result, which may throw.
     */
    @FunctionalInterface
    public interface Task {
        void run() throws Exception;
    }
    
    private final FutureTask<T> task;
    private final boolean linked;
    
    private Dream(Callable<? extends T> body, Link parent) {
        this.linked = parent != null;
        this.task = new FutureTask<T>(body::call) {
            @Override
            protected void setException(Throwable t) {
                // Deliver before completing, so an await that sees the crash also sees the link delivery.
                if (parent != null) {
                    parent.deliver(t);
                } else {
                    log.warn("Unlinked dream {} crashed", Thread.currentThread().getName(), t);
                }
                super.setException(t);
            }
        };
    }
    
    private static Callable<Void> callable(Task body) {
        Objects.requireNonNull(body);
        return () -> {
            body.run();
            return null;
        };
    }
    
    private static <T> Dream<T> start(Callable<? extends T> body, boolean linked) {
        Objects.requireNonNull(body);
        Dream<T> dream = new Dream<>(body, linked ? Link.current() : null);
        Thread thread = THREADS.newThread(dream.task);
        log.debug("Starting {} dream {} from {}", linked ? "linked" : "unlinked", thread.getName(),
                  Thread.currentThread().getName());
        thread.start();
        return dream;
    }
    
    /**
     * Runs the given work on a new thread, linked to the current thread. If the work throws, the current thread
     * receives a {@link LinkedException} at its next suspension point.
     *
     * @param body the work to run
     * @throws NullPointerException if body is null
     */
    public static void spawn(Task body) {
        start(callable(body), true);
    }
    
    /**
     * Runs the given work on a new thread, isolated from the current thread. If the work throws, the crash is logged
     * and otherwise ignored.
     *
     * @param body the work to run
     * @throws NullPointerException if body is null
     */
    public static void spawnUnlinked(Task body) {
        start(callable(body), false);
    }
    
    /**
     * Runs the given work on a new thread, linked to the current thread, and returns a handle to its result.
     *
     * @param body the work to run
     * @return a handle to the result
     * @param <T> the result type
     * @throws NullPointerException if body is null
     */
    public static <T> Dream<T> async(Callable<? extends T> body) {
        return start(body, true);
    }
    
    /**
     * Runs the given work on a new thread, isolated from the current thread, and returns a handle to its result. A
     * crash is reported only through the handle, as {@link AwaitError.Exit Exit}.
     *
     * @param body the work to run
     * @return a handle to the result
     * @param <T> the result type
     * @throws NullPointerException if body is null
     */
    public static <T> Dream<T> asyncUnlinked(Callable<? extends T> body) {
        return start(body, false);
    }
    
    /**
     * Returns {@code true} if the task was spawned linked to its spawner.
     *
     * @return {@code true} if linked
     */
    public boolean isLinked() {
        return linked;
    }
    
    /**
     * Returns {@code true} if the task has completed, normally or abruptly.
     *
     * @return {@code true} if completed
     */
    public boolean isDone() {
        return task.isDone();
    }
    
    /**
     * Waits as long as necessary for the task to complete, and returns its value or an {@link AwaitError.Exit Exit}.
     *
     * @return the value, or the exit reason
     * @throws InterruptedException if interrupted while waiting
     * @throws LinkedException if a linked task spawned by the current thread crashed
     */
    public Result<T, AwaitError> tryAwait() throws InterruptedException {
        Link.check();
        try {
            return Result.ok(task.get());
        } catch (InterruptedException e) {
            throw Link.rethrow(e);
        } catch (ExecutionException e) {
            Link.check();
            return Result.err(new AwaitError.Exit(e.getCause()));
        }
    }
    
    /**
     * Waits up to the given timeout for the task to complete, and returns its value, a
     * {@link AwaitError.Timeout Timeout}, or an {@link AwaitError.Exit Exit}. A timeout does not affect the task.
     *
     * @param timeout the maximum time to wait
     * @return the value, or why there is none
     * @throws InterruptedException if interrupted while waiting
     * @throws LinkedException if a linked task spawned by the current thread crashed
     * @throws NullPointerException if timeout is null
     */
    public Result<T, AwaitError> tryAwait(Duration timeout) throws InterruptedException {
        long nanos = Mailbox.toNanos(timeout);
        Link.check();
        try {
            return Result.ok(task.get(nanos, TimeUnit.NANOSECONDS));
        } catch (InterruptedException e) {
            throw Link.rethrow(e);
        } catch (ExecutionException e) {
            Link.check();
            return Result.err(new AwaitError.Exit(e.getCause()));
        } catch (TimeoutException e) {
            return Result.err(new AwaitError.Timeout(timeout));
        }
    }
    
    /**
     * Waits as long as necessary for the task to complete, and returns its value.
     *
     * @return the value
     * @throws AwaitException if the task exited abruptly
     * @throws InterruptedException if interrupted while waiting
     * @throws LinkedException if a linked task spawned by the current thread crashed
     */
    public T await() throws InterruptedException {
        return tryAwait().unwrap(AwaitException::new);
    }
    
    /**
     * Waits up to the given timeout for the task to complete, and returns its value.
     *
     * @param timeout the maximum time to wait
     * @return the value
     * @throws AwaitException if the timeout elapsed, or the task exited abruptly
     * @throws InterruptedException if interrupted while waiting
     * @throws LinkedException if a linked task spawned by the current thread crashed
     * @throws NullPointerException if timeout is null
     */
    public T await(Duration timeout) throws InterruptedException {
        return tryAwait(timeout).unwrap(AwaitException::new);
    }
}
