package com.sailfish.taskfactory.service.impl;

import com.sailfish.taskfactory.TaskArguments;
import com.sailfish.taskfactory.service.ExecutionContext;
import com.sailfish.taskfactory.service.TaskSubmission;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * In-process {@link ExecutionContext} running submissions on a thread pool.
 * <p>
 * Submissions with caching enabled are memoized on (content identity, arguments): an equal
 * submission gets the future of the first one instead of running again. Failed results are
 * evicted so that a later submission can recompute them. Successful entries stay until they are
 * {@linkplain #evict(String) evicted} or the context shuts down; the table is not bounded.
 * <p>
 * Walltime is measured from the moment a pool thread starts running the work, not from
 * submission. On overrun the returned future fails with {@link TimeoutException} and the work is
 * cancelled, interrupting its thread.
 */
public class LocalExecutionContext implements ExecutionContext, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LocalExecutionContext.class);

    public static final int DEFAULT_POOL_SIZE = 4;
    public static final long DEFAULT_SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final ExecutorService taskExecutor;
    private final ScheduledThreadPoolExecutor walltimeTimer;
    private final Map<MemoKey, CompletableFuture<Object>> memoTable = new ConcurrentHashMap<>();

    public LocalExecutionContext() {
        this(Executors.newFixedThreadPool(DEFAULT_POOL_SIZE));
    }

    public LocalExecutionContext(ExecutorService taskExecutor) {
        this.taskExecutor = Objects.requireNonNull(taskExecutor, "taskExecutor cannot be null");
        this.walltimeTimer = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, "task-walltime-timer");
            thread.setDaemon(true);
            return thread;
        });
        this.walltimeTimer.setRemoveOnCancelPolicy(true);
        log.info("LocalExecutionContext initialized.");
    }

    @Override
    public CompletableFuture<Object> submit(TaskSubmission submission) {
        Objects.requireNonNull(submission, "submission cannot be null");
        if (!submission.isCache()) {
            return launch(submission);
        }

        MemoKey key = new MemoKey(submission.getContentIdentity(), submission.getArguments());
        CompletableFuture<Object> existing = memoTable.get(key);
        if (existing != null) {
            log.debug("Task {} with identity {} found in memo table, reusing its result.",
                    submission.getTaskName(), submission.getContentIdentity());
            return existing;
        }
        CompletableFuture<Object> created = new CompletableFuture<>();
        existing = memoTable.putIfAbsent(key, created);
        if (existing != null) {
            return existing;
        }
        try {
            launch(submission).whenComplete((result, error) -> {
                if (error != null) {
                    memoTable.remove(key, created);
                    created.completeExceptionally(error);
                } else {
                    created.complete(result);
                }
            });
        } catch (RejectedExecutionException e) {
            memoTable.remove(key, created);
            throw e;
        }
        return created;
    }

    private CompletableFuture<Object> launch(TaskSubmission submission) {
        log.debug("Submitting task {} to executor pool (executors={}, walltime={}).",
                submission.getTaskName(), submission.getExecutors(), submission.getWalltime());
        TimedTask task = new TimedTask(submission);
        try {
            taskExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            log.error("Executor pool rejected task {}.", submission.getTaskName(), e);
            throw e;
        }
        return task.result;
    }

    /**
     * Drops every memoized result recorded under the given content identity.
     *
     * @return the number of entries removed.
     */
    public int evict(String contentIdentity) {
        int removed = 0;
        for (MemoKey key : memoTable.keySet()) {
            if (key.contentIdentity.equals(contentIdentity) && memoTable.remove(key) != null) {
                removed++;
            }
        }
        log.debug("Evicted {} memoized results for identity {}.", removed, contentIdentity);
        return removed;
    }

    /**
     * Number of results currently memoized.
     */
    public int getMemoizedCount() {
        return memoTable.size();
    }

    @Override
    @PreDestroy
    public void close() {
        shutdown(DEFAULT_SHUTDOWN_TIMEOUT_SECONDS);
    }

    /**
     * Initiates a graceful shutdown of the executor pool, forcing it after the timeout.
     *
     * @param timeoutSeconds Time to wait for running tasks to complete before forceful shutdown.
     */
    public void shutdown(long timeoutSeconds) {
        log.info("Shutting down LocalExecutionContext...");
        taskExecutor.shutdown();
        try {
            if (!taskExecutor.awaitTermination(timeoutSeconds, TimeUnit.SECONDS)) {
                log.warn("Task executor did not terminate in {} seconds.", timeoutSeconds);
                List<Runnable> droppedTasks = taskExecutor.shutdownNow();
                log.warn("Forcefully shutting down task executor. {} tasks were dropped.", droppedTasks.size());
                cancelDropped(droppedTasks);
                if (!taskExecutor.awaitTermination(timeoutSeconds, TimeUnit.SECONDS)) {
                    log.error("Task executor did not terminate even after forceful shutdown.");
                }
            } else {
                log.info("Task executor terminated gracefully.");
            }
        } catch (InterruptedException ie) {
            log.warn("Task executor shutdown interrupted. Forcing shutdown now.");
            cancelDropped(taskExecutor.shutdownNow());
            Thread.currentThread().interrupt();
        } finally {
            walltimeTimer.shutdownNow();
            memoTable.clear();
        }
    }

    private static void cancelDropped(List<Runnable> droppedTasks) {
        for (Runnable dropped : droppedTasks) {
            if (dropped instanceof TimedTask) {
                ((TimedTask) dropped).cancel(false);
            }
        }
    }

    public boolean isShutdown() {
        return taskExecutor.isShutdown();
    }

    /**
     * Runs one submission and completes {@link #result} from it. The walltime timer is armed when
     * the task starts running.
     */
    private final class TimedTask extends FutureTask<Object> {

        private final TaskSubmission submission;
        private final CompletableFuture<Object> result = new CompletableFuture<>();

        private TimedTask(TaskSubmission submission) {
            super(submission.getWork());
            this.submission = submission;
        }

        @Override
        public void run() {
            Duration walltime = submission.getWalltime();
            ScheduledFuture<?> timer;
            try {
                timer = walltimeTimer.schedule(this::expire, walltime.toMillis(), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                cancel(false);
                return;
            }
            try {
                super.run();
            } finally {
                timer.cancel(false);
            }
        }

        private void expire() {
            TimeoutException timeout = new TimeoutException(
                    "Task " + submission.getTaskName() + " exceeded walltime " + submission.getWalltime());
            if (result.completeExceptionally(timeout)) {
                log.warn("Task {} exceeded walltime {}, cancelling it.", submission.getTaskName(), submission.getWalltime());
                cancel(true);
            }
        }

        @Override
        protected void done() {
            if (isCancelled()) {
                result.completeExceptionally(new CancellationException("Task " + submission.getTaskName() + " was cancelled"));
                return;
            }
            try {
                result.complete(get());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                log.warn("Task {} failed: {}", submission.getTaskName(), cause.getMessage());
                result.completeExceptionally(cause);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                result.completeExceptionally(e);
            }
        }
    }

    private static final class MemoKey {

        private final String contentIdentity;
        private final TaskArguments arguments;

        private MemoKey(String contentIdentity, TaskArguments arguments) {
            this.contentIdentity = contentIdentity;
            this.arguments = arguments;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            MemoKey that = (MemoKey) o;
            return contentIdentity.equals(that.contentIdentity) && arguments.equals(that.arguments);
        }

        @Override
        public int hashCode() {
            return Objects.hash(contentIdentity, arguments);
        }
    }
}
