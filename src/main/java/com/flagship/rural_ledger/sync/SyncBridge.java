package com.flagship.rural_ledger.sync;

import com.flagship.rural_ledger.observability.SyncMetrics;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs all remote work on one background worker thread that owns the single
 * remote session.
 *
 * Any number of threads may call {@link #submit}; each blocks only until its
 * own operation has run. Operations run one at a time in submission order.
 * A failing operation completes its own future exceptionally and leaves the
 * worker running.
 *
 * Cancellation is not supported: a caller that stops waiting leaves the
 * operation to finish in the background.
 */
@Slf4j
public class SyncBridge {

    private final RemoteSessionFactory sessionFactory;
    private final SyncMetrics metrics;
    private final Duration shutdownTimeout;
    private final ScheduledExecutorService worker;
    private final AtomicReference<CompletableFuture<RemoteSession>> session = new AtomicReference<>();
    private final List<ChangeSubscription> subscriptions = new CopyOnWriteArrayList<>();
    private final AtomicBoolean shutdown = new AtomicBoolean(false);
    private volatile Thread workerThread;

    public SyncBridge(RemoteSessionFactory sessionFactory, SyncMetrics metrics, Duration shutdownTimeout) {
        this.sessionFactory = sessionFactory;
        this.metrics = metrics;
        this.shutdownTimeout = shutdownTimeout;
        this.worker = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "sync-bridge-worker");
            thread.setDaemon(true);
            workerThread = thread;
            return thread;
        });
    }

    /**
     * Establishes the remote session on first call; later calls return the
     * same session. A failed initialization is not cached, so the next call
     * tries again.
     *
     * @throws RemoteOperationException if the session cannot be created
     */
    public RemoteSession init() {
        CompletableFuture<RemoteSession> current = session.get();
        while (current == null) {
            CompletableFuture<RemoteSession> created = new CompletableFuture<>();
            if (session.compareAndSet(null, created)) {
                if (!isWorkerThread()) {
                    try {
                        execute(() -> createSession(created));
                    } catch (RemoteOperationException e) {
                        session.compareAndSet(created, null);
                        created.completeExceptionally(e);
                        throw e;
                    }
                }
                current = created;
            } else {
                current = session.get();
            }
        }
        if (isWorkerThread() && !current.isDone()) {
            // the queued creation would only run after the current task
            createSession(current);
        }
        return await(current, "init");
    }

    public <T> T submit(RemoteOperation<T> operation) {
        return submit("anonymous", operation);
    }

    /**
     * Runs {@code operation} on the worker and waits for its result.
     *
     * @param name label used in logs and metrics
     * @throws RemoteOperationException wrapping whatever the operation threw
     */
    public <T> T submit(String name, RemoteOperation<T> operation) {
        RemoteSession remote = init();
        if (isWorkerThread()) {
            return runInline(name, operation, remote);
        }
        long start = System.nanoTime();
        CompletableFuture<T> result = new CompletableFuture<>();
        execute(() -> {
            try {
                result.complete(operation.apply(remote));
            } catch (Throwable e) {
                result.completeExceptionally(e);
            }
        });
        try {
            T value = await(result, name);
            metrics.recordOperation(name, true, Duration.ofNanos(System.nanoTime() - start));
            return value;
        } catch (RemoteOperationException e) {
            metrics.recordOperation(name, false, Duration.ofNanos(System.nanoTime() - start));
            log.error("Remote operation {} failed: {}", name, e.getMessage());
            throw e;
        }
    }

    /**
     * Runs {@code task} on the worker at a fixed rate until cancelled or the
     * bridge shuts down.
     */
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, Duration period) {
        try {
            return worker.scheduleAtFixedRate(task, period.toMillis(), period.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            throw new RemoteOperationException("Sync bridge is shut down", e);
        }
    }

    /**
     * Registers a subscription to be unsubscribed by {@link #shutdown()}.
     */
    public void track(ChangeSubscription subscription) {
        subscriptions.add(subscription);
        metrics.subscriptionOpened();
    }

    public boolean isInitialized() {
        CompletableFuture<RemoteSession> current = session.get();
        return current != null && current.isDone() && !current.isCompletedExceptionally();
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    public int activeSubscriptions() {
        return subscriptions.size();
    }

    /**
     * Unsubscribes every tracked subscription within the shutdown budget,
     * closes the session and stops the worker. Never throws.
     */
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        List<ChangeSubscription> active = List.copyOf(subscriptions);
        subscriptions.clear();
        metrics.subscriptionsClosed(active.size());

        try {
            CompletableFuture<Void> unsubscribed = CompletableFuture.runAsync(() -> {
                active.forEach(this::unsubscribeQuietly);
                closeSessionQuietly();
            }, worker);
            unsubscribed.get(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("Sync bridge released {} subscriptions", active.size());
        } catch (TimeoutException e) {
            log.warn("Sync bridge shutdown did not finish within {} ms", shutdownTimeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while shutting down sync bridge");
        } catch (ExecutionException | RuntimeException e) {
            log.warn("Error while shutting down sync bridge: {}", e.getMessage());
        }

        worker.shutdown();
        try {
            if (!worker.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            worker.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Sync bridge stopped");
    }

    private void createSession(CompletableFuture<RemoteSession> created) {
        if (created.isDone()) {
            return;
        }
        try {
            RemoteSession remote = sessionFactory.create();
            created.complete(remote);
            metrics.recordSessionInitialized();
            log.info("Remote session initialized");
        } catch (Throwable e) {
            session.compareAndSet(created, null);
            created.completeExceptionally(e);
            log.error("Remote session initialization failed: {}", e.getMessage());
        }
    }

    private <T> T runInline(String name, RemoteOperation<T> operation, RemoteSession remote) {
        try {
            return operation.apply(remote);
        } catch (RemoteOperationException e) {
            throw e;
        } catch (Exception e) {
            throw new RemoteOperationException("Remote operation " + name + " failed: " + e.getMessage(), e);
        }
    }

    private void execute(Runnable task) {
        try {
            worker.execute(task);
        } catch (RejectedExecutionException e) {
            throw new RemoteOperationException("Sync bridge is shut down", e);
        }
    }

    private <T> T await(CompletableFuture<T> future, String name) {
        try {
            return future.get();
        } catch (ExecutionException | CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RemoteOperationException remote) {
                throw remote;
            }
            throw new RemoteOperationException("Remote operation " + name + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteOperationException("Interrupted while waiting for remote operation " + name, e);
        }
    }

    private boolean isWorkerThread() {
        return Thread.currentThread() == workerThread;
    }

    private void unsubscribeQuietly(ChangeSubscription subscription) {
        try {
            subscription.unsubscribe();
            log.debug("Unsubscribed from {}", subscription.topic());
        } catch (Exception e) {
            log.warn("Ignoring failure to unsubscribe from {}: {}", subscription.topic(), e.getMessage());
        }
    }

    private void closeSessionQuietly() {
        CompletableFuture<RemoteSession> current = session.get();
        if (current == null || !current.isDone() || current.isCompletedExceptionally()) {
            return;
        }
        try {
            current.join().close();
        } catch (Exception e) {
            log.warn("Ignoring failure to close remote session: {}", e.getMessage());
        }
    }
}
