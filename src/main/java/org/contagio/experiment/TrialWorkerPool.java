package org.contagio.experiment;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.LockSupport;

/**
 * A persistent thread pool for repeated bulk dispatches of independent trials.
 * <p>
 * Keeps {@code P-1} daemon threads alive between dispatches, parked while idle. The
 * dispatching thread participates as worker 0, so the total parallelism is P threads. Trials
 * vary widely in length, so work is not split into fixed chunks: every thread claims the next
 * unprocessed index from a shared counter until the range is exhausted.
 * <p>
 * <b>Synchronization protocol:</b>
 * <ol>
 *   <li>The dispatching thread sets the work parameters and increments the volatile {@code phase}</li>
 *   <li>It unparks all workers and starts claiming indices itself</li>
 *   <li>Workers wake, read the new phase, claim indices until none remain and count themselves done</li>
 *   <li>The dispatching thread parks until the last worker has finished and unparks it</li>
 * </ol>
 * <p>
 * <b>Thread safety:</b> {@link #dispatch(int, IndexTask)} must only be called from one thread
 * at a time. {@link #close()} is idempotent.
 */
public class TrialWorkerPool implements AutoCloseable {

    /**
     * A task that processes one work item.
     */
    @FunctionalInterface
    public interface IndexTask {
        /**
         * @param index the work item index
         */
        void run(int index);
    }

    private final Thread[] workers;
    private final int totalThreads;

    private volatile int phase;
    private volatile int workSize;
    private volatile IndexTask task;
    private volatile boolean stopped;
    private volatile Thread dispatcher;
    private final AtomicInteger nextIndex = new AtomicInteger();
    private final AtomicInteger workersCompleted = new AtomicInteger();
    private final AtomicReference<Throwable> workerException = new AtomicReference<>();
    private final AtomicInteger readyWorkers = new AtomicInteger();

    /**
     * Creates a pool and waits until every worker has read its initial phase, so the first
     * dispatch can never be mistaken for a spurious wakeup.
     *
     * @param parallelism total number of threads, including the dispatching thread. Must be &gt;= 2.
     * @throws IllegalArgumentException if parallelism &lt; 2
     */
    public TrialWorkerPool(int parallelism) {
        if (parallelism < 2) {
            throw new IllegalArgumentException("Parallelism must be >= 2, got " + parallelism);
        }
        this.totalThreads = parallelism;
        this.workers = new Thread[parallelism - 1];

        for (int i = 0; i < workers.length; i++) {
            int workerIndex = i + 1;
            workers[i] = new Thread(this::workerLoop, "trial-worker-" + workerIndex);
            workers[i].setDaemon(true);
            workers[i].start();
        }

        while (readyWorkers.get() < workers.length) {
            Thread.onSpinWait();
        }
    }

    public int getParallelism() {
        return totalThreads;
    }

    /**
     * Runs {@code task} for every index in [0, {@code totalSize}) and blocks until all are done.
     * <p>
     * If any thread throws, the first exception is rethrown after every thread has stopped
     * claiming work; later exceptions are suppressed.
     * <p>
     * An interrupt of the dispatching thread does not cut the dispatch short; the flag is
     * restored when every worker has finished.
     *
     * @param totalSize the number of work items (must be &gt;= 0)
     * @param task the task to execute per item
     * @throws RuntimeException wrapping any exception thrown by a worker thread
     */
    public void dispatch(int totalSize, IndexTask task) {
        if (totalSize <= 0) return;
        if (stopped) {
            throw new IllegalStateException("TrialWorkerPool has been closed");
        }

        this.workSize = totalSize;
        this.task = task;
        this.dispatcher = Thread.currentThread();
        nextIndex.set(0);
        workerException.set(null);
        workersCompleted.set(0);

        // Volatile write publishes the work parameters to the workers
        phase++;

        for (Thread worker : workers) {
            LockSupport.unpark(worker);
        }

        Throwable mainException = null;
        try {
            claimAndRun(task, totalSize);
        } catch (Throwable t) {
            mainException = t;
            // Stop the others from claiming further items
            nextIndex.set(totalSize);
        }

        // park returns at once while interrupted; hold the flag back until the workers are done
        boolean interrupted = false;
        while (workersCompleted.get() < workers.length) {
            LockSupport.park(this);
            interrupted |= Thread.interrupted();
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }

        Throwable workerEx = workerException.get();
        if (workerEx != null) {
            if (mainException != null) {
                workerEx.addSuppressed(mainException);
            }
            if (workerEx instanceof RuntimeException re) {
                throw re;
            }
            throw new RuntimeException("Worker thread failed", workerEx);
        }
        if (mainException != null) {
            if (mainException instanceof RuntimeException re) {
                throw re;
            }
            throw new RuntimeException("Dispatching thread failed", mainException);
        }
    }

    /**
     * Stops and joins all worker threads (5 seconds per thread at most).
     */
    @Override
    public void close() {
        stopped = true;
        for (Thread worker : workers) {
            LockSupport.unpark(worker);
        }
        for (Thread worker : workers) {
            try {
                worker.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void claimAndRun(IndexTask task, int totalSize) {
        int index;
        while ((index = nextIndex.getAndIncrement()) < totalSize) {
            task.run(index);
        }
    }

    private void workerLoop() {
        int lastPhase = phase;
        readyWorkers.incrementAndGet();

        while (!stopped) {
            LockSupport.park();

            if (stopped) break;

            int currentPhase = phase;
            if (currentPhase == lastPhase) {
                // Spurious wakeup
                continue;
            }
            lastPhase = currentPhase;

            try {
                claimAndRun(task, workSize);
            } catch (Throwable t) {
                workerException.compareAndSet(null, t);
                nextIndex.set(workSize);
            }

            if (workersCompleted.incrementAndGet() == workers.length) {
                LockSupport.unpark(dispatcher);
            }
        }
    }
}
