package org.dxworks.codedigest.pipeline;

import org.dxworks.codedigest.analyzer.cobol.preprocessor.SourceDecodingException;
import org.dxworks.codedigest.model.SourceUnit;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Digests many units on a fixed pool of worker threads.
 * <p>
 * Results come back in input order whatever order the units finish in. A failing unit yields a
 * {@link UnitStatus#FAILED} result and never stops the others. After {@link #cancel()} units not
 * yet started report {@link UnitStatus#CANCELLED}; units already running finish normally.
 */
public class BatchDigester {

    private final CodeDigester digester;
    private final int threads;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public BatchDigester(CodeDigester digester, int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be >= 1, was " + threads);
        }
        this.digester = Objects.requireNonNull(digester, "digester");
        this.threads = threads;
    }

    public List<UnitResult> digestAll(List<SourceUnit> units) {
        return digestAll(units, result -> {
        });
    }

    /**
     * Runs one batch. A {@link #cancel()} from an earlier batch does not carry over.
     *
     * @param listener called from the worker thread as soon as each unit is done, in completion order
     */
    public List<UnitResult> digestAll(List<SourceUnit> units, Consumer<UnitResult> listener) {
        cancelled.set(false);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<UnitResult>> futures = new ArrayList<>(units.size());
            List<String> names = new ArrayList<>(units.size());
            for (SourceUnit unit : units) {
                names.add(unit.getName());
                futures.add(executor.submit(() -> {
                    UnitResult result = digestOne(unit);
                    listener.accept(result);
                    return result;
                }));
            }
            return collect(futures, names);
        } finally {
            executor.shutdown();
        }
    }

    /**
     * Waits for every future in order. Once the calling thread is interrupted the batch is cancelled:
     * results already finished are still collected, the rest are reported cancelled.
     */
    List<UnitResult> collect(List<Future<UnitResult>> futures, List<String> names) {
        List<UnitResult> results = new ArrayList<>(futures.size());
        boolean interrupted = false;
        for (int i = 0; i < futures.size(); i++) {
            Future<UnitResult> future = futures.get(i);
            String name = names.get(i);
            if (interrupted && !future.isDone()) {
                results.add(UnitResult.cancelled(name));
                continue;
            }
            try {
                results.add(future.get());
            } catch (ExecutionException e) {
                // only a throwing listener gets here
                results.add(UnitResult.failed(name, e.getCause()));
            } catch (CancellationException e) {
                results.add(UnitResult.cancelled(name));
            } catch (InterruptedException e) {
                interrupted = true;
                cancel();
                results.add(UnitResult.cancelled(name));
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        return results;
    }

    /** Stops units that have not started yet. Units already running complete. */
    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    UnitResult digestOne(SourceUnit unit) {
        if (cancelled.get()) {
            return UnitResult.cancelled(unit.getName());
        }
        try {
            return UnitResult.of(digester.digest(unit));
        } catch (SourceDecodingException e) {
            return UnitResult.failed(unit.getName(), e);
        } catch (RuntimeException e) {
            return UnitResult.failed(unit.getName(), e);
        }
    }
}
