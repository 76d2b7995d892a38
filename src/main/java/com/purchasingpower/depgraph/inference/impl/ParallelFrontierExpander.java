package com.purchasingpower.depgraph.inference.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.depgraph.core.Deadline;
import com.purchasingpower.depgraph.exception.InferenceException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Splits a frontier into at most {@code maxConcurrency} slices and expands them
 * on the inference executor.
 *
 * @since 2.0.0
 */
@Slf4j
public class ParallelFrontierExpander implements FrontierExpander {

    // Below this size the hand-off costs more than it saves.
    private static final int MIN_PARALLEL_FRONTIER = 4;

    private final Executor executor;
    private final int maxConcurrency;
    private final FrontierExpander sequential = new SequentialFrontierExpander();

    public ParallelFrontierExpander(Executor executor, int maxConcurrency) {
        Preconditions.checkArgument(maxConcurrency >= 1, "maxConcurrency must be >= 1");
        this.executor = Preconditions.checkNotNull(executor, "executor");
        this.maxConcurrency = maxConcurrency;
    }

    @Override
    public void expand(List<String> frontier, Consumer<String> expandOne, Deadline deadline) {
        if (maxConcurrency == 1 || frontier.size() < MIN_PARALLEL_FRONTIER) {
            sequential.expand(frontier, expandOne, deadline);
            return;
        }

        int slices = Math.min(maxConcurrency, frontier.size());
        int sliceSize = (frontier.size() + slices - 1) / slices;
        List<CompletableFuture<Void>> futures = new ArrayList<>(slices);
        for (int start = 0; start < frontier.size(); start += sliceSize) {
            List<String> slice = frontier.subList(start, Math.min(frontier.size(), start + sliceSize));
            futures.add(CompletableFuture.runAsync(() -> sequential.expand(slice, expandOne, deadline), executor));
        }

        CompletableFuture<Void> all = CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new));
        try {
            all.get(deadline.remaining().toMillis() + 1, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.debug("Frontier of {} nodes did not finish before the deadline", frontier.size());
            futures.forEach(f -> f.cancel(true));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(f -> f.cancel(true));
            throw new InferenceException("Interrupted while expanding frontier", e);
        } catch (ExecutionException | CompletionException e) {
            throw new InferenceException("Frontier expansion failed", e.getCause());
        }
    }
}
