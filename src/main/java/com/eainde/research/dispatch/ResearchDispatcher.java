package com.eainde.research.dispatch;

import com.eainde.research.model.FindingsDocument;
import com.eainde.research.model.Gap;
import com.eainde.research.model.ResearchAssignment;
import com.eainde.research.model.Subtopic;
import com.eainde.research.model.SubtopicFindings;
import com.eainde.research.thread.MdcAwareThreadPoolExecutor;
import com.google.common.math.LongMath;
import lombok.extern.log4j.Log4j2;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fans subtopics out to independent research workers and joins on their results.
 *
 * <h3>Fan-out:</h3>
 * <pre>
 * pool size = min(subtopics, maxPoolSize)       ← full parallel fan-out up to the cap
 * per subtopic: assignment = subtopic + titles of every other subtopic
 *               submit worker.research(assignment)
 * join:         wait for each future until its deadline
 *               deadline = start + budget × (wave + 1), wave = index / poolSize
 *               (saturates instead of overflowing for very large budgets)
 * </pre>
 *
 * <h3>Failure conversion (never fatal):</h3>
 * <ul>
 *   <li>deadline passed → worker cancelled, {@code WORKER_TIMEOUT} gap</li>
 *   <li>{@link WorkerFetchException} or any unexpected exception → {@code WORKER_FETCH_FAILURE} gap</li>
 *   <li>{@link WorkerMalformedOutputException}, null document, missing
 *       {@code subtopic}/{@code claims} → {@code WORKER_MALFORMED_OUTPUT} gap</li>
 * </ul>
 *
 * <p>Results come back in subtopic order regardless of completion order. Failed subtopics
 * carry an empty document plus the gap. No retries.</p>
 */
@Log4j2
public class ResearchDispatcher {

    private final ResearchWorker worker;
    private final int maxPoolSize;

    public ResearchDispatcher(ResearchWorker worker, int maxPoolSize) {
        if (maxPoolSize < 1) throw new IllegalArgumentException("maxPoolSize must be >= 1");
        this.worker = worker;
        this.maxPoolSize = maxPoolSize;
    }

    public List<SubtopicFindings> dispatch(List<Subtopic> subtopics, Duration workerBudget) {
        if (subtopics.isEmpty()) {
            return List.of();
        }
        int poolSize = Math.min(subtopics.size(), maxPoolSize);
        log.info("Dispatching {} workers (pool {}, budget {}s each)",
                subtopics.size(), poolSize, workerBudget.toSeconds());

        ExecutorService pool = new MdcAwareThreadPoolExecutor(poolSize, "research-worker");
        try {
            List<Future<FindingsDocument>> futures = new ArrayList<>(subtopics.size());
            for (Subtopic subtopic : subtopics) {
                ResearchAssignment assignment = ResearchAssignment.forSubtopic(subtopic, subtopics);
                futures.add(pool.submit(() -> worker.research(assignment)));
            }

            long budgetNanos = saturatedNanos(workerBudget);
            long start = System.nanoTime();
            List<SubtopicFindings> results = new ArrayList<>(subtopics.size());
            boolean interrupted = false;

            for (int i = 0; i < subtopics.size(); i++) {
                Subtopic subtopic = subtopics.get(i);
                Future<FindingsDocument> future = futures.get(i);

                if (interrupted) {
                    future.cancel(true);
                    results.add(SubtopicFindings.failed(subtopic,
                            Gap.fetchFailure(subtopic, "dispatch was interrupted")));
                    continue;
                }

                long wave = i / poolSize;
                long allowed = LongMath.saturatedMultiply(budgetNanos, wave + 1);
                try {
                    long remaining = Math.max(0L, allowed - (System.nanoTime() - start));
                    FindingsDocument document = future.get(remaining, TimeUnit.NANOSECONDS);
                    results.add(accept(subtopic, document));
                } catch (TimeoutException e) {
                    future.cancel(true);
                    log.warn("Worker for subtopic {} ({}) exceeded its {}s budget, cancelled",
                            subtopic.id(), subtopic.title(), workerBudget.toSeconds());
                    results.add(SubtopicFindings.failed(subtopic, Gap.timeout(subtopic, workerBudget)));
                } catch (ExecutionException e) {
                    results.add(SubtopicFindings.failed(subtopic, classify(subtopic, e.getCause())));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    interrupted = true;
                    future.cancel(true);
                    log.warn("Dispatch interrupted while waiting for subtopic {}", subtopic.id());
                    results.add(SubtopicFindings.failed(subtopic,
                            Gap.fetchFailure(subtopic, "dispatch was interrupted")));
                }
            }

            long failed = results.stream().filter(SubtopicFindings::isFailed).count();
            log.info("Dispatch complete: {} succeeded, {} failed", results.size() - failed, failed);
            return List.copyOf(results);
        } finally {
            pool.shutdownNow();
        }
    }

    private static long saturatedNanos(Duration budget) {
        try {
            return budget.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    private SubtopicFindings accept(Subtopic subtopic, FindingsDocument document) {
        if (document == null) {
            log.warn("Worker for subtopic {} returned no document", subtopic.id());
            return SubtopicFindings.failed(subtopic, Gap.malformedOutput(subtopic, "no document returned"));
        }
        if (!document.isStructurallyValid()) {
            log.warn("Worker for subtopic {} returned a document without subtopic/claims", subtopic.id());
            return SubtopicFindings.failed(subtopic,
                    Gap.malformedOutput(subtopic, "document is missing 'subtopic' or 'claims'"));
        }
        return SubtopicFindings.completed(subtopic, document);
    }

    private Gap classify(Subtopic subtopic, Throwable cause) {
        if (cause instanceof WorkerMalformedOutputException malformed) {
            log.warn("Worker for subtopic {} returned malformed output: {}", subtopic.id(), malformed.getMessage());
            return Gap.malformedOutput(subtopic, malformed.getMessage());
        }
        if (cause instanceof WorkerFetchException fetch) {
            log.warn("Worker for subtopic {} failed to fetch: {}", subtopic.id(), fetch.getMessage());
            return Gap.fetchFailure(subtopic, fetch.getMessage());
        }
        log.error("Worker for subtopic {} failed unexpectedly", subtopic.id(), cause);
        String reason = cause == null ? "unknown error"
                : cause.getClass().getSimpleName()
                        + (cause.getMessage() != null ? ": " + cause.getMessage() : "");
        return Gap.fetchFailure(subtopic, reason);
    }
}
