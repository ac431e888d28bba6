package com.gentoro.codex.ingestion;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs pipelines for many items concurrently. Stages of one item stay sequential; the registry is
 * the only state shared between runs.
 *
 * <p>Cancelling a returned future interrupts its worker, and the pipeline stops before its next
 * stage.
 */
public class IngestionService implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.codex.logging.LoggingService.getLogger(IngestionService.class);

  private final IngestionPipeline pipeline;
  private final ExecutorService workers;

  public IngestionService(IngestionPipeline pipeline, int workerCount) {
    this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
    if (workerCount <= 0) {
      throw new IllegalArgumentException("workerCount must be positive");
    }
    AtomicInteger seq = new AtomicInteger();
    this.workers =
        Executors.newFixedThreadPool(
            workerCount,
            r -> {
              Thread t = new Thread(r, "codex-ingest-" + seq.incrementAndGet());
              t.setDaemon(true);
              return t;
            });
  }

  public CompletableFuture<IngestionResult> submit(RawItem item) {
    AtomicReference<Future<?>> running = new AtomicReference<>();
    CompletableFuture<IngestionResult> promise =
        new CompletableFuture<>() {
          @Override
          public boolean cancel(boolean mayInterruptIfRunning) {
            boolean cancelled = super.cancel(mayInterruptIfRunning);
            Future<?> task = running.get();
            if (task != null) {
              task.cancel(true);
            }
            return cancelled;
          }
        };
    running.set(
        workers.submit(
            () -> {
              try {
                promise.complete(pipeline.ingest(item));
              } catch (Throwable t) {
                log.debug(
                    "Ingestion of '{}' ended with {}",
                    item == null ? null : item.id(),
                    t.toString());
                promise.completeExceptionally(t);
              }
            }));
    if (promise.isCancelled()) {
      running.get().cancel(true);
    }
    return promise;
  }

  public List<CompletableFuture<IngestionResult>> submitAll(List<RawItem> items) {
    return items.stream().map(this::submit).toList();
  }

  @Override
  public void close() {
    workers.shutdown();
    try {
      if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
        log.warn("Ingestion workers did not finish in time; interrupting");
        workers.shutdownNow();
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    } finally {
      pipeline.close();
    }
  }
}
