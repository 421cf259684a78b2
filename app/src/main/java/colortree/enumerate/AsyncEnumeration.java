package colortree.enumerate;

import colortree.core.model.Graph;
import colortree.tree.SearchTree;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an {@link EnumerationDriver} on its own thread and delivers the outcome through a
 * {@link CompletableFuture}.
 *
 * <p>{@link #cancel()} stops the run before the next solver launch and interrupts an in-flight
 * invocation, which terminates the external process.
 */
public final class AsyncEnumeration implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(AsyncEnumeration.class);

  private final ExecutorService executor;
  private final CancellationToken cancellation = CancellationToken.create();
  private final CompletableFuture<EnumerationResult> result = new CompletableFuture<>();
  private final EnumerationDriver driver;
  private Thread worker;

  private AsyncEnumeration(EnumerationDriver driver) {
    this.driver = driver;
    this.executor =
        Executors.newSingleThreadExecutor(
            runnable -> {
              Thread thread = new Thread(runnable, "colortree-enumeration");
              thread.setDaemon(true);
              return thread;
            });
  }

  public static AsyncEnumeration start(
      EnumerationDriver driver,
      Graph graph,
      int labelCount,
      SearchTree tree,
      EnumerationListener listener) {
    Objects.requireNonNull(driver, "driver");
    AsyncEnumeration run = new AsyncEnumeration(driver);
    run.executor.execute(
        () -> {
          run.attach(Thread.currentThread());
          try {
            run.result.complete(
                driver.enumerate(graph, labelCount, tree, run.cancellation, listener));
          } catch (RuntimeException ex) {
            LOG.error("Enumeration failed: {}", ex.getMessage(), ex);
            run.result.completeExceptionally(ex);
          } finally {
            run.attach(null);
          }
        });
    return run;
  }

  public CompletableFuture<EnumerationResult> result() {
    return result;
  }

  /** Latest completed-iteration state, safe to read while the run is in progress. */
  public EnumerationState progress() {
    return driver.snapshot();
  }

  public synchronized void cancel() {
    cancellation.cancel();
    if (worker != null) {
      worker.interrupt();
    }
  }

  private synchronized void attach(Thread thread) {
    worker = thread;
  }

  @Override
  public void close() {
    cancel();
    executor.shutdownNow();
  }
}
