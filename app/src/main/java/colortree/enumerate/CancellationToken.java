package colortree.enumerate;

import java.util.concurrent.atomic.AtomicBoolean;

/** Cooperative cancellation flag checked before every solver launch. */
public final class CancellationToken {
  private final AtomicBoolean cancelled = new AtomicBoolean();

  public static CancellationToken create() {
    return new CancellationToken();
  }

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }
}
