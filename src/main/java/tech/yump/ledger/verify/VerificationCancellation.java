package tech.yump.ledger.verify;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop token for long verification scans. The scan checks it before each block
 * and returns the partial result verified so far.
 */
public class VerificationCancellation {

  private final AtomicBoolean cancelled = new AtomicBoolean(false);

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }
}
