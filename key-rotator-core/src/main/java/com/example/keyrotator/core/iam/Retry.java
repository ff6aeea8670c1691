package com.example.keyrotator.core.iam;

import static java.lang.System.Logger.Level.DEBUG;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounded fixed-delay retry used by {@link AccessKeyVerifier}.
 *
 * <p>Only exceptions of the configured type are retried; any other exception ends the loop
 * immediately. The delay is applied between attempts, never after the last one.
 */
public final class Retry {

  private static final System.Logger LOGGER = System.getLogger(Retry.class.getName());

  private Retry() {}

  /**
   * Supplier that may throw a checked exception.
   *
   * @param <T> result type
   * @param <E> exception type
   */
  @FunctionalInterface
  public interface CheckedSupplier<T, E extends Exception> {
    T get() throws E;
  }

  /**
   * Callback invoked after a retryable failure, before the delay.
   *
   * @param <E> exception type
   */
  @FunctionalInterface
  public interface RetryListener<E extends Exception> {
    /**
     * @param attempt the 1-based attempt that just failed
     * @param remaining attempts still available
     * @param failure the failure of that attempt
     */
    void onRetry(final int attempt, final int remaining, final E failure);
  }

  /** Waits between attempts. Tests substitute a recording implementation. */
  @FunctionalInterface
  public interface Sleeper {
    void sleep(final Duration duration) throws InterruptedException;

    /**
     * Returns a sleeper that blocks the current thread.
     *
     * @return thread-sleeping implementation
     */
    static Sleeper threadSleep() {
      return duration -> Thread.sleep(duration.toMillis());
    }
  }

  /**
   * Fixed-delay retry policy.
   *
   * @param maxAttempts total attempts including the first, must be >= 1
   * @param delay pause between attempts, must not be negative
   */
  public record Policy(int maxAttempts, Duration delay) {

    public Policy {
      if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
      Objects.requireNonNull(delay, "delay");
      if (delay.isNegative()) throw new IllegalArgumentException("delay must be >= 0");
    }

    /**
     * Creates a fixed delay retry policy.
     *
     * @param attempts number of attempts (including first)
     * @param delay delay between attempts
     * @return fixed delay retry policy
     */
    public static Policy fixed(final int attempts, final Duration delay) {
      return new Policy(attempts, delay);
    }
  }

  /**
   * Runs {@code supplier} until it succeeds, throws something other than {@code retryOn}, or the
   * policy's attempts are used up.
   *
   * <p>If the thread is interrupted while waiting, the interrupt flag is restored and the last
   * failure is thrown.
   *
   * @param supplier operation to execute
   * @param retryOn exception type that triggers a retry
   * @param listener notified of each retryable failure that will be retried
   * @param policy attempt bound and delay
   * @param sleeper waits between attempts
   * @param <T> result type
   * @param <E> retryable exception type
   * @return the supplier result
   * @throws E the last failure once attempts are exhausted
   */
  public static <T, E extends Exception> T onException(
      final CheckedSupplier<T, E> supplier,
      final Class<E> retryOn,
      final RetryListener<? super E> listener,
      final Policy policy,
      final Sleeper sleeper)
      throws E {
    var attempt = 0;
    while (true) {
      attempt++;
      try {
        return supplier.get();
      } catch (final RuntimeException e) {
        if (!retryOn.isInstance(e)) throw e;
        handleFailure(retryOn.cast(e), attempt, listener, policy, sleeper);
      } catch (final Exception e) {
        handleFailure(retryOn.cast(e), attempt, listener, policy, sleeper);
      }
    }
  }

  private static <E extends Exception> void handleFailure(
      final E failure,
      final int attempt,
      final RetryListener<? super E> listener,
      final Policy policy,
      final Sleeper sleeper)
      throws E {
    final var remaining = policy.maxAttempts() - attempt;
    if (remaining <= 0) throw failure;

    listener.onRetry(attempt, remaining, failure);
    LOGGER.log(DEBUG, "Attempt {0} failed, retrying in {1}", attempt, policy.delay());

    if (!policy.delay().isZero()) {
      try {
        sleeper.sleep(policy.delay());
      } catch (final InterruptedException ie) {
        Thread.currentThread().interrupt();
        throw failure;
      }
    }
  }
}
