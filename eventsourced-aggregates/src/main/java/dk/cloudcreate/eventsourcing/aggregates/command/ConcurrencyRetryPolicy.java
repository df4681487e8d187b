package dk.cloudcreate.eventsourcing.aggregates.command;

import java.time.Duration;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * Decides how many times, and with which delay, an {@link AggregateCommandHandler} repeats the
 * load-replay-command-append cycle after the append was rejected because of a concurrent modification of the aggregate.
 */
public class ConcurrencyRetryPolicy {
    public final Duration initialRetryDelay;
    public final double   retryDelayMultiplier;
    public final Duration maximumRetryDelay;
    public final int      maximumNumberOfRetries;

    public ConcurrencyRetryPolicy(Duration initialRetryDelay,
                                  double retryDelayMultiplier,
                                  Duration maximumRetryDelay,
                                  int maximumNumberOfRetries) {
        this.initialRetryDelay = requireNonNull(initialRetryDelay, "You must specify an initialRetryDelay");
        this.retryDelayMultiplier = retryDelayMultiplier;
        this.maximumRetryDelay = requireNonNull(maximumRetryDelay, "You must specify a maximumRetryDelay");
        this.maximumNumberOfRetries = maximumNumberOfRetries;
        requireTrue(retryDelayMultiplier >= 1.0d, "retryDelayMultiplier must be 1.0 or larger");
        requireTrue(maximumNumberOfRetries >= 0, "maximumNumberOfRetries must be 0 or larger");
    }

    /**
     * @param numberOfRetriesPerformed the number of retries performed so far (0 before the first retry)
     * @return the delay before the next retry
     */
    public Duration calculateRetryDelay(int numberOfRetriesPerformed) {
        requireTrue(numberOfRetriesPerformed >= 0, "numberOfRetriesPerformed must be 0 or larger");
        var calculatedDelay = Duration.ofMillis((long) (initialRetryDelay.toMillis() * Math.pow(retryDelayMultiplier, numberOfRetriesPerformed)));
        if (calculatedDelay.compareTo(maximumRetryDelay) >= 0) {
            return maximumRetryDelay;
        }
        return calculatedDelay;
    }

    public boolean shouldRetry(int numberOfRetriesPerformed) {
        return numberOfRetriesPerformed < maximumNumberOfRetries;
    }

    /**
     * Surface every concurrency conflict to the caller
     */
    public static ConcurrencyRetryPolicy noRetries() {
        return new ConcurrencyRetryPolicy(Duration.ZERO, 1.0d, Duration.ZERO, 0);
    }

    public static ConcurrencyRetryPolicy fixedBackoff(Duration retryDelay,
                                                      int maximumNumberOfRetries) {
        return new ConcurrencyRetryPolicy(retryDelay,
                                          1.0d,
                                          retryDelay,
                                          maximumNumberOfRetries);
    }

    public static ConcurrencyRetryPolicy exponentialBackoff(Duration initialRetryDelay,
                                                            double retryDelayMultiplier,
                                                            Duration maximumRetryDelay,
                                                            int maximumNumberOfRetries) {
        return new ConcurrencyRetryPolicy(initialRetryDelay,
                                          retryDelayMultiplier,
                                          maximumRetryDelay,
                                          maximumNumberOfRetries);
    }

    @Override
    public String toString() {
        return "ConcurrencyRetryPolicy{" +
                "initialRetryDelay=" + initialRetryDelay +
                ", retryDelayMultiplier=" + retryDelayMultiplier +
                ", maximumRetryDelay=" + maximumRetryDelay +
                ", maximumNumberOfRetries=" + maximumNumberOfRetries +
                '}';
    }
}
