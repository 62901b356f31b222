package io.budgetsakkie.pricebackend.retailer;

import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Worker pools for retailer lookups. Lookups never share a pool with callers that block on a
 * comparison, otherwise a burst of blocked callers leaves no thread to run the lookups they wait
 * for.
 */
public final class RetailerSchedulers {
  private RetailerSchedulers() {}

  static final String THREAD_PREFIX = "retailer-fetch";
  private static final int TTL_SECONDS = 60;

  private static final class Shared {
    static final Scheduler INSTANCE =
        create(Schedulers.DEFAULT_BOUNDED_ELASTIC_SIZE, Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE);
  }

  /** Process-wide pool used by adapters and registries built without an explicit scheduler. */
  public static Scheduler shared() {
    return Shared.INSTANCE;
  }

  public static Scheduler create(int threadCap, int queuedTaskCap) {
    return Schedulers.newBoundedElastic(
        Math.max(1, threadCap), Math.max(1, queuedTaskCap), THREAD_PREFIX, TTL_SECONDS, true);
  }
}
