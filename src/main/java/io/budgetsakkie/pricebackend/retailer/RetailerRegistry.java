package io.budgetsakkie.pricebackend.retailer;

import io.budgetsakkie.pricebackend.model.RetailerInfo;
import java.util.List;
import reactor.core.scheduler.Scheduler;

/** Fixed, ordered set of adapters a comparison fans out to, and the pool their calls run on. */
public class RetailerRegistry {
  private final List<RetailerAdapter> adapters;
  private final Scheduler scheduler;

  public RetailerRegistry(List<RetailerAdapter> adapters) {
    this(adapters, RetailerSchedulers.shared());
  }

  public RetailerRegistry(List<RetailerAdapter> adapters, Scheduler scheduler) {
    if (adapters == null || adapters.isEmpty()) {
      throw new IllegalArgumentException("at least one retailer adapter is required");
    }
    this.adapters = List.copyOf(adapters);
    this.scheduler = scheduler == null ? RetailerSchedulers.shared() : scheduler;
  }

  public List<RetailerAdapter> adapters() {
    return adapters;
  }

  public List<RetailerInfo> retailers() {
    return adapters.stream().map(RetailerAdapter::info).toList();
  }

  public int size() {
    return adapters.size();
  }

  public Scheduler scheduler() {
    return scheduler;
  }
}
