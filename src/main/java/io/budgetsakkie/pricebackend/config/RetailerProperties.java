package io.budgetsakkie.pricebackend.config;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import reactor.core.scheduler.Schedulers;

@Component
@ConfigurationProperties(prefix = "app.retailers")
public class RetailerProperties {
  private String currency = "ZAR";
  private int maxRetries = 3;
  private long backoffUnitMs = 1000;
  private long requestTimeoutMs = 10_000;
  private String userAgent = "";
  private long simulatedLatencyMinMs = 0;
  private long simulatedLatencyMaxMs = 0;
  private int workerThreads = Schedulers.DEFAULT_BOUNDED_ELASTIC_SIZE;
  private int workerQueueCapacity = Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE;

  /** Retailer id to JSON feed URL; retailers without one are priced from their catalog. */
  private Map<String, String> endpoints = new LinkedHashMap<>();

  public String getCurrency() {
    return currency;
  }

  public void setCurrency(String currency) {
    this.currency = currency;
  }

  public int getMaxRetries() {
    return maxRetries;
  }

  public void setMaxRetries(int maxRetries) {
    this.maxRetries = maxRetries;
  }

  public long getBackoffUnitMs() {
    return backoffUnitMs;
  }

  public void setBackoffUnitMs(long backoffUnitMs) {
    this.backoffUnitMs = backoffUnitMs;
  }

  public long getRequestTimeoutMs() {
    return requestTimeoutMs;
  }

  public void setRequestTimeoutMs(long requestTimeoutMs) {
    this.requestTimeoutMs = requestTimeoutMs;
  }

  public int getWorkerThreads() {
    return workerThreads;
  }

  public void setWorkerThreads(int workerThreads) {
    this.workerThreads = workerThreads;
  }

  public int getWorkerQueueCapacity() {
    return workerQueueCapacity;
  }

  public void setWorkerQueueCapacity(int workerQueueCapacity) {
    this.workerQueueCapacity = workerQueueCapacity;
  }

  public String getUserAgent() {
    return userAgent;
  }

  public void setUserAgent(String userAgent) {
    this.userAgent = userAgent;
  }

  public long getSimulatedLatencyMinMs() {
    return simulatedLatencyMinMs;
  }

  public void setSimulatedLatencyMinMs(long simulatedLatencyMinMs) {
    this.simulatedLatencyMinMs = simulatedLatencyMinMs;
  }

  public long getSimulatedLatencyMaxMs() {
    return simulatedLatencyMaxMs;
  }

  public void setSimulatedLatencyMaxMs(long simulatedLatencyMaxMs) {
    this.simulatedLatencyMaxMs = simulatedLatencyMaxMs;
  }

  public Map<String, String> getEndpoints() {
    return endpoints;
  }

  public void setEndpoints(Map<String, String> endpoints) {
    this.endpoints = endpoints == null ? new LinkedHashMap<>() : endpoints;
  }
}
