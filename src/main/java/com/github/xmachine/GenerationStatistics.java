package com.github.xmachine;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Holder of statistics for one generation run. Counters are updated from worker threads, hence the
 * atomics.
 */
public final class GenerationStatistics {
  private final String generatorId;
  private final long startTstampMillis = System.currentTimeMillis();

  final AtomicLong modelQueries = new AtomicLong();
  final AtomicLong searches = new AtomicLong();
  final AtomicLong exhaustedSearches = new AtomicLong();
  final AtomicLong configurationsExplored = new AtomicLong();
  volatile int conformanceTests;
  volatile int robustnessTests;
  volatile long elapsedMillis;

  GenerationStatistics(final String generatorId) {
    this.generatorId = generatorId;
  }

  public String getGeneratorId() {
    return generatorId;
  }

  public long getStartTimeMillis() {
    return startTstampMillis;
  }

  public long getModelQueries() {
    return modelQueries.get();
  }

  public long getSearches() {
    return searches.get();
  }

  public long getExhaustedSearches() {
    return exhaustedSearches.get();
  }

  public long getConfigurationsExplored() {
    return configurationsExplored.get();
  }

  public int getConformanceTests() {
    return conformanceTests;
  }

  public int getRobustnessTests() {
    return robustnessTests;
  }

  public long getElapsedMillis() {
    return elapsedMillis;
  }

  void stop() {
    elapsedMillis = System.currentTimeMillis() - startTstampMillis;
  }

  @Override
  public String toString() {
    return "GenerationStatistics [generatorId=" + generatorId + ", modelQueries="
        + modelQueries.get() + ", searches=" + searches.get() + ", exhaustedSearches="
        + exhaustedSearches.get() + ", configurationsExplored=" + configurationsExplored.get()
        + ", conformanceTests=" + conformanceTests + ", robustnessTests=" + robustnessTests
        + ", elapsedMillis=" + elapsedMillis + "]";
  }

}
