package com.github.xmachine;

/**
 * Upper bounds for one configuration search: the longest input sequence expanded and the number of
 * distinct configurations recorded.
 */
public final class ExplorationBudget {
  private final int maxDepth;
  private final int maxConfigurations;

  public ExplorationBudget(final int maxDepth, final int maxConfigurations) {
    if (maxDepth <= 0 || maxConfigurations <= 0) {
      throw new IllegalArgumentException(
          "Exploration budget must be positive: depth=" + maxDepth + ", configurations="
              + maxConfigurations);
    }
    this.maxDepth = maxDepth;
    this.maxConfigurations = maxConfigurations;
  }

  public int getMaxDepth() {
    return maxDepth;
  }

  public int getMaxConfigurations() {
    return maxConfigurations;
  }

  /**
   * Multiply both limits, saturating at Integer.MAX_VALUE.
   */
  public ExplorationBudget escalate(final int factor) {
    return new ExplorationBudget(saturatedMultiply(maxDepth, factor),
        saturatedMultiply(maxConfigurations, factor));
  }

  private static int saturatedMultiply(final int value, final int factor) {
    final long product = (long) value * factor;
    return product > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) product;
  }

  @Override
  public String toString() {
    return "ExplorationBudget [maxDepth=" + maxDepth + ", maxConfigurations=" + maxConfigurations
        + "]";
  }
}
