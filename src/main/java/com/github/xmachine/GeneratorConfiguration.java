package com.github.xmachine;

/**
 * This class encapsulates all the configuration parameters for a {@link TestSuiteGenerator}. Use
 * the {@code GeneratorConfigurationBuilder} to build it.
 *
 * Notes:<br>
 * 1. maxDepth and maxConfigurations bound every configuration search. Memory may be unbounded, so
 * a search that hits either limit reports itself as exhausted rather than running forever.<br>
 * 2. searches re-run for states or transitions the first exploration could not settle get a budget
 * of retryBudgetFactor times the configured one.<br>
 * 3. implementationStateBound is the m of the W-Method. 0 means "same as the model".<br>
 * 4. workerThreads only changes how fast independent searches run, never what they produce.<br>
 */
public final class GeneratorConfiguration {
  static final int defaultMaxDepth = 32;
  static final int defaultMaxConfigurations = 100_000;
  static final int defaultRetryBudgetFactor = 4;

  private final int maxDepth;
  private final int maxConfigurations;
  private final int retryBudgetFactor;
  private final int implementationStateBound;
  private final int workerThreads;
  private final boolean robustnessTests;
  private final boolean guardRejectionTests;
  private final boolean verifyDeterminism;

  public int getMaxDepth() {
    return maxDepth;
  }

  public int getMaxConfigurations() {
    return maxConfigurations;
  }

  public int getRetryBudgetFactor() {
    return retryBudgetFactor;
  }

  public int getImplementationStateBound() {
    return implementationStateBound;
  }

  public int getWorkerThreads() {
    return workerThreads;
  }

  public boolean getRobustnessTests() {
    return robustnessTests;
  }

  public boolean getGuardRejectionTests() {
    return guardRejectionTests;
  }

  public boolean getVerifyDeterminism() {
    return verifyDeterminism;
  }

  ExplorationBudget explorationBudget() {
    return new ExplorationBudget(maxDepth, maxConfigurations);
  }

  ExplorationBudget retryBudget() {
    return explorationBudget().escalate(retryBudgetFactor);
  }

  public final static class GeneratorConfigurationBuilder {
    private int maxDepth = defaultMaxDepth;
    private int maxConfigurations = defaultMaxConfigurations;
    private int retryBudgetFactor = defaultRetryBudgetFactor;
    private int implementationStateBound;
    private int workerThreads = 1;
    private boolean robustnessTests = true;
    private boolean guardRejectionTests = true;
    private boolean verifyDeterminism = true;

    public static GeneratorConfigurationBuilder newBuilder() {
      return new GeneratorConfigurationBuilder();
    }

    public GeneratorConfigurationBuilder maxDepth(final int maxDepth) {
      this.maxDepth = maxDepth;
      return this;
    }

    public GeneratorConfigurationBuilder maxConfigurations(final int maxConfigurations) {
      this.maxConfigurations = maxConfigurations;
      return this;
    }

    public GeneratorConfigurationBuilder retryBudgetFactor(final int retryBudgetFactor) {
      this.retryBudgetFactor = retryBudgetFactor;
      return this;
    }

    public GeneratorConfigurationBuilder implementationStateBound(
        final int implementationStateBound) {
      this.implementationStateBound = implementationStateBound;
      return this;
    }

    public GeneratorConfigurationBuilder workerThreads(final int workerThreads) {
      this.workerThreads = workerThreads;
      return this;
    }

    public GeneratorConfigurationBuilder robustnessTests(final boolean robustnessTests) {
      this.robustnessTests = robustnessTests;
      return this;
    }

    public GeneratorConfigurationBuilder guardRejectionTests(final boolean guardRejectionTests) {
      this.guardRejectionTests = guardRejectionTests;
      return this;
    }

    public GeneratorConfigurationBuilder verifyDeterminism(final boolean verifyDeterminism) {
      this.verifyDeterminism = verifyDeterminism;
      return this;
    }

    public GeneratorConfiguration build() throws XMachineException {
      final GeneratorConfiguration config = new GeneratorConfiguration(this);
      config.validate();
      return config;
    }

    private GeneratorConfigurationBuilder() {}
  }

  private void validate() throws XMachineException {
    StringBuilder messages = new StringBuilder();
    if (maxDepth <= 0) {
      messages.append("maxDepth must be positive. ");
    }
    if (maxConfigurations <= 0) {
      messages.append("maxConfigurations must be positive. ");
    }
    if (retryBudgetFactor < 1) {
      messages.append("retryBudgetFactor cannot be less than 1. ");
    }
    if (implementationStateBound < 0) {
      messages.append("implementationStateBound cannot be negative. ");
    }
    if (workerThreads < 1) {
      messages.append("workerThreads cannot be less than 1. ");
    }
    if (messages.length() > 0) {
      throw new XMachineException(XMachineException.Code.INVALID_GENERATOR_CONFIG,
          messages.toString().trim());
    }
  }

  @Override
  public String toString() {
    return "GeneratorConfiguration [maxDepth=" + maxDepth + ", maxConfigurations="
        + maxConfigurations + ", retryBudgetFactor=" + retryBudgetFactor
        + ", implementationStateBound=" + implementationStateBound + ", workerThreads="
        + workerThreads + ", robustnessTests=" + robustnessTests + ", guardRejectionTests="
        + guardRejectionTests + ", verifyDeterminism=" + verifyDeterminism + "]";
  }

  private GeneratorConfiguration(final GeneratorConfigurationBuilder builder) {
    this.maxDepth = builder.maxDepth;
    this.maxConfigurations = builder.maxConfigurations;
    this.retryBudgetFactor = builder.retryBudgetFactor;
    this.implementationStateBound = builder.implementationStateBound;
    this.workerThreads = builder.workerThreads;
    this.robustnessTests = builder.robustnessTests;
    this.guardRejectionTests = builder.guardRejectionTests;
    this.verifyDeterminism = builder.verifyDeterminism;
  }

}
