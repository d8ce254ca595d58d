package com.github.xmachine;

/**
 * Derives a conformance and robustness test suite from a Stream X-Machine model.
 *
 * Notes for users:<br>
 * 1. a generator is bound to one machine model and one configuration. generate() may be called
 * repeatedly and gives the same tests every time<br>
 *
 * 2. the model is only ever queried, never driven: expected outputs come from replaying the model
 * itself. Run the tests against an implementation with {@link MachineRunner} or any harness of
 * your own and compare with {@link TestCase#firstDivergence(java.util.List)}<br>
 *
 * 3. guards are explored on concrete memory values within the configured exploration budget.
 * Whatever the budget cuts off is reported as a {@link Diagnostic}, never silently dropped<br>
 *
 * 4. the number of worker threads has no effect on the generated suite<br>
 */
public interface TestSuiteGenerator<S, I, O, M> {

  /**
   * Run extraction and test generation end to end.
   */
  TestSuite<S, I, O> generate() throws XMachineException;

  /**
   * Reports the id of this generator, which prefixes its log lines.
   */
  String getId();

  /**
   * Returns the config that this generator is wired with.
   */
  GeneratorConfiguration getConfiguration();

  /**
   * A simple builder to let users use fluent APIs to build generators.
   */
  public final static class TestSuiteGeneratorBuilder<S, I, O, M> {
    private GeneratorConfiguration config;
    private XMachine<S, I, O, M> machine;

    public static <S, I, O, M> TestSuiteGeneratorBuilder<S, I, O, M> newBuilder(
        final XMachine<S, I, O, M> machine) {
      return new TestSuiteGeneratorBuilder<S, I, O, M>().machine(machine);
    }

    /**
     * Optional, defaults apply when not set.
     */
    public TestSuiteGeneratorBuilder<S, I, O, M> config(final GeneratorConfiguration config) {
      this.config = config;
      return this;
    }

    public TestSuiteGeneratorBuilder<S, I, O, M> machine(final XMachine<S, I, O, M> machine) {
      this.machine = machine;
      return this;
    }

    public TestSuiteGenerator<S, I, O, M> build() throws XMachineException {
      return new TestSuiteGeneratorImpl<>(config, machine);
    }

    private TestSuiteGeneratorBuilder() {}
  }

}
