package com.github.xmachine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.xmachine.Diagnostic.Kind;
import com.github.xmachine.GeneratorConfiguration.GeneratorConfigurationBuilder;

/**
 * Generation pipeline: model validation, automaton extraction, characterizing set, W-Method
 * conformance tests, robustness tests and assembly.
 *
 * Notes:<br>
 * 1. the model is validated once when the generator is built, so a malformed alphabet or state
 * list fails fast<br>
 *
 * 2. every generate() run gets its own statistics and worker pool; the pool is torn down before
 * generate() returns<br>
 */
public final class TestSuiteGeneratorImpl<S, I, O, M> implements TestSuiteGenerator<S, I, O, M> {
  private static final Logger logger =
      LogManager.getLogger(TestSuiteGeneratorImpl.class.getSimpleName());

  private final String generatorId = UUID.randomUUID().toString();
  private final GeneratorConfiguration config;
  private final XMachine<S, I, O, M> machine;

  TestSuiteGeneratorImpl(final GeneratorConfiguration config, final XMachine<S, I, O, M> machine)
      throws XMachineException {
    this.config = config != null ? config : GeneratorConfigurationBuilder.newBuilder().build();
    this.machine = machine;
    // fail fast on a broken model
    new ModelOracle<>(machine, false, null);
    logInfo(generatorId, "Built generator with " + this.config);
  }

  @Override
  public TestSuite<S, I, O> generate() throws XMachineException {
    final GenerationStatistics statistics = new GenerationStatistics(generatorId);
    final ModelOracle<S, I, O, M> oracle =
        new ModelOracle<>(machine, config.getVerifyDeterminism(), statistics);
    final SymbolicExplorer<S, I, O, M> explorer = new SymbolicExplorer<>(oracle, statistics);
    final List<Diagnostic> diagnostics = new ArrayList<>();
    logInfo(generatorId, String.format("Generating tests for %d states and %d inputs",
        oracle.states().size(), oracle.inputs().size()));

    final ControlAutomaton<S, I, O> automaton;
    try (GoalExecutor executor = new GoalExecutor(generatorId, config.getWorkerThreads())) {
      automaton = new AutomatonExtractor<>(oracle, explorer, config, executor).extract(diagnostics);
    }
    logInfo(generatorId, "Extracted " + automaton);

    final CharacterizingSet<S, I, O> characterizingSet = CharacterizingSet.compute(automaton);
    logDebug(generatorId, "Characterizing set " + characterizingSet.asInputs() + ", partition "
        + characterizingSet.partition());

    final List<TestCase<I, O>> conformance = new ConformanceTestGenerator<>(oracle, automaton,
        characterizingSet, config.getImplementationStateBound()).generate();

    List<TestCase<I, O>> robustness = Collections.emptyList();
    if (config.getRobustnessTests()) {
      robustness = new InputCompletenessGenerator<>(oracle, automaton,
          characterizingSet.asInputs(), config.getGuardRejectionTests()).generate();
    } else if (!automaton.isComplete()) {
      final Diagnostic incomplete = incompleteSpecification(automaton);
      logWarning(generatorId, incomplete.toString());
      diagnostics.add(incomplete);
    }

    final TestSuite<S, I, O> suite = new TestSuiteAssembler<S, I, O>().conformance(conformance)
        .robustness(robustness).diagnostics(diagnostics)
        .assemble(automaton, characterizingSet.asInputs(), statistics);
    statistics.conformanceTests = suite.getConformanceTests().size();
    statistics.robustnessTests = suite.getRobustnessTests().size();
    statistics.stop();
    logInfo(generatorId, "Generated " + suite.size() + " tests, " + statistics);
    return suite;
  }

  private Diagnostic incompleteSpecification(final ControlAutomaton<S, I, O> automaton) {
    final List<String> missing = new ArrayList<>();
    for (final int[] pair : automaton.undefinedTransitions()) {
      missing.add("(" + automaton.label(pair[0]) + ", " + automaton.getInputs().get(pair[1]) + ")");
    }
    return new Diagnostic(Kind.INCOMPLETE_SPECIFICATION, null, null,
        "No transition and no robustness test for " + missing);
  }

  @Override
  public String getId() {
    return generatorId;
  }

  @Override
  public GeneratorConfiguration getConfiguration() {
    return config;
  }

  private static void logWarning(final String generatorId, final String message) {
    logger.warn(new StringBuilder().append("[g:").append(generatorId).append("] ").append(message)
        .toString());
  }

  private static void logInfo(final String generatorId, final String message) {
    logger.info(new StringBuilder().append("[g:").append(generatorId).append("] ").append(message)
        .toString());
  }

  private static void logDebug(final String generatorId, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[g:").append(generatorId).append("] ")
          .append(message).toString());
    }
  }

}
