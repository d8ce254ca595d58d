package com.github.xmachine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Merges generated tests into a {@link TestSuite}: conformance tests first, then robustness tests,
 * each in the order its generator produced them. A test with the same kind and inputs as an earlier
 * one is dropped. Survivors are numbered from 1.
 */
final class TestSuiteAssembler<S, I, O> {
  private static final Logger logger =
      LogManager.getLogger(TestSuiteAssembler.class.getSimpleName());

  private final List<TestCase<I, O>> conformance = new ArrayList<>();
  private final List<TestCase<I, O>> robustness = new ArrayList<>();
  private final List<Diagnostic> diagnostics = new ArrayList<>();

  TestSuiteAssembler<S, I, O> conformance(final List<TestCase<I, O>> tests) {
    conformance.addAll(tests);
    return this;
  }

  TestSuiteAssembler<S, I, O> robustness(final List<TestCase<I, O>> tests) {
    robustness.addAll(tests);
    return this;
  }

  TestSuiteAssembler<S, I, O> diagnostics(final List<Diagnostic> reported) {
    diagnostics.addAll(reported);
    return this;
  }

  TestSuite<S, I, O> assemble(final ControlAutomaton<S, I, O> automaton,
      final List<List<I>> characterizingSet, final GenerationStatistics statistics) {
    final Set<List<Object>> seen = new HashSet<>();
    final List<TestCase<I, O>> numbered = new ArrayList<>();
    int duplicates = 0;
    for (final List<TestCase<I, O>> tests : Arrays.asList(conformance, robustness)) {
      for (final TestCase<I, O> test : tests) {
        if (!seen.add(Arrays.<Object>asList(test.getKind(), test.getInputs()))) {
          duplicates++;
          continue;
        }
        numbered.add(test.rename(String.format("T%04d %s", numbered.size() + 1, test.getName())));
      }
    }
    if (duplicates > 0 && logger.isDebugEnabled()) {
      logger.debug(String.format("Dropped %d duplicate tests", duplicates));
    }
    return new TestSuite<>(numbered, diagnostics, automaton, characterizingSet, statistics);
  }

}
