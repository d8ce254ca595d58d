package com.github.xmachine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.github.xmachine.Diagnostic.Kind;

/**
 * The artifact of one generation run: numbered test cases, conformance tests first, along with the
 * diagnostics reported on the way, the extracted control automaton and run statistics.
 *
 * Everything but the statistics is a pure function of the machine model and the configuration, so
 * {@link #render()} gives byte-identical text for identical inputs.
 */
public final class TestSuite<S, I, O> {
  private final List<TestCase<I, O>> tests;
  private final List<Diagnostic> diagnostics;
  private final ControlAutomaton<S, I, O> automaton;
  private final List<List<I>> characterizingSet;
  private final GenerationStatistics statistics;

  TestSuite(final List<TestCase<I, O>> tests, final List<Diagnostic> diagnostics,
      final ControlAutomaton<S, I, O> automaton, final List<List<I>> characterizingSet,
      final GenerationStatistics statistics) {
    this.tests = Collections.unmodifiableList(new ArrayList<>(tests));
    this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
    this.automaton = automaton;
    this.characterizingSet = Collections.unmodifiableList(new ArrayList<>(characterizingSet));
    this.statistics = statistics;
  }

  public List<TestCase<I, O>> getTests() {
    return tests;
  }

  public List<TestCase<I, O>> getConformanceTests() {
    return ofKind(TestKind.CONFORMANCE);
  }

  public List<TestCase<I, O>> getRobustnessTests() {
    return ofKind(TestKind.ROBUSTNESS);
  }

  public List<Diagnostic> getDiagnostics() {
    return diagnostics;
  }

  public List<Diagnostic> getDiagnostics(final Kind kind) {
    final List<Diagnostic> matching = new ArrayList<>();
    for (final Diagnostic diagnostic : diagnostics) {
      if (diagnostic.getKind() == kind) {
        matching.add(diagnostic);
      }
    }
    return matching;
  }

  public ControlAutomaton<S, I, O> getAutomaton() {
    return automaton;
  }

  /**
   * The separating sequences the conformance tests end with.
   */
  public List<List<I>> getCharacterizingSet() {
    return characterizingSet;
  }

  public GenerationStatistics getStatistics() {
    return statistics;
  }

  public int size() {
    return tests.size();
  }

  /**
   * Plain text listing of the automaton, diagnostics and tests. Statistics are left out since they
   * carry timings.
   */
  public String render() {
    final StringBuilder text = new StringBuilder();
    text.append("states:\n");
    for (int state = 0; state < automaton.size(); state++) {
      text.append("  ").append(automaton.label(state));
      if (state == automaton.initialId()) {
        text.append(" (initial)");
      }
      text.append(" access=").append(automaton.getAccessSequence(state)).append('\n');
    }
    text.append("transitions:\n");
    for (final AutomatonEdge<S, I, O> edge : automaton.getEdges()) {
      text.append("  ").append(edge).append('\n');
    }
    text.append("characterizing set: ").append(characterizingSet).append('\n');
    text.append("diagnostics:\n");
    for (final Diagnostic diagnostic : diagnostics) {
      text.append("  ").append(diagnostic).append('\n');
    }
    text.append("tests:\n");
    for (final TestCase<I, O> test : tests) {
      text.append("  ").append(test).append('\n');
    }
    return text.toString();
  }

  private List<TestCase<I, O>> ofKind(final TestKind kind) {
    final List<TestCase<I, O>> matching = new ArrayList<>();
    for (final TestCase<I, O> test : tests) {
      if (test.getKind() == kind) {
        matching.add(test);
      }
    }
    return matching;
  }

  @Override
  public String toString() {
    return "TestSuite [tests=" + tests.size() + ", diagnostics=" + diagnostics.size()
        + ", automatonStates=" + automaton.size() + ", statistics=" + statistics + "]";
  }
}
