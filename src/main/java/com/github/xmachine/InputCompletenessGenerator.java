package com.github.xmachine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.xmachine.XMachineException.Code;

/**
 * Robustness tests: every reachable state must reject, cleanly, each input it has no transition
 * for. One test per (state, input) pair without a control-level transition and per sequence of W:
 * the state's access sequence, the input, then the W sequence. The input must be observed as
 * rejected, and W checks that the machine did not move.
 *
 * Optionally, pairs that do have a transition but whose guard fails for some discovered memory get
 * tests as well: through the shortest configuration where the guard fails, and through the first
 * one as deep as the configuration that enables the transition, which is where a guard on the
 * accumulated memory turns the input away.
 */
final class InputCompletenessGenerator<S, I, O, M> {
  private static final Logger logger =
      LogManager.getLogger(InputCompletenessGenerator.class.getSimpleName());

  private final ModelOracle<S, I, O, M> oracle;
  private final ControlAutomaton<S, I, O> automaton;
  private final List<List<I>> characterizingSet;
  private final boolean guardRejectionTests;

  InputCompletenessGenerator(final ModelOracle<S, I, O, M> oracle,
      final ControlAutomaton<S, I, O> automaton, final List<List<I>> characterizingSet,
      final boolean guardRejectionTests) {
    this.oracle = oracle;
    this.automaton = automaton;
    this.characterizingSet = characterizingSet.isEmpty()
        ? Collections.singletonList(Collections.<I>emptyList())
        : characterizingSet;
    this.guardRejectionTests = guardRejectionTests;
  }

  List<TestCase<I, O>> generate() throws XMachineException {
    final List<TestCase<I, O>> tests = new ArrayList<>();
    int undefined = 0;
    int guarded = 0;
    for (int state = 0; state < automaton.size(); state++) {
      for (int input = 0; input < automaton.getInputs().size(); input++) {
        final I symbol = automaton.getInputs().get(input);
        if (!automaton.isDefined(state, input)) {
          undefined += rejectionTests(tests, String.format("Robustness: %s should reject %s",
              automaton.label(state), symbol), automaton.getAccessSequence(state), symbol);
        } else if (guardRejectionTests) {
          for (final List<I> access : automaton.getRejectingAccesses(state, input)) {
            guarded += rejectionTests(tests,
                String.format("Robustness: %s guard rejects %s after %s", automaton.label(state),
                    symbol, access),
                access, symbol);
          }
        }
      }
    }
    logger.info(String.format("Generated %d robustness tests (%d undefined, %d guarded)",
        tests.size(), undefined, guarded));
    return tests;
  }

  private int rejectionTests(final List<TestCase<I, O>> tests, final String name,
      final List<I> access, final I input) throws XMachineException {
    for (final List<I> suffix : characterizingSet) {
      final List<I> sequence = new ArrayList<>(access);
      sequence.add(input);
      sequence.addAll(suffix);
      final List<Observation<O>> expected = oracle.replay(sequence);
      if (!expected.get(access.size()).isRejected()) {
        throw new XMachineException(Code.REPLAY_MISMATCH,
            String.format("%s: replaying %s gives %s, not a rejection of input %d", name,
                sequence, expected, access.size() + 1));
      }
      tests.add(new TestCase<>(name, TestKind.ROBUSTNESS, sequence, expected));
    }
    return characterizingSet.size();
  }

}
