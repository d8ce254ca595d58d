package com.github.xmachine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import net.automatalib.words.Word;

/**
 * W-Method test generation over an extracted {@link ControlAutomaton}.
 *
 * The suite is P . Sigma^(<= m-n) . W where P is the transition cover (the state cover and each of
 * its sequences extended by every input), n the number of automaton states, m the bound on
 * implementation states and W the characterizing set. If an implementation has at most m states,
 * some test in the suite exposes any difference between its outputs and the model's.
 *
 * W is computed by AutomataLib on the Mealy view of the automaton and sequences are AutomataLib
 * words throughout. Transitions that only fire under particular memory values are added as their
 * shortest witness followed by every sequence of W. Expected outputs always come from replaying the
 * model, not from the automaton.
 */
final class ConformanceTestGenerator<S, I, O, M> {
  private static final Logger logger =
      LogManager.getLogger(ConformanceTestGenerator.class.getSimpleName());

  private final ModelOracle<S, I, O, M> oracle;
  private final ControlAutomaton<S, I, O> automaton;
  private final CharacterizingSet<S, I, O> characterizingSet;
  private final int implementationStateBound;

  ConformanceTestGenerator(final ModelOracle<S, I, O, M> oracle,
      final ControlAutomaton<S, I, O> automaton, final CharacterizingSet<S, I, O> characterizingSet,
      final int implementationStateBound) {
    this.oracle = oracle;
    this.automaton = automaton;
    this.characterizingSet = characterizingSet;
    this.implementationStateBound = implementationStateBound;
  }

  /**
   * m - n, never negative.
   */
  int extraStates() {
    final int modelStates = automaton.size();
    if (implementationStateBound == 0) {
      return 0;
    }
    if (implementationStateBound < modelStates) {
      logger.warn(String.format(
          "Implementation state bound %d is below the %d model states, using %d instead",
          implementationStateBound, modelStates, modelStates));
      return 0;
    }
    return implementationStateBound - modelStates;
  }

  /**
   * Shortest access sequence per automaton state, in state id order.
   */
  List<Word<I>> stateCover() {
    final List<Word<I>> cover = new ArrayList<>(automaton.size());
    for (int state = 0; state < automaton.size(); state++) {
      cover.add(Word.fromList(automaton.getAccessSequence(state)));
    }
    return cover;
  }

  /**
   * The state cover followed by every state cover sequence extended by every input.
   */
  List<Word<I>> transitionCover() {
    final List<Word<I>> cover = new ArrayList<>(stateCover());
    for (final Word<I> access : stateCover()) {
      for (final I input : automaton.getInputs()) {
        cover.add(access.append(input));
      }
    }
    return cover;
  }

  List<TestCase<I, O>> generate() throws XMachineException {
    List<Word<I>> characterizing = characterizingSet.words();
    if (characterizing.isEmpty()) {
      characterizing = Collections.singletonList(Word.<I>epsilon());
    }
    final int extra = extraStates();
    final List<Word<I>> middles = middles(extra);

    final Set<Word<I>> candidates = new LinkedHashSet<>();
    for (final Word<I> prefix : transitionCover()) {
      for (final Word<I> middle : middles) {
        for (final Word<I> suffix : characterizing) {
          candidates.add(prefix.concat(middle, suffix));
        }
      }
    }
    for (final AutomatonEdge<S, I, O> edge : automaton.getEdges()) {
      for (final Word<I> suffix : characterizing) {
        candidates.add(Word.fromList(edge.getWitness()).concat(suffix));
      }
    }

    final List<Word<I>> sequences = prune(candidates);
    final List<TestCase<I, O>> tests = new ArrayList<>(sequences.size());
    for (final Word<I> sequence : sequences) {
      final List<I> inputs = sequence.asList();
      tests.add(new TestCase<>("Conformance " + inputs, TestKind.CONFORMANCE, inputs,
          oracle.replay(inputs)));
    }
    logger.info(String.format(
        "W-Method over %d states, |W|=%d, %d extra states: %d candidates, %d tests after pruning",
        automaton.size(), characterizingSet.words().size(), extra, candidates.size(),
        tests.size()));
    return tests;
  }

  /**
   * Every input word of length 0 up to the given length, shorter first.
   */
  private List<Word<I>> middles(final int maxLength) {
    final List<Word<I>> middles = new ArrayList<>();
    middles.add(Word.<I>epsilon());
    List<Word<I>> layer = Collections.singletonList(Word.<I>epsilon());
    for (int length = 1; length <= maxLength; length++) {
      final List<Word<I>> next = new ArrayList<>();
      for (final Word<I> shorter : layer) {
        for (final I input : automaton.getInputs()) {
          next.add(shorter.append(input));
        }
      }
      middles.addAll(next);
      layer = next;
    }
    return middles;
  }

  /**
   * Drop words that are proper prefixes of another one, then order by length and input order.
   */
  private List<Word<I>> prune(final Set<Word<I>> candidates) {
    final Set<Word<I>> prefixes = new HashSet<>();
    for (final Word<I> candidate : candidates) {
      for (int length = 0; length < candidate.length(); length++) {
        prefixes.add(candidate.prefix(length));
      }
    }
    final List<Word<I>> kept = new ArrayList<>();
    for (final Word<I> candidate : candidates) {
      if (!candidate.isEmpty() && !prefixes.contains(candidate)) {
        kept.add(candidate);
      }
    }
    final Comparator<List<I>> order = sequenceOrder(automaton.getInputs());
    kept.sort((first, second) -> order.compare(first.asList(), second.asList()));
    return kept;
  }

  /**
   * Shorter first, then lexicographic by position in the alphabet.
   */
  static <I> Comparator<List<I>> sequenceOrder(final List<I> alphabet) {
    final Map<I, Integer> positions = new HashMap<>();
    for (int index = 0; index < alphabet.size(); index++) {
      positions.put(alphabet.get(index), index);
    }
    return (first, second) -> {
      if (first.size() != second.size()) {
        return Integer.compare(first.size(), second.size());
      }
      for (int index = 0; index < first.size(); index++) {
        final int compared =
            Integer.compare(positions.get(first.get(index)), positions.get(second.get(index)));
        if (compared != 0) {
          return compared;
        }
      }
      return 0;
    };
  }

}
