package com.github.xmachine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import net.automatalib.automata.transducers.impl.compact.CompactMealy;
import net.automatalib.util.automata.Automata;
import net.automatalib.words.Word;

/**
 * Separating sequences and the characterizing set W of a {@link ControlAutomaton}.
 *
 * The automaton is viewed as a complete Mealy machine over observations, see
 * {@link ControlAutomaton#toMealy()}, so rejection counts as an observable output and an undefined
 * transition is a self-loop. W comes from AutomataLib's partition refinement. States that W does
 * not tell apart are equivalent.
 */
final class CharacterizingSet<S, I, O> {
  private static final Logger logger =
      LogManager.getLogger(CharacterizingSet.class.getSimpleName());

  private final CompactMealy<I, Observation<O>> mealy;
  private final List<Word<I>> words;
  private final int[] classes;

  private CharacterizingSet(final CompactMealy<I, Observation<O>> mealy,
      final List<Word<I>> words, final int[] classes) {
    this.mealy = mealy;
    this.words = words;
    this.classes = classes;
  }

  static <S, I, O> CharacterizingSet<S, I, O> compute(final ControlAutomaton<S, I, O> automaton) {
    final CompactMealy<I, Observation<O>> mealy = automaton.toMealy();
    final List<Word<I>> words =
        Collections.unmodifiableList(Automata.characterizingSet(mealy, mealy.getInputAlphabet()));
    final int[] classes = classify(automaton, words);
    if (logger.isDebugEnabled()) {
      logger.debug(String.format("%d states in %d classes, |W|=%d", automaton.size(),
          distinct(classes), words.size()));
    }
    return new CharacterizingSet<>(mealy, words, classes);
  }

  /**
   * Class number per state, by the observations W draws from it. Numbers follow the smallest
   * member.
   */
  private static <S, I, O> int[] classify(final ControlAutomaton<S, I, O> automaton,
      final List<Word<I>> words) {
    final Map<List<List<Observation<O>>>, Integer> signatures = new LinkedHashMap<>();
    final int[] classes = new int[automaton.size()];
    for (int state = 0; state < automaton.size(); state++) {
      final List<List<Observation<O>>> signature = new ArrayList<>(words.size());
      for (final Word<I> word : words) {
        signature.add(automaton.run(state, word.asList()));
      }
      Integer number = signatures.get(signature);
      if (number == null) {
        number = signatures.size();
        signatures.put(signature, number);
      }
      classes[state] = number;
    }
    return classes;
  }

  private static int distinct(final int[] classes) {
    int max = -1;
    for (final int number : classes) {
      max = Math.max(max, number);
    }
    return max + 1;
  }

  /**
   * W as words, in the order AutomataLib produced them.
   */
  List<Word<I>> words() {
    return words;
  }

  /**
   * W as input sequences.
   */
  List<List<I>> asInputs() {
    final List<List<I>> sequences = new ArrayList<>(words.size());
    for (final Word<I> word : words) {
      sequences.add(word.asList());
    }
    return sequences;
  }

  /**
   * A sequence separating the two states, null if they are equivalent.
   */
  List<I> separator(final int first, final int second) {
    if (first == second || equivalent(first, second)) {
      return null;
    }
    final Word<I> separator = Automata.findSeparatingWord(mealy, Integer.valueOf(first),
        Integer.valueOf(second), mealy.getInputAlphabet());
    return separator == null ? null : separator.asList();
  }

  boolean equivalent(final int first, final int second) {
    return classes[first] == classes[second];
  }

  /**
   * The final partition: state ids grouped by class, classes ordered by their smallest member.
   */
  List<List<Integer>> partition() {
    final List<List<Integer>> partition = new ArrayList<>();
    for (int state = 0; state < classes.length; state++) {
      while (partition.size() <= classes[state]) {
        partition.add(new ArrayList<>());
      }
      partition.get(classes[state]).add(state);
    }
    return partition;
  }

}
