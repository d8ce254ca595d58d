package com.github.xmachine;

/**
 * This object encapsulates the result of applying the processing function of an {@link XMachine}
 * to a (state, memory, input) triple.
 *
 * Accepted results carry the produced output, the updated memory and the next state. Rejected
 * results carry nothing: the guard of every processing function is false for the triple. A
 * rejection is an expected outcome and not a fault.
 *
 * Users should not try to sub-class and extend this, it would serve little purpose.
 */
public final class ProcessingResult<S, O, M> {
  private final boolean accepted;
  private final O output;
  private final M memory;
  private final S nextState;

  private ProcessingResult(final boolean accepted, final O output, final M memory,
      final S nextState) {
    this.accepted = accepted;
    this.output = output;
    this.memory = memory;
    this.nextState = nextState;
  }

  public static <S, O, M> ProcessingResult<S, O, M> accepted(final O output, final M memory,
      final S nextState) {
    return new ProcessingResult<>(true, output, memory, nextState);
  }

  public static <S, O, M> ProcessingResult<S, O, M> rejected() {
    return new ProcessingResult<>(false, null, null, null);
  }

  public boolean isAccepted() {
    return accepted;
  }

  public boolean isRejected() {
    return !accepted;
  }

  public O getOutput() {
    return output;
  }

  public M getMemory() {
    return memory;
  }

  public S getNextState() {
    return nextState;
  }

  @Override
  public String toString() {
    if (!accepted) {
      return "ProcessingResult [REJECTED]";
    }
    return "ProcessingResult [output=" + output + ", memory=" + memory + ", nextState=" + nextState
        + "]";
  }
}
