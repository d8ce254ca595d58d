package com.github.xmachine;

import java.util.Arrays;
import java.util.List;

/**
 * A job runner that counts ticks while RUNNING. Nothing leads into MAINTENANCE. With a tick cap the
 * configuration space is finite; without one it is not and every search ends on its budget.
 */
final class MaintenanceMachine implements XMachine<String, String, String, Integer> {
  static final String IDLE = "IDLE";
  static final String RUNNING = "RUNNING";
  static final String MAINTENANCE = "MAINTENANCE";

  // 0 means unbounded
  private final int maxTicks;

  MaintenanceMachine(final int maxTicks) {
    this.maxTicks = maxTicks;
  }

  static MaintenanceMachine capped() {
    return new MaintenanceMachine(3);
  }

  static MaintenanceMachine unbounded() {
    return new MaintenanceMachine(0);
  }

  @Override
  public String initialState() {
    return IDLE;
  }

  @Override
  public Integer initialMemory() {
    return 0;
  }

  @Override
  public List<String> states() {
    return Arrays.asList(IDLE, RUNNING, MAINTENANCE);
  }

  @Override
  public List<String> inputAlphabet() {
    return Arrays.asList("start", "tick", "stop");
  }

  @Override
  public ProcessingResult<String, String, Integer> apply(final String state, final Integer ticks,
      final String input) {
    if (IDLE.equals(state)) {
      return "start".equals(input) ? ProcessingResult.accepted("started", 0, RUNNING)
          : ProcessingResult.rejected();
    }
    if (RUNNING.equals(state)) {
      if ("tick".equals(input) && (maxTicks == 0 || ticks < maxTicks)) {
        return ProcessingResult.accepted("ticked", ticks + 1, RUNNING);
      }
      if ("stop".equals(input)) {
        return ProcessingResult.accepted("stopped", 0, IDLE);
      }
      return ProcessingResult.rejected();
    }
    return ProcessingResult.accepted("serviced", 0, IDLE);
  }

}
