package com.github.xmachine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Door with a keypad. Memory is the buffer of entered digits, at most two of them. ENTER opens the
 * door when the buffer holds the PIN and is rejected otherwise; a full buffer rejects digits.
 * ENTER on an open door locks it again.
 */
final class KeypadDoorMachine
    implements XMachine<KeypadDoorMachine.DoorState, String, String, String> {
  static final String PIN = "17";
  static final String ENTER = "ENTER";
  static final String BEEP = "BEEP";
  static final String OPEN = "OPEN";
  static final String LOCK = "LOCK";

  static enum DoorState {
    LOCKED, UNLOCKED;
  }

  private static final List<String> alphabet;
  static {
    final List<String> inputs = new ArrayList<>();
    for (int digit = 0; digit <= 9; digit++) {
      inputs.add(String.valueOf(digit));
    }
    inputs.add(ENTER);
    alphabet = Collections.unmodifiableList(inputs);
  }

  @Override
  public DoorState initialState() {
    return DoorState.LOCKED;
  }

  @Override
  public String initialMemory() {
    return "";
  }

  @Override
  public List<DoorState> states() {
    return Arrays.asList(DoorState.values());
  }

  @Override
  public List<String> inputAlphabet() {
    return alphabet;
  }

  @Override
  public ProcessingResult<DoorState, String, String> apply(final DoorState state,
      final String buffer, final String input) {
    switch (state) {
      case LOCKED:
        if (ENTER.equals(input)) {
          return PIN.equals(buffer) ? ProcessingResult.accepted(OPEN, "", DoorState.UNLOCKED)
              : ProcessingResult.rejected();
        }
        return buffer.length() < PIN.length()
            ? ProcessingResult.accepted(BEEP, buffer + input, DoorState.LOCKED)
            : ProcessingResult.rejected();
      case UNLOCKED:
        return ENTER.equals(input) ? ProcessingResult.accepted(LOCK, "", DoorState.LOCKED)
            : ProcessingResult.rejected();
      default:
        return ProcessingResult.rejected();
    }
  }

  static List<String> inputs(final String... inputs) {
    return Arrays.asList(inputs);
  }

}
