package com.github.xmachine;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.Test;

import com.github.xmachine.Diagnostic.Kind;
import com.github.xmachine.GeneratorConfiguration.GeneratorConfigurationBuilder;
import com.github.xmachine.KeypadDoorMachine.DoorState;
import com.github.xmachine.TestSuiteGenerator.TestSuiteGeneratorBuilder;
import com.github.xmachine.XMachineException.Code;

/**
 * End to end tests of test suite generation.
 */
public class TestSuiteGeneratorTest {
  private static final Logger logger =
      LogManager.getLogger(TestSuiteGeneratorTest.class.getSimpleName());

  @Test
  public void testKeypadDoorScenario() throws XMachineException {
    final KeypadDoorMachine machine = new KeypadDoorMachine();
    final TestSuiteGenerator<DoorState, String, String, String> generator =
        TestSuiteGeneratorBuilder.newBuilder(machine).build();
    final TestSuite<DoorState, String, String> suite = generator.generate();
    logger.info(suite.render());

    assertTrue(suite.getDiagnostics().isEmpty());
    assertEquals(22, suite.getConformanceTests().size());
    assertEquals(22, suite.getRobustnessTests().size());
    assertEquals(44, suite.size());
    assertEquals("T0001 Conformance [0, 0]", suite.getTests().get(0).getName());
    assertTrue(suite.getTests().get(22).getName().startsWith("T0023 Robustness: "));
    assertEquals(Collections.singletonList(KeypadDoorMachine.inputs("0")),
        suite.getCharacterizingSet());

    // the PIN is found and LOCKED is told apart from UNLOCKED by a test longer than one input
    boolean distinguishing = false;
    for (final TestCase<String, String> test : suite.getConformanceTests()) {
      if (test.getInputs().equals(KeypadDoorMachine.inputs("1", "7", "ENTER", "0", "0"))) {
        distinguishing = true;
        assertTrue(test.getExpectedOutputs().get(3).isRejected());
      }
    }
    assertTrue(distinguishing);

    // ENTER after two digits that are not the PIN must be refused
    boolean wrongPin = false;
    for (final TestCase<String, String> test : suite.getRobustnessTests()) {
      final List<String> inputs = test.getInputs();
      final int enter = inputs.indexOf(KeypadDoorMachine.ENTER);
      if (enter == 2 && !KeypadDoorMachine.PIN.equals(inputs.get(0) + inputs.get(1))) {
        wrongPin = true;
        assertTrue(test.getExpectedOutputs().get(enter).isRejected());
      }
    }
    assertTrue(wrongPin);

    // a door that opens for any two digits is caught by the robustness tests
    final MachineRunner<DoorState, String, String, String> careless =
        new MachineRunner<>(new AnyPinDoor());
    int caught = 0;
    for (final TestCase<String, String> test : suite.getRobustnessTests()) {
      if (test.firstDivergence(careless.run(test.getInputs())) != -1) {
        caught++;
      }
    }
    assertTrue(caught > 0);

    // expected outputs agree with a plain run of the model
    final MachineRunner<DoorState, String, String, String> runner = new MachineRunner<>(machine);
    for (final TestCase<String, String> test : suite.getTests()) {
      assertEquals(test.getName(), -1, test.firstDivergence(runner.run(test.getInputs())));
    }

    final GenerationStatistics statistics = suite.getStatistics();
    assertEquals(generator.getId(), statistics.getGeneratorId());
    assertEquals(22, statistics.getConformanceTests());
    assertEquals(22, statistics.getRobustnessTests());
    assertTrue(statistics.getModelQueries() > 0);
    assertTrue(statistics.getSearches() >= 1);
    assertEquals(0, statistics.getExhaustedSearches());
  }

  @Test
  public void testDeterministicAcrossRunsAndWorkers() throws XMachineException {
    final GeneratorConfiguration single = GeneratorConfigurationBuilder.newBuilder().maxDepth(6)
        .maxConfigurations(1_000).retryBudgetFactor(2).workerThreads(1).build();
    final GeneratorConfiguration pooled = GeneratorConfigurationBuilder.newBuilder().maxDepth(6)
        .maxConfigurations(1_000).retryBudgetFactor(2).workerThreads(4).build();

    final String first = TestSuiteGeneratorBuilder.newBuilder(MaintenanceMachine.unbounded())
        .config(single).build().generate().render();
    final String second = TestSuiteGeneratorBuilder.newBuilder(MaintenanceMachine.unbounded())
        .config(single).build().generate().render();
    final String parallel = TestSuiteGeneratorBuilder.newBuilder(MaintenanceMachine.unbounded())
        .config(pooled).build().generate().render();
    assertEquals(first, second);
    assertEquals(first, parallel);

    final String keypad = TestSuiteGeneratorBuilder.newBuilder(new KeypadDoorMachine())
        .config(pooled).build().generate().render();
    assertEquals(keypad, TestSuiteGeneratorBuilder.newBuilder(new KeypadDoorMachine()).build()
        .generate().render());
  }

  @Test
  public void testUnreachableMaintenance() throws XMachineException {
    final TestSuite<String, String, String> suite =
        TestSuiteGeneratorBuilder.newBuilder(MaintenanceMachine.capped()).build().generate();
    final List<Diagnostic> unreachable = suite.getDiagnostics(Kind.UNREACHABLE_STATE);
    assertEquals(1, unreachable.size());
    assertEquals(MaintenanceMachine.MAINTENANCE, unreachable.get(0).getState());
    assertEquals(-1, suite.getAutomaton().idOf(MaintenanceMachine.MAINTENANCE));
    assertFalse(suite.getTests().isEmpty());
    for (final TestCase<String, String> test : suite.getTests()) {
      assertFalse(test.getName().contains(MaintenanceMachine.MAINTENANCE));
    }
    assertTrue(suite.render().contains("UNREACHABLE_STATE [state=MAINTENANCE"));
  }

  @Test
  public void testBudgetExhaustionReported() throws XMachineException {
    final GeneratorConfiguration config = GeneratorConfigurationBuilder.newBuilder().maxDepth(6)
        .maxConfigurations(1_000).retryBudgetFactor(2).build();
    final TestSuite<String, String, String> suite = TestSuiteGeneratorBuilder
        .newBuilder(MaintenanceMachine.unbounded()).config(config).build().generate();
    assertEquals(4, suite.getDiagnostics(Kind.EXPLORATION_BUDGET_EXHAUSTED).size());
    assertEquals(1, suite.getDiagnostics(Kind.UNREACHABLE_STATE).size());
    assertTrue(suite.getStatistics().getExhaustedSearches() > 0);
    assertFalse(suite.getConformanceTests().isEmpty());
  }

  @Test
  public void testIncompleteSpecificationWithoutRobustness() throws XMachineException {
    final GeneratorConfiguration config =
        GeneratorConfigurationBuilder.newBuilder().robustnessTests(false).build();
    final TestSuite<DoorState, String, String> suite = TestSuiteGeneratorBuilder
        .newBuilder(new KeypadDoorMachine()).config(config).build().generate();
    assertTrue(suite.getRobustnessTests().isEmpty());
    final List<Diagnostic> incomplete = suite.getDiagnostics(Kind.INCOMPLETE_SPECIFICATION);
    assertEquals(1, incomplete.size());
    assertTrue(incomplete.get(0).getMessage().contains("(UNLOCKED, 0)"));
    assertTrue(incomplete.get(0).getMessage().contains("(UNLOCKED, 9)"));
  }

  @Test
  public void testNonDeterministicModel() throws XMachineException {
    final TestSuiteGenerator<String, String, String, Integer> generator =
        TestSuiteGeneratorBuilder.newBuilder(new FlakyMachine()).build();
    try {
      generator.generate();
      fail("Expected the model to be rejected");
    } catch (XMachineException expected) {
      assertEquals(Code.NON_DETERMINISTIC_MODEL, expected.getCode());
      assertTrue(expected.getMessage().contains("state=S"));
      assertTrue(expected.getMessage().contains("input=go"));
    }

    // without the check the flaky model goes unnoticed
    final GeneratorConfiguration unchecked =
        GeneratorConfigurationBuilder.newBuilder().verifyDeterminism(false).build();
    assertNotEquals(0, TestSuiteGeneratorBuilder.newBuilder(new FlakyMachine()).config(unchecked)
        .build().generate().size());
  }

  @Test
  public void testMalformedAlphabet() throws XMachineException {
    final TableMachine duplicates = new TableMachine(Arrays.asList("a", "a"),
        new int[][] {{0, 0}}, new String[][] {{"x", "x"}});
    assertCode(Code.MALFORMED_ALPHABET, duplicates);

    final TableMachine nulls = new TableMachine(Arrays.asList("a", null), new int[][] {{0, 0}},
        new String[][] {{"x", "x"}});
    assertCode(Code.MALFORMED_ALPHABET, nulls);

    final TableMachine empty = new TableMachine(Collections.<String>emptyList(), new int[][] {{}},
        new String[][] {{}});
    assertCode(Code.MALFORMED_ALPHABET, empty);
  }

  @Test
  public void testModelFailure() throws XMachineException {
    final TestSuiteGenerator<String, String, String, Integer> generator =
        TestSuiteGeneratorBuilder.newBuilder(new BrokenMachine("S")).build();
    try {
      generator.generate();
      fail("Expected the model failure to surface");
    } catch (XMachineException expected) {
      assertEquals(Code.MODEL_FAILURE, expected.getCode());
      assertTrue(expected.getCause() instanceof IllegalStateException);
    }
  }

  @Test
  public void testUndeclaredStates() throws XMachineException {
    final TestSuiteGenerator<String, String, String, Integer> generator =
        TestSuiteGeneratorBuilder.newBuilder(new BrokenMachine("Z")).build();
    try {
      generator.generate();
      fail("Expected the undeclared next state to be caught");
    } catch (XMachineException expected) {
      assertEquals(Code.INVALID_MODEL, expected.getCode());
    }

    final FlakyMachine lost = new FlakyMachine() {
      @Override
      public String initialState() {
        return "nowhere";
      }
    };
    assertCode(Code.INVALID_MODEL, lost);
  }

  private static <S, I, O, M> void assertCode(final Code code,
      final XMachine<S, I, O, M> machine) {
    try {
      TestSuiteGeneratorBuilder.newBuilder(machine).build();
      fail("Expected " + code);
    } catch (XMachineException expected) {
      assertEquals(code, expected.getCode());
    }
  }

  /**
   * The keypad door with a guard that only counts digits: ENTER opens it on any full buffer.
   */
  static final class AnyPinDoor implements XMachine<DoorState, String, String, String> {
    private final KeypadDoorMachine door = new KeypadDoorMachine();

    @Override
    public DoorState initialState() {
      return door.initialState();
    }

    @Override
    public String initialMemory() {
      return door.initialMemory();
    }

    @Override
    public List<DoorState> states() {
      return door.states();
    }

    @Override
    public List<String> inputAlphabet() {
      return door.inputAlphabet();
    }

    @Override
    public ProcessingResult<DoorState, String, String> apply(final DoorState state,
        final String buffer, final String input) {
      if (state == DoorState.LOCKED && KeypadDoorMachine.ENTER.equals(input)
          && buffer.length() == KeypadDoorMachine.PIN.length()) {
        return ProcessingResult.accepted(KeypadDoorMachine.OPEN, "", DoorState.UNLOCKED);
      }
      return door.apply(state, buffer, input);
    }
  }

  /**
   * Answers differently every time it is asked.
   */
  static class FlakyMachine implements XMachine<String, String, String, Integer> {
    private final AtomicInteger calls = new AtomicInteger();

    @Override
    public String initialState() {
      return "S";
    }

    @Override
    public Integer initialMemory() {
      return 0;
    }

    @Override
    public List<String> states() {
      return Collections.singletonList("S");
    }

    @Override
    public List<String> inputAlphabet() {
      return Collections.singletonList("go");
    }

    @Override
    public ProcessingResult<String, String, Integer> apply(final String state,
        final Integer memory, final String input) {
      return ProcessingResult.accepted("out" + calls.incrementAndGet() % 2, memory, state);
    }
  }

  /**
   * Throws on the first input and moves to the given state on the second.
   */
  static final class BrokenMachine implements XMachine<String, String, String, Integer> {
    private final String target;

    BrokenMachine(final String target) {
      this.target = target;
    }

    @Override
    public String initialState() {
      return "S";
    }

    @Override
    public Integer initialMemory() {
      return 0;
    }

    @Override
    public List<String> states() {
      return Collections.singletonList("S");
    }

    @Override
    public List<String> inputAlphabet() {
      return "S".equals(target) ? Collections.singletonList("boom")
          : Collections.singletonList("jump");
    }

    @Override
    public ProcessingResult<String, String, Integer> apply(final String state,
        final Integer memory, final String input) {
      if ("boom".equals(input)) {
        throw new IllegalStateException("boom");
      }
      return ProcessingResult.accepted("jumped", memory, target);
    }
  }

}
