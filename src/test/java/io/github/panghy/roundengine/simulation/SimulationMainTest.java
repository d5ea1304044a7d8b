package io.github.panghy.roundengine.simulation;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class SimulationMainTest {

  private final ByteArrayOutputStream out = new ByteArrayOutputStream();
  private final ByteArrayOutputStream err = new ByteArrayOutputStream();

  @Test
  public void testOutcomeMode() {
    assertEquals(SimulationMain.EXIT_OK, run("outcome", "2000", "0x2A"));
    assertThat(stdout())
        .contains("SimulationResults{trials=2000")
        .contains("targetRtp=0.9500");
    assertThat(stderr()).isEmpty();
  }

  @Test
  public void testOutcomeOutputMatchesHarness() {
    assertEquals(SimulationMain.EXIT_OK, run("OUTCOME", "1000", "2a"));
    assertThat(stdout()).contains(SimulationHarness.simulate(1000, 0x2A).toString());
  }

  @Test
  public void testOutcomeModeWithSessions() {
    assertEquals(SimulationMain.EXIT_OK, run("outcome", "1000", "2A", "3"));
    assertThat(stdout()).contains(SimulationHarness.simulateParallel(1000, 0x2A, 3).toString());
    assertThat(stdout()).contains("SimulationResults{trials=3000");
  }

  @Test
  public void testRejectedSessionCount() {
    assertEquals(SimulationMain.EXIT_USAGE, run("outcome", "1000", "2A", "0"));
    assertThat(stderr()).contains("Session count must be positive");
  }

  @Test
  public void testHazardMode() {
    assertEquals(SimulationMain.EXIT_OK, run("hazard", "500", "5EEDC0DE", "2"));
    assertThat(stdout()).startsWith("HazardSimulationResults{trials=500, cashOutAfterSteps=2");
  }

  @Test
  public void testUnknownMode() {
    assertEquals(SimulationMain.EXIT_USAGE, run("blackjack"));
    assertThat(stderr()).contains("Unknown mode: blackjack").contains("Usage:");
    assertThat(stdout()).isEmpty();
  }

  @Test
  public void testMalformedNumbers() {
    assertEquals(SimulationMain.EXIT_USAGE, run("outcome", "many"));
    assertEquals(SimulationMain.EXIT_USAGE, run("outcome", "10", "xyz"));
    assertEquals(SimulationMain.EXIT_USAGE, run("hazard", "10", "1", "three"));
    assertThat(stderr()).contains("Invalid arguments");
  }

  @Test
  public void testRejectedByHarness() {
    assertEquals(SimulationMain.EXIT_USAGE, run("outcome", "0"));
    assertEquals(SimulationMain.EXIT_USAGE, run("hazard", "10", "1", "-2"));
    assertThat(stderr()).contains("Trial count must be positive");
  }

  private int run(String... args) {
    return SimulationMain.run(args, new PrintStream(out, true, StandardCharsets.UTF_8),
        new PrintStream(err, true, StandardCharsets.UTF_8));
  }

  private String stdout() {
    return out.toString(StandardCharsets.UTF_8);
  }

  private String stderr() {
    return err.toString(StandardCharsets.UTF_8);
  }
}
