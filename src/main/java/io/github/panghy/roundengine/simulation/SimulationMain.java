package io.github.panghy.roundengine.simulation;

import io.github.panghy.roundengine.error.RoundEngineException;
import io.github.panghy.roundengine.outcome.OutcomeTuning;

import java.io.PrintStream;
import java.util.Locale;

/**
 * Command line entry point for offline calibration runs.
 *
 * <pre>
 * outcome [trials] [seedHex] [sessions]
 * hazard  [trials] [seedHex] [cashOutSteps]
 * </pre>
 *
 * <p>Trials default to {@value SimulationHarness#DEFAULT_TRIALS}, the seed to
 * {@code 5EEDC0DE}, the session count to 1 and the cash-out step to 3. With
 * more than one session, trials are per session and the session seeds are
 * derived from the given seed.</p>
 */
public final class SimulationMain {

  static final int EXIT_OK = 0;
  static final int EXIT_USAGE = 2;

  private static final int DEFAULT_CASH_OUT_STEPS = 3;

  private SimulationMain() {
  }

  public static void main(String[] args) {
    int exitCode = run(args, System.out, System.err);
    if (exitCode != EXIT_OK) {
      System.exit(exitCode);
    }
  }

  static int run(String[] args, PrintStream out, PrintStream err) {
    String mode = args.length >= 1 ? args[0].toLowerCase(Locale.ROOT) : "outcome";
    try {
      long trials = args.length >= 2 ? Long.parseLong(args[1]) : SimulationHarness.DEFAULT_TRIALS;
      long seed = args.length >= 3 ? parseSeed(args[2]) : SimulationHarness.DEFAULT_SEED;
      switch (mode) {
        case "outcome": {
          OutcomeTuning tuning = OutcomeTuning.defaults();
          int sessions = args.length >= 4 ? Integer.parseInt(args[3]) : 1;
          SimulationResults results = sessions == 1
              ? SimulationHarness.simulate(trials, seed, tuning)
              : SimulationHarness.simulateParallel(trials, seed, sessions, tuning);
          out.println(results);
          out.printf(Locale.ROOT, "expectedRtp=%.4f targetRtp=%.4f%n", tuning.expectedRtp(), tuning.getTargetRtp());
          return EXIT_OK;
        }
        case "hazard": {
          int cashOutSteps = args.length >= 4 ? Integer.parseInt(args[3]) : DEFAULT_CASH_OUT_STEPS;
          out.println(SimulationHarness.simulateHazard(trials, seed, cashOutSteps));
          return EXIT_OK;
        }
        default:
          err.println("Unknown mode: " + args[0]);
          printUsage(err);
          return EXIT_USAGE;
      }
    } catch (NumberFormatException | RoundEngineException e) {
      err.println("Invalid arguments: " + e.getMessage());
      printUsage(err);
      return EXIT_USAGE;
    }
  }

  private static long parseSeed(String text) {
    String hex = text.startsWith("0x") || text.startsWith("0X") ? text.substring(2) : text;
    return Long.parseLong(hex, 16);
  }

  private static void printUsage(PrintStream err) {
    err.println("Usage: outcome [trials] [seedHex] [sessions] | hazard [trials] [seedHex] [cashOutSteps]");
  }
}
