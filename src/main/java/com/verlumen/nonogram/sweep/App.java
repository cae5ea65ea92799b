package com.verlumen.nonogram.sweep;

import com.google.common.flogger.FluentLogger;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.verlumen.nonogram.discovery.ConfigException;
import com.verlumen.nonogram.discovery.CrossoverStrategy;
import com.verlumen.nonogram.discovery.GeneticAlgorithmOrchestrator;
import com.verlumen.nonogram.discovery.MutationStrategy;
import com.verlumen.nonogram.discovery.SeedingStrategy;
import com.verlumen.nonogram.discovery.SolveResult;
import com.verlumen.nonogram.discovery.SolverConfig;
import com.verlumen.nonogram.puzzle.Puzzle;
import com.verlumen.nonogram.puzzle.SamplePuzzles;
import java.time.Duration;
import java.util.List;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.impl.Arguments;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;

/**
 * Command-line entry point. Solves one of the built-in puzzles, or runs the hyperparameter study
 * over it and reports the best configuration.
 */
final class App {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final GeneticAlgorithmOrchestrator orchestrator;
  private final RunCoordinator runCoordinator;

  @Inject
  App(GeneticAlgorithmOrchestrator orchestrator, RunCoordinator runCoordinator) {
    this.orchestrator = orchestrator;
    this.runCoordinator = runCoordinator;
  }

  SolveResult solve(Puzzle puzzle, SolverConfig config) {
    logger.atInfo().log("Solving a %dx%d puzzle", puzzle.width(), puzzle.height());
    SolveResult result = orchestrator.solve(puzzle, config);
    logger.atInfo().log(
        "%s with fitness %d after %d generations (seed %d):%n%s",
        result.status(),
        result.bestFitness(),
        result.generations(),
        result.seed(),
        result.bestGrid());
    return result;
  }

  SweepResult anova(Puzzle puzzle, SolverConfig base, List<Long> seeds) {
    SweepResult result = runCoordinator.sweep(puzzle, SweepPlan.anova(base), seeds);
    result
        .best()
        .ifPresentOrElse(
            best ->
                logger.atInfo().log(
                    "The best score was %d with [%s] and seed %d",
                    best.bestFitness(), best.configuration(), best.seed()),
            () -> logger.atInfo().log("A valid combination wasn't found"));
    return result;
  }

  /** Cancels whatever is still running. */
  void shutdown() {
    logger.atInfo().log("Shutting down solver...");
    runCoordinator.cancel();
  }

  public static void main(String[] args) {
    ArgumentParser parser = createArgumentParser();
    Namespace namespace;
    try {
      namespace = parser.parseArgs(args);
    } catch (ArgumentParserException e) {
      parser.handleError(e);
      System.exit(2);
      return;
    }

    Puzzle puzzle = SamplePuzzles.named(namespace.getString("puzzle"));
    SolverConfig config;
    try {
      config = toConfig(namespace).validate();
    } catch (ConfigException e) {
      logger.atSevere().log("%s", e.getMessage());
      System.exit(2);
      return;
    }

    App app = Guice.createInjector(SolverModule.create()).getInstance(App.class);
    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(
                () -> {
                  logger.atInfo().log("Shutdown hook triggered");
                  app.shutdown();
                }));

    if ("anova".equals(namespace.getString("mode"))) {
      app.anova(puzzle, config, namespace.getList("seeds"));
    } else {
      app.solve(puzzle, config);
    }
  }

  static SolverConfig toConfig(Namespace namespace) {
    SolverConfig.Builder builder =
        SolverConfig.builder()
            .setPopulationSize(namespace.getInt("populationSize"))
            .setEliteCount(namespace.getInt("eliteCount"))
            .setTournamentSize(namespace.getInt("tournamentSize"))
            .setCrossoverRate(namespace.getDouble("crossoverRate"))
            .setMutationRate(namespace.getDouble("mutationRate"))
            .setMaxGenerations(namespace.getInt("maxGenerations"))
            .setStagnationLimit(namespace.getInt("stagnationLimit"))
            .setSlideTries(namespace.getInt("slideTries"))
            .setSeedingStrategy(SeedingStrategy.valueOf(namespace.getString("seeding")))
            .setCrossoverStrategy(CrossoverStrategy.valueOf(namespace.getString("crossover")))
            .setMutationStrategy(MutationStrategy.valueOf(namespace.getString("mutation")))
            .setParallelEvaluation(!namespace.getBoolean("sequential"));
    Long seed = namespace.getLong("seed");
    if (seed != null) {
      builder.setRandomSeed(seed);
    }
    Integer penalty = namespace.getInt("colorMismatchPenalty");
    if (penalty != null) {
      builder.setColorMismatchPenalty(penalty);
    }
    Long timeLimitSeconds = namespace.getLong("timeLimitSeconds");
    if (timeLimitSeconds != null) {
      builder.setTimeLimit(Duration.ofSeconds(timeLimitSeconds));
    }
    return builder.build();
  }

  static ArgumentParser createArgumentParser() {
    SolverConfig defaults = SolverConfig.defaults();
    ArgumentParser parser =
        ArgumentParsers.newFor("NonogramSolver")
            .build()
            .defaultHelp(true)
            .description("Genetic-algorithm solver for colored nonograms");

    parser.addArgument("--puzzle")
        .choices(SamplePuzzles.names())
        .setDefault("tree")
        .help("Built-in puzzle to solve");

    parser.addArgument("--mode")
        .choices("solve", "anova")
        .setDefault("solve")
        .help("Solve once, or run the hyperparameter study");

    // Hyperparameters
    parser.addArgument("--populationSize")
        .type(Integer.class)
        .setDefault(defaults.populationSize())
        .help("Individuals per generation");

    parser.addArgument("--eliteCount")
        .type(Integer.class)
        .setDefault(defaults.eliteCount())
        .help("Best individuals carried over unchanged");

    parser.addArgument("--tournamentSize")
        .type(Integer.class)
        .setDefault(defaults.tournamentSize())
        .help("Contestants per selection tournament");

    parser.addArgument("--crossoverRate")
        .type(Double.class)
        .setDefault(defaults.crossoverRate())
        .help("Probability that an offspring is recombined");

    parser.addArgument("--mutationRate")
        .type(Double.class)
        .setDefault(defaults.mutationRate())
        .help("Per-cell repaint probability, or per-attempt slide probability");

    parser.addArgument("--maxGenerations")
        .type(Integer.class)
        .setDefault(defaults.maxGenerations())
        .help("Generation budget");

    parser.addArgument("--stagnationLimit")
        .type(Integer.class)
        .setDefault(defaults.stagnationLimit())
        .help("Generations without improvement before giving up, 0 disables");

    parser.addArgument("--slideTries")
        .type(Integer.class)
        .setDefault(defaults.slideTries())
        .help("Slide attempts per row for SEGMENT_SLIDE mutation");

    parser.addArgument("--seeding")
        .choices("ROW_SEEDED", "UNIFORM_RANDOM")
        .setDefault(defaults.seedingStrategy().name())
        .help("How the first population is drawn");

    parser.addArgument("--crossover")
        .choices("UNIFORM_ROWS", "TWO_POINT_ROWS", "MIXED")
        .setDefault(defaults.crossoverStrategy().name())
        .help("Row crossover variant");

    parser.addArgument("--mutation")
        .choices("RANDOM_CELL", "SEGMENT_SLIDE")
        .setDefault(defaults.mutationStrategy().name())
        .help("Mutation operator");

    parser.addArgument("--colorMismatchPenalty")
        .type(Integer.class)
        .help("Fixed color mismatch penalty; defaults to the scored line's length");

    parser.addArgument("--timeLimitSeconds")
        .type(Long.class)
        .help("Wall-clock budget per run");

    parser.addArgument("--sequential")
        .action(Arguments.storeTrue())
        .help("Score individuals on the search thread instead of the worker pool");

    // Seeds
    parser.addArgument("--seed")
        .type(Long.class)
        .help("Random seed of a single solve; drawn at random when absent");

    parser.addArgument("--seeds")
        .type(Long.class)
        .nargs("+")
        .setDefault(SweepPlan.ANOVA_SEEDS)
        .help("Replicate seeds of the hyperparameter study");

    return parser;
  }
}
