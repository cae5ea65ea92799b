package com.verlumen.nonogram.sweep;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.testing.fieldbinder.Bind;
import com.google.inject.testing.fieldbinder.BoundFieldModule;
import com.verlumen.nonogram.convergence.GenerationStats;
import com.verlumen.nonogram.discovery.ConfigException;
import com.verlumen.nonogram.discovery.GeneticAlgorithmOrchestrator;
import com.verlumen.nonogram.discovery.RunHandle;
import com.verlumen.nonogram.discovery.RunState;
import com.verlumen.nonogram.discovery.RunStatus;
import com.verlumen.nonogram.discovery.SolveResult;
import com.verlumen.nonogram.discovery.SolverConfig;
import com.verlumen.nonogram.puzzle.Puzzle;
import com.verlumen.nonogram.puzzle.SamplePuzzles;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnit;
import org.mockito.junit.MockitoRule;

@RunWith(JUnit4.class)
public class RunCoordinatorImplTest {
  @Rule public MockitoRule rule = MockitoJUnit.rule();

  @Mock @Bind private GeneticAlgorithmOrchestrator mockOrchestrator;

  @Inject private RunCoordinatorImpl runCoordinator;

  private Puzzle puzzle;

  @Before
  public void setUp() {
    Guice.createInjector(BoundFieldModule.of(this)).injectMembers(this);
    puzzle = SamplePuzzles.stripes();
    // Each run reports its seed as fitness and twice its seed as generations.
    when(mockOrchestrator.start(any(Puzzle.class), any(SolverConfig.class)))
        .thenAnswer(
            invocation -> {
              SolverConfig config = invocation.getArgument(1);
              long seed = config.randomSeed().get();
              return new FakeRunHandle(result(seed, (int) seed, 2 * seed, RunStatus.EXHAUSTED));
            });
  }

  @Test
  public void restarts_runsOncePerSeedInOrder() {
    ImmutableList<SolveResult> results =
        runCoordinator.restarts(puzzle, SolverConfig.defaults(), ImmutableList.of(3L, 1L, 2L));

    assertThat(results.stream().map(SolveResult::seed).collect(ImmutableList.toImmutableList()))
        .containsExactly(3L, 1L, 2L)
        .inOrder();
    ArgumentCaptor<SolverConfig> configs = ArgumentCaptor.forClass(SolverConfig.class);
    verify(mockOrchestrator, times(3)).start(any(), configs.capture());
    assertThat(configs.getAllValues().get(0).populationSize()).isEqualTo(500);
  }

  @Test
  public void sweep_collectsOneSamplePerCell() {
    ImmutableMap<String, SolverConfig> configurations =
        ImmutableMap.of(
            "small", SolverConfig.builder().setPopulationSize(20).build(),
            "large", SolverConfig.builder().setPopulationSize(80).build());

    SweepResult result =
        runCoordinator.sweep(puzzle, configurations, ImmutableList.of(4L, 2L, 6L));

    assertThat(result.samples().size()).isEqualTo(6);
    assertThat(result.samples().rowKeySet()).containsExactly("small", "large");
    assertThat(result.samples().get("large", 2L).bestFitness()).isEqualTo(2);
    assertThat(result.bestFitnessByConfiguration().get("small")).containsExactly(4, 2, 6).inOrder();
    assertThat(result.best().get().seed()).isEqualTo(2L);
  }

  @Test
  public void sweep_invalidConfiguration_startsNothing() {
    ImmutableMap<String, SolverConfig> configurations =
        ImmutableMap.of(
            "valid", SolverConfig.defaults(),
            "invalid", SolverConfig.builder().setPopulationSize(0).build());

    assertThrows(
        ConfigException.class,
        () -> runCoordinator.sweep(puzzle, configurations, ImmutableList.of(1L)));
    verifyNoInteractions(mockOrchestrator);
  }

  @Test
  public void sweep_duplicateSeeds_throws() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            runCoordinator.sweep(
                puzzle, ImmutableMap.of("a", SolverConfig.defaults()), ImmutableList.of(1L, 1L)));
  }

  @Test
  public void cancel_reachesActiveRuns() {
    FakeRunHandle active = new FakeRunHandle(result(1L, 5, 3L, RunStatus.CANCELLED));
    active.onResult = runCoordinator::cancel;
    doReturn(active).when(mockOrchestrator).start(any(Puzzle.class), any(SolverConfig.class));

    ImmutableList<SolveResult> results =
        runCoordinator.restarts(puzzle, SolverConfig.defaults(), ImmutableList.of(1L));

    assertThat(active.cancelled).isTrue();
    assertThat(results.get(0).status()).isEqualTo(RunStatus.CANCELLED);
  }

  @Test
  public void cancel_beforeStart_cancelsLaterRuns() {
    FakeRunHandle later = new FakeRunHandle(result(1L, 5, 3L, RunStatus.CANCELLED));
    doReturn(later).when(mockOrchestrator).start(any(Puzzle.class), any(SolverConfig.class));

    runCoordinator.cancel();
    runCoordinator.restarts(puzzle, SolverConfig.defaults(), ImmutableList.of(1L));

    assertThat(later.cancelled).isTrue();
  }

  @Test
  public void sweep_failingCell_cancelsTheOtherCellsAndRethrows() {
    List<FakeRunHandle> started = new ArrayList<>();
    doAnswer(
            invocation -> {
              SolverConfig config = invocation.getArgument(1);
              long seed = config.randomSeed().get();
              FakeRunHandle handle =
                  new FakeRunHandle(result(seed, (int) seed, seed, RunStatus.EXHAUSTED));
              if (seed == 2L) {
                handle.failure = new CompletionException(new IllegalStateException("boom"));
              }
              started.add(handle);
              return handle;
            })
        .when(mockOrchestrator)
        .start(any(Puzzle.class), any(SolverConfig.class));

    CompletionException thrown =
        assertThrows(
            CompletionException.class,
            () ->
                runCoordinator.sweep(
                    puzzle,
                    ImmutableMap.of("a", SolverConfig.defaults()),
                    ImmutableList.of(1L, 2L, 3L)));

    assertThat(thrown).hasCauseThat().hasMessageThat().isEqualTo("boom");
    assertThat(started).hasSize(3);
    // Cells after the failing one were never awaited and must not keep running.
    assertThat(started.get(2).cancelled).isTrue();
    assertThat(started.get(1).cancelled).isTrue();
  }

  private static SolveResult result(long seed, int fitness, long generations, RunStatus status) {
    return SolveResult.create(
        status,
        SamplePuzzles.stripesGrid(),
        fitness,
        generations,
        seed,
        Duration.ZERO,
        ImmutableList.of());
  }

  /** Hands out a fixed result and records cancellation. */
  private static final class FakeRunHandle implements RunHandle {
    private final SolveResult result;
    private Runnable onResult = () -> {};
    private RuntimeException failure;
    private volatile boolean cancelled;

    FakeRunHandle(SolveResult result) {
      this.result = result;
    }

    @Override
    public void cancel() {
      cancelled = true;
    }

    @Override
    public RunState state() {
      return RunState.valueOf(result.status().name());
    }

    @Override
    public long seed() {
      return result.seed();
    }

    @Override
    public Iterable<GenerationStats> progress() {
      return result.history();
    }

    @Override
    public SolveResult result() {
      onResult.run();
      if (failure != null) {
        throw failure;
      }
      return result;
    }
  }
}
