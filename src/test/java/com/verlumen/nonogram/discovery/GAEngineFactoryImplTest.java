package com.verlumen.nonogram.discovery;

import static com.google.common.truth.Truth.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.util.concurrent.MoreExecutors;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.testing.fieldbinder.Bind;
import com.google.inject.testing.fieldbinder.BoundFieldModule;
import com.verlumen.nonogram.puzzle.Puzzle;
import com.verlumen.nonogram.puzzle.SamplePuzzles;
import io.jenetics.Genotype;
import io.jenetics.IntegerGene;
import io.jenetics.Optimize;
import io.jenetics.Phenotype;
import io.jenetics.engine.Engine;
import io.jenetics.engine.EvolutionResult;
import io.jenetics.engine.EvolutionStart;
import io.jenetics.util.Factory;
import io.jenetics.util.ISeq;
import io.jenetics.util.RandomRegistry;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnit;
import org.mockito.junit.MockitoRule;

@RunWith(JUnit4.class)
public class GAEngineFactoryImplTest {
  @Rule public MockitoRule mockitoRule = MockitoJUnit.rule();

  @Bind @Mock private FitnessCalculator mockFitnessCalculator;
  @Bind private GenotypeConverter genotypeConverter = new GenotypeConverterImpl();

  @Bind @EvaluationExecutor
  private ExecutorService evaluationExecutor = MoreExecutors.newDirectExecutorService();

  @Inject private GAEngineFactoryImpl engineFactory;

  private Puzzle puzzle;

  @Before
  public void setUp() {
    Guice.createInjector(BoundFieldModule.of(this)).injectMembers(this);
    puzzle = SamplePuzzles.tree();
    when(mockFitnessCalculator.createFitnessFunction(any(Puzzle.class), any(SolverConfig.class)))
        .thenReturn(genotype -> 7);
  }

  @Test
  public void createEngine_survivorsAreExactlyTheElite() {
    SolverConfig config = SolverConfig.builder().setPopulationSize(40).setEliteCount(3).build();

    Engine<IntegerGene, Integer> engine = engineFactory.createEngine(puzzle, config);

    assertThat(engine.populationSize()).isEqualTo(40);
    assertThat(engine.survivorsSize()).isEqualTo(3);
    assertThat(engine.offspringSize()).isEqualTo(37);
    assertThat(engine.optimize()).isEqualTo(Optimize.MINIMUM);
    verify(mockFitnessCalculator).createFitnessFunction(puzzle, config);
  }

  @Test
  public void createEngine_evolvesPopulationOfConfiguredSize() {
    SolverConfig config =
        SolverConfig.builder()
            .setPopulationSize(20)
            .setEliteCount(2)
            .setMutationStrategy(MutationStrategy.SEGMENT_SLIDE)
            .setParallelEvaluation(false)
            .build();
    Engine<IntegerGene, Integer> engine = engineFactory.createEngine(puzzle, config);
    Factory<Genotype<IntegerGene>> factory = engineFactory.createGenotypeFactory(puzzle, config);

    EvolutionResult<IntegerGene, Integer> result =
        RandomRegistry.with(
            new Random(1),
            r ->
                engine.evolve(
                    EvolutionStart.of(
                        ISeq.of(engine.genotypeFactory()::newInstance, 20)
                            .map(gt -> Phenotype.<IntegerGene, Integer>of(gt, 1)),
                        1)));

    assertThat(result.population().length()).isEqualTo(20);
    assertThat(result.bestPhenotype().fitness()).isEqualTo(7);
    assertThat(factory.newInstance().length()).isEqualTo(puzzle.height());
  }

  @Test
  public void createGenotypeFactory_rowSeeded_satisfiesEveryRow() {
    Factory<Genotype<IntegerGene>> factory =
        engineFactory.createGenotypeFactory(puzzle, SolverConfig.defaults());

    Genotype<IntegerGene> genotype = RandomRegistry.with(new Random(2), r -> factory.newInstance());

    assertThat(genotypeConverter.toGrid(genotype).rowClues()).isEqualTo(puzzle.rowClues());
  }
}
