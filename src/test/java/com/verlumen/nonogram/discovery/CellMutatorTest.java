package com.verlumen.nonogram.discovery;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.Range;
import com.verlumen.nonogram.puzzle.CandidateGrid;
import com.verlumen.nonogram.puzzle.SamplePuzzles;
import io.jenetics.AltererResult;
import io.jenetics.IntegerGene;
import io.jenetics.Phenotype;
import io.jenetics.util.ISeq;
import io.jenetics.util.RandomRegistry;
import java.util.Random;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class CellMutatorTest {
  private final GenotypeConverter converter = new GenotypeConverterImpl();

  @Test
  public void mutate_zeroRate_leavesGridIdentical() {
    CandidateGrid grid = SamplePuzzles.treeGrid();

    int changes = new CellMutator(0.0, converter, 3).mutate(grid, new Random(1));

    assertThat(changes).isEqualTo(0);
    assertThat(grid).isEqualTo(SamplePuzzles.treeGrid());
  }

  @Test
  public void mutate_fullRate_repaintsWithinPalette() {
    CandidateGrid grid = CandidateGrid.blank(10, 10);

    int changes = new CellMutator(1.0, converter, 3).mutate(grid, new Random(2));

    assertThat(changes).isGreaterThan(0);
    for (int row = 0; row < grid.height(); row++) {
      for (int color : grid.row(row)) {
        assertThat(color).isIn(Range.closedOpen(0, 3));
      }
    }
  }

  @Test
  public void alter_zeroRate_keepsEveryPhenotype() {
    Phenotype<IntegerGene, Integer> parent =
        Phenotype.<IntegerGene, Integer>of(converter.toGenotype(SamplePuzzles.treeGrid(), 3), 1)
            .withFitness(0);
    CellMutator mutator = new CellMutator(0.0, converter, 3);

    AltererResult<IntegerGene, Integer> result =
        RandomRegistry.with(new Random(3), r -> mutator.alter(ISeq.of(parent), 2));

    assertThat(result.alterations()).isEqualTo(0);
    assertThat(result.population().get(0)).isSameInstanceAs(parent);
  }

  @Test
  public void alter_changedIndividual_needsEvaluation() {
    Phenotype<IntegerGene, Integer> parent =
        Phenotype.<IntegerGene, Integer>of(converter.toGenotype(CandidateGrid.blank(6, 6), 3), 1)
            .withFitness(40);
    CellMutator mutator = new CellMutator(1.0, converter, 3);

    AltererResult<IntegerGene, Integer> result =
        RandomRegistry.with(new Random(4), r -> mutator.alter(ISeq.of(parent), 2));

    assertThat(result.alterations()).isGreaterThan(0);
    assertThat(result.population().get(0).isEvaluated()).isFalse();
    assertThat(result.population().get(0).generation()).isEqualTo(2L);
  }

  @Test
  public void constructor_negativeRate_throws() {
    assertThrows(IllegalArgumentException.class, () -> new CellMutator(-0.1, converter, 3));
  }
}
