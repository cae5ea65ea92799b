package com.verlumen.nonogram.puzzle;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class PuzzleValidatorTest {
  private static final Palette MONOCHROME = SamplePuzzles.monochromePalette();

  @Test
  public void validate_consistentClues_returnsPuzzle() {
    Puzzle puzzle =
        PuzzleValidator.validate(
            2,
            2,
            MONOCHROME,
            ImmutableList.of(clue(Segment.of(1, 2)), clue()),
            ImmutableList.of(clue(Segment.of(1, 1)), clue(Segment.of(1, 1))));

    assertThat(puzzle.width()).isEqualTo(2);
    assertThat(puzzle.clues(LineKind.ROW, 0)).containsExactly(Segment.of(1, 2));
    assertThat(puzzle.lineLength(LineKind.COLUMN)).isEqualTo(2);
    assertThat(puzzle.lineCount(LineKind.COLUMN)).isEqualTo(2);
  }

  @Test
  public void validate_sameColorSegmentsExceedingWidth_reportsLineOverflow() {
    PuzzleValidationException thrown =
        assertThrows(
            PuzzleValidationException.class,
            () ->
                PuzzleValidator.validate(
                    3,
                    1,
                    MONOCHROME,
                    ImmutableList.of(clue(Segment.of(1, 2), Segment.of(1, 2))),
                    ImmutableList.of(clue(), clue(), clue())));

    assertThat(thrown.hasError(ValidationError.Kind.LINE_OVERFLOW)).isTrue();
    assertThat(thrown.errors()).contains(ValidationError.lineOverflow(LineKind.ROW, 0));
  }

  @Test
  public void validate_segmentLengthsSummingPastIntegerRange_reportsLineOverflow() {
    ImmutableList<Segment> huge =
        clue(Segment.of(1, Integer.MAX_VALUE), Segment.of(1, Integer.MAX_VALUE));

    PuzzleValidationException thrown =
        assertThrows(
            PuzzleValidationException.class,
            () ->
                PuzzleValidator.validate(
                    1, 1, MONOCHROME, ImmutableList.of(huge), ImmutableList.of(huge)));

    assertThat(thrown.errors()).contains(ValidationError.lineOverflow(LineKind.ROW, 0));
    assertThat(thrown.errors()).contains(ValidationError.lineOverflow(LineKind.COLUMN, 0));
  }

  @Test
  public void validate_differentColorsFillingTheLine_fit() {
    Palette palette = SamplePuzzles.treePalette();

    Puzzle puzzle =
        PuzzleValidator.validate(
            3,
            1,
            palette,
            ImmutableList.of(clue(Segment.of(1, 2), Segment.of(2, 1))),
            ImmutableList.of(
                clue(Segment.of(1, 1)), clue(Segment.of(1, 1)), clue(Segment.of(2, 1))));

    assertThat(puzzle.rowClues()).hasSize(1);
  }

  @Test
  public void validate_zeroWidth_reportsOnlyZeroDimension() {
    PuzzleValidationException thrown =
        assertThrows(
            PuzzleValidationException.class,
            () ->
                PuzzleValidator.validate(
                    0,
                    1,
                    MONOCHROME,
                    ImmutableList.of(clue(Segment.of(1, 9))),
                    ImmutableList.of()));

    assertThat(thrown.errors()).containsExactly(ValidationError.zeroDimension());
  }

  @Test
  public void validate_emptyPalette_reportsEmptyPalette() {
    PuzzleValidationException thrown =
        assertThrows(
            PuzzleValidationException.class,
            () ->
                PuzzleValidator.validate(
                    1, 1, Palette.ofRgb(), ImmutableList.of(clue()), ImmutableList.of(clue())));

    assertThat(thrown.errors()).containsExactly(ValidationError.emptyPalette());
  }

  @Test
  public void validate_collectsEveryProblem() {
    PuzzleValidationException thrown =
        assertThrows(
            PuzzleValidationException.class,
            () ->
                PuzzleValidator.validate(
                    2,
                    2,
                    MONOCHROME,
                    ImmutableList.of(clue(Segment.of(1, 0)), clue(Segment.of(5, 1))),
                    ImmutableList.of(clue())));

    assertThat(thrown.errors())
        .containsExactly(
            ValidationError.clueCountMismatch(LineKind.COLUMN),
            ValidationError.invalidSegment(LineKind.ROW, 0),
            ValidationError.unknownColor(5));
  }

  @Test
  public void validate_backgroundSegment_isInvalid() {
    PuzzleValidationException thrown =
        assertThrows(
            PuzzleValidationException.class,
            () ->
                PuzzleValidator.validate(
                    1,
                    1,
                    MONOCHROME,
                    ImmutableList.of(clue(Segment.of(Palette.BACKGROUND, 1))),
                    ImmutableList.of(clue())));

    assertThat(thrown.hasError(ValidationError.Kind.INVALID_SEGMENT)).isTrue();
  }

  @Test
  public void validate_rowsAndColumnsDisagreeOnCellCount_reportsColorCountMismatch() {
    PuzzleValidationException thrown =
        assertThrows(
            PuzzleValidationException.class,
            () ->
                PuzzleValidator.validate(
                    2,
                    2,
                    MONOCHROME,
                    ImmutableList.of(clue(Segment.of(1, 2)), clue(Segment.of(1, 2))),
                    ImmutableList.of(clue(Segment.of(1, 1)), clue(Segment.of(1, 1)))));

    assertThat(thrown.errors()).containsExactly(ValidationError.colorCountMismatch(1));
  }

  @Test
  public void fromGrid_derivesCluesOfTheDrawing() {
    Puzzle puzzle = SamplePuzzles.tree();

    assertThat(puzzle.width()).isEqualTo(5);
    assertThat(puzzle.height()).isEqualTo(5);
    assertThat(puzzle.rowClues().get(0)).containsExactly(Segment.of(SamplePuzzles.LEAVES, 3));
    assertThat(puzzle.columnClues().get(2))
        .containsExactly(Segment.of(SamplePuzzles.LEAVES, 2), Segment.of(SamplePuzzles.WOOD, 3))
        .inOrder();
  }

  @Test
  public void fromGrid_colorOutsidePalette_throws() {
    CandidateGrid grid = CandidateGrid.of(new int[][] {{0, 3}});

    PuzzleValidationException thrown =
        assertThrows(PuzzleValidationException.class, () -> Puzzle.fromGrid(MONOCHROME, grid));

    assertThat(thrown.errors()).contains(ValidationError.unknownColor(3));
  }

  @Test
  public void named_unknownPuzzle_throws() {
    assertThat(SamplePuzzles.names()).containsExactly("tree", "stripes");
    assertThrows(IllegalArgumentException.class, () -> SamplePuzzles.named("castle"));
  }

  private static ImmutableList<Segment> clue(Segment... segments) {
    return ImmutableList.copyOf(segments);
  }
}
