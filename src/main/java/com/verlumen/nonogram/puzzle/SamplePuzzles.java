package com.verlumen.nonogram.puzzle;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.function.Supplier;

/** Built-in puzzles used by the command line and as test fixtures. */
public final class SamplePuzzles {
  /** Palette index of the tree's leaves. */
  public static final int LEAVES = 1;
  /** Palette index of the tree's trunk. */
  public static final int WOOD = 2;

  private static final ImmutableMap<String, Supplier<Puzzle>> PUZZLES =
      ImmutableMap.of("tree", SamplePuzzles::tree, "stripes", SamplePuzzles::stripes);

  /** Sky blue background, forest green leaves, saddle brown wood. */
  public static Palette treePalette() {
    return Palette.of("#87ceeb", "#228b22", "#8b4513");
  }

  public static CandidateGrid treeGrid() {
    return CandidateGrid.of(
        new int[][] {
          {0, 1, 1, 1, 0},
          {1, 1, 1, 1, 1},
          {1, 1, 2, 1, 1},
          {0, 0, 2, 0, 0},
          {0, 0, 2, 0, 0},
        });
  }

  /** A 5x5 two-color tree; the middle row mixes leaves and wood without gaps. */
  public static Puzzle tree() {
    return Puzzle.fromGrid(treePalette(), treeGrid());
  }

  public static Palette monochromePalette() {
    return Palette.of("#ffffff", "#000000");
  }

  public static CandidateGrid stripesGrid() {
    return CandidateGrid.of(
        new int[][] {
          {1, 1, 1, 1, 1},
          {1, 0, 0, 0, 1},
          {1, 1, 1, 1, 1},
          {1, 0, 0, 0, 1},
          {1, 1, 1, 1, 1},
        });
  }

  /** A 5x5 single-color puzzle with row clues [5], [1 1], [5], [1 1], [5]. */
  public static Puzzle stripes() {
    return Puzzle.fromGrid(monochromePalette(), stripesGrid());
  }

  public static ImmutableSet<String> names() {
    return PUZZLES.keySet();
  }

  /** Looks up a built-in puzzle by name. */
  public static Puzzle named(String name) {
    Supplier<Puzzle> puzzle = PUZZLES.get(name);
    if (puzzle == null) {
      throw new IllegalArgumentException(
          "Unknown puzzle: " + name + ", expected one of " + names());
    }
    return puzzle.get();
  }

  private SamplePuzzles() {}
}
