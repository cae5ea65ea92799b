package com.verlumen.nonogram.puzzle;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Ordered colors of a puzzle. The position of a color is its index, so indices are unique and
 * contiguous from {@link #BACKGROUND}.
 */
@AutoValue
public abstract class Palette {
  /** Index reserved for empty cells. */
  public static final int BACKGROUND = 0;

  /** Creates a palette from {@code #rrggbb} strings; the first one is the background. */
  public static Palette of(String... hexColors) {
    return ofHex(ImmutableList.copyOf(hexColors));
  }

  public static Palette ofHex(List<String> hexColors) {
    ImmutableList.Builder<PaletteColor> colors = ImmutableList.builder();
    for (int i = 0; i < hexColors.size(); i++) {
      colors.add(PaletteColor.create(i, parseHex(hexColors.get(i))));
    }
    return new AutoValue_Palette(colors.build());
  }

  public static Palette ofRgb(int... rgbValues) {
    ImmutableList.Builder<PaletteColor> colors = ImmutableList.builder();
    for (int i = 0; i < rgbValues.length; i++) {
      colors.add(PaletteColor.create(i, rgbValues[i]));
    }
    return new AutoValue_Palette(colors.build());
  }

  public abstract ImmutableList<PaletteColor> colors();

  public int size() {
    return colors().size();
  }

  public boolean isEmpty() {
    return colors().isEmpty();
  }

  public boolean contains(int colorIndex) {
    return colorIndex >= 0 && colorIndex < size();
  }

  public PaletteColor get(int colorIndex) {
    checkArgument(contains(colorIndex), "Unknown color index: %s", colorIndex);
    return colors().get(colorIndex);
  }

  public String hex(int colorIndex) {
    return get(colorIndex).hex();
  }

  static int parseHex(String hexColor) {
    checkNotNull(hexColor, "Color cannot be null");
    checkArgument(
        hexColor.length() == 7 && hexColor.charAt(0) == '#',
        "Expected a color of the form #rrggbb but got: %s",
        hexColor);
    try {
      return Integer.parseInt(hexColor.substring(1), 16);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid hex color: " + hexColor, e);
    }
  }
}
