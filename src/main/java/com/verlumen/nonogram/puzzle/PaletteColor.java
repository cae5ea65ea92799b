package com.verlumen.nonogram.puzzle;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;

/** A palette entry: its stable index and a 24-bit RGB value. */
@AutoValue
public abstract class PaletteColor {
  static PaletteColor create(int index, int rgb) {
    checkArgument(index >= 0, "Color index must be non-negative: %s", index);
    checkArgument((rgb & ~0xFFFFFF) == 0, "RGB value out of range: %s", rgb);
    return new AutoValue_PaletteColor(index, rgb);
  }

  public abstract int index();

  public abstract int rgb();

  public int red() {
    return (rgb() >> 16) & 0xFF;
  }

  public int green() {
    return (rgb() >> 8) & 0xFF;
  }

  public int blue() {
    return rgb() & 0xFF;
  }

  public boolean isBackground() {
    return index() == Palette.BACKGROUND;
  }

  /** Renders the color as {@code #rrggbb}. */
  public String hex() {
    return String.format("#%06x", rgb());
  }
}
