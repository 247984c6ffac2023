/*-
 * #%L
 * This file is part of StainNorm.
 * %%
 * Copyright (C) 2024 StainNorm developers
 * %%
 * StainNorm is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * StainNorm is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with StainNorm.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package stainnorm.lib.common;

/**
 * Static functions to help work with packed RGB values.
 * <p>
 * Packed values follow {@link java.awt.Color}, i.e. {@code 0xAARRGGBB}.
 */
public final class ColorTools {

	// Static methods only
	private ColorTools() {
		throw new AssertionError();
	}

	/**
	 * Packed RGB representation of white.
	 */
	public static final int WHITE = packRGB(255, 255, 255);

	/**
	 * Packed RGB representation of black.
	 */
	public static final int BLACK = packRGB(0, 0, 0);

	/**
	 * Pack red, green and blue values into an opaque RGB int.
	 * This is equivalent to an ARGB value with alpha set to 255.
	 * <p>
	 * Only the lowest 8 bits of each value are kept.
	 *
	 * @param r
	 * @param g
	 * @param b
	 * @return packed ARGB value
	 * @see #packClippedRGB(int, int, int)
	 */
	public static int packRGB(int r, int g, int b) {
		return (0xff << 24) +
			   ((r & 0xff) << 16) +
			   ((g & 0xff) << 8) +
			    (b & 0xff);
	}

	/**
	 * Pack red, green and blue values into an opaque RGB int, after clipping each to 0-255.
	 *
	 * @param r
	 * @param g
	 * @param b
	 * @return packed ARGB value
	 * @see #packRGB(int, int, int)
	 */
	public static int packClippedRGB(int r, int g, int b) {
		return packRGB(do8BitRangeCheck(r), do8BitRangeCheck(g), do8BitRangeCheck(b));
	}

	/**
	 * Clip an integer value to the range 0-255.
	 * @param v
	 * @return
	 */
	public static int do8BitRangeCheck(int v) {
		return v < 0 ? 0 : (v > 255 ? 255 : v);
	}

	/**
	 * Get the alpha component (0-255) of a packed ARGB value.
	 *
	 * @param argb
	 * @return
	 */
	public static int alpha(int argb) {
		return (argb >> 24) & 0xff;
	}

	/**
	 * Get the red component (0-255) of a packed RGB value.
	 *
	 * @param rgb
	 * @return
	 */
	public static int red(int rgb) {
		return (rgb >> 16) & 0xff;
	}

	/**
	 * Get the green component (0-255) of a packed RGB value.
	 *
	 * @param rgb
	 * @return
	 */
	public static int green(int rgb) {
		return (rgb >> 8) & 0xff;
	}

	/**
	 * Get the blue component (0-255) of a packed RGB value.
	 *
	 * @param rgb
	 * @return
	 */
	public static int blue(int rgb) {
		return (rgb & 0xff);
	}

	/**
	 * Convert a double value to an int, rounding and clipping to the range 0-255.
	 * NaN is converted to 0.
	 * @param val
	 * @return
	 */
	public static int round255(double val) {
		if (Double.isNaN(val))
			return 0;
		return (int)Math.round(Math.min(255, Math.max(val, 0)));
	}

}
