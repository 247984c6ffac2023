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

package stainnorm.lib.color;

import stainnorm.lib.common.ColorTools;

/**
 * Static methods to convert between pixel intensities and optical densities.
 * <p>
 * Optical densities use the natural logarithm, with an offset of 1 so that zero-valued pixels remain finite:
 * {@code OD = -ln((val + 1) / max)}.
 * Pixels brighter than the background give negative optical densities; these are retained so that
 * the conversion can be inverted exactly.
 */
public final class OpticalDensityTools {

	// Suppressed default constructor for non-instantiability
	private OpticalDensityTools() {
		throw new AssertionError();
	}

	/**
	 * Convert a single pixel value to an optical density as {@code -ln((val + 1) / max)}.
	 * @param val
	 * @param max transmitted light intensity (background)
	 * @return
	 */
	public static double makeOD(double val, double max) {
		return -Math.log((val + 1) / max);
	}

	/**
	 * Convert an optical density back to an intensity value, as {@code max * exp(-od)}.
	 * No clipping is applied.
	 * @param od
	 * @param max transmitted light intensity (background)
	 * @return
	 */
	public static double makeIntensity(double od, double max) {
		return max * Math.exp(-od);
	}

	/**
	 * Create an optical density lookup table with 256 entries, normalizing to the specified background value.
	 * @param maxValue
	 * @return
	 * @see #makeOD(double, double)
	 */
	public static double[] makeODLUT(double maxValue) {
		return makeODLUT(maxValue, 256);
	}

	/**
	 * Create an optical density lookup table, normalizing to the specified background value.
	 * @param maxValue background (white value)
	 * @param nValues number of values to include in the lookup table
	 * @return
	 */
	public static double[] makeODLUT(double maxValue, int nValues) {
		double[] lut = new double[nValues];
		for (int i = 0; i < nValues; i++)
			lut[i] = makeOD(i, maxValue);
		return lut;
	}

	/**
	 * Convert red channel of packed rgb pixels to optical density values, using a specified maximum value.
	 *
	 * @param rgb
	 * @param maxValue
	 * @param px optional array used for output
	 * @return
	 */
	public static double[] getRedOpticalDensities(int[] rgb, double maxValue, double[] px) {
		if (px == null)
			px = new double[rgb.length];
		double[] lut = makeODLUT(maxValue);
		for (int i = 0; i < rgb.length; i++)
			px[i] = lut[ColorTools.red(rgb[i])];
		return px;
	}

	/**
	 * Convert green channel of packed rgb pixels to optical density values, using a specified maximum value.
	 *
	 * @param rgb
	 * @param maxValue
	 * @param px optional array used for output
	 * @return
	 */
	public static double[] getGreenOpticalDensities(int[] rgb, double maxValue, double[] px) {
		if (px == null)
			px = new double[rgb.length];
		double[] lut = makeODLUT(maxValue);
		for (int i = 0; i < rgb.length; i++)
			px[i] = lut[ColorTools.green(rgb[i])];
		return px;
	}

	/**
	 * Convert blue channel of packed rgb pixels to optical density values, using a specified maximum value.
	 *
	 * @param rgb
	 * @param maxValue
	 * @param px optional array used for output
	 * @return
	 */
	public static double[] getBlueOpticalDensities(int[] rgb, double maxValue, double[] px) {
		if (px == null)
			px = new double[rgb.length];
		double[] lut = makeODLUT(maxValue);
		for (int i = 0; i < rgb.length; i++)
			px[i] = lut[ColorTools.blue(rgb[i])];
		return px;
	}

}
