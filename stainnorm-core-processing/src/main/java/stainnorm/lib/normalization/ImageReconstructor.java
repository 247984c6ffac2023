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

package stainnorm.lib.normalization;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import stainnorm.lib.color.OpticalDensityTools;
import stainnorm.lib.color.StainMatrix;
import stainnorm.lib.common.ColorTools;
import stainnorm.lib.images.RgbImage;

/**
 * Convert stain concentrations back into an RGB image, using the Beer-Lambert model.
 * <p>
 * For each pixel, {@code rgb = background * exp(-(c . M))} where {@code M} has one row per stain.
 * Values are rounded and clipped to the range 0-255; the number of values that were outside this range
 * is reported as the gamut overflow.
 */
public class ImageReconstructor {

	private static final Logger logger = LoggerFactory.getLogger(ImageReconstructor.class);

	// Suppressed default constructor for non-instantiability
	private ImageReconstructor() {
		throw new AssertionError();
	}

	/**
	 * Reconstructed image, along with the number of channel values that needed to be clipped.
	 */
	public static class Result {

		private final RgbImage image;
		private final long gamutOverflowCount;

		private Result(RgbImage image, long gamutOverflowCount) {
			this.image = image;
			this.gamutOverflowCount = gamutOverflowCount;
		}

		/**
		 * Get the reconstructed image.
		 * @return
		 */
		public RgbImage getImage() {
			return image;
		}

		/**
		 * Get the number of channel values that were outside the range 0-255 before clipping.
		 * @return
		 */
		public long getGamutOverflowCount() {
			return gamutOverflowCount;
		}

	}

	/**
	 * Reconstruct an image from concentrations.
	 * @param concentrations concentrations, with one channel per stain
	 * @param stains stains used for reconstruction; the background value gives the transmitted light intensity
	 * @param width width of the output image
	 * @param height height of the output image
	 * @return
	 * @throws DimensionMismatchException if the dimensions are inconsistent with the concentrations or stains
	 */
	public static Result reconstruct(ConcentrationMatrix concentrations, StainMatrix stains, int width, int height) {
		int n = concentrations.getPixelCount();
		if ((long)width * height != n)
			throw new DimensionMismatchException("Image size " + width + "x" + height + " does not match the number of pixels", n, width * height);
		int nStains = concentrations.getChannelCount();
		if (stains.getStainCount() != nStains)
			throw new DimensionMismatchException("Number of stains does not match the number of concentration channels", nStains, stains.getStainCount());

		double[][] m = stains.getArray();
		double io = stains.getBackground();
		double[] values = concentrations.getValues();
		int[] rgb = new int[n];
		long overflow = 0;
		double[] od = new double[3];
		for (int i = 0; i < n; i++) {
			od[0] = 0;
			od[1] = 0;
			od[2] = 0;
			int ind = i * nStains;
			for (int k = 0; k < nStains; k++) {
				double c = values[ind + k];
				od[0] += c * m[k][0];
				od[1] += c * m[k][1];
				od[2] += c * m[k][2];
			}
			double r = OpticalDensityTools.makeIntensity(od[0], io);
			double g = OpticalDensityTools.makeIntensity(od[1], io);
			double b = OpticalDensityTools.makeIntensity(od[2], io);
			if (isOutOfGamut(r))
				overflow++;
			if (isOutOfGamut(g))
				overflow++;
			if (isOutOfGamut(b))
				overflow++;
			rgb[i] = ColorTools.packRGB(ColorTools.round255(r), ColorTools.round255(g), ColorTools.round255(b));
		}
		if (overflow > 0)
			logger.warn("{} reconstructed channel value(s) outside the range 0-255 have been clipped", overflow);
		return new Result(RgbImage.create(width, height, rgb), overflow);
	}

	private static boolean isOutOfGamut(double v) {
		return !(v >= 0 && v <= 255);
	}

}
