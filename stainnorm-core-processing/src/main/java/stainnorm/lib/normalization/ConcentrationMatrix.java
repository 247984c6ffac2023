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

import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import stainnorm.lib.analysis.stats.PercentileTools;
import stainnorm.lib.color.StainMatrix;

/**
 * Immutable N x K matrix of stain concentrations, with one row per pixel and one column (channel) per stain.
 * <p>
 * Rows follow the row-major pixel order of {@link stainnorm.lib.images.RgbImage}.
 * Channels may be flagged as residual, i.e. corresponding to a stain computed orthogonal to the real stains.
 */
public final class ConcentrationMatrix {

	private static final Logger logger = LoggerFactory.getLogger(ConcentrationMatrix.class);

	/**
	 * Negative values greater than {@code -NEGATIVE_NOISE_TOLERANCE} are considered to be numerical noise.
	 */
	public static final double NEGATIVE_NOISE_TOLERANCE = 1e-6;

	private final int nPixels;
	private final int nChannels;
	private final double[] values;
	private final boolean[] residual;

	private ConcentrationMatrix(int nPixels, int nChannels, double[] values, boolean[] residual) {
		this.nPixels = nPixels;
		this.nChannels = nChannels;
		this.values = values;
		this.residual = residual;
	}

	/**
	 * Create a concentration matrix.
	 *
	 * @param nPixels number of rows
	 * @param nChannels number of columns
	 * @param values row-major values; the array is copied
	 * @param residual optional flags indicating which channels are residuals; may be null if there are none
	 * @return
	 * @throws IllegalArgumentException if array lengths do not match the dimensions
	 */
	public static ConcentrationMatrix create(int nPixels, int nChannels, double[] values, boolean[] residual) throws IllegalArgumentException {
		if (nPixels <= 0 || nChannels <= 0)
			throw new IllegalArgumentException("Concentration matrix dimensions must be > 0, but were " + nPixels + "x" + nChannels);
		if (values == null || values.length != nPixels * nChannels)
			throw new IllegalArgumentException("Expected " + (nPixels * nChannels) + " values, but got " + (values == null ? "null" : values.length));
		if (residual != null && residual.length != nChannels)
			throw new IllegalArgumentException("Expected " + nChannels + " residual flags, but got " + residual.length);
		return new ConcentrationMatrix(nPixels, nChannels, values.clone(),
				residual == null ? new boolean[nChannels] : residual.clone());
	}

	/**
	 * Create a concentration matrix for values computed using a stain matrix.
	 * The residual flags are taken from the stains.
	 *
	 * @param values row-major values; the array is copied
	 * @param stains the stains used to compute the values
	 * @return
	 */
	public static ConcentrationMatrix create(double[] values, StainMatrix stains) {
		int nChannels = stains.getStainCount();
		boolean[] residual = new boolean[nChannels];
		for (int k = 0; k < nChannels; k++)
			residual[k] = stains.getStains().get(k).isResidual();
		if (values == null || values.length % nChannels != 0)
			throw new IllegalArgumentException("Number of values is not compatible with " + nChannels + " stains");
		return create(values.length / nChannels, nChannels, values, residual);
	}

	/**
	 * Get the number of pixels (rows).
	 * @return
	 */
	public int getPixelCount() {
		return nPixels;
	}

	/**
	 * Get the number of channels (columns).
	 * @return
	 */
	public int getChannelCount() {
		return nChannels;
	}

	/**
	 * Get a single value.
	 * @param pixel
	 * @param channel
	 * @return
	 */
	public double get(int pixel, int channel) {
		return values[pixel * nChannels + channel];
	}

	/**
	 * Returns true if the specified channel is a residual.
	 * @param channel
	 * @return
	 */
	public boolean isResidual(int channel) {
		return residual[channel];
	}

	/**
	 * Get a copy of all values for one channel.
	 * @param channel
	 * @return
	 */
	public double[] getChannel(int channel) {
		double[] arr = new double[nPixels];
		for (int i = 0; i < nPixels; i++)
			arr[i] = values[i * nChannels + channel];
		return arr;
	}

	/**
	 * Get a copy of all values, in row-major order.
	 * @return
	 */
	public double[] getValues() {
		return values.clone();
	}

	/**
	 * Compute the specified percentile of every channel.
	 * @param percentile percentile, between 0 and 100
	 * @return an array with one entry per channel
	 */
	public double[] getPercentiles(double percentile) {
		return PercentileTools.columnPercentiles(values, nChannels, percentile);
	}

	/**
	 * Create a new matrix with channels reordered.
	 * @param order zero-based indices, where {@code order[i]} gives the channel of this matrix that becomes channel i
	 * @return
	 */
	public ConcentrationMatrix permuteChannels(int... order) {
		StainMatrix.checkPermutation(order, nChannels);
		double[] output = new double[values.length];
		boolean[] residual2 = new boolean[nChannels];
		for (int k = 0; k < nChannels; k++)
			residual2[k] = residual[order[k]];
		for (int i = 0; i < nPixels; i++) {
			int ind = i * nChannels;
			for (int k = 0; k < nChannels; k++)
				output[ind + k] = values[ind + order[k]];
		}
		return new ConcentrationMatrix(nPixels, nChannels, output, residual2);
	}

	/**
	 * Create a new matrix with each channel multiplied by a scale factor.
	 * @param scales one scale factor per channel
	 * @return
	 */
	public ConcentrationMatrix scaleChannels(double... scales) {
		if (scales.length != nChannels)
			throw new DimensionMismatchException("Wrong number of scale factors", nChannels, scales.length);
		double[] output = new double[values.length];
		for (int i = 0; i < values.length; i++)
			output[i] = values[i] * scales[i % nChannels];
		return new ConcentrationMatrix(nPixels, nChannels, output, residual);
	}

	/**
	 * Create a new matrix with negative values of non-residual channels set to zero, according to a policy.
	 * @param policy
	 * @return the new matrix, or this matrix if no values needed to change
	 */
	public ConcentrationMatrix clampNegatives(NegativeConcentrationPolicy policy) {
		double[] output = null;
		int nBelowTolerance = 0;
		for (int i = 0; i < values.length; i++) {
			double v = values[i];
			if (!(v < 0) || residual[i % nChannels])
				continue;
			boolean isNoise = v >= -NEGATIVE_NOISE_TOLERANCE;
			if (!isNoise)
				nBelowTolerance++;
			if (isNoise || policy == NegativeConcentrationPolicy.CLAMP_ALL) {
				if (output == null)
					output = values.clone();
				output[i] = 0;
			}
		}
		if (nBelowTolerance > 0)
			logger.debug("{} concentration value(s) below -{} ({})", nBelowTolerance, NEGATIVE_NOISE_TOLERANCE,
					policy == NegativeConcentrationPolicy.CLAMP_ALL ? "set to zero" : "kept");
		if (output == null)
			return this;
		return new ConcentrationMatrix(nPixels, nChannels, output, residual);
	}

	@Override
	public int hashCode() {
		return 31 * (31 * nChannels + Arrays.hashCode(residual)) + Arrays.hashCode(values);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof ConcentrationMatrix))
			return false;
		ConcentrationMatrix other = (ConcentrationMatrix)obj;
		return nPixels == other.nPixels && nChannels == other.nChannels &&
				Arrays.equals(residual, other.residual) && Arrays.equals(values, other.values);
	}

	@Override
	public String toString() {
		return "ConcentrationMatrix (" + nPixels + "x" + nChannels + ")";
	}

}
