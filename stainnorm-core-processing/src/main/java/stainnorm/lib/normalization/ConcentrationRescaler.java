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
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rescale source concentrations so that the robust maximum of each channel matches the target.
 * <p>
 * Each channel is scaled independently by {@code targetMax / sourceMax}, where the maxima are
 * the 99th percentiles of the channels. No clamping is applied to the result.
 * <p>
 * Residual channels are passed through unchanged.
 */
public class ConcentrationRescaler {

	private static final Logger logger = LoggerFactory.getLogger(ConcentrationRescaler.class);

	/**
	 * Percentile used as a robust maximum.
	 */
	public static final double MAX_PERCENTILE = 99.0;

	/**
	 * Source maxima no greater than this are treated as having no signal.
	 * This is the optical density of a single 8-bit intensity step at full brightness, i.e. {@code ln(256/255)}.
	 */
	public static final double DEGENERATE_TOLERANCE = Math.log(256.0 / 255.0);

	private final DegenerateChannelPolicy policy;

	private ConcentrationRescaler(DegenerateChannelPolicy policy) {
		this.policy = Objects.requireNonNull(policy);
	}

	/**
	 * Create a rescaler using the default policy for degenerate channels.
	 * @return
	 * @see DegenerateChannelPolicy#ZERO
	 */
	public static ConcentrationRescaler create() {
		return create(DegenerateChannelPolicy.ZERO);
	}

	/**
	 * Create a rescaler with the specified policy for channels whose source maximum has no usable signal.
	 * @param policy
	 * @return
	 */
	public static ConcentrationRescaler create(DegenerateChannelPolicy policy) {
		return new ConcentrationRescaler(policy);
	}

	/**
	 * Get the policy for degenerate channels.
	 * @return
	 */
	public DegenerateChannelPolicy getDegenerateChannelPolicy() {
		return policy;
	}

	/**
	 * Compute the robust maximum of each channel.
	 * @param concentrations
	 * @return
	 */
	public static double[] computeMaxima(ConcentrationMatrix concentrations) {
		return concentrations.getPercentiles(MAX_PERCENTILE);
	}

	/**
	 * Rescale source concentrations to match target concentrations.
	 * @param source
	 * @param target
	 * @return
	 * @throws DimensionMismatchException if the number of channels differs
	 * @throws DegenerateChannelException if a channel is degenerate and the policy is {@link DegenerateChannelPolicy#FAIL}
	 */
	public ConcentrationMatrix rescale(ConcentrationMatrix source, ConcentrationMatrix target) {
		checkChannels(source.getChannelCount(), target.getChannelCount());
		return rescale(source, computeMaxima(source), computeMaxima(target));
	}

	/**
	 * Rescale source concentrations using precomputed maxima.
	 * @param source
	 * @param sourceMax robust maximum of each source channel
	 * @param targetMax robust maximum of each target channel
	 * @return
	 * @throws DimensionMismatchException if the number of channels differs
	 * @throws DegenerateChannelException if a channel is degenerate and the policy is {@link DegenerateChannelPolicy#FAIL}
	 */
	public ConcentrationMatrix rescale(ConcentrationMatrix source, double[] sourceMax, double[] targetMax) {
		int nChannels = source.getChannelCount();
		checkChannels(nChannels, sourceMax.length);
		checkChannels(nChannels, targetMax.length);
		boolean[] residual = new boolean[nChannels];
		for (int c = 0; c < nChannels; c++)
			residual[c] = source.isResidual(c);
		return source.scaleChannels(computeScaleFactors(sourceMax, targetMax, residual));
	}

	/**
	 * Compute the scale factor for each channel, applying the degenerate channel policy.
	 * All channels are treated as stains.
	 * @param sourceMax
	 * @param targetMax
	 * @return
	 */
	public double[] computeScaleFactors(double[] sourceMax, double[] targetMax) {
		return computeScaleFactors(sourceMax, targetMax, new boolean[sourceMax.length]);
	}

	/**
	 * Compute the scale factor for each channel, applying the degenerate channel policy.
	 * Residual channels always have a scale factor of 1.
	 * @param sourceMax
	 * @param targetMax
	 * @param residual flags indicating which channels are residuals
	 * @return
	 */
	public double[] computeScaleFactors(double[] sourceMax, double[] targetMax, boolean[] residual) {
		checkChannels(sourceMax.length, targetMax.length);
		checkChannels(sourceMax.length, residual.length);
		double[] scales = new double[sourceMax.length];
		for (int c = 0; c < scales.length; c++) {
			double s = sourceMax[c];
			if (residual[c]) {
				scales[c] = 1.0;
			} else if (!(s > DEGENERATE_TOLERANCE) || !Double.isFinite(s)) {
				switch (policy) {
				case FAIL:
					throw new DegenerateChannelException(c, "Channel " + c + " has no signal in the source image (99th percentile = " + s + ")");
				case UNIT:
					logger.warn("Channel {} has no signal in the source image - it will not be rescaled", c);
					scales[c] = 1.0;
					break;
				case ZERO:
				default:
					logger.warn("Channel {} has no signal in the source image - it will be set to zero", c);
					scales[c] = 0.0;
					break;
				}
			} else
				scales[c] = targetMax[c] / s;
		}
		logger.debug("Scale factors: {}", Arrays.toString(scales));
		return scales;
	}

	private static void checkChannels(int expected, int actual) {
		if (expected != actual)
			throw new DimensionMismatchException("Number of concentration channels differs (" + expected + " vs " + actual + ")", expected, actual);
	}

	@Override
	public String toString() {
		return "ConcentrationRescaler [" + policy + "]";
	}

}
