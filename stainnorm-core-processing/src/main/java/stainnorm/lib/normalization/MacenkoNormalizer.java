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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import stainnorm.lib.color.StainMatrix;
import stainnorm.lib.color.StainVector;
import stainnorm.lib.common.GeneralTools;
import stainnorm.lib.images.RgbImage;
import stainnorm.lib.normalization.StainMatcher.StainMatchers;

/**
 * Stain normalization using the method of Macenko et al.
 * <p>
 * Stains are estimated and separated for both the source and the target image.
 * The source concentrations are rescaled so that the 99th percentile of each channel matches the target,
 * and the result is reconstructed using the target stains.
 * <p>
 * Instances are immutable and can be shared between threads.
 */
public class MacenkoNormalizer {

	private static final Logger logger = LoggerFactory.getLogger(MacenkoNormalizer.class);

	/**
	 * Stains whose total angle differs by less than this (in degrees) are treated as equally well matched.
	 */
	private static final double FLIP_ANGLE_TOLERANCE = 1e-6;

	private final NormalizationParameters params;
	private final StainModel stainModel;
	private final StainMatcher stainMatcher;
	private final ConcentrationRescaler rescaler;
	private final List<NormalizationListener> listeners;

	private MacenkoNormalizer(Builder builder) {
		this.params = builder.params;
		this.stainModel = builder.stainModel;
		this.stainMatcher = builder.stainMatcher;
		this.rescaler = ConcentrationRescaler.create(params.getDegenerateChannelPolicy());
		this.listeners = Collections.unmodifiableList(new ArrayList<>(builder.listeners));
	}

	/**
	 * Create a normalizer with default parameters.
	 * @return
	 */
	public static MacenkoNormalizer create() {
		return builder().build();
	}

	/**
	 * Create a normalizer with the specified parameters.
	 * @param params
	 * @return
	 */
	public static MacenkoNormalizer create(NormalizationParameters params) {
		return builder().parameters(params).build();
	}

	/**
	 * Create a builder to customize a normalizer.
	 * @return
	 */
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Normalize an image using optional parameters.
	 * @param source image to normalize
	 * @param target image with the desired stain appearance
	 * @param io transmitted light intensity, or null to use the default
	 * @param beta optical density threshold, or null to use the default
	 * @param alpha percentile for robust angle extremes, or null to use the default
	 * @return the normalized image
	 */
	public static RgbImage normalizeMacenko(RgbImage source, RgbImage target, Double io, Double beta, Double alpha) {
		var params = NormalizationParameters.builder()
				.io(io)
				.beta(beta)
				.alpha(alpha)
				.build();
		return create(params).normalize(source, target);
	}

	/**
	 * Get the parameters.
	 * @return
	 */
	public NormalizationParameters getParameters() {
		return params;
	}

	/**
	 * Get the stain model.
	 * @return
	 */
	public StainModel getStainModel() {
		return stainModel;
	}

	/**
	 * Get the stain matcher.
	 * @return
	 */
	public StainMatcher getStainMatcher() {
		return stainMatcher;
	}

	/**
	 * Normalize an image given as a [y][x][channel] array.
	 * @param source
	 * @param target
	 * @return the normalized image as a [y][x][channel] array
	 * @throws MissingInputException if either image is null or empty
	 */
	public int[][][] normalize(int[][][] source, int[][][] target) {
		return normalize(toImage(source, "Source"), toImage(target, "Target")).toChannels();
	}

	/**
	 * Normalize an image.
	 * @param source
	 * @param target
	 * @return the normalized image, with the same size as the source
	 */
	public RgbImage normalize(RgbImage source, RgbImage target) {
		return normalizeWithDetails(source, target).getImage();
	}

	/**
	 * Normalize an image, returning the intermediate values along with the normalized image.
	 * @param source
	 * @param target
	 * @return
	 * @throws MissingInputException if either image is null or empty
	 * @throws StainEstimationException if stains cannot be estimated
	 * @throws DimensionMismatchException if the source and target have different numbers of stains
	 * @throws DegenerateChannelException if a channel is degenerate and the policy is {@link DegenerateChannelPolicy#FAIL}
	 */
	public NormalizationResult normalizeWithDetails(RgbImage source, RgbImage target) {
		checkInput(source, "Source");
		checkInput(target, "Target");

		// Target
		StainMatrix targetEstimate = stainModel.estimateStains(target, params).getStainsOrThrow("target");
		DeconvolutionResult targetDeconvolved = stainModel.deconvolve(target, targetEstimate, params);
		StainMatrix targetStains = targetDeconvolved.getStains();
		ConcentrationMatrix targetConcentrations = targetDeconvolved.getConcentrations()
				.clampNegatives(params.getNegativeConcentrationPolicy());

		// Source
		StainEstimationResult sourceEstimation = stainModel.estimateStains(source, params);
		boolean fallback = false;
		StainMatrix sourceEstimate;
		if (sourceEstimation.isSuccess()) {
			sourceEstimate = sourceEstimation.getStains();
		} else if (params.isSourceFallback()) {
			logger.warn("Unable to estimate source stains ({}) - target stains will be used instead", sourceEstimation.getFailureReason());
			sourceEstimate = targetEstimate;
			fallback = true;
		} else
			sourceEstimate = sourceEstimation.getStainsOrThrow("source");

		if (sourceEstimate.getEstimatedStainCount() != targetEstimate.getEstimatedStainCount())
			throw new DimensionMismatchException("Source and target have different numbers of stains",
					targetEstimate.getEstimatedStainCount(), sourceEstimate.getEstimatedStainCount());

		DeconvolutionResult sourceDeconvolved = stainModel.deconvolve(source, sourceEstimate, params);
		StainMatrix sourceStains = sourceDeconvolved.getStains();
		ConcentrationMatrix sourceConcentrations = sourceDeconvolved.getConcentrations()
				.clampNegatives(params.getNegativeConcentrationPolicy());

		if (sourceConcentrations.getChannelCount() != targetConcentrations.getChannelCount())
			throw new DimensionMismatchException("Source and target have different numbers of concentration channels",
					targetConcentrations.getChannelCount(), sourceConcentrations.getChannelCount());

		// Match stains
		int[] order = stainMatcher.match(sourceStains, targetStains);
		StainMatrix.checkPermutation(order, sourceConcentrations.getChannelCount());
		if (!fallback)
			checkStainOrder(sourceStains, targetStains, order);
		sourceConcentrations = sourceConcentrations.permuteChannels(order);
		sourceStains = sourceStains.permute(order);
		sourceConcentrations = alignResiduals(sourceConcentrations, sourceStains, targetStains);

		// Rescale & reconstruct
		double[] sourceMaxima = ConcentrationRescaler.computeMaxima(sourceConcentrations);
		double[] targetMaxima = ConcentrationRescaler.computeMaxima(targetConcentrations);
		ConcentrationMatrix scaled = rescaler.rescale(sourceConcentrations, sourceMaxima, targetMaxima);
		var reconstructed = ImageReconstructor.reconstruct(scaled, targetStains, source.getWidth(), source.getHeight());

		var result = new NormalizationResult(reconstructed.getImage(), sourceStains, targetStains,
				sourceMaxima, targetMaxima, order, reconstructed.getGamutOverflowCount(), fallback);

		if (params.isVerbose())
			logSummary(result);
		else
			logger.debug("Normalization complete: {}", result);

		for (var listener : listeners)
			listener.normalizationComplete(source, target, result);

		return result;
	}

	/**
	 * Log a warning if a different order of the source stains would better match the target stains.
	 */
	private static void checkStainOrder(StainMatrix sourceStains, StainMatrix targetStains, int[] order) {
		int[] best = StainMatchers.bestAngleOrder(sourceStains, targetStains);
		double chosenAngle = StainMatchers.totalAngle(sourceStains, targetStains, order);
		double bestAngle = StainMatchers.totalAngle(sourceStains, targetStains, best);
		if (bestAngle < chosenAngle - FLIP_ANGLE_TOLERANCE) {
			logger.warn("Source and target stains may be in a different order: stain order {} would reduce the total angle from {} to {} degrees",
					Arrays.toString(best),
					GeneralTools.formatNumber(chosenAngle, 2),
					GeneralTools.formatNumber(bestAngle, 2));
		}
	}

	/**
	 * Negate residual channels where the source residual stain points away from the target residual stain,
	 * so that the unexplained optical density keeps its sign during reconstruction.
	 */
	private static ConcentrationMatrix alignResiduals(ConcentrationMatrix sourceConcentrations, StainMatrix sourceStains, StainMatrix targetStains) {
		int nChannels = sourceConcentrations.getChannelCount();
		double[] signs = new double[nChannels];
		boolean flip = false;
		for (int k = 0; k < nChannels; k++) {
			signs[k] = 1.0;
			var sourceStain = sourceStains.getStain(k + 1);
			var targetStain = targetStains.getStain(k + 1);
			if (sourceStain.isResidual() && targetStain.isResidual() && StainVector.computeAngle(sourceStain, targetStain) > 90) {
				logger.debug("Residual stain {} points away from the target residual - concentrations will be negated", k + 1);
				signs[k] = -1.0;
				flip = true;
			}
		}
		return flip ? sourceConcentrations.scaleChannels(signs) : sourceConcentrations;
	}

	private static void logSummary(NormalizationResult result) {
		logger.info("Target stains: {}", result.getTargetStains());
		logger.info("Source stains: {}", result.getSourceStains());
		logger.info("Stain order: {}", Arrays.toString(result.getStainOrder()));
		logger.info("Source maxima: {}", GeneralTools.arrayToString(Locale.US, result.getSourceMaxima(), 4));
		logger.info("Target maxima: {}", GeneralTools.arrayToString(Locale.US, result.getTargetMaxima(), 4));
		if (result.isSourceFallbackUsed())
			logger.info("Target stains were used for the source image");
		logger.info("Gamut overflow: {} value(s)", result.getGamutOverflowCount());
	}

	private static void checkInput(RgbImage img, String name) {
		if (img == null || img.getPixelCount() == 0)
			throw new MissingInputException(name + " image is missing or empty");
	}

	private static RgbImage toImage(int[][][] pixels, String name) {
		if (pixels == null || pixels.length == 0 || pixels[0] == null || pixels[0].length == 0)
			throw new MissingInputException(name + " image is missing or empty");
		try {
			return RgbImage.fromChannels(pixels);
		} catch (IllegalArgumentException e) {
			throw new MissingInputException(name + " image is not a valid RGB image: " + e.getLocalizedMessage());
		}
	}

	@Override
	public String toString() {
		return "MacenkoNormalizer [" + params + ", " + stainModel + ", " + stainMatcher + "]";
	}


	/**
	 * Builder for {@link MacenkoNormalizer}.
	 */
	public static class Builder {

		private NormalizationParameters params = NormalizationParameters.getDefault();
		private StainModel stainModel = new MacenkoStainModel();
		private StainMatcher stainMatcher = StainMatcher.identity();
		private List<NormalizationListener> listeners = new ArrayList<>();

		private Builder() {}

		/**
		 * Set the parameters.
		 * @param params
		 * @return this builder
		 */
		public Builder parameters(NormalizationParameters params) {
			this.params = Objects.requireNonNull(params);
			return this;
		}

		/**
		 * Set the stain model used for stain estimation and deconvolution.
		 * @param stainModel
		 * @return this builder
		 */
		public Builder stainModel(StainModel stainModel) {
			this.stainModel = Objects.requireNonNull(stainModel);
			return this;
		}

		/**
		 * Set the strategy used to match source stains to target stains.
		 * @param stainMatcher
		 * @return this builder
		 */
		public Builder stainMatcher(StainMatcher stainMatcher) {
			this.stainMatcher = Objects.requireNonNull(stainMatcher);
			return this;
		}

		/**
		 * Add a listener to be notified after each normalization.
		 * @param listener
		 * @return this builder
		 */
		public Builder addListener(NormalizationListener listener) {
			this.listeners.add(Objects.requireNonNull(listener));
			return this;
		}

		/**
		 * Build the normalizer.
		 * @return
		 */
		public MacenkoNormalizer build() {
			return new MacenkoNormalizer(this);
		}

	}

}
