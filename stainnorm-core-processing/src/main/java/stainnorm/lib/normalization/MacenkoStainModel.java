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

import stainnorm.lib.analysis.algorithms.ColorDeconvolution;
import stainnorm.lib.analysis.algorithms.EstimateStainVectors;
import stainnorm.lib.color.StainMatrix;
import stainnorm.lib.images.RgbImage;

/**
 * Stain model using Macenko's method for stain estimation, and least-squares color deconvolution.
 * <p>
 * Two-stain matrices are completed with a residual stain before deconvolution, and the background
 * value of the matrix is set to the transmitted light intensity from the parameters.
 */
public class MacenkoStainModel implements StainModel {

	private static final Logger logger = LoggerFactory.getLogger(MacenkoStainModel.class);

	@Override
	public StainEstimationResult estimateStains(RgbImage img, NormalizationParameters params) {
		try {
			StainMatrix stains = EstimateStainVectors.estimateMacenko(img.getRGB(), params.getIo(), params.getBeta(), params.getAlpha());
			logger.debug("Estimated stains for {}: {}", img, stains);
			return StainEstimationResult.success(stains);
		} catch (IllegalArgumentException e) {
			logger.debug("Stain estimation failed for {}: {}", img, e.getLocalizedMessage());
			return StainEstimationResult.failure(e.getLocalizedMessage());
		}
	}

	@Override
	public DeconvolutionResult deconvolve(RgbImage img, StainMatrix stains, NormalizationParameters params) {
		StainMatrix stainsUsed = stains.withResidual();
		if (stainsUsed.getBackground() != params.getIo())
			stainsUsed = stainsUsed.changeBackground(params.getIo());
		double[] values = ColorDeconvolution.deconvolve(img.getRGB(), stainsUsed, null);
		return new DeconvolutionResult(ConcentrationMatrix.create(values, stainsUsed), stainsUsed);
	}

	@Override
	public String toString() {
		return "Macenko stain model";
	}

}
