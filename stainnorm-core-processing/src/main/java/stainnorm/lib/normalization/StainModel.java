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

import stainnorm.lib.color.StainMatrix;
import stainnorm.lib.images.RgbImage;

/**
 * A model that can estimate stain vectors for an image, and separate an image into stain concentrations.
 * <p>
 * Implementations must be deterministic, so that the same image always gives the same result.
 */
public interface StainModel {

	/**
	 * Estimate the stains present in an image.
	 * @param img
	 * @param params
	 * @return a successful result with a stain matrix, or a failed result with a reason
	 */
	StainEstimationResult estimateStains(RgbImage img, NormalizationParameters params);

	/**
	 * Compute stain concentrations for every pixel of an image.
	 * @param img
	 * @param stains
	 * @param params
	 * @return the concentrations, and the (possibly adjusted) stain matrix that they relate to
	 */
	DeconvolutionResult deconvolve(RgbImage img, StainMatrix stains, NormalizationParameters params);

}
