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

import stainnorm.lib.color.StainMatrix;
import stainnorm.lib.images.RgbImage;

/**
 * Output of stain normalization, along with the intermediate values that determined it.
 */
public final class NormalizationResult {

	private final RgbImage image;
	private final StainMatrix sourceStains;
	private final StainMatrix targetStains;
	private final double[] sourceMaxima;
	private final double[] targetMaxima;
	private final int[] stainOrder;
	private final long gamutOverflowCount;
	private final boolean sourceFallbackUsed;

	NormalizationResult(RgbImage image, StainMatrix sourceStains, StainMatrix targetStains,
			double[] sourceMaxima, double[] targetMaxima, int[] stainOrder,
			long gamutOverflowCount, boolean sourceFallbackUsed) {
		this.image = image;
		this.sourceStains = sourceStains;
		this.targetStains = targetStains;
		this.sourceMaxima = sourceMaxima.clone();
		this.targetMaxima = targetMaxima.clone();
		this.stainOrder = stainOrder.clone();
		this.gamutOverflowCount = gamutOverflowCount;
		this.sourceFallbackUsed = sourceFallbackUsed;
	}

	/**
	 * Get the normalized image, which has the same size as the source image.
	 * @return
	 */
	public RgbImage getImage() {
		return image;
	}

	/**
	 * Get the stains used to deconvolve the source image, in the order used for rescaling.
	 * @return
	 */
	public StainMatrix getSourceStains() {
		return sourceStains;
	}

	/**
	 * Get the stains used to deconvolve the target image, and to reconstruct the normalized image.
	 * @return
	 */
	public StainMatrix getTargetStains() {
		return targetStains;
	}

	/**
	 * Get the 99th percentile of each source concentration channel, in the order used for rescaling.
	 * @return
	 */
	public double[] getSourceMaxima() {
		return sourceMaxima.clone();
	}

	/**
	 * Get the 99th percentile of each target concentration channel.
	 * @return
	 */
	public double[] getTargetMaxima() {
		return targetMaxima.clone();
	}

	/**
	 * Get the zero-based order in which source channels were matched to target channels.
	 * @return
	 */
	public int[] getStainOrder() {
		return stainOrder.clone();
	}

	/**
	 * Get the number of channel values that were clipped during reconstruction.
	 * @return
	 */
	public long getGamutOverflowCount() {
		return gamutOverflowCount;
	}

	/**
	 * Returns true if stains could not be estimated for the source image, and the target stains were used instead.
	 * @return
	 */
	public boolean isSourceFallbackUsed() {
		return sourceFallbackUsed;
	}

	@Override
	public String toString() {
		return "NormalizationResult [image=" + image + ", stainOrder=" + Arrays.toString(stainOrder)
				+ ", sourceMaxima=" + Arrays.toString(sourceMaxima) + ", targetMaxima=" + Arrays.toString(targetMaxima)
				+ ", gamutOverflow=" + gamutOverflowCount + ", sourceFallback=" + sourceFallbackUsed + "]";
	}

}
