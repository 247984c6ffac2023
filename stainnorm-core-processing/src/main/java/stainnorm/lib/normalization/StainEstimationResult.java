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

import java.util.Objects;

import stainnorm.lib.color.StainMatrix;

/**
 * Result of estimating stains for an image: either a stain matrix, or the reason why no stains could be estimated.
 */
public final class StainEstimationResult {

	private final StainMatrix stains;
	private final String failureReason;

	private StainEstimationResult(StainMatrix stains, String failureReason) {
		this.stains = stains;
		this.failureReason = failureReason;
	}

	/**
	 * Create a successful result.
	 * @param stains
	 * @return
	 */
	public static StainEstimationResult success(StainMatrix stains) {
		return new StainEstimationResult(Objects.requireNonNull(stains), null);
	}

	/**
	 * Create a failed result.
	 * @param reason
	 * @return
	 */
	public static StainEstimationResult failure(String reason) {
		return new StainEstimationResult(null, reason == null ? "Unknown reason" : reason);
	}

	/**
	 * Returns true if stains were estimated.
	 * @return
	 */
	public boolean isSuccess() {
		return stains != null;
	}

	/**
	 * Get the estimated stains.
	 * @return
	 * @throws IllegalStateException if estimation failed
	 */
	public StainMatrix getStains() throws IllegalStateException {
		if (stains == null)
			throw new IllegalStateException("No stains available: " + failureReason);
		return stains;
	}

	/**
	 * Get the estimated stains, or throw an exception describing the failure.
	 * @param imageName name used to identify the image in the exception message
	 * @return
	 * @throws StainEstimationException if estimation failed
	 */
	public StainMatrix getStainsOrThrow(String imageName) throws StainEstimationException {
		if (stains == null)
			throw new StainEstimationException("Unable to estimate stains for " + imageName + " image: " + failureReason);
		return stains;
	}

	/**
	 * Get the reason why estimation failed, or null if it succeeded.
	 * @return
	 */
	public String getFailureReason() {
		return failureReason;
	}

	@Override
	public String toString() {
		return isSuccess() ? "StainEstimationResult [" + stains + "]" : "StainEstimationResult [failed: " + failureReason + "]";
	}

}
