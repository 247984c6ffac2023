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

/**
 * Policy to handle negative stain concentrations after deconvolution.
 * Residual channels are never modified.
 */
public enum NegativeConcentrationPolicy {

	/**
	 * Set small negative values (numerical noise) to zero, and keep larger negative values.
	 * Larger negative values occur for pixels outside the cone spanned by the stain vectors,
	 * or for pixels brighter than the background.
	 * <p>
	 * This means the concentrations used for reconstruction are <i>not</i> guaranteed to be non-negative.
	 * Keeping them allows an image normalized against itself to be reproduced within rounding error.
	 * Use {@link #CLAMP_ALL} if non-negative concentrations are required.
	 *
	 * @see ConcentrationMatrix#NEGATIVE_NOISE_TOLERANCE
	 */
	CLAMP_NOISE,

	/**
	 * Set all negative values to zero.
	 */
	CLAMP_ALL;

}
