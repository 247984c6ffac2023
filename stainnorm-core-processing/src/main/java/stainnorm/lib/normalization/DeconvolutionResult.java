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
 * Result of color deconvolution: the stain concentrations, and the stain matrix that was actually used.
 * <p>
 * The stain matrix may differ from the one that was requested, e.g. if a residual stain was added.
 * The concentration channels always correspond to the stains of the returned matrix.
 */
public final class DeconvolutionResult {

	private final ConcentrationMatrix concentrations;
	private final StainMatrix stains;

	/**
	 * Constructor.
	 * @param concentrations
	 * @param stains
	 * @throws DimensionMismatchException if the number of channels does not match the number of stains
	 */
	public DeconvolutionResult(ConcentrationMatrix concentrations, StainMatrix stains) {
		this.concentrations = Objects.requireNonNull(concentrations);
		this.stains = Objects.requireNonNull(stains);
		if (concentrations.getChannelCount() != stains.getStainCount())
			throw new DimensionMismatchException("Concentration channels do not match the number of stains",
					stains.getStainCount(), concentrations.getChannelCount());
	}

	/**
	 * Get the concentrations.
	 * @return
	 */
	public ConcentrationMatrix getConcentrations() {
		return concentrations;
	}

	/**
	 * Get the stain matrix used for deconvolution.
	 * @return
	 */
	public StainMatrix getStains() {
		return stains;
	}

}
