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
 * Policy to apply when the 99th percentile of a source stain channel is too small to use for rescaling,
 * i.e. no greater than {@link ConcentrationRescaler#DEGENERATE_TOLERANCE}.
 */
public enum DegenerateChannelPolicy {

	/**
	 * Scale the channel by zero, i.e. remove its contribution to the output.
	 */
	ZERO,

	/**
	 * Leave the channel unscaled.
	 */
	UNIT,

	/**
	 * Throw a {@link DegenerateChannelException}.
	 */
	FAIL;

}
