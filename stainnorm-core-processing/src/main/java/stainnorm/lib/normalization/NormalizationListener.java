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

import stainnorm.lib.images.RgbImage;

/**
 * Listener notified whenever a normalization completes successfully.
 */
public interface NormalizationListener {

	/**
	 * Called after normalization.
	 * @param source the source image
	 * @param target the target image
	 * @param result the result, including the normalized image
	 */
	void normalizationComplete(RgbImage source, RgbImage target, NormalizationResult result);

}
