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
 * Exception thrown when the number of stains (or concentration channels) differs between two images,
 * or when pixel counts are inconsistent with the requested image dimensions.
 */
public class DimensionMismatchException extends StainNormalizationException {

	private static final long serialVersionUID = 1L;

	private final int expected;
	private final int actual;

	/**
	 * Constructor.
	 * @param message
	 * @param expected the expected size
	 * @param actual the size that was found
	 */
	public DimensionMismatchException(String message, int expected, int actual) {
		super(message + " (expected " + expected + ", found " + actual + ")");
		this.expected = expected;
		this.actual = actual;
	}

	/**
	 * Get the expected size.
	 * @return
	 */
	public int getExpected() {
		return expected;
	}

	/**
	 * Get the size that was found.
	 * @return
	 */
	public int getActual() {
		return actual;
	}

}
