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

package stainnorm.lib.analysis.stats;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

/**
 * Percentile calculations using linear interpolation.
 * <p>
 * The i-th smallest of n sorted values is taken to be the {@code 100 * (i - 0.5) / n} percentile,
 * with linear interpolation in between and the minimum or maximum used outside this range.
 * This corresponds to {@link EstimationType#R_5}.
 */
public final class PercentileTools {

	// Suppressed default constructor for non-instantiability
	private PercentileTools() {
		throw new AssertionError();
	}

	/**
	 * Compute a percentile of an array of values.
	 * @param values the values; these are not modified
	 * @param percentile the percentile, in the range 0-100
	 * @return the percentile, or NaN if values is empty
	 * @throws IllegalArgumentException if the percentile is out of range
	 */
	public static double percentile(double[] values, double percentile) throws IllegalArgumentException {
		if (!(percentile >= 0 && percentile <= 100))
			throw new IllegalArgumentException("Percentile must be between 0 and 100, but was " + percentile);
		if (values.length == 0)
			return Double.NaN;
		if (percentile == 0) {
			double min = Double.POSITIVE_INFINITY;
			for (double v : values)
				min = Math.min(min, v);
			return min;
		}
		return new Percentile()
				.withEstimationType(EstimationType.R_5)
				.evaluate(values, percentile);
	}

	/**
	 * Compute a percentile for each column of a row-major matrix.
	 * @param values matrix values, where the entry for (row, column) is found at {@code row * nColumns + column}
	 * @param nColumns the number of columns
	 * @param percentile the percentile, in the range 0-100
	 * @return an array of length nColumns
	 */
	public static double[] columnPercentiles(double[] values, int nColumns, double percentile) {
		if (nColumns <= 0 || values.length % nColumns != 0)
			throw new IllegalArgumentException("Array length " + values.length + " is not compatible with " + nColumns + " columns");
		int nRows = values.length / nColumns;
		double[] column = new double[nRows];
		double[] result = new double[nColumns];
		for (int c = 0; c < nColumns; c++) {
			for (int r = 0; r < nRows; r++)
				column[r] = values[r * nColumns + c];
			result[c] = percentile(column, percentile);
		}
		return result;
	}

}
