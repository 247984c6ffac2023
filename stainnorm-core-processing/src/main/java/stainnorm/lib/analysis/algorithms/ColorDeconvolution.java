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

package stainnorm.lib.analysis.algorithms;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import stainnorm.lib.color.OpticalDensityTools;
import stainnorm.lib.color.StainMatrix;

/**
 * Color deconvolution of packed RGB pixels into stain concentrations.
 * <p>
 * For each pixel, the concentrations {@code c} solve {@code c . M = od} in the least-squares sense,
 * where {@code M} has one row per stain and {@code od} contains the red, green and blue optical densities.
 * A pseudo-inverse is used so that rank-deficient stain matrices (e.g. with collinear stains) give the
 * minimum-norm solution.
 */
public class ColorDeconvolution {

	private static final Logger logger = LoggerFactory.getLogger(ColorDeconvolution.class);

	/**
	 * Singular values below this fraction of the largest singular value are treated as zero.
	 */
	public static final double SINGULAR_VALUE_TOLERANCE = 1e-10;

	/**
	 * Compute the Moore-Penrose pseudo-inverse of a K x 3 stain array (one row per stain).
	 *
	 * @param stainArray
	 * @return a 3 x K array
	 */
	public static double[][] computePseudoInverse(double[][] stainArray) {
		RealMatrix mat = MatrixUtils.createRealMatrix(stainArray);
		SingularValueDecomposition svd = new SingularValueDecomposition(mat);
		double[] singularValues = svd.getSingularValues();
		double tol = singularValues[0] * SINGULAR_VALUE_TOLERANCE;

		RealMatrix u = svd.getU();
		RealMatrix v = svd.getV();
		int rank = 0;
		double[] inverseValues = new double[singularValues.length];
		for (int i = 0; i < singularValues.length; i++) {
			if (singularValues[i] > tol) {
				inverseValues[i] = 1.0 / singularValues[i];
				rank++;
			}
		}
		if (rank < stainArray.length)
			logger.debug("Stain matrix is rank deficient (rank {} for {} stains), using minimum-norm solution", rank, stainArray.length);

		// pinv = V * S^+ * U^T
		RealMatrix sInv = MatrixUtils.createRealDiagonalMatrix(inverseValues);
		return v.multiply(sInv).multiply(u.transpose()).getData();
	}

	/**
	 * Deconvolve packed RGB pixels using the specified stains.
	 * <p>
	 * All stains in the matrix are used, in order; no residual is added here.
	 *
	 * @param rgb packed RGB pixels
	 * @param stains the stain matrix, which also provides the background value used to compute optical densities
	 * @param output optional output array of length {@code rgb.length * nStains}
	 * @return row-major concentrations, where the value for pixel i and stain k is at {@code i * nStains + k}
	 */
	public static double[] deconvolve(int[] rgb, StainMatrix stains, double[] output) {
		int nStains = stains.getStainCount();
		int n = rgb.length;
		if (output == null || output.length < n * nStains)
			output = new double[n * nStains];

		double[][] pinv = computePseudoInverse(stains.getArray());

		double[] red = OpticalDensityTools.getRedOpticalDensities(rgb, stains.getBackground(), null);
		double[] green = OpticalDensityTools.getGreenOpticalDensities(rgb, stains.getBackground(), null);
		double[] blue = OpticalDensityTools.getBlueOpticalDensities(rgb, stains.getBackground(), null);

		for (int i = 0; i < n; i++) {
			double r = red[i];
			double g = green[i];
			double b = blue[i];
			int ind = i * nStains;
			for (int k = 0; k < nStains; k++)
				output[ind + k] = r * pinv[0][k] + g * pinv[1][k] + b * pinv[2][k];
		}
		return output;
	}

}
