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

import java.util.Arrays;
import java.util.Comparator;
import java.util.Locale;
import java.util.stream.IntStream;

import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import stainnorm.lib.analysis.stats.PercentileTools;
import stainnorm.lib.color.OpticalDensityTools;
import stainnorm.lib.color.StainMatrix;
import stainnorm.lib.color.StainVector;
import stainnorm.lib.color.StainVector.DefaultStains;
import stainnorm.lib.common.GeneralTools;

/**
 * Estimate stain vectors automatically from an image, using the method of Macenko et al.
 * <p>
 * See 'A method for normalizing histology slides for quantitative analysis', ISBI 2009.
 * Optical densities of sufficiently-stained pixels are projected onto the plane spanned by the two
 * main eigenvectors of their covariance matrix, and the stain vectors are taken from robust extremes
 * of the angle within that plane.
 */
public class EstimateStainVectors {

	private static final Logger logger = LoggerFactory.getLogger(EstimateStainVectors.class);

	/**
	 * Stain vectors closer than this angle (in degrees) are reported as collinear.
	 */
	private static final double MIN_SEPARATION_DEGREES = 1.0;

	/**
	 * Estimate hematoxylin and eosin stain vectors from packed RGB pixels.
	 *
	 * @param rgb packed RGB pixels
	 * @param io transmitted light intensity
	 * @param beta optical density threshold; pixels are used only if all channels have an optical density &gt;= beta
	 * @param alpha percentile (0-50) used to determine the pseudo-min and pseudo-max angles
	 * @return a stain matrix containing two stains, with the stain having the larger red optical density first
	 * @throws IllegalArgumentException if too few pixels remain after thresholding
	 */
	public static StainMatrix estimateMacenko(final int[] rgb, final double io, final double beta, final double alpha) throws IllegalArgumentException {
		return estimateMacenko(rgb, io, beta, alpha,
				DefaultStains.HEMATOXYLIN.toString(), DefaultStains.EOSIN.toString());
	}

	/**
	 * Estimate two stain vectors from packed RGB pixels.
	 *
	 * @param rgb packed RGB pixels
	 * @param io transmitted light intensity
	 * @param beta optical density threshold; pixels are used only if all channels have an optical density &gt;= beta
	 * @param alpha percentile (0-50) used to determine the pseudo-min and pseudo-max angles
	 * @param name1 name of the first stain (the one with the larger red optical density)
	 * @param name2 name of the second stain
	 * @return
	 * @throws IllegalArgumentException if too few pixels remain after thresholding
	 */
	public static StainMatrix estimateMacenko(final int[] rgb, final double io, final double beta, final double alpha,
			final String name1, final String name2) throws IllegalArgumentException {

		int n = rgb.length;
		double[] red = OpticalDensityTools.getRedOpticalDensities(rgb, io, null);
		double[] green = OpticalDensityTools.getGreenOpticalDensities(rgb, io, null);
		double[] blue = OpticalDensityTools.getBlueOpticalDensities(rgb, io, null);

		// Discard transparent pixels, i.e. those with a low optical density in any channel
		int keepCount = 0;
		for (int i = 0; i < n; i++) {
			double r = red[i];
			double g = green[i];
			double b = blue[i];
			if (r < beta || g < beta || b < beta)
				continue;
			red[keepCount] = r;
			green[keepCount] = g;
			blue[keepCount] = b;
			keepCount++;
		}
		if (keepCount <= 1)
			throw new IllegalArgumentException("Not enough pixels remain after applying stain thresholds! (" + keepCount + "/" + n + " pixels have OD >= " + beta + ")");
		logger.debug("Estimating stains from {}/{} pixels", keepCount, n);

		red = Arrays.copyOf(red, keepCount);
		green = Arrays.copyOf(green, keepCount);
		blue = Arrays.copyOf(blue, keepCount);

		double[][] cov = new double[3][3];
		cov[0][0] = covariance(red, red);
		cov[1][1] = covariance(green, green);
		cov[2][2] = covariance(blue, blue);
		cov[0][1] = covariance(red, green);
		cov[0][2] = covariance(red, blue);
		cov[1][2] = covariance(green, blue);
		cov[2][1] = cov[1][2];
		cov[2][0] = cov[0][2];
		cov[1][0] = cov[0][1];

		RealMatrix mat = MatrixUtils.createRealMatrix(cov);
		if (logger.isTraceEnabled()) {
			for (double[] row : mat.getData())
				logger.trace("Covariance: {}", GeneralTools.arrayToString(Locale.US, row, 6));
		}

		EigenDecomposition eigen = new EigenDecomposition(mat);
		double[] eigenValues = eigen.getRealEigenvalues();
		int[] eigenOrder = rank(eigenValues);
		double[] eigen1 = eigen.getEigenvector(eigenOrder[2]).toArray();
		double[] eigen2 = eigen.getEigenvector(eigenOrder[1]).toArray();
		// Make the vectors point into the positive red half-space
		if (eigen1[0] < 0)
			negate(eigen1);
		if (eigen2[0] < 0)
			negate(eigen2);
		logger.debug("First eigenvector: {}", GeneralTools.arrayToString(Locale.US, eigen1, 4));
		logger.debug("Second eigenvector: {}", GeneralTools.arrayToString(Locale.US, eigen2, 4));

		// Angle of each pixel within the plane, relative to the first eigenvector
		double[] phi = new double[keepCount];
		for (int i = 0; i < keepCount; i++) {
			double r = red[i];
			double g = green[i];
			double b = blue[i];
			phi[i] = Math.atan2(
					r*eigen2[0] + g*eigen2[1] + b*eigen2[2],
					r*eigen1[0] + g*eigen1[1] + b*eigen1[2]);
		}

		double minPhi = PercentileTools.percentile(phi, alpha);
		double maxPhi = PercentileTools.percentile(phi, 100 - alpha);

		double[] v1 = fromAngle(eigen1, eigen2, minPhi);
		double[] v2 = fromAngle(eigen1, eigen2, maxPhi);

		// Hematoxylin is expected to have the larger red optical density
		StainVector s1, s2;
		if (v1[0] > v2[0]) {
			s1 = StainVector.createStainVector(name1, v1);
			s2 = StainVector.createStainVector(name2, v2);
		} else {
			s1 = StainVector.createStainVector(name1, v2);
			s2 = StainVector.createStainVector(name2, v1);
		}

		double angle = StainVector.computeAngle(s1, s2);
		if (angle < MIN_SEPARATION_DEGREES)
			logger.warn("Estimated stain vectors are almost collinear (angle {} degrees) - stains may not be separable", angle);

		return StainMatrix.create("Macenko estimate", io, s1, s2);
	}

	private static double[] fromAngle(double[] e1, double[] e2, double phi) {
		double cos = Math.cos(phi);
		double sin = Math.sin(phi);
		return new double[]{
				e1[0]*cos + e2[0]*sin,
				e1[1]*cos + e2[1]*sin,
				e1[2]*cos + e2[2]*sin
		};
	}

	private static void negate(double[] v) {
		for (int i = 0; i < v.length; i++)
			v[i] = -v[i];
	}

	/**
	 * Get the indices that would sort the values in ascending order.
	 * @param values
	 * @return
	 */
	static int[] rank(double[] values) {
		return IntStream.range(0, values.length)
				.boxed()
				.sorted(Comparator.comparingDouble(i -> values[i]))
				.mapToInt(Integer::intValue)
				.toArray();
	}

	/**
	 * Calculate covariance of two vectors, which must have the same length.
	 * @param x
	 * @param y
	 * @return
	 */
	static double covariance(final double[] x, final double[] y) {
		int n = x.length;
		if (n != y.length)
			throw new IllegalArgumentException("Cannot compute covariance - array lengths are not the same");

		double xMean = 0;
		for (double v : x)
			xMean += v / n;

		double yMean = 0;
		for (double v : y)
			yMean += v / n;

		double result = 0;
		for (int i = 0; i < n; i++) {
			double xDev = x[i] - xMean;
			double yDev = y[i] - yMean;
			result += xDev * yDev / n;
		}
		return result;
	}

}
