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

package stainnorm.lib.color;

import java.util.Locale;
import java.util.Objects;

import stainnorm.lib.common.GeneralTools;

/**
 * Representation of a stain vector, defined in terms of RGB optical densities.
 * <p>
 * Stain vectors are always normalized to unit length.
 */
public final class StainVector {

	/**
	 * Enum representing default stains.
	 */
	public enum DefaultStains {
		/**
		 * Hematoxylin
		 */
		HEMATOXYLIN("Hematoxylin"),
		/**
		 * Eosin
		 */
		EOSIN("Eosin"),
		/**
		 * DAB
		 */
		DAB("DAB");

		private final String name;

		DefaultStains(String name) {
			this.name = name;
		}

		@Override
		public String toString() {
			return name;
		}
	}

	/**
	 * Name given to residual stains.
	 */
	public static final String RESIDUAL = "Residual";

	/**
	 * Cross products shorter than this are treated as collinear input vectors.
	 */
	private static final double COLLINEAR_TOLERANCE = 1e-8;

	private static final double[] STAIN_HEMATOXYLIN_DEFAULT = new double[]{0.65, 0.70, 0.29}; 	// From Ruifrok & Johnston's original paper
	private static final double[] STAIN_DAB_DEFAULT = new double[]{0.27, 0.57, 0.78};			// From Ruifrok & Johnston's original paper
	private static final double[] STAIN_EOSIN_DEFAULT = new double[]{0.2159, 0.8012, 0.5581}; 	// From http://amida13.isi.uu.nl/?q=node/69

	private final String name;
	private final double r, g, b;
	private final boolean isResidual;

	private StainVector(String name, double r, double g, double b, boolean isResidual) {
		double length = getLength(r, g, b);
		if (!(length > 0) || !Double.isFinite(length))
			throw new IllegalArgumentException("Stain vector is not valid - must have a finite length > 0");
		this.name = name;
		this.r = r / length;
		this.g = g / length;
		this.b = b / length;
		this.isResidual = isResidual;
	}

	/**
	 * Get a default stain vector.
	 * @param stain
	 * @return
	 */
	public static StainVector makeDefaultStainVector(DefaultStains stain) {
		switch (stain) {
		case HEMATOXYLIN:
			return createStainVector(stain.toString(), STAIN_HEMATOXYLIN_DEFAULT);
		case EOSIN:
			return createStainVector(stain.toString(), STAIN_EOSIN_DEFAULT);
		case DAB:
			return createStainVector(stain.toString(), STAIN_DAB_DEFAULT);
		default:
			throw new IllegalArgumentException("Unknown stain " + stain);
		}
	}

	/**
	 * Create a stain vector.
	 * @param name the name of the stain
	 * @param r the stain vector red component
	 * @param g the stain vector green component
	 * @param b the stain vector blue component
	 * @return
	 * @throws IllegalArgumentException if the vector has zero length
	 */
	public static StainVector createStainVector(String name, double r, double g, double b) {
		return new StainVector(name, r, g, b, false);
	}

	/**
	 * Create a stain vector from a 3-element array.
	 * @param name
	 * @param vector
	 * @return
	 */
	public static StainVector createStainVector(String name, double[] vector) {
		return createStainVector(name, vector, false);
	}

	static StainVector createStainVector(String name, double[] vector, boolean isResidual) {
		if (vector == null || vector.length != 3)
			throw new IllegalArgumentException("Stain vector must have 3 values");
		return new StainVector(name, vector[0], vector[1], vector[2], isResidual);
	}

	/**
	 * Returns true if this vector represents the residual (orthogonal) stain, used whenever color deconvolution is required with two stains only.
	 * @return
	 */
	public boolean isResidual() {
		return isResidual;
	}

	/**
	 * Returns the name of the stain vector.
	 * @return
	 */
	public String getName() {
		return name;
	}

	/**
	 * Get the red component of the (normalized) stain vector.
	 * @return
	 */
	public double getRed() {
		return r;
	}

	/**
	 * Get the green component of the (normalized) stain vector.
	 * @return
	 */
	public double getGreen() {
		return g;
	}

	/**
	 * Get the blue component of the (normalized) stain vector.
	 * @return
	 */
	public double getBlue() {
		return b;
	}

	/**
	 * Get the stain vector as a 3 element array (red, green, blue).
	 * @return
	 */
	public double[] getArray() {
		return new double[]{r, g, b};
	}

	/**
	 * Create a stain vector with the same values but a different name.
	 * @param name
	 * @return
	 */
	public StainVector withName(String name) {
		return new StainVector(name, r, g, b, isResidual);
	}

	/**
	 * Get a String representation of the stain vector array, formatting according to the specified Locale.
	 * @param locale
	 * @param nDecimalPlaces
	 * @return
	 */
	public String arrayAsString(final Locale locale, final int nDecimalPlaces) {
		return GeneralTools.arrayToString(locale, getArray(), nDecimalPlaces);
	}

	@Override
	public String toString() {
		return name + ": " + arrayAsString(Locale.US, 3);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, r, g, b, isResidual);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof StainVector))
			return false;
		StainVector other = (StainVector)obj;
		return Objects.equals(name, other.name) &&
				Double.compare(r, other.r) == 0 &&
				Double.compare(g, other.g) == 0 &&
				Double.compare(b, other.b) == 0 &&
				isResidual == other.isResidual;
	}

	private static double getLength(double r, double g, double b) {
		return Math.sqrt(r*r + g*g + b*b);
	}

	/**
	 * Calculate the angle between two stain vectors, in degrees.
	 * @param s1
	 * @param s2
	 * @return
	 */
	public static double computeAngle(StainVector s1, StainVector s2) {
		double dot = s1.r * s2.r + s1.g * s2.g + s1.b * s2.b;
		if (Math.abs(1 - dot) < 0.00001)
			return 0;
		return Math.acos(Math.max(-1, Math.min(1, dot))) / Math.PI * 180;
	}

	/**
	 * Compute the cross product of two vectors.
	 * @param u
	 * @param v
	 * @return
	 */
	public static double[] cross3(double[] u, double[] v) {
		double[] s = new double[3];
		s[0] = (u[1]*v[2] - u[2]*v[1]);
		s[1] = (u[2]*v[0] - u[0]*v[2]);
		s[2] = (u[0]*v[1] - u[1]*v[0]);
		return s;
	}

	/**
	 * Make a 'residual' stain vector, i.e. a third stain vector orthogonal to two specified vectors.
	 * <p>
	 * If the two vectors are collinear, the residual is orthogonal to the first only.
	 *
	 * @param s1
	 * @param s2
	 * @return
	 */
	public static StainVector makeResidualStainVector(StainVector s1, StainVector s2) {
		double[] u = s1.getArray();
		double[] cross = cross3(u, s2.getArray());
		if (getLength(cross[0], cross[1], cross[2]) < COLLINEAR_TOLERANCE) {
			// Use whichever axis is least aligned with the first stain
			double[] axis = new double[3];
			int minInd = 0;
			for (int i = 1; i < 3; i++) {
				if (Math.abs(u[i]) < Math.abs(u[minInd]))
					minInd = i;
			}
			axis[minInd] = 1;
			cross = cross3(u, axis);
		}
		return createStainVector(RESIDUAL, cross, true);
	}

}
