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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestConcentrationRescaler {

	private static final double EPS = 1e-10;

	/**
	 * Create a matrix with 100 pixels where channel k has values (i+1) * factors[k].
	 */
	private static ConcentrationMatrix createMatrix(double... factors) {
		int n = 100;
		int k = factors.length;
		double[] values = new double[n * k];
		for (int i = 0; i < n; i++) {
			for (int c = 0; c < k; c++)
				values[i * k + c] = (i + 1) * factors[c];
		}
		return ConcentrationMatrix.create(n, k, values, null);
	}

	@Test
	public void test_computeMaxima() {
		var c = createMatrix(1, 2);
		assertArrayEquals(new double[] {99.5, 199.0}, ConcentrationRescaler.computeMaxima(c), EPS);
	}

	@Test
	public void test_rescale() {
		var source = createMatrix(1, 2);
		var target = createMatrix(3, 1);
		var scaled = ConcentrationRescaler.create().rescale(source, target);
		// Channel-wise scaling
		assertEquals(3.0, scaled.get(0, 0), EPS);
		assertEquals(1.0, scaled.get(0, 1), EPS);
		assertArrayEquals(ConcentrationRescaler.computeMaxima(target), ConcentrationRescaler.computeMaxima(scaled), EPS);
	}

	@Test
	public void test_rescaleSelf() {
		var source = createMatrix(1, 2, 0.5);
		assertEquals(source, ConcentrationRescaler.create().rescale(source, source));
	}

	@Test
	public void test_rescaleNoClamping() {
		var source = ConcentrationMatrix.create(3, 1, new double[] {-1, 1, 2}, null);
		var target = ConcentrationMatrix.create(3, 1, new double[] {0, 2, 4}, null);
		var scaled = ConcentrationRescaler.create().rescale(source, target);
		assertEquals(-2.0, scaled.get(0, 0), EPS);
	}

	@Test
	public void test_dimensionMismatch() {
		var rescaler = ConcentrationRescaler.create();
		var e = assertThrows(DimensionMismatchException.class, () -> rescaler.rescale(createMatrix(1, 2), createMatrix(1, 2, 3)));
		assertEquals(2, e.getExpected());
		assertEquals(3, e.getActual());
		assertThrows(DimensionMismatchException.class, () -> rescaler.rescale(createMatrix(1, 2), new double[] {1, 1}, new double[] {1}));
	}

	@Test
	public void test_degenerateZero() {
		var source = createMatrix(1, 0);
		var target = createMatrix(2, 2);
		var rescaler = ConcentrationRescaler.create(DegenerateChannelPolicy.ZERO);
		assertArrayEquals(new double[] {2, 0}, rescaler.computeScaleFactors(new double[] {1, 0}, new double[] {2, 2}), EPS);
		var scaled = rescaler.rescale(source, target);
		assertArrayEquals(new double[100], scaled.getChannel(1), EPS);
		assertEquals(2.0, scaled.get(0, 0), EPS);
	}

	@Test
	public void test_degenerateUnit() {
		var rescaler = ConcentrationRescaler.create(DegenerateChannelPolicy.UNIT);
		assertArrayEquals(new double[] {2, 1}, rescaler.computeScaleFactors(new double[] {1, 1e-12}, new double[] {2, 5}), EPS);
	}

	@Test
	public void test_degenerateFail() {
		var rescaler = ConcentrationRescaler.create(DegenerateChannelPolicy.FAIL);
		var e = assertThrows(DegenerateChannelException.class, () -> rescaler.computeScaleFactors(new double[] {1, 0}, new double[] {2, 5}));
		assertEquals(1, e.getChannel());
		assertEquals(DegenerateChannelPolicy.FAIL, rescaler.getDegenerateChannelPolicy());
	}

	@Test
	public void test_degenerateBelowTolerance() {
		var rescaler = ConcentrationRescaler.create(DegenerateChannelPolicy.ZERO);
		// Negative maxima, and maxima below a single intensity step, have no usable signal
		double small = ConcentrationRescaler.DEGENERATE_TOLERANCE / 2;
		assertArrayEquals(new double[] {0, 0, 2}, rescaler.computeScaleFactors(new double[] {-0.01, small, 1}, new double[] {1, 1, 2}), EPS);
		assertEquals(Math.log(256.0 / 255.0), ConcentrationRescaler.DEGENERATE_TOLERANCE, EPS);
	}

	@Test
	public void test_residualNotRescaled() {
		var rescaler = ConcentrationRescaler.create(DegenerateChannelPolicy.FAIL);
		assertArrayEquals(new double[] {2, 1},
				rescaler.computeScaleFactors(new double[] {1, -0.03}, new double[] {2, 5}, new boolean[] {false, true}), EPS);

		double[] values = new double[200];
		for (int i = 0; i < 100; i++) {
			values[i * 2] = i + 1;
			values[i * 2 + 1] = -0.03;
		}
		var source = ConcentrationMatrix.create(100, 2, values, new boolean[] {false, true});
		var target = createMatrix(2, 7);
		var scaled = rescaler.rescale(source, target);
		assertArrayEquals(source.getChannel(1), scaled.getChannel(1), EPS);
		assertEquals(2.0, scaled.get(0, 0), EPS);
	}

}
