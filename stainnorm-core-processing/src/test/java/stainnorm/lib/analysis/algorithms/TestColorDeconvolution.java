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

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

import stainnorm.lib.color.OpticalDensityTools;
import stainnorm.lib.color.StainMatrix;
import stainnorm.lib.color.StainVector;
import stainnorm.lib.common.ColorTools;
import stainnorm.lib.normalization.SyntheticImages;

@SuppressWarnings("javadoc")
public class TestColorDeconvolution {

	@Test
	public void test_pseudoInverseFullRank() {
		double[][] stains = SyntheticImages.STAINS_HE.withResidual().getArray();
		double[][] pinv = ColorDeconvolution.computePseudoInverse(stains);
		assertEquals(3, pinv.length);
		assertEquals(3, pinv[0].length);
		// stains * pinv should be the identity
		for (int i = 0; i < 3; i++) {
			for (int j = 0; j < 3; j++) {
				double sum = 0;
				for (int k = 0; k < 3; k++)
					sum += stains[i][k] * pinv[k][j];
				assertEquals(i == j ? 1.0 : 0.0, sum, 1e-10);
			}
		}
	}

	@Test
	public void test_pseudoInverseRankDeficient() {
		double[][] stains = {{1, 0, 0}, {1, 0, 0}};
		double[][] pinv = ColorDeconvolution.computePseudoInverse(stains);
		assertEquals(0.5, pinv[0][0], 1e-10);
		assertEquals(0.5, pinv[0][1], 1e-10);
		for (int i = 1; i < 3; i++) {
			assertEquals(0, pinv[i][0], 1e-10);
			assertEquals(0, pinv[i][1], 1e-10);
		}
	}

	@Test
	public void test_deconvolveKnownConcentrations() {
		StainMatrix stains = SyntheticImages.STAINS_HE.withResidual();
		int[] rgb = {
				SyntheticImages.createPixel(stains, 0.5, 0.3),
				SyntheticImages.createPixel(stains, 1.0, 0.0),
				ColorTools.WHITE
		};
		double[] c = ColorDeconvolution.deconvolve(rgb, stains, null);
		assertEquals(9, c.length);
		assertEquals(0.5, c[0], 0.02);
		assertEquals(0.3, c[1], 0.02);
		assertEquals(0.0, c[2], 0.02);
		assertEquals(1.0, c[3], 0.02);
		assertEquals(0.0, c[4], 0.02);
		// White is slightly brighter than the background, so concentrations are close to (but not exactly) zero
		double whiteOD = OpticalDensityTools.makeOD(255, 255);
		for (int k = 6; k < 9; k++)
			assertEquals(0, c[k], 2 * Math.abs(whiteOD) * Math.sqrt(3));
	}

	@Test
	public void test_deconvolveCollinear() {
		var h = SyntheticImages.STAINS_HE.getStain(1);
		var stains = StainMatrix.create("Collinear", 255, h, h.withName("Copy"));
		int[] rgb = {SyntheticImages.createPixel(StainMatrix.create("Single", 255, h, StainVector.createStainVector("Other", 0, 0, 1)), 1.0, 0.0)};
		double[] c = ColorDeconvolution.deconvolve(rgb, stains, new double[2]);
		// Minimum-norm solution splits the concentration between both stains
		assertEquals(c[0], c[1], 1e-10);
		assertEquals(1.0, c[0] + c[1], 0.02);
	}

}
