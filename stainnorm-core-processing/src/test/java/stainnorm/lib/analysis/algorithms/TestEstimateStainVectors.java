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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import stainnorm.lib.color.StainVector;
import stainnorm.lib.common.ColorTools;
import stainnorm.lib.normalization.SyntheticImages;

@SuppressWarnings("javadoc")
public class TestEstimateStainVectors {

	@Test
	public void test_estimateSynthetic() {
		var img = SyntheticImages.createGradientImage(SyntheticImages.STAINS_HE, 40, 1.5);
		var stains = EstimateStainVectors.estimateMacenko(img.getRGB(), 255, 0.15, 1);

		assertEquals(2, stains.getStainCount());
		assertFalse(stains.hasResidual());
		assertEquals(255, stains.getBackground());
		assertEquals("Hematoxylin", stains.getStain(1).getName());
		assertEquals("Eosin", stains.getStain(2).getName());

		// Hematoxylin first, i.e. the stain with the larger red component
		assertTrue(stains.getStain(1).getRed() > stains.getStain(2).getRed());
		assertTrue(StainVector.computeAngle(stains.getStain(1), SyntheticImages.STAINS_HE.getStain(1)) < 5);
		assertTrue(StainVector.computeAngle(stains.getStain(2), SyntheticImages.STAINS_HE.getStain(2)) < 5);
	}

	@Test
	public void test_estimateDeterministic() {
		var img = SyntheticImages.createGradientImage(SyntheticImages.STAINS_HE, 30, 1.2);
		var stains1 = EstimateStainVectors.estimateMacenko(img.getRGB(), 255, 0.15, 1);
		var stains2 = EstimateStainVectors.estimateMacenko(img.getRGB(), 255, 0.15, 1);
		assertEquals(stains1, stains2);
	}

	@Test
	public void test_estimateNames() {
		var img = SyntheticImages.createGradientImage(SyntheticImages.STAINS_HE, 30, 1.2);
		var stains = EstimateStainVectors.estimateMacenko(img.getRGB(), 255, 0.15, 1, "First", "Second");
		assertEquals("First", stains.getStain(1).getName());
		assertEquals("Second", stains.getStain(2).getName());
	}

	@Test
	public void test_estimateWhite() {
		int[] rgb = new int[100];
		Arrays.fill(rgb, ColorTools.WHITE);
		assertThrows(IllegalArgumentException.class, () -> EstimateStainVectors.estimateMacenko(rgb, 255, 0.15, 1));
	}

	@Test
	public void test_estimateSinglePixel() {
		int[] rgb = {ColorTools.packRGB(50, 60, 70), ColorTools.WHITE, ColorTools.WHITE};
		assertThrows(IllegalArgumentException.class, () -> EstimateStainVectors.estimateMacenko(rgb, 255, 0.15, 1));
	}

	@Test
	public void test_rank() {
		assertArrayEquals(new int[] {1, 2, 0}, EstimateStainVectors.rank(new double[] {3, 1, 2}));
	}

	@Test
	public void test_covariance() {
		double[] x = {1, 2, 3, 4};
		double[] y = {2, 4, 6, 8};
		assertEquals(1.25, EstimateStainVectors.covariance(x, x), 1e-12);
		assertEquals(2.5, EstimateStainVectors.covariance(x, y), 1e-12);
		assertThrows(IllegalArgumentException.class, () -> EstimateStainVectors.covariance(x, new double[3]));
	}

}
