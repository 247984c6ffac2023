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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import stainnorm.lib.color.StainMatrix;
import stainnorm.lib.color.StainVector;
import stainnorm.lib.common.ColorTools;
import stainnorm.lib.images.RgbImage;

@SuppressWarnings("javadoc")
public class TestMacenkoStainModel {

	private final StainModel model = new MacenkoStainModel();
	private final NormalizationParameters params = NormalizationParameters.getDefault();

	@Test
	public void test_estimateSuccess() {
		var img = SyntheticImages.createGradientImage(SyntheticImages.STAINS_HE, 40, 1.5);
		var result = model.estimateStains(img, params);
		assertTrue(result.isSuccess());
		assertNull(result.getFailureReason());
		assertEquals(2, result.getStains().getStainCount());
		assertEquals(result.getStains(), result.getStainsOrThrow("test"));
	}

	@Test
	public void test_estimateFailure() {
		var img = RgbImage.filled(4, 4, ColorTools.WHITE);
		var result = model.estimateStains(img, params);
		assertFalse(result.isSuccess());
		assertNotNull(result.getFailureReason());
		assertThrows(IllegalStateException.class, () -> result.getStains());
		assertThrows(StainEstimationException.class, () -> result.getStainsOrThrow("white"));
	}

	@Test
	public void test_deconvolveAddsResidual() {
		var img = SyntheticImages.createGradientImage(SyntheticImages.STAINS_HE, 10, 1.0);
		var result = model.deconvolve(img, SyntheticImages.STAINS_HE, params);
		assertEquals(3, result.getStains().getStainCount());
		assertTrue(result.getStains().hasResidual());
		assertEquals(img.getPixelCount(), result.getConcentrations().getPixelCount());
		assertEquals(3, result.getConcentrations().getChannelCount());
		assertTrue(result.getConcentrations().isResidual(2));
		// First pixel is white
		assertEquals(0, result.getConcentrations().get(0, 0), 1e-12);
		// Last pixel has both stains at the maximum concentration
		assertEquals(1.0, result.getConcentrations().get(99, 0), 0.05);
		assertEquals(1.0, result.getConcentrations().get(99, 1), 0.05);
	}

	@Test
	public void test_deconvolveUsesIo() {
		var img = RgbImage.filled(2, 2, ColorTools.packRGB(199, 199, 199));
		var paramsIo = params.toBuilder().io(200.0).build();
		var result = model.deconvolve(img, SyntheticImages.STAINS_HE, paramsIo);
		assertEquals(200, result.getStains().getBackground());
		assertEquals(0, result.getConcentrations().get(0, 0), 1e-12);
	}

	@Test
	public void test_clampAllNonNegative() {
		var img = SyntheticImages.createGradientImage(SyntheticImages.STAINS_HE, 20, 1.5);
		// Stains that do not match the image give negative concentrations
		var stains = StainMatrix.create("Mismatched", 255,
				StainVector.createStainVector("Stain 1", 1, 0, 0),
				StainVector.createStainVector("Stain 2", 1, 1, 1));
		var concentrations = model.deconvolve(img, stains, params).getConcentrations();
		assertTrue(minStainValue(concentrations) < 0);
		assertTrue(minStainValue(concentrations.clampNegatives(NegativeConcentrationPolicy.CLAMP_ALL)) >= 0);
	}

	@Test
	public void test_deconvolutionResultMismatch() {
		var c = ConcentrationMatrix.create(1, 2, new double[2], null);
		assertThrows(DimensionMismatchException.class, () -> new DeconvolutionResult(c, SyntheticImages.STAINS_HE.withResidual()));
	}

	private static double minStainValue(ConcentrationMatrix concentrations) {
		double min = Double.POSITIVE_INFINITY;
		for (int c = 0; c < concentrations.getChannelCount(); c++) {
			if (concentrations.isResidual(c))
				continue;
			for (double v : concentrations.getChannel(c))
				min = Math.min(min, v);
		}
		return min;
	}

}
