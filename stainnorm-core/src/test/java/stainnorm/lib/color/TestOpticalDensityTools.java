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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import stainnorm.lib.common.ColorTools;

@SuppressWarnings("javadoc")
public class TestOpticalDensityTools {

	private static final double EPS = 1e-12;

	@Test
	public void test_makeOD() {
		assertEquals(-Math.log(11.0 / 255.0), OpticalDensityTools.makeOD(10, 255), EPS);
		assertEquals(0, OpticalDensityTools.makeOD(254, 255), EPS);
		// Values brighter than the background are negative, not clamped
		assertEquals(-Math.log(256.0 / 255.0), OpticalDensityTools.makeOD(255, 255), EPS);
		assertEquals(-Math.log(256.0 / 200.0), OpticalDensityTools.makeOD(255, 200), EPS);
		assertTrue(OpticalDensityTools.makeOD(240, 200) < 0);
	}

	@Test
	public void test_inverse() {
		for (double io : new double[] {255, 240, 200}) {
			for (int v = 0; v < 256; v++) {
				double od = OpticalDensityTools.makeOD(v, io);
				assertEquals(v + 1, OpticalDensityTools.makeIntensity(od, io), 1e-9);
			}
		}
	}

	@Test
	public void test_lut() {
		double[] lut = OpticalDensityTools.makeODLUT(255);
		assertEquals(256, lut.length);
		for (int i = 0; i < lut.length; i++)
			assertEquals(OpticalDensityTools.makeOD(i, 255), lut[i], EPS);
	}

	@Test
	public void test_channelODs() {
		int[] rgb = {ColorTools.packRGB(10, 100, 200), ColorTools.WHITE};
		double[] red = OpticalDensityTools.getRedOpticalDensities(rgb, 255, null);
		double[] green = OpticalDensityTools.getGreenOpticalDensities(rgb, 255, new double[2]);
		double[] blue = OpticalDensityTools.getBlueOpticalDensities(rgb, 255, null);

		assertArrayEquals(new double[] {OpticalDensityTools.makeOD(10, 255), OpticalDensityTools.makeOD(255, 255)}, red, EPS);
		assertArrayEquals(new double[] {OpticalDensityTools.makeOD(100, 255), OpticalDensityTools.makeOD(255, 255)}, green, EPS);
		assertArrayEquals(new double[] {OpticalDensityTools.makeOD(200, 255), OpticalDensityTools.makeOD(255, 255)}, blue, EPS);
	}

}
