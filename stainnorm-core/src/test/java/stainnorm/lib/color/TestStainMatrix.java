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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import stainnorm.lib.color.StainMatrix.DefaultStainMatrix;

@SuppressWarnings("javadoc")
public class TestStainMatrix {

	private final StainMatrix stainsHE = StainMatrix.makeDefaultStainMatrix(DefaultStainMatrix.H_E, 255);

	@Test
	void Check_Default_Stains() {
		Assertions.assertEquals(2, stainsHE.getStainCount());
		Assertions.assertEquals(2, stainsHE.getEstimatedStainCount());
		Assertions.assertFalse(stainsHE.hasResidual());
		Assertions.assertEquals("Hematoxylin", stainsHE.getStain(1).getName());
		Assertions.assertEquals("Eosin", stainsHE.getStain(2).getName());
		Assertions.assertNull(stainsHE.getStain(0));
		Assertions.assertNull(stainsHE.getStain(3));
		Assertions.assertEquals(255, stainsHE.getBackground());
	}

	@Test
	void Check_Invalid_Stain_Matrices() {
		var h = stainsHE.getStain(1);
		Assertions.assertThrows(IllegalArgumentException.class, () -> StainMatrix.create("None", 255));
		Assertions.assertThrows(IllegalArgumentException.class, () -> StainMatrix.create("Too many", 255, h, h, h, h));
		Assertions.assertThrows(IllegalArgumentException.class, () -> StainMatrix.create("Bad background", 0, h));
	}

	@Test
	void Check_With_Residual() {
		var withResidual = stainsHE.withResidual();
		Assertions.assertEquals(3, withResidual.getStainCount());
		Assertions.assertEquals(2, withResidual.getEstimatedStainCount());
		Assertions.assertTrue(withResidual.hasResidual());
		Assertions.assertTrue(withResidual.getStain(3).isResidual());
		Assertions.assertSame(withResidual, withResidual.withResidual());
		Assertions.assertEquals(stainsHE.getStains(), withResidual.getStains().subList(0, 2));
	}

	@Test
	void Check_Permute() {
		var permuted = stainsHE.permute(1, 0);
		Assertions.assertEquals(stainsHE.getStain(1), permuted.getStain(2));
		Assertions.assertEquals(stainsHE.getStain(2), permuted.getStain(1));
		Assertions.assertEquals(stainsHE, permuted.permute(1, 0));
		Assertions.assertThrows(IllegalArgumentException.class, () -> stainsHE.permute(0, 0));
		Assertions.assertThrows(IllegalArgumentException.class, () -> stainsHE.permute(0));
		Assertions.assertThrows(IllegalArgumentException.class, () -> stainsHE.permute(0, 2));
	}

	@Test
	void Check_Array() {
		double[][] arr = stainsHE.getArray();
		Assertions.assertEquals(2, arr.length);
		Assertions.assertArrayEquals(stainsHE.getStain(1).getArray(), arr[0]);
		Assertions.assertArrayEquals(stainsHE.getStain(2).getArray(), arr[1]);
	}

	@Test
	void Check_Map_Round_Trip() {
		var stains = StainMatrix.create("Round trip", stainsHE.getBackground(), stainsHE.withResidual().getStains());
		var map = stains.getStainMatrixAsMap();
		Assertions.assertEquals(List.of("Hematoxylin", "Eosin", "Residual", "Background"), List.copyOf(map.keySet()));

		var parsed = StainMatrix.parseStainMatrix(stains.getName(), map);
		Assertions.assertEquals(stains, parsed);
		Assertions.assertTrue(parsed.getStain(3).isResidual());
	}

	@Test
	void Check_Parsed_Stain_Matrix_With_Single_Background_Value() {
		Map<String, List<Number>> map = new LinkedHashMap<>();       // LinkedHashMap to conserve order
		map.put("Stain 1", List.of(1, 0, 0));
		map.put("Stain 2", List.of(0, 1, 0));
		map.put("Background", List.of(240));

		var stains = StainMatrix.parseStainMatrix("some name", map);

		Assertions.assertEquals(240, stains.getBackground());
		Assertions.assertEquals(2, stains.getStainCount());
		Assertions.assertEquals("some name", stains.getName());
	}

	@Test
	void Check_Parsed_Stain_Matrix_Skips_Invalid_Stains() {
		Map<String, List<Number>> map = new LinkedHashMap<>();
		map.put("Stain 1", List.of(1, 2, 3));
		map.put("Stain 2", List.of());
		map.put("Background", List.of(255, 255, 255));

		var stains = StainMatrix.parseStainMatrix("", map);

		Assertions.assertEquals(1, stains.getStainCount());
	}

	@Test
	void Check_Parsed_Stain_Matrix_With_No_Background() {
		Map<String, List<Number>> map = Map.of(
				"Stain 1", List.of(1, 2, 3),
				"Stain 2", List.of(4, 5, 6)
		);

		Assertions.assertThrows(IllegalArgumentException.class, () -> StainMatrix.parseStainMatrix("", map));
	}

	@Test
	void Check_Parsed_Stain_Matrix_With_Different_Background_Values() {
		Map<String, List<Number>> map = Map.of(
				"Stain 1", List.of(1, 2, 3),
				"Background", List.of(4, 5, 6)
		);

		Assertions.assertThrows(IllegalArgumentException.class, () -> StainMatrix.parseStainMatrix("", map));
	}

}
