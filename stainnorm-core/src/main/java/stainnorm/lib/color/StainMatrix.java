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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import stainnorm.lib.color.StainVector.DefaultStains;

/**
 * An ordered collection of stain vectors, together with the transmitted light intensity (background)
 * used to convert pixel values to optical densities.
 * <p>
 * This corresponds to a 3xK stain matrix, where each stain vector is one column.
 * Up to three stains can be stored, because a 3-channel image can recover (to some extent) up to 3 stains.
 * If a third stain is required for deconvolution but only two are known, a residual stain orthogonal to the others
 * can be added with {@link #withResidual()}.
 */
public final class StainMatrix {

	private static final Logger logger = LoggerFactory.getLogger(StainMatrix.class);

	/**
	 * Key used for the background value when converting to or from a map.
	 */
	public static final String BACKGROUND = "Background";

	/**
	 * Default transmitted light intensity for 8-bit images.
	 */
	public static final double DEFAULT_BACKGROUND = 255.0;

	/**
	 * Enum for common stain defaults.
	 */
	public enum DefaultStainMatrix {
		/**
		 * Hematoxylin and eosin
		 */
		H_E("H&E"),

		/**
		 * Hematoxylin and DAB
		 */
		H_DAB("H-DAB");

		private final String name;

		DefaultStainMatrix(String name) {
			this.name = name;
		}

		@Override
		public String toString() {
			return name;
		}
	}

	private final String name;
	private final List<StainVector> stains;
	private final double background;

	private StainMatrix(String name, List<StainVector> stains, double background) {
		if (stains == null || stains.isEmpty() || stains.size() > 3)
			throw new IllegalArgumentException("A stain matrix needs between 1 and 3 stains, but " +
					(stains == null ? 0 : stains.size()) + " were provided");
		if (stains.contains(null))
			throw new IllegalArgumentException("Stain vectors must not be null");
		if (!(background > 0) || !Double.isFinite(background))
			throw new IllegalArgumentException("Background value must be > 0, but was " + background);
		this.name = name;
		this.stains = Collections.unmodifiableList(new ArrayList<>(stains));
		this.background = background;
	}

	/**
	 * Create a stain matrix.
	 * @param name name of the stain combination (may be null)
	 * @param background transmitted light intensity, i.e. the value of a pixel containing no stain
	 * @param stains between 1 and 3 stain vectors, in order
	 * @return
	 * @throws IllegalArgumentException if the number of stains or the background are invalid
	 */
	public static StainMatrix create(String name, double background, StainVector... stains) {
		return new StainMatrix(name, Arrays.asList(stains), background);
	}

	/**
	 * Create a stain matrix from a list of stains.
	 * @param name
	 * @param background
	 * @param stains
	 * @return
	 * @see #create(String, double, StainVector...)
	 */
	public static StainMatrix create(String name, double background, List<StainVector> stains) {
		return new StainMatrix(name, stains, background);
	}

	/**
	 * Create a stain matrix for a default stain combination.
	 * @param stains
	 * @param background
	 * @return
	 */
	public static StainMatrix makeDefaultStainMatrix(DefaultStainMatrix stains, double background) {
		switch (stains) {
		case H_E:
			return create("H&E default", background,
					StainVector.makeDefaultStainVector(DefaultStains.HEMATOXYLIN),
					StainVector.makeDefaultStainVector(DefaultStains.EOSIN));
		case H_DAB:
			return create("H-DAB default", background,
					StainVector.makeDefaultStainVector(DefaultStains.HEMATOXYLIN),
					StainVector.makeDefaultStainVector(DefaultStains.DAB));
		default:
			throw new IllegalArgumentException("Unknown stains " + stains);
		}
	}

	/**
	 * Get the name of the stain combination.
	 * @return
	 */
	public String getName() {
		return name;
	}

	/**
	 * Get the transmitted light intensity (background value).
	 * @return
	 */
	public double getBackground() {
		return background;
	}

	/**
	 * Get a specified stain vector, where n should be 1, 2 or 3.
	 *
	 * @param n
	 * @return The requested stain vector, or null if n is out of range.
	 */
	public StainVector getStain(int n) {
		if (n >= 1 && n <= stains.size())
			return stains.get(n - 1);
		if (n == 0)
			logger.error("Stains are not zero-based! Do you mean you want stain 1?");
		return null;
	}

	/**
	 * Get an unmodifiable list of all stains, including any residual.
	 * @return
	 */
	public List<StainVector> getStains() {
		return stains;
	}

	/**
	 * Get the total number of stains, including any residual.
	 * @return
	 */
	public int getStainCount() {
		return stains.size();
	}

	/**
	 * Get the number of stains that are not residuals.
	 * @return
	 */
	public int getEstimatedStainCount() {
		return (int)stains.stream().filter(s -> !s.isResidual()).count();
	}

	/**
	 * Returns true if any stain is a residual.
	 * @return
	 */
	public boolean hasResidual() {
		return stains.stream().anyMatch(StainVector::isResidual);
	}

	/**
	 * Get the stain vectors as a K x 3 array, i.e. one row per stain.
	 * This is the transpose of the conventional 3xK stain matrix.
	 * @return
	 */
	public double[][] getArray() {
		double[][] arr = new double[stains.size()][];
		for (int i = 0; i < arr.length; i++)
			arr[i] = stains.get(i).getArray();
		return arr;
	}

	/**
	 * Create a new stain matrix with a third (residual) stain computed orthogonal to the first two.
	 * <p>
	 * If the matrix does not contain exactly two stains, it is returned unchanged.
	 * @return
	 */
	public StainMatrix withResidual() {
		if (stains.size() != 2)
			return this;
		List<StainVector> list = new ArrayList<>(stains);
		list.add(StainVector.makeResidualStainVector(stains.get(0), stains.get(1)));
		return new StainMatrix(name, list, background);
	}

	/**
	 * Create a new stain matrix with the stains reordered.
	 * @param order zero-based indices, where {@code order[i]} gives the index of the stain that should be at position i
	 * @return
	 * @throws IllegalArgumentException if order is not a permutation of the stain indices
	 */
	public StainMatrix permute(int... order) {
		checkPermutation(order, stains.size());
		List<StainVector> list = new ArrayList<>();
		for (int ind : order)
			list.add(stains.get(ind));
		return new StainMatrix(name, list, background);
	}

	/**
	 * Create a new stain matrix with the same stains but a new background value.
	 * @param background
	 * @return
	 */
	public StainMatrix changeBackground(double background) {
		return new StainMatrix(name, stains, background);
	}

	/**
	 * Check that an array is a permutation of 0, 1, ..., n-1.
	 * @param order
	 * @param n
	 * @throws IllegalArgumentException if it is not
	 */
	public static void checkPermutation(int[] order, int n) throws IllegalArgumentException {
		if (order == null || order.length != n)
			throw new IllegalArgumentException("Permutation must have " + n + " entries, but was " + Arrays.toString(order));
		boolean[] seen = new boolean[n];
		for (int ind : order) {
			if (ind < 0 || ind >= n || seen[ind])
				throw new IllegalArgumentException("Invalid permutation " + Arrays.toString(order) + " for " + n + " stains");
			seen[ind] = true;
		}
	}

	/**
	 * Get the stains as a map, using stain names as keys and with an additional entry for the background.
	 * Values are lists of 3 numbers.
	 * @return
	 * @see #parseStainMatrix(String, Map)
	 */
	public Map<String, List<Number>> getStainMatrixAsMap() {
		Map<String, List<Number>> map = new LinkedHashMap<>();
		for (StainVector stain : stains)
			map.put(stain.getName(), List.of(stain.getRed(), stain.getGreen(), stain.getBlue()));
		map.put(BACKGROUND, List.of(background, background, background));
		return map;
	}

	/**
	 * Parse a stain matrix from a map, as created by {@link #getStainMatrixAsMap()}.
	 * <p>
	 * Every entry other than {@link #BACKGROUND} is a stain, in iteration order. A stain named
	 * {@link StainVector#RESIDUAL} is treated as a residual stain. Stains without exactly 3 values are skipped.
	 * The background may be given as 1 value, or as 3 equal values.
	 *
	 * @param name
	 * @param map
	 * @return
	 * @throws IllegalArgumentException if the background is missing, or no valid stains are found
	 */
	public static StainMatrix parseStainMatrix(String name, Map<String, List<Number>> map) throws IllegalArgumentException {
		List<Number> bg = map.get(BACKGROUND);
		if (bg == null || !(bg.size() == 1 || bg.size() == 3))
			throw new IllegalArgumentException("A background value is required");
		double background = bg.get(0).doubleValue();
		for (Number n : bg) {
			if (n.doubleValue() != background)
				throw new IllegalArgumentException("Background values must be the same for all channels, but were " + bg);
		}
		List<StainVector> list = new ArrayList<>();
		for (var entry : map.entrySet()) {
			if (BACKGROUND.equals(entry.getKey()))
				continue;
			List<Number> values = entry.getValue();
			if (values == null || values.size() != 3) {
				logger.warn("Skipping stain {} - expected 3 values but found {}", entry.getKey(), values);
				continue;
			}
			double[] vector = values.stream().mapToDouble(Number::doubleValue).toArray();
			list.add(StainVector.createStainVector(entry.getKey(), vector, StainVector.RESIDUAL.equals(entry.getKey())));
		}
		if (list.isEmpty())
			throw new IllegalArgumentException("No valid stains found");
		return new StainMatrix(name, list, background);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, stains, background);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof StainMatrix))
			return false;
		StainMatrix other = (StainMatrix)obj;
		return Objects.equals(name, other.name) &&
				stains.equals(other.stains) &&
				Double.compare(background, other.background) == 0;
	}

	@Override
	public String toString() {
		return "Stain matrix: " + stains.stream().map(StainVector::toString).collect(Collectors.joining(", "));
	}

}
