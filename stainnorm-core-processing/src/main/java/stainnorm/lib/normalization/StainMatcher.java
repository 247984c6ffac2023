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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import stainnorm.lib.color.StainMatrix;
import stainnorm.lib.color.StainVector;

/**
 * Strategy to decide which source concentration channel corresponds to each target channel.
 * <p>
 * Stain estimation does not guarantee that stains are returned in the same order for two images.
 * A matcher makes the choice explicit, rather than assuming that the orders agree.
 */
public interface StainMatcher {

	/**
	 * Determine the order of source channels.
	 * @param source the stains used to deconvolve the source image
	 * @param target the stains used to deconvolve the target image
	 * @return zero-based indices, where element i gives the source channel that should be matched to target channel i
	 */
	int[] match(StainMatrix source, StainMatrix target);

	/**
	 * Matcher that keeps channels in the order in which they were estimated.
	 * @return
	 */
	static StainMatcher identity() {
		return new StainMatchers.IdentityMatcher();
	}

	/**
	 * Matcher that applies a fixed permutation of the estimated stains.
	 * Channels beyond the length of the permutation (e.g. the residual) keep their position.
	 * @param order zero-based indices
	 * @return
	 * @throws IllegalArgumentException if order is not a permutation of 0, 1, ..., order.length-1
	 */
	static StainMatcher permutation(int... order) throws IllegalArgumentException {
		return new StainMatchers.PermutationMatcher(order);
	}

	/**
	 * Matcher that chooses the order of the estimated stains minimizing the total angle
	 * between corresponding source and target stain vectors.
	 * @return
	 */
	static StainMatcher closestAngle() {
		return new StainMatchers.ClosestAngleMatcher();
	}

	/**
	 * Static helpers for stain matching.
	 */
	final class StainMatchers {

		private StainMatchers() {
			throw new AssertionError();
		}

		/**
		 * Extend an order for the first stains to cover all channels, using the identity for the remaining channels.
		 * @param order
		 * @param nChannels
		 * @return
		 */
		static int[] extendOrder(int[] order, int nChannels) {
			if (order.length > nChannels)
				throw new DimensionMismatchException("Stain order " + Arrays.toString(order) + " has too many entries", nChannels, order.length);
			int[] full = new int[nChannels];
			for (int i = 0; i < nChannels; i++)
				full[i] = i < order.length ? order[i] : i;
			StainMatrix.checkPermutation(full, nChannels);
			return full;
		}

		/**
		 * Sum of angles (in degrees) between target stains and the source stains selected by an order.
		 * Only the first {@code min(order.length, nTargetStains)} entries are considered.
		 * @param source
		 * @param target
		 * @param order
		 * @return
		 */
		public static double totalAngle(StainMatrix source, StainMatrix target, int[] order) {
			List<StainVector> sourceStains = source.getStains();
			List<StainVector> targetStains = target.getStains();
			int n = Math.min(order.length, targetStains.size());
			double total = 0;
			for (int i = 0; i < n; i++)
				total += StainVector.computeAngle(sourceStains.get(order[i]), targetStains.get(i));
			return total;
		}

		/**
		 * Find the order of the estimated (non-residual) source stains that best matches the target stains.
		 * Ties are resolved in favor of the order that is found first, starting with the identity.
		 * @param source
		 * @param target
		 * @return zero-based order, covering all channels of the source
		 */
		public static int[] bestAngleOrder(StainMatrix source, StainMatrix target) {
			int nEstimated = Math.min(source.getEstimatedStainCount(), target.getEstimatedStainCount());
			int[] best = null;
			double bestAngle = Double.POSITIVE_INFINITY;
			for (int[] order : permutations(nEstimated)) {
				double angle = totalAngle(source, target, order);
				if (angle < bestAngle) {
					bestAngle = angle;
					best = order;
				}
			}
			return extendOrder(best, source.getStainCount());
		}

		/**
		 * Generate all permutations of 0, 1, ..., n-1, with the identity first.
		 * @param n
		 * @return
		 */
		static List<int[]> permutations(int n) {
			List<int[]> list = new ArrayList<>();
			int[] current = new int[n];
			for (int i = 0; i < n; i++)
				current[i] = i;
			permute(current, 0, list);
			return list;
		}

		private static void permute(int[] arr, int k, List<int[]> list) {
			if (k >= arr.length - 1) {
				list.add(arr.clone());
				return;
			}
			for (int i = k; i < arr.length; i++) {
				swap(arr, k, i);
				permute(arr, k + 1, list);
				swap(arr, k, i);
			}
		}

		private static void swap(int[] arr, int i, int j) {
			int temp = arr[i];
			arr[i] = arr[j];
			arr[j] = temp;
		}


		static class IdentityMatcher implements StainMatcher {

			@Override
			public int[] match(StainMatrix source, StainMatrix target) {
				return extendOrder(new int[0], source.getStainCount());
			}

			@Override
			public String toString() {
				return "Identity stain matcher";
			}

		}


		static class PermutationMatcher implements StainMatcher {

			private final int[] order;

			PermutationMatcher(int[] order) {
				StainMatrix.checkPermutation(order, order.length);
				this.order = order.clone();
			}

			@Override
			public int[] match(StainMatrix source, StainMatrix target) {
				if (order.length > source.getEstimatedStainCount())
					throw new IllegalArgumentException("Stain order " + Arrays.toString(order) + " is not compatible with " + source.getEstimatedStainCount() + " estimated stains");
				return extendOrder(order, source.getStainCount());
			}

			@Override
			public String toString() {
				return "Permutation stain matcher " + Arrays.toString(order);
			}

		}


		static class ClosestAngleMatcher implements StainMatcher {

			@Override
			public int[] match(StainMatrix source, StainMatrix target) {
				return bestAngleOrder(source, target);
			}

			@Override
			public String toString() {
				return "Closest angle stain matcher";
			}

		}

	}

}
