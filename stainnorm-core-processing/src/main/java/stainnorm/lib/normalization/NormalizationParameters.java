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

import java.util.Objects;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import stainnorm.lib.io.GsonTools;

/**
 * Immutable parameters for Macenko stain normalization.
 * <p>
 * Defaults are {@code io = 255}, {@code beta = 0.15}, {@code alpha = 1} and {@code verbose = false}.
 * Parameters are validated once, when they are built or parsed.
 */
public final class NormalizationParameters {

	/**
	 * Default transmitted light intensity.
	 */
	public static final double DEFAULT_IO = 255.0;

	/**
	 * Default optical density threshold for transparent pixels.
	 */
	public static final double DEFAULT_BETA = 0.15;

	/**
	 * Default percentile used for the pseudo-min and pseudo-max angles.
	 */
	public static final double DEFAULT_ALPHA = 1.0;

	private static final NormalizationParameters DEFAULT = builder().build();

	private double io = DEFAULT_IO;
	private double beta = DEFAULT_BETA;
	private double alpha = DEFAULT_ALPHA;
	private boolean verbose = false;
	private DegenerateChannelPolicy degenerateChannelPolicy = DegenerateChannelPolicy.ZERO;
	private NegativeConcentrationPolicy negativeConcentrationPolicy = NegativeConcentrationPolicy.CLAMP_NOISE;
	private boolean sourceFallback = true;

	private NormalizationParameters() {}

	private NormalizationParameters(NormalizationParameters other) {
		this.io = other.io;
		this.beta = other.beta;
		this.alpha = other.alpha;
		this.verbose = other.verbose;
		this.degenerateChannelPolicy = other.degenerateChannelPolicy;
		this.negativeConcentrationPolicy = other.negativeConcentrationPolicy;
		this.sourceFallback = other.sourceFallback;
	}

	/**
	 * Get the default parameters.
	 * @return
	 */
	public static NormalizationParameters getDefault() {
		return DEFAULT;
	}

	/**
	 * Create a new builder, initialized with default values.
	 * @return
	 */
	public static Builder builder() {
		return new Builder(new NormalizationParameters());
	}

	/**
	 * Create a new builder, initialized with the values of these parameters.
	 * @return
	 */
	public Builder toBuilder() {
		return new Builder(new NormalizationParameters(this));
	}

	/**
	 * Parse parameters from JSON.
	 * Missing or null fields take their default values.
	 *
	 * @param json
	 * @return
	 * @throws IllegalArgumentException if the JSON cannot be parsed or the parameters are invalid
	 */
	public static NormalizationParameters fromJson(String json) throws IllegalArgumentException {
		NormalizationParameters params;
		try {
			params = GsonTools.getInstance().fromJson(json, NormalizationParameters.class);
		} catch (JsonParseException e) {
			throw new IllegalArgumentException("Unable to parse normalization parameters: " + e.getLocalizedMessage(), e);
		}
		if (params == null)
			return DEFAULT;
		// Gson leaves enums null if they are given as null
		if (params.degenerateChannelPolicy == null)
			params.degenerateChannelPolicy = DegenerateChannelPolicy.ZERO;
		if (params.negativeConcentrationPolicy == null)
			params.negativeConcentrationPolicy = NegativeConcentrationPolicy.CLAMP_NOISE;
		return params.validate();
	}

	/**
	 * Convert these parameters to JSON.
	 * @return
	 */
	public String toJson() {
		Gson gson = GsonTools.getInstance(true);
		return gson.toJson(this);
	}

	private NormalizationParameters validate() throws IllegalArgumentException {
		if (!(io > 0) || !Double.isFinite(io))
			throw new IllegalArgumentException("Io must be a finite value > 0, but was " + io);
		if (!(beta >= 0) || !Double.isFinite(beta))
			throw new IllegalArgumentException("Beta must be a finite value >= 0, but was " + beta);
		if (!(alpha >= 0 && alpha < 50))
			throw new IllegalArgumentException("Alpha must be >= 0 and < 50, but was " + alpha);
		return this;
	}

	/**
	 * Transmitted light intensity, i.e. the value of a pixel with no stain.
	 * @return
	 */
	public double getIo() {
		return io;
	}

	/**
	 * Optical density threshold; pixels with an optical density below this in any channel are
	 * considered transparent and are not used for stain estimation.
	 * @return
	 */
	public double getBeta() {
		return beta;
	}

	/**
	 * Percentile (0-50) used for the robust pseudo-min and pseudo-max when estimating stains.
	 * @return
	 */
	public double getAlpha() {
		return alpha;
	}

	/**
	 * If true, a summary of each normalization is logged.
	 * @return
	 */
	public boolean isVerbose() {
		return verbose;
	}

	/**
	 * Policy for source channels with a 99th percentile of zero.
	 * @return
	 */
	public DegenerateChannelPolicy getDegenerateChannelPolicy() {
		return degenerateChannelPolicy;
	}

	/**
	 * Policy for negative concentrations after deconvolution.
	 * @return
	 */
	public NegativeConcentrationPolicy getNegativeConcentrationPolicy() {
		return negativeConcentrationPolicy;
	}

	/**
	 * If true, the target stains are used to deconvolve the source image whenever
	 * stains cannot be estimated for the source (e.g. because it contains no tissue).
	 * @return
	 */
	public boolean isSourceFallback() {
		return sourceFallback;
	}

	@Override
	public int hashCode() {
		return Objects.hash(io, beta, alpha, verbose, degenerateChannelPolicy, negativeConcentrationPolicy, sourceFallback);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof NormalizationParameters))
			return false;
		NormalizationParameters other = (NormalizationParameters)obj;
		return Double.compare(io, other.io) == 0 &&
				Double.compare(beta, other.beta) == 0 &&
				Double.compare(alpha, other.alpha) == 0 &&
				verbose == other.verbose &&
				degenerateChannelPolicy == other.degenerateChannelPolicy &&
				negativeConcentrationPolicy == other.negativeConcentrationPolicy &&
				sourceFallback == other.sourceFallback;
	}

	@Override
	public String toString() {
		return "NormalizationParameters [io=" + io + ", beta=" + beta + ", alpha=" + alpha + ", verbose=" + verbose
				+ ", degenerateChannelPolicy=" + degenerateChannelPolicy + ", negativeConcentrationPolicy="
				+ negativeConcentrationPolicy + ", sourceFallback=" + sourceFallback + "]";
	}


	/**
	 * Builder for {@link NormalizationParameters}.
	 */
	public static final class Builder {

		private final NormalizationParameters params;

		private Builder(NormalizationParameters params) {
			this.params = params;
		}

		/**
		 * Set the transmitted light intensity.
		 * @param io the value, or null to use the default
		 * @return this builder
		 */
		public Builder io(Double io) {
			params.io = io == null ? DEFAULT_IO : io;
			return this;
		}

		/**
		 * Set the optical density threshold for transparent pixels.
		 * @param beta the value, or null to use the default
		 * @return this builder
		 */
		public Builder beta(Double beta) {
			params.beta = beta == null ? DEFAULT_BETA : beta;
			return this;
		}

		/**
		 * Set the percentile used for the pseudo-min and pseudo-max angles.
		 * @param alpha the value, or null to use the default
		 * @return this builder
		 */
		public Builder alpha(Double alpha) {
			params.alpha = alpha == null ? DEFAULT_ALPHA : alpha;
			return this;
		}

		/**
		 * Request that a summary of each normalization is logged.
		 * @param verbose
		 * @return this builder
		 */
		public Builder verbose(boolean verbose) {
			params.verbose = verbose;
			return this;
		}

		/**
		 * Set the policy for degenerate source channels.
		 * @param policy
		 * @return this builder
		 */
		public Builder degenerateChannelPolicy(DegenerateChannelPolicy policy) {
			params.degenerateChannelPolicy = Objects.requireNonNull(policy);
			return this;
		}

		/**
		 * Set the policy for negative concentrations.
		 * @param policy
		 * @return this builder
		 */
		public Builder negativeConcentrationPolicy(NegativeConcentrationPolicy policy) {
			params.negativeConcentrationPolicy = Objects.requireNonNull(policy);
			return this;
		}

		/**
		 * Specify whether the target stains may be used for the source if source stain estimation fails.
		 * @param fallback
		 * @return this builder
		 */
		public Builder sourceFallback(boolean fallback) {
			params.sourceFallback = fallback;
			return this;
		}

		/**
		 * Build validated parameters.
		 * @return
		 * @throws IllegalArgumentException if any value is invalid
		 */
		public NormalizationParameters build() throws IllegalArgumentException {
			return new NormalizationParameters(params).validate();
		}

	}

}
