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

package stainnorm;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.reflect.TypeToken;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import stainnorm.app.MontageWriter;
import stainnorm.app.images.ImageFileTools;
import stainnorm.app.logging.LogManager;
import stainnorm.app.logging.LogManager.LogLevel;
import stainnorm.lib.color.StainMatrix;
import stainnorm.lib.io.GsonTools;
import stainnorm.lib.normalization.DegenerateChannelPolicy;
import stainnorm.lib.normalization.MacenkoNormalizer;
import stainnorm.lib.normalization.NegativeConcentrationPolicy;
import stainnorm.lib.normalization.NormalizationParameters;
import stainnorm.lib.normalization.NormalizationResult;
import stainnorm.lib.normalization.StainMatcher;

/**
 * Command line launcher to normalize the stain appearance of one image to match another.
 */
@Command(name = "stainnorm", description = {
		"Normalizes the stain appearance of a brightfield image to match a target image, using the method of Macenko et al."},
		mixinStandardHelpOptions = true, version = "StainNorm 0.1.0", sortOptions = false)
public class StainNorm implements Callable<Integer> {

	private static final Logger logger = LoggerFactory.getLogger(StainNorm.class);

	@Parameters(index = "0", paramLabel = "source", description = "Path to the image to normalize.")
	File source;

	@Parameters(index = "1", paramLabel = "target", description = "Path to the image with the desired stain appearance.")
	File target;

	@Parameters(index = "2", paramLabel = "output", description = "Path to write the normalized image (format taken from the extension, default PNG).")
	File output;

	@Option(names = {"--io"}, description = "Transmitted light intensity (default = 255).")
	Double io;

	@Option(names = {"--beta"}, description = "Optical density threshold for transparent pixels (default = 0.15).")
	Double beta;

	@Option(names = {"--alpha"}, description = "Percentile used for robust stain angle extremes (default = 1).")
	Double alpha;

	@Option(names = {"-v", "--verbose"}, description = "Log a summary of the estimated stains and scale factors.")
	boolean verbose;

	@Option(names = {"--stain-order"}, split = ",", paramLabel = "n", description = {
			"Order in which source stains are matched to target stains, e.g. 2,1 to swap the first two stains.",
			"Indices start at 1."})
	int[] stainOrder;

	@Option(names = {"--match-stains"}, description = "Match source stains to the closest target stains automatically.")
	boolean matchStains;

	@Option(names = {"--degenerate"}, description = {"Handling of stains with no signal in the source image (default = ZERO).",
			"Options: ${COMPLETION-CANDIDATES}"})
	DegenerateChannelPolicy degenerate;

	@Option(names = {"--clamp-negative"}, description = {"Handling of negative stain concentrations (default = CLAMP_NOISE).",
			"Options: ${COMPLETION-CANDIDATES}"})
	NegativeConcentrationPolicy clampNegative;

	@Option(names = {"--no-source-fallback"}, description = "Fail if stains cannot be estimated for the source image, rather than using the target stains.")
	boolean noSourceFallback;

	@Option(names = {"--export-stains"}, paramLabel = "json", description = "Write the source and target stain matrices to a JSON file.")
	File exportStains;

	@Option(names = {"--config"}, paramLabel = "json", description = "Read parameters from a JSON file; command line options take precedence.")
	File config;

	@Option(names = {"--montage"}, paramLabel = "image", description = "Write the source, target and normalized images side by side.")
	File montage;

	@Option(names = {"-l", "--log"}, description = {"Log level (default = INFO).", "Options: ${COMPLETION-CANDIDATES}"})
	LogLevel logLevel = LogLevel.INFO;

	/**
	 * Main method to launch stain normalization.
	 * @param args
	 */
	public static void main(String[] args) {
		int exitCode = createCommandLine(new StainNorm()).execute(args);
		System.exit(exitCode);
	}

	/**
	 * Create a command line for the specified command, mapping all failures to exit code 1.
	 * @param command
	 * @return
	 */
	static CommandLine createCommandLine(StainNorm command) {
		CommandLine cmd = new CommandLine(command);
		cmd.setCaseInsensitiveEnumValuesAllowed(true);
		cmd.setExpandAtFiles(false);
		cmd.setExitCodeExceptionMapper(t -> 1);
		cmd.setParameterExceptionHandler((ex, args) -> {
			var err = ex.getCommandLine().getErr();
			err.println(ex.getMessage());
			ex.getCommandLine().usage(err);
			return 1;
		});
		return cmd;
	}

	@Override
	public Integer call() throws Exception {
		if (logLevel != null)
			LogManager.setRootLogLevel(logLevel);

		try {
			var builder = MacenkoNormalizer.builder()
					.parameters(buildParameters())
					.stainMatcher(buildStainMatcher());
			if (montage != null)
				builder.addListener(new MontageWriter(montage));
			var normalizer = builder.build();

			var imgSource = ImageFileTools.readImage(source);
			var imgTarget = ImageFileTools.readImage(target);
			logger.info("Normalizing {} to match {}", source.getName(), target.getName());
			NormalizationResult result = normalizer.normalizeWithDetails(imgSource, imgTarget);
			ImageFileTools.writeImage(result.getImage(), output);
			logger.info("Normalized image written to {}", output.getAbsolutePath());
			if (exportStains != null)
				writeStains(result, exportStains);
		} catch (Exception e) {
			logger.error("Stain normalization failed: " + e.getLocalizedMessage(), e);
			return 1;
		}
		return 0;
	}

	/**
	 * Create parameters from the config file (if any), overridden by command line options.
	 * @return
	 * @throws IOException if the config file cannot be read
	 */
	NormalizationParameters buildParameters() throws IOException {
		NormalizationParameters params = NormalizationParameters.getDefault();
		if (config != null) {
			logger.debug("Reading parameters from {}", config);
			params = NormalizationParameters.fromJson(Files.readString(config.toPath(), StandardCharsets.UTF_8));
		}
		var builder = params.toBuilder();
		if (io != null)
			builder.io(io);
		if (beta != null)
			builder.beta(beta);
		if (alpha != null)
			builder.alpha(alpha);
		if (verbose)
			builder.verbose(true);
		if (degenerate != null)
			builder.degenerateChannelPolicy(degenerate);
		if (clampNegative != null)
			builder.negativeConcentrationPolicy(clampNegative);
		if (noSourceFallback)
			builder.sourceFallback(false);
		return builder.build();
	}

	/**
	 * Create the stain matcher requested on the command line.
	 * @return
	 * @throws IllegalArgumentException if both a stain order and automatic matching are requested
	 */
	StainMatcher buildStainMatcher() throws IllegalArgumentException {
		if (stainOrder != null && stainOrder.length > 0) {
			if (matchStains)
				throw new IllegalArgumentException("--stain-order and --match-stains cannot be used together");
			int[] order = new int[stainOrder.length];
			for (int i = 0; i < order.length; i++)
				order[i] = stainOrder[i] - 1;
			return StainMatcher.permutation(order);
		}
		if (matchStains)
			return StainMatcher.closestAngle();
		return StainMatcher.identity();
	}

	private static void writeStains(NormalizationResult result, File file) throws IOException {
		Map<String, StainMatrix> map = new LinkedHashMap<>();
		map.put("source", result.getSourceStains());
		map.put("target", result.getTargetStains());
		String json = GsonTools.getInstance(true).toJson(map, new TypeToken<Map<String, StainMatrix>>() {}.getType());
		Files.writeString(file.toPath(), json, StandardCharsets.UTF_8);
		logger.info("Stain matrices written to {}", file.getAbsolutePath());
	}

}
