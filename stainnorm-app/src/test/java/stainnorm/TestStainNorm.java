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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import javax.imageio.ImageIO;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.gson.reflect.TypeToken;

import stainnorm.app.images.ImageFileTools;
import stainnorm.app.logging.LogManager.LogLevel;
import stainnorm.lib.color.StainMatrix;
import stainnorm.lib.color.StainMatrix.DefaultStainMatrix;
import stainnorm.lib.common.ColorTools;
import stainnorm.lib.images.RgbImage;
import stainnorm.lib.io.GsonTools;
import stainnorm.lib.normalization.DegenerateChannelPolicy;
import stainnorm.lib.normalization.NegativeConcentrationPolicy;
import stainnorm.lib.normalization.NormalizationParameters;

@SuppressWarnings("javadoc")
public class TestStainNorm {

	private static final StainMatrix STAINS_HE = StainMatrix.makeDefaultStainMatrix(DefaultStainMatrix.H_E, 255);

	@TempDir
	Path tempDir;

	private static StainNorm parse(String... args) {
		var command = new StainNorm();
		StainNorm.createCommandLine(command).parseArgs(args);
		return command;
	}

	@Test
	public void test_defaults() throws IOException {
		var command = parse("source.png", "target.png", "output.png");
		assertEquals(new File("source.png"), command.source);
		assertEquals(new File("target.png"), command.target);
		assertEquals(new File("output.png"), command.output);
		assertNull(command.io);
		assertNull(command.stainOrder);
		assertFalse(command.verbose);
		assertEquals(LogLevel.INFO, command.logLevel);
		assertEquals(NormalizationParameters.getDefault(), command.buildParameters());

		var stains = STAINS_HE.withResidual();
		assertArrayEquals(new int[] {0, 1, 2}, command.buildStainMatcher().match(stains.permute(1, 0, 2), stains));
	}

	@Test
	public void test_options() throws IOException {
		var command = parse("--io", "240", "--beta", "0.2", "--alpha", "2", "-v",
				"--degenerate", "fail", "--clamp-negative", "clamp_all", "--no-source-fallback", "-l", "debug",
				"source.png", "target.png", "output.png");
		var params = command.buildParameters();
		assertEquals(240.0, params.getIo());
		assertEquals(0.2, params.getBeta());
		assertEquals(2.0, params.getAlpha());
		assertTrue(params.isVerbose());
		assertEquals(DegenerateChannelPolicy.FAIL, params.getDegenerateChannelPolicy());
		assertEquals(NegativeConcentrationPolicy.CLAMP_ALL, params.getNegativeConcentrationPolicy());
		assertFalse(params.isSourceFallback());
		assertEquals(LogLevel.DEBUG, command.logLevel);
	}

	@Test
	public void test_stainOrder() {
		var stains = STAINS_HE.withResidual();
		var swapped = stains.permute(1, 0, 2);

		var command = parse("--stain-order", "2,1", "a.png", "b.png", "c.png");
		assertArrayEquals(new int[] {2, 1}, command.stainOrder);
		assertArrayEquals(new int[] {1, 0, 2}, command.buildStainMatcher().match(swapped, stains));

		command = parse("--match-stains", "a.png", "b.png", "c.png");
		assertArrayEquals(new int[] {1, 0, 2}, command.buildStainMatcher().match(swapped, stains));

		var both = parse("--match-stains", "--stain-order", "2,1", "a.png", "b.png", "c.png");
		assertThrows(IllegalArgumentException.class, () -> both.buildStainMatcher());

		var invalid = parse("--stain-order", "1,1", "a.png", "b.png", "c.png");
		assertThrows(IllegalArgumentException.class, () -> invalid.buildStainMatcher());
	}

	@Test
	public void test_config() throws IOException {
		var config = tempDir.resolve("config.json");
		Files.writeString(config, "{\"io\": 250, \"beta\": 0.25, \"degenerateChannelPolicy\": \"UNIT\"}", StandardCharsets.UTF_8);

		var params = parse("--config", config.toString(), "--beta", "0.1", "a.png", "b.png", "c.png").buildParameters();
		assertEquals(250.0, params.getIo());
		assertEquals(0.1, params.getBeta());
		assertEquals(NormalizationParameters.DEFAULT_ALPHA, params.getAlpha());
		assertEquals(DegenerateChannelPolicy.UNIT, params.getDegenerateChannelPolicy());
	}

	@Test
	public void test_missingParameters() {
		var err = new StringWriter();
		var cmd = StainNorm.createCommandLine(new StainNorm());
		cmd.setErr(new PrintWriter(err));
		assertEquals(1, cmd.execute("source.png", "target.png"));
		assertTrue(err.toString().contains("output"));
	}

	@Test
	public void test_invalidOption() {
		var cmd = StainNorm.createCommandLine(new StainNorm());
		cmd.setErr(new PrintWriter(new StringWriter()));
		assertEquals(1, cmd.execute("--degenerate", "sometimes", "a.png", "b.png", "c.png"));
	}

	@Test
	public void test_invalidSettingsLogged() throws IOException {
		var config = tempDir.resolve("bad.json");
		Files.writeString(config, "{\"io\": ", StandardCharsets.UTF_8);
		var source = tempDir.resolve("source.png").toString();

		var err = new StringWriter();
		var cmd = StainNorm.createCommandLine(new StainNorm());
		cmd.setErr(new PrintWriter(err));
		assertEquals(1, cmd.execute("-l", "off", "--config", config.toString(), source, source, "out.png"));
		assertEquals("", err.toString());

		err = new StringWriter();
		cmd = StainNorm.createCommandLine(new StainNorm());
		cmd.setErr(new PrintWriter(err));
		assertEquals(1, cmd.execute("-l", "off", "--match-stains", "--stain-order", "2,1", source, source, "out.png"));
		assertEquals("", err.toString());
	}

	@Test
	public void test_normalize() throws IOException {
		File source = tempDir.resolve("source.png").toFile();
		File target = tempDir.resolve("target.png").toFile();
		File output = tempDir.resolve("output.png").toFile();
		File stains = tempDir.resolve("stains.json").toFile();
		File montage = tempDir.resolve("montage.png").toFile();
		var imgSource = createImage(30, 1.0);
		ImageFileTools.writeImage(imgSource, source);
		ImageFileTools.writeImage(createImage(20, 1.5), target);

		int exitCode = StainNorm.createCommandLine(new StainNorm()).execute(
				"--export-stains", stains.getPath(),
				"--montage", montage.getPath(),
				"--match-stains",
				"-l", "warn",
				source.getPath(), target.getPath(), output.getPath());
		assertEquals(0, exitCode);

		var imgOutput = ImageFileTools.readImage(output);
		assertTrue(imgSource.sameSize(imgOutput));

		var imgMontage = ImageIO.read(montage);
		assertEquals(30 + 20 + 30 + 20, imgMontage.getWidth());
		assertEquals(30, imgMontage.getHeight());

		Map<String, StainMatrix> map = GsonTools.getInstance().fromJson(
				Files.readString(stains.toPath(), StandardCharsets.UTF_8),
				new TypeToken<Map<String, StainMatrix>>() {}.getType());
		assertEquals(3, map.get("source").getStainCount());
		assertEquals(3, map.get("target").getStainCount());
		assertTrue(map.get("target").hasResidual());
	}

	@Test
	public void test_normalizeFailure() throws IOException {
		File source = tempDir.resolve("source.png").toFile();
		File target = tempDir.resolve("white.png").toFile();
		File output = tempDir.resolve("output.png").toFile();
		ImageFileTools.writeImage(createImage(10, 1.0), source);
		ImageFileTools.writeImage(RgbImage.filled(10, 10, ColorTools.WHITE), target);

		int exitCode = StainNorm.createCommandLine(new StainNorm()).execute(
				"-l", "off", source.getPath(), target.getPath(), output.getPath());
		assertEquals(1, exitCode);
		assertFalse(output.exists());
	}

	@Test
	public void test_missingFile() {
		int exitCode = StainNorm.createCommandLine(new StainNorm()).execute(
				"-l", "off",
				tempDir.resolve("missing.png").toString(),
				tempDir.resolve("missing2.png").toString(),
				tempDir.resolve("output.png").toString());
		assertEquals(1, exitCode);
	}

	/**
	 * Create an image with increasing hematoxylin along x and increasing eosin along y.
	 */
	private static RgbImage createImage(int size, double maxConcentration) {
		double[] h = STAINS_HE.getStain(1).getArray();
		double[] e = STAINS_HE.getStain(2).getArray();
		int[] rgb = new int[size * size];
		for (int y = 0; y < size; y++) {
			for (int x = 0; x < size; x++) {
				double c1 = maxConcentration * x / (size - 1);
				double c2 = maxConcentration * y / (size - 1);
				int[] values = new int[3];
				for (int c = 0; c < 3; c++)
					values[c] = ColorTools.round255(255 * Math.exp(-(c1 * h[c] + c2 * e[c])) - 1);
				rgb[y * size + x] = ColorTools.packRGB(values[0], values[1], values[2]);
			}
		}
		return RgbImage.create(size, size, rgb);
	}

}
