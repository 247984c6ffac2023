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

package stainnorm.app;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import stainnorm.app.images.ImageFileTools;
import stainnorm.lib.awt.common.BufferedImageTools;
import stainnorm.lib.images.RgbImage;
import stainnorm.lib.normalization.NormalizationListener;
import stainnorm.lib.normalization.NormalizationResult;

/**
 * Listener that writes the source, target and normalized images side by side to a file.
 */
public class MontageWriter implements NormalizationListener {

	private static final Logger logger = LoggerFactory.getLogger(MontageWriter.class);

	/**
	 * Default spacing between images, in pixels.
	 */
	public static final int DEFAULT_SPACING = 10;

	private final File file;
	private final int spacing;

	/**
	 * Create a montage writer with the default spacing.
	 * @param file
	 */
	public MontageWriter(File file) {
		this(file, DEFAULT_SPACING);
	}

	/**
	 * Create a montage writer.
	 * @param file output file
	 * @param spacing spacing between images, in pixels
	 */
	public MontageWriter(File file, int spacing) {
		this.file = Objects.requireNonNull(file);
		if (spacing < 0)
			throw new IllegalArgumentException("Spacing must be >= 0, but was " + spacing);
		this.spacing = spacing;
	}

	@Override
	public void normalizationComplete(RgbImage source, RgbImage target, NormalizationResult result) {
		var montage = BufferedImageTools.createMontage(List.of(source, target, result.getImage()), spacing);
		try {
			ImageFileTools.writeImage(montage, file);
			logger.info("Montage written to {}", file.getAbsolutePath());
		} catch (IOException e) {
			throw new UncheckedIOException("Unable to write montage to " + file, e);
		}
	}

}
