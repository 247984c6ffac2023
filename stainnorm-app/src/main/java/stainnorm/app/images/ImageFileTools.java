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

package stainnorm.app.images;

import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;

import javax.imageio.ImageIO;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import stainnorm.lib.awt.common.BufferedImageTools;
import stainnorm.lib.common.GeneralTools;
import stainnorm.lib.images.RgbImage;

/**
 * Read and write RGB images using ImageIO.
 */
public final class ImageFileTools {

	private static final Logger logger = LoggerFactory.getLogger(ImageFileTools.class);

	private static final String DEFAULT_FORMAT = "png";

	// Suppressed default constructor for non-instantiability
	private ImageFileTools() {
		throw new AssertionError();
	}

	/**
	 * Read an RGB image from a file.
	 * @param file
	 * @return
	 * @throws IOException if the file does not exist or cannot be read as an image
	 */
	public static RgbImage readImage(File file) throws IOException {
		if (!file.isFile())
			throw new IOException("Image file not found: " + file);
		BufferedImage img = ImageIO.read(file);
		if (img == null)
			throw new IOException("Unable to read image from " + file);
		logger.debug("Read {}x{} image from {}", img.getWidth(), img.getHeight(), file);
		return BufferedImageTools.toRgbImage(img);
	}

	/**
	 * Write an RGB image to a file, using the file extension to determine the format.
	 * @param img
	 * @param file
	 * @throws IOException
	 */
	public static void writeImage(RgbImage img, File file) throws IOException {
		writeImage(BufferedImageTools.toBufferedImage(img), file);
	}

	/**
	 * Write an image to a file, using the file extension to determine the format.
	 * PNG is used if the file has no extension.
	 * @param img
	 * @param file
	 * @throws IOException if no writer is available for the format, or writing fails
	 */
	public static void writeImage(BufferedImage img, File file) throws IOException {
		String format = getFormatName(file);
		var parent = file.getAbsoluteFile().getParentFile();
		if (parent != null && !parent.exists())
			parent.mkdirs();
		if (!ImageIO.write(img, format, file))
			throw new IOException("No image writer available for format '" + format + "'");
		logger.debug("Image written to {}", file);
	}

	static String getFormatName(File file) {
		String ext = GeneralTools.getExtension(file);
		if (GeneralTools.isNullOrBlank(ext))
			return DEFAULT_FORMAT;
		ext = ext.substring(1);
		if ("jpeg".equals(ext))
			return "jpg";
		if ("tiff".equals(ext))
			return "tif";
		return ext;
	}

}
