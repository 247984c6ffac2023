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

package stainnorm.lib.awt.common;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.List;

import stainnorm.lib.images.RgbImage;

/**
 * Static methods to convert between {@link RgbImage} and {@link BufferedImage}.
 */
public final class BufferedImageTools {

	// Suppressed default constructor for non-instantiability
	private BufferedImageTools() {
		throw new AssertionError();
	}

	/**
	 * Check if a BufferedImage type represents an 8-bit RGB image, with or without alpha.
	 * @param type
	 * @return
	 */
	public static boolean is8bitColorType(int type) {
		return type == BufferedImage.TYPE_INT_RGB ||
				type == BufferedImage.TYPE_INT_BGR ||
				type == BufferedImage.TYPE_INT_ARGB ||
				type == BufferedImage.TYPE_INT_ARGB_PRE ||
				type == BufferedImage.TYPE_3BYTE_BGR ||
				type == BufferedImage.TYPE_4BYTE_ABGR ||
				type == BufferedImage.TYPE_4BYTE_ABGR_PRE;
	}

	/**
	 * Ensure that an BufferedImage is of the requested type, by drawing it on a new image if required.
	 * Images that already have the same type are returned unchanged.
	 *
	 * @param img the input image
	 * @param requestedType the type to which the image should be converted
	 * @return the (possibly-new) output image
	 */
	public static BufferedImage ensureBufferedImageType(final BufferedImage img, int requestedType) {
		if (img.getType() != requestedType) {
			BufferedImage img2 = new BufferedImage(img.getWidth(), img.getHeight(), requestedType);
			Graphics2D g2d = img2.createGraphics();
			g2d.drawImage(img, 0, 0, null);
			g2d.dispose();
			return img2;
		}
		return img;
	}

	/**
	 * Convert a BufferedImage to an {@link RgbImage}.
	 * <p>
	 * Images that are not 8-bit RGB (e.g. indexed or grayscale) are first drawn onto an RGB image.
	 *
	 * @param img
	 * @return
	 */
	public static RgbImage toRgbImage(final BufferedImage img) {
		BufferedImage imgRGB = is8bitColorType(img.getType()) ? img : ensureBufferedImageType(img, BufferedImage.TYPE_INT_RGB);
		int[] rgb = imgRGB.getRGB(0, 0, imgRGB.getWidth(), imgRGB.getHeight(), null, 0, imgRGB.getWidth());
		return RgbImage.create(imgRGB.getWidth(), imgRGB.getHeight(), rgb);
	}

	/**
	 * Convert an {@link RgbImage} to a BufferedImage of type {@link BufferedImage#TYPE_INT_RGB}.
	 * @param img
	 * @return
	 */
	public static BufferedImage toBufferedImage(final RgbImage img) {
		BufferedImage imgBuf = new BufferedImage(img.getWidth(), img.getHeight(), BufferedImage.TYPE_INT_RGB);
		imgBuf.setRGB(0, 0, img.getWidth(), img.getHeight(), img.getRGB(), 0, img.getWidth());
		return imgBuf;
	}

	/**
	 * Create a new image by placing images side by side, aligned at the top.
	 * Any uncovered area is white.
	 *
	 * @param images
	 * @param spacing number of pixels between images
	 * @return
	 */
	public static BufferedImage createMontage(final List<RgbImage> images, int spacing) {
		if (images.isEmpty())
			throw new IllegalArgumentException("At least one image is required for a montage");
		int width = spacing * (images.size() - 1);
		int height = 0;
		for (var img : images) {
			width += img.getWidth();
			height = Math.max(height, img.getHeight());
		}
		BufferedImage montage = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
		Graphics2D g2d = montage.createGraphics();
		g2d.setColor(java.awt.Color.WHITE);
		g2d.fillRect(0, 0, width, height);
		int x = 0;
		for (var img : images) {
			g2d.drawImage(toBufferedImage(img), x, 0, null);
			x += img.getWidth() + spacing;
		}
		g2d.dispose();
		return montage;
	}

}
