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

package stainnorm.lib.images;

import java.util.Arrays;

import stainnorm.lib.common.ColorTools;

/**
 * Immutable 8-bit RGB image.
 * <p>
 * Pixels are stored as packed RGB values in row-major order, so that the pixel at (x, y)
 * is found at index {@code y * width + x}. Any alpha values are discarded.
 */
public final class RgbImage {

	private final int width;
	private final int height;
	private final int[] rgb;

	private RgbImage(int width, int height, int[] rgb) {
		this.width = width;
		this.height = height;
		this.rgb = rgb;
	}

	/**
	 * Create an image from packed RGB values.
	 * The array is copied, and alpha values are set to 255.
	 *
	 * @param width image width, must be &gt; 0
	 * @param height image height, must be &gt; 0
	 * @param rgb packed RGB values, row-major, of length width * height
	 * @return
	 * @throws IllegalArgumentException if the dimensions are invalid or do not match the array length
	 */
	public static RgbImage create(int width, int height, int[] rgb) throws IllegalArgumentException {
		if (width <= 0 || height <= 0)
			throw new IllegalArgumentException("Image dimensions must be > 0, but were " + width + "x" + height);
		if (rgb == null || rgb.length != width * height)
			throw new IllegalArgumentException("Expected " + (width * height) + " pixels for a " + width + "x" + height + " image, but got " +
					(rgb == null ? "null" : rgb.length));
		int[] pixels = new int[rgb.length];
		for (int i = 0; i < rgb.length; i++)
			pixels[i] = rgb[i] | 0xff000000;
		return new RgbImage(width, height, pixels);
	}

	/**
	 * Create an image from separate channel values, indexed as {@code [y][x][channel]}.
	 * Values are clipped to 0-255.
	 *
	 * @param pixels
	 * @return
	 * @throws IllegalArgumentException if the array is empty, ragged or does not have 3 channels
	 */
	public static RgbImage fromChannels(int[][][] pixels) throws IllegalArgumentException {
		if (pixels == null || pixels.length == 0 || pixels[0].length == 0)
			throw new IllegalArgumentException("Pixel array must not be empty");
		int height = pixels.length;
		int width = pixels[0].length;
		int[] rgb = new int[width * height];
		for (int y = 0; y < height; y++) {
			if (pixels[y].length != width)
				throw new IllegalArgumentException("Row " + y + " has " + pixels[y].length + " pixels, expected " + width);
			for (int x = 0; x < width; x++) {
				int[] px = pixels[y][x];
				if (px.length != 3)
					throw new IllegalArgumentException("Expected 3 channels, but pixel (" + x + ", " + y + ") has " + px.length);
				rgb[y * width + x] = ColorTools.packClippedRGB(px[0], px[1], px[2]);
			}
		}
		return new RgbImage(width, height, rgb);
	}

	/**
	 * Create an image where every pixel has the same value.
	 * @param width
	 * @param height
	 * @param rgb packed RGB value
	 * @return
	 */
	public static RgbImage filled(int width, int height, int rgb) {
		int[] pixels = new int[width * height];
		Arrays.fill(pixels, rgb);
		return create(width, height, pixels);
	}

	/**
	 * Get the image width.
	 * @return
	 */
	public int getWidth() {
		return width;
	}

	/**
	 * Get the image height.
	 * @return
	 */
	public int getHeight() {
		return height;
	}

	/**
	 * Get the total number of pixels.
	 * @return
	 */
	public int getPixelCount() {
		return rgb.length;
	}

	/**
	 * Get the packed RGB value at the specified location.
	 * @param x
	 * @param y
	 * @return
	 */
	public int getRGB(int x, int y) {
		return rgb[y * width + x];
	}

	/**
	 * Get the value of a single channel at the specified location.
	 * @param x
	 * @param y
	 * @param channel 0 (red), 1 (green) or 2 (blue)
	 * @return
	 */
	public int getChannelValue(int x, int y, int channel) {
		int val = getRGB(x, y);
		switch (channel) {
		case 0:
			return ColorTools.red(val);
		case 1:
			return ColorTools.green(val);
		case 2:
			return ColorTools.blue(val);
		default:
			throw new IllegalArgumentException("Channel must be 0, 1 or 2, but was " + channel);
		}
	}

	/**
	 * Get a copy of the packed RGB values, in row-major order.
	 * @return
	 */
	public int[] getRGB() {
		return rgb.clone();
	}

	/**
	 * Get the channel values as an array indexed as {@code [y][x][channel]}.
	 * @return
	 * @see #fromChannels(int[][][])
	 */
	public int[][][] toChannels() {
		int[][][] pixels = new int[height][width][3];
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				int v = rgb[y * width + x];
				pixels[y][x][0] = ColorTools.red(v);
				pixels[y][x][1] = ColorTools.green(v);
				pixels[y][x][2] = ColorTools.blue(v);
			}
		}
		return pixels;
	}

	/**
	 * Check if two images have the same width and height.
	 * @param other
	 * @return
	 */
	public boolean sameSize(RgbImage other) {
		return other != null && width == other.width && height == other.height;
	}

	@Override
	public int hashCode() {
		return 31 * (31 * width + height) + Arrays.hashCode(rgb);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof RgbImage))
			return false;
		RgbImage other = (RgbImage)obj;
		return width == other.width && height == other.height && Arrays.equals(rgb, other.rgb);
	}

	@Override
	public String toString() {
		return "RgbImage (" + width + "x" + height + ")";
	}

}
