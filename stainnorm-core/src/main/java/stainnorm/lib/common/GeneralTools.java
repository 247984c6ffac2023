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

package stainnorm.lib.common;

import java.io.File;
import java.text.NumberFormat;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * A collection of generally useful static methods.
 */
public final class GeneralTools {

	// Static methods only
	private GeneralTools() {
		throw new AssertionError();
	}

	private static final Map<Locale, NumberFormat> formatters = new HashMap<>();

	/**
	 * Check if a String is null or empty (after trimming).
	 * @param s
	 * @return
	 */
	public static boolean isNullOrBlank(final String s) {
		return s == null || s.isBlank();
	}

	/**
	 * Get the extension of a file name, in lower case and including the dot (e.g. ".png").
	 * @param file
	 * @return the extension, or an empty String if there is none
	 */
	public static String getExtension(final File file) {
		String name = file.getName();
		int ind = name.lastIndexOf('.');
		if (ind < 0 || ind == name.length() - 1)
			return "";
		return name.substring(ind).toLowerCase(Locale.ROOT);
	}

	/**
	 * Format a value with a maximum number of decimal places, using a specified Locale.
	 *
	 * @param locale
	 * @param value
	 * @param maxDecimalPlaces
	 * @return
	 */
	public static synchronized String formatNumber(final Locale locale, final double value, final int maxDecimalPlaces) {
		NumberFormat nf = formatters.get(locale);
		if (nf == null) {
			nf = NumberFormat.getInstance(locale);
			nf.setGroupingUsed(false);
			formatters.put(locale, nf);
		}
		nf.setMaximumFractionDigits(maxDecimalPlaces);
		return nf.format(value);
	}

	/**
	 * Format a value with a maximum number of decimal places, using {@link Locale#US}.
	 * @param value
	 * @param maxDecimalPlaces
	 * @return
	 */
	public static String formatNumber(final double value, final int maxDecimalPlaces) {
		return formatNumber(Locale.US, value, maxDecimalPlaces);
	}

	/**
	 * Convert a double array to a String, with a specified delimiter and number of decimal places.
	 *
	 * @param locale
	 * @param array
	 * @param delimiter
	 * @param nDecimalPlaces
	 * @return
	 */
	public static String arrayToString(final Locale locale, final double[] array, final String delimiter, final int nDecimalPlaces) {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < array.length; i++) {
			sb.append(formatNumber(locale, array[i], nDecimalPlaces));
			if (i < array.length-1)
				sb.append(delimiter);
		}
		return sb.toString();
	}

	/**
	 * Convert a double array to a String using a space as a delimiter.
	 *
	 * @param locale
	 * @param array
	 * @param nDecimalPlaces
	 * @return
	 */
	public static String arrayToString(final Locale locale, final double[] array, final int nDecimalPlaces) {
		return arrayToString(locale, array, " ", nDecimalPlaces);
	}

}
