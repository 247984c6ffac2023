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

/**
 * Exception thrown when a source concentration channel has a 99th percentile of zero,
 * and {@link DegenerateChannelPolicy#FAIL} is in use.
 */
public class DegenerateChannelException extends StainNormalizationException {

	private static final long serialVersionUID = 1L;

	private final int channel;

	/**
	 * Constructor.
	 * @param channel zero-based index of the degenerate channel
	 * @param message
	 */
	public DegenerateChannelException(int channel, String message) {
		super(message);
		this.channel = channel;
	}

	/**
	 * Get the zero-based index of the degenerate channel.
	 * @return
	 */
	public int getChannel() {
		return channel;
	}

}
