/*-
 * #%L
 * This file is part of AstroView.
 * %%
 * Copyright (C) 2025 AstroView developers
 * %%
 * AstroView is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * AstroView is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with AstroView.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package astroview.lib.processing;

import astroview.lib.images.ImageBuffer;
import astroview.lib.images.PixelType;

/**
 * Static methods to convert images to single-channel intensity images.
 */
public final class ColorConversion {

	/**
	 * Red weight used for luminance.
	 */
	public static final double WEIGHT_RED = 0.2125;

	/**
	 * Green weight used for luminance.
	 */
	public static final double WEIGHT_GREEN = 0.7154;

	/**
	 * Blue weight used for luminance.
	 */
	public static final double WEIGHT_BLUE = 0.0721;

	// Suppress default constructor for non-instantiability
	private ColorConversion() {
		throw new AssertionError();
	}

	/**
	 * Compute the luminance of an image as {@code 0.2125*R + 0.7154*G + 0.0721*B}.
	 * Any alpha channel is ignored. For a single-channel image, a copy of its only channel is returned.
	 * @param buffer
	 * @return luminance values, in the intensity units of the input
	 */
	public static double[] toLuminance(ImageBuffer buffer) {
		if (buffer.isSingleChannel())
			return buffer.getChannel(0);
		double[] red = buffer.getChannel(0);
		double[] green = buffer.getChannel(1);
		double[] blue = buffer.getChannel(2);
		double[] lum = new double[red.length];
		for (int i = 0; i < lum.length; i++)
			lum[i] = WEIGHT_RED * red[i] + WEIGHT_GREEN * green[i] + WEIGHT_BLUE * blue[i];
		return lum;
	}

	/**
	 * Linearly rescale values so that the minimum becomes 0 and the maximum 255, and convert the result to 8-bit.
	 * If all values are the same, they are converted to 8-bit without rescaling.
	 * @param values
	 * @return a new array containing integer values in the range 0-255
	 */
	public static double[] normalizeToUint8(double[] values) {
		double min = Double.POSITIVE_INFINITY;
		double max = Double.NEGATIVE_INFINITY;
		for (double v : values) {
			if (v < min)
				min = v;
			if (v > max)
				max = v;
		}
		double[] output = new double[values.length];
		double range = max - min;
		for (int i = 0; i < values.length; i++) {
			double v = range > 0 ? (values[i] - min) / range * 255.0 : values[i];
			output[i] = PixelType.UINT8.convertValue(v);
		}
		return output;
	}

	/**
	 * Get a single-channel 8-bit intensity image.
	 * Single-channel UINT8 images are returned unchanged; anything else is converted to luminance and normalized.
	 * @param buffer
	 * @return
	 * @see #toLuminance(ImageBuffer)
	 * @see #normalizeToUint8(double[])
	 */
	public static double[] toUint8Intensities(ImageBuffer buffer) {
		if (buffer.isSingleChannel() && buffer.getPixelType() == PixelType.UINT8)
			return buffer.getChannel(0);
		return normalizeToUint8(toLuminance(buffer));
	}

}
