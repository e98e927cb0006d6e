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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import astroview.lib.analysis.stats.Histogram;
import astroview.lib.images.ImageBuffer;
import astroview.lib.images.PixelType;

/**
 * Global histogram equalization of 8-bit intensities.
 * <p>
 * The lookup table is computed from the cumulative histogram as
 * {@code round((cdf[i] - cdfMin) / (cdfMax - cdfMin) * 255)}, where {@code cdfMin} is the smallest non-zero
 * cumulative count and {@code cdfMax} the total number of pixels.
 * If all pixels share the same intensity, the lookup table is the identity.
 */
public final class HistogramEqualization {

	private static final Logger logger = LoggerFactory.getLogger(HistogramEqualization.class);

	// Suppress default constructor for non-instantiability
	private HistogramEqualization() {
		throw new AssertionError();
	}

	/**
	 * Equalize the histogram of an image.
	 * <p>
	 * Images other than single-channel UINT8 are first converted to luminance and normalized to 0-255.
	 * @param buffer
	 * @return a single-channel UINT8 image
	 * @see ColorConversion#toUint8Intensities(ImageBuffer)
	 */
	public static ImageBuffer equalize(ImageBuffer buffer) {
		double[] values = ColorConversion.toUint8Intensities(buffer);
		int[] lut = computeLookupTable(new Histogram(values));
		for (int i = 0; i < values.length; i++)
			values[i] = lut[(int)values[i]];
		return ImageBuffer.createSingleChannel(PixelType.UINT8, buffer.getWidth(), buffer.getHeight(), values);
	}

	/**
	 * Compute the 256-entry equalization lookup table for a histogram.
	 * @param histogram
	 * @return
	 */
	public static int[] computeLookupTable(Histogram histogram) {
		long[] cdf = histogram.getCumulativeCounts();
		long cdfMin = 0;
		for (long c : cdf) {
			if (c > 0) {
				cdfMin = c;
				break;
			}
		}
		long cdfMax = cdf[cdf.length - 1];
		int[] lut = new int[cdf.length];
		if (cdfMax <= cdfMin) {
			logger.debug("Single intensity image, equalization will not change values");
			for (int i = 0; i < lut.length; i++)
				lut[i] = i;
			return lut;
		}
		double scale = 255.0 / (cdfMax - cdfMin);
		for (int i = 0; i < lut.length; i++) {
			// Bins below the first non-empty one are unused
			long val = Math.round((cdf[i] - cdfMin) * scale);
			lut[i] = (int)Math.max(0, Math.min(255, val));
		}
		return lut;
	}

}
