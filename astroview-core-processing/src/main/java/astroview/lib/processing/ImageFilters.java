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

import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import astroview.imagej.tools.IJFilters;
import astroview.lib.images.ImageBuffer;

/**
 * Static methods implementing the standard point and neighborhood filters.
 * <p>
 * All methods leave the input unchanged and return a new buffer with the same pixel type as the input.
 * Intermediate values are computed in double precision and converted back to the pixel type at the end,
 * truncating toward zero and clipping as required.
 */
public final class ImageFilters {

	private static final Logger logger = LoggerFactory.getLogger(ImageFilters.class);

	// Suppress default constructor for non-instantiability
	private ImageFilters() {
		throw new AssertionError();
	}

	/**
	 * Linearly map the range of values in an image to a new range.
	 * <p>
	 * The current range is computed jointly across all channels. If the image is flat (min == max), it is
	 * returned unchanged. Otherwise, the result is clipped to the new range.
	 * @param buffer
	 * @param newMin
	 * @param newMax
	 * @return
	 * @throws IllegalArgumentException if either new value is not finite
	 */
	public static ImageBuffer contrastStretch(ImageBuffer buffer, double newMin, double newMax) {
		if (!Double.isFinite(newMin) || !Double.isFinite(newMax))
			throw new IllegalArgumentException("Contrast limits must be finite, but got " + newMin + " and " + newMax);
		double currentMin = buffer.getMinValue();
		double currentMax = buffer.getMaxValue();
		if (currentMax == currentMin) {
			logger.debug("Image is flat (all values {}), contrast stretch will return the input", currentMin);
			return buffer;
		}
		double currentRange = currentMax - currentMin;
		double low = Math.min(newMin, newMax);
		double high = Math.max(newMin, newMax);
		var builder = buffer.toBuilder();
		for (int c = 0; c < buffer.nChannels(); c++) {
			double[] values = buffer.getChannel(c);
			for (int i = 0; i < values.length; i++) {
				double v = (values[i] - currentMin) / currentRange * (newMax - newMin) + newMin;
				values[i] = Math.max(low, Math.min(high, v));
			}
			builder.setChannel(c, values);
		}
		return builder.build();
	}

	/**
	 * Apply a Gaussian filter to each channel, using ImageJ.
	 * @param buffer
	 * @param sigma Gaussian sigma, in pixels
	 * @return
	 * @throws IllegalArgumentException if sigma is not &gt; 0
	 */
	public static ImageBuffer gaussianBlur(ImageBuffer buffer, double sigma) {
		if (!(sigma > 0) || Double.isInfinite(sigma))
			throw new IllegalArgumentException("Gaussian sigma must be > 0, but got " + sigma);
		int w = buffer.getWidth();
		int h = buffer.getHeight();
		var builder = buffer.toBuilder();
		for (int c = 0; c < buffer.nChannels(); c++)
			builder.setChannel(c, IJFilters.gaussianBlur(buffer.getChannel(c), w, h, sigma));
		return builder.build();
	}

	/**
	 * Apply a median filter to each channel.
	 * <p>
	 * The neighborhood is a disk with radius {@code filterSize / 2} (rounded down), i.e. all offsets with
	 * {@code dx*dx + dy*dy <= r*r}. Pixels beyond the image boundary take the value of the nearest edge pixel.
	 * @param buffer
	 * @param filterSize the filter diameter; if &lt;= 1, the input is returned unchanged
	 * @return
	 */
	public static ImageBuffer medianFilter(ImageBuffer buffer, int filterSize) {
		int radius = filterSize / 2;
		if (filterSize <= 1 || radius < 1)
			return buffer;
		int w = buffer.getWidth();
		int h = buffer.getHeight();
		var builder = buffer.toBuilder();
		for (int c = 0; c < buffer.nChannels(); c++)
			builder.setChannel(c, IJFilters.median(buffer.getChannel(c), w, h, radius));
		return builder.build();
	}

	/**
	 * Compute the Sobel gradient magnitude.
	 * <p>
	 * Multichannel images are first converted to luminance (ignoring any alpha channel).
	 * The output is always single-channel; the magnitude is not rescaled, and is clipped to the range of the pixel type.
	 * Pixels beyond the image boundary are found by reflection.
	 * @param buffer
	 * @return
	 * @see ColorConversion#toLuminance(ImageBuffer)
	 */
	public static ImageBuffer sobel(ImageBuffer buffer) {
		int w = buffer.getWidth();
		int h = buffer.getHeight();
		double[] lum = ColorConversion.toLuminance(buffer);
		double[] output = new double[lum.length];
		for (int y = 0; y < h; y++) {
			int y0 = reflect(y - 1, h) * w;
			int y1 = y * w;
			int y2 = reflect(y + 1, h) * w;
			for (int x = 0; x < w; x++) {
				int x0 = reflect(x - 1, w);
				int x2 = reflect(x + 1, w);
				double gx = (lum[y0 + x2] + 2 * lum[y1 + x2] + lum[y2 + x2])
						- (lum[y0 + x0] + 2 * lum[y1 + x0] + lum[y2 + x0]);
				double gy = (lum[y2 + x0] + 2 * lum[y2 + x] + lum[y2 + x2])
						- (lum[y0 + x0] + 2 * lum[y0 + x] + lum[y0 + x2]);
				output[y1 + x] = Math.sqrt(gx * gx + gy * gy);
			}
		}
		return ImageBuffer.createSingleChannel(buffer.getPixelType(), w, h, output);
	}

	/**
	 * Apply a power-law transform.
	 * <p>
	 * Values are divided by the maximum value in the image, raised to the power {@code gamma},
	 * then multiplied by the same maximum. If the maximum is 0, the input is returned unchanged.
	 * Negative values keep their sign.
	 * @param buffer
	 * @param gamma
	 * @return
	 * @throws IllegalArgumentException if gamma is not &gt; 0
	 */
	public static ImageBuffer gammaCorrection(ImageBuffer buffer, double gamma) {
		if (!(gamma > 0) || Double.isInfinite(gamma))
			throw new IllegalArgumentException("Gamma must be > 0, but got " + gamma);
		double max = buffer.getMaxValue();
		if (max == 0) {
			logger.debug("Maximum value is 0, gamma correction will return the input");
			return buffer;
		}
		var builder = buffer.toBuilder();
		for (int c = 0; c < buffer.nChannels(); c++) {
			double[] values = buffer.getChannel(c);
			for (int i = 0; i < values.length; i++) {
				double v = values[i] / max;
				values[i] = Math.signum(v) * Math.pow(Math.abs(v), gamma) * max;
			}
			builder.setChannel(c, values);
		}
		return builder.build();
	}

	/**
	 * Convolve each channel with a 3x3 kernel, repeating edge pixels beyond the image boundary.
	 * <p>
	 * The kernel is applied as a correlation, i.e. it is not flipped, and it is not normalized. Since it is indexed as {@code kernel[row][column]},
	 * {@code kernel[0][0]} is applied to the pixel above and to the left.
	 * @param buffer
	 * @param kernel 3x3 kernel
	 * @return
	 * @throws IllegalArgumentException if the kernel is not 3x3
	 */
	public static ImageBuffer convolve3x3(ImageBuffer buffer, double[][] kernel) {
		if (kernel == null || kernel.length != 3 || Arrays.stream(kernel).anyMatch(row -> row == null || row.length != 3))
			throw new IllegalArgumentException("Kernel must be 3x3");
		int w = buffer.getWidth();
		int h = buffer.getHeight();
		var builder = buffer.toBuilder();
		for (int c = 0; c < buffer.nChannels(); c++)
			builder.setChannel(c, IJFilters.convolve3x3(buffer.getChannel(c), w, h, kernel));
		return builder.build();
	}

	/**
	 * Compute a local mean over a square neighborhood, reflecting pixels beyond the image boundary.
	 * @param values pixel values, in row-major order
	 * @param width
	 * @param height
	 * @param size side length of the neighborhood; should be odd
	 * @return
	 */
	public static double[] meanFilter(double[] values, int width, int height, int size) {
		int r = size / 2;
		int n = (2 * r + 1) * (2 * r + 1);
		double[] output = new double[values.length];
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				double sum = 0;
				for (int dy = -r; dy <= r; dy++) {
					int yy = reflect(y + dy, height) * width;
					for (int dx = -r; dx <= r; dx++)
						sum += values[yy + reflect(x + dx, width)];
				}
				output[y * width + x] = sum / n;
			}
		}
		return output;
	}

	/**
	 * Reflect an index into the range {@code 0 <= ind < n}, repeating the edge pixel
	 * (so that -1 maps to 0, and n maps to n-1).
	 * @param ind
	 * @param n
	 * @return
	 */
	static int reflect(int ind, int n) {
		if (n == 1)
			return 0;
		int period = 2 * n;
		ind = ind % period;
		if (ind < 0)
			ind += period;
		return ind < n ? ind : period - 1 - ind;
	}

}
