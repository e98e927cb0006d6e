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

package astroview.imagej.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ij.ImagePlus;
import ij.process.ColorProcessor;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

import astroview.lib.images.ImageBuffer;
import astroview.lib.images.PixelType;

/**
 * Collection of static methods to help convert between ImageJ and AstroView images.
 */
public class IJTools {

	private static final Logger logger = LoggerFactory.getLogger(IJTools.class);

	// Suppress default constructor for non-instantiability
	private IJTools() {
		throw new AssertionError();
	}

	/**
	 * Create a FloatProcessor from a single plane of pixels.
	 * @param values pixel values, in row-major order
	 * @param width
	 * @param height
	 * @return
	 */
	public static FloatProcessor convertToFloatProcessor(double[] values, int width, int height) {
		if (values.length != width * height)
			throw new IllegalArgumentException("Expected " + (width * height) + " values, but got " + values.length);
		float[] pixels = new float[values.length];
		for (int i = 0; i < pixels.length; i++)
			pixels[i] = (float)values[i];
		return new FloatProcessor(width, height, pixels);
	}

	/**
	 * Extract the pixels of an ImageProcessor as doubles, in row-major order.
	 * Color processors are not supported here; use {@link #convertToImageBuffer(ImagePlus)} instead.
	 * @param ip
	 * @return
	 */
	public static double[] getPixelsAsDoubles(ImageProcessor ip) {
		int n = ip.getWidth() * ip.getHeight();
		double[] values = new double[n];
		for (int i = 0; i < n; i++)
			values[i] = ip.getf(i);
		return values;
	}

	/**
	 * Convert the current slice of an ImagePlus to an ImageBuffer.
	 * <p>
	 * RGB images are converted to 3-channel UINT8 buffers, as are 8-bit images with a color lookup table
	 * (e.g. palette PNG or GIF images), which are first converted to RGB using the table. Otherwise, the pixel type follows the bit depth
	 * of the image (8-bit as UINT8, 16-bit as UINT16 and 32-bit as FLOAT32).
	 * Stacks with 3 or 4 slices of the same type are not treated as color images; only the current slice is used.
	 * @param imp
	 * @return
	 */
	public static ImageBuffer convertToImageBuffer(ImagePlus imp) {
		var ip = imp.getProcessor();
		int width = ip.getWidth();
		int height = ip.getHeight();
		if (imp.getBitDepth() == 8 && ip.isColorLut()) {
			logger.debug("Converting {} to RGB using its color lookup table", imp.getTitle());
			ip = ip.convertToRGB();
		}
		if (ip instanceof ColorProcessor) {
			var cp = (ColorProcessor)ip;
			int n = width * height;
			byte[][] bytes = new byte[3][n];
			cp.getRGB(bytes[0], bytes[1], bytes[2]);
			var builder = new ImageBuffer.Builder(PixelType.UINT8, width, height, 3);
			for (int c = 0; c < 3; c++) {
				double[] values = new double[n];
				for (int i = 0; i < n; i++)
					values[i] = bytes[c][i] & 0xff;
				builder.setChannel(c, values);
			}
			return builder.build();
		}
		PixelType type;
		switch (imp.getBitDepth()) {
		case 8:
			type = PixelType.UINT8;
			break;
		case 16:
			type = PixelType.UINT16;
			break;
		default:
			type = PixelType.FLOAT32;
		}
		return ImageBuffer.createSingleChannel(type, width, height, getPixelsAsDoubles(ip));
	}

}
