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

package astroview.lib.awt.common;

import java.awt.image.BufferedImage;
import java.awt.image.DataBuffer;
import java.awt.image.IndexColorModel;
import java.awt.image.WritableRaster;

import astroview.lib.images.ImageBuffer;
import astroview.lib.images.PixelType;

/**
 * Static methods to convert between Java {@link BufferedImage BufferedImages} and {@link ImageBuffer ImageBuffers}.
 */
public final class BufferedImageTools {

	// Suppress default constructor for non-instantiability
	private BufferedImageTools() {
		throw new AssertionError();
	}

	/**
	 * Convert a {@link BufferedImage} to an {@link ImageBuffer}.
	 * <p>
	 * Some implementation notes:
	 * <ul>
	 * <li>Indexed and packed 8-bit color images are converted to RGB, or RGBA if they have transparency.</li>
	 * <li>Two-band (gray + alpha) images are converted to single-channel, discarding alpha.</li>
	 * <li>Otherwise, the pixel type is determined from the raster's data type.</li>
	 * </ul>
	 * @param img
	 * @return
	 * @throws IllegalArgumentException if the image has more than 4 bands, or an unsupported data type
	 */
	public static ImageBuffer toImageBuffer(BufferedImage img) {
		int width = img.getWidth();
		int height = img.getHeight();
		if (img.getColorModel() instanceof IndexColorModel || is8bitColorType(img.getType()))
			return fromRGB(img);

		WritableRaster raster = img.getRaster();
		int nBands = raster.getNumBands();
		if (nBands > 4)
			throw new IllegalArgumentException("Unsupported number of bands " + nBands);
		int nChannels = nBands == 2 ? 1 : nBands;
		var pixelType = getPixelType(raster);

		var builder = new ImageBuffer.Builder(pixelType, width, height, nChannels);
		double[] samples = new double[width * height];
		for (int c = 0; c < nChannels; c++) {
			raster.getSamples(0, 0, width, height, c, samples);
			builder.setChannel(c, samples);
		}
		return builder.build();
	}

	private static ImageBuffer fromRGB(BufferedImage img) {
		int width = img.getWidth();
		int height = img.getHeight();
		boolean hasAlpha = img.getColorModel().hasAlpha();
		int[] rgb = img.getRGB(0, 0, width, height, null, 0, width);
		int nChannels = hasAlpha ? 4 : 3;
		double[][] planes = new double[nChannels][width * height];
		for (int i = 0; i < rgb.length; i++) {
			int val = rgb[i];
			planes[0][i] = (val >> 16) & 0xff;
			planes[1][i] = (val >> 8) & 0xff;
			planes[2][i] = val & 0xff;
			if (hasAlpha)
				planes[3][i] = (val >> 24) & 0xff;
		}
		var builder = new ImageBuffer.Builder(PixelType.UINT8, width, height, nChannels);
		for (int c = 0; c < nChannels; c++)
			builder.setChannel(c, planes[c]);
		return builder.build();
	}

	/**
	 * Get the pixel type corresponding to a raster.
	 * @param raster
	 * @return
	 */
	static PixelType getPixelType(WritableRaster raster) {
		switch (raster.getDataBuffer().getDataType()) {
		case DataBuffer.TYPE_BYTE:
			return PixelType.UINT8;
		case DataBuffer.TYPE_USHORT:
			return PixelType.UINT16;
		case DataBuffer.TYPE_SHORT:
			return PixelType.INT16;
		case DataBuffer.TYPE_INT:
			return raster.getSampleModel().getSampleSize(0) <= 8 ? PixelType.UINT8 : PixelType.INT32;
		case DataBuffer.TYPE_FLOAT:
			return PixelType.FLOAT32;
		case DataBuffer.TYPE_DOUBLE:
			return PixelType.FLOAT64;
		default:
			throw new IllegalArgumentException("Unsupported data buffer type " + raster.getDataBuffer().getDataType());
		}
	}

	/**
	 * Convert an {@link ImageBuffer} to a {@link BufferedImage}, suitable for writing with ImageIO.
	 * <p>
	 * UINT8 buffers are converted without loss, as are single-channel UINT16 buffers.
	 * Anything else is first rescaled to 8-bit using the buffer's min and max values,
	 * since it cannot be written to common image formats directly.
	 * @param buffer
	 * @return
	 */
	public static BufferedImage toBufferedImage(ImageBuffer buffer) {
		int width = buffer.getWidth();
		int height = buffer.getHeight();
		var type = buffer.getPixelType();
		if (buffer.isSingleChannel() && type == PixelType.UINT16) {
			var img = new BufferedImage(width, height, BufferedImage.TYPE_USHORT_GRAY);
			img.getRaster().setSamples(0, 0, width, height, 0, buffer.getChannel(0));
			return img;
		}
		double[][] planes = type == PixelType.UINT8 ? buffer.getChannels() : rescaleTo8bit(buffer);
		if (buffer.isSingleChannel()) {
			var img = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
			img.getRaster().setSamples(0, 0, width, height, 0, planes[0]);
			return img;
		}
		boolean hasAlpha = buffer.hasAlpha();
		var img = new BufferedImage(width, height, hasAlpha ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB);
		int[] rgb = new int[width * height];
		for (int i = 0; i < rgb.length; i++) {
			int r = (int)planes[0][i];
			int g = (int)planes[1][i];
			int b = (int)planes[2][i];
			int a = hasAlpha ? (int)planes[3][i] : 255;
			rgb[i] = (a << 24) | (r << 16) | (g << 8) | b;
		}
		img.setRGB(0, 0, width, height, rgb, 0, width);
		return img;
	}

	private static double[][] rescaleTo8bit(ImageBuffer buffer) {
		double min = buffer.getMinValue();
		double max = buffer.getMaxValue();
		double range = max - min;
		double[][] planes = buffer.getChannels();
		for (double[] plane : planes) {
			for (int i = 0; i < plane.length; i++)
				plane[i] = range > 0 ? PixelType.UINT8.convertValue((plane[i] - min) / range * 255.0) : 0;
		}
		return planes;
	}

	/**
	 * Returns true if a BufferedImage type represents an 8-bit color image.
	 * The precise representation (BGR, RGB, byte, int, with/without alpha) is not important.
	 * @param type
	 * @return
	 */
	public static boolean is8bitColorType(int type) {
		switch (type) {
		case BufferedImage.TYPE_3BYTE_BGR:
		case BufferedImage.TYPE_4BYTE_ABGR:
		case BufferedImage.TYPE_4BYTE_ABGR_PRE:
		case BufferedImage.TYPE_INT_ARGB:
		case BufferedImage.TYPE_INT_ARGB_PRE:
		case BufferedImage.TYPE_INT_BGR:
		case BufferedImage.TYPE_INT_RGB:
			return true;
		default:
			return false;
		}
	}

}
