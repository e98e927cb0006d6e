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

package astroview.lib.images;

import java.util.Arrays;
import java.util.Objects;

/**
 * Pixel data for a single 2D image.
 * <p>
 * The logical shape is either {@code (height, width)} for a single-channel image, or
 * {@code (height, width, channels)} for RGB (3 channels) or RGBA (4 channels) images, with channels last.
 * Internally, pixels are stored as one row-major plane per channel.
 * <p>
 * Instances are immutable: every value stored has already been converted to the buffer's {@link PixelType},
 * and methods that expose pixels return copies. New buffers are created using a {@link Builder}.
 */
public final class ImageBuffer {

	private final int width;
	private final int height;
	private final PixelType pixelType;
	private final double[][] planes;

	private ImageBuffer(int width, int height, PixelType pixelType, double[][] planes) {
		this.width = width;
		this.height = height;
		this.pixelType = pixelType;
		this.planes = planes;
	}

	/**
	 * Create a single-channel buffer from row-major pixel values.
	 * Values are converted to the requested pixel type (with truncation and clipping, if needed).
	 * @param pixelType
	 * @param width
	 * @param height
	 * @param pixels
	 * @return
	 */
	public static ImageBuffer createSingleChannel(PixelType pixelType, int width, int height, double[] pixels) {
		return new Builder(pixelType, width, height, 1).setChannel(0, pixels).build();
	}

	/**
	 * Create a single-channel UINT8 buffer from row-major pixel values.
	 * @param width
	 * @param height
	 * @param pixels
	 * @return
	 */
	public static ImageBuffer createUint8(int width, int height, int... pixels) {
		var builder = new Builder(PixelType.UINT8, width, height, 1);
		for (int i = 0; i < pixels.length; i++)
			builder.setValue(i % width, i / width, 0, pixels[i]);
		return builder.build();
	}

	/**
	 * Image width, in pixels.
	 * @return
	 */
	public int getWidth() {
		return width;
	}

	/**
	 * Image height, in pixels.
	 * @return
	 */
	public int getHeight() {
		return height;
	}

	/**
	 * Number of channels; this is 1, 3 (RGB) or 4 (RGBA).
	 * @return
	 */
	public int nChannels() {
		return planes.length;
	}

	/**
	 * The numeric type of every element in the buffer.
	 * @return
	 */
	public PixelType getPixelType() {
		return pixelType;
	}

	/**
	 * Total number of pixels per channel.
	 * @return
	 */
	public int nPixels() {
		return width * height;
	}

	/**
	 * Returns true if the buffer has a single channel.
	 * @return
	 */
	public boolean isSingleChannel() {
		return planes.length == 1;
	}

	/**
	 * Returns true if the buffer has an alpha channel (i.e. it is RGBA).
	 * @return
	 */
	public boolean hasAlpha() {
		return planes.length == 4;
	}

	/**
	 * Get the logical shape, either {@code [height, width]} or {@code [height, width, channels]}.
	 * @return
	 */
	public int[] getShape() {
		if (isSingleChannel())
			return new int[] {height, width};
		return new int[] {height, width, planes.length};
	}

	/**
	 * Get a single pixel value.
	 * @param x
	 * @param y
	 * @param channel
	 * @return
	 * @throws IndexOutOfBoundsException if the location is outside the image
	 */
	public double getValue(int x, int y, int channel) {
		Objects.checkIndex(x, width);
		Objects.checkIndex(y, height);
		return planes[channel][y * width + x];
	}

	/**
	 * Get a copy of the pixels for one channel, in row-major order.
	 * @param channel
	 * @return
	 */
	public double[] getChannel(int channel) {
		return planes[channel].clone();
	}

	/**
	 * Get copies of all channels.
	 * @return
	 */
	public double[][] getChannels() {
		double[][] copy = new double[planes.length][];
		for (int c = 0; c < planes.length; c++)
			copy[c] = planes[c].clone();
		return copy;
	}

	/**
	 * Minimum value across all channels.
	 * @return
	 */
	public double getMinValue() {
		double min = Double.POSITIVE_INFINITY;
		for (double[] plane : planes) {
			for (double v : plane) {
				if (v < min)
					min = v;
			}
		}
		return min;
	}

	/**
	 * Maximum value across all channels.
	 * @return
	 */
	public double getMaxValue() {
		double max = Double.NEGATIVE_INFINITY;
		for (double[] plane : planes) {
			for (double v : plane) {
				if (v > max)
					max = v;
			}
		}
		return max;
	}

	/**
	 * Mean value across all channels.
	 * @return
	 */
	public double getMeanValue() {
		double sum = 0;
		for (double[] plane : planes) {
			for (double v : plane)
				sum += v;
		}
		return sum / ((double)nPixels() * planes.length);
	}

	/**
	 * Create a deep copy of this buffer.
	 * <p>
	 * Because buffers are immutable this is rarely necessary, but it is used whenever a buffer
	 * is handed to code outside the host's control.
	 * @return
	 */
	public ImageBuffer duplicate() {
		return new ImageBuffer(width, height, pixelType, getChannels());
	}

	/**
	 * Create a builder for a new buffer with the same dimensions and pixel type as this one,
	 * initialized with a copy of this buffer's values.
	 * @return
	 */
	public Builder toBuilder() {
		var builder = new Builder(pixelType, width, height, planes.length);
		for (int c = 0; c < planes.length; c++)
			System.arraycopy(planes[c], 0, builder.planes[c], 0, planes[c].length);
		return builder;
	}

	@Override
	public String toString() {
		return "ImageBuffer [shape=" + Arrays.toString(getShape()) + ", type=" + pixelType + "]";
	}

	@Override
	public int hashCode() {
		return Objects.hash(width, height, pixelType, Arrays.deepHashCode(planes));
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof ImageBuffer other))
			return false;
		return width == other.width && height == other.height && pixelType == other.pixelType
				&& Arrays.deepEquals(planes, other.planes);
	}


	/**
	 * Builder for {@link ImageBuffer} instances.
	 * <p>
	 * Values passed to the builder may be floating point intermediates; they are converted to the
	 * target pixel type when they are set.
	 */
	public static class Builder {

		private final int width;
		private final int height;
		private final PixelType pixelType;
		private final double[][] planes;

		private boolean built = false;

		/**
		 * Create a builder for a buffer filled with zeros.
		 * @param pixelType
		 * @param width
		 * @param height
		 * @param nChannels number of channels; must be 1, 3 or 4
		 */
		public Builder(PixelType pixelType, int width, int height, int nChannels) {
			Objects.requireNonNull(pixelType, "Pixel type must not be null");
			if (width <= 0 || height <= 0)
				throw new IllegalArgumentException("Image dimensions must be > 0, but got " + width + " x " + height);
			if (nChannels != 1 && nChannels != 3 && nChannels != 4)
				throw new IllegalArgumentException("Unsupported number of channels " + nChannels + " (must be 1, 3 or 4)");
			if ((long)width * height > Integer.MAX_VALUE)
				throw new IllegalArgumentException("Image is too large (" + width + " x " + height + ")");
			this.pixelType = pixelType;
			this.width = width;
			this.height = height;
			this.planes = new double[nChannels][width * height];
		}

		/**
		 * Set all pixels for a channel, converting to the builder's pixel type.
		 * @param channel
		 * @param pixels row-major pixel values; length must equal width * height
		 * @return this builder
		 */
		public Builder setChannel(int channel, double[] pixels) {
			checkNotBuilt();
			if (pixels.length != width * height)
				throw new IllegalArgumentException("Expected " + (width * height) + " pixels, but got " + pixels.length);
			double[] plane = planes[channel];
			for (int i = 0; i < pixels.length; i++)
				plane[i] = pixelType.convertValue(pixels[i]);
			return this;
		}

		/**
		 * Set a single pixel value, converting to the builder's pixel type.
		 * @param x
		 * @param y
		 * @param channel
		 * @param value
		 * @return this builder
		 */
		public Builder setValue(int x, int y, int channel, double value) {
			checkNotBuilt();
			Objects.checkIndex(x, width);
			Objects.checkIndex(y, height);
			planes[channel][y * width + x] = pixelType.convertValue(value);
			return this;
		}

		/**
		 * Build the buffer. The builder cannot be reused afterwards.
		 * @return
		 */
		public ImageBuffer build() {
			checkNotBuilt();
			built = true;
			return new ImageBuffer(width, height, pixelType, planes);
		}

		private void checkNotBuilt() {
			if (built)
				throw new IllegalStateException("ImageBuffer has already been built");
		}

	}

}
