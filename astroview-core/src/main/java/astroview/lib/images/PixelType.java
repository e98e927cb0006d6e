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

/**
 * Image bit-depths and types. In general, expected image types are UINT8, UINT16 and FLOAT32.
 * <p>
 * Every {@link ImageBuffer} has exactly one pixel type, and operations are expected to return
 * buffers of the same type as their input - using {@link #convertValue(double)} to cast
 * floating point intermediates back into range.
 */
public enum PixelType {

	/**
	 * 8-bit unsigned integer
	 */
	UINT8(8, PixelValueType.UNSIGNED_INTEGER, 0, 255),
	/**
	 * 8-bit signed integer
	 */
	INT8(8, PixelValueType.SIGNED_INTEGER, Byte.MIN_VALUE, Byte.MAX_VALUE),
	/**
	 * 16-bit unsigned integer
	 */
	UINT16(16, PixelValueType.UNSIGNED_INTEGER, 0, 65535),
	/**
	 * 16-bit signed integer
	 */
	INT16(16, PixelValueType.SIGNED_INTEGER, Short.MIN_VALUE, Short.MAX_VALUE),
	/**
	 * 32-bit signed integer
	 */
	INT32(32, PixelValueType.SIGNED_INTEGER, Integer.MIN_VALUE, Integer.MAX_VALUE),
	/**
	 * 32-bit floating point
	 */
	FLOAT32(32, PixelValueType.FLOATING_POINT, -Float.MAX_VALUE, Float.MAX_VALUE),
	/**
	 * 64-bit floating point
	 */
	FLOAT64(64, PixelValueType.FLOATING_POINT, -Double.MAX_VALUE, Double.MAX_VALUE);

	private final int bitsPerPixel;
	private final PixelValueType type;
	private final double minValue, maxValue;

	private PixelType(int bpp, PixelValueType type, double minValue, double maxValue) {
		this.bitsPerPixel = bpp;
		this.type = type;
		this.minValue = minValue;
		this.maxValue = maxValue;
	}

	/**
	 * Number of bits per pixel.
	 * @return
	 *
	 * @see #getBytesPerPixel()
	 */
	public int getBitsPerPixel() {
		return bitsPerPixel;
	}

	/**
	 * Number of bytes per pixel.
	 * @return
	 *
	 * @see #getBitsPerPixel()
	 */
	public int getBytesPerPixel() {
		return (int)Math.ceil(bitsPerPixel / 8.0);
	}

	/**
	 * Get the minimum value permitted by this type (may be negative).
	 * @return
	 */
	public double getLowerBound() {
		return minValue;
	}

	/**
	 * Get the maximum value permitted by this type.
	 * @return
	 */
	public double getUpperBound() {
		return maxValue;
	}

	/**
	 * Returns true if the type is a signed integer representation.
	 * @return
	 */
	public boolean isSignedInteger() {
		return type == PixelValueType.SIGNED_INTEGER;
	}

	/**
	 * Returns true if the type is an unsigned integer representation.
	 * @return
	 */
	public boolean isUnsignedInteger() {
		return type == PixelValueType.UNSIGNED_INTEGER;
	}

	/**
	 * Returns true if the type is a floating point representation.
	 * @return
	 */
	public boolean isFloatingPoint() {
		return type == PixelValueType.FLOATING_POINT;
	}

	/**
	 * Clip a value to the range supported by this type, without rounding.
	 * NaN values are retained for floating point types, and converted to 0 for integer types.
	 * @param value
	 * @return
	 */
	public double clip(double value) {
		if (Double.isNaN(value))
			return isFloatingPoint() ? value : 0;
		if (value < minValue)
			return minValue;
		if (value > maxValue)
			return maxValue;
		return value;
	}

	/**
	 * Convert a value so that it can be represented exactly by this type.
	 * <p>
	 * Integer types are clipped to the type's range and truncated toward zero;
	 * FLOAT32 values are rounded to single precision; FLOAT64 values are returned unchanged.
	 * @param value
	 * @return
	 */
	public double convertValue(double value) {
		switch (this) {
		case FLOAT64:
			return value;
		case FLOAT32:
			if (Double.isNaN(value) || Double.isInfinite(value))
				return (float)value;
			return (float)clip(value);
		default:
			double clipped = clip(value);
			return clipped < 0 ? Math.ceil(clipped) : Math.floor(clipped);
		}
	}

	private enum PixelValueType {
		SIGNED_INTEGER, UNSIGNED_INTEGER, FLOATING_POINT;
	}

}
