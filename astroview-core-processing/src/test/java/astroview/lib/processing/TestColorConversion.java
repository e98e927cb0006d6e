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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

import astroview.lib.images.ImageBuffer;
import astroview.lib.images.PixelType;

@SuppressWarnings("javadoc")
public class TestColorConversion {

	@Test
	public void test_luminance() {
		var rgba = new ImageBuffer.Builder(PixelType.UINT8, 1, 1, 4)
				.setValue(0, 0, 0, 100)
				.setValue(0, 0, 1, 200)
				.setValue(0, 0, 2, 50)
				.setValue(0, 0, 3, 255)
				.build();
		double expected = 0.2125 * 100 + 0.7154 * 200 + 0.0721 * 50;
		assertEquals(expected, ColorConversion.toLuminance(rgba)[0], 1e-9);

		var gray = ImageBuffer.createUint8(2, 1, 3, 4);
		assertArrayEquals(new double[] {3, 4}, ColorConversion.toLuminance(gray));
	}

	@Test
	public void test_normalize() {
		assertArrayEquals(new double[] {0, 127, 255}, ColorConversion.normalizeToUint8(new double[] {-1, 0, 1}));
		assertArrayEquals(new double[] {255, 255}, ColorConversion.normalizeToUint8(new double[] {1000, 1000}));
		assertArrayEquals(new double[] {0, 0}, ColorConversion.normalizeToUint8(new double[] {-5, -5}));
	}

	@Test
	public void test_uint8Intensities() {
		var gray = ImageBuffer.createUint8(2, 1, 10, 20);
		assertArrayEquals(new double[] {10, 20}, ColorConversion.toUint8Intensities(gray));

		var float32 = ImageBuffer.createSingleChannel(PixelType.FLOAT32, 2, 1, new double[] {0.1, 0.2});
		assertArrayEquals(new double[] {0, 255}, ColorConversion.toUint8Intensities(float32));
	}

	@Test
	public void test_constants() {
		assertEquals(1.0, ColorConversion.WEIGHT_RED + ColorConversion.WEIGHT_GREEN + ColorConversion.WEIGHT_BLUE, 1e-12);
	}

}
