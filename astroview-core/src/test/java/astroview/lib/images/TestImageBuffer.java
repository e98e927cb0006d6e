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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestImageBuffer {

	@Test
	public void test_shape() {
		var gray = new ImageBuffer.Builder(PixelType.UINT8, 4, 3, 1).build();
		assertArrayEquals(new int[] {3, 4}, gray.getShape());
		assertTrue(gray.isSingleChannel());

		var rgba = new ImageBuffer.Builder(PixelType.UINT8, 4, 3, 4).build();
		assertArrayEquals(new int[] {3, 4, 4}, rgba.getShape());
		assertTrue(rgba.hasAlpha());
		assertEquals(12, rgba.nPixels());
	}

	@Test
	public void test_invalidBuffers() {
		assertThrows(IllegalArgumentException.class, () -> new ImageBuffer.Builder(PixelType.UINT8, 4, 3, 2));
		assertThrows(IllegalArgumentException.class, () -> new ImageBuffer.Builder(PixelType.UINT8, 0, 3, 1));
		assertThrows(IllegalArgumentException.class, () -> ImageBuffer.createSingleChannel(PixelType.UINT8, 2, 2, new double[3]));
	}

	@Test
	public void test_valuesAreConverted() {
		var buffer = ImageBuffer.createSingleChannel(PixelType.UINT8, 2, 2, new double[] {-1, 0.4, 254.6, 300});
		assertArrayEquals(new double[] {0, 0, 255, 255}, buffer.getChannel(0));
		assertEquals(0, buffer.getMinValue());
		assertEquals(255, buffer.getMaxValue());
		assertEquals(127.5, buffer.getMeanValue(), 1e-9);
	}

	@Test
	public void test_immutable() {
		var buffer = ImageBuffer.createUint8(2, 2, 1, 2, 3, 4);
		double[] channel = buffer.getChannel(0);
		channel[0] = 100;
		assertEquals(1, buffer.getValue(0, 0, 0));
		assertEquals(4, buffer.getValue(1, 1, 0));

		var builder = new ImageBuffer.Builder(PixelType.UINT8, 2, 2, 1);
		builder.build();
		assertThrows(IllegalStateException.class, () -> builder.setValue(0, 0, 0, 1));
	}

	@Test
	public void test_duplicateAndEquals() {
		var buffer = ImageBuffer.createUint8(3, 1, 10, 20, 30);
		var copy = buffer.duplicate();
		assertNotSame(buffer, copy);
		assertEquals(buffer, copy);
		assertEquals(buffer.hashCode(), copy.hashCode());

		var changed = buffer.toBuilder().setValue(0, 0, 0, 11).build();
		assertFalse(buffer.equals(changed));
		assertEquals(10, buffer.getValue(0, 0, 0));

		var float32 = ImageBuffer.createSingleChannel(PixelType.FLOAT32, 3, 1, new double[] {10, 20, 30});
		assertFalse(buffer.equals(float32));
	}

	@Test
	public void test_outOfBounds() {
		var buffer = ImageBuffer.createUint8(2, 2, 1, 2, 3, 4);
		assertThrows(IndexOutOfBoundsException.class, () -> buffer.getValue(2, 0, 0));
		assertThrows(IndexOutOfBoundsException.class, () -> buffer.getValue(0, -1, 0));
	}

}
