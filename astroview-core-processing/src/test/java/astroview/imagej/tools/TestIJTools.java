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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.awt.image.IndexColorModel;

import org.junit.jupiter.api.Test;

import astroview.lib.images.PixelType;
import ij.ImagePlus;
import ij.process.ByteProcessor;
import ij.process.ColorProcessor;
import ij.process.FloatProcessor;
import ij.process.ShortProcessor;

@SuppressWarnings("javadoc")
public class TestIJTools {

	@Test
	public void test_floatProcessor() {
		double[] values = {1.5, 2, 3, 4, 5, 6};
		var fp = IJTools.convertToFloatProcessor(values, 3, 2);
		assertEquals(3, fp.getWidth());
		assertEquals(2, fp.getHeight());
		assertEquals(4, fp.getf(0, 1));
		assertArrayEquals(values, IJTools.getPixelsAsDoubles(fp));
		assertThrows(IllegalArgumentException.class, () -> IJTools.convertToFloatProcessor(values, 2, 2));
	}

	@Test
	public void test_convertToImageBuffer() {
		var bp = new ByteProcessor(4, 3);
		bp.set(1, 2, 200);
		var buffer = IJTools.convertToImageBuffer(new ImagePlus("byte", bp));
		assertEquals(PixelType.UINT8, buffer.getPixelType());
		assertEquals(200, buffer.getValue(1, 2, 0));

		var sp = new ShortProcessor(2, 2);
		sp.set(1, 1, 50000);
		var buffer16 = IJTools.convertToImageBuffer(new ImagePlus("short", sp));
		assertEquals(PixelType.UINT16, buffer16.getPixelType());
		assertEquals(50000, buffer16.getValue(1, 1, 0));

		var fp = new FloatProcessor(2, 2);
		fp.setf(0, 1, -2.5f);
		var buffer32 = IJTools.convertToImageBuffer(new ImagePlus("float", fp));
		assertEquals(PixelType.FLOAT32, buffer32.getPixelType());
		assertEquals(-2.5, buffer32.getValue(0, 1, 0));
	}

	@Test
	public void test_convertColorToImageBuffer() {
		var cp = new ColorProcessor(2, 1);
		cp.set(1, 0, (10 << 16) | (20 << 8) | 30);
		var buffer = IJTools.convertToImageBuffer(new ImagePlus("rgb", cp));
		assertEquals(3, buffer.nChannels());
		assertEquals(10, buffer.getValue(1, 0, 0));
		assertEquals(20, buffer.getValue(1, 0, 1));
		assertEquals(30, buffer.getValue(1, 0, 2));
		assertEquals(0, buffer.getValue(0, 0, 0));
	}

	@Test
	public void test_convertColorLutToImageBuffer() {
		byte[] r = new byte[256];
		byte[] g = new byte[256];
		byte[] b = new byte[256];
		for (int i = 0; i < 256; i++) {
			r[i] = (byte)i;
			b[i] = (byte)(255 - i);
		}
		var bp = new ByteProcessor(2, 1, new byte[] {10, (byte)200}, new IndexColorModel(8, 256, r, g, b));
		var buffer = IJTools.convertToImageBuffer(new ImagePlus("palette", bp));
		assertEquals(PixelType.UINT8, buffer.getPixelType());
		assertEquals(3, buffer.nChannels());
		assertEquals(10, buffer.getValue(0, 0, 0));
		assertEquals(0, buffer.getValue(0, 0, 1));
		assertEquals(245, buffer.getValue(0, 0, 2));
		assertEquals(200, buffer.getValue(1, 0, 0));
		assertEquals(55, buffer.getValue(1, 0, 2));

		// Grayscale lookup tables keep a single channel
		var gray = new ByteProcessor(2, 1, new byte[] {10, (byte)200});
		assertEquals(1, IJTools.convertToImageBuffer(new ImagePlus("gray", gray)).nChannels());
	}

	@Test
	public void test_gaussianBlurLeavesInput() {
		double[] values = new double[25];
		values[12] = 100;
		double[] blurred = IJFilters.gaussianBlur(values, 5, 5, 1.0);
		assertEquals(100, values[12]);
		assertEquals(blurred[11], blurred[13], 1e-4);
	}

}
