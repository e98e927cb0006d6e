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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import astroview.lib.analysis.stats.Histogram;
import astroview.lib.images.ImageBuffer;
import astroview.lib.images.PixelType;

@SuppressWarnings("javadoc")
public class TestHistogramEqualization {

	private static ImageBuffer createCheckerboard(int size, int low, int high) {
		double[] values = new double[size * size];
		for (int y = 0; y < size; y++) {
			for (int x = 0; x < size; x++)
				values[y * size + x] = (x + y) % 2 == 0 ? low : high;
		}
		return ImageBuffer.createSingleChannel(PixelType.UINT8, size, size, values);
	}

	private static Set<Double> distinctValues(ImageBuffer buffer) {
		return Arrays.stream(buffer.getChannel(0)).boxed().collect(Collectors.toSet());
	}

	@Test
	public void test_checkerboard() {
		var result = HistogramEqualization.equalize(createCheckerboard(16, 60, 180));
		assertEquals(PixelType.UINT8, result.getPixelType());
		assertEquals(Set.of(0.0, 255.0), distinctValues(result));
		assertEquals(0, result.getValue(0, 0, 0));
		assertEquals(255, result.getValue(1, 0, 0));
	}

	@Test
	public void test_flatImage() {
		double[] values = new double[16];
		Arrays.fill(values, 100);
		var buffer = ImageBuffer.createSingleChannel(PixelType.UINT8, 4, 4, values);
		assertEquals(buffer, HistogramEqualization.equalize(buffer));
	}

	@Test
	public void test_repeatedEqualizationIsMonotonic() {
		var rand = new Random(100L);
		double[] values = new double[32 * 32];
		for (int i = 0; i < values.length; i++)
			values[i] = 40 + rand.nextInt(60);
		var buffer = ImageBuffer.createSingleChannel(PixelType.UINT8, 32, 32, values);
		double[] first = HistogramEqualization.equalize(buffer).getChannel(0);
		double[] second = HistogramEqualization.equalize(HistogramEqualization.equalize(buffer)).getChannel(0);
		for (int i = 0; i < first.length; i++) {
			for (int j = 0; j < first.length; j++) {
				if (first[i] < first[j])
					assertTrue(second[i] <= second[j]);
				else if (first[i] == first[j])
					assertEquals(second[i], second[j]);
			}
		}
		// Input range is expanded
		assertEquals(0, Arrays.stream(first).min().getAsDouble());
		assertEquals(255, Arrays.stream(first).max().getAsDouble());
	}

	@Test
	public void test_colorInput() {
		var builder = new ImageBuffer.Builder(PixelType.UINT16, 2, 1, 3);
		for (int c = 0; c < 3; c++) {
			builder.setValue(0, 0, c, 1000);
			builder.setValue(1, 0, c, 2000);
		}
		var result = HistogramEqualization.equalize(builder.build());
		assertTrue(result.isSingleChannel());
		assertEquals(PixelType.UINT8, result.getPixelType());
		assertEquals(Set.of(0.0, 255.0), distinctValues(result));
	}

	@Test
	public void test_lookupTable() {
		// Two values at 10 and 20, three at 30
		var hist = new Histogram(new double[] {10, 10, 20, 20, 30, 30, 30});
		int[] lut = HistogramEqualization.computeLookupTable(hist);
		assertEquals(0, lut[0]);
		assertEquals(0, lut[10]);
		assertEquals(Math.round(2.0 / 5.0 * 255), lut[20]);
		assertEquals(255, lut[30]);
		assertEquals(255, lut[255]);
	}

}
