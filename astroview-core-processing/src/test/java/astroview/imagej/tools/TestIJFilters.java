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

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestIJFilters {

	@Test
	public void test_medianCross() {
		// With radius 1, the corners of the 3x3 neighborhood are excluded (a square median would give 5)
		double[] values = {
				9, 0, 9,
				0, 5, 0,
				9, 0, 9
		};
		double[] result = IJFilters.median(values, 3, 3, 1);
		assertEquals(0, result[4]);
		assertThrows(IllegalArgumentException.class, () -> IJFilters.median(values, 3, 3, 0));
	}

	@Test
	public void test_medianLeavesInputUnchanged() {
		double[] values = {1, 100, 2, 3};
		double[] copy = values.clone();
		IJFilters.median(values, 2, 2, 1);
		assertArrayEquals(copy, values);
	}

	@Test
	public void test_rankRadius() {
		for (int r = 1; r <= 20; r++) {
			double rankRadius = IJFilters.toRankRadius(r);
			assertEquals(r * r, (int)(rankRadius * rankRadius) + 1);
		}
	}

	@Test
	public void test_convolve3x3() {
		double[] values = {
				1, 2, 3,
				4, 5, 6
		};
		double[][] kernel = {{0, 1, 0}, {0, 0, 0}, {0, 0, 0}};
		// Each pixel takes the value above, repeating the top row
		assertArrayEquals(new double[] {1, 2, 3, 1, 2, 3}, IJFilters.convolve3x3(values, 3, 2, kernel));

		double[][] doubled = {{0, 0, 0}, {0, 2, 0}, {0, 0, 0}};
		assertArrayEquals(new double[] {2, 4, 6, 8, 10, 12}, IJFilters.convolve3x3(values, 3, 2, doubled));
	}

}
