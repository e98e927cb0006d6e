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

import ij.plugin.filter.Convolver;
import ij.plugin.filter.GaussianBlur;
import ij.plugin.filter.RankFilters;

/**
 * Helper class for applying ImageJ filters to single planes of pixels.
 * <p>
 * The input is unchanged and a new array is returned.
 */
public class IJFilters {

	/**
	 * Kernel accuracy used for Gaussian filtering of float images (as in ImageJ's own Gaussian Blur command).
	 */
	private static final double GAUSSIAN_ACCURACY = 0.0002;

	// Suppress default constructor for non-instantiability
	private IJFilters() {
		throw new AssertionError();
	}

	/**
	 * Apply a Gaussian filter, extending edge pixels beyond the image boundary.
	 * @param values pixel values, in row-major order
	 * @param width
	 * @param height
	 * @param sigma Gaussian sigma, in pixels
	 * @return the smoothed pixel values
	 */
	public static double[] gaussianBlur(double[] values, int width, int height, double sigma) {
		var fp = IJTools.convertToFloatProcessor(values, width, height);
		new GaussianBlur().blurGaussian(fp, sigma, sigma, GAUSSIAN_ACCURACY);
		return IJTools.getPixelsAsDoubles(fp);
	}

	/**
	 * Apply a median filter over a disk, extending edge pixels beyond the image boundary.
	 * <p>
	 * The disk contains all offsets with {@code dx*dx + dy*dy <= radius*radius}.
	 * @param values pixel values, in row-major order
	 * @param width
	 * @param height
	 * @param radius disk radius, in pixels; must be &gt;= 1
	 * @return the filtered pixel values
	 */
	public static double[] median(double[] values, int width, int height, int radius) {
		if (radius < 1)
			throw new IllegalArgumentException("Median radius must be >= 1, but got " + radius);
		var fp = IJTools.convertToFloatProcessor(values, width, height);
		new RankFilters().rank(fp, toRankRadius(radius), RankFilters.MEDIAN);
		return IJTools.getPixelsAsDoubles(fp);
	}

	/**
	 * ImageJ's rank filters include all offsets with {@code d*d <= (int)(r*r) + 1},
	 * so the requested radius is reduced to give a disk with {@code d*d <= radius*radius}.
	 * @param radius
	 * @return
	 */
	static double toRankRadius(int radius) {
		return Math.sqrt(radius * radius - 0.5);
	}

	/**
	 * Correlate with a 3x3 kernel, extending edge pixels beyond the image boundary.
	 * <p>
	 * The kernel is not normalized, and is indexed as {@code kernel[row][column]}.
	 * @param values pixel values, in row-major order
	 * @param width
	 * @param height
	 * @param kernel 3x3 kernel
	 * @return the filtered pixel values
	 */
	public static double[] convolve3x3(double[] values, int width, int height, double[][] kernel) {
		float[] k = new float[9];
		for (int row = 0; row < 3; row++) {
			for (int col = 0; col < 3; col++)
				k[row * 3 + col] = (float)kernel[row][col];
		}
		var fp = IJTools.convertToFloatProcessor(values, width, height);
		var convolver = new Convolver();
		convolver.setNormalize(false);
		convolver.convolve(fp, k, 3, 3);
		return IJTools.getPixelsAsDoubles(fp);
	}

}
