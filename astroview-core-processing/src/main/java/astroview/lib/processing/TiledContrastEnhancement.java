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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import astroview.imagej.tools.IJFilters;
import astroview.lib.analysis.stats.Histogram;
import astroview.lib.images.ImageBuffer;
import astroview.lib.images.PixelType;

/**
 * Detail enhancement for lunar and planetary images.
 * <p>
 * This combines several steps, applied in order:
 * <ol>
 *   <li>conversion to luminance, normalized to 0-255</li>
 *   <li>contrast-limited histogram equalization within each tile of an 8x8 grid</li>
 *   <li>smoothing of pixels close to tile boundaries with a 5x5 mean filter, to hide the grid</li>
 *   <li>unsharp masking with a Gaussian sigma of 1 pixel</li>
 *   <li>a global contrast boost around the mean intensity</li>
 * </ol>
 * The result is always a single-channel UINT8 image.
 * <p>
 * Unlike standard CLAHE, the mapping is not interpolated between neighboring tiles.
 */
public final class TiledContrastEnhancement {

	private static final Logger logger = LoggerFactory.getLogger(TiledContrastEnhancement.class);

	/**
	 * Number of tiles along each axis.
	 */
	public static final int N_TILES = 8;

	/**
	 * Histogram bins are clipped at this multiple of the mean bin count.
	 */
	public static final double CLIP_LIMIT = 2.0;

	/**
	 * Pixels within this distance of an internal tile boundary are smoothed.
	 */
	public static final int BOUNDARY_DISTANCE = 2;

	/**
	 * Size of the mean filter used to smooth tile boundaries.
	 */
	public static final int BOUNDARY_FILTER_SIZE = 5;

	/**
	 * Gaussian sigma used for unsharp masking.
	 */
	public static final double UNSHARP_SIGMA = 1.0;

	// Suppress default constructor for non-instantiability
	private TiledContrastEnhancement() {
		throw new AssertionError();
	}

	/**
	 * Enhance an image.
	 * @param buffer
	 * @param sharpenStrength weight applied to the detail (image - blurred image) when sharpening; 0 for no sharpening
	 * @param contrastBoost multiplier applied to differences from the mean intensity; 1 for no change
	 * @return a single-channel UINT8 image
	 * @throws IllegalArgumentException if either parameter is not finite
	 */
	public static ImageBuffer enhance(ImageBuffer buffer, double sharpenStrength, double contrastBoost) {
		if (!Double.isFinite(sharpenStrength) || !Double.isFinite(contrastBoost))
			throw new IllegalArgumentException("Enhancement parameters must be finite, but got " + sharpenStrength + " and " + contrastBoost);
		int w = buffer.getWidth();
		int h = buffer.getHeight();

		double[] normalized = ColorConversion.normalizeToUint8(ColorConversion.toLuminance(buffer));
		double[] tiled = equalizeTiles(normalized, w, h);
		smoothTileBoundaries(tiled, w, h);

		double[] blurred = IJFilters.gaussianBlur(tiled, w, h, UNSHARP_SIGMA);
		double[] sharpened = new double[tiled.length];
		double sum = 0;
		for (int i = 0; i < tiled.length; i++) {
			sharpened[i] = tiled[i] + sharpenStrength * (tiled[i] - blurred[i]);
			sum += sharpened[i];
		}
		double mean = sum / sharpened.length;
		logger.debug("Mean intensity after sharpening: {}", mean);

		double[] output = new double[sharpened.length];
		for (int i = 0; i < sharpened.length; i++) {
			double v = mean + contrastBoost * (sharpened[i] - mean);
			output[i] = PixelType.UINT8.convertValue(Math.max(0, Math.min(255, v)));
		}
		return ImageBuffer.createSingleChannel(PixelType.UINT8, w, h, output);
	}

	/**
	 * Equalize each tile independently, using a clipped histogram.
	 * The last tile along each axis absorbs any remaining rows or columns.
	 * @param values 8-bit intensities
	 * @param width
	 * @param height
	 * @return equalized values (not rounded)
	 */
	static double[] equalizeTiles(double[] values, int width, int height) {
		int tileH = height / N_TILES;
		int tileW = width / N_TILES;
		double[] output = new double[values.length];
		for (int ty = 0; ty < N_TILES; ty++) {
			int y1 = ty * tileH;
			int y2 = ty < N_TILES - 1 ? (ty + 1) * tileH : height;
			for (int tx = 0; tx < N_TILES; tx++) {
				int x1 = tx * tileW;
				int x2 = tx < N_TILES - 1 ? (tx + 1) * tileW : width;
				if (y2 <= y1 || x2 <= x1)
					continue;
				var hist = new Histogram();
				for (int y = y1; y < y2; y++) {
					for (int x = x1; x < x2; x++)
						hist.add(values[y * width + x]);
				}
				double[] lut = computeClippedMapping(hist, (y2 - y1) * (x2 - x1));
				for (int y = y1; y < y2; y++) {
					for (int x = x1; x < x2; x++) {
						int ind = y * width + x;
						output[ind] = lut[(int)values[ind]];
					}
				}
			}
		}
		return output;
	}

	/**
	 * Compute the intensity mapping for one tile.
	 * Bins are clipped at {@link #CLIP_LIMIT} times the mean count, and the excess is spread evenly across all bins.
	 * @param hist
	 * @param nPixels
	 * @return 256 values in the range 0-255
	 */
	static double[] computeClippedMapping(Histogram hist, int nPixels) {
		int n = Histogram.N_BINS;
		double clipThreshold = CLIP_LIMIT * nPixels / n;
		double[] clipped = new double[n];
		double excess = 0;
		for (int i = 0; i < n; i++) {
			double count = hist.getCountsForBin(i);
			clipped[i] = Math.min(count, clipThreshold);
			excess += count - clipped[i];
		}
		double redistribute = excess / n;
		double[] cdf = new double[n];
		double sum = 0;
		for (int i = 0; i < n; i++) {
			sum += clipped[i] + redistribute;
			cdf[i] = sum;
		}
		for (int i = 0; i < n; i++)
			cdf[i] = cdf[i] / sum * 255.0;
		return cdf;
	}

	/**
	 * Replace pixels close to internal tile boundaries with a local mean, computed from the tiled image.
	 * @param values tiled values, updated in place
	 * @param width
	 * @param height
	 */
	static void smoothTileBoundaries(double[] values, int width, int height) {
		boolean[] rows = new boolean[height];
		boolean[] cols = new boolean[width];
		int tileH = height / N_TILES;
		int tileW = width / N_TILES;
		for (int i = 1; i < N_TILES; i++) {
			markBoundary(rows, i * tileH);
			markBoundary(cols, i * tileW);
		}
		double[] smoothed = ImageFilters.meanFilter(values, width, height, BOUNDARY_FILTER_SIZE);
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				if (rows[y] || cols[x]) {
					int ind = y * width + x;
					values[ind] = smoothed[ind];
				}
			}
		}
	}

	private static void markBoundary(boolean[] mask, int boundary) {
		if (boundary >= mask.length)
			return;
		int start = Math.max(0, boundary - BOUNDARY_DISTANCE);
		int end = Math.min(mask.length, boundary + BOUNDARY_DISTANCE + 1);
		for (int i = start; i < end; i++)
			mask[i] = true;
	}

}
