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

package astroview.lib.analysis.stats;

import java.util.Arrays;

/**
 * Class for storing histogram data for 8-bit intensities.
 * <p>
 * There are always 256 bins, one per integer intensity, and values are assigned to bins by truncation.
 * Values outside the range 0-255 are counted as missing.
 */
public class Histogram {

	/**
	 * Number of bins in every histogram.
	 */
	public static final int N_BINS = 256;

	private final long[] counts = new long[N_BINS];
	private long countSum;
	private long nMissing;

	/**
	 * Create a histogram from an array of values.
	 * @param values
	 */
	public Histogram(double[] values) {
		this(values, 0, values.length);
	}

	/**
	 * Create a histogram from part of an array of values.
	 * @param values
	 * @param from first index (inclusive)
	 * @param to last index (exclusive)
	 */
	public Histogram(double[] values, int from, int to) {
		for (int i = from; i < to; i++)
			add(values[i]);
	}

	/**
	 * Create an empty histogram, to be populated with {@link #add(double)}.
	 */
	public Histogram() {}

	/**
	 * Add a value to the histogram.
	 * @param value
	 */
	public void add(double value) {
		if (!(value >= 0 && value < N_BINS)) {
			nMissing++;
			return;
		}
		counts[(int)value]++;
		countSum++;
	}

	/**
	 * Get the number of values in a bin.
	 * @param ind
	 * @return
	 */
	public long getCountsForBin(int ind) {
		return counts[ind];
	}

	/**
	 * Get a copy of all bin counts.
	 * @return
	 */
	public long[] getCounts() {
		return counts.clone();
	}

	/**
	 * Get the cumulative counts, where element i is the number of values in bins 0 to i (inclusive).
	 * @return
	 */
	public long[] getCumulativeCounts() {
		long[] cumulative = new long[N_BINS];
		long sum = 0;
		for (int i = 0; i < N_BINS; i++) {
			sum += counts[i];
			cumulative[i] = sum;
		}
		return cumulative;
	}

	/**
	 * Get the total number of values counted in bins.
	 * @return
	 */
	public long getCountSum() {
		return countSum;
	}

	/**
	 * Get the number of values that were outside the histogram range, or NaN.
	 * @return
	 */
	public long nMissingValues() {
		return nMissing;
	}

	/**
	 * Get the number of bins with a non-zero count.
	 * @return
	 */
	public int nNonEmptyBins() {
		return (int)Arrays.stream(counts).filter(c -> c > 0).count();
	}

	@Override
	public String toString() {
		return "Histogram [" + countSum + " values, " + nNonEmptyBins() + " non-empty bins]";
	}

}
