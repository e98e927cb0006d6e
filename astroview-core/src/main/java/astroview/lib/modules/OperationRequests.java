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

package astroview.lib.modules;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

import astroview.lib.io.GsonTools;
import astroview.lib.io.GsonTools.SubTypeAdapterFactory;
import astroview.lib.modules.parameters.ParameterList;

/**
 * Static methods to create {@link OperationRequest OperationRequests}, along with the available request types.
 * <p>
 * Requests can be serialized to JSON using {@link GsonTools}, in which case the operation name is stored
 * in the 'operation' field, e.g.
 * <pre>
 * {"operation": "Gaussian Blur", "sigma": 2.0}
 * </pre>
 * For convenience, a lower-case form of the name with spaces replaced by underscores
 * (e.g. "gaussian_blur") is also accepted when reading.
 */
public class OperationRequests {

	/**
	 * Name of the field used to store the operation name in JSON and key-value maps.
	 */
	public static final String KEY_OPERATION = "operation";

	/**
	 * Name of the contrast stretching operation.
	 */
	public static final String CONTRAST_STRETCHING = "Contrast Stretching";
	/**
	 * Name of the Gaussian blur operation.
	 */
	public static final String GAUSSIAN_BLUR = "Gaussian Blur";
	/**
	 * Name of the median filter operation.
	 */
	public static final String MEDIAN_FILTER = "Median Filter";
	/**
	 * Name of the Sobel edge detection operation.
	 */
	public static final String SOBEL_EDGE_DETECTION = "Sobel Edge Detection";
	/**
	 * Name of the gamma correction operation.
	 */
	public static final String GAMMA_CORRECTION = "Gamma Correction";
	/**
	 * Name of the 3x3 convolution operation.
	 */
	public static final String CONVOLUTION = "Convolution";
	/**
	 * Name of the tile-based detail enhancement operation.
	 */
	public static final String MOON_DETAIL_ENHANCEMENT = "Moon Detail Enhancement";
	/**
	 * Name of the histogram equalization operation.
	 */
	public static final String HISTOGRAM_EQUALIZATION = "Histogram Equalization";

	private static final SubTypeAdapterFactory<OperationRequest> factory = SubTypeAdapterFactory.create(OperationRequest.class, KEY_OPERATION);

	private static final Map<String, Class<? extends OperationRequest>> operations = new LinkedHashMap<>();

	static {
		registerOperation(ContrastStretch.class, CONTRAST_STRETCHING);
		registerOperation(GaussianBlur.class, GAUSSIAN_BLUR);
		registerOperation(MedianFilter.class, MEDIAN_FILTER);
		registerOperation(SobelEdges.class, SOBEL_EDGE_DETECTION);
		registerOperation(GammaCorrection.class, GAMMA_CORRECTION);
		registerOperation(Convolution.class, CONVOLUTION);
		registerOperation(DetailEnhancement.class, MOON_DETAIL_ENHANCEMENT);
		registerOperation(HistogramEqualization.class, HISTOGRAM_EQUALIZATION);
	}

	private static void registerOperation(Class<? extends OperationRequest> cls, String name) {
		factory.registerSubtype(cls, name);
		factory.registerAlias(cls, name.toLowerCase(Locale.ROOT).replace(' ', '_'));
		operations.put(name, cls);
	}

	// Suppress default constructor for non-instantiability
	private OperationRequests() {
		throw new AssertionError();
	}

	/**
	 * Get the type adapter factory used to serialize and deserialize requests.
	 * This is registered with the default builder in {@link GsonTools}.
	 * @return
	 */
	public static SubTypeAdapterFactory<OperationRequest> getTypeAdapterFactory() {
		return factory;
	}

	/**
	 * Get the names of all known operations.
	 * @return
	 */
	public static List<String> getOperationNames() {
		return Collections.unmodifiableList(new ArrayList<>(operations.keySet()));
	}

	/**
	 * Create a contrast stretching request.
	 * @param newMin minimum value of the output
	 * @param newMax maximum value of the output
	 * @return
	 */
	public static ContrastStretch contrastStretch(double newMin, double newMax) {
		return new ContrastStretch(newMin, newMax);
	}

	/**
	 * Create a Gaussian blur request.
	 * @param sigma Gaussian sigma, in pixels; must be &gt; 0
	 * @return
	 */
	public static GaussianBlur gaussianBlur(double sigma) {
		return new GaussianBlur(sigma);
	}

	/**
	 * Create a median filter request.
	 * @param filterSize diameter of the filter; values &lt;= 1 result in no change
	 * @return
	 */
	public static MedianFilter medianFilter(int filterSize) {
		return new MedianFilter(filterSize);
	}

	/**
	 * Create a Sobel edge detection request.
	 * @return
	 */
	public static SobelEdges sobelEdges() {
		return new SobelEdges();
	}

	/**
	 * Create a gamma correction request.
	 * @param gamma exponent; must be &gt; 0
	 * @return
	 */
	public static GammaCorrection gammaCorrection(double gamma) {
		return new GammaCorrection(gamma);
	}

	/**
	 * Create a convolution request.
	 * @param kernel 3x3 kernel, indexed as {@code kernel[row][column]}
	 * @return
	 * @throws IllegalArgumentException if the kernel is not 3x3
	 */
	public static Convolution convolution(double[][] kernel) {
		return new Convolution(kernel);
	}

	/**
	 * Create a detail enhancement request.
	 * @param sharpenStrength weight of the unsharp mask
	 * @param contrastBoost global contrast multiplier
	 * @return
	 */
	public static DetailEnhancement detailEnhancement(double sharpenStrength, double contrastBoost) {
		return new DetailEnhancement(sharpenStrength, contrastBoost);
	}

	/**
	 * Create a histogram equalization request.
	 * @return
	 */
	public static HistogramEqualization histogramEqualization() {
		return new HistogramEqualization();
	}

	/**
	 * Serialize a request to JSON.
	 * @param request
	 * @return
	 */
	public static String toJson(OperationRequest request) {
		return GsonTools.getInstance().toJson(request, OperationRequest.class);
	}

	/**
	 * Parse a request from JSON.
	 * @param json
	 * @return
	 * @throws IllegalArgumentException if the JSON does not represent a known request
	 */
	public static OperationRequest fromJson(String json) {
		try {
			var request = GsonTools.getInstance().fromJson(json, OperationRequest.class);
			if (request == null)
				throw new IllegalArgumentException("No operation request found in '" + json + "'");
			return request;
		} catch (JsonParseException e) {
			throw new IllegalArgumentException("Unable to parse operation request: " + e.getLocalizedMessage(), e);
		}
	}

	/**
	 * Create a request from a map of keys and values.
	 * The map must contain the 'operation' key; other keys correspond to the fields of the request.
	 * A 'kernel' may be given as a 2D array or as a String of 9 numbers.
	 * @param map
	 * @return
	 * @throws IllegalArgumentException if the map does not represent a known request
	 */
	public static OperationRequest fromMap(Map<String, ?> map) {
		var operation = map.get(KEY_OPERATION);
		if (operation == null)
			throw new IllegalArgumentException("No '" + KEY_OPERATION + "' specified");
		if (factory.getSubtype(operation.toString()) == null)
			throw new IllegalArgumentException("Unknown operation '" + operation + "'");
		Map<String, Object> copy = new LinkedHashMap<>(map);
		var kernel = copy.get(Convolution.KEY_KERNEL);
		if (kernel instanceof String)
			copy.put(Convolution.KEY_KERNEL, parseKernel((String)kernel));
		try {
			var gson = GsonTools.getInstance();
			return gson.fromJson(gson.toJsonTree(copy), OperationRequest.class);
		} catch (JsonParseException e) {
			throw new IllegalArgumentException("Unable to create request for '" + operation + "': " + e.getLocalizedMessage(), e);
		}
	}

	/**
	 * Create a request from the current values in a parameter list.
	 * @param operation the operation name
	 * @param params parameters, with keys matching the request fields
	 * @return
	 */
	public static OperationRequest fromParameters(String operation, ParameterList params) {
		Map<String, Object> map = new LinkedHashMap<>();
		map.put(KEY_OPERATION, operation);
		if (params != null)
			map.putAll(params.getKeyValueParameters());
		return fromMap(map);
	}

	/**
	 * Parse a 3x3 kernel from a String containing 9 numbers, separated by commas, semicolons or whitespace.
	 * Square brackets are ignored.
	 * @param text
	 * @return the kernel, indexed as {@code kernel[row][column]}
	 * @throws IllegalArgumentException if the text does not contain exactly 9 numbers
	 */
	public static double[][] parseKernel(String text) {
		Objects.requireNonNull(text, "Kernel text must not be null");
		var tokens = text.replace("[", " ").replace("]", " ").trim().split("[,;\\s]+");
		if (tokens.length != 9)
			throw new IllegalArgumentException("Kernel must contain 9 values, but found " + (tokens[0].isEmpty() ? 0 : tokens.length));
		double[][] kernel = new double[3][3];
		for (int i = 0; i < 9; i++) {
			try {
				kernel[i / 3][i % 3] = Double.parseDouble(tokens[i]);
			} catch (NumberFormatException e) {
				throw new IllegalArgumentException("Invalid kernel value '" + tokens[i] + "'", e);
			}
		}
		return kernel;
	}

	/**
	 * Format a 3x3 kernel as text that can be read by {@link #parseKernel(String)}.
	 * @param kernel
	 * @return
	 */
	public static String formatKernel(double[][] kernel) {
		var sb = new StringBuilder();
		for (int r = 0; r < kernel.length; r++) {
			if (r > 0)
				sb.append("; ");
			for (int c = 0; c < kernel[r].length; c++) {
				if (c > 0)
					sb.append(", ");
				sb.append(kernel[r][c]);
			}
		}
		return sb.toString();
	}

	private static void checkKernel(double[][] kernel) {
		Objects.requireNonNull(kernel, "Kernel must not be null");
		if (kernel.length != 3)
			throw new IllegalArgumentException("Kernel must be 3x3, but has " + kernel.length + " rows");
		for (var row : kernel) {
			if (row == null || row.length != 3)
				throw new IllegalArgumentException("Kernel must be 3x3, but has a row of length " + (row == null ? 0 : row.length));
		}
	}


	/**
	 * Linear contrast stretch to a new range.
	 */
	public static final class ContrastStretch implements OperationRequest {

		@SerializedName("new_min")
		private double newMin = 0.0;

		@SerializedName("new_max")
		private double newMax = 255.0;

		private ContrastStretch() {}

		private ContrastStretch(double newMin, double newMax) {
			this.newMin = newMin;
			this.newMax = newMax;
		}

		public double getNewMin() {
			return newMin;
		}

		public double getNewMax() {
			return newMax;
		}

		@Override
		public String getOperationName() {
			return CONTRAST_STRETCHING;
		}

		@Override
		public String toString() {
			return getOperationName() + " [new_min=" + newMin + ", new_max=" + newMax + "]";
		}

	}

	/**
	 * Gaussian smoothing.
	 */
	public static final class GaussianBlur implements OperationRequest {

		private double sigma = 1.0;

		private GaussianBlur() {}

		private GaussianBlur(double sigma) {
			this.sigma = sigma;
		}

		public double getSigma() {
			return sigma;
		}

		@Override
		public String getOperationName() {
			return GAUSSIAN_BLUR;
		}

		@Override
		public String toString() {
			return getOperationName() + " [sigma=" + sigma + "]";
		}

	}

	/**
	 * Median filter with a disk-shaped neighborhood.
	 */
	public static final class MedianFilter implements OperationRequest {

		@SerializedName("filter_size")
		private int filterSize = 3;

		private MedianFilter() {}

		private MedianFilter(int filterSize) {
			this.filterSize = filterSize;
		}

		public int getFilterSize() {
			return filterSize;
		}

		@Override
		public String getOperationName() {
			return MEDIAN_FILTER;
		}

		@Override
		public String toString() {
			return getOperationName() + " [filter_size=" + filterSize + "]";
		}

	}

	/**
	 * Sobel gradient magnitude. This has no parameters.
	 */
	public static final class SobelEdges implements OperationRequest {

		private SobelEdges() {}

		@Override
		public String getOperationName() {
			return SOBEL_EDGE_DETECTION;
		}

		@Override
		public String toString() {
			return getOperationName();
		}

	}

	/**
	 * Power-law intensity transform.
	 */
	public static final class GammaCorrection implements OperationRequest {

		private double gamma = 1.0;

		private GammaCorrection() {}

		private GammaCorrection(double gamma) {
			this.gamma = gamma;
		}

		public double getGamma() {
			return gamma;
		}

		@Override
		public String getOperationName() {
			return GAMMA_CORRECTION;
		}

		@Override
		public String toString() {
			return getOperationName() + " [gamma=" + gamma + "]";
		}

	}

	/**
	 * Convolution with a 3x3 kernel.
	 */
	public static final class Convolution implements OperationRequest {

		static final String KEY_KERNEL = "kernel";

		private double[][] kernel = {
				{0, 0, 0},
				{0, 1, 0},
				{0, 0, 0}
		};

		private Convolution() {}

		private Convolution(double[][] kernel) {
			checkKernel(kernel);
			this.kernel = new double[3][];
			for (int r = 0; r < 3; r++)
				this.kernel[r] = kernel[r].clone();
		}

		/**
		 * Get a copy of the kernel, indexed as {@code kernel[row][column]}.
		 * @return
		 * @throws IllegalArgumentException if the kernel is not 3x3 (which is possible if it was read from JSON)
		 */
		public double[][] getKernel() {
			checkKernel(kernel);
			double[][] copy = new double[3][];
			for (int r = 0; r < 3; r++)
				copy[r] = kernel[r].clone();
			return copy;
		}

		@Override
		public String getOperationName() {
			return CONVOLUTION;
		}

		@Override
		public String toString() {
			return getOperationName() + " [kernel=" + Arrays.deepToString(kernel) + "]";
		}

	}

	/**
	 * Tile-based adaptive histogram equalization, followed by unsharp masking and a global contrast boost.
	 */
	public static final class DetailEnhancement implements OperationRequest {

		@SerializedName("sharpen_strength")
		private double sharpenStrength = 2.0;

		@SerializedName("contrast_boost")
		private double contrastBoost = 1.5;

		private DetailEnhancement() {}

		private DetailEnhancement(double sharpenStrength, double contrastBoost) {
			this.sharpenStrength = sharpenStrength;
			this.contrastBoost = contrastBoost;
		}

		public double getSharpenStrength() {
			return sharpenStrength;
		}

		public double getContrastBoost() {
			return contrastBoost;
		}

		@Override
		public String getOperationName() {
			return MOON_DETAIL_ENHANCEMENT;
		}

		@Override
		public String toString() {
			return getOperationName() + " [sharpen_strength=" + sharpenStrength + ", contrast_boost=" + contrastBoost + "]";
		}

	}

	/**
	 * Global histogram equalization. This has no parameters.
	 */
	public static final class HistogramEqualization implements OperationRequest {

		private HistogramEqualization() {}

		@Override
		public String getOperationName() {
			return HISTOGRAM_EQUALIZATION;
		}

		@Override
		public String toString() {
			return getOperationName();
		}

	}

}
