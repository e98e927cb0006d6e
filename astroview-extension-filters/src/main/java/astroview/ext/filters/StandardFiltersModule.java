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

package astroview.ext.filters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import javax.imageio.ImageIO;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import astroview.lib.awt.common.BufferedImageTools;
import astroview.lib.images.ImageBuffer;
import astroview.lib.images.ImageMetadata;
import astroview.lib.modules.AbstractProcessingUnit;
import astroview.lib.modules.ModuleControls;
import astroview.lib.modules.OperationRequest;
import astroview.lib.modules.OperationRequests;
import astroview.lib.modules.OperationRequests.ContrastStretch;
import astroview.lib.modules.OperationRequests.Convolution;
import astroview.lib.modules.OperationRequests.GammaCorrection;
import astroview.lib.modules.OperationRequests.GaussianBlur;
import astroview.lib.modules.OperationRequests.MedianFilter;
import astroview.lib.modules.ProcessingException;
import astroview.lib.modules.parameters.ParameterList;
import astroview.lib.processing.ImageFilters;

/**
 * Processing unit providing standard point and neighborhood filters.
 * Images are read with Java ImageIO.
 */
public class StandardFiltersModule extends AbstractProcessingUnit {

	private static final Logger logger = LoggerFactory.getLogger(StandardFiltersModule.class);

	/**
	 * Name of the unit.
	 */
	public static final String NAME = "Standard Filters";

	private static final List<String> FORMATS = List.of("png", "jpg", "jpeg", "bmp", "gif", "tif", "tiff");

	/**
	 * Constructor.
	 */
	public StandardFiltersModule() {
		super(NAME, FORMATS);
	}

	@Override
	protected ImageBuffer readImage(Path path) throws IOException {
		var img = ImageIO.read(path.toFile());
		if (img == null) {
			logger.debug("No ImageIO reader found for {}", path);
			return null;
		}
		return BufferedImageTools.toImageBuffer(img);
	}

	@Override
	protected ImageBuffer applyOperation(ImageBuffer buffer, ImageMetadata metadata, OperationRequest request) throws ProcessingException {
		switch (request.getOperationName()) {
		case OperationRequests.CONTRAST_STRETCHING:
			var stretch = castRequest(request, ContrastStretch.class);
			return ImageFilters.contrastStretch(buffer, stretch.getNewMin(), stretch.getNewMax());
		case OperationRequests.GAUSSIAN_BLUR:
			return ImageFilters.gaussianBlur(buffer, castRequest(request, GaussianBlur.class).getSigma());
		case OperationRequests.MEDIAN_FILTER:
			return ImageFilters.medianFilter(buffer, castRequest(request, MedianFilter.class).getFilterSize());
		case OperationRequests.SOBEL_EDGE_DETECTION:
			return ImageFilters.sobel(buffer);
		case OperationRequests.GAMMA_CORRECTION:
			return ImageFilters.gammaCorrection(buffer, castRequest(request, GammaCorrection.class).getGamma());
		case OperationRequests.CONVOLUTION:
			return ImageFilters.convolve3x3(buffer, castRequest(request, Convolution.class).getKernel());
		default:
			throw new ProcessingException("Unsupported operation " + request.getOperationName());
		}
	}

	@Override
	public ModuleControls createControls() {
		return new ModuleControls(NAME)
				.addOperation(OperationRequests.CONTRAST_STRETCHING, new ParameterList()
						.addDoubleParameter("new_min", "New minimum intensity", 0, null, 0, 255, "Minimum value of the output")
						.addDoubleParameter("new_max", "New maximum intensity", 255, null, 0, 255, "Maximum value of the output"))
				.addOperation(OperationRequests.GAUSSIAN_BLUR, new ParameterList()
						.addDoubleParameter("sigma", "Sigma", 1.0, "px", 0.1, 20, "Standard deviation of the Gaussian kernel"))
				.addOperation(OperationRequests.MEDIAN_FILTER, new ParameterList()
						.addIntParameter("filter_size", "Filter size", 3, "px", 1, 25, "Diameter of the circular neighborhood"))
				.addOperation(OperationRequests.SOBEL_EDGE_DETECTION, new ParameterList()
						.addEmptyParameter("Gradient magnitude of the luminance"))
				.addOperation(OperationRequests.GAMMA_CORRECTION, new ParameterList()
						.addDoubleParameter("gamma", "Gamma", 1.0, null, 0.1, 5.0, "Values < 1 brighten, values > 1 darken"))
				.addOperation(OperationRequests.CONVOLUTION, new ParameterList()
						.addStringParameter("kernel", "Kernel", "0, 0, 0; 0, 1, 0; 0, 0, 0", "9 values, row by row"));
	}

}
