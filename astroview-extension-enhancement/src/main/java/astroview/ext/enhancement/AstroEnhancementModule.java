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

package astroview.ext.enhancement;

import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import astroview.imagej.tools.IJTools;
import astroview.lib.images.ImageBuffer;
import astroview.lib.images.ImageMetadata;
import astroview.lib.modules.AbstractProcessingUnit;
import astroview.lib.modules.ModuleControls;
import astroview.lib.modules.OperationRequest;
import astroview.lib.modules.OperationRequests;
import astroview.lib.modules.OperationRequests.DetailEnhancement;
import astroview.lib.modules.ProcessingException;
import astroview.lib.modules.parameters.ParameterList;
import astroview.lib.processing.HistogramEqualization;
import astroview.lib.processing.TiledContrastEnhancement;
import ij.IJ;

/**
 * Processing unit for enhancing astronomical images, particularly of the moon.
 * <p>
 * Images are read with ImageJ, which also supports FITS files.
 */
public class AstroEnhancementModule extends AbstractProcessingUnit {

	private static final Logger logger = LoggerFactory.getLogger(AstroEnhancementModule.class);

	/**
	 * Name of the unit.
	 */
	public static final String NAME = "Astro Enhancement";

	private static final List<String> FORMATS = List.of("png", "jpg", "jpeg", "bmp", "tif", "tiff", "fits", "fit", "fts");

	/**
	 * Constructor.
	 */
	public AstroEnhancementModule() {
		super(NAME, FORMATS);
	}

	@Override
	protected ImageBuffer readImage(Path path) {
		var imp = IJ.openImage(path.toAbsolutePath().toString());
		if (imp == null) {
			logger.debug("ImageJ could not open {}", path);
			return null;
		}
		try {
			if (imp.getStackSize() > 1)
				logger.warn("{} has {} slices, only the first will be used", path.getFileName(), imp.getStackSize());
			return IJTools.convertToImageBuffer(imp);
		} finally {
			imp.close();
		}
	}

	/**
	 * Include the intensity range as contrast limits, since FITS data rarely uses a fixed display range.
	 */
	@Override
	protected ImageMetadata createMetadata(Path path, ImageBuffer buffer) {
		return ImageMetadata.builder()
				.name(path.getFileName().toString())
				.contrastLimits(buffer.getMinValue(), buffer.getMaxValue())
				.build();
	}

	@Override
	protected ImageBuffer applyOperation(ImageBuffer buffer, ImageMetadata metadata, OperationRequest request) throws ProcessingException {
		switch (request.getOperationName()) {
		case OperationRequests.MOON_DETAIL_ENHANCEMENT:
			var params = castRequest(request, DetailEnhancement.class);
			return TiledContrastEnhancement.enhance(buffer, params.getSharpenStrength(), params.getContrastBoost());
		case OperationRequests.HISTOGRAM_EQUALIZATION:
			return HistogramEqualization.equalize(buffer);
		default:
			throw new ProcessingException("Unsupported operation " + request.getOperationName());
		}
	}

	@Override
	public ModuleControls createControls() {
		return new ModuleControls(NAME)
				.addOperation(OperationRequests.MOON_DETAIL_ENHANCEMENT, new ParameterList()
						.addDoubleParameter("sharpen_strength", "Sharpening strength", 2.0, null, 0, 5, "Weight of the unsharp mask")
						.addDoubleParameter("contrast_boost", "Contrast boost", 1.5, null, 1, 3, "Multiplier for differences from the mean intensity"))
				.addOperation(OperationRequests.HISTOGRAM_EQUALIZATION, new ParameterList()
						.addEmptyParameter("Redistributes intensities to use the full dynamic range"));
	}

}
