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

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import astroview.lib.common.GeneralTools;
import astroview.lib.images.ImageBuffer;
import astroview.lib.images.ImageMetadata;

/**
 * Interface for a processing unit (module) that can load images and apply operations to them.
 * <p>
 * Implementations are discovered at runtime using a {@link java.util.ServiceLoader}, and are therefore
 * required to have a public no-argument constructor.
 * Apart from the methods defined here, the host knows nothing about their concrete types.
 *
 * @see AbstractProcessingUnit
 * @see ModuleLoader
 */
public interface ProcessingUnit {

	/**
	 * Get a stable, human-readable name for this unit. This is used as the key when registering the unit.
	 * @return
	 */
	String getName();

	/**
	 * Get the formats that can be loaded by this unit, as lower-case file extensions without the dot
	 * (e.g. "png", "tiff").
	 * @return
	 */
	Set<String> getSupportedFormats();

	/**
	 * Get the names of all operations this unit can apply, in the order they should be presented to a user.
	 * @return
	 */
	List<String> getOperationNames();

	/**
	 * Query whether this unit reports support for a specified file, based upon its extension.
	 * @param path
	 * @return
	 */
	default boolean supportsFile(Path path) {
		return path != null && GeneralTools.hasFormat(path, getSupportedFormats());
	}

	/**
	 * Read an image from a file.
	 * <p>
	 * This should never throw an exception: any problem should be reported through a failed {@link LoadResult}.
	 * @param path
	 * @return
	 */
	LoadResult loadImage(Path path);

	/**
	 * Apply an operation to an image, returning the result as a new buffer.
	 * <p>
	 * Implementations must not depend upon any state other than the arguments,
	 * and must not modify the buffer or metadata.
	 *
	 * @param buffer the image to process
	 * @param metadata metadata for the image
	 * @param request the operation and its parameters
	 * @return the processed image
	 * @throws ProcessingException if the operation is not supported, or cannot be applied with the given parameters
	 */
	ImageBuffer processImage(ImageBuffer buffer, ImageMetadata metadata, OperationRequest request) throws ProcessingException;

	/**
	 * Create the controls for this unit, i.e. the parameters that may be adjusted for each operation.
	 * A new instance should be returned by each call.
	 * @return
	 */
	ModuleControls createControls();

}
