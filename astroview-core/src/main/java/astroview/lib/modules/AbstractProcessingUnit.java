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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import astroview.lib.images.ImageBuffer;
import astroview.lib.images.ImageMetadata;

/**
 * Abstract {@link ProcessingUnit} that handles the bookkeeping common to most implementations.
 * <p>
 * Subclasses only need to read an image ({@link #readImage(Path)}) and apply an operation
 * ({@link #applyOperation(ImageBuffer, ImageMetadata, OperationRequest)}).
 * This class ensures that loading never throws an exception, that only supported operations are applied,
 * and that invalid arguments are reported as a {@link ProcessingException}.
 */
public abstract class AbstractProcessingUnit implements ProcessingUnit {

	private static final Logger logger = LoggerFactory.getLogger(AbstractProcessingUnit.class);

	private final String name;
	private final Set<String> formats;

	protected AbstractProcessingUnit(String name, Collection<String> formats) {
		this.name = Objects.requireNonNull(name, "Name must not be null");
		var set = new LinkedHashSet<String>();
		for (var format : formats) {
			var token = format.trim().toLowerCase(Locale.ROOT);
			if (token.startsWith("."))
				token = token.substring(1);
			if (!token.isEmpty())
				set.add(token);
		}
		this.formats = Collections.unmodifiableSet(set);
	}

	@Override
	public String getName() {
		return name;
	}

	@Override
	public Set<String> getSupportedFormats() {
		return formats;
	}

	@Override
	public final LoadResult loadImage(Path path) {
		if (path == null)
			return LoadResult.failure("No file specified", null);
		if (!Files.isRegularFile(path))
			return LoadResult.failure("File not found: " + path, null);
		try {
			var buffer = readImage(path);
			if (buffer == null)
				return LoadResult.failure("Unable to read an image from " + path.getFileName(), null);
			var metadata = createMetadata(path, buffer);
			logger.debug("{} read {} from {}", name, buffer, path);
			return LoadResult.success(buffer, metadata, null);
		} catch (Exception | LinkageError e) {
			logger.warn("Error loading {} with {}: {}", path, name, e.getLocalizedMessage());
			logger.debug(e.getLocalizedMessage(), e);
			return LoadResult.failure("Error loading " + path.getFileName() + ": " + e.getLocalizedMessage(), e);
		}
	}

	/**
	 * Read the pixels of an image.
	 * @param path a path to an existing file
	 * @return the image, or null if it could not be read
	 * @throws IOException
	 */
	protected abstract ImageBuffer readImage(Path path) throws IOException;

	/**
	 * Create metadata for a newly-read image. The default implementation stores the file name only.
	 * @param path
	 * @param buffer
	 * @return
	 */
	protected ImageMetadata createMetadata(Path path, ImageBuffer buffer) {
		return ImageMetadata.builder()
				.name(path.getFileName().toString())
				.build();
	}

	@Override
	public final ImageBuffer processImage(ImageBuffer buffer, ImageMetadata metadata, OperationRequest request) throws ProcessingException {
		Objects.requireNonNull(buffer, "Buffer must not be null");
		if (request == null)
			throw new ProcessingException("No operation requested");
		var operation = request.getOperationName();
		if (!getOperationNames().contains(operation))
			throw new ProcessingException("Operation '" + operation + "' is not supported by " + name);
		try {
			long startTime = System.currentTimeMillis();
			var result = applyOperation(buffer, metadata == null ? ImageMetadata.empty() : metadata, request);
			long endTime = System.currentTimeMillis();
			logger.debug("{} applied in {} ms", request, endTime - startTime);
			return result;
		} catch (IllegalArgumentException e) {
			throw new ProcessingException("Unable to apply " + operation + ": " + e.getLocalizedMessage(), e);
		}
	}

	/**
	 * Apply an operation. This is only called for operations that are included in {@link #getOperationNames()}.
	 * @param buffer
	 * @param metadata
	 * @param request
	 * @return
	 * @throws ProcessingException
	 * @throws IllegalArgumentException if the parameters are invalid
	 */
	protected abstract ImageBuffer applyOperation(ImageBuffer buffer, ImageMetadata metadata, OperationRequest request) throws ProcessingException;

	/**
	 * Helper method to cast a request to the type expected for an operation.
	 * @param <T>
	 * @param request
	 * @param cls
	 * @return
	 * @throws ProcessingException if the request is not of the expected type
	 */
	protected static <T extends OperationRequest> T castRequest(OperationRequest request, Class<T> cls) throws ProcessingException {
		if (cls.isInstance(request))
			return cls.cast(request);
		throw new ProcessingException("Expected " + cls.getSimpleName() + " for " + request.getOperationName() + ", but got " + request.getClass().getSimpleName());
	}

	@Override
	public List<String> getOperationNames() {
		return createControls().getOperationNames();
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + " [" + name + "]";
	}

}
