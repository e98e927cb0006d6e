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

package astroview.lib.session;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import astroview.lib.images.ImageLayer;
import astroview.lib.images.LayerName;
import astroview.lib.modules.ModuleRegistry;
import astroview.lib.modules.OperationRequest;
import astroview.lib.modules.ProcessingUnit;
import astroview.lib.session.ProcessingOutcome.ErrorType;

/**
 * Sequences requests to load and process images with the active {@link ProcessingUnit}.
 * <p>
 * Loaded images are stored in a {@link SessionContext} as the 'Original' layer.
 * Processing always starts from a copy of the stored original, and its result is announced as the 'Processed' layer
 * without replacing the original - so that an image can be processed repeatedly with different parameters.
 * <p>
 * None of the methods throw exceptions for problems with the image or unit: failures are logged, returned
 * as a {@link ProcessingOutcome}, and leave the stored original unchanged.
 */
public class ProcessingOrchestrator {

	private static final Logger logger = LoggerFactory.getLogger(ProcessingOrchestrator.class);

	private final ModuleRegistry registry;
	private final SessionContext session;
	private final List<LayerListener> listeners = new CopyOnWriteArrayList<>();

	/**
	 * Constructor.
	 * @param registry registry providing the active processing unit
	 * @param session context holding the current original image
	 */
	public ProcessingOrchestrator(ModuleRegistry registry, SessionContext session) {
		this.registry = Objects.requireNonNull(registry, "Registry must not be null");
		this.session = Objects.requireNonNull(session, "Session must not be null");
	}

	/**
	 * Get the registry used by this orchestrator.
	 * @return
	 */
	public ModuleRegistry getRegistry() {
		return registry;
	}

	/**
	 * Get the session context used by this orchestrator.
	 * @return
	 */
	public SessionContext getSession() {
		return session;
	}

	/**
	 * Add a listener to be notified of layer changes.
	 * @param listener
	 */
	public void addLayerListener(LayerListener listener) {
		listeners.add(Objects.requireNonNull(listener));
	}

	/**
	 * Remove a listener.
	 * @param listener
	 */
	public void removeLayerListener(LayerListener listener) {
		listeners.remove(listener);
	}

	/**
	 * Load an image with the active unit, storing it as the current original.
	 * <p>
	 * On success, listeners are first asked to clear their layers, then informed of the new 'Original' layer.
	 * @param path
	 * @return
	 */
	public ProcessingOutcome loadImage(Path path) {
		var unit = registry.getActiveModule().orElse(null);
		if (unit == null)
			return fail(ErrorType.NO_ACTIVE_MODULE, "No active module to load image", null);

		try {
			var result = unit.loadImage(path);
			if (!result.isSuccess())
				return fail(ErrorType.LOAD_FAILED, "Failed to load image with module " + unit.getName() + ": " + result.getMessage(), result.getCause().orElse(null));
			fireClearLayers();
			var layer = session.setImage(result.getBuffer(), result.getMetadata(), result.getSessionId().orElse(null));
			logger.info("Loaded {} with {} (session {})", layer.getMetadata().getName(), unit.getName(), layer.getSessionId());
			fireLayerUpdated(layer);
			return ProcessingOutcome.success(layer);
		} catch (RuntimeException | LinkageError e) {
			return fail(ErrorType.LOAD_FAILED, "Error loading image with module " + unit.getName() + ": " + e.getLocalizedMessage(), e);
		}
	}

	/**
	 * Apply an operation to a copy of the current original with the active unit.
	 * <p>
	 * On success, listeners are informed of the new 'Processed' layer, which shares the original's session id.
	 * The stored original is never changed.
	 * @param request
	 * @return
	 */
	public ProcessingOutcome applyProcessing(OperationRequest request) {
		var unit = registry.getActiveModule().orElse(null);
		if (unit == null)
			return fail(ErrorType.NO_ACTIVE_MODULE, "No active module for processing", null);

		var original = session.getImage().orElse(null);
		if (original == null)
			return fail(ErrorType.NO_IMAGE, "No image loaded to process", null);

		try {
			var buffer = original.getBuffer().duplicate();
			var metadata = original.getMetadata().toBuilder().build();
			var processed = unit.processImage(buffer, metadata, request);
			if (processed == null)
				return fail(ErrorType.PROCESSING_FAILED, unit.getName() + " returned no image for " + request, null);
			var layer = new ImageLayer(
					processed,
					original.getMetadata().withLayerName(LayerName.PROCESSED),
					original.getSessionId());
			logger.info("Applied {} with {}", request, unit.getName());
			fireLayerUpdated(layer);
			return ProcessingOutcome.success(layer);
		} catch (Exception | LinkageError e) {
			return fail(ErrorType.PROCESSING_FAILED, "Error processing image with module " + unit.getName() + ": " + e.getLocalizedMessage(), e);
		}
	}

	private static ProcessingOutcome fail(ErrorType type, String message, Throwable cause) {
		logger.warn(message);
		if (cause != null)
			logger.debug(cause.getLocalizedMessage(), cause);
		return ProcessingOutcome.failure(type, message, cause);
	}

	private void fireClearLayers() {
		for (var listener : listeners) {
			try {
				listener.clearLayers();
			} catch (RuntimeException e) {
				logger.warn("Error clearing layers for " + listener + ": " + e.getLocalizedMessage(), e);
			}
		}
	}

	private void fireLayerUpdated(ImageLayer layer) {
		for (var listener : listeners) {
			try {
				listener.layerUpdated(layer);
			} catch (RuntimeException e) {
				logger.warn("Error updating layer for " + listener + ": " + e.getLocalizedMessage(), e);
			}
		}
	}

}
