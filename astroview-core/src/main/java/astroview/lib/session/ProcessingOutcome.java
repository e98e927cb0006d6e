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

import java.util.Objects;
import java.util.Optional;

import astroview.lib.images.ImageLayer;

/**
 * Result of a request made to a {@link ProcessingOrchestrator}.
 * A successful outcome has a layer; a failed outcome has an error type and message.
 */
public final class ProcessingOutcome {

	/**
	 * Reasons why a request can fail.
	 */
	public enum ErrorType {
		/**
		 * No processing unit is active.
		 */
		NO_ACTIVE_MODULE,
		/**
		 * No image has been loaded.
		 */
		NO_IMAGE,
		/**
		 * The active unit could not load the image.
		 */
		LOAD_FAILED,
		/**
		 * The active unit could not process the image.
		 */
		PROCESSING_FAILED
	}

	private final ImageLayer layer;
	private final ErrorType errorType;
	private final String message;
	private final Throwable cause;

	private ProcessingOutcome(ImageLayer layer, ErrorType errorType, String message, Throwable cause) {
		this.layer = layer;
		this.errorType = errorType;
		this.message = message;
		this.cause = cause;
	}

	static ProcessingOutcome success(ImageLayer layer) {
		return new ProcessingOutcome(Objects.requireNonNull(layer), null, null, null);
	}

	static ProcessingOutcome failure(ErrorType errorType, String message, Throwable cause) {
		return new ProcessingOutcome(null, Objects.requireNonNull(errorType), message, cause);
	}

	public boolean isSuccess() {
		return layer != null;
	}

	/**
	 * The layer that was created, if successful.
	 * @return
	 */
	public Optional<ImageLayer> getLayer() {
		return Optional.ofNullable(layer);
	}

	/**
	 * The error type, or null if successful.
	 * @return
	 */
	public ErrorType getErrorType() {
		return errorType;
	}

	/**
	 * A message describing the failure, or null if successful.
	 * @return
	 */
	public String getMessage() {
		return message;
	}

	public Optional<Throwable> getCause() {
		return Optional.ofNullable(cause);
	}

	@Override
	public String toString() {
		if (isSuccess())
			return "ProcessingOutcome [success, " + layer + "]";
		return "ProcessingOutcome [" + errorType + ", " + message + "]";
	}

}
