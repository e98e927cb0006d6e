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

import java.util.Objects;
import java.util.Optional;

import astroview.lib.images.ImageBuffer;
import astroview.lib.images.ImageMetadata;
import astroview.lib.images.SessionId;

/**
 * Result of requesting that a {@link ProcessingUnit} loads an image.
 * <p>
 * A successful result always has a buffer. A failed result never has one, and its metadata is empty.
 */
public final class LoadResult {

	private final ImageBuffer buffer;
	private final ImageMetadata metadata;
	private final SessionId sessionId;
	private final String message;
	private final Throwable cause;

	private LoadResult(ImageBuffer buffer, ImageMetadata metadata, SessionId sessionId, String message, Throwable cause) {
		this.buffer = buffer;
		this.metadata = metadata;
		this.sessionId = sessionId;
		this.message = message;
		this.cause = cause;
	}

	/**
	 * Create a successful result.
	 * @param buffer the image; must not be null
	 * @param metadata the image metadata; may be null if no metadata is available
	 * @param sessionId an optional session id; if null, one will be generated when the image is stored
	 * @return
	 */
	public static LoadResult success(ImageBuffer buffer, ImageMetadata metadata, SessionId sessionId) {
		Objects.requireNonNull(buffer, "Buffer must not be null for a successful load");
		return new LoadResult(buffer, metadata == null ? ImageMetadata.empty() : metadata, sessionId, null, null);
	}

	/**
	 * Create a failed result.
	 * @param message a message explaining the failure
	 * @param cause the exception that caused the failure; may be null
	 * @return
	 */
	public static LoadResult failure(String message, Throwable cause) {
		return new LoadResult(null, ImageMetadata.empty(), null, message, cause);
	}

	/**
	 * Returns true if the image was loaded successfully.
	 * @return
	 */
	public boolean isSuccess() {
		return buffer != null;
	}

	/**
	 * Get the loaded image.
	 * @return the buffer, or null if loading failed
	 */
	public ImageBuffer getBuffer() {
		return buffer;
	}

	/**
	 * Get the image metadata. This is empty if loading failed.
	 * @return
	 */
	public ImageMetadata getMetadata() {
		return metadata;
	}

	/**
	 * Get the session id supplied by the loader, if any.
	 * @return
	 */
	public Optional<SessionId> getSessionId() {
		return Optional.ofNullable(sessionId);
	}

	/**
	 * Get the failure message.
	 * @return the message, or null if loading succeeded
	 */
	public String getMessage() {
		return message;
	}

	/**
	 * Get the cause of a failure, if known.
	 * @return
	 */
	public Optional<Throwable> getCause() {
		return Optional.ofNullable(cause);
	}

	@Override
	public String toString() {
		if (isSuccess())
			return "LoadResult [success, " + buffer + "]";
		return "LoadResult [failure, " + message + "]";
	}

}
