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

package astroview.lib.images;

import java.util.Objects;

/**
 * An image buffer with its metadata and session id, as sent to a viewer.
 * The layer it should be displayed in is given by the metadata's layer name.
 */
public final class ImageLayer {

	private final ImageBuffer buffer;
	private final ImageMetadata metadata;
	private final SessionId sessionId;

	/**
	 * Constructor.
	 * @param buffer the pixels
	 * @param metadata the metadata
	 * @param sessionId the session this layer belongs to
	 */
	public ImageLayer(ImageBuffer buffer, ImageMetadata metadata, SessionId sessionId) {
		this.buffer = Objects.requireNonNull(buffer, "Buffer must not be null");
		this.metadata = metadata == null ? ImageMetadata.empty() : metadata;
		this.sessionId = Objects.requireNonNull(sessionId, "Session id must not be null");
	}

	public ImageBuffer getBuffer() {
		return buffer;
	}

	public ImageMetadata getMetadata() {
		return metadata;
	}

	public SessionId getSessionId() {
		return sessionId;
	}

	/**
	 * Convenience method to get the layer name from the metadata.
	 * @return
	 */
	public LayerName getLayerName() {
		return metadata.getLayerName();
	}

	@Override
	public String toString() {
		return "ImageLayer [" + getLayerName() + ", " + buffer + ", session=" + sessionId + "]";
	}

}
