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

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import astroview.lib.images.ImageBuffer;
import astroview.lib.images.ImageLayer;
import astroview.lib.images.ImageMetadata;
import astroview.lib.images.LayerName;
import astroview.lib.images.SessionId;

/**
 * Holder for the current original image, its metadata and its session id.
 * <p>
 * The three values are stored together as a single immutable {@link ImageLayer}, which is always replaced
 * as a whole. Readers therefore always see a consistent snapshot, even if another thread loads a new image.
 */
public class SessionContext {

	private static final Logger logger = LoggerFactory.getLogger(SessionContext.class);

	private ImageLayer current;

	/**
	 * Store a new original image, replacing any previous image.
	 * @param buffer the image
	 * @param metadata the metadata; this is tagged with the 'Original' layer name
	 * @param sessionId the session id, or null if a new id should be generated
	 * @return the stored layer
	 */
	public synchronized ImageLayer setImage(ImageBuffer buffer, ImageMetadata metadata, SessionId sessionId) {
		if (sessionId == null)
			sessionId = SessionId.create();
		var meta = metadata == null ? ImageMetadata.empty() : metadata;
		current = new ImageLayer(buffer, meta.withLayerName(LayerName.ORIGINAL), sessionId);
		logger.debug("Session {} set to {}", sessionId, buffer);
		return current;
	}

	/**
	 * Get the current original image.
	 * @return
	 */
	public synchronized Optional<ImageLayer> getImage() {
		return Optional.ofNullable(current);
	}

	/**
	 * Returns true if an image is currently stored.
	 * @return
	 */
	public synchronized boolean hasImage() {
		return current != null;
	}

	/**
	 * Remove the current image.
	 */
	public synchronized void clear() {
		if (current != null)
			logger.debug("Clearing session {}", current.getSessionId());
		current = null;
	}

}
