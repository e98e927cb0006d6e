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

import astroview.lib.images.ImageLayer;

/**
 * Listener for changes to the layers that should be displayed, e.g. by a viewer.
 * <p>
 * A viewer should create or replace the layer named by {@link ImageLayer#getLayerName()}.
 */
public interface LayerListener {

	/**
	 * Called before a newly-loaded original image is announced, so that any stale layers
	 * (in particular, a previous 'Processed' layer) can be removed.
	 */
	void clearLayers();

	/**
	 * Called when a layer has been created or updated.
	 * @param layer
	 */
	void layerUpdated(ImageLayer layer);

}
