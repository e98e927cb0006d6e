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

/**
 * Names of the display layers used to compare an image with its processed derivative.
 */
public enum LayerName {

	/**
	 * The image as it was loaded.
	 */
	ORIGINAL("Original"),

	/**
	 * The result of applying an operation to the original.
	 */
	PROCESSED("Processed");

	private final String displayName;

	private LayerName(String displayName) {
		this.displayName = displayName;
	}

	/**
	 * Get the name as stored in {@link ImageMetadata} under the 'layer_name' key.
	 * @return
	 */
	public String getDisplayName() {
		return displayName;
	}

	/**
	 * Get the layer with the specified display name.
	 * @param name
	 * @return the layer, or null if the name is not recognized
	 */
	public static LayerName fromDisplayName(String name) {
		for (var layer : values()) {
			if (layer.displayName.equals(name))
				return layer;
		}
		return null;
	}

	@Override
	public String toString() {
		return displayName;
	}

}
