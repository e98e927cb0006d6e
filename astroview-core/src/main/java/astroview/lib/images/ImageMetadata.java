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

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Annotations attached to an {@link ImageBuffer}.
 * <p>
 * This is an open mapping of string keys to values. A few keys are well-known and have typed accessors:
 * <ul>
 *   <li>{@link #KEY_NAME} - a human-readable name for the image</li>
 *   <li>{@link #KEY_LAYER_NAME} - the display layer ('Original' or 'Processed')</li>
 *   <li>{@link #KEY_CONTRAST_LIMITS} - optional display limits, stored as a {@code double[2]}</li>
 * </ul>
 * Metadata is immutable. Changes are made by creating a new instance with {@link #toBuilder()},
 * so that the metadata of an original image and its processed derivative can never be aliased.
 */
public final class ImageMetadata {

	/**
	 * Key for the image name.
	 */
	public static final String KEY_NAME = "name";

	/**
	 * Key for the layer name.
	 * @see LayerName
	 */
	public static final String KEY_LAYER_NAME = "layer_name";

	/**
	 * Key for display contrast limits.
	 */
	public static final String KEY_CONTRAST_LIMITS = "contrast_limits";

	private static final ImageMetadata EMPTY = new ImageMetadata(Collections.emptyMap());

	private final Map<String, Object> values;

	private ImageMetadata(Map<String, Object> values) {
		this.values = Collections.unmodifiableMap(values);
	}

	/**
	 * Get metadata containing no entries.
	 * @return
	 */
	public static ImageMetadata empty() {
		return EMPTY;
	}

	/**
	 * Create a new builder.
	 * @return
	 */
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Create a builder initialized with the entries of this metadata.
	 * @return
	 */
	public Builder toBuilder() {
		var builder = new Builder();
		for (var entry : values.entrySet())
			builder.put(entry.getKey(), entry.getValue());
		return builder;
	}

	/**
	 * Get the image name, if available.
	 * @return the name, or null if no name is set
	 */
	public String getName() {
		var name = values.get(KEY_NAME);
		return name == null ? null : name.toString();
	}

	/**
	 * Get the layer name, if available.
	 * @return the layer, or null if no (recognized) layer name is set
	 */
	public LayerName getLayerName() {
		var name = values.get(KEY_LAYER_NAME);
		return name == null ? null : LayerName.fromDisplayName(name.toString());
	}

	/**
	 * Get the display contrast limits, if available.
	 * @return a copy of the {@code [min, max]} limits, or null if none are set
	 */
	public double[] getContrastLimits() {
		var limits = values.get(KEY_CONTRAST_LIMITS);
		if (limits instanceof double[] array)
			return array.clone();
		return null;
	}

	/**
	 * Get the value for a key.
	 * Arrays are returned as copies.
	 * @param key
	 * @return the value, or null if the key is not present
	 */
	public Object get(String key) {
		return copyValue(values.get(key));
	}

	/**
	 * Get a string representation of the value for a key.
	 * @param key
	 * @return the value as a string, or null if the key is not present
	 */
	public String getString(String key) {
		var val = values.get(key);
		return val == null ? null : val.toString();
	}

	/**
	 * Returns true if the key is present.
	 * @param key
	 * @return
	 */
	public boolean containsKey(String key) {
		return values.containsKey(key);
	}

	/**
	 * Get an unmodifiable view of the keys.
	 * @return
	 */
	public Set<String> keySet() {
		return values.keySet();
	}

	/**
	 * Number of entries.
	 * @return
	 */
	public int size() {
		return values.size();
	}

	/**
	 * Returns true if there are no entries.
	 * @return
	 */
	public boolean isEmpty() {
		return values.isEmpty();
	}

	/**
	 * Create a copy of this metadata with the layer name set.
	 * @param layer
	 * @return
	 */
	public ImageMetadata withLayerName(LayerName layer) {
		return toBuilder().layerName(layer).build();
	}

	private static Object copyValue(Object value) {
		if (value instanceof double[] array)
			return array.clone();
		if (value instanceof int[] array)
			return array.clone();
		if (value instanceof float[] array)
			return array.clone();
		return value;
	}

	@Override
	public String toString() {
		var sb = new StringBuilder("ImageMetadata {");
		boolean first = true;
		for (var entry : values.entrySet()) {
			if (!first)
				sb.append(", ");
			first = false;
			sb.append(entry.getKey()).append("=");
			var val = entry.getValue();
			if (val instanceof double[] array)
				sb.append(Arrays.toString(array));
			else
				sb.append(val);
		}
		return sb.append("}").toString();
	}

	@Override
	public int hashCode() {
		return Objects.hash(values.keySet());
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof ImageMetadata other))
			return false;
		if (!values.keySet().equals(other.values.keySet()))
			return false;
		for (var entry : values.entrySet()) {
			if (!Objects.deepEquals(entry.getValue(), other.values.get(entry.getKey())))
				return false;
		}
		return true;
	}


	/**
	 * Builder for {@link ImageMetadata}.
	 */
	public static class Builder {

		private final Map<String, Object> values = new LinkedHashMap<>();

		private Builder() {}

		/**
		 * Set the image name.
		 * @param name
		 * @return this builder
		 */
		public Builder name(String name) {
			return put(KEY_NAME, name);
		}

		/**
		 * Set the layer name.
		 * @param layer
		 * @return this builder
		 */
		public Builder layerName(LayerName layer) {
			return put(KEY_LAYER_NAME, layer == null ? null : layer.getDisplayName());
		}

		/**
		 * Set the display contrast limits.
		 * @param min
		 * @param max
		 * @return this builder
		 */
		public Builder contrastLimits(double min, double max) {
			return put(KEY_CONTRAST_LIMITS, new double[] {min, max});
		}

		/**
		 * Set an arbitrary value. Arrays are copied; a null value removes the key.
		 * @param key
		 * @param value
		 * @return this builder
		 */
		public Builder put(String key, Object value) {
			Objects.requireNonNull(key, "Metadata key must not be null");
			if (value == null)
				values.remove(key);
			else
				values.put(key, copyValue(value));
			return this;
		}

		/**
		 * Remove a key.
		 * @param key
		 * @return this builder
		 */
		public Builder remove(String key) {
			values.remove(key);
			return this;
		}

		/**
		 * Build the metadata.
		 * @return
		 */
		public ImageMetadata build() {
			return new ImageMetadata(new LinkedHashMap<>(values));
		}

	}

}
