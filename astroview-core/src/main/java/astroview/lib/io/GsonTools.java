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

package astroview.lib.io;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import astroview.lib.modules.OperationRequests;

/**
 * Helper class providing Gson instances with type adapters registered to serialize
 * key AstroView classes - in particular, {@link astroview.lib.modules.OperationRequest OperationRequests}.
 */
public class GsonTools {

	private static final Logger logger = LoggerFactory.getLogger(GsonTools.class);

	private static final GsonBuilder builder = new GsonBuilder()
			.serializeSpecialFloatingPointValues()
			.setLenient()
			.registerTypeAdapterFactory(OperationRequests.getTypeAdapterFactory());

	/**
	 * A {@link TypeAdapterFactory} that is suitable for handling class hierarchies.
	 * This can be used to construct the appropriate subtype when parsing the JSON.
	 * <p>
	 * Subtypes are identified by a label stored in a named field of the JSON object.
	 * Alias labels may also be registered; these are accepted when reading, but never written.
	 *
	 * @param <T>
	 */
	public static class SubTypeAdapterFactory<T> implements TypeAdapterFactory {

		private static final Logger logger = LoggerFactory.getLogger(SubTypeAdapterFactory.class);

		private final Class<?> baseType;
		private final String typeFieldName;
		private final Map<String, Class<?>> labelToSubtype = new LinkedHashMap<>();
		private final Map<Class<?>, String> subtypeToLabel = new LinkedHashMap<>();
		private final Map<String, Class<?>> aliasToSubtype = new LinkedHashMap<>();

		private SubTypeAdapterFactory(Class<T> baseType, String typeFieldName) {
			Objects.requireNonNull(baseType, "baseType must not be null!");
			Objects.requireNonNull(typeFieldName, "typeFieldName must not be null!");
			this.typeFieldName = typeFieldName;
			this.baseType = baseType;
		}

		/**
		 * Create a factory for a class hierarchy.
		 * This can be used to construct the appropriate subtype when parsing the JSON by using a specific field in the JSON representation.
		 *
		 * @param <T>
		 * @param baseType the base type, i.e. the class or interface that all types descend from
		 * @param typeFieldName a field name to include within the serialized JSON object to identify the specific type
		 * @return
		 */
		public static <T> SubTypeAdapterFactory<T> create(Class<T> baseType, String typeFieldName) {
			return new SubTypeAdapterFactory<>(baseType, typeFieldName);
		}

		@SuppressWarnings("unchecked")
		@Override
		public synchronized <R> TypeAdapter<R> create(Gson gson, TypeToken<R> type) {
			if (!Objects.equals(type.getRawType(), baseType)) {
				return null;
			}
			return (TypeAdapter<R>)new SubTypeAdapter(gson).nullSafe();
		}

		/**
		 * Get the subtype associated with a label or alias.
		 * @param label
		 * @return the subtype, or null if the label is unknown
		 */
		public synchronized Class<?> getSubtype(String label) {
			var subtype = labelToSubtype.get(label);
			return subtype == null ? aliasToSubtype.get(label) : subtype;
		}

		private class SubTypeAdapter extends TypeAdapter<T> {

			private final Gson gson;
			private final Map<Class<?>, TypeAdapter<?>> subtypeToDelegate = new LinkedHashMap<>();

			private SubTypeAdapter(final Gson gson) {
				this.gson = gson;
				for (Map.Entry<String, Class<?>> entry : labelToSubtype.entrySet()) {
					TypeAdapter<?> delegate = gson.getDelegateAdapter(SubTypeAdapterFactory.this, TypeToken.get(entry.getValue()));
					subtypeToDelegate.put(entry.getValue(), delegate);
				}
			}

			@SuppressWarnings("unchecked")
			@Override
			public void write(JsonWriter out, T value) throws IOException {
				Class<?> srcType = value.getClass();
				String label = subtypeToLabel.get(srcType);
				TypeAdapter<T> delegate = (TypeAdapter<T>)subtypeToDelegate.get(srcType);
				if (delegate == null)
					throw new JsonParseException("Cannot serialize " + baseType + " subtype named " + srcType.getName() +
							"; did you forget to register a subtype?");
				JsonObject jsonObject = delegate.toJsonTree(value).getAsJsonObject();
				if (jsonObject.has(typeFieldName))
					throw new JsonParseException("Cannot serialize " + srcType.getName() +
							" because it already defines a field named " + typeFieldName);
				JsonObject clone = new JsonObject();
				clone.add(typeFieldName, new JsonPrimitive(label));
				for (Map.Entry<String, JsonElement> entry : jsonObject.entrySet()) {
					clone.add(entry.getKey(), entry.getValue());
				}
				logger.trace("Writing {} for {} ", label, value);
				gson.toJson(clone, out);
			}

			@SuppressWarnings("unchecked")
			@Override
			public T read(JsonReader in) throws IOException {
				JsonElement jsonElement = gson.fromJson(in, JsonElement.class);
				if (jsonElement == null || !jsonElement.isJsonObject())
					throw new JsonParseException("Cannot deserialize " + baseType + " from " + jsonElement);
				JsonElement labelElement = jsonElement.getAsJsonObject().remove(typeFieldName);
				if (labelElement == null)
					throw new JsonParseException("Cannot deserialize " + baseType + " because there is no field named " + typeFieldName);
				String label = labelElement.getAsString();
				Class<?> subtype = getSubtype(label);
				TypeAdapter<T> delegate = (TypeAdapter<T>)subtypeToDelegate.get(subtype);
				if (delegate == null)
					throw new JsonParseException("Cannot deserialize " + baseType + " subtype named " + label);
				logger.trace("Reading {} for {} ", label, baseType);
				return delegate.fromJsonTree(jsonElement);
			}

		}

		/**
		 * Register a subtype using a custom label.
		 *
		 * @param subtype the subtype to register
		 * @param label the label used to identify objects of this subtype; this must be unique
		 * @return this {@link SubTypeAdapterFactory}
		 */
		public synchronized SubTypeAdapterFactory<T> registerSubtype(Class<? extends T> subtype, String label) {
			Objects.requireNonNull(subtype, "subtype must not be null!");
			Objects.requireNonNull(label, "label must not be null!");
			if (labelToSubtype.containsKey(label))
				throw new IllegalArgumentException("Label " + label + " is already assigned! Did you want to register an alias instead?");
			labelToSubtype.put(label, subtype);
			subtypeToLabel.put(subtype, label);
			return this;
		}

		/**
		 * Register an alias label for a specified subtype.
		 * This is accepted during deserialization, but will not be used for serializing new objects.
		 *
		 * @param subtype the subtype to register
		 * @param alias the alias used as an alternative label to identify objects of this subtype
		 * @return this {@link SubTypeAdapterFactory}
		 */
		public synchronized SubTypeAdapterFactory<T> registerAlias(Class<? extends T> subtype, String alias) {
			Objects.requireNonNull(subtype, "subtype must not be null!");
			Objects.requireNonNull(alias, "alias must not be null!");
			if (aliasToSubtype.containsKey(alias)) {
				if (Objects.equals(aliasToSubtype.get(alias), subtype))
					return this;
				logger.warn("Alias {} is already assigned to subtype {}, request will be ignored", alias, aliasToSubtype.get(alias));
				return this;
			}
			aliasToSubtype.put(alias, subtype);
			return this;
		}

	}

	/**
	 * Get default Gson, capable of serializing/deserializing key AstroView classes.
	 * @return
	 */
	public static Gson getInstance() {
		return builder.create();
	}

}
