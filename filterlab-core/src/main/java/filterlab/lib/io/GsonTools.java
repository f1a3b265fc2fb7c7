/*-
 * #%L
 * This file is part of FilterLab.
 * %%
 * Copyright (C) 2024 - 2026 FilterLab developers
 * %%
 * FilterLab is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * FilterLab is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with FilterLab.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package filterlab.lib.io;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.Strictness;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

/**
 * Access shared Gson instances, which know how to read and write FilterLab classes (e.g. filters and kernels).
 * <p>
 * Modules register their own adapters with {@link #getDefaultBuilder()} when their classes are initialized.
 */
public class GsonTools {

	private static final Logger logger = LoggerFactory.getLogger(GsonTools.class);

	private static final GsonBuilder builder = new GsonBuilder()
			.serializeSpecialFloatingPointValues()
			.setStrictness(Strictness.LENIENT);

	/**
	 * Get the builder shared by all instances returned by {@link #getInstance()}.
	 * Adapters registered here apply to every Gson instance requested afterwards, throughout the software.
	 *
	 * @return
	 */
	public static synchronized GsonBuilder getDefaultBuilder() {
		logger.trace("Requesting default GsonBuilder");
		return builder;
	}

	/**
	 * Create a factory to read and write implementations of an interface (or subclasses of a class),
	 * identifying each implementation by a label stored in the JSON object.
	 *
	 * @param <T>
	 * @param baseType the type that all registered subtypes extend
	 * @param typeFieldName name of the JSON field used to store the label
	 * @return
	 */
	public static <T> SubTypeAdapterFactory<T> createSubTypeAdapterFactory(Class<T> baseType, String typeFieldName) {
		return new SubTypeAdapterFactory<>(baseType, typeFieldName);
	}


	/**
	 * {@link TypeAdapterFactory} for a class hierarchy.
	 * <p>
	 * When writing, the label of the subtype is written as the first field of the JSON object.
	 * When reading, the label is used to choose the subtype; aliases are also accepted here,
	 * so that alternative names can be used in hand-written JSON.
	 *
	 * @param <T>
	 */
	public static class SubTypeAdapterFactory<T> implements TypeAdapterFactory {

		private final Class<T> baseType;
		private final String typeFieldName;

		// Labels and aliases
		private final Map<String, Class<? extends T>> types = new ConcurrentHashMap<>();
		private final Map<Class<?>, String> labels = new ConcurrentHashMap<>();

		private volatile Consumer<? super T> validator;

		private SubTypeAdapterFactory(Class<T> baseType, String typeFieldName) {
			this.baseType = Objects.requireNonNull(baseType, "Base type must not be null");
			this.typeFieldName = Objects.requireNonNull(typeFieldName, "Type field name must not be null");
		}

		@SuppressWarnings("unchecked")
		@Override
		public <R> TypeAdapter<R> create(Gson gson, TypeToken<R> type) {
			if (type.getRawType() != baseType)
				return null;
			return (TypeAdapter<R>)new LabelledTypeAdapter(gson).nullSafe();
		}

		/**
		 * Register a subtype.
		 *
		 * @param subtype
		 * @param label the label written to JSON for this subtype; must not already be used for another subtype
		 * @return this factory
		 * @throws IllegalArgumentException if the label is already in use
		 */
		public SubTypeAdapterFactory<T> registerSubtype(Class<? extends T> subtype, String label) {
			Objects.requireNonNull(subtype, "Subtype must not be null");
			Objects.requireNonNull(label, "Label must not be null");
			var previous = types.putIfAbsent(label, subtype);
			if (previous != null && previous != subtype)
				throw new IllegalArgumentException("Label " + label + " is already used for " + previous.getName());
			labels.put(subtype, label);
			return this;
		}

		/**
		 * Register an alternative label for a subtype, which is accepted when reading JSON but never written.
		 *
		 * @param subtype a subtype that has already been registered
		 * @param alias
		 * @return this factory
		 * @throws IllegalArgumentException if the subtype has not been registered, or the alias is already in use
		 */
		public SubTypeAdapterFactory<T> registerAlias(Class<? extends T> subtype, String alias) {
			Objects.requireNonNull(alias, "Alias must not be null");
			if (!labels.containsKey(subtype))
				throw new IllegalArgumentException("Cannot register alias " + alias + " for unregistered subtype " + subtype);
			var previous = types.putIfAbsent(alias, subtype);
			if (previous != null && previous != subtype)
				throw new IllegalArgumentException("Alias " + alias + " is already used for " + previous.getName());
			return this;
		}

		/**
		 * Set a check that is applied to every object after it has been read from JSON.
		 * <p>
		 * Objects are created by Gson without calling their constructors, so any validation performed
		 * there needs to be repeated here. An {@link IllegalArgumentException}, {@link IllegalStateException}
		 * or {@link NullPointerException} thrown by the validator is reported as a {@link JsonParseException}.
		 *
		 * @param validator the check, or null to accept all objects
		 * @return this factory
		 */
		public SubTypeAdapterFactory<T> setValidator(Consumer<? super T> validator) {
			this.validator = validator;
			return this;
		}

		/**
		 * Get the label registered for a subtype.
		 * @param subtype
		 * @return the label, or null if the subtype has not been registered
		 */
		public String getLabel(Class<?> subtype) {
			return subtype == null ? null : labels.get(subtype);
		}

		private class LabelledTypeAdapter extends TypeAdapter<T> {

			private final Gson gson;
			private final Map<Class<?>, TypeAdapter<?>> delegates = new ConcurrentHashMap<>();

			private LabelledTypeAdapter(Gson gson) {
				this.gson = gson;
			}

			@SuppressWarnings("unchecked")
			private <S> TypeAdapter<S> getDelegate(Class<S> cls) {
				var delegate = delegates.get(cls);
				if (delegate == null) {
					delegate = gson.getDelegateAdapter(SubTypeAdapterFactory.this, TypeToken.get(cls));
					delegates.put(cls, delegate);
				}
				return (TypeAdapter<S>)delegate;
			}

			@SuppressWarnings("unchecked")
			@Override
			public void write(JsonWriter out, T value) throws IOException {
				var cls = (Class<T>)value.getClass();
				String label = getLabel(cls);
				if (label == null)
					throw new JsonParseException("Cannot write " + cls.getName() + " - no " + typeFieldName + " has been registered");
				JsonElement tree = getDelegate(cls).toJsonTree(value);
				if (!tree.isJsonObject())
					throw new JsonParseException("Cannot write " + cls.getName() + " - expected a JSON object but got " + tree);
				JsonObject fields = tree.getAsJsonObject();
				if (fields.has(typeFieldName))
					throw new JsonParseException("Cannot write " + cls.getName() + " - it already has a field named " + typeFieldName);
				out.beginObject();
				out.name(typeFieldName).value(label);
				for (var entry : fields.entrySet()) {
					out.name(entry.getKey());
					gson.toJson(entry.getValue(), out);
				}
				out.endObject();
			}

			@Override
			public T read(JsonReader in) throws IOException {
				JsonElement element = JsonParser.parseReader(in);
				if (!element.isJsonObject())
					throw new JsonParseException("Cannot read " + baseType.getSimpleName() + " from " + element);
				JsonObject fields = element.getAsJsonObject();
				JsonElement labelElement = fields.remove(typeFieldName);
				if (labelElement == null || !labelElement.isJsonPrimitive())
					throw new JsonParseException("Cannot read " + baseType.getSimpleName() + " - no " + typeFieldName + " found in " + element);
				String label = labelElement.getAsString();
				Class<? extends T> cls = types.get(label);
				if (cls == null)
					throw new JsonParseException("Unknown " + baseType.getSimpleName() + " " + typeFieldName + ": " + label);
				T value = getDelegate(cls).fromJsonTree(fields);
				var check = validator;
				if (check != null && value != null) {
					try {
						check.accept(value);
					} catch (IllegalArgumentException | IllegalStateException | NullPointerException e) {
						throw new JsonParseException("Invalid " + baseType.getSimpleName() + " " + label + ": " + e.getMessage(), e);
					}
				}
				return value;
			}

		}

	}

	/**
	 * Get a Gson instance that can read and write all registered FilterLab classes.
	 * @return
	 * @see #getInstance(boolean)
	 */
	public static synchronized Gson getInstance() {
		return builder.create();
	}

	/**
	 * Get a Gson instance that can read and write all registered FilterLab classes.
	 *
	 * @param pretty if true, use pretty-printing
	 * @return
	 * @see #getInstance()
	 */
	public static synchronized Gson getInstance(boolean pretty) {
		if (!pretty)
			return getInstance();
		return builder.create().newBuilder().setPrettyPrinting().create();
	}

}
