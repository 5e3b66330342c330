/*-
 * #%L
 * This file is part of ObjectFlow.
 * %%
 * Copyright (C) 2026 ObjectFlow developers
 * %%
 * ObjectFlow is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * ObjectFlow is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with ObjectFlow.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package objectflow.lib.io;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
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
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import objectflow.lib.measurements.FeatureSelection;
import objectflow.lib.measurements.FloatMatrix;
import objectflow.lib.objects.LabelArray;

/**
 * Access to a default Gson instance that can handle the core ObjectFlow types.
 * <p>
 * Special floating point values (NaN, infinity) are supported, since these may occur 
 * in features and out-of-bag errors.
 */
public class GsonTools {
	
	private static final Logger logger = LoggerFactory.getLogger(GsonTools.class);
	
	private static GsonBuilder builder = new GsonBuilder()
			.serializeSpecialFloatingPointValues()
			.setLenient()
			.registerTypeAdapterFactory(new ObjectFlowTypeAdapterFactory());
	
	/**
	 * Get the default GsonBuilder. Any changes will affect all subsequent calls to {@link #getInstance()}.
	 * @return
	 */
	public static GsonBuilder getDefaultBuilder() {
		logger.trace("Requesting GsonBuilder from {}", Thread.currentThread().getStackTrace()[0]);
		return builder;
	}
	
	/**
	 * Get a Gson instance built from the default builder.
	 * @return
	 */
	public static Gson getInstance() {
		return builder.create();
	}
	
	/**
	 * Get a Gson instance built from the default builder, optionally with pretty printing.
	 * @param pretty
	 * @return
	 */
	public static Gson getInstance(boolean pretty) {
		if (pretty)
			return getInstance().newBuilder().setPrettyPrinting().create();
		return getInstance();
	}
	
	
	static class ObjectFlowTypeAdapterFactory implements TypeAdapterFactory {

		@Override
		public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
			return getTypeAdaptor(type.getRawType());
		}
		
		@SuppressWarnings("unchecked")
		static <T> TypeAdapter<T> getTypeAdaptor(Class<? super T> cls) {
			if (LabelArray.class == cls)
				return (TypeAdapter<T>)LabelArrayTypeAdapter.INSTANCE.nullSafe();
			if (FloatMatrix.class == cls)
				return (TypeAdapter<T>)FloatMatrixTypeAdapter.INSTANCE.nullSafe();
			if (FeatureSelection.class == cls)
				return (TypeAdapter<T>)FeatureSelectionTypeAdapter.INSTANCE.nullSafe();
			return null;
		}
		
	}
	
	
	/**
	 * Labels are written as a plain array of integers.
	 */
	static class LabelArrayTypeAdapter extends TypeAdapter<LabelArray> {
		
		static final LabelArrayTypeAdapter INSTANCE = new LabelArrayTypeAdapter();

		@Override
		public void write(JsonWriter out, LabelArray value) throws IOException {
			out.beginArray();
			for (int v : value.toArray())
				out.value(v);
			out.endArray();
		}

		@Override
		public LabelArray read(JsonReader in) throws IOException {
			List<Integer> values = new ArrayList<>();
			in.beginArray();
			while (in.hasNext())
				values.add(in.nextInt());
			in.endArray();
			return LabelArray.of(values.stream().mapToInt(Integer::intValue).toArray());
		}
		
	}
	
	
	static class FloatMatrixTypeAdapter extends TypeAdapter<FloatMatrix> {
		
		static final FloatMatrixTypeAdapter INSTANCE = new FloatMatrixTypeAdapter();

		@Override
		public void write(JsonWriter out, FloatMatrix value) throws IOException {
			out.beginObject();
			out.name("rows").value(value.nRows());
			out.name("cols").value(value.nCols());
			out.name("data");
			out.beginArray();
			for (float v : value.getData())
				out.value(v);
			out.endArray();
			out.endObject();
		}

		@Override
		public FloatMatrix read(JsonReader in) throws IOException {
			int rows = -1;
			int cols = -1;
			float[] data = null;
			in.beginObject();
			while (in.hasNext()) {
				String name = in.nextName();
				switch (name) {
				case "rows":
					rows = in.nextInt();
					break;
				case "cols":
					cols = in.nextInt();
					break;
				case "data":
					data = readFloats(in);
					break;
				default:
					logger.debug("Skipping unknown matrix field {}", name);
					in.skipValue();
				}
			}
			in.endObject();
			if (rows < 0 || cols < 0 || data == null)
				throw new JsonParseException("Matrix requires 'rows', 'cols' and 'data'");
			if (data.length != rows * cols)
				throw new JsonParseException("Matrix data has length " + data.length + ", expected " + rows + "x" + cols);
			return FloatMatrix.wrap(rows, cols, data);
		}
		
		private static float[] readFloats(JsonReader in) throws IOException {
			List<Float> values = new ArrayList<>();
			in.beginArray();
			while (in.hasNext()) {
				// Special values are written as unquoted literals, but may appear as strings
				if (in.peek() == JsonToken.STRING)
					values.add(Float.parseFloat(in.nextString()));
				else
					values.add((float)in.nextDouble());
			}
			in.endArray();
			float[] data = new float[values.size()];
			for (int i = 0; i < data.length; i++)
				data[i] = values.get(i);
			return data;
		}
		
	}
	
	
	/**
	 * Selections are written as an object mapping plugin names to arrays of feature names.
	 */
	static class FeatureSelectionTypeAdapter extends TypeAdapter<FeatureSelection> {
		
		static final FeatureSelectionTypeAdapter INSTANCE = new FeatureSelectionTypeAdapter();

		@Override
		public void write(JsonWriter out, FeatureSelection value) throws IOException {
			out.beginObject();
			for (var entry : value.asMap().entrySet()) {
				out.name(entry.getKey());
				out.beginArray();
				for (var feature : entry.getValue())
					out.value(feature);
				out.endArray();
			}
			out.endObject();
		}

		@Override
		public FeatureSelection read(JsonReader in) throws IOException {
			Map<String, List<String>> map = new LinkedHashMap<>();
			in.beginObject();
			while (in.hasNext()) {
				String plugin = in.nextName();
				List<String> features = new ArrayList<>();
				in.beginArray();
				while (in.hasNext())
					features.add(in.nextString());
				in.endArray();
				map.put(plugin, features);
			}
			in.endObject();
			return FeatureSelection.of(map);
		}
		
	}
	
	
	/**
	 * Create a {@link SubTypeAdapterFactory} to support serializing implementations of an interface, 
	 * storing the implementation type in a named field.
	 * @param <T>
	 * @param baseType
	 * @param typeFieldName
	 * @return
	 */
	public static <T> SubTypeAdapterFactory<T> createSubTypeAdapterFactory(Class<T> baseType, String typeFieldName) {
		return new SubTypeAdapterFactory<>(baseType, typeFieldName);
	}
	
	/**
	 * TypeAdapterFactory that writes the concrete type of an object alongside its fields, 
	 * so that the correct type can be created when reading.
	 *
	 * @param <T>
	 */
	public static class SubTypeAdapterFactory<T> implements TypeAdapterFactory {
		
		private final Class<?> baseType;
		private final String typeFieldName;
		private final Map<String, Class<?>> labelToSubtype = new LinkedHashMap<>();
		private final Map<Class<?>, String> subtypeToLabel = new LinkedHashMap<>();
		
		private SubTypeAdapterFactory(Class<T> baseType, String typeFieldName) {
			Objects.requireNonNull(baseType, "baseType must not be null!");
			Objects.requireNonNull(typeFieldName, "typeFieldName must not be null!");
			this.typeFieldName = typeFieldName;
			this.baseType = baseType;
		}
		
		@SuppressWarnings("unchecked")
		@Override
		public synchronized <R> TypeAdapter<R> create(Gson gson, TypeToken<R> type) {
			if (!Objects.equals(type.getRawType(), baseType))
				return null;
			return (TypeAdapter<R>)new SubTypeAdapter(gson).nullSafe();
		}
		
		/**
		 * Register a subtype, using its simple name as the label.
		 * @param subtype
		 * @return this factory
		 */
		public synchronized SubTypeAdapterFactory<T> registerSubtype(Class<? extends T> subtype) {
			return registerSubtype(subtype, subtype.getSimpleName());
		}
		
		/**
		 * Register a subtype with a specific label.
		 * @param subtype
		 * @param label
		 * @return this factory
		 */
		public synchronized SubTypeAdapterFactory<T> registerSubtype(Class<? extends T> subtype, String label) {
			Objects.requireNonNull(subtype, "subtype must not be null!");
			Objects.requireNonNull(label, "label must not be null!");
			if (labelToSubtype.containsKey(label))
				throw new IllegalArgumentException("Label " + label + " is already assigned!");
			labelToSubtype.put(label, subtype);
			subtypeToLabel.put(subtype, label);
			return this;
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
				for (Map.Entry<String, JsonElement> entry : jsonObject.entrySet())
					clone.add(entry.getKey(), entry.getValue());
				logger.trace("Writing {} for {}", label, value);
				gson.toJson(clone, out);
			}

			@SuppressWarnings("unchecked")
			@Override
			public T read(JsonReader in) throws IOException {
				JsonElement jsonElement = gson.fromJson(in, JsonElement.class);
				JsonElement labelElement = jsonElement.getAsJsonObject().remove(typeFieldName);
				if (labelElement == null)
					throw new JsonParseException("Cannot deserialize " + baseType + " because there is no field named " + typeFieldName);
				String label = labelElement.getAsString();
				TypeAdapter<T> delegate = (TypeAdapter<T>)subtypeToDelegate.get(labelToSubtype.get(label));
				if (delegate == null)
					throw new JsonParseException("Cannot deserialize " + baseType + " subtype named " + label);
				logger.trace("Reading {} for {}", label, baseType);
				return delegate.fromJsonTree(jsonElement);
			}
			
		}
		
	}

}
