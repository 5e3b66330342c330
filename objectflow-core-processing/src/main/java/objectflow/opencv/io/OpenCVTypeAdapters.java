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

package objectflow.opencv.io;

import java.io.IOException;

import org.bytedeco.opencv.opencv_core.FileNode;
import org.bytedeco.opencv.opencv_core.FileStorage;
import org.bytedeco.opencv.opencv_ml.DTrees;
import org.bytedeco.opencv.opencv_ml.RTrees;
import org.bytedeco.opencv.opencv_ml.StatModel;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;


/**
 * Helper classes for combining OpenCV's JSON serialization with Gson's.
 * <p>
 * Sample use:
 * <pre>
 * Gson gson = new GsonBuilder()
 * 				.registerTypeAdapterFactory(OpenCVTypeAdapters.getOpenCVTypeAdaptorFactory())
 * 				.create();
 * 
 * String json = gson.toJson(trees, StatModel.class);
 * StatModel model = gson.fromJson(json, StatModel.class);
 * </pre>
 */
public class OpenCVTypeAdapters {
	
	/**
	 * Get a TypeAdapterFactory to pass to a GsonBuilder to aid with serializing OpenCV stat models.
	 * 
	 * @return
	 */
	public static TypeAdapterFactory getOpenCVTypeAdaptorFactory() {
		return new OpenCVTypeAdaptorFactory();
	}
	
	/**
	 * Get a TypeAdapter for a specific supported OpenCV class.
	 * 
	 * @param cls
	 * @return the required TypeAdaptor, or null if no supported adapter is available for the class.
	 */
	@SuppressWarnings("unchecked")
	public static <T> TypeAdapter<T> getTypeAdaptor(Class<T> cls) {
		if (StatModel.class.isAssignableFrom(cls))
			return (TypeAdapter<T>)new StatModelTypeAdapter();
		return null;
	}
	
	
	/**
	 * TypeAdapterFactory that helps make OpenCV's serialization methods compatible with Gson.
	 */
	public static class OpenCVTypeAdaptorFactory implements TypeAdapterFactory {

		@SuppressWarnings("unchecked")
		@Override
		public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
			return getTypeAdaptor((Class<T>)type.getRawType());
		}
		
	}
	
	
	private static class StatModelTypeAdapter extends TypeAdapter<StatModel> {
		
		private final Gson gson = new GsonBuilder().setLenient().create();

		@Override
		public void write(JsonWriter out, StatModel value) throws IOException {
			if (value == null) {
				out.nullValue();
				return;
			}
			try (FileStorage fs = new FileStorage()) {
				fs.open("anything.json", FileStorage.FORMAT_JSON + FileStorage.WRITE + FileStorage.MEMORY);
				value.write(fs, value.getDefaultName());
				String json = fs.releaseAndGetString().getString();
				
				out.beginObject();
				out.name("class");
				out.value(value.getClass().getSimpleName());
				out.name("statmodel");
				
				// jsonValue is not supported by JsonTreeWriter, so go through a JsonObject
				JsonObject element = gson.fromJson(json.trim(), JsonObject.class);
				gson.toJson(element, out);
				out.endObject();
			}
		}

		@Override
		public StatModel read(JsonReader in) throws IOException {
			boolean lenient = in.isLenient();
			try {
				JsonElement element = JsonParser.parseReader(in);
				if (element.isJsonNull())
					return null;
				JsonObject obj = element.getAsJsonObject();
				String className = obj.get("class").getAsString();
				
				// toString() can give lines too long for OpenCV to parse
				String modelString = new GsonBuilder().setPrettyPrinting().create().toJson(obj.get("statmodel"));
				
				StatModel model;
				if (RTrees.class.getSimpleName().equals(className))
					model = RTrees.create();
				else if (DTrees.class.getSimpleName().equals(className))
					model = DTrees.create();
				else
					throw new IOException("Unknown StatModel class name " + className);
				
				try (FileStorage fs = new FileStorage()) {
					fs.open(modelString, FileStorage.FORMAT_JSON + FileStorage.READ + FileStorage.MEMORY);
					FileNode fn = fs.getFirstTopLevelNode();
					model.read(fn);
					return model;
				}
			} finally {
				in.setLenient(lenient);
			}
		}
		
	}

}
