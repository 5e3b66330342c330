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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.google.gson.JsonParseException;

import objectflow.lib.measurements.FeatureSelection;
import objectflow.lib.measurements.FloatMatrix;
import objectflow.lib.objects.LabelArray;

@SuppressWarnings("javadoc")
public class TestGsonTools {
	
	static interface Shape {
		double area();
	}
	
	static class Square implements Shape {
		
		private double side;
		
		Square(double side) {
			this.side = side;
		}

		@Override
		public double area() {
			return side * side;
		}
		
	}
	
	static class Circle implements Shape {
		
		private double radius;
		
		Circle(double radius) {
			this.radius = radius;
		}

		@Override
		public double area() {
			return Math.PI * radius * radius;
		}
		
	}
	
	static class ShapeHolder {
		
		private List<Shape> shapes;
		
	}
	
	@Test
	public void test_labelArray() {
		var gson = GsonTools.getInstance();
		var labels = LabelArray.of(0, 2, 0, 1);
		var json = gson.toJson(labels);
		assertEquals("[0,2,0,1]", json);
		assertArrayEquals(labels.toArray(), gson.fromJson(json, LabelArray.class).toArray());
	}
	
	@Test
	public void test_floatMatrix() {
		var gson = GsonTools.getInstance();
		var matrix = FloatMatrix.fromRows(new float[] {1, 2.5f}, new float[] {Float.NaN, -3});
		var json = gson.toJson(matrix);
		var read = gson.fromJson(json, FloatMatrix.class);
		assertEquals(2, read.nRows());
		assertEquals(2, read.nCols());
		assertArrayEquals(matrix.getData(), read.getData());
		
		var quoted = gson.fromJson("{\"rows\": 1, \"cols\": 2, \"data\": [\"Infinity\", 4], \"extra\": true}", FloatMatrix.class);
		assertEquals(Float.POSITIVE_INFINITY, quoted.get(0, 0));
		assertEquals(4f, quoted.get(0, 1));
		
		assertThrows(JsonParseException.class, () -> gson.fromJson("{\"rows\": 2, \"cols\": 2, \"data\": [1]}", FloatMatrix.class));
		assertThrows(JsonParseException.class, () -> gson.fromJson("{\"rows\": 2, \"data\": [1, 2]}", FloatMatrix.class));
	}
	
	@Test
	public void test_featureSelection() {
		var gson = GsonTools.getInstance();
		var selection = FeatureSelection.of(Map.of("Intensity", List.of("Mean", "Max"), "Shape", List.of("Area")));
		var read = gson.fromJson(gson.toJson(selection), FeatureSelection.class);
		assertEquals(selection, read);
		assertTrue(gson.fromJson("{}", FeatureSelection.class).isEmpty());
	}
	
	@Test
	public void test_subtypes() {
		var factory = GsonTools.createSubTypeAdapterFactory(Shape.class, "shape_type")
				.registerSubtype(Square.class)
				.registerSubtype(Circle.class, "circle");
		var gson = GsonTools.getInstance().newBuilder()
				.registerTypeAdapterFactory(factory)
				.create();
		
		var holder = new ShapeHolder();
		holder.shapes = List.of(new Square(2), new Circle(1));
		var json = gson.toJson(holder);
		assertTrue(json.contains("\"shape_type\":\"Square\""));
		assertTrue(json.contains("\"shape_type\":\"circle\""));
		
		var read = gson.fromJson(json, ShapeHolder.class);
		assertEquals(2, read.shapes.size());
		assertEquals(4.0, read.shapes.get(0).area(), 1e-9);
		assertEquals(Math.PI, read.shapes.get(1).area(), 1e-9);
		
		assertThrows(IllegalArgumentException.class, () -> factory.registerSubtype(Square.class, "circle"));
		assertThrows(JsonParseException.class, () -> gson.fromJson("{\"shapes\": [{\"side\": 1}]}", ShapeHolder.class));
		assertThrows(JsonParseException.class, () -> gson.fromJson("{\"shapes\": [{\"shape_type\": \"Triangle\"}]}", ShapeHolder.class));
	}

}
