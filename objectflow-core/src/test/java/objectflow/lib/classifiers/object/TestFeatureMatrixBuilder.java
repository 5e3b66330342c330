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

package objectflow.lib.classifiers.object;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.junit.jupiter.api.Test;

import objectflow.lib.measurements.FeatureColumn;
import objectflow.lib.measurements.FeatureSelection;
import objectflow.lib.measurements.FeatureSet;
import objectflow.lib.measurements.FloatMatrix;
import objectflow.lib.objects.LabelArray;
import objectflow.lib.objects.TimeObject;

@SuppressWarnings("javadoc")
public class TestFeatureMatrixBuilder {
	
	private static FeatureSelection selection = FeatureSelection.of(Map.of(
			"Shape", List.of("Area"),
			"Intensity", List.of("Mean")));
	
	private static FeatureSet createFeatures(float... area) {
		int n = area.length;
		float[][] mean = new float[n][];
		for (int i = 0; i < n; i++)
			mean[i] = new float[] {i * 100, i * 1000};
		return FeatureSet.builder()
				.add("Shape", "Area", area)
				.add("Shape", "Perimeter", new float[n])
				.add("Intensity", "Mean", FloatMatrix.fromRows(mean))
				.boundingBoxes(FloatMatrix.zeros(n, 2), FloatMatrix.zeros(n, 2))
				.build();
	}
	
	@Test
	public void test_columnOrder() {
		var matrix = FeatureMatrixBuilder.build(Map.of(0, createFeatures(0, 1, 2, 3)), selection);
		assertEquals(List.of(
				new FeatureColumn("Intensity", "Mean", 0),
				new FeatureColumn("Intensity", "Mean", 1),
				new FeatureColumn("Shape", "Area", 0)),
				matrix.getColumns());
		assertArrayEquals(new float[] {200, 2000, 2}, matrix.getData().getRow(2));
		assertFalse(matrix.hasLabels());
		assertNull(matrix.getLabels());
	}
	
	@Test
	public void test_unlabeledIncludesAllRows() {
		var matrix = FeatureMatrixBuilder.build(Map.of(1, createFeatures(0, 1, 2), 0, createFeatures(5, 6)), selection);
		assertEquals(5, matrix.nRows());
		assertEquals(List.of(
				TimeObject.of(0, 0), TimeObject.of(0, 1), 
				TimeObject.of(1, 0), TimeObject.of(1, 1), TimeObject.of(1, 2)), 
				matrix.getRowIds());
		assertEquals(5f, matrix.getData().get(0, 2));
	}
	
	@Test
	public void test_labeledRowsOnly() {
		var features = Map.of(0, createFeatures(0, 1, 2, 3), 1, createFeatures(0, 10, 20));
		var labels = Map.of(0, LabelArray.of(0, 2, 0, 1));
		var matrix = FeatureMatrixBuilder.build(features, selection, labels);
		assertTrue(matrix.hasLabels());
		assertEquals(List.of(TimeObject.of(0, 1), TimeObject.of(0, 3)), matrix.getRowIds());
		assertArrayEquals(new int[] {2, 1}, matrix.getLabels());
		assertEquals(matrix.nRows(), matrix.getLabels().length);
		assertArrayEquals(new float[] {1, 3}, matrix.getData().getColumn(2));
	}
	
	@Test
	public void test_labelsBeyondFeaturesSkipped() {
		var labels = Map.of(0, LabelArray.of(0, 1, 0, 0, 0, 2));
		var matrix = FeatureMatrixBuilder.build(Map.of(0, createFeatures(0, 1, 2, 3)), selection, labels);
		assertEquals(List.of(TimeObject.of(0, 1)), matrix.getRowIds());
		assertArrayEquals(new int[] {1}, matrix.getLabels());
	}
	
	@Test
	public void test_nonFiniteValuesReplaced() {
		var matrix = FeatureMatrixBuilder.build(Map.of(0, createFeatures(0, 1, Float.NaN, Float.POSITIVE_INFINITY)), selection);
		assertEquals(Set.of(2, 3), matrix.getBadRows());
		assertEquals(Set.of(2), matrix.getBadColumns());
		assertEquals(Set.of("Shape: Area"), matrix.getBadFeatureNames());
		assertEquals(List.of(TimeObject.of(0, 2), TimeObject.of(0, 3)), matrix.getBadObjects());
		assertEquals(FeatureMatrix.MISSING_VALUE, matrix.getData().get(2, 2));
		assertEquals(FeatureMatrix.MISSING_VALUE, matrix.getData().get(3, 2));
		for (float v : matrix.getData().getData())
			assertTrue(Float.isFinite(v));
	}
	
	@Test
	public void test_defaultFeaturesExcluded() {
		var selected = FeatureSelection.of(FeatureSet.DEFAULT_FEATURES_KEY, FeatureSet.COORD_MINIMUM, FeatureSet.COORD_MAXIMUM);
		var matrix = FeatureMatrixBuilder.build(Map.of(0, createFeatures(0, 1)), selected);
		assertTrue(matrix.getColumns().isEmpty());
	}
	
	@Test
	public void test_columnMismatch() {
		var selected = FeatureSelection.of("Shape", "Area", "Perimeter");
		var other = FeatureSet.builder().add("Shape", "Area", 0, 1).build();
		assertThrows(ConfigurationException.class, 
				() -> FeatureMatrixBuilder.build(Map.of(0, createFeatures(0, 1), 1, other), selected));
	}
	
	@Test
	public void test_objectCountMismatch() {
		var features = FeatureSet.builder()
				.add("Shape", "Area", 0, 1, 2)
				.add("Intensity", "Mean", FloatMatrix.zeros(2, 2))
				.build();
		assertThrows(ConfigurationException.class, 
				() -> FeatureMatrixBuilder.build(Map.of(0, features), selection));
	}
	
	@Test
	public void test_replaceMissing() {
		var mat = FloatMatrix.fromRows(new float[] {1, Float.NaN}, new float[] {Float.NEGATIVE_INFINITY, 2});
		var rows = new TreeSet<Integer>();
		var cols = new TreeSet<Integer>();
		assertTrue(FeatureMatrixBuilder.replaceMissing(mat, rows, cols));
		assertArrayEquals(new float[] {1, 0, 0, 2}, mat.getData());
		assertEquals(Arrays.asList(0, 1), List.copyOf(rows));
		assertEquals(Arrays.asList(0, 1), List.copyOf(cols));
		assertFalse(FeatureMatrixBuilder.replaceMissing(mat, rows, cols));
	}

}
