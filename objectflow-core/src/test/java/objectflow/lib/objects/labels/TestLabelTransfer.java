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

package objectflow.lib.objects.labels;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import objectflow.lib.measurements.FloatMatrix;
import objectflow.lib.objects.LabelArray;
import objectflow.lib.objects.ObjectBoundingBoxes;

@SuppressWarnings("javadoc")
public class TestLabelTransfer {
	
	/**
	 * Create 2D boxes from {minX, minY, maxX, maxY} for each object; the background row is added automatically.
	 */
	private static ObjectBoundingBoxes boxes(float[]... bounds) {
		var min = FloatMatrix.zeros(bounds.length + 1, 2);
		var max = FloatMatrix.zeros(bounds.length + 1, 2);
		for (int i = 0; i < bounds.length; i++) {
			min.set(i + 1, 0, bounds[i][0]);
			min.set(i + 1, 1, bounds[i][1]);
			max.set(i + 1, 0, bounds[i][2]);
			max.set(i + 1, 1, bounds[i][3]);
		}
		return ObjectBoundingBoxes.create(min, max);
	}
	
	private static float[] box(float minX, float minY, float maxX, float maxY) {
		return new float[] {minX, minY, maxX, maxY};
	}
	
	@Test
	public void test_identicalSegmentation() {
		var b = boxes(box(0, 0, 4, 4), box(10, 10, 14, 14), box(20, 20, 24, 24));
		var labels = LabelArray.of(0, 1, 2, 0);
		var result = LabelTransfer.transfer(labels, b, b);
		assertArrayEquals(new int[] {0, 1, 2, 0}, result.getNewLabels().toArray());
		assertFalse(result.hasLosses());
		assertTrue(result.getOldLabelsLost().get(LabelTransferResult.LOST_FULL).isEmpty());
		assertTrue(result.getOldLabelsLost().get(LabelTransferResult.LOST_PARTIAL).isEmpty());
		assertTrue(result.getNewLabelsLost().get(LabelTransferResult.LOST_CONFLICT).isEmpty());
	}
	
	@Test
	public void test_reorderedObjects() {
		var oldBoxes = boxes(box(0, 0, 4, 4), box(10, 10, 14, 14));
		var newBoxes = boxes(box(11, 11, 15, 15), box(20, 20, 30, 30), box(1, 0, 5, 4));
		var result = LabelTransfer.transfer(LabelArray.of(0, 1, 2), oldBoxes, newBoxes);
		assertArrayEquals(new int[] {0, 2, 0, 1}, result.getNewLabels().toArray());
		assertFalse(result.hasLosses());
	}
	
	@Test
	public void test_fullLoss() {
		var oldBoxes = boxes(box(0, 0, 4, 4), box(10, 10, 14, 14));
		var newBoxes = boxes(box(30, 30, 34, 34));
		var result = LabelTransfer.transfer(LabelArray.of(0, 1, 0), oldBoxes, newBoxes);
		assertArrayEquals(new int[] {0, 0}, result.getNewLabels().toArray());
		assertTrue(result.hasLosses());
		var full = result.getOldLabelsLost().get(LabelTransferResult.LOST_FULL);
		assertEquals(1, full.size());
		assertArrayEquals(new double[] {2, 2, 0}, full.get(0), 1e-9);
	}
	
	@Test
	public void test_partialLossFirstMaximumWins() {
		var oldBoxes = boxes(box(0, 0, 10, 4));
		// Both new objects overlap the old object equally
		var newBoxes = boxes(box(0, 0, 4, 4), box(6, 0, 10, 4));
		var result = LabelTransfer.transfer(LabelArray.of(0, 3), oldBoxes, newBoxes);
		assertArrayEquals(new int[] {0, 3, 0}, result.getNewLabels().toArray());
		var partial = result.getOldLabelsLost().get(LabelTransferResult.LOST_PARTIAL);
		assertEquals(1, partial.size());
		assertArrayEquals(new double[] {5, 2, 0}, partial.get(0), 1e-9);
		assertTrue(result.getOldLabelsLost().get(LabelTransferResult.LOST_FULL).isEmpty());
	}
	
	@Test
	public void test_conflict() {
		var oldBoxes = boxes(box(0, 0, 4, 4), box(6, 0, 10, 4));
		var newBoxes = boxes(box(0, 0, 10, 4));
		var result = LabelTransfer.transfer(LabelArray.of(0, 1, 2), oldBoxes, newBoxes);
		assertArrayEquals(new int[] {0, 0}, result.getNewLabels().toArray());
		var conflict = result.getNewLabelsLost().get(LabelTransferResult.LOST_CONFLICT);
		assertEquals(1, conflict.size());
		assertArrayEquals(new double[] {5, 2, 0}, conflict.get(0), 1e-9);
	}
	
	@Test
	public void test_labeledObjectWithoutBox() {
		var b = boxes(box(0, 0, 4, 4));
		var result = LabelTransfer.transfer(LabelArray.of(0, 1, 0, 0, 2), b, b);
		assertArrayEquals(new int[] {0, 1}, result.getNewLabels().toArray());
		assertTrue(result.hasLosses());
		var full = result.getOldLabelsLost().get(LabelTransferResult.LOST_FULL);
		assertEquals(1, full.size());
		assertTrue(Double.isNaN(full.get(0)[0]));
	}
	
	@Test
	public void test_thinObjects() {
		// A single pixel and a vertical line, both with inclusive maxima
		var b = boxes(box(5, 5, 5, 5), box(10, 0, 10, 9));
		var result = LabelTransfer.transfer(LabelArray.of(0, 1, 2), b, b);
		assertArrayEquals(new int[] {0, 1, 2}, result.getNewLabels().toArray());
		assertFalse(result.hasLosses());
		
		// Adjacent pixels do not overlap
		var shifted = boxes(box(6, 5, 6, 5), box(11, 0, 11, 9));
		result = LabelTransfer.transfer(LabelArray.of(0, 1, 2), b, shifted);
		assertArrayEquals(new int[] {0, 0, 0}, result.getNewLabels().toArray());
		assertEquals(2, result.getOldLabelsLost().get(LabelTransferResult.LOST_FULL).size());
		
		var moved = boxes(box(10, 3, 10, 4), box(5, 5, 5, 5));
		result = LabelTransfer.transfer(LabelArray.of(0, 1, 2), b, moved);
		assertArrayEquals(new int[] {0, 2, 1}, result.getNewLabels().toArray());
	}
	
	@Test
	public void test_dimensionMismatch() {
		var b2 = boxes(box(0, 0, 4, 4));
		var b3 = ObjectBoundingBoxes.create(FloatMatrix.zeros(2, 3), FloatMatrix.zeros(2, 3));
		assertThrows(IllegalArgumentException.class, () -> LabelTransfer.transfer(LabelArray.of(0, 1), b2, b3));
	}

}
