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

package objectflow.lib.images.projection;

import java.util.HashMap;
import java.util.Map;

import objectflow.lib.graph.DefaultImageSlot;
import objectflow.lib.graph.DefaultTimeSeriesSlot;
import objectflow.lib.images.SegmentationImage;
import objectflow.lib.measurements.FeatureSet;
import objectflow.lib.measurements.FloatMatrix;

/**
 * A small 6x4 segmentation with three time points, and features providing its bounding boxes.
 * <p>
 * At time 2, object 2 is replaced by object 5.
 */
@SuppressWarnings("javadoc")
class ProjectionTestUtils {
	
	static final int[][] SLICE = {
			{0, 1, 1, 0, 0, 0},
			{0, 1, 1, 0, 2, 2},
			{0, 0, 0, 0, 2, 2},
			{3, 3, 0, 0, 0, 0}
	};
	
	static final int[][] SLICE_2 = {
			{0, 1, 1, 0, 0, 0},
			{0, 1, 1, 0, 5, 5},
			{0, 0, 0, 0, 5, 5},
			{3, 3, 0, 0, 0, 0}
	};
	
	static final int[] SHAPE = {6, 4};
	
	static DefaultImageSlot createImage() {
		return new DefaultImageSlot("Segmentation", SegmentationImage.create2D(SLICE, SLICE, SLICE_2));
	}
	
	static FeatureSet createBoxes(int nObjects, int boxedObject) {
		var min = FloatMatrix.zeros(nObjects, 2);
		var max = FloatMatrix.zeros(nObjects, 2);
		setBox(min, max, 1, 1, 0, 2, 1);
		setBox(min, max, boxedObject, 4, 1, 5, 2);
		setBox(min, max, 3, 0, 3, 1, 3);
		return FeatureSet.builder().boundingBoxes(min, max).build();
	}
	
	private static void setBox(FloatMatrix min, FloatMatrix max, int id, int x0, int y0, int x1, int y1) {
		min.set(id, 0, x0);
		min.set(id, 1, y0);
		max.set(id, 0, x1);
		max.set(id, 1, y1);
	}
	
	static DefaultTimeSeriesSlot<FeatureSet> createFeatures() {
		var slot = new DefaultTimeSeriesSlot<FeatureSet>("Features");
		Map<Integer, FeatureSet> map = new HashMap<>();
		map.put(0, createBoxes(4, 2));
		map.put(1, createBoxes(4, 2));
		map.put(2, createBoxes(6, 5));
		slot.setValues(3, map);
		return slot;
	}
	
	static DefaultTimeSeriesSlot<FloatMatrix> createMapping(FloatMatrix... values) {
		var slot = new DefaultTimeSeriesSlot<FloatMatrix>("Mapping");
		Map<Integer, FloatMatrix> map = new HashMap<>();
		for (int t = 0; t < values.length; t++)
			map.put(t, values[t]);
		slot.setValues(3, map);
		return slot;
	}

}
