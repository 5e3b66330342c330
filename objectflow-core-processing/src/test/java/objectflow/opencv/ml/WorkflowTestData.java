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

package objectflow.opencv.ml;

import java.util.Map;

import objectflow.lib.graph.DefaultImageSlot;
import objectflow.lib.graph.DefaultTimeSeriesSlot;
import objectflow.lib.images.PixelType;
import objectflow.lib.images.SegmentationImage;
import objectflow.lib.measurements.FeatureSelection;
import objectflow.lib.measurements.FeatureSet;
import objectflow.lib.measurements.FloatMatrix;

/**
 * A segmentation with eight single-pixel objects on the first row of a 10x2 image.
 * Objects 1-4 have small feature values and objects 5-8 large ones.
 */
@SuppressWarnings("javadoc")
public class WorkflowTestData {
	
	public static final int[] SHAPE = {10, 2};
	
	public static final FeatureSelection SELECTION = FeatureSelection.of("Intensity", "Mean", "Max");
	
	public static DefaultImageSlot createSegmentation() {
		int[] pixels = new int[SHAPE[0] * SHAPE[1]];
		for (int i = 1; i <= 8; i++)
			pixels[i - 1] = i;
		return new DefaultImageSlot("Segmentation", SegmentationImage.create(PixelType.UINT16, SHAPE, pixels));
	}
	
	public static FeatureSet createFeatureSet() {
		float[] mean = {0, 0.1f, 0.3f, 0.5f, 0.7f, 10f, 10.2f, 10.4f, 10.6f};
		float[] max = new float[mean.length];
		var min = FloatMatrix.zeros(mean.length, 2);
		var boxMax = FloatMatrix.zeros(mean.length, 2);
		for (int i = 1; i < mean.length; i++) {
			max[i] = mean[i] * 2 + 1;
			min.set(i, 0, i - 1);
			boxMax.set(i, 0, i - 1);
		}
		return FeatureSet.builder()
				.add("Intensity", "Mean", mean)
				.add("Intensity", "Max", max)
				.add("Shape", "Area", 0, 1, 1, 1, 1, 1, 1, 1, 1)
				.boundingBoxes(min, boxMax)
				.build();
	}
	
	public static DefaultTimeSeriesSlot<FeatureSet> createFeatures() {
		var slot = new DefaultTimeSeriesSlot<FeatureSet>("Features");
		slot.setValues(1, Map.of(0, createFeatureSet()));
		return slot;
	}
	
	/**
	 * @param x x-coordinate of the pixel, i.e. object id - 1
	 */
	public static int[] pixel(int x) {
		return new int[] {x, 0};
	}

}
