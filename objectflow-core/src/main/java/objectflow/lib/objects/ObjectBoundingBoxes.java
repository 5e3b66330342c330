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

package objectflow.lib.objects;

import objectflow.lib.measurements.FeatureSet;
import objectflow.lib.measurements.FloatMatrix;
import objectflow.lib.regions.ImageRegion;

/**
 * Axis-aligned bounding boxes of all objects at one time point.
 * <p>
 * Row {@code i} holds the box of object {@code i}, with row 0 belonging to the background.
 * Coordinates are ordered x, y (, z) and maxima are inclusive.
 */
public class ObjectBoundingBoxes {
	
	private final FloatMatrix minimum;
	private final FloatMatrix maximum;
	
	private ObjectBoundingBoxes(FloatMatrix minimum, FloatMatrix maximum) {
		if (minimum.nRows() != maximum.nRows() || minimum.nCols() != maximum.nCols())
			throw new IllegalArgumentException("Bounding box minimum " + minimum + " and maximum " + maximum + " have different shapes");
		if (minimum.nCols() < 2 || minimum.nCols() > 3)
			throw new IllegalArgumentException("Bounding boxes must be 2D or 3D, but have " + minimum.nCols() + " dimensions");
		this.minimum = minimum.copy();
		this.maximum = maximum.copy();
	}
	
	/**
	 * Create bounding boxes from minimum and maximum coordinates.
	 * @param minimum matrix of objects × dimensions
	 * @param maximum matrix of objects × dimensions (inclusive)
	 * @return
	 */
	public static ObjectBoundingBoxes create(FloatMatrix minimum, FloatMatrix maximum) {
		return new ObjectBoundingBoxes(minimum, maximum);
	}
	
	/**
	 * Extract bounding boxes from the reserved plugin of a feature set.
	 * @param features
	 * @return the bounding boxes, or null if the features do not contain them
	 */
	public static ObjectBoundingBoxes fromFeatures(FeatureSet features) {
		if (features == null || !features.hasBoundingBoxes())
			return null;
		return new ObjectBoundingBoxes(
				features.get(FeatureSet.DEFAULT_FEATURES_KEY, FeatureSet.COORD_MINIMUM),
				features.get(FeatureSet.DEFAULT_FEATURES_KEY, FeatureSet.COORD_MAXIMUM));
	}
	
	/**
	 * @return number of rows, i.e. the number of objects including the background
	 */
	public int nObjects() {
		return minimum.nRows();
	}
	
	/**
	 * @return 2 or 3
	 */
	public int nDimensions() {
		return minimum.nCols();
	}
	
	/**
	 * Get the minimum coordinate of an object.
	 * @param objectId
	 * @param dim
	 * @return
	 */
	public float getMin(int objectId, int dim) {
		return minimum.get(objectId, dim);
	}
	
	/**
	 * Get the inclusive maximum coordinate of an object.
	 * @param objectId
	 * @param dim
	 * @return
	 */
	public float getMax(int objectId, int dim) {
		return maximum.get(objectId, dim);
	}
	
	/**
	 * Get the region of an image covered by an object.
	 * @param t time point of the region
	 * @param objectId
	 * @return
	 */
	public ImageRegion getRegion(int t, int objectId) {
		int n = nDimensions();
		int[] min = new int[n];
		int[] max = new int[n];
		for (int d = 0; d < n; d++) {
			min[d] = (int)Math.floor(getMin(objectId, d));
			max[d] = (int)Math.ceil(getMax(objectId, d));
		}
		return ImageRegion.createFromBounds(t, min, max);
	}
	
	@Override
	public String toString() {
		return "ObjectBoundingBoxes[" + nObjects() + " objects, " + nDimensions() + "D]";
	}

}
