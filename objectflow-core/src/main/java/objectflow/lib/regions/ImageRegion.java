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

package objectflow.lib.regions;

import java.util.Arrays;

/**
 * Class for defining a region of a single time slice of an image.
 * <p>
 * The spatial box is given in pixel coordinates as a start (inclusive) and stop (exclusive) 
 * for each spatial axis, in the order x, y (, z). The time point is given as an index.
 */
public class ImageRegion {
	
	private final int t;
	private final int[] start;
	private final int[] stop;
	
	ImageRegion(final int t, final int[] start, final int[] stop) {
		this.t = t;
		this.start = start;
		this.stop = stop;
	}
	
	/**
	 * Create a region from its start (inclusive) and stop (exclusive) coordinates.
	 * @param t time index
	 * @param start
	 * @param stop
	 * @return
	 */
	public static ImageRegion createInstance(final int t, final int[] start, final int[] stop) {
		if (t < 0)
			throw new IllegalArgumentException("Time index must be >= 0! Requested t = " + t);
		if (start.length != stop.length)
			throw new IllegalArgumentException("Start and stop must have the same number of dimensions, but got " + 
					start.length + " and " + stop.length);
		for (int d = 0; d < start.length; d++) {
			if (stop[d] < start[d])
				throw new IllegalArgumentException("Region size must be >= 0! Requested " + Arrays.toString(start) + " - " + Arrays.toString(stop));
		}
		return new ImageRegion(t, start.clone(), stop.clone());
	}
	
	/**
	 * Create a region covering a complete time slice.
	 * @param t time index
	 * @param shape spatial shape of the image
	 * @return
	 */
	public static ImageRegion createFullSlice(final int t, final int[] shape) {
		return createInstance(t, new int[shape.length], shape);
	}
	
	/**
	 * Create the region enclosing a bounding box with an <i>inclusive</i> maximum, 
	 * as produced by object feature extraction.
	 * @param t time index
	 * @param min minimum coordinates
	 * @param maxInclusive maximum coordinates, included in the region
	 * @return
	 */
	public static ImageRegion createFromBounds(final int t, final int[] min, final int[] maxInclusive) {
		int[] stop = new int[maxInclusive.length];
		for (int d = 0; d < stop.length; d++)
			stop[d] = maxInclusive[d] + 1;
		return createInstance(t, min, stop);
	}
	
	/**
	 * Get the time point index for the region.
	 * @return
	 */
	public int getT() {
		return t;
	}
	
	/**
	 * Number of spatial dimensions (2 or 3).
	 * @return
	 */
	public int nDimensions() {
		return start.length;
	}
	
	/**
	 * Get the start coordinate (inclusive) along a spatial axis.
	 * @param dim
	 * @return
	 */
	public int getStart(int dim) {
		return start[dim];
	}
	
	/**
	 * Get the stop coordinate (exclusive) along a spatial axis.
	 * @param dim
	 * @return
	 */
	public int getStop(int dim) {
		return stop[dim];
	}
	
	/**
	 * Get the size of the region along a spatial axis.
	 * @param dim
	 * @return
	 */
	public int getSize(int dim) {
		return stop[dim] - start[dim];
	}
	
	/**
	 * Get the spatial shape of the region.
	 * @return
	 */
	public int[] getShape() {
		int[] shape = new int[start.length];
		for (int d = 0; d < shape.length; d++)
			shape[d] = stop[d] - start[d];
		return shape;
	}
	
	/**
	 * Get the number of pixels (or voxels) within the region.
	 * @return
	 */
	public int getNumPixels() {
		int n = 1;
		for (int d = 0; d < start.length; d++)
			n *= stop[d] - start[d];
		return n;
	}
	
	/**
	 * Returns true if the region has no pixels.
	 * @return
	 */
	public boolean isEmpty() {
		return getNumPixels() == 0;
	}
	
	/**
	 * Returns true if this region overlaps with another (in the same time slice).
	 * @param region
	 * @return
	 */
	public boolean intersects(final ImageRegion region) {
		if (t != region.t || start.length != region.start.length)
			return false;
		for (int d = 0; d < start.length; d++) {
			if (region.stop[d] <= start[d] || region.start[d] >= stop[d])
				return false;
		}
		return !isEmpty() && !region.isEmpty();
	}
	
	/**
	 * Check if this region contains a specified coordinate.
	 * @param t
	 * @param coords
	 * @return
	 */
	public boolean contains(int t, int... coords) {
		if (this.t != t || coords.length != start.length)
			return false;
		for (int d = 0; d < start.length; d++) {
			if (coords[d] < start[d] || coords[d] >= stop[d])
				return false;
		}
		return true;
	}
	
	/**
	 * Clip the region so that it lies within an image of the specified shape.
	 * @param shape
	 * @return this region if no clipping is needed, otherwise a new (possibly empty) region
	 */
	public ImageRegion clip(final int[] shape) {
		boolean changed = false;
		int[] start2 = start.clone();
		int[] stop2 = stop.clone();
		for (int d = 0; d < start.length; d++) {
			start2[d] = Math.max(0, Math.min(start[d], shape[d]));
			stop2[d] = Math.max(start2[d], Math.min(stop[d], shape[d]));
			changed = changed || start2[d] != start[d] || stop2[d] != stop[d];
		}
		return changed ? new ImageRegion(t, start2, stop2) : this;
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + t;
		result = prime * result + Arrays.hashCode(start);
		result = prime * result + Arrays.hashCode(stop);
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof ImageRegion))
			return false;
		ImageRegion other = (ImageRegion) obj;
		return t == other.t && Arrays.equals(start, other.start) && Arrays.equals(stop, other.stop);
	}
	
	@Override
	public String toString() {
		return "Region: t=" + t + ", start=" + Arrays.toString(start) + ", stop=" + Arrays.toString(stop);
	}

}
