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

package objectflow.lib.images;

import java.util.Arrays;
import java.util.Objects;

import objectflow.lib.common.GeneralTools;
import objectflow.lib.regions.ImageRegion;

/**
 * In-memory image of object indices, with one slice per time point.
 * <p>
 * Pixels within a slice are stored with x varying fastest, i.e. the index of (x, y, z) 
 * is {@code x + sizeX * (y + sizeY * z)}.
 */
public class SegmentationImage {
	
	private final PixelType pixelType;
	private final int[] shape;
	private final int[][] slices;
	
	private SegmentationImage(PixelType pixelType, int[] shape, int[][] slices) {
		this.pixelType = pixelType;
		this.shape = shape;
		this.slices = slices;
	}
	
	/**
	 * Create a segmentation image from per-time pixel arrays.
	 * @param pixelType declared pixel type
	 * @param shape spatial shape (x, y) or (x, y, z)
	 * @param slices one pixel array per time point, each of length equal to the product of the shape
	 * @return
	 * @throws IllegalArgumentException if a slice has the wrong length
	 */
	public static SegmentationImage create(PixelType pixelType, int[] shape, int[]... slices) {
		Objects.requireNonNull(pixelType);
		if (shape.length < 2 || shape.length > 3)
			throw new IllegalArgumentException("Only 2D and 3D images are supported, but shape is " + Arrays.toString(shape));
		int n = GeneralTools.product(shape);
		int[][] copy = new int[slices.length][];
		for (int t = 0; t < slices.length; t++) {
			if (slices[t].length != n)
				throw new IllegalArgumentException("Slice " + t + " has " + slices[t].length + " pixels, expected " + n);
			copy[t] = slices[t].clone();
		}
		return new SegmentationImage(pixelType, shape.clone(), copy);
	}
	
	/**
	 * Create a 2D segmentation image with 32-bit integer pixels from row arrays, 
	 * i.e. {@code rows[t][y][x]}.
	 * @param rows
	 * @return
	 */
	public static SegmentationImage create2D(int[][]... rows) {
		int sy = rows[0].length;
		int sx = rows[0][0].length;
		int[][] slices = new int[rows.length][];
		for (int t = 0; t < rows.length; t++) {
			int[] slice = new int[sx * sy];
			for (int y = 0; y < sy; y++)
				System.arraycopy(rows[t][y], 0, slice, y * sx, sx);
			slices[t] = slice;
		}
		return create(PixelType.UINT32, new int[] {sx, sy}, slices);
	}
	
	/**
	 * @return the declared pixel type
	 */
	public PixelType getPixelType() {
		return pixelType;
	}
	
	/**
	 * @return the number of time points
	 */
	public int nTimepoints() {
		return slices.length;
	}
	
	/**
	 * @return a copy of the spatial shape
	 */
	public int[] getShape() {
		return shape.clone();
	}
	
	/**
	 * Get the pixel at the specified coordinates.
	 * @param t
	 * @param coords
	 * @return
	 */
	public int getPixel(int t, int... coords) {
		return slices[t][index(coords)];
	}
	
	/**
	 * Read the pixels of a region, which must lie within the image.
	 * @param region
	 * @return
	 */
	public int[] readRegion(ImageRegion region) {
		if (region.nDimensions() != shape.length)
			throw new IllegalArgumentException("Region " + region + " does not match image dimensions " + Arrays.toString(shape));
		int[] slice = slices[region.getT()];
		int[] output = new int[region.getNumPixels()];
		int x0 = region.getStart(0), sx = region.getSize(0);
		int z0 = shape.length > 2 ? region.getStart(2) : 0;
		int z1 = shape.length > 2 ? region.getStop(2) : 1;
		int i = 0;
		for (int z = z0; z < z1; z++) {
			for (int y = region.getStart(1); y < region.getStop(1); y++) {
				int offset = x0 + shape[0] * (y + shape[1] * z);
				System.arraycopy(slice, offset, output, i, sx);
				i += sx;
			}
		}
		return output;
	}
	
	/**
	 * Get the pixel array of a complete time slice.
	 * @param t
	 * @return a copy of the pixels
	 */
	public int[] getSlice(int t) {
		return slices[t].clone();
	}
	
	private int index(int[] coords) {
		int z = coords.length > 2 ? coords[2] : 0;
		return coords[0] + shape[0] * (coords[1] + shape[1] * z);
	}

}
