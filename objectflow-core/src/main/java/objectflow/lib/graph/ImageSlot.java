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

package objectflow.lib.graph;

import objectflow.lib.images.PixelType;
import objectflow.lib.regions.ImageRegion;

/**
 * A slot providing integer-valued pixels of an image, region by region.
 * Used for segmentation (connected component) images, where each pixel holds an object index.
 */
public interface ImageSlot extends Slot {
	
	/**
	 * @return the pixel type of the image
	 */
	PixelType getPixelType();
	
	/**
	 * @return number of time points
	 */
	int nTimepoints();
	
	/**
	 * Spatial shape of each time slice, in the order x, y (, z).
	 * @return
	 */
	int[] getShape();
	
	/**
	 * Read the pixels of a region, with x varying fastest.
	 * @param region
	 * @return
	 */
	int[] readRegion(ImageRegion region);
	
	/**
	 * Read a single pixel.
	 * @param t
	 * @param coords
	 * @return
	 */
	default int getPixel(int t, int... coords) {
		int[] stop = new int[coords.length];
		for (int d = 0; d < coords.length; d++)
			stop[d] = coords[d] + 1;
		return readRegion(ImageRegion.createInstance(t, coords, stop))[0];
	}

}
