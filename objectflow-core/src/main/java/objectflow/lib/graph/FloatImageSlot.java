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

import objectflow.lib.regions.ImageRegion;

/**
 * A slot providing a multichannel floating point image, region by region.
 */
public interface FloatImageSlot extends Slot {
	
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
	 * @return number of channels
	 */
	int nChannels();
	
	/**
	 * Read the pixels of a region.
	 * Values are stored channel-last, with x varying fastest after the channel, 
	 * i.e. the value of channel c at pixel index i is found at {@code i * nChannels() + c}.
	 * @param region
	 * @return
	 */
	float[] readRegion(ImageRegion region);

}
