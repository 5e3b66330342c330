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

/**
 * Pixel types supported for segmentation and projected images.
 */
public enum PixelType {
	
	/**
	 * 8-bit unsigned integer
	 */
	UINT8(8, false),
	/**
	 * 16-bit unsigned integer
	 */
	UINT16(16, false),
	/**
	 * 32-bit unsigned integer
	 */
	UINT32(32, false),
	/**
	 * 32-bit signed integer
	 */
	INT32(32, false),
	/**
	 * 64-bit signed integer
	 */
	INT64(64, false),
	/**
	 * 32-bit floating point
	 */
	FLOAT32(32, true),
	/**
	 * 64-bit floating point
	 */
	FLOAT64(64, true);
	
	private final int bitsPerPixel;
	private final boolean isFloatingPoint;
	
	private PixelType(int bitsPerPixel, boolean isFloatingPoint) {
		this.bitsPerPixel = bitsPerPixel;
		this.isFloatingPoint = isFloatingPoint;
	}
	
	/**
	 * @return number of bits per pixel
	 */
	public int getBitsPerPixel() {
		return bitsPerPixel;
	}
	
	/**
	 * @return true if the type is floating point
	 */
	public boolean isFloatingPoint() {
		return isFloatingPoint;
	}

}
