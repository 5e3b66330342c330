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
import objectflow.lib.images.SegmentationImage;
import objectflow.lib.regions.ImageRegion;

/**
 * A settable {@link ImageSlot} backed by a {@link SegmentationImage}.
 */
public class DefaultImageSlot implements ImageSlot {
	
	private final DirtyNotifier notifier = new DirtyNotifier(this);
	private final String name;
	
	private volatile SegmentationImage image;
	
	/**
	 * Create a slot without an image.
	 * @param name
	 */
	public DefaultImageSlot(String name) {
		this.name = name;
	}
	
	/**
	 * Create a slot with an initial image.
	 * @param name
	 * @param image
	 */
	public DefaultImageSlot(String name, SegmentationImage image) {
		this(name);
		this.image = image;
	}
	
	/**
	 * Set the image and notify listeners that everything is dirty.
	 * @param image
	 */
	public void setImage(SegmentationImage image) {
		this.image = image;
		notifier.fireDirty(DirtyRegion.all());
	}
	
	/**
	 * Set the image and notify listeners that only part of it has changed.
	 * @param image
	 * @param region
	 */
	public void setImage(SegmentationImage image, DirtyRegion region) {
		this.image = image;
		notifier.fireDirty(region);
	}
	
	/**
	 * @return the current image, or null
	 */
	public SegmentationImage getImage() {
		return image;
	}
	
	private SegmentationImage requireImage() {
		var img = image;
		if (img == null)
			throw new IllegalStateException("Slot " + name + " is not ready");
		return img;
	}

	@Override
	public PixelType getPixelType() {
		return requireImage().getPixelType();
	}

	@Override
	public int nTimepoints() {
		return requireImage().nTimepoints();
	}

	@Override
	public int[] getShape() {
		return requireImage().getShape();
	}

	@Override
	public int[] readRegion(ImageRegion region) {
		return requireImage().readRegion(region);
	}

	@Override
	public boolean isReady() {
		return image != null;
	}

	@Override
	public void addDirtyListener(DirtyListener listener) {
		notifier.addListener(listener);
	}

	@Override
	public void removeDirtyListener(DirtyListener listener) {
		notifier.removeListener(listener);
	}
	
	@Override
	public String toString() {
		return name;
	}

}
