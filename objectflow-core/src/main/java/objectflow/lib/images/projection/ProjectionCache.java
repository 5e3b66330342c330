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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import objectflow.lib.common.GeneralTools;
import objectflow.lib.graph.DirtyEvent;
import objectflow.lib.graph.DirtyListener;
import objectflow.lib.graph.DirtyNotifier;
import objectflow.lib.graph.DirtyRegion;
import objectflow.lib.graph.FloatImageSlot;
import objectflow.lib.regions.ImageRegion;

/**
 * Pixel cache for a {@link FloatImageSlot}.
 * <p>
 * Each time slice is stored in full once any part of it has been requested, along with a mask 
 * indicating which pixels are up to date. Dirty notifications from the source only invalidate 
 * the pixels within the dirty region.
 * <p>
 * The cache can be frozen: while frozen, requests are answered from the stored pixels only 
 * (with 0 for pixels never computed) and dirty notifications are held back until the cache is unfrozen.
 */
public class ProjectionCache implements FloatImageSlot, DirtyListener {
	
	private static final Logger logger = LoggerFactory.getLogger(ProjectionCache.class);
	
	private final FloatImageSlot source;
	private final DirtyNotifier notifier = new DirtyNotifier(this);
	
	private final Map<Integer, float[]> data = new HashMap<>();
	private final Map<Integer, boolean[]> clean = new HashMap<>();
	
	private boolean frozen = false;
	private final List<DirtyRegion> pendingDirty = new ArrayList<>();
	
	/**
	 * Constructor.
	 * @param source the image to cache
	 */
	public ProjectionCache(FloatImageSlot source) {
		this.source = Objects.requireNonNull(source);
		source.addDirtyListener(this);
	}
	
	/**
	 * Stop listening to the source.
	 */
	public void dispose() {
		source.removeDirtyListener(this);
	}
	
	/**
	 * @return the cached image
	 */
	public FloatImageSlot getSource() {
		return source;
	}

	@Override
	public float[] readRegion(ImageRegion region) {
		int[] shape = source.getShape();
		int nChannels = source.nChannels();
		synchronized (this) {
			if (!frozen && !isRegionClean(region)) {
				var values = source.readRegion(region);
				write(region, values, shape, nChannels);
			}
			return read(region, shape, nChannels);
		}
	}
	
	/**
	 * Query whether a pixel is cached and up to date.
	 * @param t
	 * @param coords
	 * @return
	 */
	public synchronized boolean isClean(int t, int... coords) {
		var mask = clean.get(t);
		if (mask == null)
			return false;
		return mask[index(source.getShape(), coords)];
	}
	
	/**
	 * Freeze or unfreeze the cache. When unfreezing, any dirty notifications received while frozen are passed on.
	 * @param frozen
	 */
	public void setFrozen(boolean frozen) {
		List<DirtyRegion> toFire;
		synchronized (this) {
			if (this.frozen == frozen)
				return;
			this.frozen = frozen;
			if (frozen)
				return;
			toFire = new ArrayList<>(pendingDirty);
			pendingDirty.clear();
		}
		logger.debug("Cache unfrozen, passing on {} dirty region(s)", toFire.size());
		if (toFire.stream().anyMatch(DirtyRegion::isAll))
			notifier.fireDirty(DirtyRegion.all());
		else {
			for (var region : toFire)
				notifier.fireDirty(region);
		}
	}
	
	/**
	 * @return true if the cache is frozen
	 */
	public synchronized boolean isFrozen() {
		return frozen;
	}
	
	/**
	 * Discard all cached pixels.
	 */
	public synchronized void clear() {
		data.clear();
		clean.clear();
	}

	@Override
	public void slotDirty(DirtyEvent event) {
		var region = event.getRegion();
		synchronized (this) {
			invalidate(region);
			if (frozen) {
				pendingDirty.add(region);
				return;
			}
		}
		notifier.fireDirty(region);
	}
	
	private void invalidate(DirtyRegion region) {
		switch (region.getType()) {
		case ALL:
			clean.values().forEach(mask -> Arrays.fill(mask, false));
			break;
		case TIMES:
			for (int t : region.getTimes()) {
				var mask = clean.get(t);
				if (mask != null)
					Arrays.fill(mask, false);
			}
			break;
		case SPATIAL:
			var mask = clean.get(region.getRegion().getT());
			if (mask != null)
				fillMask(mask, region.getRegion().clip(source.getShape()), source.getShape(), false);
			break;
		case OBJECTS:
			// Object regions are resolved by the source
			logger.warn("Unexpected object-level dirty region {}, invalidating affected time points", region);
			for (var obj : region.getObjects()) {
				var m = clean.get(obj.getTime());
				if (m != null)
					Arrays.fill(m, false);
			}
			break;
		}
	}
	
	private boolean isRegionClean(ImageRegion region) {
		var mask = clean.get(region.getT());
		if (mask == null)
			return false;
		int[] shape = source.getShape();
		boolean[] result = {true};
		forEachIndex(region, shape, (i, j) -> {
			if (!mask[i])
				result[0] = false;
		});
		return result[0];
	}
	
	private void write(ImageRegion region, float[] values, int[] shape, int nChannels) {
		int t = region.getT();
		int nPixels = GeneralTools.product(shape);
		var slice = data.computeIfAbsent(t, k -> new float[nPixels * nChannels]);
		var mask = clean.computeIfAbsent(t, k -> new boolean[nPixels]);
		forEachIndex(region, shape, (i, j) -> {
			System.arraycopy(values, j * nChannels, slice, i * nChannels, nChannels);
			mask[i] = true;
		});
	}
	
	private float[] read(ImageRegion region, int[] shape, int nChannels) {
		float[] output = new float[region.getNumPixels() * nChannels];
		var slice = data.get(region.getT());
		if (slice == null)
			return output;
		forEachIndex(region, shape, (i, j) -> System.arraycopy(slice, i * nChannels, output, j * nChannels, nChannels));
		return output;
	}
	
	private static void fillMask(boolean[] mask, ImageRegion region, int[] shape, boolean value) {
		forEachIndex(region, shape, (i, j) -> mask[i] = value);
	}
	
	private static int index(int[] shape, int[] coords) {
		int z = coords.length > 2 ? coords[2] : 0;
		return coords[0] + shape[0] * (coords[1] + shape[1] * z);
	}
	
	/**
	 * Visit each pixel of a region, passing the index within the full slice and the index within the region.
	 */
	private static void forEachIndex(ImageRegion region, int[] shape, IndexConsumer consumer) {
		boolean is3D = shape.length > 2;
		int z0 = is3D ? region.getStart(2) : 0;
		int z1 = is3D ? region.getStop(2) : 1;
		int j = 0;
		for (int z = z0; z < z1; z++) {
			for (int y = region.getStart(1); y < region.getStop(1); y++) {
				int offset = shape[0] * (y + shape[1] * z);
				for (int x = region.getStart(0); x < region.getStop(0); x++) {
					consumer.accept(offset + x, j++);
				}
			}
		}
	}
	
	@FunctionalInterface
	private static interface IndexConsumer {
		void accept(int sliceIndex, int regionIndex);
	}

	@Override
	public int nTimepoints() {
		return source.nTimepoints();
	}

	@Override
	public int[] getShape() {
		return source.getShape();
	}

	@Override
	public int nChannels() {
		return source.nChannels();
	}

	@Override
	public boolean isReady() {
		return source.isReady();
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
		return "Cache[" + source + "]";
	}

}
