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
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import objectflow.lib.graph.DirtyEvent;
import objectflow.lib.graph.DirtyListener;
import objectflow.lib.graph.DirtyNotifier;
import objectflow.lib.graph.DirtyRegion;
import objectflow.lib.graph.FloatImageSlot;
import objectflow.lib.graph.ImageSlot;
import objectflow.lib.graph.TimeSeriesSlot;
import objectflow.lib.measurements.FeatureSet;
import objectflow.lib.measurements.FloatMatrix;
import objectflow.lib.objects.ObjectBoundingBoxes;
import objectflow.lib.regions.ImageRegion;

/**
 * Image in which each pixel of a segmentation is replaced by the value mapped to its object.
 * <p>
 * The mapping for each time point is a matrix with one row per object and one column per output channel.
 * Objects beyond the end of the mapping are given the value 0, as are all pixels of a time point 
 * with an empty mapping.
 * <p>
 * Dirty notifications are passed on as precisely as possible: changes to the segmentation keep their region, 
 * changes to the mapping of individual objects only affect the bounding boxes of those objects.
 */
public class ObjectMapProjection implements FloatImageSlot {
	
	private static final Logger logger = LoggerFactory.getLogger(ObjectMapProjection.class);
	
	private final String name;
	private final ImageSlot image;
	private final TimeSeriesSlot<FloatMatrix> mapping;
	private final TimeSeriesSlot<FeatureSet> features;
	private final int nChannels;
	
	private final DirtyNotifier notifier = new DirtyNotifier(this);
	private final DirtyListener imageListener = this::imageDirty;
	private final DirtyListener mappingListener = this::mappingDirty;
	
	/**
	 * Constructor.
	 * @param name
	 * @param image segmentation image
	 * @param mapping mapping from object to value(s) for each time point
	 * @param features features providing the bounding boxes of each object
	 * @param nChannels number of output channels
	 */
	public ObjectMapProjection(String name, ImageSlot image, TimeSeriesSlot<FloatMatrix> mapping, TimeSeriesSlot<FeatureSet> features, int nChannels) {
		if (nChannels < 1)
			throw new IllegalArgumentException("Number of channels must be > 0");
		this.name = name;
		this.image = Objects.requireNonNull(image);
		this.mapping = Objects.requireNonNull(mapping);
		this.features = Objects.requireNonNull(features);
		this.nChannels = nChannels;
		image.addDirtyListener(imageListener);
		mapping.addDirtyListener(mappingListener);
		if ((Object)features != mapping)
			features.addDirtyListener(mappingListener);
	}
	
	/**
	 * Stop listening to the inputs.
	 */
	public void dispose() {
		image.removeDirtyListener(imageListener);
		mapping.removeDirtyListener(mappingListener);
		features.removeDirtyListener(mappingListener);
	}

	@Override
	public float[] readRegion(ImageRegion region) {
		long startTime = System.nanoTime();
		int t = region.getT();
		int[] pixels = image.readRegion(region);
		float[] output = new float[pixels.length * nChannels];
		
		var map = mapping.getValue(t);
		if (map == null || map.nRows() == 0 || map.nCols() == 0) {
			// No objects, nothing to paint
			return output;
		}
		int nRows = map.nRows();
		int nCols = Math.min(map.nCols(), nChannels);
		for (int i = 0; i < pixels.length; i++) {
			int id = pixels[i];
			if (id < 0 || id >= nRows)
				continue;
			for (int c = 0; c < nCols; c++)
				output[i * nChannels + c] = map.get(id, c);
		}
		if (logger.isTraceEnabled())
			logger.trace("{}: projected {} in {} ms", name, region, (System.nanoTime() - startTime) / 1e6);
		return output;
	}
	
	private void imageDirty(DirtyEvent event) {
		notifier.fireDirty(event.getRegion());
	}
	
	private void mappingDirty(DirtyEvent event) {
		var region = event.getRegion();
		switch (region.getType()) {
		case ALL:
			notifier.fireDirty(DirtyRegion.all());
			break;
		case TIMES:
			for (int t : region.getTimes())
				notifier.fireDirty(DirtyRegion.spatial(ImageRegion.createFullSlice(t, image.getShape())));
			break;
		case SPATIAL:
			notifier.fireDirty(region);
			break;
		case OBJECTS:
			for (var dirty : getObjectRegions(region))
				notifier.fireDirty(DirtyRegion.spatial(dirty));
			break;
		}
	}
	
	/**
	 * Get the bounding box regions of dirty objects; if a bounding box is not known, 
	 * the whole time slice is returned instead.
	 */
	private List<ImageRegion> getObjectRegions(DirtyRegion region) {
		int[] shape = image.getShape();
		var times = new TreeSet<Integer>();
		for (var obj : region.getObjects())
			times.add(obj.getTime());
		var featureMap = features.getValues(times);
		List<ImageRegion> regions = new ArrayList<>();
		for (var obj : region.getObjects()) {
			int t = obj.getTime();
			var boxes = ObjectBoundingBoxes.fromFeatures(featureMap.get(t));
			if (boxes == null || obj.getObjectId() >= boxes.nObjects()) {
				logger.debug("No bounding box for {}, setting time slice dirty", obj);
				regions.add(ImageRegion.createFullSlice(t, shape));
			} else {
				var box = boxes.getRegion(t, obj.getObjectId()).clip(shape);
				if (!box.isEmpty())
					regions.add(box);
			}
		}
		return regions;
	}

	@Override
	public int nTimepoints() {
		return image.nTimepoints();
	}

	@Override
	public int[] getShape() {
		return image.getShape();
	}

	@Override
	public int nChannels() {
		return nChannels;
	}

	@Override
	public boolean isReady() {
		return image.isReady() && mapping.isReady();
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
