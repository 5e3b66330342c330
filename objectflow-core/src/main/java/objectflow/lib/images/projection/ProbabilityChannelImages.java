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
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import objectflow.lib.classifiers.object.ObjectPredictor;
import objectflow.lib.graph.ImageSlot;
import objectflow.lib.graph.TimeSeriesSlot;
import objectflow.lib.measurements.FeatureSet;
import objectflow.lib.measurements.FloatMatrix;

/**
 * One cached probability image per class, all projected onto the same segmentation.
 */
public class ProbabilityChannelImages {
	
	private static final Logger logger = LoggerFactory.getLogger(ProbabilityChannelImages.class);
	
	private final ImageSlot image;
	private final TimeSeriesSlot<FeatureSet> features;
	private final ObjectPredictor predictor;
	
	private final List<Channel> channels = new ArrayList<>();
	private boolean frozen = false;
	
	/**
	 * Constructor. No channels are created until {@link #resize(int)} is called.
	 * @param image segmentation image
	 * @param features features providing bounding boxes
	 * @param predictor predictor providing the probabilities
	 */
	public ProbabilityChannelImages(ImageSlot image, TimeSeriesSlot<FeatureSet> features, ObjectPredictor predictor) {
		this.image = image;
		this.features = features;
		this.predictor = predictor;
	}
	
	/**
	 * Set the number of channels, creating or removing images as required.
	 * @param nChannels
	 */
	public synchronized void resize(int nChannels) {
		if (nChannels < 0)
			throw new IllegalArgumentException("Number of channels must be >= 0");
		if (nChannels == channels.size())
			return;
		logger.debug("Resizing probability channels from {} to {}", channels.size(), nChannels);
		while (channels.size() > nChannels)
			channels.remove(channels.size() - 1).dispose();
		while (channels.size() < nChannels) {
			var channel = new Channel(channels.size());
			channel.cache.setFrozen(frozen);
			channels.add(channel);
		}
	}
	
	/**
	 * @return the number of channels
	 */
	public synchronized int size() {
		return channels.size();
	}
	
	/**
	 * Get the cached probability image of a class.
	 * @param classIndex zero-based class index, i.e. label - 1
	 * @return
	 */
	public synchronized ProjectionCache get(int classIndex) {
		return channels.get(classIndex).cache;
	}
	
	/**
	 * @return the cached probability images of all classes
	 */
	public synchronized List<ProjectionCache> getImages() {
		List<ProjectionCache> list = new ArrayList<>();
		for (var channel : channels)
			list.add(channel.cache);
		return Collections.unmodifiableList(list);
	}
	
	/**
	 * Freeze or unfreeze all channels.
	 * @param frozen
	 */
	public synchronized void setFrozen(boolean frozen) {
		this.frozen = frozen;
		for (var channel : channels)
			channel.cache.setFrozen(frozen);
	}
	
	/**
	 * Remove all channels and stop listening to the inputs.
	 */
	public synchronized void dispose() {
		resize(0);
	}
	
	
	private class Channel {
		
		private final TimeSeriesSlot<FloatMatrix> mapping;
		private final ObjectMapProjection projection;
		private final ProjectionCache cache;
		
		Channel(int classIndex) {
			mapping = predictor.createProbabilityChannelSlot(classIndex);
			projection = new ObjectMapProjection("Probability channel " + classIndex, image, mapping, features, 1);
			cache = new ProjectionCache(projection);
		}
		
		void dispose() {
			cache.dispose();
			projection.dispose();
			predictor.releaseSlot(mapping);
		}
		
	}

}
