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

package objectflow.lib.classifiers.object.workflow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ExecutorService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import objectflow.lib.classifiers.object.ClassifierEnsemble;
import objectflow.lib.classifiers.object.ConfigurationException;
import objectflow.lib.classifiers.object.ObjectPredictor;
import objectflow.lib.graph.DefaultTimeSeriesSlot;
import objectflow.lib.graph.DirtyEvent;
import objectflow.lib.graph.DirtyListener;
import objectflow.lib.graph.DirtyRegion;
import objectflow.lib.graph.FloatImageSlot;
import objectflow.lib.graph.ImageSlot;
import objectflow.lib.graph.TimeSeriesSlot;
import objectflow.lib.graph.TimeSeriesSlots;
import objectflow.lib.graph.ValueSlot;
import objectflow.lib.images.projection.ObjectMapProjection;
import objectflow.lib.images.projection.ProbabilityChannelImages;
import objectflow.lib.images.projection.ProjectionCache;
import objectflow.lib.measurements.FeatureSelection;
import objectflow.lib.measurements.FeatureSet;
import objectflow.lib.measurements.FloatMatrix;
import objectflow.lib.objects.LabelArray;
import objectflow.lib.objects.ObjectBoundingBoxes;
import objectflow.lib.objects.labels.LabelTransfer;
import objectflow.lib.objects.labels.LabelTransferResult;

/**
 * The state of one image sequence within an {@link ObjectClassificationWorkflow}: 
 * its inputs, labels, predictor and output images.
 * <p>
 * Bounding boxes of labeled objects are cached whenever labels are assigned, 
 * so that labels can be transferred if the segmentation changes.
 */
public class ClassificationLane {
	
	private static final Logger logger = LoggerFactory.getLogger(ClassificationLane.class);
	
	private final ImageSlot segmentation;
	private final TimeSeriesSlot<FeatureSet> features;
	private final DefaultTimeSeriesSlot<LabelArray> labels = new DefaultTimeSeriesSlot<>("Labels");
	
	private final Map<Integer, ObjectBoundingBoxes> labelBoundingBoxes = new TreeMap<>();
	private Map<Integer, LabelArray> labelSnapshot = null;
	private boolean needTransfer = false;
	
	private final ObjectPredictor predictor;
	private final ObjectMapProjection labelImage;
	private final ObjectMapProjection uncachedPredictionImage;
	private final ProjectionCache predictionImage;
	private final ObjectMapProjection badObjectImage;
	private final ProbabilityChannelImages probabilityChannels;
	
	private final DirtyListener segmentationListener = this::segmentationDirty;
	
	ClassificationLane(ImageSlot segmentation, TimeSeriesSlot<FeatureSet> features, 
			ValueSlot<ClassifierEnsemble> classifier, ValueSlot<FeatureSelection> selected, 
			ValueSlot<Integer> numLabels, ExecutorService pool) {
		if (!segmentation.isReady())
			throw new ConfigurationException("Segmentation image is not available");
		if (segmentation.getPixelType().isFloatingPoint())
			throw new ConfigurationException("Segmentation image should be of integer type, but is " + segmentation.getPixelType());
		this.segmentation = segmentation;
		this.features = features;
		
		resetLabels();
		
		predictor = new ObjectPredictor(classifier, features, selected, numLabels, pool);
		labelImage = new ObjectMapProjection("Labels", segmentation, 
				TimeSeriesSlots.map(labels, l -> toColumn(l.toArray())), features, 1);
		uncachedPredictionImage = new ObjectMapProjection("Predictions", segmentation, 
				TimeSeriesSlots.map(predictor.getPredictionsSlot(), ClassificationLane::toColumn), features, 1);
		predictionImage = new ProjectionCache(uncachedPredictionImage);
		badObjectImage = new ObjectMapProjection("Bad objects", segmentation, 
				TimeSeriesSlots.map(predictor.getBadObjectsSlot(), ClassificationLane::toColumn), features, 1);
		probabilityChannels = new ProbabilityChannelImages(segmentation, features, predictor);
		
		segmentation.addDirtyListener(segmentationListener);
	}
	
	/**
	 * Reset the labels for all time points to 0.
	 */
	public synchronized void resetLabels() {
		Map<Integer, LabelArray> map = new LinkedHashMap<>();
		int n = segmentation.nTimepoints();
		for (int t = 0; t < n; t++)
			map.put(t, LabelArray.ofSize(1));
		labelBoundingBoxes.clear();
		labelSnapshot = null;
		needTransfer = false;
		labels.setValues(n, map);
	}
	
	/**
	 * Replace the labels, e.g. when restoring a saved project.
	 * Bounding boxes are not available for restored labels, so they cannot be transferred to a new segmentation.
	 * @param newLabels
	 */
	public synchronized void setLabels(Map<Integer, LabelArray> newLabels) {
		Map<Integer, LabelArray> map = new LinkedHashMap<>();
		int n = segmentation.nTimepoints();
		for (int t = 0; t < n; t++) {
			var l = newLabels.get(t);
			map.put(t, l == null ? LabelArray.ofSize(1) : l.copy());
		}
		labelBoundingBoxes.clear();
		labels.setValues(n, map);
	}
	
	/**
	 * Assign a label to the object at the specified pixel.
	 * Nothing happens if the pixel belongs to the background.
	 * 
	 * @param t time point
	 * @param coords pixel coordinates (x, y[, z])
	 * @param label the label to assign, or 0 to remove a label
	 * @return the index of the labeled object, or 0 if the pixel belongs to the background
	 */
	public int assignObjectLabel(int t, int[] coords, int label) {
		int[] shape = segmentation.getShape();
		if (coords.length != shape.length)
			throw new IllegalArgumentException("Expected " + shape.length + " coordinates, but got " + coords.length);
		int objectId = segmentation.getPixel(t, coords);
		if (objectId == 0)
			return 0;
		synchronized (this) {
			labels.getValue(t).set(objectId, label);
			if (!labelBoundingBoxes.containsKey(t)) {
				var boxes = ObjectBoundingBoxes.fromFeatures(features.getValue(t));
				if (boxes == null)
					logger.warn("No bounding boxes available at time {}, labels cannot be transferred to a new segmentation", t);
				else
					labelBoundingBoxes.put(t, boxes);
			}
		}
		logger.debug("Assigned label {} to object {} at time {}", label, objectId, t);
		labels.setDirty(DirtyRegion.object(t, objectId));
		return objectId;
	}
	
	/**
	 * Remove a label from every object, and decrement all higher labels by one.
	 * @param label
	 * @return true if any label changed
	 */
	public boolean removeLabel(int label) {
		boolean changed = false;
		for (var l : labels.getValues(Collections.emptyList()).values())
			changed = l.replaceAll(v -> v == label ? 0 : v > label ? v - 1 : v) || changed;
		if (changed)
			labels.setDirty(DirtyRegion.all());
		return changed;
	}
	
	private void segmentationDirty(DirtyEvent event) {
		synchronized (this) {
			Map<Integer, LabelArray> snapshot = new TreeMap<>();
			for (var entry : labels.getValues(Collections.emptyList()).entrySet())
				snapshot.put(entry.getKey(), entry.getValue().copy());
			labelSnapshot = snapshot;
			needTransfer = true;
		}
		logger.debug("Segmentation changed: {}", event.getRegion());
	}
	
	/**
	 * Query whether labels should be transferred because the segmentation has changed.
	 * @return
	 */
	public synchronized boolean needsLabelTransfer() {
		return needTransfer;
	}
	
	/**
	 * Transfer labels from the segmentation that was current when labels were last assigned 
	 * to the current segmentation.
	 * @return the result for each time point that was transferred; empty if there was nothing to transfer
	 */
	public Map<Integer, LabelTransferResult> transferLabels() {
		Map<Integer, LabelTransferResult> results = new TreeMap<>();
		synchronized (this) {
			if (!needTransfer || !segmentation.isReady())
				return results;
			if (labelBoundingBoxes.isEmpty()) {
				// No labels or restored labels, nothing to transfer
				needTransfer = false;
				labelSnapshot = null;
				return results;
			}
			logger.info("Transferring labels to the new segmentation...");
			int n = segmentation.nTimepoints();
			var currentLabels = labels.getValues(Collections.emptyList());
			Map<Integer, LabelArray> newLabels = new LinkedHashMap<>();
			for (int t = 0; t < n; t++) {
				var oldBoxes = labelBoundingBoxes.get(t);
				var oldLabels = labelSnapshot == null ? null : labelSnapshot.get(t);
				if (oldBoxes == null || oldLabels == null) {
					if (currentLabels.get(t) != null && currentLabels.get(t).hasNonZero())
						logger.warn("Labels at time {} cannot be transferred without bounding boxes", t);
					newLabels.put(t, currentLabels.get(t) == null ? LabelArray.ofSize(1) : currentLabels.get(t));
					continue;
				}
				var newBoxes = ObjectBoundingBoxes.fromFeatures(features.getValue(t));
				if (newBoxes == null)
					throw new ConfigurationException("No bounding boxes available for the new segmentation at time " + t);
				var result = LabelTransfer.transfer(oldLabels, oldBoxes, newBoxes);
				if (result.hasLosses())
					logger.warn("Labels lost at time {}: {}", t, result);
				results.put(t, result);
				newLabels.put(t, result.getNewLabels());
				labelBoundingBoxes.put(t, newBoxes);
			}
			labelSnapshot = null;
			needTransfer = false;
			labels.setValues(n, newLabels);
		}
		return results;
	}
	
	void setNumLabels(int nLabels) {
		probabilityChannels.resize(nLabels);
	}
	
	void setFrozen(boolean frozen) {
		predictionImage.setFrozen(frozen);
		probabilityChannels.setFrozen(frozen);
	}
	
	void dispose() {
		segmentation.removeDirtyListener(segmentationListener);
		probabilityChannels.dispose();
		badObjectImage.dispose();
		predictionImage.dispose();
		uncachedPredictionImage.dispose();
		labelImage.dispose();
		predictor.dispose();
	}
	
	private static FloatMatrix toColumn(int[] values) {
		float[] column = new float[values.length];
		for (int i = 0; i < values.length; i++)
			column[i] = values[i];
		return FloatMatrix.column(column);
	}
	
	/**
	 * @return the segmentation image
	 */
	public ImageSlot getSegmentation() {
		return segmentation;
	}
	
	/**
	 * @return the object features
	 */
	public TimeSeriesSlot<FeatureSet> getFeatures() {
		return features;
	}
	
	/**
	 * @return the labels of each time point
	 */
	public TimeSeriesSlot<LabelArray> getLabels() {
		return labels;
	}
	
	/**
	 * @return the predictor for this lane
	 */
	public ObjectPredictor getPredictor() {
		return predictor;
	}
	
	/**
	 * @return image showing the label of each object
	 */
	public FloatImageSlot getLabelImage() {
		return labelImage;
	}
	
	/**
	 * @return cached image showing the predicted label of each object
	 */
	public ProjectionCache getPredictionImage() {
		return predictionImage;
	}
	
	/**
	 * @return image showing the predicted label of each object, computed on every request
	 */
	public FloatImageSlot getUncachedPredictionImage() {
		return uncachedPredictionImage;
	}
	
	/**
	 * @return image showing objects with non-finite features as 1
	 */
	public FloatImageSlot getBadObjectImage() {
		return badObjectImage;
	}
	
	/**
	 * @return cached images of the probability of each class
	 */
	public ProbabilityChannelImages getProbabilityChannelImages() {
		return probabilityChannels;
	}

}
