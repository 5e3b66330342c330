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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import objectflow.lib.classifiers.object.BadObjectsWarnings;
import objectflow.lib.classifiers.object.ClassifierBackend;
import objectflow.lib.classifiers.object.ClassifierEnsemble;
import objectflow.lib.classifiers.object.MaxLabelTracker;
import objectflow.lib.classifiers.object.ObjectClassifierParameters;
import objectflow.lib.classifiers.object.ObjectTrainer;
import objectflow.lib.classifiers.object.WarningMessage;
import objectflow.lib.common.ThreadTools;
import objectflow.lib.graph.DefaultValueSlot;
import objectflow.lib.graph.DirtyEvent;
import objectflow.lib.graph.DirtyListener;
import objectflow.lib.graph.ImageSlot;
import objectflow.lib.graph.TimeSeriesSlot;
import objectflow.lib.graph.ValueCache;
import objectflow.lib.graph.ValueSlot;
import objectflow.lib.measurements.FeatureSelection;
import objectflow.lib.measurements.FeatureSet;
import objectflow.lib.measurements.FloatMatrix;
import objectflow.lib.objects.LabelArray;
import objectflow.lib.objects.labels.LabelTransferResult;

/**
 * Top-level object classification: holds the lanes, trains a shared classifier from the labels of all lanes 
 * and makes predictions for each lane.
 * <p>
 * Everything is computed lazily. The classifier is retrained on request after any change to labels, 
 * features or the feature selection, unless it has been fixed with {@link #setFixClassifier(boolean)}.
 */
public class ObjectClassificationWorkflow implements AutoCloseable {
	
	private static final Logger logger = LoggerFactory.getLogger(ObjectClassificationWorkflow.class);
	
	private final ObjectClassifierParameters params;
	private final ExecutorService pool;
	private final ObjectTrainer trainer;
	
	private final List<ClassificationLane> lanes = new CopyOnWriteArrayList<>();
	
	private final DefaultValueSlot<FeatureSelection> selectedFeatures = new DefaultValueSlot<>("SelectedFeatures", FeatureSelection.empty());
	private final DefaultValueSlot<List<String>> labelNames = new DefaultValueSlot<>("LabelNames", Collections.emptyList());
	private final DefaultValueSlot<WarningMessage> warnings = new DefaultValueSlot<>("Warnings", WarningMessage.empty());
	private final MaxLabelTracker maxLabel = new MaxLabelTracker();
	private final ValueCache<Integer> numLabels;
	private final ValueCache<ClassifierEnsemble> classifier;
	
	private boolean fixClassifier = false;
	private boolean classifierStale = false;
	private boolean freezePredictions = false;
	
	private final DirtyListener trainingInputListener = this::trainingInputDirty;
	
	/**
	 * Constructor.
	 * @param backend backend used to train classifiers
	 * @param params training parameters; these are copied, so later changes have no effect
	 */
	public ObjectClassificationWorkflow(ClassifierBackend backend, ObjectClassifierParameters params) {
		this.params = params.duplicate();
		this.pool = ThreadTools.createWorkerPool("object-classification", this.params.getNumThreads());
		this.trainer = new ObjectTrainer(backend, this.params, pool);
		this.trainer.setBadObjectsListener(bad -> warnings.setValue(BadObjectsWarnings.format(bad)));
		
		numLabels = new ValueCache<>("NumLabels", () -> Math.max(labelNames.getValue().size(), maxLabel.getValue()));
		labelNames.addDirtyListener(e -> numLabels.invalidate());
		maxLabel.addDirtyListener(e -> numLabels.invalidate());
		numLabels.addDirtyListener(e -> updateNumLabels());
		
		classifier = new ValueCache<>("Classifier", this::trainClassifier);
		selectedFeatures.addDirtyListener(trainingInputListener);
	}
	
	private ClassifierEnsemble trainClassifier() {
		List<TimeSeriesSlot<LabelArray>> labels = new ArrayList<>();
		List<TimeSeriesSlot<FeatureSet>> features = new ArrayList<>();
		for (var lane : lanes) {
			labels.add(lane.getLabels());
			features.add(lane.getFeatures());
		}
		return trainer.train(labels, features, selectedFeatures.getValue());
	}
	
	private void trainingInputDirty(DirtyEvent event) {
		synchronized (this) {
			if (fixClassifier) {
				classifierStale = true;
				return;
			}
		}
		classifier.invalidate();
	}
	
	private void updateNumLabels() {
		int n = numLabels.getValue();
		for (var lane : lanes)
			lane.setNumLabels(n);
	}
	
	/**
	 * Add a new lane.
	 * @param segmentation segmentation image, where each pixel holds an object index
	 * @param features object features for each time point
	 * @return the new lane
	 * @throws objectflow.lib.classifiers.object.ConfigurationException if the segmentation is not available or not integer-valued
	 */
	public ClassificationLane addLane(ImageSlot segmentation, TimeSeriesSlot<FeatureSet> features) {
		var lane = new ClassificationLane(segmentation, features, classifier, selectedFeatures, numLabels, pool);
		boolean frozen;
		synchronized (this) {
			frozen = freezePredictions;
		}
		lane.setFrozen(frozen);
		lane.setNumLabels(numLabels.getValue());
		lanes.add(lane);
		maxLabel.addSource(lane.getLabels());
		lane.getLabels().addDirtyListener(trainingInputListener);
		features.addDirtyListener(trainingInputListener);
		logger.debug("Lane {} added", lanes.size() - 1);
		trainingInputDirty(null);
		return lane;
	}
	
	/**
	 * Remove a lane.
	 * @param index
	 */
	public void removeLane(int index) {
		var lane = lanes.remove(index);
		lane.getLabels().removeDirtyListener(trainingInputListener);
		lane.getFeatures().removeDirtyListener(trainingInputListener);
		maxLabel.removeSource(lane.getLabels());
		lane.dispose();
		logger.debug("Lane {} removed", index);
		trainingInputDirty(null);
	}
	
	/**
	 * @return the number of lanes
	 */
	public int nLanes() {
		return lanes.size();
	}
	
	/**
	 * Get a lane.
	 * @param index
	 * @return
	 */
	public ClassificationLane getLane(int index) {
		return lanes.get(index);
	}
	
	/**
	 * Assign a label to the object at a pixel of a lane.
	 * @param laneIndex
	 * @param t
	 * @param coords
	 * @param label
	 * @return the labeled object, or 0 if the pixel belongs to the background
	 * @see ClassificationLane#assignObjectLabel(int, int[], int)
	 */
	public int assignObjectLabel(int laneIndex, int t, int[] coords, int label) {
		return lanes.get(laneIndex).assignObjectLabel(t, coords, label);
	}
	
	/**
	 * Transfer the labels of a lane after its segmentation has changed.
	 * @param laneIndex
	 * @return the transfer results for each time point; empty if nothing needed to be transferred
	 */
	public Map<Integer, LabelTransferResult> triggerTransferLabels(int laneIndex) {
		return lanes.get(laneIndex).transferLabels();
	}
	
	/**
	 * Remove a label from all lanes, decrementing all higher labels.
	 * If a name exists for the label, it is removed as well.
	 * @param label the label to remove (1-based)
	 */
	public void removeLabel(int label) {
		if (label < 1)
			throw new IllegalArgumentException("Label must be >= 1, but was " + label);
		var names = labelNames.getValue();
		if (label <= names.size()) {
			var newNames = new ArrayList<>(names);
			newNames.remove(label - 1);
			labelNames.setValue(Collections.unmodifiableList(newNames));
		}
		for (var lane : lanes)
			lane.removeLabel(label);
		logger.info("Label {} removed", label);
	}
	
	/**
	 * Set the names of the labels; the number of names determines the minimum number of classes.
	 * @param names
	 */
	public void setLabelNames(List<String> names) {
		labelNames.setValue(List.copyOf(names));
	}
	
	/**
	 * @return the label names
	 */
	public List<String> getLabelNames() {
		return labelNames.getValue();
	}
	
	/**
	 * Set the features used for classification.
	 * @param selection
	 */
	public void setSelectedFeatures(FeatureSelection selection) {
		selectedFeatures.setValue(selection == null ? FeatureSelection.empty() : selection);
	}
	
	/**
	 * @return the features used for classification
	 */
	public FeatureSelection getSelectedFeatures() {
		return selectedFeatures.getValue();
	}
	
	/**
	 * Fix the classifier, so that it is not retrained when labels or features change.
	 * When unfixing, the classifier is invalidated if anything changed while it was fixed.
	 * @param fix
	 */
	public void setFixClassifier(boolean fix) {
		boolean invalidate;
		synchronized (this) {
			fixClassifier = fix;
			invalidate = !fix && classifierStale;
			if (!fix)
				classifierStale = false;
		}
		if (invalidate)
			classifier.invalidate();
	}
	
	/**
	 * @return true if the classifier is fixed
	 */
	public synchronized boolean isClassifierFixed() {
		return fixClassifier;
	}
	
	/**
	 * Freeze the cached prediction and probability images of all lanes.
	 * @param freeze
	 */
	public void setFreezePredictions(boolean freeze) {
		synchronized (this) {
			freezePredictions = freeze;
		}
		for (var lane : lanes)
			lane.setFrozen(freeze);
	}
	
	/**
	 * @return true if predictions are frozen
	 */
	public synchronized boolean isFreezePredictions() {
		return freezePredictions;
	}
	
	/**
	 * Get the classifier, training it if necessary.
	 * @return the classifier, or null if there are no labels or no selected features
	 * @throws objectflow.lib.classifiers.object.TrainingException if training fails
	 */
	public ClassifierEnsemble getClassifier() {
		return classifier.getValue();
	}
	
	/**
	 * Get the classifier if it is already available, without training.
	 * @return the current classifier, or null
	 */
	public ClassifierEnsemble peekClassifier() {
		return classifier.peek();
	}

	/**
	 * Set the classifier directly, e.g. when restoring a saved project.
	 * @param ensemble
	 */
	public void setClassifier(ClassifierEnsemble ensemble) {
		classifier.forceValue(ensemble);
	}
	
	/**
	 * @return the classifier as a slot
	 */
	public ValueSlot<ClassifierEnsemble> getClassifierSlot() {
		return classifier;
	}
	
	/**
	 * Set externally computed probabilities for a lane.
	 * @param laneIndex
	 * @param probabilities
	 */
	public void setInputProbabilities(int laneIndex, Map<Integer, FloatMatrix> probabilities) {
		lanes.get(laneIndex).getPredictor().setInputProbabilities(probabilities);
	}
	
	/**
	 * @return the number of labels, i.e. the maximum of the number of label names and the highest label used
	 */
	public int getNumLabels() {
		return numLabels.getValue();
	}
	
	/**
	 * @return the number of labels as a slot
	 */
	public ValueSlot<Integer> getNumLabelsSlot() {
		return numLabels;
	}
	
	/**
	 * @return the warning produced by the last training
	 */
	public ValueSlot<WarningMessage> getWarnings() {
		return warnings;
	}
	
	/**
	 * Replace the current warning, e.g. when restoring a saved project.
	 * @param warning the warning, or null to clear it
	 */
	public void setWarnings(WarningMessage warning) {
		warnings.setValue(warning == null ? WarningMessage.empty() : warning);
	}
	
	/**
	 * @return the parameters used for training
	 */
	public ObjectClassifierParameters getParameters() {
		return params.duplicate();
	}

	@Override
	public void close() {
		for (var lane : lanes)
			lane.dispose();
		lanes.clear();
		pool.shutdownNow();
	}

}
