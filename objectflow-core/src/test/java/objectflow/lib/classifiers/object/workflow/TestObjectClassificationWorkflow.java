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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import objectflow.lib.classifiers.object.ClassifierTestUtils;
import objectflow.lib.classifiers.object.ClassifierTestUtils.RecordingBackend;
import objectflow.lib.classifiers.object.ConfigurationException;
import objectflow.lib.classifiers.object.ObjectClassifierParameters;
import objectflow.lib.graph.DefaultImageSlot;
import objectflow.lib.graph.DefaultTimeSeriesSlot;
import objectflow.lib.images.PixelType;
import objectflow.lib.images.SegmentationImage;
import objectflow.lib.measurements.FeatureSelection;
import objectflow.lib.measurements.FeatureSet;
import objectflow.lib.measurements.FloatMatrix;
import objectflow.lib.regions.ImageRegion;

@SuppressWarnings("javadoc")
public class TestObjectClassificationWorkflow {
	
	private static final int[][] SLICE = {
			{0, 1, 1, 0, 0, 0},
			{0, 1, 1, 0, 2, 2},
			{0, 0, 0, 0, 2, 2},
			{3, 3, 0, 0, 0, 0}
	};
	
	// Objects 1 and 2 swapped
	private static final int[][] SLICE_SWAPPED = {
			{0, 2, 2, 0, 0, 0},
			{0, 2, 2, 0, 1, 1},
			{0, 0, 0, 0, 1, 1},
			{3, 3, 0, 0, 0, 0}
	};
	
	private static final float[] BOX_0 = {0, 0, 0, 0};
	private static final float[] BOX_LEFT = {1, 0, 2, 1};
	private static final float[] BOX_RIGHT = {4, 1, 5, 2};
	private static final float[] BOX_BOTTOM = {0, 3, 1, 3};
	
	private static final ImageRegion FULL = ImageRegion.createFullSlice(0, new int[] {6, 4});
	
	private RecordingBackend backend;
	private ObjectClassificationWorkflow workflow;
	private DefaultImageSlot segmentation;
	private DefaultTimeSeriesSlot<FeatureSet> features;
	
	private static FeatureSet createFeatures(float... values) {
		return ClassifierTestUtils.createFeatures(values, BOX_0, BOX_LEFT, BOX_RIGHT, BOX_BOTTOM);
	}
	
	@BeforeEach
	public void setUp() {
		backend = new RecordingBackend();
		var params = new ObjectClassifierParameters()
				.set(ObjectClassifierParameters.KEY_SEED, 5)
				.set(ObjectClassifierParameters.KEY_THREADS, 2);
		workflow = new ObjectClassificationWorkflow(backend, params);
		workflow.setSelectedFeatures(FeatureSelection.of("Test", "Value"));
		
		segmentation = new DefaultImageSlot("Segmentation", SegmentationImage.create2D(SLICE));
		features = new DefaultTimeSeriesSlot<>("Features");
		features.setValues(1, Map.of(0, createFeatures(0, 1, 2, 1.2f)));
		workflow.addLane(segmentation, features);
	}
	
	@AfterEach
	public void tearDown() {
		workflow.close();
	}
	
	private void labelLeftAndRight() {
		assertEquals(1, workflow.assignObjectLabel(0, 0, new int[] {1, 0}, 1));
		assertEquals(2, workflow.assignObjectLabel(0, 0, new int[] {4, 1}, 2));
	}
	
	@Test
	public void test_assignLabels() {
		assertEquals(0, workflow.assignObjectLabel(0, 0, new int[] {0, 0}, 1));
		assertEquals(0, workflow.getNumLabels());
		assertNull(workflow.getClassifier());
		
		labelLeftAndRight();
		assertEquals(2, workflow.getNumLabels());
		
		var labelImage = workflow.getLane(0).getLabelImage().readRegion(FULL);
		assertEquals(1f, labelImage[1]);
		assertEquals(2f, labelImage[6 + 4]);
		assertEquals(0f, labelImage[3 * 6]);
		
		assertThrows(IllegalArgumentException.class, () -> workflow.assignObjectLabel(0, 0, new int[] {1}, 1));
	}
	
	@Test
	public void test_trainAndPredict() {
		labelLeftAndRight();
		
		var classifier = workflow.getClassifier();
		assertNotNull(classifier);
		assertEquals(1, backend.nCalls());
		assertEquals(List.of(5L), backend.getSeeds());
		assertArrayEquals(new int[] {1, 2}, backend.getLastLabels());
		assertSame(classifier, workflow.getClassifier());
		
		var predictions = workflow.getLane(0).getPredictor().getPredictions(List.of(0)).get(0);
		assertArrayEquals(new int[] {0, 1, 2, 1}, predictions);
		
		var image = workflow.getLane(0).getPredictionImage().readRegion(FULL);
		assertEquals(0f, image[0]);
		assertEquals(1f, image[1]);
		assertEquals(2f, image[6 + 5]);
		assertEquals(1f, image[3 * 6]);
		
		var channels = workflow.getLane(0).getProbabilityChannelImages();
		assertEquals(2, channels.size());
		assertEquals(1f, channels.get(1).readRegion(FULL)[6 + 4]);
		assertEquals(0f, channels.get(0).readRegion(FULL)[6 + 4]);
	}
	
	@Test
	public void test_retrainAfterChanges() {
		labelLeftAndRight();
		var first = workflow.getClassifier();
		
		workflow.assignObjectLabel(0, 0, new int[] {0, 3}, 1);
		var second = workflow.getClassifier();
		assertNotSame(first, second);
		assertEquals(2, backend.nCalls());
		assertArrayEquals(new int[] {1, 2, 1}, backend.getLastLabels());
		
		features.setValue(0, createFeatures(0, 2, 1, 2));
		assertNotSame(second, workflow.getClassifier());
		assertEquals(3, backend.nCalls());
		
		workflow.setSelectedFeatures(null);
		assertNull(workflow.getClassifier());
		assertTrue(workflow.getSelectedFeatures().isEmpty());
	}
	
	@Test
	public void test_labelNamesAndRemoveLabel() {
		workflow.setLabelNames(List.of("First", "Second", "Third"));
		assertEquals(3, workflow.getNumLabels());
		assertEquals(3, workflow.getLane(0).getProbabilityChannelImages().size());
		
		labelLeftAndRight();
		workflow.removeLabel(1);
		assertEquals(List.of("Second", "Third"), workflow.getLabelNames());
		assertEquals(2, workflow.getNumLabels());
		
		var labels = workflow.getLane(0).getLabels().getValue(0);
		assertEquals(0, labels.get(1));
		assertEquals(1, labels.get(2));
		
		workflow.getClassifier();
		assertArrayEquals(new int[] {1}, backend.getLastLabels());
		
		workflow.setLabelNames(Collections.emptyList());
		assertEquals(1, workflow.getNumLabels());
		assertThrows(IllegalArgumentException.class, () -> workflow.removeLabel(0));
	}
	
	@Test
	public void test_fixClassifier() {
		labelLeftAndRight();
		var classifier = workflow.getClassifier();
		
		workflow.setFixClassifier(true);
		assertTrue(workflow.isClassifierFixed());
		workflow.assignObjectLabel(0, 0, new int[] {0, 3}, 2);
		assertSame(classifier, workflow.getClassifier());
		assertEquals(1, backend.nCalls());
		
		workflow.setFixClassifier(false);
		assertNotSame(classifier, workflow.getClassifier());
		assertEquals(2, backend.nCalls());
		
		// Unfixing without changes keeps the classifier
		var current = workflow.peekClassifier();
		workflow.setFixClassifier(true);
		workflow.setFixClassifier(false);
		assertSame(current, workflow.getClassifier());
	}
	
	@Test
	public void test_freezePredictions() {
		labelLeftAndRight();
		var lane = workflow.getLane(0);
		assertEquals(1f, lane.getPredictionImage().readRegion(FULL)[3 * 6]);
		
		workflow.setFreezePredictions(true);
		assertTrue(workflow.isFreezePredictions());
		assertTrue(lane.getPredictionImage().isFrozen());
		
		features.setValue(0, createFeatures(0, 1, 2, 2));
		assertEquals(1f, lane.getPredictionImage().readRegion(FULL)[3 * 6]);
		
		workflow.setFreezePredictions(false);
		assertEquals(2f, lane.getPredictionImage().readRegion(FULL)[3 * 6]);
	}
	
	@Test
	public void test_transferLabels() {
		labelLeftAndRight();
		assertFalse(workflow.getLane(0).needsLabelTransfer());
		assertTrue(workflow.triggerTransferLabels(0).isEmpty());
		
		segmentation.setImage(SegmentationImage.create2D(SLICE_SWAPPED));
		features.setValue(0, ClassifierTestUtils.createFeatures(new float[] {0, 2, 1, 1.2f}, BOX_0, BOX_RIGHT, BOX_LEFT, BOX_BOTTOM));
		assertTrue(workflow.getLane(0).needsLabelTransfer());
		
		var results = workflow.triggerTransferLabels(0);
		assertEquals(1, results.size());
		assertFalse(results.get(0).hasLosses());
		
		var labels = workflow.getLane(0).getLabels().getValue(0);
		assertEquals(2, labels.get(1));
		assertEquals(1, labels.get(2));
		assertEquals(0, labels.get(3));
		assertFalse(workflow.getLane(0).needsLabelTransfer());
	}
	
	@Test
	public void test_lanes() {
		var features2 = new DefaultTimeSeriesSlot<FeatureSet>("Features");
		features2.setValues(1, Map.of(0, createFeatures(0, 3, 1, 1)));
		workflow.addLane(new DefaultImageSlot("Segmentation", SegmentationImage.create2D(SLICE)), features2);
		assertEquals(2, workflow.nLanes());
		
		labelLeftAndRight();
		workflow.assignObjectLabel(1, 0, new int[] {1, 0}, 3);
		assertEquals(3, workflow.getNumLabels());
		assertEquals(3, workflow.getLane(0).getProbabilityChannelImages().size());
		
		workflow.getClassifier();
		assertArrayEquals(new int[] {1, 2, 3}, backend.getLastLabels());
		
		workflow.removeLane(1);
		assertEquals(1, workflow.nLanes());
		assertEquals(2, workflow.getNumLabels());
		workflow.getClassifier();
		assertArrayEquals(new int[] {1, 2}, backend.getLastLabels());
	}
	
	@Test
	public void test_invalidSegmentation() {
		var floatImage = SegmentationImage.create(PixelType.FLOAT32, new int[] {2, 2}, new int[4]);
		assertThrows(ConfigurationException.class, () -> workflow.addLane(new DefaultImageSlot("Float", floatImage), features));
		assertThrows(ConfigurationException.class, () -> workflow.addLane(new DefaultImageSlot("Empty"), features));
		assertEquals(1, workflow.nLanes());
	}
	
	@Test
	public void test_warnings() {
		features.setValue(0, createFeatures(0, 1, Float.NaN, 1));
		labelLeftAndRight();
		assertTrue(workflow.getWarnings().getValue().isEmpty());
		
		workflow.getClassifier();
		var warning = workflow.getWarnings().getValue();
		assertFalse(warning.isEmpty());
		assertTrue(warning.getDetails().contains("Objects 2"));
		assertTrue(warning.getDetails().contains("Test: Value"));
		
		features.setValue(0, createFeatures(0, 1, 2, 1));
		workflow.getClassifier();
		assertTrue(workflow.getWarnings().getValue().isEmpty());
	}
	
	@Test
	public void test_inputProbabilities() {
		var probabilities = FloatMatrix.fromRows(
				new float[] {0, 0}, 
				new float[] {0.2f, 0.8f}, 
				new float[] {0.9f, 0.1f}, 
				new float[] {0.5f, 0.4f});
		workflow.setInputProbabilities(0, Map.of(0, probabilities));
		var cached = workflow.getLane(0).getPredictor().getCachedProbabilities(List.of(0));
		assertEquals(0.8f, cached.get(0).get(1, 1));
		assertEquals(0, backend.nCalls());
	}

}
