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

package objectflow.opencv.ml;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Random;

import org.junit.jupiter.api.Test;

import objectflow.lib.classifiers.object.ObjectClassifierParameters;
import objectflow.lib.measurements.FloatMatrix;

@SuppressWarnings("javadoc")
public class TestRTreesObjectClassifier {
	
	/**
	 * Two well-separated clusters: label 1 near (0, 0) and label 2 near (10, 10).
	 */
	static FloatMatrix createClusters(int nPerClass, int[] labelsOut) {
		var random = new Random(42);
		var matrix = FloatMatrix.zeros(nPerClass * 2, 2);
		for (int i = 0; i < nPerClass * 2; i++) {
			int label = i < nPerClass ? 1 : 2;
			float center = label == 1 ? 0 : 10;
			matrix.set(i, 0, center + (float)random.nextGaussian());
			matrix.set(i, 1, center + (float)random.nextGaussian());
			labelsOut[i] = label;
		}
		return matrix;
	}
	
	private static ObjectClassifierParameters createParameters() {
		return new ObjectClassifierParameters()
				.set(ObjectClassifierParameters.KEY_TREE_COUNT, 20);
	}
	
	@Test
	public void test_trainAndPredict() {
		int[] labels = new int[40];
		var features = createClusters(20, labels);
		var classifier = RTreesObjectClassifier.train(features, labels, createParameters(), 1);
		assertEquals(2, classifier.nClasses());
		
		double oob = classifier.getOutOfBagError();
		assertTrue(oob >= 0 && oob <= 0.5, "Unexpected out-of-bag error " + oob);
		
		var importance = classifier.getFeatureImportance();
		assertNotNull(importance);
		assertEquals(2, importance.length);
		
		var probabilities = classifier.predictProbabilities(FloatMatrix.fromRows(
				new float[] {0.2f, -0.1f},
				new float[] {9.5f, 10.3f}));
		assertEquals(2, probabilities.nRows());
		assertEquals(2, probabilities.nCols());
		for (int r = 0; r < 2; r++)
			assertEquals(1.0, probabilities.get(r, 0) + probabilities.get(r, 1), 1e-5);
		assertTrue(probabilities.get(0, 0) > 0.5);
		assertTrue(probabilities.get(1, 1) > 0.5);
	}
	
	@Test
	public void test_sameSeedSameResult() {
		int[] labels = new int[40];
		var features = createClusters(20, labels);
		var params = createParameters();
		var first = RTreesObjectClassifier.train(features, labels, params, 7);
		var second = RTreesObjectClassifier.train(features, labels, params, 7);
		var test = FloatMatrix.fromRows(new float[] {5, 5}, new float[] {4, 6}, new float[] {6, 4});
		var p1 = first.predictProbabilities(test);
		var p2 = second.predictProbabilities(test);
		for (int i = 0; i < p1.getData().length; i++)
			assertEquals(p1.getData()[i], p2.getData()[i], 1e-6);
		assertEquals(first.getOutOfBagError(), second.getOutOfBagError(), 1e-9);
	}
	
	@Test
	public void test_labelsBeyondObservedClasses() {
		// Label 1 never occurs, so column 0 is always zero
		var features = FloatMatrix.fromRows(
				new float[] {0}, new float[] {1}, new float[] {10}, new float[] {11});
		int[] labels = {2, 2, 3, 3};
		var classifier = RTreesObjectClassifier.train(features, labels, createParameters(), 3);
		assertEquals(3, classifier.nClasses());
		var probabilities = classifier.predictProbabilities(FloatMatrix.fromRows(new float[] {0.5f}, new float[] {10.5f}));
		assertEquals(3, probabilities.nCols());
		assertEquals(0f, probabilities.get(0, 0));
		assertEquals(0f, probabilities.get(1, 0));
		assertTrue(probabilities.get(0, 1) > probabilities.get(0, 2));
		assertTrue(probabilities.get(1, 2) > probabilities.get(1, 1));
	}
	
	@Test
	public void test_emptyPrediction() {
		int[] labels = new int[10];
		var classifier = RTreesObjectClassifier.train(createClusters(5, labels), labels, createParameters(), 1);
		var probabilities = classifier.predictProbabilities(FloatMatrix.zeros(0, 2));
		assertEquals(0, probabilities.nRows());
		assertEquals(2, probabilities.nCols());
	}
	
	@Test
	public void test_invalidInput() {
		var params = createParameters();
		var features = FloatMatrix.fromRows(new float[] {0}, new float[] {1});
		assertThrows(IllegalArgumentException.class, () -> RTreesObjectClassifier.train(features, new int[] {1}, params, 1));
		assertThrows(IllegalArgumentException.class, () -> RTreesObjectClassifier.train(features, new int[] {1, 0}, params, 1));
		assertThrows(IllegalArgumentException.class, () -> RTreesObjectClassifier.train(FloatMatrix.zeros(0, 1), new int[0], params, 1));
	}

}
