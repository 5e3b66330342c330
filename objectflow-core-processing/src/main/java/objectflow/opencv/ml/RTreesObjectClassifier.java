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

import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.bytedeco.javacpp.indexer.IntIndexer;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_ml;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.TermCriteria;
import org.bytedeco.opencv.opencv_ml.RTrees;
import org.bytedeco.opencv.opencv_ml.TrainData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.annotations.JsonAdapter;

import objectflow.lib.classifiers.object.ClassifierHandle;
import objectflow.lib.classifiers.object.ObjectClassifierParameters;
import objectflow.lib.measurements.FloatMatrix;
import objectflow.opencv.io.OpenCVTypeAdapters;
import objectflow.opencv.tools.OpenCVTools;

/**
 * A single random forest, wrapping an OpenCV {@link RTrees} model.
 * <p>
 * Probabilities are estimated from the proportion of tree votes for each class.
 */
public class RTreesObjectClassifier implements ClassifierHandle {
	
	private static final Logger logger = LoggerFactory.getLogger(RTreesObjectClassifier.class);
	
	@JsonAdapter(OpenCVTypeAdapters.OpenCVTypeAdaptorFactory.class)
	private RTrees model;
	
	private int nClasses;
	private double outOfBagError = Double.NaN;
	private double[] featureImportance;
	
	private transient ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
	
	private RTreesObjectClassifier() {}
	
	private RTreesObjectClassifier(RTrees model, int nClasses) {
		this.model = model;
		this.nClasses = nClasses;
	}
	
	/**
	 * Train a new random forest.
	 * @param features matrix of objects × features
	 * @param labels label of each row, all &gt; 0
	 * @param params training parameters
	 * @param seed seed for OpenCV's random number generator (in the calling thread)
	 * @return the trained classifier
	 */
	public static RTreesObjectClassifier train(FloatMatrix features, int[] labels, ObjectClassifierParameters params, long seed) {
		if (features.nRows() != labels.length)
			throw new IllegalArgumentException("Number of rows (" + features.nRows() + ") does not match number of labels (" + labels.length + ")");
		if (features.nRows() == 0)
			throw new IllegalArgumentException("Cannot train a classifier without samples");
		int nClasses = 0;
		for (int label : labels) {
			if (label <= 0)
				throw new IllegalArgumentException("Labels must be > 0, but found " + label);
			nClasses = Math.max(nClasses, label);
		}
		
		var trees = RTrees.create();
		int maxDepth = params.getMaxDepth();
		trees.setMaxDepth(maxDepth <= 0 ? Integer.MAX_VALUE : maxDepth);
		trees.setMinSampleCount(Math.max(1, params.getMinSampleCount()));
		trees.setActiveVarCount(params.getActiveVarCount());
		trees.setCVFolds(0);
		trees.setUseSurrogates(false); // Not implemented, throws an exception
		trees.setCalculateVarImportance(true);
		trees.setTermCriteria(new TermCriteria(TermCriteria.MAX_ITER, params.getTreeCount(), 0));
		
		var classifier = new RTreesObjectClassifier(trees, nClasses);
		classifier.train(features, labels, (int)seed);
		return classifier;
	}
	
	private void train(FloatMatrix features, int[] labels, int seed) {
		lock.writeLock().lock();
		try (Mat samples = OpenCVTools.toMat(features);
				Mat targets = OpenCVTools.toColumnMat(labels)) {
			long startTime = System.currentTimeMillis();
			// The RNG is thread-local
			opencv_core.setRNGSeed(seed);
			var trainData = TrainData.create(samples, opencv_ml.ROW_SAMPLE, targets);
			model.train(trainData, 0);
			outOfBagError = model.getOOBError();
			try (Mat importance = model.getVarImportance()) {
				featureImportance = importance.empty() ? null : OpenCVTools.extractDoubles(importance);
			}
			logger.debug("Trained random forest with {} samples, {} features and seed {} in {} ms", 
					samples.rows(), samples.cols(), seed, System.currentTimeMillis() - startTime);
		} finally {
			lock.writeLock().unlock();
		}
	}

	@Override
	public FloatMatrix predictProbabilities(FloatMatrix features) {
		int nSamples = features.nRows();
		FloatMatrix probabilities = FloatMatrix.zeros(nSamples, nClasses);
		if (nSamples == 0)
			return probabilities;
		lock.readLock().lock();
		try (Mat samples = OpenCVTools.toMat(features);
				Mat votes = new Mat()) {
			model.getVotes(samples, votes, RTrees.PREDICT_AUTO);
			
			// First row contains the class labels, subsequent rows the vote counts per sample
			int nVoteClasses = votes.cols();
			try (IntIndexer indexer = votes.createIndexer()) {
				int[] orderedClasses = new int[nVoteClasses];
				for (int c = 0; c < nVoteClasses; c++)
					orderedClasses[c] = indexer.get(0, c);
				for (int i = 0; i < nSamples; i++) {
					double sum = 0;
					for (int c = 0; c < nVoteClasses; c++)
						sum += indexer.get(i + 1, c);
					if (sum == 0)
						continue;
					for (int c = 0; c < nVoteClasses; c++) {
						int col = orderedClasses[c] - 1;
						if (col >= 0 && col < nClasses)
							probabilities.set(i, col, (float)(indexer.get(i + 1, c) / sum));
					}
				}
			}
		} finally {
			lock.readLock().unlock();
		}
		return probabilities;
	}

	@Override
	public double getOutOfBagError() {
		return outOfBagError;
	}

	@Override
	public int nClasses() {
		return nClasses;
	}
	
	@Override
	public double[] getFeatureImportance() {
		return featureImportance == null ? null : featureImportance.clone();
	}
	
	@Override
	public String toString() {
		return String.format("Random trees (%d classes, oob error=%s)", nClasses, outOfBagError);
	}

}
