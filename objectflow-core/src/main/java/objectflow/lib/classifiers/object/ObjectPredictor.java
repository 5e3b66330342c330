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

package objectflow.lib.classifiers.object;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import objectflow.lib.common.GeneralTools;
import objectflow.lib.graph.DirtyEvent;
import objectflow.lib.graph.DirtyListener;
import objectflow.lib.graph.DirtyNotifier;
import objectflow.lib.graph.DirtyRegion;
import objectflow.lib.graph.TimeSeriesSlot;
import objectflow.lib.graph.ValueSlot;
import objectflow.lib.measurements.FeatureSelection;
import objectflow.lib.measurements.FeatureSet;
import objectflow.lib.measurements.FloatMatrix;

/**
 * Predicts and caches class probabilities for the objects of one lane.
 * <p>
 * Probabilities for a time point are computed on first request by averaging the outputs of all 
 * ensemble members, and cached until any input becomes dirty; the whole cache is then discarded.
 * Object 0 (the background) always has probability 0 for every class and prediction 0.
 * <p>
 * A request for an empty collection of time points is a request for all time points.
 */
public class ObjectPredictor implements DirtyListener {
	
	private static final Logger logger = LoggerFactory.getLogger(ObjectPredictor.class);
	
	private final ValueSlot<ClassifierEnsemble> classifier;
	private final TimeSeriesSlot<FeatureSet> features;
	private final ValueSlot<FeatureSelection> selected;
	private final ValueSlot<Integer> labelsCount;
	private final ExecutorService pool;
	
	private final ReentrantLock lock = new ReentrantLock();
	private final Map<Integer, FloatMatrix> probabilityCache = new HashMap<>();
	private final Map<Integer, int[]> badObjectCache = new HashMap<>();
	// Incremented whenever the cache is cleared or replaced; guarded by the lock
	private long generation = 0;
	
	private final List<OutputSlot<?>> outputs = new CopyOnWriteArrayList<>();
	private final OutputSlot<FloatMatrix> probabilitiesSlot;
	private final OutputSlot<int[]> predictionsSlot;
	private final OutputSlot<FloatMatrix> cachedProbabilitiesSlot;
	private final OutputSlot<int[]> badObjectsSlot;
	
	/**
	 * Constructor.
	 * @param classifier the trained ensemble; the value may be null if there is no classifier
	 * @param features features of this lane
	 * @param selected the features used by the classifier
	 * @param labelsCount the number of labels
	 * @param pool pool used to run ensemble members in parallel
	 */
	public ObjectPredictor(ValueSlot<ClassifierEnsemble> classifier, TimeSeriesSlot<FeatureSet> features, 
			ValueSlot<FeatureSelection> selected, ValueSlot<Integer> labelsCount, ExecutorService pool) {
		this.classifier = Objects.requireNonNull(classifier);
		this.features = Objects.requireNonNull(features);
		this.selected = Objects.requireNonNull(selected);
		this.labelsCount = Objects.requireNonNull(labelsCount);
		this.pool = Objects.requireNonNull(pool);
		
		probabilitiesSlot = createOutput("Probabilities", this::getProbabilities);
		predictionsSlot = createOutput("Predictions", this::getPredictions);
		cachedProbabilitiesSlot = createOutput("CachedProbabilities", this::getCachedProbabilities);
		badObjectsSlot = createOutput("BadObjects", this::getBadObjects);
		
		classifier.addDirtyListener(this);
		features.addDirtyListener(this);
		selected.addDirtyListener(this);
		labelsCount.addDirtyListener(this);
	}
	
	/**
	 * Stop listening to the inputs. The predictor should not be used afterwards.
	 */
	public void dispose() {
		classifier.removeDirtyListener(this);
		features.removeDirtyListener(this);
		selected.removeDirtyListener(this);
		labelsCount.removeDirtyListener(this);
	}
	
	/**
	 * @return the number of time points of the lane
	 */
	public int nTimepoints() {
		return features.nTimepoints();
	}
	
	/**
	 * Get class probabilities, computing them if necessary.
	 * <p>
	 * The returned matrices are shared with the cache and must not be modified.
	 * 
	 * @param times
	 * @return a map from time to a matrix of objects × classes; matrices are empty if there is no classifier
	 */
	public Map<Integer, FloatMatrix> getProbabilities(Collection<Integer> times) {
		return readCached(features.resolveTimes(times), probabilityCache::get, t -> FloatMatrix.zeros(0, 0));
	}
	
	/**
	 * Get predicted labels: 1 + index of the most probable class, and 0 for the background.
	 * @param times
	 * @return a map from time to one label per object; arrays are empty if there is no classifier
	 */
	public Map<Integer, int[]> getPredictions(Collection<Integer> times) {
		Map<Integer, int[]> output = new LinkedHashMap<>();
		for (var entry : getProbabilities(times).entrySet())
			output.put(entry.getKey(), argmaxLabels(entry.getValue()));
		return output;
	}
	
	/**
	 * Get the probabilities of a single class.
	 * @param classIndex zero-based column index, i.e. label - 1
	 * @param times
	 * @return a map from time to a single-column matrix; if the class is not available, the column contains zeros
	 */
	public Map<Integer, FloatMatrix> getProbabilityChannel(int classIndex, Collection<Integer> times) {
		if (classIndex < 0)
			throw new IllegalArgumentException("Class index must be >= 0, but was " + classIndex);
		Map<Integer, FloatMatrix> output = new LinkedHashMap<>();
		for (var entry : getProbabilities(times).entrySet()) {
			var probabilities = entry.getValue();
			if (classIndex < probabilities.nCols())
				output.put(entry.getKey(), FloatMatrix.column(probabilities.getColumn(classIndex)));
			else
				output.put(entry.getKey(), FloatMatrix.zeros(probabilities.nRows(), 1));
		}
		return output;
	}
	
	/**
	 * Get flags indicating which objects had non-finite features during prediction.
	 * @param times
	 * @return a map from time to one value per object, 1 for bad objects and 0 otherwise
	 */
	public Map<Integer, int[]> getBadObjects(Collection<Integer> times) {
		return readCached(features.resolveTimes(times), t -> {
			var flags = badObjectCache.get(t);
			if (flags == null)
				return new int[probabilityCache.get(t).nRows()];
			return flags.clone();
		}, t -> new int[0]);
	}
	
	/**
	 * Get any probabilities that are already available, without computing anything.
	 * @param times
	 * @return a map containing only the requested time points that are cached
	 */
	public Map<Integer, FloatMatrix> getCachedProbabilities(Collection<Integer> times) {
		var timeList = features.resolveTimes(times);
		Map<Integer, FloatMatrix> output = new LinkedHashMap<>();
		lock.lock();
		try {
			for (int t : timeList) {
				var probabilities = probabilityCache.get(t);
				if (probabilities != null)
					output.put(t, probabilities);
			}
		} finally {
			lock.unlock();
		}
		return output;
	}
	
	/**
	 * Replace the cache by externally supplied probabilities, e.g. restored from a saved project.
	 * @param probabilities map from time to a matrix of objects × classes
	 */
	public void setInputProbabilities(Map<Integer, FloatMatrix> probabilities) {
		lock.lock();
		try {
			probabilityCache.clear();
			badObjectCache.clear();
			generation++;
			for (var entry : probabilities.entrySet())
				probabilityCache.put(entry.getKey(), entry.getValue().copy());
		} finally {
			lock.unlock();
		}
		logger.debug("Probabilities set for {} time point(s)", probabilities.size());
		fireDirty();
	}
	
	/**
	 * Discard all cached probabilities and notify listeners.
	 */
	public void invalidate() {
		lock.lock();
		try {
			probabilityCache.clear();
			badObjectCache.clear();
			generation++;
		} finally {
			lock.unlock();
		}
		fireDirty();
	}

	@Override
	public void slotDirty(DirtyEvent event) {
		invalidate();
	}
	
	private void fireDirty() {
		for (var output : outputs)
			output.notifier.fireDirty(DirtyRegion.all());
	}
	
	/**
	 * Read cached values for the requested time points, computing missing entries with the current ensemble.
	 * <p>
	 * The ensemble is requested outside the lock, since it may need to be trained. 
	 * If the cache is cleared in the meantime, the ensemble is requested again so that 
	 * results from a discarded ensemble are never stored.
	 * 
	 * @param times resolved time points
	 * @param reader function to read the output for a time point, called while holding the lock
	 * @param empty function to create the output for a time point if there is no classifier
	 */
	private <T> Map<Integer, T> readCached(List<Integer> times, Function<Integer, T> reader, Function<Integer, T> empty) {
		while (true) {
			long requestGeneration;
			lock.lock();
			try {
				requestGeneration = generation;
			} finally {
				lock.unlock();
			}
			
			var ensemble = classifier.getValue();
			if (ensemble == null)
				return emptyResults(times, empty);
			
			lock.lock();
			try {
				if (requestGeneration != generation) {
					logger.debug("Predictions invalidated while requesting the classifier, trying again");
					continue;
				}
				ensureCached(times, ensemble);
				Map<Integer, T> output = new LinkedHashMap<>();
				for (int t : times)
					output.put(t, reader.apply(t));
				return output;
			} finally {
				lock.unlock();
			}
		}
	}
	
	/**
	 * Compute probabilities for all requested time points that are not yet cached.
	 * Must be called while holding the lock.
	 */
	private void ensureCached(List<Integer> times, ClassifierEnsemble ensemble) {
		List<Integer> missing = new ArrayList<>();
		for (int t : times) {
			if (!probabilityCache.containsKey(t))
				missing.add(t);
		}
		if (missing.isEmpty())
			return;
		
		long startTime = System.currentTimeMillis();
		var selection = selected.getValue();
		var featureMap = features.getValues(missing);
		for (int t : missing) {
			var matrix = FeatureMatrixBuilder.build(Collections.singletonMap(t, featureMap.get(t)), selection);
			if (!ensemble.getColumns().isEmpty() && !ensemble.getColumns().equals(matrix.getColumns()))
				throw new ConfigurationException("Features at time " + t + " do not match the features used to train the classifier");
			
			int[] flags = new int[matrix.nRows()];
			for (int r : matrix.getBadRows())
				flags[r] = 1;
			
			FloatMatrix probabilities;
			try {
				probabilities = ensemble.predictProbabilities(matrix.getData(), pool);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				throw new IllegalStateException("Interrupted while predicting objects at time " + t, e);
			}
			// Background probability is always zero
			if (probabilities.nRows() > 0) {
				for (int c = 0; c < probabilities.nCols(); c++)
					probabilities.set(0, c, 0f);
			}
			probabilityCache.put(t, probabilities);
			badObjectCache.put(t, flags);
		}
		long endTime = System.currentTimeMillis();
		logger.debug("Predicted {} time point(s) in {} ms", missing.size(), GeneralTools.formatNumber(endTime - startTime, 1));
	}
	
	static int[] argmaxLabels(FloatMatrix probabilities) {
		int n = probabilities.nRows();
		int[] labels = new int[n];
		if (probabilities.nCols() == 0)
			return labels;
		for (int r = 1; r < n; r++) {
			int best = 0;
			float bestValue = probabilities.get(r, 0);
			for (int c = 1; c < probabilities.nCols(); c++) {
				float v = probabilities.get(r, c);
				if (v > bestValue) {
					bestValue = v;
					best = c;
				}
			}
			labels[r] = best + 1;
		}
		return labels;
	}
	
	private static <T> Map<Integer, T> emptyResults(List<Integer> times, Function<Integer, T> fun) {
		Map<Integer, T> output = new LinkedHashMap<>();
		for (int t : times)
			output.put(t, fun.apply(t));
		return output;
	}
	
	/**
	 * @return a slot view of {@link #getProbabilities(Collection)}
	 */
	public TimeSeriesSlot<FloatMatrix> getProbabilitiesSlot() {
		return probabilitiesSlot;
	}
	
	/**
	 * @return a slot view of {@link #getPredictions(Collection)}
	 */
	public TimeSeriesSlot<int[]> getPredictionsSlot() {
		return predictionsSlot;
	}
	
	/**
	 * @return a slot view of {@link #getCachedProbabilities(Collection)}
	 */
	public TimeSeriesSlot<FloatMatrix> getCachedProbabilitiesSlot() {
		return cachedProbabilitiesSlot;
	}
	
	/**
	 * @return a slot view of {@link #getBadObjects(Collection)}
	 */
	public TimeSeriesSlot<int[]> getBadObjectsSlot() {
		return badObjectsSlot;
	}
	
	/**
	 * Create a slot view of {@link #getProbabilityChannel(int, Collection)}.
	 * @param classIndex
	 * @return
	 */
	public TimeSeriesSlot<FloatMatrix> createProbabilityChannelSlot(int classIndex) {
		return createOutput("ProbabilityChannel" + classIndex, times -> getProbabilityChannel(classIndex, times));
	}
	
	/**
	 * Release a slot created with {@link #createProbabilityChannelSlot(int)}, so that it is no longer notified.
	 * @param slot
	 */
	public void releaseSlot(TimeSeriesSlot<?> slot) {
		outputs.remove(slot);
	}
	
	private <T> OutputSlot<T> createOutput(String name, Function<Collection<Integer>, Map<Integer, T>> fun) {
		var slot = new OutputSlot<>(name, fun);
		outputs.add(slot);
		return slot;
	}
	
	
	private class OutputSlot<T> implements TimeSeriesSlot<T> {
		
		private final String name;
		private final DirtyNotifier notifier = new DirtyNotifier(this);
		private final Function<Collection<Integer>, Map<Integer, T>> fun;
		
		private OutputSlot(String name, Function<Collection<Integer>, Map<Integer, T>> fun) {
			this.name = name;
			this.fun = fun;
		}

		@Override
		public boolean isReady() {
			return features.isReady() && classifier.isReady() && selected.isReady();
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
		public int nTimepoints() {
			return features.nTimepoints();
		}

		@Override
		public Map<Integer, T> getValues(Collection<Integer> times) {
			return fun.apply(times);
		}
		
		@Override
		public String toString() {
			return name;
		}
		
	}

}
