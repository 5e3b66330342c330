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
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.primitives.Ints;

import objectflow.lib.common.GeneralTools;
import objectflow.lib.common.LogTools;
import objectflow.lib.common.ThreadTools;
import objectflow.lib.graph.TimeSeriesSlot;
import objectflow.lib.measurements.FeatureColumn;
import objectflow.lib.measurements.FeatureSelection;
import objectflow.lib.measurements.FeatureSet;
import objectflow.lib.measurements.FloatMatrix;
import objectflow.lib.objects.LabelArray;

/**
 * Train a {@link ClassifierEnsemble} from the labeled objects of all lanes.
 * <p>
 * Only time points containing at least one label are used, so that features are only 
 * requested where they are needed.
 */
public class ObjectTrainer {
	
	private static final Logger logger = LoggerFactory.getLogger(ObjectTrainer.class);
	
	private final ClassifierBackend backend;
	private final ObjectClassifierParameters params;
	private final ExecutorService pool;
	
	private Consumer<BadObjects> badObjectsListener;
	
	/**
	 * Constructor.
	 * @param backend backend used to train each ensemble member
	 * @param params training parameters
	 * @param pool pool used to train ensemble members in parallel
	 */
	public ObjectTrainer(ClassifierBackend backend, ObjectClassifierParameters params, ExecutorService pool) {
		this.backend = Objects.requireNonNull(backend);
		this.params = Objects.requireNonNull(params);
		this.pool = Objects.requireNonNull(pool);
	}
	
	/**
	 * Set a consumer that receives the bad objects and features found during each training.
	 * @param listener
	 */
	public void setBadObjectsListener(Consumer<BadObjects> listener) {
		this.badObjectsListener = listener;
	}
	
	/**
	 * Train an ensemble.
	 * 
	 * @param labels labels for each lane
	 * @param features features for each lane
	 * @param selected features to use for training
	 * @return the trained ensemble, or null if no features were selected or no objects have been labeled
	 * @throws ConfigurationException if the features differ between lanes or time points
	 * @throws TrainingException if any ensemble member could not be trained
	 */
	public ClassifierEnsemble train(List<? extends TimeSeriesSlot<LabelArray>> labels, 
			List<? extends TimeSeriesSlot<FeatureSet>> features, FeatureSelection selected) {
		if (labels.size() != features.size())
			throw new IllegalArgumentException("Got labels for " + labels.size() + " lanes, but features for " + features.size());
		
		if (selected == null || selected.isEmpty()) {
			LogTools.warnOnce(logger, "No features selected - object classifier cannot be trained");
			return null;
		}
		
		List<FloatMatrix> featureBlocks = new ArrayList<>();
		List<int[]> labelBlocks = new ArrayList<>();
		List<FeatureColumn> columns = null;
		var badObjects = BadObjects.builder();
		
		for (int lane = 0; lane < labels.size(); lane++) {
			Map<Integer, LabelArray> labeled = new TreeMap<>();
			for (var entry : labels.get(lane).getValues(Collections.emptyList()).entrySet()) {
				if (entry.getValue() != null && entry.getValue().hasNonZero())
					labeled.put(entry.getKey(), entry.getValue());
			}
			if (labeled.isEmpty())
				continue;
			
			// Only request features where there are labels
			var laneFeatures = features.get(lane).getValues(labeled.keySet());
			var matrix = FeatureMatrixBuilder.build(laneFeatures, selected, labeled);
			if (matrix.nRows() == 0 || matrix.getColumns().isEmpty())
				continue;
			
			if (columns == null)
				columns = matrix.getColumns();
			else if (!columns.equals(matrix.getColumns()))
				throw new ConfigurationException("Lane " + lane + " does not have the same features as previous lanes");
			
			for (var obj : matrix.getBadObjects())
				badObjects.addObject(lane, obj.getTime(), obj.getObjectId());
			for (var name : matrix.getBadFeatureNames())
				badObjects.addFeature(name);
			
			featureBlocks.add(matrix.getData());
			labelBlocks.add(matrix.getLabels());
		}
		
		if (featureBlocks.isEmpty()) {
			logger.info("No labeled objects - object classifier not trained");
			return null;
		}
		
		var bad = badObjects.build();
		if (!bad.isEmpty())
			logger.warn("Training with sanitized values for {}", bad);
		if (badObjectsListener != null)
			badObjectsListener.accept(bad);
		
		var featureMatrix = FloatMatrix.concatenateRows(featureBlocks);
		var labelVector = Ints.concat(labelBlocks.toArray(int[][]::new));
		
		int nForests = params.getForestCount();
		long seed = params.getSeed();
		logger.info("Training {} forest(s) on matrix of shape {}x{}", nForests, featureMatrix.nRows(), featureMatrix.nCols());
		
		long startTime = System.currentTimeMillis();
		List<Future<ClassifierHandle>> futures = new ArrayList<>();
		for (int i = 0; i < nForests; i++) {
			long memberSeed = seed + i;
			futures.add(pool.submit(() -> backend.train(featureMatrix, labelVector, memberSeed)));
		}
		List<ClassifierHandle> members;
		try {
			members = ThreadTools.awaitAll(futures);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new TrainingException("Interrupted while training object classifier", e);
		} catch (RuntimeException e) {
			logger.error("Unable to train object classifier: {}", e.getLocalizedMessage(), e);
			throw new TrainingException("Unable to train object classifier", e);
		}
		
		var ensemble = new ClassifierEnsemble(members, columns);
		long endTime = System.currentTimeMillis();
		logger.info("Training finished in {} s, out of bag error: {}", 
				GeneralTools.formatNumber((endTime - startTime)/1000.0, 2),
				GeneralTools.formatNumber(ensemble.getMeanOutOfBagError(), 4));
		return ensemble;
	}

}
