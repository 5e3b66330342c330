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

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import objectflow.lib.plugins.parameters.ParameterList;

/**
 * Parameters controlling the training of object classifiers.
 * <p>
 * Values are stored in a {@link ParameterList}, so that they can be updated from 
 * key/value pairs (e.g. read from a properties file or command line).
 */
public class ObjectClassifierParameters {
	
	/**
	 * Number of independently trained forests in the ensemble
	 */
	public static final String KEY_FOREST_COUNT = "forestCount";
	/**
	 * Number of trees per forest
	 */
	public static final String KEY_TREE_COUNT = "treeCount";
	/**
	 * Maximum tree depth, 0 for unlimited
	 */
	public static final String KEY_MAX_DEPTH = "maxDepth";
	/**
	 * Minimum number of samples required to split a node
	 */
	public static final String KEY_MIN_SAMPLE_COUNT = "minSampleCount";
	/**
	 * Number of features considered at each split, 0 for the square root of the number of features
	 */
	public static final String KEY_ACTIVE_VAR_COUNT = "activeVarCount";
	/**
	 * Base seed for random number generation
	 */
	public static final String KEY_SEED = "seed";
	/**
	 * Number of worker threads
	 */
	public static final String KEY_THREADS = "nThreads";
	
	private final ParameterList params;
	
	/**
	 * Create parameters with default values.
	 */
	public ObjectClassifierParameters() {
		params = new ParameterList()
				.addIntParameter(KEY_FOREST_COUNT, "Number of forests", 1, 1, 1024, 
						"Number of random forests trained in parallel; their probabilities are averaged")
				.addIntParameter(KEY_TREE_COUNT, "Number of trees", 100, 1, 100_000, 
						"Number of trees in each random forest")
				.addIntParameter(KEY_MAX_DEPTH, "Maximum tree depth", 0, 0, 1000, 
						"Maximum depth of each tree (0 for unlimited)")
				.addIntParameter(KEY_MIN_SAMPLE_COUNT, "Minimum samples per node", 1, 1, Integer.MAX_VALUE, 
						"Minimum number of samples required to split a node")
				.addIntParameter(KEY_ACTIVE_VAR_COUNT, "Active features", 0, 0, Integer.MAX_VALUE, 
						"Number of features tested at each split (0 for the square root of the number of features)")
				.addIntParameter(KEY_SEED, "Random seed", 1012, 
						"Seed for training; forest i uses seed + i")
				.addIntParameter(KEY_THREADS, "Number of threads", Runtime.getRuntime().availableProcessors(), 1, 1024, 
						"Number of threads used for training and prediction");
	}
	
	private ObjectClassifierParameters(ParameterList params) {
		this.params = params;
	}
	
	/**
	 * @return the number of forests in the ensemble
	 */
	public int getForestCount() {
		return params.getIntParameterValue(KEY_FOREST_COUNT);
	}
	
	/**
	 * @return the number of trees per forest
	 */
	public int getTreeCount() {
		return params.getIntParameterValue(KEY_TREE_COUNT);
	}
	
	/**
	 * @return the maximum tree depth, or 0 if unlimited
	 */
	public int getMaxDepth() {
		return params.getIntParameterValue(KEY_MAX_DEPTH);
	}
	
	/**
	 * @return the minimum number of samples needed to split a node
	 */
	public int getMinSampleCount() {
		return params.getIntParameterValue(KEY_MIN_SAMPLE_COUNT);
	}
	
	/**
	 * @return the number of features considered at each split, or 0 for the default
	 */
	public int getActiveVarCount() {
		return params.getIntParameterValue(KEY_ACTIVE_VAR_COUNT);
	}
	
	/**
	 * @return the base seed
	 */
	public int getSeed() {
		return params.getIntParameterValue(KEY_SEED);
	}
	
	/**
	 * @return the number of worker threads
	 */
	public int getNumThreads() {
		return params.getIntParameterValue(KEY_THREADS);
	}
	
	/**
	 * Set an integer parameter.
	 * @param key
	 * @param value
	 * @return this instance
	 * @throws IllegalArgumentException if the key is unknown or the value is out of range
	 */
	public ObjectClassifierParameters set(String key, int value) {
		params.setIntParameterValue(key, value);
		return this;
	}
	
	/**
	 * Update parameters from string values.
	 * @param values
	 * @param locale locale used to parse numbers
	 * @return true if all values could be set
	 */
	public boolean update(Map<String, String> values, Locale locale) {
		return ParameterList.updateParameterList(params, values, locale);
	}
	
	/**
	 * @return the current values (or defaults) of all parameters
	 */
	public Map<String, Object> toMap() {
		return new LinkedHashMap<>(params.getKeyValueParameters());
	}
	
	/**
	 * @return the underlying parameter list
	 */
	public ParameterList getParameterList() {
		return params;
	}
	
	/**
	 * @return an independent copy of these parameters
	 */
	public ObjectClassifierParameters duplicate() {
		return new ObjectClassifierParameters(params.duplicate());
	}
	
	@Override
	public String toString() {
		return "ObjectClassifierParameters" + params.getKeyValueParameters();
	}

}
