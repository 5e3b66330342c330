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

package objectflow.lib.measurements;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Per-object features for a single time point, grouped by plugin and feature name.
 * <p>
 * Each feature is a {@link FloatMatrix} with one row per object (including the background row 0) 
 * and one column per feature channel.
 * The plugin {@link #DEFAULT_FEATURES_KEY} is reserved for features that are always computed, 
 * including the bounding boxes {@link #COORD_MINIMUM} and {@link #COORD_MAXIMUM}.
 */
public class FeatureSet {
	
	/**
	 * Name of the reserved plugin holding features that are never used for classification.
	 */
	public static final String DEFAULT_FEATURES_KEY = "Default features";
	
	/**
	 * Name of the feature holding the minimum coordinate of each object's bounding box.
	 */
	public static final String COORD_MINIMUM = "Coord<Minimum>";
	
	/**
	 * Name of the feature holding the (inclusive) maximum coordinate of each object's bounding box.
	 */
	public static final String COORD_MAXIMUM = "Coord<Maximum>";
	
	private final Map<String, Map<String, FloatMatrix>> features;
	
	private FeatureSet(Map<String, Map<String, FloatMatrix>> features) {
		this.features = features;
	}
	
	/**
	 * Create a new builder.
	 * @return
	 */
	public static Builder builder() {
		return new Builder();
	}
	
	/**
	 * @return plugin names, in sorted order
	 */
	public Set<String> getPlugins() {
		return features.keySet();
	}
	
	/**
	 * Get the features of a plugin.
	 * @param plugin
	 * @return a map from feature name to matrix, sorted by feature name; empty if the plugin is not found
	 */
	public Map<String, FloatMatrix> getFeatures(String plugin) {
		return features.getOrDefault(plugin, Collections.emptyMap());
	}
	
	/**
	 * Get a single feature.
	 * @param plugin
	 * @param feature
	 * @return the feature matrix, or null if it is not found
	 */
	public FloatMatrix get(String plugin, String feature) {
		return getFeatures(plugin).get(feature);
	}
	
	/**
	 * Query whether bounding boxes are available.
	 * @return
	 */
	public boolean hasBoundingBoxes() {
		return get(DEFAULT_FEATURES_KEY, COORD_MINIMUM) != null && get(DEFAULT_FEATURES_KEY, COORD_MAXIMUM) != null;
	}
	
	@Override
	public String toString() {
		return "FeatureSet" + features.keySet();
	}
	
	
	/**
	 * Builder for a {@link FeatureSet}.
	 */
	public static class Builder {
		
		private final Map<String, Map<String, FloatMatrix>> features = new TreeMap<>();
		
		private Builder() {}
		
		/**
		 * Add a feature.
		 * @param plugin
		 * @param feature
		 * @param values matrix of objects × channels
		 * @return this builder
		 */
		public Builder add(String plugin, String feature, FloatMatrix values) {
			features.computeIfAbsent(plugin, p -> new TreeMap<>()).put(feature, values);
			return this;
		}
		
		/**
		 * Add a single-channel feature.
		 * @param plugin
		 * @param feature
		 * @param values one value per object
		 * @return this builder
		 */
		public Builder add(String plugin, String feature, float... values) {
			return add(plugin, feature, FloatMatrix.column(values));
		}
		
		/**
		 * Add bounding boxes to the reserved plugin.
		 * @param minimum matrix of objects × dimensions (x, y[, z])
		 * @param maximum matrix of objects × dimensions (x, y[, z]), inclusive
		 * @return this builder
		 */
		public Builder boundingBoxes(FloatMatrix minimum, FloatMatrix maximum) {
			add(DEFAULT_FEATURES_KEY, COORD_MINIMUM, minimum);
			return add(DEFAULT_FEATURES_KEY, COORD_MAXIMUM, maximum);
		}
		
		/**
		 * Build the feature set.
		 * @return
		 */
		public FeatureSet build() {
			Map<String, Map<String, FloatMatrix>> map = new TreeMap<>();
			for (var entry : features.entrySet())
				map.put(entry.getKey(), Collections.unmodifiableMap(new TreeMap<>(entry.getValue())));
			return new FeatureSet(Collections.unmodifiableMap(map));
		}
		
	}

}
