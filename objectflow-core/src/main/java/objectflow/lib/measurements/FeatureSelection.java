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

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * The (plugin, feature name) pairs selected for classification.
 */
public class FeatureSelection {
	
	private static final FeatureSelection EMPTY = new FeatureSelection(Collections.emptyMap());
	
	private final Map<String, Set<String>> selected;
	
	private FeatureSelection(Map<String, Set<String>> selected) {
		this.selected = selected;
	}
	
	/**
	 * @return a selection containing no features
	 */
	public static FeatureSelection empty() {
		return EMPTY;
	}
	
	/**
	 * Create a selection from a map of plugin names to feature names.
	 * @param selected
	 * @return
	 */
	public static FeatureSelection of(Map<String, ? extends Collection<String>> selected) {
		Map<String, Set<String>> map = new TreeMap<>();
		for (var entry : selected.entrySet()) {
			if (!entry.getValue().isEmpty())
				map.put(entry.getKey(), Collections.unmodifiableSet(new TreeSet<>(entry.getValue())));
		}
		return new FeatureSelection(Collections.unmodifiableMap(map));
	}
	
	/**
	 * Create a selection of features from a single plugin.
	 * @param plugin
	 * @param features
	 * @return
	 */
	public static FeatureSelection of(String plugin, String... features) {
		return of(Map.of(plugin, Set.of(features)));
	}
	
	/**
	 * @return true if nothing is selected
	 */
	public boolean isEmpty() {
		return selected.isEmpty();
	}
	
	/**
	 * Query whether any feature of a plugin is selected.
	 * @param plugin
	 * @return
	 */
	public boolean containsPlugin(String plugin) {
		return selected.containsKey(plugin);
	}
	
	/**
	 * Query whether a feature is selected.
	 * @param plugin
	 * @param feature
	 * @return
	 */
	public boolean contains(String plugin, String feature) {
		var features = selected.get(plugin);
		return features != null && features.contains(feature);
	}
	
	/**
	 * @return an unmodifiable map from plugin to selected feature names, both sorted
	 */
	public Map<String, Set<String>> asMap() {
		return selected;
	}
	
	@Override
	public int hashCode() {
		return selected.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof FeatureSelection))
			return false;
		return selected.equals(((FeatureSelection)obj).selected);
	}

	@Override
	public String toString() {
		return "FeatureSelection" + selected;
	}

}
