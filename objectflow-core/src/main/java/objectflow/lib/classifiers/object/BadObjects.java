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

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

import com.google.common.collect.ImmutableList;

/**
 * Record of objects and feature columns that contained non-finite values during training.
 * <p>
 * Objects are grouped by lane (image index), then time point.
 */
public class BadObjects {
	
	private static final BadObjects EMPTY = new BadObjects(Collections.emptySortedMap(), Collections.emptySortedSet());
	
	private final SortedMap<Integer, SortedMap<Integer, List<Integer>>> objects;
	private final Set<String> features;
	
	private BadObjects(SortedMap<Integer, SortedMap<Integer, List<Integer>>> objects, Set<String> features) {
		this.objects = objects;
		this.features = features;
	}
	
	/**
	 * @return an instance without any bad objects or features
	 */
	public static BadObjects empty() {
		return EMPTY;
	}
	
	/**
	 * @return a new builder
	 */
	public static Builder builder() {
		return new Builder();
	}
	
	/**
	 * Bad objects, grouped by lane then time.
	 * @return
	 */
	public SortedMap<Integer, SortedMap<Integer, List<Integer>>> getObjects() {
		return objects;
	}
	
	/**
	 * Names of the features with bad values, sorted.
	 * @return
	 */
	public Set<String> getFeatures() {
		return features;
	}
	
	/**
	 * @return true if there are no bad objects and no bad features
	 */
	public boolean isEmpty() {
		return objects.isEmpty() && features.isEmpty();
	}
	
	@Override
	public String toString() {
		return "BadObjects[objects=" + objects + ", features=" + features + "]";
	}
	
	
	/**
	 * Builder for {@link BadObjects}.
	 */
	public static class Builder {
		
		private final Map<Integer, Map<Integer, Set<Integer>>> objects = new TreeMap<>();
		private final Set<String> features = new TreeSet<>();
		
		private Builder() {}
		
		/**
		 * Add a bad object.
		 * @param lane
		 * @param time
		 * @param objectId
		 * @return this builder
		 * @throws ConfigurationException if any index is negative
		 */
		public Builder addObject(int lane, int time, int objectId) {
			if (lane < 0 || time < 0 || objectId < 0)
				throw new ConfigurationException(String.format("Invalid bad object (lane=%d, time=%d, object=%d)", lane, time, objectId));
			objects.computeIfAbsent(lane, k -> new TreeMap<>())
				.computeIfAbsent(time, k -> new TreeSet<>())
				.add(objectId);
			return this;
		}
		
		/**
		 * Add a bad feature name.
		 * @param name
		 * @return this builder
		 * @throws ConfigurationException if the name is null or empty
		 */
		public Builder addFeature(String name) {
			if (name == null || name.isEmpty())
				throw new ConfigurationException("Bad feature names must not be empty");
			features.add(name);
			return this;
		}
		
		/**
		 * Build the record.
		 * @return
		 */
		public BadObjects build() {
			if (objects.isEmpty() && features.isEmpty())
				return EMPTY;
			SortedMap<Integer, SortedMap<Integer, List<Integer>>> map = new TreeMap<>();
			for (var laneEntry : objects.entrySet()) {
				SortedMap<Integer, List<Integer>> times = new TreeMap<>();
				for (var timeEntry : laneEntry.getValue().entrySet())
					times.put(timeEntry.getKey(), ImmutableList.copyOf(timeEntry.getValue()));
				map.put(laneEntry.getKey(), Collections.unmodifiableSortedMap(times));
			}
			return new BadObjects(Collections.unmodifiableSortedMap(map), Collections.unmodifiableSet(new TreeSet<>(features)));
		}
		
	}

}
