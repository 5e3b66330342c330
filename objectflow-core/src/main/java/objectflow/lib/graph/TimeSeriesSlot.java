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

package objectflow.lib.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * A list-typed slot, with one value per time index.
 * <p>
 * Values are requested with an explicit selection of time indices, where an empty selection means 'all'.
 *
 * @param <T>
 */
public interface TimeSeriesSlot<T> extends Slot {
	
	/**
	 * Number of time points that may be requested.
	 * @return
	 */
	int nTimepoints();
	
	/**
	 * Get the values for the requested time points, computing them if necessary.
	 * This may block while upstream values are computed.
	 * 
	 * @param times the requested time indices; if empty, all time points are requested
	 * @return a map from time index to value
	 * @throws IllegalStateException if the slot is not ready
	 */
	Map<Integer, T> getValues(Collection<Integer> times);
	
	/**
	 * Get the value for a single time point.
	 * @param t
	 * @return
	 */
	default T getValue(int t) {
		return getValues(List.of(t)).get(t);
	}
	
	/**
	 * Resolve a selection of time indices, replacing an empty selection by all available indices.
	 * @param times
	 * @return a sorted list of time indices without duplicates
	 */
	default List<Integer> resolveTimes(Collection<Integer> times) {
		if (times == null || times.isEmpty()) {
			int n = nTimepoints();
			List<Integer> all = new ArrayList<>(n);
			for (int t = 0; t < n; t++)
				all.add(t);
			return all;
		}
		return new ArrayList<>(new TreeSet<>(times));
	}

}
