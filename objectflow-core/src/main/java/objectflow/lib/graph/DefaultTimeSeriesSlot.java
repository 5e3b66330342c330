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

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * A settable {@link TimeSeriesSlot}, holding one value per time point.
 *
 * @param <T>
 */
public class DefaultTimeSeriesSlot<T> implements TimeSeriesSlot<T> {
	
	private final DirtyNotifier notifier = new DirtyNotifier(this);
	private final String name;
	private final Map<Integer, T> values = new TreeMap<>();
	
	private volatile int nTimepoints = 0;
	private volatile boolean ready = false;
	
	/**
	 * Constructor.
	 * @param name
	 */
	public DefaultTimeSeriesSlot(String name) {
		this.name = name;
	}
	
	/**
	 * Replace all values, notifying listeners that everything is dirty.
	 * @param nTimepoints number of time points
	 * @param values values per time point; missing entries are returned as null
	 */
	public void setValues(int nTimepoints, Map<Integer, ? extends T> values) {
		synchronized (this.values) {
			this.values.clear();
			this.values.putAll(values);
			this.nTimepoints = nTimepoints;
			this.ready = true;
		}
		notifier.fireDirty(DirtyRegion.all());
	}
	
	/**
	 * Set the value for one time point, notifying listeners that the time point is dirty.
	 * @param t
	 * @param value
	 */
	public void setValue(int t, T value) {
		if (t < 0 || t >= nTimepoints)
			throw new IllegalArgumentException("Time index " + t + " out of range for " + nTimepoints + " time points");
		synchronized (values) {
			values.put(t, value);
		}
		notifier.fireDirty(DirtyRegion.times(t));
	}
	
	/**
	 * Notify listeners that (part of) a value has been modified in place.
	 * @param region
	 */
	public void setDirty(DirtyRegion region) {
		notifier.fireDirty(region);
	}

	@Override
	public int nTimepoints() {
		return nTimepoints;
	}

	@Override
	public Map<Integer, T> getValues(Collection<Integer> times) {
		if (!ready)
			throw new IllegalStateException("Slot " + name + " is not ready");
		Map<Integer, T> output = new LinkedHashMap<>();
		synchronized (values) {
			for (int t : resolveTimes(times))
				output.put(t, values.get(t));
		}
		return output;
	}

	@Override
	public boolean isReady() {
		return ready;
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
	public String toString() {
		return name;
	}

}
