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

/**
 * A settable {@link ValueSlot}, used for inputs of the graph.
 *
 * @param <T>
 */
public class DefaultValueSlot<T> implements ValueSlot<T> {
	
	private final DirtyNotifier notifier = new DirtyNotifier(this);
	private final String name;
	
	private volatile boolean ready;
	private volatile T value;
	
	/**
	 * Create a slot without a value.
	 * @param name
	 */
	public DefaultValueSlot(String name) {
		this.name = name;
	}
	
	/**
	 * Create a slot with an initial value.
	 * @param name
	 * @param value
	 */
	public DefaultValueSlot(String name, T value) {
		this(name);
		this.value = value;
		this.ready = true;
	}
	
	/**
	 * Set the value and notify listeners that everything is dirty.
	 * @param value
	 */
	public void setValue(T value) {
		this.value = value;
		this.ready = true;
		notifier.fireDirty(DirtyRegion.all());
	}
	
	/**
	 * Remove the value, so that the slot is no longer ready.
	 */
	public void disconnect() {
		this.ready = false;
		this.value = null;
		notifier.fireDirty(DirtyRegion.all());
	}
	
	/**
	 * Notify listeners that the value has been modified in place.
	 * @param region
	 */
	public void setDirty(DirtyRegion region) {
		notifier.fireDirty(region);
	}

	@Override
	public T getValue() {
		if (!ready)
			throw new IllegalStateException("Slot " + name + " is not ready");
		return value;
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
