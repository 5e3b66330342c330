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

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * A {@link ValueSlot} that computes its value lazily on first request and keeps it 
 * until {@link #invalidate()} is called.
 * <p>
 * Computation happens under a lock, so concurrent requests share a single computation.
 * The value can also be replaced directly with {@link #forceValue(Object)}, 
 * e.g. when restoring previously-computed state.
 *
 * @param <T>
 */
public class ValueCache<T> implements ValueSlot<T> {
	
	private final DirtyNotifier notifier = new DirtyNotifier(this);
	private final ReentrantLock lock = new ReentrantLock();
	private final String name;
	private final Supplier<? extends T> computation;
	
	// Null if no value is cached
	private volatile Holder<T> holder;
	
	/**
	 * Constructor.
	 * @param name
	 * @param computation function used to compute the value when required
	 */
	public ValueCache(String name, Supplier<? extends T> computation) {
		this.name = name;
		this.computation = Objects.requireNonNull(computation);
	}

	@Override
	public T getValue() {
		var current = holder;
		if (current != null)
			return current.value;
		lock.lock();
		try {
			current = holder;
			if (current == null) {
				current = new Holder<>(computation.get());
				holder = current;
			}
			return current.value;
		} finally {
			lock.unlock();
		}
	}
	
	/**
	 * Get the cached value without computing it.
	 * @return the value if it is available, otherwise null
	 */
	public T peek() {
		var current = holder;
		return current == null ? null : current.value;
	}
	
	/**
	 * @return true if a value is currently cached
	 */
	public boolean isValid() {
		return holder != null;
	}
	
	/**
	 * Discard any cached value and notify listeners.
	 */
	public void invalidate() {
		lock.lock();
		try {
			holder = null;
		} finally {
			lock.unlock();
		}
		notifier.fireDirty(DirtyRegion.all());
	}
	
	/**
	 * Set the cached value directly and notify listeners.
	 * @param value
	 */
	public void forceValue(T value) {
		lock.lock();
		try {
			holder = new Holder<>(value);
		} finally {
			lock.unlock();
		}
		notifier.fireDirty(DirtyRegion.all());
	}

	@Override
	public boolean isReady() {
		return true;
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
	
	
	private static class Holder<T> {
		
		private final T value;
		
		private Holder(T value) {
			this.value = value;
		}
		
	}

}
