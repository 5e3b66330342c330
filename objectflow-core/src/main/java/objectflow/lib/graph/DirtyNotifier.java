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

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Helper class that maintains the {@link DirtyListener}s of a {@link Slot} and notifies them.
 */
public class DirtyNotifier {
	
	private final Slot source;
	private final List<DirtyListener> listeners = new CopyOnWriteArrayList<>();
	
	/**
	 * Constructor.
	 * @param source the slot that will be reported as the source of events
	 */
	public DirtyNotifier(final Slot source) {
		this.source = source;
	}
	
	/**
	 * Add a listener.
	 * @param listener
	 */
	public void addListener(DirtyListener listener) {
		listeners.add(listener);
	}
	
	/**
	 * Remove a listener.
	 * @param listener
	 */
	public void removeListener(DirtyListener listener) {
		listeners.remove(listener);
	}
	
	/**
	 * @return true if at least one listener is registered
	 */
	public boolean hasListeners() {
		return !listeners.isEmpty();
	}
	
	/**
	 * Notify all listeners that the region has become dirty.
	 * @param region
	 */
	public void fireDirty(DirtyRegion region) {
		if (listeners.isEmpty())
			return;
		var event = new DirtyEvent(source, region);
		for (var listener : listeners)
			listener.slotDirty(event);
	}

}
