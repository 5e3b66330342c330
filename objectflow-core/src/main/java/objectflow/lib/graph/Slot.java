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
 * Base interface for a lazily-evaluated value in a computation graph.
 * <p>
 * Values are only computed when pulled; consumers register a {@link DirtyListener} 
 * to find out when a value they have previously pulled is no longer valid.
 */
public interface Slot {
	
	/**
	 * Query whether the slot can currently provide a value.
	 * @return
	 */
	boolean isReady();
	
	/**
	 * Add a listener to be notified when the slot (or part of it) becomes dirty.
	 * @param listener
	 */
	void addDirtyListener(DirtyListener listener);
	
	/**
	 * Remove a listener previously added with {@link #addDirtyListener(DirtyListener)}.
	 * @param listener
	 */
	void removeDirtyListener(DirtyListener listener);

}
