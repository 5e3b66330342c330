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
 * An event class for passing on information about which part of a slot has become dirty.
 */
public class DirtyEvent {
	
	private final Slot source;
	private final DirtyRegion region;
	
	/**
	 * Constructor.
	 * @param source the slot that has become dirty
	 * @param region the dirty region
	 */
	public DirtyEvent(final Slot source, final DirtyRegion region) {
		this.source = source;
		this.region = region;
	}
	
	/**
	 * @return the slot that has become dirty
	 */
	public Slot getSource() {
		return source;
	}
	
	/**
	 * @return the part of the slot that has become dirty
	 */
	public DirtyRegion getRegion() {
		return region;
	}
	
	@Override
	public String toString() {
		return "Dirty event: Source=" + source + ", Region=" + region;
	}

}
