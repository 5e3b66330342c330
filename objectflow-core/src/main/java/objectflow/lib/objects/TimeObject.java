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

package objectflow.lib.objects;

import java.util.Objects;

/**
 * Identifies a single object within a lane: a time index and a 1-based object index.
 * Object index 0 is the background.
 */
public final class TimeObject implements Comparable<TimeObject> {
	
	private final int time;
	private final int objectId;
	
	private TimeObject(int time, int objectId) {
		this.time = time;
		this.objectId = objectId;
	}
	
	/**
	 * Create an identifier for an object at a given time.
	 * @param time
	 * @param objectId
	 * @return
	 */
	public static TimeObject of(int time, int objectId) {
		if (time < 0)
			throw new IllegalArgumentException("Time index must be >= 0, but was " + time);
		if (objectId < 0)
			throw new IllegalArgumentException("Object index must be >= 0, but was " + objectId);
		return new TimeObject(time, objectId);
	}
	
	/**
	 * @return the time index
	 */
	public int getTime() {
		return time;
	}
	
	/**
	 * @return the object index (0 for background)
	 */
	public int getObjectId() {
		return objectId;
	}
	
	/**
	 * @return true if this refers to the background object
	 */
	public boolean isBackground() {
		return objectId == 0;
	}

	@Override
	public int compareTo(TimeObject o) {
		int cmp = Integer.compare(time, o.time);
		return cmp != 0 ? cmp : Integer.compare(objectId, o.objectId);
	}

	@Override
	public int hashCode() {
		return Objects.hash(time, objectId);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof TimeObject))
			return false;
		TimeObject other = (TimeObject) obj;
		return time == other.time && objectId == other.objectId;
	}

	@Override
	public String toString() {
		return "(t=" + time + ", object=" + objectId + ")";
	}

}
