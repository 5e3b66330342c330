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
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

import objectflow.lib.objects.TimeObject;
import objectflow.lib.regions.ImageRegion;

/**
 * Description of the part of a slot's output that must be recomputed after an upstream change.
 * <p>
 * A region is either everything, a list of time indices, a list of (time, object) pairs 
 * or a spatial region within a single time slice.
 */
public final class DirtyRegion {
	
	/**
	 * The different ways in which a dirty region may be described.
	 */
	public static enum Type {
		/**
		 * The whole output is dirty
		 */
		ALL,
		/**
		 * Complete time slices are dirty
		 */
		TIMES,
		/**
		 * Individual objects are dirty
		 */
		OBJECTS,
		/**
		 * A spatial region of one time slice is dirty
		 */
		SPATIAL
	}
	
	private static final DirtyRegion ALL = new DirtyRegion(Type.ALL, Collections.emptyList(), Collections.emptyList(), null);
	
	private final Type type;
	private final List<Integer> times;
	private final List<TimeObject> objects;
	private final ImageRegion region;
	
	private DirtyRegion(Type type, List<Integer> times, List<TimeObject> objects, ImageRegion region) {
		this.type = type;
		this.times = times;
		this.objects = objects;
		this.region = region;
	}
	
	/**
	 * A region describing that everything is dirty.
	 * @return
	 */
	public static DirtyRegion all() {
		return ALL;
	}
	
	/**
	 * A region describing that complete time slices are dirty.
	 * An empty collection is interpreted as 'everything'.
	 * @param times
	 * @return
	 */
	public static DirtyRegion times(Collection<Integer> times) {
		if (times.isEmpty())
			return ALL;
		return new DirtyRegion(Type.TIMES, List.copyOf(new TreeSet<>(times)), Collections.emptyList(), null);
	}
	
	/**
	 * A region describing that complete time slices are dirty.
	 * @param times
	 * @return
	 */
	public static DirtyRegion times(Integer... times) {
		return times(List.of(times));
	}
	
	/**
	 * A region describing that specific objects are dirty.
	 * An empty collection is interpreted as 'everything'.
	 * @param objects
	 * @return
	 */
	public static DirtyRegion objects(Collection<TimeObject> objects) {
		if (objects.isEmpty())
			return ALL;
		return new DirtyRegion(Type.OBJECTS, Collections.emptyList(), List.copyOf(objects), null);
	}
	
	/**
	 * A region describing that a single object is dirty.
	 * @param time
	 * @param objectId
	 * @return
	 */
	public static DirtyRegion object(int time, int objectId) {
		return objects(List.of(TimeObject.of(time, objectId)));
	}
	
	/**
	 * A region describing that part of one time slice is dirty.
	 * @param region
	 * @return
	 */
	public static DirtyRegion spatial(ImageRegion region) {
		Objects.requireNonNull(region);
		return new DirtyRegion(Type.SPATIAL, List.of(region.getT()), Collections.emptyList(), region);
	}
	
	/**
	 * @return the type of this region
	 */
	public Type getType() {
		return type;
	}
	
	/**
	 * @return true if everything is dirty
	 */
	public boolean isAll() {
		return type == Type.ALL;
	}
	
	/**
	 * @return the dirty time indices for {@link Type#TIMES} (or the single time for {@link Type#SPATIAL}), otherwise an empty list
	 */
	public List<Integer> getTimes() {
		return times;
	}
	
	/**
	 * @return the dirty objects for {@link Type#OBJECTS}, otherwise an empty list
	 */
	public List<TimeObject> getObjects() {
		return objects;
	}
	
	/**
	 * @return the dirty spatial region for {@link Type#SPATIAL}, otherwise null
	 */
	public ImageRegion getRegion() {
		return region;
	}
	
	@Override
	public String toString() {
		switch (type) {
		case ALL:
			return "DirtyRegion[all]";
		case TIMES:
			return "DirtyRegion[times=" + times + "]";
		case OBJECTS:
			return "DirtyRegion[objects=" + objects + "]";
		case SPATIAL:
		default:
			return "DirtyRegion[" + region + "]";
		}
	}

	@Override
	public int hashCode() {
		return Objects.hash(type, times, objects, region);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof DirtyRegion))
			return false;
		DirtyRegion other = (DirtyRegion) obj;
		return type == other.type && times.equals(other.times) && objects.equals(other.objects)
				&& Objects.equals(region, other.region);
	}

}
