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

import java.util.Arrays;
import java.util.function.IntUnaryOperator;
import java.util.stream.IntStream;

/**
 * Dense array of per-object labels for one time point, indexed by object id.
 * <p>
 * The array grows on demand whenever a label is assigned to an object with an index 
 * beyond the current size; it never shrinks. Index 0 corresponds to the background and 
 * is expected to remain unlabeled.
 */
public class LabelArray {
	
	private int[] labels;
	
	private LabelArray(int[] labels) {
		this.labels = labels;
	}
	
	/**
	 * Create an array of the given size, with all labels 0.
	 * @param size
	 * @return
	 */
	public static LabelArray ofSize(int size) {
		if (size < 0)
			throw new IllegalArgumentException("Size must be >= 0, but was " + size);
		return new LabelArray(new int[size]);
	}
	
	/**
	 * Create an array from existing labels (copied).
	 * @param labels
	 * @return
	 */
	public static LabelArray of(int... labels) {
		return new LabelArray(labels.clone());
	}
	
	/**
	 * @return the current number of entries
	 */
	public synchronized int size() {
		return labels.length;
	}
	
	/**
	 * Get the label of an object.
	 * @param objectId
	 * @return the label, or 0 if the object index is beyond the current size
	 */
	public synchronized int get(int objectId) {
		if (objectId < 0)
			throw new IllegalArgumentException("Object index must be >= 0, but was " + objectId);
		return objectId < labels.length ? labels[objectId] : 0;
	}
	
	/**
	 * Set the label of an object, growing the array if necessary.
	 * @param objectId
	 * @param label
	 */
	public synchronized void set(int objectId, int label) {
		if (objectId < 0)
			throw new IllegalArgumentException("Object index must be >= 0, but was " + objectId);
		if (label < 0)
			throw new IllegalArgumentException("Label must be >= 0, but was " + label);
		ensureSize(objectId + 1);
		labels[objectId] = label;
	}
	
	/**
	 * Grow the array (filling with 0) so that it has at least the specified size.
	 * @param size
	 */
	public synchronized void ensureSize(int size) {
		if (size > labels.length)
			labels = Arrays.copyOf(labels, Math.max(size, labels.length + labels.length / 2));
	}
	
	/**
	 * @return the maximum label value, or 0 if the array is empty
	 */
	public synchronized int max() {
		int max = 0;
		for (int v : labels)
			max = Math.max(max, v);
		return max;
	}
	
	/**
	 * @return true if at least one object has a nonzero label
	 */
	public synchronized boolean hasNonZero() {
		for (int v : labels) {
			if (v != 0)
				return true;
		}
		return false;
	}
	
	/**
	 * Get the indices of all objects with a nonzero label, in increasing order.
	 * @return
	 */
	public synchronized int[] nonZeroIndices() {
		return IntStream.range(0, labels.length).filter(i -> labels[i] != 0).toArray();
	}
	
	/**
	 * Apply a function to every label in place.
	 * @param op
	 * @return true if any label changed
	 */
	public synchronized boolean replaceAll(IntUnaryOperator op) {
		boolean changed = false;
		for (int i = 0; i < labels.length; i++) {
			int v = op.applyAsInt(labels[i]);
			if (v != labels[i]) {
				labels[i] = v;
				changed = true;
			}
		}
		return changed;
	}
	
	/**
	 * @return a copy of the labels
	 */
	public synchronized int[] toArray() {
		return labels.clone();
	}
	
	/**
	 * @return an independent copy of this array
	 */
	public synchronized LabelArray copy() {
		return new LabelArray(labels.clone());
	}
	
	@Override
	public synchronized String toString() {
		return "LabelArray" + Arrays.toString(labels);
	}

}
