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

package objectflow.lib.objects.labels;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import objectflow.lib.objects.LabelArray;

/**
 * Result of transferring labels from an old segmentation to a new one.
 * <p>
 * Lost labels are reported by the centroid (x, y, z) of the affected object's bounding box, 
 * with z = 0 for 2D data.
 */
public class LabelTransferResult {
	
	/**
	 * Key for old objects that did not overlap any new object.
	 */
	public static final String LOST_FULL = "full";
	
	/**
	 * Key for old objects that overlapped several new objects, and whose label was passed to only one.
	 */
	public static final String LOST_PARTIAL = "partial";
	
	/**
	 * Key for new objects claimed by several old objects, which remain unlabeled.
	 */
	public static final String LOST_CONFLICT = "conflict";
	
	private final LabelArray newLabels;
	private final Map<String, List<double[]>> oldLabelsLost;
	private final Map<String, List<double[]>> newLabelsLost;
	
	LabelTransferResult(LabelArray newLabels, List<double[]> full, List<double[]> partial, List<double[]> conflict) {
		this.newLabels = newLabels;
		this.oldLabelsLost = Map.of(
				LOST_FULL, Collections.unmodifiableList(full),
				LOST_PARTIAL, Collections.unmodifiableList(partial));
		this.newLabelsLost = Map.of(
				LOST_CONFLICT, Collections.unmodifiableList(conflict));
	}
	
	/**
	 * Labels for the objects of the new segmentation.
	 * @return
	 */
	public LabelArray getNewLabels() {
		return newLabels;
	}
	
	/**
	 * Centroids of old objects whose label was lost, under the keys {@link #LOST_FULL} and {@link #LOST_PARTIAL}.
	 * Labeled objects without a bounding box are lost fully, with a NaN centroid.
	 * @return
	 */
	public Map<String, List<double[]>> getOldLabelsLost() {
		return oldLabelsLost;
	}
	
	/**
	 * Centroids of new objects that could not be labeled, under the key {@link #LOST_CONFLICT}.
	 * @return
	 */
	public Map<String, List<double[]>> getNewLabelsLost() {
		return newLabelsLost;
	}
	
	/**
	 * Query whether any label was lost or in conflict.
	 * @return
	 */
	public boolean hasLosses() {
		return !oldLabelsLost.get(LOST_FULL).isEmpty() ||
				!oldLabelsLost.get(LOST_PARTIAL).isEmpty() ||
				!newLabelsLost.get(LOST_CONFLICT).isEmpty();
	}
	
	@Override
	public String toString() {
		return String.format("LabelTransferResult[full=%d, partial=%d, conflict=%d]",
				oldLabelsLost.get(LOST_FULL).size(),
				oldLabelsLost.get(LOST_PARTIAL).size(),
				newLabelsLost.get(LOST_CONFLICT).size());
	}

}
