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

package objectflow.lib.classifiers.object;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import objectflow.lib.graph.DirtyEvent;
import objectflow.lib.graph.DirtyListener;
import objectflow.lib.graph.DirtyNotifier;
import objectflow.lib.graph.DirtyRegion;
import objectflow.lib.graph.TimeSeriesSlot;
import objectflow.lib.graph.ValueSlot;
import objectflow.lib.objects.LabelArray;

/**
 * Tracks the maximum label assigned in any lane.
 * <p>
 * The maximum is recomputed whenever the labels of any lane change; 
 * listeners are only notified when the maximum itself changes.
 */
public class MaxLabelTracker implements ValueSlot<Integer>, DirtyListener {
	
	private static final Logger logger = LoggerFactory.getLogger(MaxLabelTracker.class);
	
	private final DirtyNotifier notifier = new DirtyNotifier(this);
	private final List<TimeSeriesSlot<LabelArray>> sources = new CopyOnWriteArrayList<>();
	
	private volatile int maxLabel = 0;
	
	/**
	 * Add the labels of a lane.
	 * @param labels
	 */
	public void addSource(TimeSeriesSlot<LabelArray> labels) {
		sources.add(labels);
		labels.addDirtyListener(this);
		update();
	}
	
	/**
	 * Remove the labels of a lane.
	 * @param labels
	 */
	public void removeSource(TimeSeriesSlot<LabelArray> labels) {
		labels.removeDirtyListener(this);
		sources.remove(labels);
		update();
	}
	
	/**
	 * Recompute the maximum label, notifying listeners if it has changed.
	 */
	public void update() {
		int max = 0;
		for (var source : sources) {
			if (!source.isReady())
				continue;
			for (var labels : source.getValues(Collections.emptyList()).values()) {
				if (labels != null)
					max = Math.max(max, labels.max());
			}
		}
		int previous;
		synchronized (this) {
			previous = maxLabel;
			maxLabel = max;
		}
		if (previous != max) {
			logger.debug("Maximum label changed from {} to {}", previous, max);
			notifier.fireDirty(DirtyRegion.all());
		}
	}

	@Override
	public void slotDirty(DirtyEvent event) {
		update();
	}

	@Override
	public Integer getValue() {
		return maxLabel;
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

}
