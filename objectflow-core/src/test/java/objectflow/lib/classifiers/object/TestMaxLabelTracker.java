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

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import objectflow.lib.graph.DefaultTimeSeriesSlot;
import objectflow.lib.objects.LabelArray;

@SuppressWarnings("javadoc")
public class TestMaxLabelTracker {
	
	private static DefaultTimeSeriesSlot<LabelArray> createLabels(LabelArray... labels) {
		var slot = new DefaultTimeSeriesSlot<LabelArray>("Labels");
		Map<Integer, LabelArray> map = new HashMap<>();
		for (int t = 0; t < labels.length; t++)
			map.put(t, labels[t]);
		slot.setValues(labels.length, map);
		return slot;
	}
	
	@Test
	public void test_maxAcrossLanes() {
		var tracker = new MaxLabelTracker();
		assertEquals(0, tracker.getValue());
		
		var lane1 = createLabels(LabelArray.of(0, 1, 2), LabelArray.of(0, 0));
		var lane2 = createLabels(LabelArray.of(0, 4));
		tracker.addSource(lane1);
		assertEquals(2, tracker.getValue());
		tracker.addSource(lane2);
		assertEquals(4, tracker.getValue());
		
		tracker.removeSource(lane2);
		assertEquals(2, tracker.getValue());
	}
	
	@Test
	public void test_notifiesOnlyOnChange() {
		var tracker = new MaxLabelTracker();
		var count = new AtomicInteger();
		tracker.addDirtyListener(e -> count.incrementAndGet());
		
		var labels = LabelArray.of(0, 1, 0);
		var lane = createLabels(labels);
		tracker.addSource(lane);
		assertEquals(1, count.get());
		
		// Same maximum
		labels.set(2, 1);
		lane.setValue(0, labels);
		assertEquals(1, count.get());
		
		labels.set(2, 3);
		lane.setValue(0, labels);
		assertEquals(3, tracker.getValue());
		assertEquals(2, count.get());
		
		labels.replaceAll(l -> 0);
		lane.setValue(0, labels);
		assertEquals(0, tracker.getValue());
		assertEquals(3, count.get());
	}

}
