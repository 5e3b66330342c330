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

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Format a {@link BadObjects} record as a {@link WarningMessage}.
 */
public class BadObjectsWarnings {
	
	static final String TITLE = "Warning";
	static final String TEXT = "Encountered bad objects/features while training.";
	
	private static final String BLOCK_SEP = "\n\n";
	private static final String ITEM_SEP = "\n";
	private static final String OBJECT_SEP = ", ";
	private static final String INDENT = "    ";
	
	private BadObjectsWarnings() {
		throw new AssertionError();
	}
	
	/**
	 * Create a warning message listing the bad objects and features.
	 * @param badObjects
	 * @return the message, or {@link WarningMessage#empty()} if there is nothing to report
	 */
	public static WarningMessage format(BadObjects badObjects) {
		if (badObjects == null || badObjects.isEmpty())
			return WarningMessage.empty();
		List<String> blocks = new ArrayList<>();
		String objects = formatObjects(badObjects);
		if (!objects.isEmpty())
			blocks.add(objects);
		String features = formatFeatures(badObjects);
		if (!features.isEmpty())
			blocks.add(features);
		String details = String.join(BLOCK_SEP, blocks);
		if (details.isEmpty())
			return WarningMessage.empty();
		return WarningMessage.create(TITLE, TEXT, details);
	}
	
	private static String formatObjects(BadObjects badObjects) {
		List<String> lines = new ArrayList<>();
		for (var laneEntry : badObjects.getObjects().entrySet()) {
			var times = laneEntry.getValue();
			// Only show the time if there is more than one
			boolean needTime = times.size() > 1;
			List<String> laneLines = new ArrayList<>();
			for (var timeEntry : times.entrySet()) {
				if (timeEntry.getValue().isEmpty())
					continue;
				String ids = timeEntry.getValue().stream().map(String::valueOf).collect(Collectors.joining(OBJECT_SEP));
				String line = INDENT + INDENT + "Objects " + ids;
				if (needTime)
					line = INDENT + INDENT + "at time " + timeEntry.getKey() + ITEM_SEP + INDENT + line;
				laneLines.add(line);
			}
			if (!laneLines.isEmpty()) {
				lines.add(INDENT + "at image index " + laneEntry.getKey());
				lines.addAll(laneLines);
			}
		}
		if (lines.isEmpty())
			return "";
		return "The following objects had bad features:" + ITEM_SEP + String.join(ITEM_SEP, lines);
	}
	
	private static String formatFeatures(BadObjects badObjects) {
		if (badObjects.getFeatures().isEmpty())
			return "";
		return "The following features had bad values:" + ITEM_SEP + String.join(ITEM_SEP, badObjects.getFeatures());
	}

}
