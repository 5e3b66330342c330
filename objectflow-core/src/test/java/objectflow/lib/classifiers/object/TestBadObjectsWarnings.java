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
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestBadObjectsWarnings {
	
	@Test
	public void test_empty() {
		assertTrue(BadObjectsWarnings.format(BadObjects.empty()).isEmpty());
		assertTrue(BadObjectsWarnings.format(null).isEmpty());
		assertSame(BadObjects.empty(), BadObjects.builder().build());
	}
	
	@Test
	public void test_objectsAndFeatures() {
		var bad = BadObjects.builder()
				.addObject(2, 4, 5)
				.addObject(0, 0, 7)
				.addObject(2, 0, 1)
				.addObject(0, 0, 3)
				.addObject(2, 4, 2)
				.addObject(0, 0, 3)
				.addFeature("Test: Value")
				.addFeature("Other: Area")
				.build();
		
		var warning = BadObjectsWarnings.format(bad);
		assertEquals(BadObjectsWarnings.TITLE, warning.getTitle());
		assertEquals(BadObjectsWarnings.TEXT, warning.getText());
		String expected = "The following objects had bad features:\n"
				+ "    at image index 0\n"
				+ "        Objects 3, 7\n"
				+ "    at image index 2\n"
				+ "        at time 0\n"
				+ "            Objects 1\n"
				+ "        at time 4\n"
				+ "            Objects 2, 5\n"
				+ "\n"
				+ "The following features had bad values:\n"
				+ "Other: Area\n"
				+ "Test: Value";
		assertEquals(expected, warning.getDetails());
	}
	
	@Test
	public void test_featuresOnly() {
		var bad = BadObjects.builder().addFeature("Test: Value").build();
		var warning = BadObjectsWarnings.format(bad);
		assertEquals("The following features had bad values:\nTest: Value", warning.getDetails());
	}
	
	@Test
	public void test_invalidEntries() {
		var builder = BadObjects.builder();
		assertThrows(ConfigurationException.class, () -> builder.addObject(-1, 0, 0));
		assertThrows(ConfigurationException.class, () -> builder.addObject(0, 0, -2));
		assertThrows(ConfigurationException.class, () -> builder.addFeature(""));
		assertThrows(ConfigurationException.class, () -> builder.addFeature(null));
	}

}
