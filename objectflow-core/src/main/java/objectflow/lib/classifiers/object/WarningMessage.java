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

import java.util.Objects;

/**
 * A warning intended for the user, with a short title, a one-line text and detailed information.
 */
public class WarningMessage {
	
	private static final WarningMessage EMPTY = new WarningMessage("", "", "");
	
	private final String title;
	private final String text;
	private final String details;
	
	private WarningMessage(String title, String text, String details) {
		this.title = title;
		this.text = text;
		this.details = details;
	}
	
	/**
	 * Create a warning message.
	 * @param title
	 * @param text
	 * @param details
	 * @return
	 */
	public static WarningMessage create(String title, String text, String details) {
		return new WarningMessage(Objects.requireNonNull(title), Objects.requireNonNull(text), Objects.requireNonNull(details));
	}
	
	/**
	 * @return a message indicating that there is nothing to warn about
	 */
	public static WarningMessage empty() {
		return EMPTY;
	}
	
	/**
	 * @return the title
	 */
	public String getTitle() {
		return title;
	}
	
	/**
	 * @return the main text
	 */
	public String getText() {
		return text;
	}
	
	/**
	 * @return the details
	 */
	public String getDetails() {
		return details;
	}
	
	/**
	 * @return true if there is nothing to warn about
	 */
	public boolean isEmpty() {
		return details.isEmpty();
	}

	@Override
	public int hashCode() {
		return Objects.hash(title, text, details);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof WarningMessage))
			return false;
		WarningMessage other = (WarningMessage) obj;
		return title.equals(other.title) && text.equals(other.text) && details.equals(other.details);
	}
	
	@Override
	public String toString() {
		if (isEmpty())
			return "WarningMessage[empty]";
		return title + ": " + text + "\n" + details;
	}

}
