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

package objectflow.lib.measurements;

import java.util.Objects;

/**
 * Identifies a single column of a feature matrix: one channel of a feature computed by a plugin.
 */
public final class FeatureColumn {
	
	private final String plugin;
	private final String feature;
	private final int channel;
	
	/**
	 * Constructor.
	 * @param plugin
	 * @param feature
	 * @param channel
	 */
	public FeatureColumn(String plugin, String feature, int channel) {
		this.plugin = Objects.requireNonNull(plugin);
		this.feature = Objects.requireNonNull(feature);
		this.channel = channel;
	}
	
	/**
	 * @return the plugin that computed the feature
	 */
	public String getPlugin() {
		return plugin;
	}
	
	/**
	 * @return the feature name
	 */
	public String getFeature() {
		return feature;
	}
	
	/**
	 * @return the channel within the feature
	 */
	public int getChannel() {
		return channel;
	}
	
	/**
	 * Get a readable name identifying the feature, without the channel.
	 * @return
	 */
	public String getName() {
		return plugin + ": " + feature;
	}

	@Override
	public int hashCode() {
		return Objects.hash(plugin, feature, channel);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof FeatureColumn))
			return false;
		FeatureColumn other = (FeatureColumn) obj;
		return channel == other.channel && plugin.equals(other.plugin) && feature.equals(other.feature);
	}

	@Override
	public String toString() {
		return getName() + " [" + channel + "]";
	}

}
