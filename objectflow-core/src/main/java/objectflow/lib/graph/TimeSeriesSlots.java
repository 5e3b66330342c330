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
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Static methods for working with {@link TimeSeriesSlot}s.
 */
public class TimeSeriesSlots {
	
	private TimeSeriesSlots() {
		throw new AssertionError();
	}
	
	/**
	 * Create a view of a slot where each value is transformed on request.
	 * Dirty notifications of the source are passed on unchanged.
	 * 
	 * @param <S>
	 * @param <T>
	 * @param source
	 * @param fun
	 * @return
	 */
	public static <S, T> TimeSeriesSlot<T> map(TimeSeriesSlot<S> source, Function<? super S, ? extends T> fun) {
		return new MappedTimeSeriesSlot<>(source, fun);
	}
	

	private static class MappedTimeSeriesSlot<S, T> implements TimeSeriesSlot<T> {
		
		private final TimeSeriesSlot<S> source;
		private final Function<? super S, ? extends T> fun;
		
		private MappedTimeSeriesSlot(TimeSeriesSlot<S> source, Function<? super S, ? extends T> fun) {
			this.source = source;
			this.fun = fun;
		}

		@Override
		public boolean isReady() {
			return source.isReady();
		}

		@Override
		public void addDirtyListener(DirtyListener listener) {
			source.addDirtyListener(listener);
		}

		@Override
		public void removeDirtyListener(DirtyListener listener) {
			source.removeDirtyListener(listener);
		}

		@Override
		public int nTimepoints() {
			return source.nTimepoints();
		}

		@Override
		public Map<Integer, T> getValues(Collection<Integer> times) {
			var input = source.getValues(times);
			Map<Integer, T> output = new LinkedHashMap<>();
			for (var entry : input.entrySet())
				output.put(entry.getKey(), entry.getValue() == null ? null : fun.apply(entry.getValue()));
			return output;
		}
		
	}

}
