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

package objectflow.lib.common;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Helpers for the worker pools used to train and apply ensemble members.
 * <p>
 * Threads get a name prefix, which helps with debugging (e.g. using visualvm).
 */
public class ThreadTools {
	
	/**
	 * Create a named thread factory with a specified priority.
	 * 
	 * @param prefix
	 * @param daemon
	 * @param priority
	 * @return
	 */
	public static ThreadFactory createThreadFactory(String prefix, boolean daemon, int priority) {
		return new SimpleThreadFactory(prefix, daemon, priority);
	}
	
	/**
	 * Create a named thread factory with {@code Thread.NORM_PRIORITY}.
	 * 
	 * @param prefix
	 * @param daemon
	 * @return
	 */
	public static ThreadFactory createThreadFactory(String prefix, boolean daemon) {
		return createThreadFactory(prefix, daemon, Thread.NORM_PRIORITY);
	}
	
	/**
	 * Create a bounded pool of daemon worker threads.
	 * Daemon threads mean the pool does not keep the JVM alive on teardown; tasks that are running are never interrupted.
	 * 
	 * @param prefix thread name prefix
	 * @param nThreads maximum number of threads; values &lt; 1 are replaced by the number of available processors
	 * @return
	 */
	public static ExecutorService createWorkerPool(String prefix, int nThreads) {
		if (nThreads < 1)
			nThreads = Runtime.getRuntime().availableProcessors();
		return Executors.newFixedThreadPool(nThreads, createThreadFactory(prefix, true));
	}
	
	/**
	 * Wait for every future to complete, returning the results in order.
	 * <p>
	 * All futures are awaited even if one fails, so that no task is still running when this method returns. 
	 * The first failure is then rethrown, unwrapped from its {@link ExecutionException} if it is unchecked.
	 * 
	 * @param <T>
	 * @param futures
	 * @return the results, in the same order as the futures
	 * @throws InterruptedException if the calling thread was interrupted while waiting
	 */
	public static <T> List<T> awaitAll(List<? extends Future<? extends T>> futures) throws InterruptedException {
		List<T> results = new ArrayList<>(futures.size());
		Throwable firstError = null;
		for (var future : futures) {
			try {
				results.add(future.get());
			} catch (ExecutionException e) {
				if (firstError == null)
					firstError = e.getCause() == null ? e : e.getCause();
				else
					firstError.addSuppressed(e.getCause() == null ? e : e.getCause());
				results.add(null);
			}
		}
		if (firstError instanceof RuntimeException)
			throw (RuntimeException)firstError;
		if (firstError instanceof Error)
			throw (Error)firstError;
		if (firstError != null)
			throw new IllegalStateException(firstError.getLocalizedMessage(), firstError);
		return results;
	}
	
	
	static class SimpleThreadFactory implements ThreadFactory {
		
		private final AtomicInteger threadNumber = new AtomicInteger(1);
		private String prefix;
		private boolean daemon;
		private int priority;
	
		SimpleThreadFactory(final String prefix, final boolean daemon, final int priority) {
			this.prefix = prefix;
			this.daemon = daemon;
			this.priority = Math.max(Thread.MIN_PRIORITY, Math.min(Thread.MAX_PRIORITY, priority));
		}
	
		@Override
		public Thread newThread(Runnable r) {
			String name = prefix + threadNumber.getAndIncrement();
			Thread t = new Thread(r, name);
			t.setDaemon(daemon);
			if (t.getPriority() != priority)
				t.setPriority(priority);
			return t;
		}
		
	}
	
}
