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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestThreadTools {
	
	private ExecutorService pool;
	
	@BeforeEach
	public void setUp() {
		pool = ThreadTools.createWorkerPool("test-pool-", 2);
	}
	
	@AfterEach
	public void tearDown() {
		pool.shutdownNow();
	}
	
	@Test
	public void test_threadFactory() {
		var thread = ThreadTools.createThreadFactory("named-", true).newThread(() -> {});
		assertEquals("named-1", thread.getName());
		assertTrue(thread.isDaemon());
	}
	
	@Test
	public void test_awaitAll() throws Exception {
		List<Future<Integer>> futures = List.of(pool.submit(() -> 1), pool.submit(() -> 2), pool.submit(() -> 3));
		assertEquals(List.of(1, 2, 3), ThreadTools.awaitAll(futures));
	}
	
	@Test
	public void test_awaitAllWaitsForSlowTasks() throws Exception {
		var latch = new CountDownLatch(1);
		var slowFinished = new AtomicBoolean(false);
		Future<Integer> failing = pool.submit(() -> {
			latch.countDown();
			throw new IllegalArgumentException("Failed");
		});
		Future<Integer> slow = pool.submit(() -> {
			latch.await(5, TimeUnit.SECONDS);
			Thread.sleep(100);
			slowFinished.set(true);
			return 2;
		});
		var e = assertThrows(IllegalArgumentException.class, () -> ThreadTools.awaitAll(List.of(failing, slow)));
		assertEquals("Failed", e.getMessage());
		assertTrue(slowFinished.get());
	}
	
	@Test
	public void test_checkedExceptionsWrapped() {
		Future<Integer> failing = pool.submit(() -> {
			throw new IOException("Checked");
		});
		var e = assertThrows(IllegalStateException.class, () -> ThreadTools.awaitAll(List.of(failing)));
		assertTrue(e.getCause() instanceof IOException);
	}

}
