/*
 * Copyright 2022-2025 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.quiesce;

import com.quiesce.TestSupport.FakeConnection;
import com.quiesce.TestSupport.RecordingLifecycleObserver;
import com.quiesce.TestSupport.ScriptedListener;
import com.quiesce.exception.ClosedAfterShutdownException;
import org.jspecify.annotations.NonNull;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.net.SocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/*
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class GracefulListenerTests {
	@Test
	public void accept_wraps_connection_with_new_state() throws Exception {
		FakeConnection c1 = new FakeConnection("c1");
		ScriptedListener scriptedListener = new ScriptedListener().thenYield(c1);
		GracefulListener<FakeConnection> listener = GracefulListener.withListener(scriptedListener)
				.lifecycleObserver(new RecordingLifecycleObserver())
				.build();

		StatefulConnection<FakeConnection> connection = listener.accept();

		Assertions.assertSame(c1, connection.getConnection());
		Assertions.assertEquals(ConnectionState.NEW, connection.getLastState());
		Assertions.assertTrue(listener.isOpen());
	}

	@Test
	public void accept_failure_while_open_is_rethrown_unchanged() {
		IOException failure = new IOException("too many open files");
		ScriptedListener scriptedListener = new ScriptedListener().thenFail(failure);
		RecordingLifecycleObserver observer = new RecordingLifecycleObserver();
		GracefulListener<FakeConnection> listener = GracefulListener.withListener(scriptedListener)
				.lifecycleObserver(observer)
				.build();

		IOException thrown = Assertions.assertThrows(IOException.class, listener::accept);

		Assertions.assertSame(failure, thrown);
		Assertions.assertFalse(thrown instanceof ClosedAfterShutdownException);
		Assertions.assertEquals(List.of(failure), observer.getAcceptFailures());
	}

	@Test
	public void accept_failure_after_close_is_classified_as_shutdown() throws Exception {
		IOException failure = new IOException("socket closed");
		ScriptedListener scriptedListener = new ScriptedListener().failAcceptsAfterCloseWith(failure);
		RecordingLifecycleObserver observer = new RecordingLifecycleObserver();
		GracefulListener<FakeConnection> listener = GracefulListener.withListener(scriptedListener)
				.lifecycleObserver(observer)
				.build();

		listener.close();

		ClosedAfterShutdownException thrown = Assertions.assertThrows(ClosedAfterShutdownException.class, listener::accept);

		Assertions.assertSame(failure, thrown.getCause());
		Assertions.assertEquals("socket closed", thrown.getMessage());
		Assertions.assertTrue(observer.getAcceptFailures().isEmpty(), "Shutdown-classified failures should not be reported as accept failures");

		// Every later failure is classified the same way
		ClosedAfterShutdownException thrownAgain = Assertions.assertThrows(ClosedAfterShutdownException.class, listener::accept);
		Assertions.assertSame(failure, thrownAgain.getCause());
	}

	@Test
	public void repeated_close_closes_underlying_listener_once() throws Exception {
		ScriptedListener scriptedListener = new ScriptedListener();
		RecordingLifecycleObserver observer = new RecordingLifecycleObserver();
		GracefulListener<FakeConnection> listener = GracefulListener.withListener(scriptedListener)
				.lifecycleObserver(observer)
				.build();

		listener.close();
		listener.close();
		listener.close();

		Assertions.assertEquals(1, scriptedListener.getCloseCount());
		Assertions.assertEquals(1, observer.getWillCloseCount());
		Assertions.assertEquals(1, observer.getDidCloseCount());
		Assertions.assertFalse(listener.isOpen());
	}

	@Test
	@Timeout(10)
	public void concurrent_close_closes_underlying_listener_once() throws Exception {
		int threadCount = 32;
		ScriptedListener scriptedListener = new ScriptedListener();
		GracefulListener<FakeConnection> listener = GracefulListener.withListener(scriptedListener)
				.lifecycleObserver(new RecordingLifecycleObserver())
				.build();

		ExecutorService executorService = Executors.newFixedThreadPool(threadCount);

		try {
			CountDownLatch ready = new CountDownLatch(threadCount);
			CountDownLatch go = new CountDownLatch(1);
			List<Future<?>> futures = new ArrayList<>();

			for (int i = 0; i < threadCount; i++) {
				futures.add(executorService.submit(() -> {
					ready.countDown();
					go.await();
					listener.close();
					return null;
				}));
			}

			Assertions.assertTrue(ready.await(5, TimeUnit.SECONDS));
			go.countDown();

			// Future::get rethrows anything close() threw
			for (Future<?> future : futures)
				future.get(5, TimeUnit.SECONDS);
		} finally {
			executorService.shutdownNow();
		}

		Assertions.assertEquals(1, scriptedListener.getCloseCount());
		Assertions.assertFalse(listener.isOpen());
	}

	@Test
	public void close_failure_is_only_seen_by_first_caller() throws Exception {
		IOException failure = new IOException("close failed");
		ScriptedListener scriptedListener = new ScriptedListener().failCloseWith(failure);
		RecordingLifecycleObserver observer = new RecordingLifecycleObserver();
		GracefulListener<FakeConnection> listener = GracefulListener.withListener(scriptedListener)
				.lifecycleObserver(observer)
				.build();

		IOException thrown = Assertions.assertThrows(IOException.class, listener::close);
		Assertions.assertSame(failure, thrown);

		Assertions.assertDoesNotThrow(listener::close);
		Assertions.assertEquals(1, scriptedListener.getCloseCount());
		Assertions.assertEquals(List.of(failure), observer.getCloseFailures());
		Assertions.assertEquals(0, observer.getDidCloseCount());
		Assertions.assertFalse(listener.isOpen(), "A failed close still leaves the listener closed");
	}

	@Test
	@Timeout(10)
	public void close_from_another_thread_unblocks_pending_accept_as_shutdown() throws Exception {
		FakeConnection c1 = new FakeConnection("c1");
		FakeConnection c2 = new FakeConnection("c2");
		IOException failure = new IOException("listener closed");

		ScriptedListener scriptedListener = new ScriptedListener()
				.thenYield(c1)
				.thenYield(c2)
				.failAcceptsAfterCloseWith(failure);

		RecordingLifecycleObserver observer = new RecordingLifecycleObserver();
		GracefulListener<FakeConnection> listener = GracefulListener.withListener(scriptedListener)
				.lifecycleObserver(observer)
				.build();

		Assertions.assertSame(c1, listener.accept().getConnection());
		Assertions.assertSame(c2, listener.accept().getConnection());

		ExecutorService executorService = Executors.newFixedThreadPool(2);

		try {
			// Nothing else is scripted, so this blocks until close() runs
			Future<StatefulConnection<FakeConnection>> pendingAccept = executorService.submit(listener::accept);

			Future<?> closer = executorService.submit(() -> {
				listener.close();
				return null;
			});

			closer.get(5, TimeUnit.SECONDS);
			Assertions.assertEquals(1, scriptedListener.getCloseCount());

			ExecutionException executionException =
					Assertions.assertThrows(ExecutionException.class, () -> pendingAccept.get(5, TimeUnit.SECONDS));

			Assertions.assertTrue(executionException.getCause() instanceof ClosedAfterShutdownException,
					"Expected a shutdown-classified failure but got " + executionException.getCause());
			Assertions.assertSame(failure, executionException.getCause().getCause());

			// A second close is a no-op
			Assertions.assertDoesNotThrow(listener::close);
			Assertions.assertEquals(1, scriptedListener.getCloseCount());
		} finally {
			executorService.shutdownNow();
		}

		Assertions.assertEquals(2, observer.getAcceptedConnections().size());
		Assertions.assertTrue(observer.getAcceptFailures().isEmpty());
	}

	@Test
	public void lifecycle_observer_failures_do_not_affect_accept_or_close() throws Exception {
		FakeConnection c1 = new FakeConnection("c1");
		ScriptedListener scriptedListener = new ScriptedListener().thenYield(c1);
		List<LogEvent> logEvents = new ArrayList<>();

		GracefulListener<FakeConnection> listener = GracefulListener.withListener(scriptedListener)
				.lifecycleObserver(new LifecycleObserver() {
					@Override
					public void didAcceptConnection(@NonNull Listener<?> observedListener, @NonNull Connection connection) {
						throw new IllegalStateException("observer blew up");
					}

					@Override
					public void willCloseListener(@NonNull Listener<?> observedListener) {
						throw new IllegalStateException("observer blew up");
					}

					@Override
					public void didReceiveLogEvent(@NonNull LogEvent logEvent) {
						logEvents.add(logEvent);
					}
				})
				.build();

		Assertions.assertSame(c1, listener.accept().getConnection());
		Assertions.assertDoesNotThrow(listener::close);
		Assertions.assertEquals(1, scriptedListener.getCloseCount());

		Assertions.assertEquals(2, logEvents.size());
		Assertions.assertEquals(LogEventType.LIFECYCLE_OBSERVER_DID_ACCEPT_CONNECTION_FAILED, logEvents.get(0).getLogEventType());
		Assertions.assertEquals(LogEventType.LIFECYCLE_OBSERVER_WILL_CLOSE_LISTENER_FAILED, logEvents.get(1).getLogEventType());
		Assertions.assertTrue(logEvents.get(0).getThrowable().isPresent());
		Assertions.assertSame(listener, logEvents.get(0).getListener().orElse(null));
	}

	@Test
	public void failing_accept_and_close_hooks_are_logged_by_hook() throws Exception {
		IOException acceptFailure = new IOException("too many open files");
		ScriptedListener scriptedListener = new ScriptedListener().thenFail(acceptFailure);
		List<LogEvent> logEvents = new ArrayList<>();

		GracefulListener<FakeConnection> listener = GracefulListener.withListener(scriptedListener)
				.lifecycleObserver(new LifecycleObserver() {
					@Override
					public void didFailToAcceptConnection(@NonNull Listener<?> observedListener, @NonNull Throwable throwable) {
						throw new IllegalStateException("observer blew up");
					}

					@Override
					public void didCloseListener(@NonNull Listener<?> observedListener) {
						throw new IllegalStateException("observer blew up");
					}

					@Override
					public void didReceiveLogEvent(@NonNull LogEvent logEvent) {
						logEvents.add(logEvent);
					}
				})
				.build();

		IOException thrown = Assertions.assertThrows(IOException.class, listener::accept);
		Assertions.assertSame(acceptFailure, thrown);

		Assertions.assertDoesNotThrow(listener::close);
		Assertions.assertEquals(1, scriptedListener.getCloseCount());

		Assertions.assertEquals(2, logEvents.size());
		Assertions.assertEquals(LogEventType.LIFECYCLE_OBSERVER_DID_FAIL_TO_ACCEPT_CONNECTION_FAILED, logEvents.get(0).getLogEventType());
		Assertions.assertEquals(LogEventType.LIFECYCLE_OBSERVER_DID_CLOSE_LISTENER_FAILED, logEvents.get(1).getLogEventType());
	}

	@Test
	public void failing_close_failure_hook_is_logged_and_close_failure_still_thrown() {
		IOException closeFailure = new IOException("close failed");
		ScriptedListener scriptedListener = new ScriptedListener().failCloseWith(closeFailure);
		List<LogEvent> logEvents = new ArrayList<>();

		GracefulListener<FakeConnection> listener = GracefulListener.withListener(scriptedListener)
				.lifecycleObserver(new LifecycleObserver() {
					@Override
					public void didFailToCloseListener(@NonNull Listener<?> observedListener, @NonNull Throwable throwable) {
						throw new IllegalStateException("observer blew up");
					}

					@Override
					public void didReceiveLogEvent(@NonNull LogEvent logEvent) {
						logEvents.add(logEvent);
					}
				})
				.build();

		IOException thrown = Assertions.assertThrows(IOException.class, listener::close);
		Assertions.assertSame(closeFailure, thrown);

		Assertions.assertEquals(1, logEvents.size());
		Assertions.assertEquals(LogEventType.LIFECYCLE_OBSERVER_DID_FAIL_TO_CLOSE_LISTENER_FAILED, logEvents.get(0).getLogEventType());
		Assertions.assertSame(listener, logEvents.get(0).getListener().orElse(null));
	}

	@Test
	public void runtime_exceptions_from_accept_propagate_unchanged() {
		IllegalStateException failure = new IllegalStateException("not bound");

		Listener<FakeConnection> brokenListener = new Listener<>() {
			@NonNull
			@Override
			public FakeConnection accept() {
				throw failure;
			}

			@Override
			public void close() {
				// Nothing to close
			}

			@Override
			public SocketAddress getLocalAddress() {
				return null;
			}
		};

		GracefulListener<FakeConnection> listener = GracefulListener.wrap(brokenListener);

		IllegalStateException thrown = Assertions.assertThrows(IllegalStateException.class, listener::accept);
		Assertions.assertSame(failure, thrown);
	}

	@Test
	public void local_address_is_delegated() throws Exception {
		ScriptedListener scriptedListener = new ScriptedListener();
		GracefulListener<FakeConnection> listener = GracefulListener.wrap(scriptedListener);

		Assertions.assertEquals(scriptedListener.getLocalAddress(), listener.getLocalAddress());
		Assertions.assertSame(scriptedListener, listener.getListener());
	}
}
