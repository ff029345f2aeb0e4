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

import org.jspecify.annotations.NonNull;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Read-only hook methods for observing listener and connection lifecycle events.
 * <p>
 * Exceptions thrown by these methods never alter listener behavior; they are caught and surfaced separately via {@link #didReceiveLogEvent(LogEvent)}.
 * <p>
 * A standard threadsafe implementation can be acquired via the {@link #defaultInstance()} factory method.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface LifecycleObserver {
	/**
	 * Called after a {@link GracefulListener} accepts a connection.
	 */
	default void didAcceptConnection(@NonNull Listener<?> listener,
																	 @NonNull Connection connection) {
		// No-op by default
	}

	/**
	 * Called when a {@link GracefulListener} fails to accept a connection while still open.
	 * <p>
	 * Failures that occur because the listener was intentionally closed are not reported here.
	 */
	default void didFailToAcceptConnection(@NonNull Listener<?> listener,
																				 @NonNull Throwable throwable) {
		// No-op by default
	}

	/**
	 * Called before a {@link GracefulListener} closes its underlying listener.
	 * <p>
	 * Invoked at most once per listener, by whichever thread wins the race to close.
	 */
	default void willCloseListener(@NonNull Listener<?> listener) {
		// No-op by default
	}

	/**
	 * Called after a {@link GracefulListener} closes its underlying listener.
	 */
	default void didCloseListener(@NonNull Listener<?> listener) {
		// No-op by default
	}

	/**
	 * Called if closing the underlying listener fails.
	 */
	default void didFailToCloseListener(@NonNull Listener<?> listener,
																			@NonNull Throwable throwable) {
		// No-op by default
	}

	/**
	 * Called when a listener emits a log event.
	 */
	default void didReceiveLogEvent(@NonNull LogEvent logEvent) {
		String message = logEvent.getMessage();
		Throwable throwable = logEvent.getThrowable().orElse(null);

		if (throwable == null) {
			System.err.printf("%s::didReceiveLogEvent [%s]: %s\n", LifecycleObserver.class.getSimpleName(), logEvent.getLogEventType().name(), message);
		} else {
			StringWriter stringWriter = new StringWriter();
			PrintWriter printWriter = new PrintWriter(stringWriter);
			throwable.printStackTrace(printWriter);
			String throwableWithStackTrace = stringWriter.toString();

			System.err.printf("%s::didReceiveLogEvent [%s]: %s\n%s\n", LifecycleObserver.class.getSimpleName(), logEvent.getLogEventType().name(), message, throwableWithStackTrace);
		}
	}

	/**
	 * Acquires a threadsafe {@link LifecycleObserver} instance with sensible defaults.
	 *
	 * @return a {@code LifecycleObserver} with default settings
	 */
	@NonNull
	static LifecycleObserver defaultInstance() {
		return DefaultLifecycleObserver.defaultInstance();
	}
}
