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

/**
 * Kinds of {@link LogEvent} instances that listeners can produce.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public enum LogEventType {
	/**
	 * Indicates that a configuration option was requested but isn't supported in the current runtime/environment; behavior may differ (perhaps ignored or degraded).
	 */
	CONFIGURATION_UNSUPPORTED,
	/**
	 * Indicates that a socket option could not be applied to a newly-accepted connection.
	 */
	SOCKET_OPTION_FAILED,
	/**
	 * Indicates {@link LifecycleObserver#didAcceptConnection(Listener, Connection)} threw an exception.
	 */
	LIFECYCLE_OBSERVER_DID_ACCEPT_CONNECTION_FAILED,
	/**
	 * Indicates {@link LifecycleObserver#didFailToAcceptConnection(Listener, Throwable)} threw an exception.
	 */
	LIFECYCLE_OBSERVER_DID_FAIL_TO_ACCEPT_CONNECTION_FAILED,
	/**
	 * Indicates {@link LifecycleObserver#willCloseListener(Listener)} threw an exception.
	 */
	LIFECYCLE_OBSERVER_WILL_CLOSE_LISTENER_FAILED,
	/**
	 * Indicates {@link LifecycleObserver#didCloseListener(Listener)} threw an exception.
	 */
	LIFECYCLE_OBSERVER_DID_CLOSE_LISTENER_FAILED,
	/**
	 * Indicates {@link LifecycleObserver#didFailToCloseListener(Listener, Throwable)} threw an exception.
	 */
	LIFECYCLE_OBSERVER_DID_FAIL_TO_CLOSE_LISTENER_FAILED
}
