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
 * Application-protocol states a server may record against a {@link StatefulConnection}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @see StatefulConnection#setLastState(ConnectionState)
 */
public enum ConnectionState {
	/**
	 * The connection was just accepted and no protocol state has been recorded yet.
	 */
	NEW,
	/**
	 * The connection has read at least one byte of a request and is being serviced.
	 */
	ACTIVE,
	/**
	 * The connection finished servicing a request and is waiting for the next one.
	 */
	IDLE,
	/**
	 * The connection was taken over by application code and is no longer managed by the server.
	 */
	HIJACKED,
	/**
	 * The connection has been closed.
	 */
	CLOSED
}
