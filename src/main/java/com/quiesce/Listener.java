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
import org.jspecify.annotations.Nullable;

import java.io.Closeable;
import java.io.IOException;
import java.net.SocketAddress;

/**
 * Contract for a source of inbound {@link Connection} instances, for example a bound server socket.
 * <p>
 * Implementations are not required to make {@link #close()} idempotent - wrap in a {@link GracefulListener} if you need that guarantee.
 *
 * @param <C> the type of connection this listener vends
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface Listener<C extends Connection> extends Closeable {
	/**
	 * Blocks until the next inbound connection is available.
	 *
	 * @return the newly-accepted connection
	 * @throws IOException if the connection could not be accepted, including because this listener was closed
	 */
	@NonNull
	C accept() throws IOException;

	/**
	 * The local address this listener is bound to.
	 *
	 * @return the local address, or {@code null} if not bound
	 * @throws IOException if an I/O error occurs
	 */
	@Nullable
	SocketAddress getLocalAddress() throws IOException;
}
