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

import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.net.SocketAddress;
import java.nio.channels.ByteChannel;

/**
 * A bidirectional byte stream vended by a {@link Listener}.
 * <p>
 * Reads, writes and closing follow the {@link ByteChannel} contract.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface Connection extends ByteChannel {
	/**
	 * The local address this connection is bound to.
	 *
	 * @return the local address, or {@code null} if the connection is not bound
	 * @throws IOException if an I/O error occurs
	 */
	@Nullable
	SocketAddress getLocalAddress() throws IOException;

	/**
	 * The address of the peer on the other end of this connection.
	 *
	 * @return the remote address, or {@code null} if the connection is not connected
	 * @throws IOException if an I/O error occurs
	 */
	@Nullable
	SocketAddress getRemoteAddress() throws IOException;
}
