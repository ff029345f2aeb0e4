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

import javax.annotation.concurrent.NotThreadSafe;
import java.io.IOException;
import java.net.SocketAddress;
import java.nio.ByteBuffer;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A {@link Connection} vended by {@link GracefulListener} which records the last application-protocol state observed for it.
 * <p>
 * All I/O is passed straight through to the wrapped connection.
 * <p>
 * The state is not synchronized: exactly one owner - normally the server's connection-state callback - may call {@link #setLastState(ConnectionState)}.
 *
 * @param <C> the type of the wrapped connection
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public final class StatefulConnection<C extends Connection> implements Connection {
	@NonNull
	private final C connection;
	@NonNull
	private ConnectionState lastState;

	StatefulConnection(@NonNull C connection) {
		requireNonNull(connection);

		this.connection = connection;
		this.lastState = ConnectionState.NEW;
	}

	/**
	 * The most recently recorded protocol state, {@link ConnectionState#NEW} if none was recorded yet.
	 *
	 * @return the last recorded state
	 */
	@NonNull
	public ConnectionState getLastState() {
		return this.lastState;
	}

	/**
	 * Records the protocol state this connection just entered.
	 *
	 * @param lastState the state to record
	 */
	public void setLastState(@NonNull ConnectionState lastState) {
		requireNonNull(lastState);
		this.lastState = lastState;
	}

	/**
	 * The connection this instance wraps.
	 *
	 * @return the wrapped connection
	 */
	@NonNull
	public C getConnection() {
		return this.connection;
	}

	@Override
	public int read(@NonNull ByteBuffer byteBuffer) throws IOException {
		return getConnection().read(byteBuffer);
	}

	@Override
	public int write(@NonNull ByteBuffer byteBuffer) throws IOException {
		return getConnection().write(byteBuffer);
	}

	@Override
	public boolean isOpen() {
		return getConnection().isOpen();
	}

	@Override
	public void close() throws IOException {
		getConnection().close();
	}

	@Nullable
	@Override
	public SocketAddress getLocalAddress() throws IOException {
		return getConnection().getLocalAddress();
	}

	@Nullable
	@Override
	public SocketAddress getRemoteAddress() throws IOException {
		return getConnection().getRemoteAddress();
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{connection=%s, lastState=%s}", getClass().getSimpleName(), getConnection(), getLastState());
	}
}
