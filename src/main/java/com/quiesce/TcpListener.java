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
import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.BindException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.net.StandardSocketOptions;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A {@link Listener} backed by a blocking {@link ServerSocketChannel}.
 * <p>
 * Closing this listener from another thread unblocks a pending {@link #accept()}, which then fails with {@link java.nio.channels.AsynchronousCloseException}.
 * Subsequent calls to {@link #accept()} fail with {@link java.nio.channels.ClosedChannelException}.
 * <p>
 * For example:
 * <pre>{@code  TcpListener tcpListener = TcpListener.withPort(8080)
 *   .host("127.0.0.1")
 *   .build();}</pre>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class TcpListener implements Listener<TcpConnection> {
	@NonNull
	private static final String DEFAULT_HOST;
	@NonNull
	private static final Integer DEFAULT_SOCKET_PENDING_CONNECTION_LIMIT;

	static {
		DEFAULT_HOST = "0.0.0.0";
		DEFAULT_SOCKET_PENDING_CONNECTION_LIMIT = 0;
	}

	@NonNull
	private final ServerSocketChannel serverSocketChannel;

	/**
	 * Acquires a builder for a {@link TcpListener} bound to the given port.
	 *
	 * @param port the port to bind to, or {@code 0} for a system-picked port
	 * @return the builder
	 */
	@NonNull
	public static Builder withPort(@NonNull Integer port) {
		requireNonNull(port);
		return new Builder(port);
	}

	/**
	 * Wraps a {@link ServerSocketChannel} that was already opened and bound elsewhere.
	 * <p>
	 * The channel must be in blocking mode.
	 *
	 * @param serverSocketChannel the channel to wrap
	 * @return a listener backed by {@code serverSocketChannel}
	 */
	@NonNull
	public static TcpListener withServerSocketChannel(@NonNull ServerSocketChannel serverSocketChannel) {
		requireNonNull(serverSocketChannel);

		if (!serverSocketChannel.isBlocking())
			throw new IllegalArgumentException(format("%s must be in blocking mode", ServerSocketChannel.class.getSimpleName()));

		return new TcpListener(serverSocketChannel);
	}

	private TcpListener(@NonNull ServerSocketChannel serverSocketChannel) {
		requireNonNull(serverSocketChannel);
		this.serverSocketChannel = serverSocketChannel;
	}

	@NonNull
	@Override
	public TcpConnection accept() throws IOException {
		SocketChannel socketChannel = getServerSocketChannel().accept();
		return TcpConnection.withSocketChannel(socketChannel);
	}

	@Override
	public void close() throws IOException {
		getServerSocketChannel().close();
	}

	@Nullable
	@Override
	public SocketAddress getLocalAddress() throws IOException {
		return getServerSocketChannel().getLocalAddress();
	}

	/**
	 * The port this listener is bound to.
	 *
	 * @return the bound port, or {@code -1} if not bound to an internet address
	 * @throws IOException if an I/O error occurs
	 */
	@NonNull
	public Integer getPort() throws IOException {
		return getLocalAddress() instanceof InetSocketAddress inetSocketAddress ? inetSocketAddress.getPort() : -1;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{serverSocketChannel=%s}", getClass().getSimpleName(), getServerSocketChannel());
	}

	@NonNull
	protected ServerSocketChannel getServerSocketChannel() {
		return this.serverSocketChannel;
	}

	/**
	 * Builder used to construct instances of {@link TcpListener}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private Integer port;
		@Nullable
		private String host;
		@Nullable
		private Integer socketPendingConnectionLimit;
		@Nullable
		private Boolean reuseAddress;

		private Builder(@NonNull Integer port) {
			requireNonNull(port);
			this.port = port;
		}

		@NonNull
		public Builder port(@NonNull Integer port) {
			requireNonNull(port);
			this.port = port;
			return this;
		}

		@NonNull
		public Builder host(@Nullable String host) {
			this.host = host;
			return this;
		}

		@NonNull
		public Builder socketPendingConnectionLimit(@Nullable Integer socketPendingConnectionLimit) {
			this.socketPendingConnectionLimit = socketPendingConnectionLimit;
			return this;
		}

		@NonNull
		public Builder reuseAddress(@Nullable Boolean reuseAddress) {
			this.reuseAddress = reuseAddress;
			return this;
		}

		/**
		 * Opens and binds the server socket.
		 *
		 * @return a bound listener
		 * @throws UncheckedIOException if the socket could not be opened or bound
		 */
		@NonNull
		public TcpListener build() {
			String host = this.host != null ? this.host : DEFAULT_HOST;
			Integer socketPendingConnectionLimit = this.socketPendingConnectionLimit != null ? this.socketPendingConnectionLimit : DEFAULT_SOCKET_PENDING_CONNECTION_LIMIT;

			if (this.port < 0 || this.port > 65_535)
				throw new IllegalArgumentException(format("Port must be in the range 0-65535 (was %d)", this.port));

			if (socketPendingConnectionLimit < 0)
				throw new IllegalArgumentException(format("Socket pending connection limit cannot be negative (was %d)", socketPendingConnectionLimit));

			ServerSocketChannel serverSocketChannel = null;

			try {
				serverSocketChannel = ServerSocketChannel.open();

				if (this.reuseAddress != null)
					serverSocketChannel.setOption(StandardSocketOptions.SO_REUSEADDR, this.reuseAddress);

				serverSocketChannel.bind(new InetSocketAddress(host, this.port), socketPendingConnectionLimit);
				return new TcpListener(serverSocketChannel);
			} catch (BindException e) {
				closeAfterFailedBuild(serverSocketChannel, e);
				throw new UncheckedIOException(format("Unable to bind to %s:%d - the address is already in use.", host, this.port), e);
			} catch (IOException e) {
				closeAfterFailedBuild(serverSocketChannel, e);
				throw new UncheckedIOException(e);
			}
		}

		private void closeAfterFailedBuild(@Nullable ServerSocketChannel serverSocketChannel,
																			 @NonNull IOException cause) {
			requireNonNull(cause);

			if (serverSocketChannel == null)
				return;

			try {
				serverSocketChannel.close();
			} catch (IOException e) {
				cause.addSuppressed(e);
			}
		}
	}
}
