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

import jdk.net.ExtendedSocketOptions;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.net.SocketAddress;
import java.net.StandardSocketOptions;
import java.nio.ByteBuffer;
import java.nio.channels.SocketChannel;
import java.time.Duration;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A {@link KeepAliveConnection} backed by a blocking {@link SocketChannel}.
 * <p>
 * Keep-alive probe timing is applied via {@link ExtendedSocketOptions#TCP_KEEPIDLE} and {@link ExtendedSocketOptions#TCP_KEEPINTERVAL} where the platform supports them.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class TcpConnection implements KeepAliveConnection {
	@NonNull
	private final SocketChannel socketChannel;

	/**
	 * Wraps a connected {@link SocketChannel}.
	 *
	 * @param socketChannel the channel to wrap
	 * @return a connection backed by {@code socketChannel}
	 */
	@NonNull
	public static TcpConnection withSocketChannel(@NonNull SocketChannel socketChannel) {
		requireNonNull(socketChannel);
		return new TcpConnection(socketChannel);
	}

	private TcpConnection(@NonNull SocketChannel socketChannel) {
		requireNonNull(socketChannel);
		this.socketChannel = socketChannel;
	}

	@Override
	public void setKeepAlive(@NonNull Boolean keepAlive) throws IOException {
		requireNonNull(keepAlive);
		getSocketChannel().setOption(StandardSocketOptions.SO_KEEPALIVE, keepAlive);
	}

	@Override
	public void setKeepAlivePeriod(@NonNull Duration keepAlivePeriod) throws IOException {
		requireNonNull(keepAlivePeriod);

		if (keepAlivePeriod.isNegative())
			throw new IllegalArgumentException(format("Keep-alive period cannot be negative (was %s)", keepAlivePeriod));

		Set<?> supportedOptions = getSocketChannel().supportedOptions();

		if (!supportedOptions.contains(ExtendedSocketOptions.TCP_KEEPIDLE) || !supportedOptions.contains(ExtendedSocketOptions.TCP_KEEPINTERVAL))
			throw new UnsupportedOperationException("This platform does not support tuning TCP keep-alive probe timing");

		// Round up to whole seconds, never below 1
		long seconds = keepAlivePeriod.getSeconds();

		if (keepAlivePeriod.getNano() > 0 && seconds < Long.MAX_VALUE)
			++seconds;

		int secondsAsInt = (int) Math.min(Integer.MAX_VALUE, Math.max(1L, seconds));

		getSocketChannel().setOption(ExtendedSocketOptions.TCP_KEEPIDLE, secondsAsInt);
		getSocketChannel().setOption(ExtendedSocketOptions.TCP_KEEPINTERVAL, secondsAsInt);
	}

	@Override
	public int read(@NonNull ByteBuffer byteBuffer) throws IOException {
		requireNonNull(byteBuffer);
		return getSocketChannel().read(byteBuffer);
	}

	@Override
	public int write(@NonNull ByteBuffer byteBuffer) throws IOException {
		requireNonNull(byteBuffer);
		return getSocketChannel().write(byteBuffer);
	}

	@Override
	public boolean isOpen() {
		return getSocketChannel().isOpen();
	}

	@Override
	public void close() throws IOException {
		getSocketChannel().close();
	}

	@Nullable
	@Override
	public SocketAddress getLocalAddress() throws IOException {
		return getSocketChannel().getLocalAddress();
	}

	@Nullable
	@Override
	public SocketAddress getRemoteAddress() throws IOException {
		return getSocketChannel().getRemoteAddress();
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{socketChannel=%s}", getClass().getSimpleName(), getSocketChannel());
	}

	/**
	 * The channel backing this connection.
	 *
	 * @return the socket channel
	 */
	@NonNull
	public SocketChannel getSocketChannel() {
		return this.socketChannel;
	}
}
