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
import java.net.SocketAddress;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A {@link Listener} which turns on transport keep-alive probing for every connection it accepts.
 * <p>
 * Without probing, a peer that disappears mid-conversation (a laptop lid closed during a download, say) leaves an idle connection behind
 * that a graceful shutdown would wait on forever.
 * <p>
 * Applying keep-alive is best-effort: if an option can't be set, a {@link LogEvent} is emitted and the connection is returned anyway.
 * No socket options other than keep-alive are touched.
 * <p>
 * For example:
 * <pre>{@code  KeepAliveListener<TcpConnection> keepAliveListener = KeepAliveListener.withListener(TcpListener.withPort(8080).build())
 *   .keepAlivePeriod(Duration.ofMinutes(3))
 *   .build();}</pre>
 *
 * @param <C> the type of connection this listener vends
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class KeepAliveListener<C extends KeepAliveConnection> implements Listener<C> {
	@NonNull
	private static final Duration DEFAULT_KEEP_ALIVE_PERIOD;

	static {
		DEFAULT_KEEP_ALIVE_PERIOD = Duration.ofMinutes(3);
	}

	@NonNull
	private final Listener<C> listener;
	@NonNull
	private final Duration keepAlivePeriod;
	@NonNull
	private final LifecycleObserver lifecycleObserver;
	@NonNull
	private final AtomicBoolean keepAlivePeriodUnsupportedLogged;

	/**
	 * Acquires a builder for a {@link KeepAliveListener} which wraps the given listener.
	 *
	 * @param listener the listener to wrap
	 * @param <C>      the type of connection the listener vends
	 * @return the builder
	 */
	@NonNull
	public static <C extends KeepAliveConnection> Builder<C> withListener(@NonNull Listener<C> listener) {
		requireNonNull(listener);
		return new Builder<>(listener);
	}

	protected KeepAliveListener(@NonNull Builder<C> builder) {
		requireNonNull(builder);

		this.listener = builder.listener;
		this.keepAlivePeriod = builder.keepAlivePeriod != null ? builder.keepAlivePeriod : DEFAULT_KEEP_ALIVE_PERIOD;
		this.lifecycleObserver = builder.lifecycleObserver != null ? builder.lifecycleObserver : LifecycleObserver.defaultInstance();
		this.keepAlivePeriodUnsupportedLogged = new AtomicBoolean(false);

		if (this.keepAlivePeriod.isNegative() || this.keepAlivePeriod.isZero())
			throw new IllegalArgumentException(format("Keep-alive period must be positive (was %s)", this.keepAlivePeriod));
	}

	@NonNull
	@Override
	public C accept() throws IOException {
		C connection = getListener().accept();

		try {
			connection.setKeepAlive(true);
			connection.setKeepAlivePeriod(getKeepAlivePeriod());
		} catch (UnsupportedOperationException e) {
			if (getKeepAlivePeriodUnsupportedLogged().compareAndSet(false, true))
				safelyLog(LogEvent.with(LogEventType.CONFIGURATION_UNSUPPORTED,
								format("Keep-alive is enabled but the probe period of %s cannot be applied on this platform; the system default will be used", getKeepAlivePeriod()))
						.throwable(e)
						.listener(this)
						.connection(connection)
						.build());
		} catch (IOException e) {
			safelyLog(LogEvent.with(LogEventType.SOCKET_OPTION_FAILED, "Unable to apply keep-alive to accepted connection")
					.throwable(e)
					.listener(this)
					.connection(connection)
					.build());
		} catch (RuntimeException e) {
			// Never returned to the caller, so close it here
			try {
				connection.close();
			} catch (IOException closeException) {
				e.addSuppressed(closeException);
			}

			throw e;
		}

		return connection;
	}

	@Override
	public void close() throws IOException {
		getListener().close();
	}

	@Nullable
	@Override
	public SocketAddress getLocalAddress() throws IOException {
		return getListener().getLocalAddress();
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{listener=%s, keepAlivePeriod=%s}", getClass().getSimpleName(), getListener(), getKeepAlivePeriod());
	}

	protected void safelyLog(@NonNull LogEvent logEvent) {
		LifecycleObserverSupport.safelyLog(getLifecycleObserver(), logEvent);
	}

	/**
	 * The listener this instance wraps.
	 *
	 * @return the wrapped listener
	 */
	@NonNull
	public Listener<C> getListener() {
		return this.listener;
	}

	/**
	 * The keep-alive probe period applied to accepted connections.
	 *
	 * @return the probe period
	 */
	@NonNull
	public Duration getKeepAlivePeriod() {
		return this.keepAlivePeriod;
	}

	@NonNull
	protected LifecycleObserver getLifecycleObserver() {
		return this.lifecycleObserver;
	}

	@NonNull
	protected AtomicBoolean getKeepAlivePeriodUnsupportedLogged() {
		return this.keepAlivePeriodUnsupportedLogged;
	}

	/**
	 * Builder used to construct instances of {@link KeepAliveListener}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @param <C> the type of connection the wrapped listener vends
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder<C extends KeepAliveConnection> {
		@NonNull
		private Listener<C> listener;
		@Nullable
		private Duration keepAlivePeriod;
		@Nullable
		private LifecycleObserver lifecycleObserver;

		private Builder(@NonNull Listener<C> listener) {
			requireNonNull(listener);
			this.listener = listener;
		}

		@NonNull
		public Builder<C> listener(@NonNull Listener<C> listener) {
			requireNonNull(listener);
			this.listener = listener;
			return this;
		}

		@NonNull
		public Builder<C> keepAlivePeriod(@Nullable Duration keepAlivePeriod) {
			this.keepAlivePeriod = keepAlivePeriod;
			return this;
		}

		@NonNull
		public Builder<C> lifecycleObserver(@Nullable LifecycleObserver lifecycleObserver) {
			this.lifecycleObserver = lifecycleObserver;
			return this;
		}

		@NonNull
		public KeepAliveListener<C> build() {
			return new KeepAliveListener<>(this);
		}
	}
}
