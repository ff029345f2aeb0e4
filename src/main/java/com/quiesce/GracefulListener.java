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

import com.quiesce.exception.ClosedAfterShutdownException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A {@link Listener} which can be closed safely from any thread while another thread is blocked in {@link #accept()}.
 * <p>
 * It differs from the listener it wraps in three ways:
 * <ul>
 *   <li>{@link #close()} is idempotent - the wrapped listener is closed at most once, no matter how many threads race to close it</li>
 *   <li>If {@link #accept()} fails after this listener was closed, it throws {@link ClosedAfterShutdownException} so accept loops can exit quietly</li>
 *   <li>Every accepted connection is a {@link StatefulConnection} on which the server can record protocol state</li>
 * </ul>
 * <p>
 * The open/closed flag is read when the wrapped {@link Listener#accept()} fails, not when it is called.  A failure that races with {@link #close()}
 * may therefore be classified either way.
 * <p>
 * A typical accept loop looks like this:
 * <pre>{@code  try (GracefulListener<TcpConnection> listener = GracefulListener.listen(new InetSocketAddress(8080))) {
 *   while (true) {
 *     StatefulConnection<TcpConnection> connection;
 *
 *     try {
 *       connection = listener.accept();
 *     } catch (ClosedAfterShutdownException e) {
 *       break; // Someone called listener.close()
 *     }
 *
 *     executorService.submit(() -> handle(connection));
 *   }
 * }}</pre>
 *
 * @param <C> the type of connection the wrapped listener vends
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class GracefulListener<C extends Connection> implements Listener<StatefulConnection<C>> {
	@NonNull
	private final Listener<C> listener;
	@NonNull
	private final LifecycleObserver lifecycleObserver;
	@NonNull
	private final AtomicBoolean open;

	/**
	 * Acquires a builder for a {@link GracefulListener} which wraps the given listener.
	 *
	 * @param listener the listener to wrap
	 * @param <C>      the type of connection the listener vends
	 * @return the builder
	 */
	@NonNull
	public static <C extends Connection> Builder<C> withListener(@NonNull Listener<C> listener) {
		requireNonNull(listener);
		return new Builder<>(listener);
	}

	/**
	 * Wraps the given listener using default settings.
	 *
	 * @param listener the listener to wrap
	 * @param <C>      the type of connection the listener vends
	 * @return an open {@link GracefulListener}
	 */
	@NonNull
	public static <C extends Connection> GracefulListener<C> wrap(@NonNull Listener<C> listener) {
		requireNonNull(listener);
		return withListener(listener).build();
	}

	/**
	 * Binds a TCP listener to the given address and wraps it so that accepted connections have keep-alive enabled
	 * and the listener can be closed gracefully.
	 *
	 * @param address the address to bind to
	 * @return an open {@link GracefulListener}
	 * @throws java.io.UncheckedIOException if the address could not be bound
	 */
	@NonNull
	public static GracefulListener<TcpConnection> listen(@NonNull InetSocketAddress address) {
		requireNonNull(address);

		TcpListener tcpListener = TcpListener.withPort(address.getPort())
				.host(address.getHostString())
				.build();

		return wrap(KeepAliveListener.withListener(tcpListener).build());
	}

	protected GracefulListener(@NonNull Builder<C> builder) {
		requireNonNull(builder);

		this.listener = builder.listener;
		this.lifecycleObserver = builder.lifecycleObserver != null ? builder.lifecycleObserver : LifecycleObserver.defaultInstance();
		this.open = new AtomicBoolean(true);
	}

	/**
	 * Blocks until the wrapped listener yields the next connection.
	 *
	 * @return the accepted connection, whose last state is {@link ConnectionState#NEW}
	 * @throws ClosedAfterShutdownException if the accept failed and this listener had been closed by the time it did
	 * @throws IOException                  if the accept failed while this listener was still open
	 */
	@NonNull
	@Override
	public StatefulConnection<C> accept() throws IOException {
		C connection;

		try {
			connection = getListener().accept();
		} catch (IOException e) {
			if (!isOpen())
				throw new ClosedAfterShutdownException(e);

			try {
				getLifecycleObserver().didFailToAcceptConnection(this, e);
			} catch (Throwable t) {
				safelyLog(LogEvent.with(LogEventType.LIFECYCLE_OBSERVER_DID_FAIL_TO_ACCEPT_CONNECTION_FAILED,
								format("An exception occurred while invoking %s::didFailToAcceptConnection", LifecycleObserver.class.getSimpleName()))
						.throwable(t)
						.listener(this)
						.build());
			}

			throw e;
		}

		StatefulConnection<C> statefulConnection = new StatefulConnection<>(connection);

		try {
			getLifecycleObserver().didAcceptConnection(this, statefulConnection);
		} catch (Throwable t) {
			safelyLog(LogEvent.with(LogEventType.LIFECYCLE_OBSERVER_DID_ACCEPT_CONNECTION_FAILED,
							format("An exception occurred while invoking %s::didAcceptConnection", LifecycleObserver.class.getSimpleName()))
					.throwable(t)
					.listener(this)
					.connection(statefulConnection)
					.build());
		}

		return statefulConnection;
	}

	/**
	 * Stops listening.
	 * <p>
	 * Only the first call closes the wrapped listener and can throw.  Every other call, concurrent or subsequent, returns immediately.
	 *
	 * @throws IOException if closing the wrapped listener failed
	 */
	@Override
	public void close() throws IOException {
		if (!getOpen().compareAndSet(true, false))
			return;

		try {
			getLifecycleObserver().willCloseListener(this);
		} catch (Throwable t) {
			safelyLog(LogEvent.with(LogEventType.LIFECYCLE_OBSERVER_WILL_CLOSE_LISTENER_FAILED,
							format("An exception occurred while invoking %s::willCloseListener", LifecycleObserver.class.getSimpleName()))
					.throwable(t)
					.listener(this)
					.build());
		}

		try {
			getListener().close();
		} catch (IOException e) {
			try {
				getLifecycleObserver().didFailToCloseListener(this, e);
			} catch (Throwable t) {
				safelyLog(LogEvent.with(LogEventType.LIFECYCLE_OBSERVER_DID_FAIL_TO_CLOSE_LISTENER_FAILED,
								format("An exception occurred while invoking %s::didFailToCloseListener", LifecycleObserver.class.getSimpleName()))
						.throwable(t)
						.listener(this)
						.build());
			}

			throw e;
		}

		try {
			getLifecycleObserver().didCloseListener(this);
		} catch (Throwable t) {
			safelyLog(LogEvent.with(LogEventType.LIFECYCLE_OBSERVER_DID_CLOSE_LISTENER_FAILED,
							format("An exception occurred while invoking %s::didCloseListener", LifecycleObserver.class.getSimpleName()))
					.throwable(t)
					.listener(this)
					.build());
		}
	}

	/**
	 * Has {@link #close()} not yet been called?
	 *
	 * @return {@code true} if this listener is open, {@code false} otherwise
	 */
	@NonNull
	public Boolean isOpen() {
		return getOpen().get();
	}

	@Nullable
	@Override
	public SocketAddress getLocalAddress() throws IOException {
		return getListener().getLocalAddress();
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

	@Override
	@NonNull
	public String toString() {
		return format("%s{listener=%s, open=%s}", getClass().getSimpleName(), getListener(), isOpen());
	}

	protected void safelyLog(@NonNull LogEvent logEvent) {
		LifecycleObserverSupport.safelyLog(getLifecycleObserver(), logEvent);
	}

	@NonNull
	protected LifecycleObserver getLifecycleObserver() {
		return this.lifecycleObserver;
	}

	@NonNull
	protected AtomicBoolean getOpen() {
		return this.open;
	}

	/**
	 * Builder used to construct instances of {@link GracefulListener}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @param <C> the type of connection the wrapped listener vends
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder<C extends Connection> {
		@NonNull
		private Listener<C> listener;
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
		public Builder<C> lifecycleObserver(@Nullable LifecycleObserver lifecycleObserver) {
			this.lifecycleObserver = lifecycleObserver;
			return this;
		}

		@NonNull
		public GracefulListener<C> build() {
			return new GracefulListener<>(this);
		}
	}
}
