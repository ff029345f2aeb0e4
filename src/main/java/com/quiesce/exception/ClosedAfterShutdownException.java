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

package com.quiesce.exception;

import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.NotThreadSafe;
import java.io.IOException;

import static java.util.Objects.requireNonNull;

/**
 * Thrown by {@link com.quiesce.GracefulListener#accept()} when an accept fails after the listener was intentionally closed.
 * <p>
 * Accept loops should treat this as a signal to exit cleanly rather than as a fault.  The underlying failure is available via {@link #getCause()}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public class ClosedAfterShutdownException extends IOException {
	public ClosedAfterShutdownException(@NonNull IOException cause) {
		super(requireNonNull(cause).getMessage(), cause);
	}

	@Override
	@NonNull
	public synchronized IOException getCause() {
		return (IOException) super.getCause();
	}
}
