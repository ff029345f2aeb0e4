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

import java.io.IOException;
import java.time.Duration;

/**
 * A {@link Connection} whose transport supports keep-alive probing, for example TCP.
 * <p>
 * Used by {@link KeepAliveListener} to reclaim connections to peers that vanished without closing.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface KeepAliveConnection extends Connection {
	/**
	 * Turns transport-level keep-alive probing on or off.
	 *
	 * @param keepAlive {@code true} to enable probing
	 * @throws IOException if the option could not be applied
	 */
	void setKeepAlive(@NonNull Boolean keepAlive) throws IOException;

	/**
	 * Sets both the idle time before the first keep-alive probe and the interval between subsequent probes.
	 * <p>
	 * The period is applied at whole-second granularity and is never less than one second.
	 *
	 * @param keepAlivePeriod the probe period
	 * @throws IOException                   if the option could not be applied
	 * @throws UnsupportedOperationException if the platform does not permit tuning probe timing
	 */
	void setKeepAlivePeriod(@NonNull Duration keepAlivePeriod) throws IOException;
}
