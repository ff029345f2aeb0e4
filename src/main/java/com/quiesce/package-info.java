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

/**
 * Listener and connection decorators which let a server stop accepting new connections without racing its own accept loop.
 * <p>
 * Wrap a {@link com.quiesce.Listener} in a {@link com.quiesce.GracefulListener}, call {@link com.quiesce.GracefulListener#accept()} from your accept loop,
 * and call {@link com.quiesce.GracefulListener#close()} from wherever shutdown is triggered.  The loop exits when it sees a
 * {@link com.quiesce.exception.ClosedAfterShutdownException}.  Deciding when in-flight connections have drained is left to the server,
 * which can record each connection's protocol state via {@link com.quiesce.StatefulConnection#setLastState(com.quiesce.ConnectionState)}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
package com.quiesce;
