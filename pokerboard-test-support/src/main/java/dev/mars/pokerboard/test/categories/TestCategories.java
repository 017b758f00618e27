/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.pokerboard.test.categories;

/**
 * Test category tags used with JUnit 5 {@code @Tag}.
 *
 * <p>Run a single category with {@code mvn test -Dgroups=core}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public final class TestCategories {

    /**
     * Core tests - Fast unit tests for daily development.
     *
     * <p>These tests should:</p>
     * <ul>
     *   <li>Run in under 30 seconds total</li>
     *   <li>Each test completes in under 1 second</li>
     *   <li>Use in-memory stores only</li>
     *   <li>Not open network ports</li>
     * </ul>
     *
     * <p>Examples: projection folding, command validation, broker state transitions</p>
     */
    public static final String CORE = "core";

    /**
     * Integration tests - Tests that deploy the server verticle.
     *
     * <p>These tests should:</p>
     * <ul>
     *   <li>Run in under a minute total</li>
     *   <li>Use a real Vert.x instance and real sockets on a test port</li>
     *   <li>Exercise complete command-to-view round trips</li>
     * </ul>
     *
     * <p>Examples: WebSocket sessions, HTTP board endpoints</p>
     */
    public static final String INTEGRATION = "integration";

    /**
     * Slow tests - Timing dependent tests such as heartbeat expiry and retry back-off.
     */
    public static final String SLOW = "slow";

    private TestCategories() {
        // Constants class - no instantiation
    }
}
