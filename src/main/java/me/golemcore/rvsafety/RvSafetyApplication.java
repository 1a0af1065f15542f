package me.golemcore.rvsafety;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the RV safety core.
 *
 * <p>
 * The safety core gates physically hazardous coach operations (slide rooms,
 * awnings, leveling jacks, emergency stop) behind short-lived PIN sessions and
 * environmental interlocks.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>PIN Authorization</b> - salted PIN validation, sliding-window lockout,
 * usage-limited sessions with concurrent-session eviction</li>
 * <li><b>Safety Interlocks</b> - per-feature guards over vehicle telemetry with
 * time-boxed, PIN-authorized overrides</li>
 * <li><b>Emergency Stop</b> - PIN-gated trigger and reset, forced safe shutdown
 * of position-critical features</li>
 * <li><b>Supervision</b> - watchdog and health loops that fail closed into a
 * terminal safe state</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Domain Layer       → PinManager, SafetyService, SafetyInterlock
 * Scheduling         → SafetyMonitor (watchdog + health loop)
 * Infrastructure     → PIN store, feature registry, security audit adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code rvsafety.*} prefix.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class RvSafetyApplication {

    public static void main(String[] args) {
        SpringApplication.run(RvSafetyApplication.class, args);
    }

}
