package me.golemcore.rvsafety.port.outbound;

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

import me.golemcore.rvsafety.domain.model.FeatureHealthReport;
import me.golemcore.rvsafety.domain.model.FeatureInfo;

import java.util.List;
import java.util.Optional;

/**
 * Port to the feature manager that owns coach subsystems (slides, awnings,
 * leveling jacks). The safety core reads health and classification and may
 * force a feature into safe shutdown.
 */
public interface FeatureManagerPort {

    Optional<FeatureInfo> getFeature(String name);

    List<FeatureInfo> listFeatures();

    FeatureHealthReport checkSystemHealth();

    /**
     * Forces the feature into safe shutdown.
     *
     * @return {@code false} if the feature is unknown
     */
    boolean forceSafeShutdown(String name);
}
