package me.golemcore.rvsafety.adapter.outbound.feature;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.rvsafety.domain.model.FeatureHealthReport;
import me.golemcore.rvsafety.domain.model.FeatureInfo;
import me.golemcore.rvsafety.domain.model.FeatureState;
import me.golemcore.rvsafety.domain.model.SafetyClassification;
import me.golemcore.rvsafety.infrastructure.config.RvSafetyProperties;
import me.golemcore.rvsafety.port.outbound.FeatureManagerPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Feature registry populated from {@code rvsafety.features.*}. Stands in for
 * the coach feature manager when the safety core runs on its own.
 *
 * <p>
 * Enabled features start {@link FeatureState#HEALTHY}, disabled ones
 * {@link FeatureState#STOPPED}. Other components report state changes through
 * {@link #updateState(String, FeatureState)}.
 */
@Component
@Slf4j
public class InMemoryFeatureRegistry implements FeatureManagerPort {

    private final Object lock = new Object();
    private final Map<String, FeatureInfo> features = new LinkedHashMap<>();

    public InMemoryFeatureRegistry(RvSafetyProperties properties) {
        properties.getFeatures().forEach((name, config) -> features.put(name, FeatureInfo.builder()
                .name(name)
                .enabled(config.isEnabled())
                .classification(config.getClassification() != null
                        ? config.getClassification()
                        : SafetyClassification.OPERATIONAL)
                .state(config.isEnabled() ? FeatureState.HEALTHY : FeatureState.STOPPED)
                .build()));
        log.info("[Features] Registered {} feature(s): {}", features.size(), features.keySet());
    }

    @Override
    public Optional<FeatureInfo> getFeature(String name) {
        synchronized (lock) {
            return Optional.ofNullable(features.get(name));
        }
    }

    @Override
    public List<FeatureInfo> listFeatures() {
        synchronized (lock) {
            return new ArrayList<>(features.values());
        }
    }

    @Override
    public FeatureHealthReport checkSystemHealth() {
        FeatureHealthReport.FeatureHealthReportBuilder report = FeatureHealthReport.builder();
        boolean healthy = true;
        for (FeatureInfo feature : listFeatures()) {
            report.featureState(feature.getName(), feature.getState());
            if (feature.isEnabled() && feature.getState().isFailed()) {
                healthy = false;
                report.failedFeature(feature.getName());
                if (feature.getClassification() == SafetyClassification.CRITICAL) {
                    report.failedCriticalFeature(feature.getName());
                }
            }
        }
        return report.healthy(healthy).build();
    }

    @Override
    public boolean forceSafeShutdown(String name) {
        synchronized (lock) {
            FeatureInfo feature = features.get(name);
            if (feature == null) {
                log.warn("[Features] Safe shutdown requested for unknown feature {}", name);
                return false;
            }
            features.put(name, feature.toBuilder().state(FeatureState.SAFE_SHUTDOWN).build());
        }
        log.warn("[Features] Feature {} forced to safe shutdown", name);
        return true;
    }

    /**
     * Records a state reported by the feature itself.
     *
     * @return {@code false} if the feature is unknown
     */
    public boolean updateState(String name, FeatureState state) {
        synchronized (lock) {
            FeatureInfo feature = features.get(name);
            if (feature == null) {
                return false;
            }
            features.put(name, feature.toBuilder().state(state).build());
        }
        log.info("[Features] Feature {} is now {}", name, state);
        return true;
    }
}
