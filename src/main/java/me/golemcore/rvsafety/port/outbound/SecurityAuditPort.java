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

import me.golemcore.rvsafety.domain.model.RateLimitCategory;
import me.golemcore.rvsafety.domain.model.RateLimitResult;
import me.golemcore.rvsafety.domain.model.SecurityEvent;

/**
 * Port to the security audit service: sink for security events and source of
 * rate-limit decisions.
 */
public interface SecurityAuditPort {

    void logSecurityEvent(SecurityEvent event);

    RateLimitResult checkRateLimit(String identifier, RateLimitCategory category, boolean isAdmin,
            String sourceIp);
}
