package me.golemcore.rvsafety.domain.model;

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

import lombok.Value;

import java.time.Duration;

/**
 * Outcome of one token-bucket check. A denial carries the time until the next
 * token; an allowance carries the tokens left.
 */
@Value
public class RateLimitResult {

    boolean allowed;
    long remainingTokens;
    Duration waitTime;

    public static RateLimitResult allowed(long remaining) {
        return new RateLimitResult(true, remaining, null);
    }

    public static RateLimitResult denied(Duration waitTime) {
        return new RateLimitResult(false, 0, waitTime);
    }
}
