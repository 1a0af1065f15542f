package me.golemcore.rvsafety.domain.safety;

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
import me.golemcore.rvsafety.domain.model.AuditLogEntry;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Bounded, append-only safety audit trail. When full, the oldest entry is
 * dropped. Every entry is also written to the log.
 */
@Slf4j
public class SafetyAuditLog {

    private final Object lock = new Object();
    private final Deque<AuditLogEntry> ringBuffer;
    private final int capacity;

    public SafetyAuditLog(int capacity) {
        this.capacity = Math.max(1, capacity);
        this.ringBuffer = new ArrayDeque<>(this.capacity);
    }

    public AuditLogEntry append(String eventType, Map<String, Object> details, Instant timestamp) {
        AuditLogEntry.AuditLogEntryBuilder builder = AuditLogEntry.builder()
                .timestamp(timestamp)
                .eventType(eventType);
        if (details != null) {
            details.forEach(builder::detail);
        }
        AuditLogEntry entry = builder.build();

        synchronized (lock) {
            if (ringBuffer.size() >= capacity) {
                ringBuffer.removeFirst();
            }
            ringBuffer.addLast(entry);
        }
        log.info("[SafetyAudit] {} {}", eventType, entry.getDetails());
        return entry;
    }

    /**
     * Newest {@code maxEntries} entries, oldest first.
     */
    public List<AuditLogEntry> recent(int maxEntries) {
        List<AuditLogEntry> snapshot;
        synchronized (lock) {
            snapshot = new ArrayList<>(ringBuffer);
        }
        if (maxEntries <= 0 || snapshot.size() <= maxEntries) {
            return snapshot;
        }
        return new ArrayList<>(snapshot.subList(snapshot.size() - maxEntries, snapshot.size()));
    }

    public int size() {
        synchronized (lock) {
            return ringBuffer.size();
        }
    }

    public int getCapacity() {
        return capacity;
    }
}
