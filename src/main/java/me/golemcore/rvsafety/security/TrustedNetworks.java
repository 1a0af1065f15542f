package me.golemcore.rvsafety.security;

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

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * CIDR allow-list for source addresses that bypass rate limiting (the coach's
 * own control panels on the local network).
 *
 * <p>
 * Only literal IPv4/IPv6 addresses are accepted; anything that would need a
 * DNS lookup is treated as untrusted.
 */
@Slf4j
public final class TrustedNetworks {

    private static final Pattern LITERAL_ADDRESS = Pattern.compile("[0-9A-Fa-f:.]+");

    private final List<Network> networks;

    private TrustedNetworks(List<Network> networks) {
        this.networks = List.copyOf(networks);
    }

    /**
     * Parses CIDR strings such as {@code 192.168.1.0/24} or {@code ::1/128}. A
     * bare address is treated as a single-host network. Invalid entries are
     * skipped with a warning.
     */
    public static TrustedNetworks parse(List<String> cidrs) {
        List<Network> parsed = new ArrayList<>();
        if (cidrs != null) {
            for (String cidr : cidrs) {
                Network network = parseNetwork(cidr);
                if (network == null) {
                    log.warn("[Security] Ignoring invalid trusted network: {}", cidr);
                } else {
                    parsed.add(network);
                }
            }
        }
        return new TrustedNetworks(parsed);
    }

    public boolean isEmpty() {
        return networks.isEmpty();
    }

    public boolean contains(String address) {
        if (address == null || networks.isEmpty()) {
            return false;
        }
        byte[] bytes = toBytes(address.trim());
        if (bytes == null) {
            return false;
        }
        for (Network network : networks) {
            if (network.matches(bytes)) {
                return true;
            }
        }
        return false;
    }

    private static Network parseNetwork(String cidr) {
        if (cidr == null || cidr.isBlank()) {
            return null;
        }
        String[] parts = cidr.trim().split("/", 2);
        byte[] address = toBytes(parts[0]);
        if (address == null) {
            return null;
        }
        int maxBits = address.length * 8;
        int prefix = maxBits;
        if (parts.length == 2) {
            try {
                prefix = Integer.parseInt(parts[1]);
            } catch (NumberFormatException e) {
                return null;
            }
            if (prefix < 0 || prefix > maxBits) {
                return null;
            }
        }
        return new Network(address, prefix);
    }

    private static byte[] toBytes(String literal) {
        if (literal.isEmpty() || !LITERAL_ADDRESS.matcher(literal).matches()) {
            return null;
        }
        try {
            return InetAddress.getByName(literal).getAddress();
        } catch (UnknownHostException e) {
            return null;
        }
    }

    private record Network(byte[] address, int prefixLength) {

        boolean matches(byte[] candidate) {
            if (candidate.length != address.length) {
                return false;
            }
            int fullBytes = prefixLength / 8;
            for (int i = 0; i < fullBytes; i++) {
                if (candidate[i] != address[i]) {
                    return false;
                }
            }
            int remainingBits = prefixLength % 8;
            if (remainingBits == 0) {
                return true;
            }
            int mask = (0xFF << (8 - remainingBits)) & 0xFF;
            return (candidate[fullBytes] & mask) == (address[fullBytes] & mask);
        }
    }
}
