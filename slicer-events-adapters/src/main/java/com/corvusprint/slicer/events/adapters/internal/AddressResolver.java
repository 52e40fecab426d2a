/*
 * Copyright © 2025 CorvusPrint
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
package com.corvusprint.slicer.events.adapters.internal;

import com.google.common.net.HostAndPort;
import com.google.common.net.InetAddresses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Utility for parsing broker addresses in various formats.
 * <p>
 * Parsing is purely syntactic: host names are not resolved, so an address can be configured before
 * the network is up. Resolution is left to the transport.
 */
public final class AddressResolver {

  private static final Logger logger = LoggerFactory.getLogger(AddressResolver.class);

  private static final Set<String> PLAIN_SCHEMES = Set.of("mqtt", "tcp");
  private static final Set<String> TLS_SCHEMES = Set.of("mqtts", "ssl");

  private AddressResolver() {
  }

  /**
   * Parses an address string into a {@link HostAndPort}.
   * <p>
   * Returns {@link Optional#empty()} if the address is {@code null} or blank.
   * Throws an exception if the address format is invalid.
   * </p>
   *
   * <h4>Supported Formats</h4>
   * <ul>
   *   <li><strong>IPv4:</strong> {@code host:port} (e.g., {@code 192.168.1.100:1883})</li>
   *   <li><strong>IPv6:</strong> {@code [host]:port} (e.g., {@code [::1]:1883})</li>
   *   <li><strong>Hostname:</strong> {@code host[:port]} (e.g., {@code broker.local})</li>
   *   <li><strong>With scheme:</strong> {@code mqtt://host:port}, {@code tcp://host:port},
   *       {@code mqtts://host:port}, {@code ssl://host:port}</li>
   * </ul>
   * <p>
   * A missing port is replaced by {@code defaultPort}. The port must lie between 0 and 65535.
   * </p>
   *
   * @param rawAddress  the address string; may be {@code null} or blank
   * @param defaultPort port used when the address carries none
   * @return {@link Optional} containing the parsed address, or {@link Optional#empty()} if address is {@code null} or blank
   * @throws IllegalArgumentException if the address format or its scheme is invalid
   */
  public static Optional<HostAndPort> resolve(String rawAddress, int defaultPort) {
    if (rawAddress == null || rawAddress.isBlank()) return Optional.empty();

    var trimmed = rawAddress.trim();
    if (containsWhitespaceInside(trimmed)) {
      throw new IllegalArgumentException("Address contains whitespace: " + rawAddress);
    }

    var authority = trimmed.contains("://") ? stripScheme(trimmed) : trimmed;
    return Optional.of(parseHostAndPort(authority, defaultPort, rawAddress));
  }

  /**
   * Tells whether the address names a TLS scheme ({@code mqtts://} or {@code ssl://}).
   *
   * @param rawAddress the address string; may be {@code null}
   * @return {@code true} if the scheme asks for TLS
   */
  public static boolean isTlsScheme(String rawAddress) {
    if (rawAddress == null || !rawAddress.contains("://")) return false;
    return TLS_SCHEMES.contains(scheme(rawAddress.trim()));
  }

  private static String stripScheme(String address) {
    var scheme = scheme(address);
    if (!PLAIN_SCHEMES.contains(scheme) && !TLS_SCHEMES.contains(scheme)) {
      logger.error("Unsupported scheme in address: {}", address);
      throw new IllegalArgumentException("Unsupported scheme '" + scheme + "' in address: " + address);
    }
    var authority = address.substring(address.indexOf("://") + 3);
    if (authority.endsWith("/")) {
      authority = authority.substring(0, authority.length() - 1);
    }
    if (authority.contains("/") || authority.contains("?") || authority.contains("#")) {
      logger.error("Address must not include path/query/fragment: {}", address);
      throw new IllegalArgumentException("Address must not include path/query/fragment: " + address);
    }
    return authority;
  }

  private static String scheme(String address) {
    return address.substring(0, address.indexOf("://")).toLowerCase(Locale.ROOT);
  }

  private static HostAndPort parseHostAndPort(String authority, int defaultPort, String rawAddress) {
    try {
      var hostAndPort = HostAndPort.fromString(authority).withDefaultPort(defaultPort);
      if (hostAndPort.getHost().isEmpty()) {
        throw new IllegalArgumentException("Host required in address: " + rawAddress);
      }
      if (hostAndPort.getHost().contains(":") && !InetAddresses.isInetAddress(hostAndPort.getHost())) {
        throw new IllegalArgumentException("Invalid IPv6 literal in address: " + rawAddress);
      }
      return hostAndPort;
    } catch (IllegalArgumentException ex) {
      logger.error("Invalid host:port address: {}", rawAddress, ex);
      throw new IllegalArgumentException("Invalid host:port address: " + rawAddress, ex);
    }
  }

  private static boolean containsWhitespaceInside(String s) {
    for (int i = 0; i < s.length(); i++) {
      if (Character.isWhitespace(s.charAt(i))) return true;
    }
    return false;
  }
}
