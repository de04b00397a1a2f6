// Copyright 2026 The DomainSync Authors. All Rights Reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package dev.domainsync.util;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Strings.isNullOrEmpty;

import com.google.common.base.Ascii;
import com.google.common.net.InternetDomainName;

/** Utility methods related to domain names. */
public final class DomainNameUtils {

  /** The record name registrars use for the zone apex. */
  public static final String APEX_LABEL = "@";

  /** Canonicalizes a domain name by lowercasing it and removing any trailing dot. */
  public static String canonicalizeHostname(String hostname) {
    String lowered = Ascii.toLowerCase(hostname.trim());
    return lowered.endsWith(".") ? lowered.substring(0, lowered.length() - 1) : lowered;
  }

  /** Returns the registrar record name for a subdomain label, mapping empty to the apex. */
  public static String toRecordName(String subdomain) {
    return isNullOrEmpty(subdomain) ? APEX_LABEL : canonicalizeHostname(subdomain);
  }

  /** Returns whether the record name denotes the zone apex. */
  public static boolean isApex(String recordName) {
    return isNullOrEmpty(recordName) || APEX_LABEL.equals(recordName);
  }

  /**
   * Returns the fully qualified domain name for a record name under a root domain.
   *
   * <p>The apex label ({@code @} or empty) maps to the root domain itself.
   */
  public static String toFqdn(String rootDomain, String recordName) {
    String root = canonicalizeHostname(rootDomain);
    return isApex(recordName) ? root : canonicalizeHostname(recordName) + "." + root;
  }

  /** Returns whether the given string parses as a valid internet domain name. */
  public static boolean isValidDomainName(String name) {
    if (isNullOrEmpty(name)) {
      return false;
    }
    return InternetDomainName.isValid(canonicalizeHostname(name));
  }

  /** Checks that the given string parses as a valid domain name and returns it canonicalized. */
  public static String checkValidDomainName(String name) {
    checkArgument(isValidDomainName(name), "Invalid domain name: '%s'", name);
    return canonicalizeHostname(name);
  }

  private DomainNameUtils() {}
}
