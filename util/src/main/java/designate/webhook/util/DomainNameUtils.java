// Copyright 2026 The Designate Webhook Authors. All Rights Reserved.
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

package designate.webhook.util;

import static com.google.common.base.Ascii.toLowerCase;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;

/** Utility methods for fully-qualified DNS names. */
public final class DomainNameUtils {

  /** Separator between DNS labels, also the terminator of an absolute name. */
  public static final String LABEL_SEPARATOR = ".";

  /**
   * Returns the canonical form of a DNS name: lower-cased and ending in a dot.
   *
   * <p>Comparisons between zone names and host names are done on this form only.
   */
  public static String canonicalizeDomainName(String name) {
    String absolute = name.endsWith(LABEL_SEPARATOR) ? name : name + LABEL_SEPARATOR;
    return toLowerCase(absolute);
  }

  /** Canonicalizes every name of the given list, preserving order. */
  public static ImmutableList<String> canonicalizeDomainNames(Iterable<String> names) {
    return ImmutableList.copyOf(names).stream()
        .map(DomainNameUtils::canonicalizeDomainName)
        .collect(toImmutableList());
  }

  /** Returns the name without a single trailing dot, if it has one. */
  public static String stripTrailingDot(String name) {
    return name.endsWith(LABEL_SEPARATOR) ? name.substring(0, name.length() - 1) : name;
  }

  private DomainNameUtils() {}
}
