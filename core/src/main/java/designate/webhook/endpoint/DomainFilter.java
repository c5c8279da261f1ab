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

package designate.webhook.endpoint;

import static com.google.common.base.Ascii.toLowerCase;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.base.CharMatcher;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.gson.annotations.Expose;
import designate.webhook.util.DomainNameUtils;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Restricts the zones visible to the webhook.
 *
 * <p>A plain filter {@code example.com} accepts {@code example.com} and every name below it. A
 * filter starting with a dot, such as {@code .example.com}, accepts only names below it. When a
 * regex include is configured it replaces the plain lists entirely. Exclusions always win.
 */
public final class DomainFilter {

  private static final CharMatcher DOT = CharMatcher.is('.');

  @Expose private final ImmutableList<String> include;
  @Expose private final ImmutableList<String> exclude;
  @Expose private final String regexInclude;
  @Expose private final String regexExclude;

  private final transient Optional<Pattern> regexIncludePattern;
  private final transient Optional<Pattern> regexExcludePattern;

  public DomainFilter(
      List<String> include, List<String> exclude, String regexInclude, String regexExclude) {
    this.include = normalize(include);
    this.exclude = normalize(exclude);
    this.regexInclude = Strings.nullToEmpty(regexInclude);
    this.regexExclude = Strings.nullToEmpty(regexExclude);
    this.regexIncludePattern = compile(this.regexInclude);
    this.regexExcludePattern = compile(this.regexExclude);
  }

  /** Returns a filter accepting only the given domains and the names below them. */
  public static DomainFilter of(List<String> include) {
    return new DomainFilter(include, ImmutableList.of(), "", "");
  }

  /** Returns a filter accepting every domain. */
  public static DomainFilter acceptAll() {
    return of(ImmutableList.of());
  }

  /** Returns whether the given domain name is visible to the webhook. */
  public boolean matches(String domain) {
    if (regexIncludePattern.isPresent() || regexExcludePattern.isPresent()) {
      return matchesRegex(domain);
    }
    return matchesAny(include, domain, true) && !matchesAny(exclude, domain, false);
  }

  public ImmutableList<String> getInclude() {
    return include;
  }

  public ImmutableList<String> getExclude() {
    return exclude;
  }

  public boolean isConfigured() {
    return !include.isEmpty()
        || !exclude.isEmpty()
        || regexIncludePattern.isPresent()
        || regexExcludePattern.isPresent();
  }

  private boolean matchesRegex(String domain) {
    String normalized = normalizeDomain(domain);
    if (regexExcludePattern.isPresent() && regexExcludePattern.get().matcher(normalized).find()) {
      return false;
    }
    return regexIncludePattern.isEmpty() || regexIncludePattern.get().matcher(normalized).find();
  }

  private static boolean matchesAny(List<String> filters, String domain, boolean valueIfEmpty) {
    if (filters.isEmpty()) {
      return valueIfEmpty;
    }
    String normalized = normalizeDomain(domain);
    for (String filter : filters) {
      if (filter.isEmpty()) {
        continue;
      }
      if (filter.startsWith(".")) {
        if (normalized.endsWith(filter)) {
          return true;
        }
      } else if (DOT.countIn(normalized) == DOT.countIn(filter)) {
        if (normalized.equals(filter)) {
          return true;
        }
      } else if (normalized.endsWith("." + filter)) {
        return true;
      }
    }
    return false;
  }

  private static String normalizeDomain(String domain) {
    return toLowerCase(DomainNameUtils.stripTrailingDot(domain.trim()));
  }

  private static ImmutableList<String> normalize(List<String> filters) {
    if (filters == null) {
      return ImmutableList.of();
    }
    return filters.stream()
        .map(DomainFilter::normalizeDomain)
        .filter(f -> !f.isEmpty())
        .collect(toImmutableList());
  }

  private static Optional<Pattern> compile(String regex) {
    return regex.isEmpty() ? Optional.empty() : Optional.of(Pattern.compile(regex));
  }

  @Override
  public String toString() {
    return String.format(
        "DomainFilter{include=%s, exclude=%s, regexInclude=%s, regexExclude=%s}",
        include, exclude, regexInclude, regexExclude);
  }
}
