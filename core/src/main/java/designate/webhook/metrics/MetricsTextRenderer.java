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

package designate.webhook.metrics;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.monitoring.metrics.Distribution;
import com.google.monitoring.metrics.LabelDescriptor;
import com.google.monitoring.metrics.Metric;
import com.google.monitoring.metrics.MetricPoint;
import com.google.monitoring.metrics.MetricRegistry;
import com.google.monitoring.metrics.MetricRegistryImpl;
import jakarta.inject.Inject;
import java.util.Comparator;
import java.util.Iterator;

/**
 * Renders the registered metrics as plain text, one line per metric point.
 *
 * <p>Distributions are rendered as their count and mean, e.g. {@code
 * /designate/api_call_latency{method="ForEachZone"} count=3 mean=12.0}.
 */
public class MetricsTextRenderer {

  private final MetricRegistry registry;

  @Inject
  public MetricsTextRenderer() {
    this(MetricRegistryImpl.getDefault());
  }

  MetricsTextRenderer(MetricRegistry registry) {
    this.registry = registry;
  }

  public String render() {
    StringBuilder text = new StringBuilder();
    ImmutableList<Metric<?>> metrics =
        registry.getRegisteredMetrics().stream()
            .sorted(Comparator.comparing(m -> m.getMetricSchema().name()))
            .collect(toImmutableList());
    for (Metric<?> metric : metrics) {
      text.append("# ").append(metric.getMetricSchema().description()).append('\n');
      ImmutableList<String> labelNames =
          metric.getMetricSchema().labels().stream()
              .map(LabelDescriptor::name)
              .collect(toImmutableList());
      for (MetricPoint<?> point : metric.getTimestampedValues()) {
        text.append(metric.getMetricSchema().name());
        appendLabels(text, labelNames, point.labelValues());
        text.append(' ').append(formatValue(point.value())).append('\n');
      }
    }
    return text.toString();
  }

  private static void appendLabels(
      StringBuilder text, ImmutableList<String> names, ImmutableList<String> values) {
    if (names.isEmpty()) {
      return;
    }
    text.append('{');
    Iterator<String> valueIterator = values.iterator();
    for (int i = 0; i < names.size() && valueIterator.hasNext(); i++) {
      if (i > 0) {
        text.append(',');
      }
      text.append(names.get(i)).append("=\"").append(valueIterator.next()).append('"');
    }
    text.append('}');
  }

  private static String formatValue(Object value) {
    if (value instanceof Distribution) {
      Distribution distribution = (Distribution) value;
      return String.format("count=%d mean=%s", distribution.count(), distribution.mean());
    }
    return String.valueOf(value);
  }
}
