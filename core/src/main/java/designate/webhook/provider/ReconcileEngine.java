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

package designate.webhook.provider;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import designate.webhook.client.DesignateClient;
import designate.webhook.client.DesignateException;
import designate.webhook.client.DesignateException.RecordMutationException;
import designate.webhook.client.model.RecordSetRequest;
import jakarta.inject.Inject;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Brings Designate in line with a set of {@link AggregatedRecordSet}s.
 *
 * <p>Each record set is created, updated, deleted or left alone depending on whether it has a
 * Designate id and whether any target is still wanted. A failing record set does not stop the
 * others; the first failure is thrown once all of them have been tried.
 */
public class ReconcileEngine {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private static final Joiner COMMA_JOINER = Joiner.on(',');

  /** The operation chosen for one record set. */
  public enum Action {
    CREATE,
    UPDATE,
    DELETE,
    NONE
  }

  private final DesignateClient designateClient;

  @Inject
  public ReconcileEngine(DesignateClient designateClient) {
    this.designateClient = designateClient;
  }

  /**
   * Applies the record sets in iteration order.
   *
   * @param zones the managed zones, used to find the owner of record sets without a zone id
   * @param dryRun if set, the chosen operations are logged but not sent to Designate
   * @throws RecordMutationException the first failure, after all record sets were tried
   */
  public void apply(
      Collection<AggregatedRecordSet> recordSets, Map<String, String> zones, boolean dryRun)
      throws RecordMutationException {
    RecordMutationException firstFailure = null;
    for (AggregatedRecordSet recordSet : recordSets) {
      try {
        upsert(recordSet, zones, dryRun);
      } catch (DesignateException e) {
        logger.atWarning().withCause(e).log("Failed to apply %s", recordSet);
        if (firstFailure == null) {
          firstFailure =
              new RecordMutationException(
                  String.format(
                      "Failed to apply changes to %s/%s",
                      recordSet.getDnsName(), recordSet.getRecordType()),
                  e);
        }
      }
    }
    if (firstFailure != null) {
      throw firstFailure;
    }
  }

  /** Returns the operation for a record set owned by a known zone. */
  public static Action decide(AggregatedRecordSet recordSet) {
    boolean exists = !recordSet.getRecordSetId().isEmpty();
    boolean wanted = !recordSet.wantedRecords().isEmpty();
    if (exists) {
      return wanted ? Action.UPDATE : Action.DELETE;
    }
    return wanted ? Action.CREATE : Action.NONE;
  }

  private void upsert(AggregatedRecordSet recordSet, Map<String, String> zones, boolean dryRun)
      throws DesignateException {
    Optional<String> zoneId = resolveZone(recordSet, zones);
    if (zoneId.isEmpty()) {
      logger.atFine().log(
          "Skipping record %s because no hosted zone matching record DNS Name was detected",
          recordSet.getDnsName());
      return;
    }
    ImmutableList<String> records = recordSet.wantedRecords();
    Action action = decide(recordSet);
    String prefix = dryRun ? "[dry-run] " : "";
    switch (action) {
      case NONE:
        return;
      case CREATE:
        logger.atInfo().log(
            "%sCreating records: %s: %s", prefix, recordSet.getKey(), COMMA_JOINER.join(records));
        if (!dryRun) {
          String id =
              designateClient.createRecordSet(
                  zoneId.get(),
                  RecordSetRequest.forCreate(
                      recordSet.getDnsName(), recordSet.getRecordType(), records, ttl(recordSet)));
          logger.atFine().log("Created record set %s", id);
        }
        return;
      case DELETE:
        logger.atInfo().log("%sDeleting records for %s", prefix, recordSet.getKey());
        if (!dryRun) {
          designateClient.deleteRecordSet(zoneId.get(), recordSet.getRecordSetId());
        }
        return;
      case UPDATE:
        logger.atInfo().log(
            "%sUpdating records: %s: %s", prefix, recordSet.getKey(), COMMA_JOINER.join(records));
        if (!dryRun) {
          designateClient.updateRecordSet(
              zoneId.get(),
              recordSet.getRecordSetId(),
              RecordSetRequest.forUpdate(records, ttl(recordSet)));
        }
        return;
    }
  }

  /** Returns the TTL to send, rejecting values Designate cannot store. */
  private static long ttl(AggregatedRecordSet recordSet) throws DesignateException {
    long ttl = recordSet.getTtl();
    if (ttl > Integer.MAX_VALUE) {
      throw new DesignateException(
          String.format("TTL %d of %s is out of range", ttl, recordSet.getKey()));
    }
    return ttl;
  }

  private static Optional<String> resolveZone(
      AggregatedRecordSet recordSet, Map<String, String> zones) {
    String zoneId = recordSet.getZoneId();
    if (!zoneId.isEmpty()) {
      return Optional.of(zoneId);
    }
    return ZoneMatcher.matchZone(recordSet.getDnsName(), zones);
  }
}
