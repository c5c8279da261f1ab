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

package designate.webhook.client;

import designate.webhook.client.model.RecordSet;
import designate.webhook.client.model.RecordSetRequest;
import designate.webhook.client.model.Zone;

/** Interface between the reconciliation logic and the Designate DNS API. */
public interface DesignateClient {

  /** Receives the items of a paged listing one at a time. */
  @FunctionalInterface
  interface Handler<T> {
    void handle(T item) throws DesignateException;
  }

  /** Calls the handler for each zone visible to the authenticated project. */
  void forEachZone(Handler<Zone> handler) throws DesignateException;

  /** Calls the handler for each record set in the given zone. */
  void forEachRecordSet(String zoneId, Handler<RecordSet> handler) throws DesignateException;

  /**
   * Creates a record set in the given zone.
   *
   * @return the id assigned to the new record set
   */
  String createRecordSet(String zoneId, RecordSetRequest request) throws DesignateException;

  /** Replaces the records and TTL of an existing record set. */
  void updateRecordSet(String zoneId, String recordSetId, RecordSetRequest request)
      throws DesignateException;

  /** Deletes a record set. */
  void deleteRecordSet(String zoneId, String recordSetId) throws DesignateException;
}
