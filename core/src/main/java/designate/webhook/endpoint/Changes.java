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

import static designate.webhook.util.CollectionUtils.nullToEmptyImmutableCopy;

import com.google.common.collect.ImmutableList;
import com.google.gson.annotations.Expose;
import com.google.gson.annotations.SerializedName;
import java.util.List;

/**
 * A batch of endpoint changes planned by external-dns.
 *
 * <p>{@code updateOld} and {@code updateNew} are expected to be paired: each target removed by an
 * update-old entry is replaced by the targets of the update-new entry for the same name and type.
 */
public record Changes(
    @Expose @SerializedName("Create") List<Endpoint> create,
    @Expose @SerializedName("UpdateOld") List<Endpoint> updateOld,
    @Expose @SerializedName("UpdateNew") List<Endpoint> updateNew,
    @Expose @SerializedName("Delete") List<Endpoint> delete) {

  public Changes {
    create = nullToEmptyImmutableCopy(create);
    updateOld = nullToEmptyImmutableCopy(updateOld);
    updateNew = nullToEmptyImmutableCopy(updateNew);
    delete = nullToEmptyImmutableCopy(delete);
  }

  public static Changes ofCreates(List<Endpoint> create) {
    return new Changes(create, ImmutableList.of(), ImmutableList.of(), ImmutableList.of());
  }

  public static Changes ofUpdates(List<Endpoint> updateOld, List<Endpoint> updateNew) {
    return new Changes(ImmutableList.of(), updateOld, updateNew, ImmutableList.of());
  }

  public static Changes ofDeletes(List<Endpoint> delete) {
    return new Changes(ImmutableList.of(), ImmutableList.of(), ImmutableList.of(), delete);
  }

  public boolean isEmpty() {
    return create.isEmpty() && updateOld.isEmpty() && updateNew.isEmpty() && delete.isEmpty();
  }

  public int size() {
    return create.size() + updateOld.size() + updateNew.size() + delete.size();
  }
}
