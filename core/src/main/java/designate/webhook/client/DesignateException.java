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

import java.io.IOException;
import java.util.OptionalInt;

/**
 * Failure talking to, or reported by, the Designate service.
 *
 * <p>The nested subclasses tell the reconciliation layers which phase failed. None of them is
 * retried by the webhook itself.
 */
public class DesignateException extends IOException {

  private static final int NO_STATUS = -1;

  private final int httpStatus;

  public DesignateException(String message) {
    this(message, NO_STATUS, null);
  }

  public DesignateException(String message, Throwable cause) {
    this(message, NO_STATUS, cause);
  }

  public DesignateException(String message, int httpStatus, Throwable cause) {
    super(message, cause);
    this.httpStatus = httpStatus;
  }

  /** The HTTP status code returned by Designate or Keystone, if a response was received. */
  public OptionalInt getHttpStatus() {
    return httpStatus == NO_STATUS ? OptionalInt.empty() : OptionalInt.of(httpStatus);
  }

  /** Thrown when Keystone rejects the credentials or Designate rejects the token. */
  public static class DesignateAuthenticationException extends DesignateException {
    public DesignateAuthenticationException(String message, int httpStatus) {
      super(message, httpStatus, null);
    }

    public DesignateAuthenticationException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** Thrown when the managed zones cannot be enumerated. Aborts the whole call. */
  public static class ZoneListingException extends DesignateException {
    public ZoneListingException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** Thrown when the record sets of a zone cannot be enumerated. Aborts the read phase. */
  public static class RecordListingException extends DesignateException {
    public RecordListingException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** Thrown when creating, updating or deleting a single record set fails. */
  public static class RecordMutationException extends DesignateException {
    public RecordMutationException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
