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

package dev.domainsync.provider;

import java.io.IOException;
import java.util.Optional;
import java.util.OptionalInt;
import javax.annotation.Nullable;

/**
 * An error returned by, or while talking to, an external provider.
 *
 * <p>Subclasses separate failures worth retrying from those that are not. Network failures, 5xx
 * responses and rate limiting are {@link TransientProviderException}s; every other 4xx response is
 * a {@link PermanentProviderException}.
 */
public class ProviderException extends IOException {

  @Nullable private final Integer statusCode;
  @Nullable private final String responseBody;

  public ProviderException(String message) {
    this(message, null, null, null);
  }

  public ProviderException(String message, Throwable cause) {
    this(message, null, null, cause);
  }

  protected ProviderException(
      String message,
      @Nullable Integer statusCode,
      @Nullable String responseBody,
      @Nullable Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
    this.responseBody = responseBody;
  }

  public OptionalInt getStatusCode() {
    return statusCode == null ? OptionalInt.empty() : OptionalInt.of(statusCode);
  }

  public Optional<String> getResponseBody() {
    return Optional.ofNullable(responseBody);
  }

  /** Returns whether the failure may succeed on retry. */
  public boolean isTransient() {
    return false;
  }

  /** Predicate for {@code Retrier}: only transient provider failures are retried. */
  public static boolean isRetryable(Throwable t) {
    return t instanceof ProviderException && ((ProviderException) t).isTransient();
  }

  /** Creates the exception matching an unsuccessful HTTP status code. */
  public static ProviderException forStatus(String operation, int statusCode, String body) {
    String message = String.format("%s failed with HTTP %d: %s", operation, statusCode, body);
    if (statusCode == 429) {
      return new RateLimitedException(message, statusCode, body);
    }
    if (statusCode >= 500) {
      return new TransientProviderException(message, statusCode, body, null);
    }
    if (statusCode == 401 || statusCode == 403) {
      return new AuthorizationException(message, statusCode, body);
    }
    return new PermanentProviderException(message, statusCode, body);
  }

  /** A network failure, timeout or 5xx response. */
  public static class TransientProviderException extends ProviderException {

    public TransientProviderException(String message, Throwable cause) {
      super(message, null, null, cause);
    }

    TransientProviderException(
        String message,
        @Nullable Integer statusCode,
        @Nullable String body,
        @Nullable Throwable cause) {
      super(message, statusCode, body, cause);
    }

    @Override
    public boolean isTransient() {
      return true;
    }
  }

  /** The provider rejected the call with HTTP 429. */
  public static class RateLimitedException extends TransientProviderException {
    RateLimitedException(String message, int statusCode, String body) {
      super(message, statusCode, body, null);
    }
  }

  /** A 4xx response other than 429. Retrying will not help. */
  public static class PermanentProviderException extends ProviderException {

    public PermanentProviderException(String message) {
      super(message, null, null, null);
    }

    public PermanentProviderException(String message, Throwable cause) {
      super(message, null, null, cause);
    }

    PermanentProviderException(String message, int statusCode, String body) {
      super(message, statusCode, body, null);
    }
  }

  /** The provider rejected our credentials with HTTP 401 or 403. */
  public static class AuthorizationException extends PermanentProviderException {
    AuthorizationException(String message, int statusCode, String body) {
      super(message, statusCode, body);
    }
  }
}
