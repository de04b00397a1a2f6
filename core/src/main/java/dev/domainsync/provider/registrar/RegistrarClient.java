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

package dev.domainsync.provider.registrar;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.common.util.concurrent.RateLimiter;
import dev.domainsync.config.DomainSyncConfig.Config;
import dev.domainsync.config.RegistrarCredentials;
import dev.domainsync.provider.ProviderException;
import dev.domainsync.provider.ProviderException.PermanentProviderException;
import dev.domainsync.provider.ProviderException.TransientProviderException;
import dev.domainsync.util.Retrier;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.io.IOException;
import java.net.HttpURLConnection;
import java.util.List;
import java.util.concurrent.Callable;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * A client for the registrar's DNS records API.
 *
 * <p>Record sets are addressed by root domain, record type and record name, e.g. {@code
 * /v1/domains/2100.cool/records/A/asoos}. A {@code PUT} replaces the whole set and a {@code PUT}
 * with an empty list deletes it. A {@code GET} for a set that doesn't exist returns 404, which
 * this client reports as an empty list.
 *
 * <p>Every call passes through a rate limiter shared by all workers, and transient failures are
 * retried with exponential backoff. Both reads and writes are idempotent, so retrying is safe.
 */
public class RegistrarClient {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  /** Largest page the registrar returns when listing domains. */
  private static final int LIST_DOMAINS_LIMIT = 500;

  private final OkHttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final HttpUrl baseUrl;
  private final RegistrarCredentials credentials;
  private final RateLimiter rateLimiter;
  private final Retrier retrier;

  @Inject
  public RegistrarClient(
      @Named("registrarHttpClient") OkHttpClient httpClient,
      ObjectMapper objectMapper,
      @Config("registrarBaseUrl") String baseUrl,
      RegistrarCredentials credentials,
      @Named("registrarRateLimiter") RateLimiter rateLimiter,
      @Named("providerRetrier") Retrier retrier) {
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    HttpUrl parsed = HttpUrl.parse(baseUrl);
    checkArgument(parsed != null, "Invalid registrar base URL: %s", baseUrl);
    this.baseUrl = parsed;
    this.credentials = credentials;
    this.rateLimiter = rateLimiter;
    this.retrier = retrier;
  }

  /** Returns the records of one record set, or an empty list if the set doesn't exist. */
  public ImmutableList<DnsRecord> getRecords(String rootDomain, String recordName, RecordType type)
      throws ProviderException {
    Request request = newRequest(recordsUrl(rootDomain, recordName, type)).get().build();
    return withRetry(
        () -> {
          try (Response response = logAndExecuteRequest(request)) {
            if (response.code() == HttpURLConnection.HTTP_NOT_FOUND) {
              return ImmutableList.of();
            }
            String body = checkSuccessful(request, response);
            return ImmutableList.copyOf(parseList(body, DnsRecord.class));
          }
        });
  }

  /**
   * Replaces one record set with the given records. An empty list deletes the set.
   *
   * <p>Only the data and TTL of each record are sent.
   */
  public void putRecords(
      String rootDomain, String recordName, RecordType type, List<DnsRecord> records)
      throws ProviderException {
    String json;
    try {
      json = objectMapper.writeValueAsString(records);
    } catch (JsonProcessingException e) {
      throw new PermanentProviderException("Failed to serialize records", e);
    }
    Request request =
        newRequest(recordsUrl(rootDomain, recordName, type))
            .put(RequestBody.create(json, JSON))
            .build();
    withRetry(
        () -> {
          try (Response response = logAndExecuteRequest(request)) {
            checkSuccessful(request, response);
            return null;
          }
        });
  }

  /** Deletes one record set. Deleting a set that doesn't exist is not an error. */
  public void deleteRecords(String rootDomain, String recordName, RecordType type)
      throws ProviderException {
    putRecords(rootDomain, recordName, type, ImmutableList.of());
  }

  /** Lists the names of the active domains in the registrar account. */
  public ImmutableList<String> listActiveDomains() throws ProviderException {
    HttpUrl url =
        baseUrl
            .newBuilder()
            .addPathSegments("v1/domains")
            .addQueryParameter("limit", String.valueOf(LIST_DOMAINS_LIMIT))
            .addQueryParameter("statuses", "ACTIVE")
            .build();
    Request request = newRequest(url).get().build();
    List<RegistrarDomain> domains =
        withRetry(
            () -> {
              try (Response response = logAndExecuteRequest(request)) {
                return parseList(checkSuccessful(request, response), RegistrarDomain.class);
              }
            });
    return domains.stream().map(RegistrarDomain::getDomain).collect(toImmutableList());
  }

  private HttpUrl recordsUrl(String rootDomain, String recordName, RecordType type) {
    return baseUrl
        .newBuilder()
        .addPathSegments("v1/domains")
        .addPathSegment(rootDomain)
        .addPathSegment("records")
        .addPathSegment(type.name())
        .addPathSegment(recordName)
        .build();
  }

  private Request.Builder newRequest(HttpUrl url) {
    return new Request.Builder()
        .url(url)
        .header("Authorization", credentials.authorizationHeader())
        .header("Accept", "application/json");
  }

  private <T> T withRetry(Callable<T> callable) throws ProviderException {
    return retrier.callWithRetry(callable, ProviderException::isRetryable, ProviderException.class);
  }

  private Response logAndExecuteRequest(Request request) throws ProviderException {
    rateLimiter.acquire();
    logger.atFine().log("Executing registrar request: %s %s", request.method(), request.url());
    long startTime = System.currentTimeMillis();
    Response response;
    try {
      response = httpClient.newCall(request).execute();
    } catch (IOException e) {
      throw new TransientProviderException(
          String.format("Error during %s request to %s", request.method(), request.url()), e);
    }
    logger.atFine().log(
        "Completed registrar request in %d ms, response code: %d",
        System.currentTimeMillis() - startTime, response.code());
    return response;
  }

  /** Returns the response body, throwing the matching exception if the call was unsuccessful. */
  private static String checkSuccessful(Request request, Response response)
      throws ProviderException {
    String body;
    try {
      ResponseBody responseBody = response.body();
      body = responseBody == null ? "" : responseBody.string();
    } catch (IOException e) {
      throw new TransientProviderException("Failed to read registrar response body", e);
    }
    if (!response.isSuccessful()) {
      throw ProviderException.forStatus(
          String.format("Registrar %s %s", request.method(), request.url().encodedPath()),
          response.code(),
          body);
    }
    return body;
  }

  private <T> List<T> parseList(String body, Class<T> elementType) throws ProviderException {
    try {
      return objectMapper.readValue(
          body, objectMapper.getTypeFactory().constructCollectionType(List.class, elementType));
    } catch (JsonProcessingException e) {
      throw new PermanentProviderException("Failed to parse registrar response", e);
    }
  }
}
