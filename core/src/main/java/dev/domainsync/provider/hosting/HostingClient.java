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

package dev.domainsync.provider.hosting;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Throwables;
import com.google.common.flogger.FluentLogger;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import dagger.Lazy;
import dev.domainsync.config.DomainSyncConfig.Config;
import dev.domainsync.provider.ProviderException;
import dev.domainsync.provider.ProviderException.PermanentProviderException;
import dev.domainsync.provider.ProviderException.TransientProviderException;
import dev.domainsync.provider.hosting.HostingModels.CustomDomain;
import dev.domainsync.provider.hosting.HostingModels.DnsRecordEntry;
import dev.domainsync.provider.hosting.HostingModels.DnsRecordSet;
import dev.domainsync.provider.hosting.HostingModels.ErrorResponse;
import dev.domainsync.util.Retrier;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.io.IOException;
import java.net.HttpURLConnection;
import java.util.Optional;
import java.util.concurrent.Callable;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Facade for the hosting provider's custom domain endpoints.
 *
 * <p>Attaching a hostname to a site makes the provider issue an ownership token, which must then
 * be published as a TXT record. Attaching a hostname that is already attached returns 409; the
 * client then reads the existing attachment instead.
 */
public class HostingClient {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private final OkHttpClient httpClient;
  private final Gson gson;
  private final HttpUrl baseUrl;
  private final Lazy<String> accessToken;
  private final Retrier retrier;
  private final String verificationPrefix;

  @Inject
  public HostingClient(
      @Named("hostingHttpClient") OkHttpClient httpClient,
      Gson gson,
      @Config("hostingBaseUrl") String baseUrl,
      @Config("hostingAccessToken") Lazy<String> accessToken,
      @Named("providerRetrier") Retrier retrier,
      @Config("verificationPrefix") String verificationPrefix) {
    this.httpClient = httpClient;
    this.gson = gson;
    HttpUrl parsed = HttpUrl.parse(baseUrl);
    checkArgument(parsed != null, "Invalid hosting base URL: %s", baseUrl);
    this.baseUrl = parsed;
    this.accessToken = accessToken;
    this.retrier = retrier;
    this.verificationPrefix = verificationPrefix;
  }

  /**
   * Resolves the access token, failing if it isn't configured.
   *
   * <p>Called before a batch starts so that a missing credential stops the run before any domain
   * is touched.
   */
  public void checkConfigured() {
    accessToken.get();
  }

  /** Attaches a hostname to a site and returns the ownership token the provider wants to see. */
  public AttachResult attachCustomDomain(String hostingSite, String fqdn)
      throws ProviderException {
    HttpUrl url =
        customDomainsUrl(hostingSite)
            .newBuilder()
            .addQueryParameter("customDomainId", fqdn)
            .build();
    Request request = newRequest(url).post(RequestBody.create("{}", JSON)).build();
    Optional<CustomDomain> created =
        withRetry(
            () -> {
              try (Response response = execute(request)) {
                if (response.code() == HttpURLConnection.HTTP_CONFLICT) {
                  return Optional.empty();
                }
                return Optional.of(parse(request, response, CustomDomain.class));
              }
            });
    CustomDomain domain;
    if (created.isPresent()) {
      domain = created.get();
    } else {
      logger.atInfo().log("%s is already attached to site %s.", fqdn, hostingSite);
      domain = getCustomDomain(hostingSite, fqdn);
    }
    if (domain.isOwnershipActive()) {
      return AttachResult.alreadyVerified();
    }
    return findToken(domain).map(AttachResult::tokenIssued).orElseGet(AttachResult::tokenPending);
  }

  /** Returns the provider's view of ownership and certificate state for a hostname. */
  public HostingDomainStatus getDomainStatus(String hostingSite, String fqdn)
      throws ProviderException {
    CustomDomain domain = getCustomDomain(hostingSite, fqdn);
    return new HostingDomainStatus(
        domain.isOwnershipActive(),
        SslState.fromCertState(domain.cert() == null ? null : domain.cert().state()));
  }

  private CustomDomain getCustomDomain(String hostingSite, String fqdn) throws ProviderException {
    HttpUrl url = customDomainsUrl(hostingSite).newBuilder().addPathSegment(fqdn).build();
    Request request = newRequest(url).get().build();
    return withRetry(
        () -> {
          try (Response response = execute(request)) {
            return parse(request, response, CustomDomain.class);
          }
        });
  }

  /** Finds the TXT record the provider wants published and strips the prefix from its value. */
  private Optional<String> findToken(CustomDomain domain) {
    if (domain.requiredDnsUpdates() == null) {
      return Optional.empty();
    }
    for (DnsRecordSet recordSet : domain.requiredDnsUpdates().desired()) {
      for (DnsRecordEntry entry : recordSet.records()) {
        if ("TXT".equals(entry.type())
            && entry.rdata() != null
            && entry.rdata().startsWith(verificationPrefix)) {
          return Optional.of(entry.rdata().substring(verificationPrefix.length()));
        }
      }
    }
    return Optional.empty();
  }

  private HttpUrl customDomainsUrl(String hostingSite) {
    return baseUrl
        .newBuilder()
        .addPathSegments("v1beta1/sites")
        .addPathSegment(hostingSite)
        .addPathSegment("customDomains")
        .build();
  }

  private Request.Builder newRequest(HttpUrl url) {
    return new Request.Builder().url(url).header("Authorization", "Bearer " + accessToken.get());
  }

  private <T> T withRetry(Callable<T> callable) throws ProviderException {
    return retrier.callWithRetry(callable, ProviderException::isRetryable, ProviderException.class);
  }

  private Response execute(Request request) throws ProviderException {
    logger.atFine().log("Executing hosting request: %s %s", request.method(), request.url());
    try {
      return httpClient.newCall(request).execute();
    } catch (IOException e) {
      throw new TransientProviderException(
          String.format("Error during %s request to %s", request.method(), request.url()), e);
    }
  }

  private <T> T parse(Request request, Response response, Class<T> type)
      throws ProviderException {
    try {
      ResponseBody responseBody = response.body();
      String body = responseBody == null ? "" : responseBody.string();
      if (!response.isSuccessful()) {
        throw parseErrorResponse(request, response.code(), body);
      }
      T parsed = gson.fromJson(body, type);
      if (parsed == null) {
        throw new PermanentProviderException(
            String.format("Hosting %s %s returned an empty body", request.method(), request.url()));
      }
      return parsed;
    } catch (JsonParseException e) {
      throw new PermanentProviderException("Failed to parse hosting response", e);
    } catch (IOException e) {
      Throwables.throwIfInstanceOf(e, ProviderException.class);
      throw new TransientProviderException("Failed to read hosting response", e);
    }
  }

  /** Turns an unsuccessful response into the matching {@link ProviderException}. */
  private ProviderException parseErrorResponse(Request request, int statusCode, String body) {
    String detail = body;
    try {
      ErrorResponse error = gson.fromJson(body, ErrorResponse.class);
      if (error != null && error.error() != null && error.error().message() != null) {
        detail = error.error().message();
      }
    } catch (JsonParseException e) {
      logger.atFine().log("Unparseable hosting error body: %s", body);
    }
    return ProviderException.forStatus(
        String.format("Hosting %s %s", request.method(), request.url().encodedPath()),
        statusCode,
        detail);
  }
}
