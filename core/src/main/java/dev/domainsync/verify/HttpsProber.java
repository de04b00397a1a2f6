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

package dev.domainsync.verify;

import dev.domainsync.verify.VerificationLogEntry.HttpCheck;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.io.IOException;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;

/**
 * Checks that a hostname serves its site over HTTPS.
 *
 * <p>Redirects are followed and any final 2xx counts as reachable. Certificate errors, timeouts
 * and other status codes do not, and are reported rather than thrown.
 */
public class HttpsProber {

  private final OkHttpClient httpClient;

  @Inject
  public HttpsProber(@Named("probeHttpClient") OkHttpClient httpClient) {
    this.httpClient = httpClient;
  }

  public HttpCheck probe(String fqdn) {
    HttpUrl url = new HttpUrl.Builder().scheme("https").host(fqdn).build();
    Request request = new Request.Builder().url(url).get().build();
    try (Response response = httpClient.newCall(request).execute()) {
      if (response.isSuccessful()) {
        return new HttpCheck(true, response.code(), null);
      }
      return new HttpCheck(false, response.code(), "HTTP " + response.code());
    } catch (IOException e) {
      return new HttpCheck(false, null, e.toString());
    }
  }
}
