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

package dev.domainsync.tools;

import com.google.common.collect.ImmutableMap;

/** Container class to create and run DomainSync commands. */
public final class DomainSyncTool {

  /**
   * Available commands.
   *
   * <p><b>Note:</b> If changing the command-line name of any commands below, remember to resolve
   * any invocations in scripts (e.g. cron jobs or deploy hooks).
   */
  public static final ImmutableMap<String, Class<? extends Command>> COMMAND_MAP =
      new ImmutableMap.Builder<String, Class<? extends Command>>()
          .put("add_verification", AddVerificationCommand.class)
          .put("list_domains", ListDomainsCommand.class)
          .put("reconcile", ReconcileCommand.class)
          .put("schedule", ScheduleCommand.class)
          .put("status", StatusCommand.class)
          .put("verify", VerifyCommand.class)
          .build();

  public static void main(String[] args) throws Exception {
    System.exit(new DomainSyncCli("domainsync", COMMAND_MAP).run(args));
  }

  private DomainSyncTool() {}
}
