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

import com.google.common.base.Throwables;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.Optional;

/** Hands a parsed command to the Dagger component that fills in its fields. */
final class Injector {

  /**
   * Calls the component's {@code inject} overload for the command's exact class.
   *
   * <p>A failure inside the component, like a missing credential, surfaces unwrapped so the CLI can
   * map it to an exit code.
   *
   * @return whether the component declares an overload for this command
   */
  static <T> boolean injectReflectively(Class<T> componentType, T component, Object command) {
    Optional<Method> injector =
        Arrays.stream(componentType.getMethods())
            .filter(m -> m.getName().equals("inject") && m.getParameterCount() == 1)
            .filter(m -> m.getParameterTypes()[0] == command.getClass())
            .findFirst();
    if (injector.isEmpty()) {
      return false;
    }
    try {
      injector.get().invoke(component, command);
    } catch (InvocationTargetException e) {
      Throwables.throwIfUnchecked(e.getCause());
      throw new IllegalStateException("Injection failed for " + command.getClass(), e.getCause());
    } catch (IllegalAccessException e) {
      throw new IllegalStateException(e);
    }
    return true;
  }

  private Injector() {}
}
