/*
 * Copyright 2018 Davide Maestroni
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package dm.pact.util;

import org.jetbrains.annotations.NotNull;

/**
 * Utility class for telling apart the failures that must never be handled as a rejection.
 * <p>
 * Created by davide-maestroni on 03/20/2018.
 */
@SuppressWarnings("WeakerAccess")
public class FatalErrors {

  /**
   * Avoid explicit instantiation.
   */
  protected FatalErrors() {
    ConstantConditions.avoid();
  }

  /**
   * Checks if the specified throwable is an error of the virtual machine, like a stack overflow or
   * an out of memory error.
   *
   * @param t the throwable.
   * @return whether the throwable is fatal.
   */
  public static boolean isFatal(@NotNull final Throwable t) {
    return (t instanceof VirtualMachineError);
  }

  /**
   * Re-throws the specified throwable if fatal.
   *
   * @param t the throwable.
   * @throws java.lang.VirtualMachineError if the throwable is fatal.
   */
  public static void throwIfFatal(@NotNull final Throwable t) {
    if (isFatal(t)) {
      throw (VirtualMachineError) t;
    }
  }
}
