/*
 * Copyright 2025 The Rustfront Authors.
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

package org.rustfront.compiler;

import java.io.Serializable;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Generates unique String Ids when requested via a compiler instance.
 *
 * <p>One supplier exists per {@link Compiler}, so Ids are unique across every module and every
 * pass of a compilation and restart from zero for the next compilation. The counter is atomic, so
 * passes running on different modules concurrently never receive the same Id.
 */
public final class UniqueIdSupplier implements Serializable {
  private static final long serialVersionUID = 1L;

  private final AtomicInteger counter = new AtomicInteger();

  UniqueIdSupplier() {}

  /** Creates and returns a unique Id across the whole compilation. */
  public String getUniqueId() {
    return String.valueOf(counter.getAndIncrement());
  }

  /** Returns the number of Ids handed out so far. */
  public int getIssuedCount() {
    return counter.get();
  }
}
