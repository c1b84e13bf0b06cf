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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Set;

/**
 * Hands out compiler-generated names that cannot capture or shadow a name of the program.
 *
 * <p>Ids come from the compilation's {@link UniqueIdSupplier}, so two rewrites never share a name.
 * Ids that would spell a name already present in the tree are skipped.
 */
final class HygienicNameGenerator {
  private final UniqueIdSupplier idSupplier;
  private final Set<String> reservedNames;

  /**
   * @param reservedNames the names already used by the program; generated names are added to it
   */
  HygienicNameGenerator(UniqueIdSupplier idSupplier, Set<String> reservedNames) {
    this.idSupplier = idSupplier;
    this.reservedNames = reservedNames;
  }

  /**
   * Returns a fresh id such that {@code prefix + id} is unused for every given prefix, and reserves
   * those names.
   */
  String generateId(String... prefixes) {
    checkArgument(prefixes.length > 0);
    while (true) {
      String id = idSupplier.getUniqueId();
      if (isFree(id, prefixes)) {
        for (String prefix : prefixes) {
          reservedNames.add(prefix + id);
        }
        return id;
      }
    }
  }

  /** Returns a fresh name starting with {@code prefix}, and reserves it. */
  String generateName(String prefix) {
    return prefix + generateId(prefix);
  }

  private boolean isFree(String id, String[] prefixes) {
    for (String prefix : prefixes) {
      if (reservedNames.contains(prefix + id)) {
        return false;
      }
    }
    return true;
  }
}
