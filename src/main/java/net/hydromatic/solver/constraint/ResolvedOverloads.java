/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.solver.constraint;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.solver.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** The overloads that have been resolved in a solve session, in the order
 * they were resolved, indexed by locator.
 *
 * <p>Appends are recorded on the system's trail, so backtracking removes
 * the overloads that were resolved on the abandoned branch. */
public class ResolvedOverloads {
  private final Trail trail;
  private final List<ResolvedOverload> list = new ArrayList<>();
  private final Map<ConstraintLocator, ResolvedOverload> byLocator =
      new HashMap<>();

  ResolvedOverloads(Trail trail) {
    this.trail = trail;
  }

  /** Returns the most recently resolved overload, or null. */
  public @Nullable ResolvedOverload head() {
    return list.isEmpty() ? null : list.get(list.size() - 1);
  }

  /** Returns the overload resolved at a locator, or null. */
  public @Nullable ResolvedOverload get(ConstraintLocator locator) {
    return byLocator.get(locator);
  }

  public int size() {
    return list.size();
  }

  /** Returns the resolved overloads, oldest first. */
  public ImmutableList<ResolvedOverload> toList() {
    return ImmutableList.copyOf(list);
  }

  ResolvedOverload append(Type boundType, OverloadChoice choice,
      ConstraintLocator locator, Type openedFullType, Type refType) {
    final ResolvedOverload item =
        new ResolvedOverload(boundType, choice, locator, openedFullType,
            refType, head());
    list.add(item);
    final ResolvedOverload replaced = byLocator.put(locator, item);
    trail.record(() -> {
      list.remove(list.size() - 1);
      if (replaced == null) {
        byLocator.remove(locator);
      } else {
        byLocator.put(locator, replaced);
      }
    });
    return item;
  }
}

// End ResolvedOverloads.java
