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
package net.hydromatic.solver.decl;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.solver.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Evidence that a type conforms to a protocol, with the type that witnesses
 * each associated type of the protocol. */
public class Conformance {
  public final Type type;
  public final NominalDecl protocol;
  private final ImmutableMap<String, Type> typeWitnesses;

  public Conformance(Type type, NominalDecl protocol,
      Map<String, Type> typeWitnesses) {
    this.type = requireNonNull(type);
    this.protocol = requireNonNull(protocol);
    this.typeWitnesses = ImmutableMap.copyOf(typeWitnesses);
  }

  @Override public String toString() {
    return type + ": " + protocol.name;
  }

  /** Returns the type that witnesses an associated type, or null if the
   * conformance does not record one. */
  public @Nullable Type typeWitness(AssociatedTypeDecl assocType) {
    return typeWitnesses.get(assocType.name);
  }

  public ImmutableMap<String, Type> typeWitnesses() {
    return typeWitnesses;
  }

  /** Returns whether every associated type of the protocol, and of the
   * protocols it refines, has a witness. */
  public boolean isComplete() {
    for (NominalDecl p : protocol.allProtocols()) {
      for (Decl member : p.members()) {
        if (member instanceof AssociatedTypeDecl
            && !typeWitnesses.containsKey(member.name)) {
          return false;
        }
      }
    }
    return true;
  }
}

// End Conformance.java
