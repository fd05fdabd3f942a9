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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.solver.type.ArchetypeType;
import net.hydromatic.solver.type.GenericParamType;
import net.hydromatic.solver.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Generic parameters of a declaration, and the requirements that they must
 * satisfy. */
public class GenericSignature {
  public static final GenericSignature EMPTY =
      new GenericSignature(ImmutableList.of(), ImmutableList.of());

  public final ImmutableList<GenericParamType> params;
  public final ImmutableList<Requirement> requirements;

  private final Map<GenericParamType, ArchetypeType> archetypes =
      new HashMap<>();

  private GenericSignature(ImmutableList<GenericParamType> params,
      ImmutableList<Requirement> requirements) {
    this.params = params;
    this.requirements = requirements;
  }

  /** Creates a generic signature. */
  public static GenericSignature of(List<GenericParamType> params,
      List<Requirement> requirements) {
    if (params.isEmpty() && requirements.isEmpty()) {
      return EMPTY;
    }
    return new GenericSignature(ImmutableList.copyOf(params),
        ImmutableList.copyOf(requirements));
  }

  /** Creates a generic signature without requirements. */
  public static GenericSignature of(GenericParamType... params) {
    return of(ImmutableList.copyOf(params), ImmutableList.of());
  }

  public boolean isEmpty() {
    return params.isEmpty();
  }

  @Override public String toString() {
    final StringBuilder buf = new StringBuilder("<");
    for (int i = 0; i < params.size(); i++) {
      buf.append(i > 0 ? ", " : "").append(params.get(i));
    }
    for (int i = 0; i < requirements.size(); i++) {
      buf.append(i > 0 ? ", " : " where ").append(requirements.get(i));
    }
    return buf.append('>').toString();
  }

  /**
   * Returns the archetype of a generic parameter: the abstract type that
   * stands for the parameter inside the declaration, conforming to the
   * protocols its requirements name.
   *
   * <p>Each parameter has one archetype, created on first request.
   */
  public ArchetypeType archetype(GenericParamType param) {
    return archetypes.computeIfAbsent(param, p -> {
      final ImmutableList.Builder<NominalDecl> protocols =
          ImmutableList.builder();
      Type superclass = null;
      for (Requirement requirement : requirements) {
        if (requirement.kind != Requirement.Kind.CONFORMANCE
            || requirement.first != p) {
          continue;
        }
        final NominalDecl decl =
            requireNonNull(requirement.second.nominalDecl());
        if (decl.isProtocol()) {
          protocols.add(decl);
        } else {
          superclass = requirement.second;
        }
      }
      return ArchetypeType.create(p.name, null, protocols.build(),
          superclass);
    });
  }

  /** Returns a map from each generic parameter to the corresponding type in
   * a list. */
  public ImmutableMap<GenericParamType, Type> substitutions(
      List<? extends Type> args) {
    final ImmutableMap.Builder<GenericParamType, Type> b =
        ImmutableMap.builder();
    for (int i = 0; i < params.size(); i++) {
      b.put(params.get(i), args.get(i));
    }
    return b.build();
  }

  /** Returns the generic parameter with a given name, or null. */
  public @Nullable GenericParamType param(String name) {
    for (GenericParamType param : params) {
      if (param.name.equals(name)) {
        return param;
      }
    }
    return null;
  }
}

// End GenericSignature.java
