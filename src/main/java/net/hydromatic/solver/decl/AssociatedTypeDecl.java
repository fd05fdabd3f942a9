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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import net.hydromatic.solver.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Declaration of an associated type of a protocol.
 *
 * <p>Its interface type is the dependent member type {@code Self.Name}. */
public class AssociatedTypeDecl extends Decl {
  /** Protocols that the associated type must conform to. */
  public final ImmutableList<NominalDecl> conformsTo;

  /** Class that the associated type must inherit from, or null. */
  public final @Nullable Type superclass;

  AssociatedTypeDecl(String name, NominalDecl protocol,
      List<NominalDecl> conformsTo, @Nullable Type superclass) {
    super(name, protocol, ImmutableSet.of());
    checkArgument(protocol.isProtocol(), "not a protocol: %s", protocol);
    this.conformsTo = ImmutableList.copyOf(conformsTo);
    this.superclass = superclass;
  }

  /** Returns the protocol that declares this associated type. */
  public NominalDecl protocol() {
    return requireNonNull(owner);
  }

  @Override public boolean isInstanceMember() {
    return false;
  }

  @Override public Type resultInterfaceType() {
    return interfaceType();
  }
}

// End AssociatedTypeDecl.java
