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
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.solver.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Declaration of a nominal type: a struct, enum, class or protocol.
 *
 * <p>Create instances using the factory methods of {@link Module}, which
 * also assign the declared type.
 */
public class NominalDecl extends Decl {
  public final Kind kind;
  private GenericSignature genericSignature;

  /** For a class, its superclass type, or null. */
  public final @Nullable Type superclass;

  /** For a protocol, the protocols that it refines. */
  public final ImmutableList<NominalDecl> inheritedProtocols;

  private final List<Decl> members = new ArrayList<>();
  private @Nullable Type declaredInterfaceType;

  NominalDecl(Kind kind, String name, @Nullable NominalDecl owner,
      GenericSignature genericSignature, @Nullable Type superclass,
      List<NominalDecl> inheritedProtocols) {
    super(name, owner, ImmutableSet.of());
    this.kind = requireNonNull(kind);
    this.genericSignature = requireNonNull(genericSignature);
    this.superclass = superclass;
    this.inheritedProtocols = ImmutableList.copyOf(inheritedProtocols);
    checkArgument(superclass == null || kind == Kind.CLASS,
        "only a class may have a superclass");
    for (NominalDecl p : inheritedProtocols) {
      checkArgument(p.isProtocol(), "not a protocol: %s", p);
    }
  }

  public boolean isProtocol() {
    return kind == Kind.PROTOCOL;
  }

  public boolean isClass() {
    return kind == Kind.CLASS;
  }

  /** Returns whether this type has generic parameters. A protocol is not
   * generic, even though its signature has a {@code Self} parameter. */
  public boolean isGeneric() {
    return !isProtocol() && !genericSignature.isEmpty();
  }

  /** Returns the generic signature of this type. For a protocol, the
   * signature has a single parameter, {@code Self}, that conforms to the
   * protocol. */
  public GenericSignature genericSignature() {
    return genericSignature;
  }

  void setGenericSignature(GenericSignature genericSignature) {
    checkState(this.genericSignature.isEmpty(),
        "signature of %s already set", this);
    this.genericSignature = requireNonNull(genericSignature);
  }

  /** Returns the type of a value of this type, written in terms of its own
   * generic parameters; for example {@code Array<T>}. */
  public Type declaredInterfaceType() {
    return requireNonNull(declaredInterfaceType);
  }

  void setDeclaredInterfaceType(Type type) {
    checkState(declaredInterfaceType == null);
    declaredInterfaceType = requireNonNull(type);
  }

  /** Returns the {@code Self} parameter of a protocol. */
  public Type selfType() {
    checkState(isProtocol(), "not a protocol: %s", this);
    return genericSignature.params.get(0);
  }

  void addMember(Decl member) {
    checkArgument(member.owner == this, "member %s is not owned by %s",
        member, this);
    members.add(member);
  }

  /** Returns the members declared directly in this type. */
  public List<Decl> members() {
    return members;
  }

  /** Returns the members declared directly in this type that have a given
   * name. */
  public List<Decl> lookupDirect(String name) {
    final ImmutableList.Builder<Decl> b = ImmutableList.builder();
    for (Decl member : members) {
      if (member.name.equals(name)) {
        b.add(member);
      }
    }
    return b.build();
  }

  /** Returns the associated type of this protocol, or a protocol that it
   * refines, with a given name. */
  public @Nullable AssociatedTypeDecl lookupAssociatedType(String name) {
    for (NominalDecl protocol : allProtocols()) {
      for (Decl member : protocol.lookupDirect(name)) {
        if (member instanceof AssociatedTypeDecl) {
          return (AssociatedTypeDecl) member;
        }
      }
    }
    return null;
  }

  /** For a protocol, returns this protocol and every protocol it refines,
   * directly or indirectly, this protocol first. */
  public Set<NominalDecl> allProtocols() {
    final Set<NominalDecl> set = new LinkedHashSet<>();
    collectProtocols(set);
    return set;
  }

  private void collectProtocols(Set<NominalDecl> set) {
    if (set.add(this)) {
      inheritedProtocols.forEach(p -> p.collectProtocols(set));
    }
  }

  /** Returns whether this protocol is, or refines, a given protocol. */
  public boolean inheritsFrom(NominalDecl protocol) {
    if (this == protocol) {
      return true;
    }
    for (NominalDecl p : inheritedProtocols) {
      if (p.inheritsFrom(protocol)) {
        return true;
      }
    }
    return false;
  }

  /** Returns the declaration of the superclass of this class, or null. */
  public @Nullable NominalDecl superclassDecl() {
    return superclass == null ? null : superclass.nominalDecl();
  }

  /** Returns whether this class is, or is derived from, a given class. */
  public boolean isSubclassOf(NominalDecl classDecl) {
    for (NominalDecl d = this; d != null; d = d.superclassDecl()) {
      if (d == classDecl) {
        return true;
      }
    }
    return false;
  }

  @Override public Type resultInterfaceType() {
    return declaredInterfaceType();
  }

  /** A nested type is a member of its enclosing type, not of instances of
   * it. */
  @Override public boolean isInstanceMember() {
    return false;
  }

  /** Kind of nominal type. */
  public enum Kind {
    STRUCT,
    ENUM,
    CLASS,
    PROTOCOL
  }
}

// End NominalDecl.java
