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

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Maps;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.solver.type.AnyFunctionType;
import net.hydromatic.solver.type.ArchetypeType;
import net.hydromatic.solver.type.DynamicSelfType;
import net.hydromatic.solver.type.FnType;
import net.hydromatic.solver.type.GenericParamType;
import net.hydromatic.solver.type.MetatypeType;
import net.hydromatic.solver.type.ModuleType;
import net.hydromatic.solver.type.NominalType;
import net.hydromatic.solver.type.Type;
import net.hydromatic.solver.type.TypeSystem;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Module, a registry of declarations that answers the questions of a
 * {@link SemanticContext}.
 *
 * <p>Declarations, conformances and the special roles of protocols and
 * literal types are registered explicitly. The first module created in a
 * {@link TypeSystem} also declares the enums {@code Optional<T>} and
 * {@code ImplicitlyUnwrappedOptional<T>}.
 */
public class Module implements SemanticContext {
  public final String name;
  private final TypeSystem typeSystem;
  private final Map<String, NominalDecl> types = new LinkedHashMap<>();
  private final ListMultimap<String, Decl> globals =
      ArrayListMultimap.create();
  private final ListMultimap<NominalDecl, Conformance> conformances =
      ArrayListMultimap.create();
  private final Map<KnownProtocol, NominalDecl> knownProtocols =
      new EnumMap<>(KnownProtocol.class);
  private final Map<NominalDecl, Type> defaultLiteralTypes = new HashMap<>();
  private final Set<NominalDecl> bridged = new HashSet<>();

  /** Creates a Module. */
  public Module(String name, TypeSystem typeSystem) {
    this.name = requireNonNull(name);
    this.typeSystem = requireNonNull(typeSystem);
    if (typeSystem.optionalDecl() == null) {
      final NominalDecl optional = enumDecl("Optional", "T");
      final NominalDecl iuo = enumDecl("ImplicitlyUnwrappedOptional", "T");
      typeSystem.setOptionalDecls(optional, iuo);
    } else {
      register(requireNonNull(typeSystem.optionalDecl()));
      register(requireNonNull(typeSystem.implicitlyUnwrappedOptionalDecl()));
    }
  }

  @Override public String toString() {
    return name;
  }

  @Override public TypeSystem typeSystem() {
    return typeSystem;
  }

  /** Returns the type of a reference to this module. */
  public ModuleType moduleType() {
    return typeSystem.moduleType(this);
  }

  // Declaring types

  /** Creates generic parameters at depth 0. */
  public ImmutableList<GenericParamType> genericParams(String... names) {
    final ImmutableList.Builder<GenericParamType> b = ImmutableList.builder();
    for (int i = 0; i < names.length; i++) {
      b.add(typeSystem.genericParam(0, i, names[i]));
    }
    return b.build();
  }

  /** Declares a struct. */
  public NominalDecl struct(String name, String... genericParams) {
    return nominal(NominalDecl.Kind.STRUCT, name,
        GenericSignature.of(genericParams(genericParams), ImmutableList.of()),
        null);
  }

  /** Declares an enum. */
  public NominalDecl enumDecl(String name, String... genericParams) {
    return nominal(NominalDecl.Kind.ENUM, name,
        GenericSignature.of(genericParams(genericParams), ImmutableList.of()),
        null);
  }

  /** Declares a class. */
  public NominalDecl classDecl(String name, @Nullable NominalDecl superclass) {
    return nominal(NominalDecl.Kind.CLASS, name, GenericSignature.EMPTY,
        superclass == null ? null : superclass.declaredInterfaceType());
  }

  /** Declares a struct, enum or class with a given generic signature. */
  public NominalDecl nominal(NominalDecl.Kind kind, String name,
      GenericSignature signature, @Nullable Type superclass) {
    checkArgument(kind != NominalDecl.Kind.PROTOCOL,
        "use protocol() to declare a protocol");
    final NominalDecl decl =
        new NominalDecl(kind, name, null, GenericSignature.EMPTY, superclass,
            ImmutableList.of());
    decl.setGenericSignature(signature);
    decl.setDeclaredInterfaceType(
        typeSystem.nominalType(decl, signature.params));
    return register(decl);
  }

  /** Declares a struct, enum or class inside another type. It is found by
   * member lookup on the enclosing type, not by unqualified lookup. */
  public NominalDecl nestedType(NominalDecl owner, NominalDecl.Kind kind,
      String name) {
    checkArgument(kind != NominalDecl.Kind.PROTOCOL,
        "a protocol cannot be nested");
    final NominalDecl decl =
        new NominalDecl(kind, name, owner, GenericSignature.EMPTY, null,
            ImmutableList.of());
    decl.setDeclaredInterfaceType(
        typeSystem.nominalType(decl, ImmutableList.of()));
    decl.setInterfaceType(
        typeSystem.metatypeType(decl.declaredInterfaceType()));
    owner.addMember(decl);
    return decl;
  }

  /** Declares a protocol. Its signature has a {@code Self} parameter that
   * conforms to the protocol. */
  public NominalDecl protocol(String name, NominalDecl... inherited) {
    final NominalDecl decl =
        new NominalDecl(NominalDecl.Kind.PROTOCOL, name, null,
            GenericSignature.EMPTY, null, Arrays.asList(inherited));
    final Type existential = typeSystem.nominalType(decl, ImmutableList.of());
    final GenericParamType self = typeSystem.genericParam(0, 0, "Self");
    decl.setGenericSignature(
        GenericSignature.of(ImmutableList.of(self),
            ImmutableList.of(Requirement.conformance(self, existential))));
    decl.setDeclaredInterfaceType(existential);
    return register(decl);
  }

  private NominalDecl register(NominalDecl decl) {
    if (!decl.hasInterfaceType()) {
      decl.setInterfaceType(
          typeSystem.metatypeType(decl.declaredInterfaceType()));
    }
    types.put(decl.name, decl);
    return decl;
  }

  /** Declares an associated type of a protocol. */
  public AssociatedTypeDecl associatedType(NominalDecl protocol, String name,
      List<NominalDecl> conformsTo, @Nullable Type superclass) {
    final AssociatedTypeDecl decl =
        new AssociatedTypeDecl(name, protocol, conformsTo, superclass);
    decl.setInterfaceType(
        typeSystem.dependentMemberType(protocol.selfType(), decl));
    protocol.addMember(decl);
    return decl;
  }

  /** Returns the type declared in this module with a given name, or
   * null. */
  public @Nullable NominalDecl lookupType(String name) {
    return types.get(name);
  }

  // Declaring values

  /** Declares a function at module scope, or a method if {@code owner} is
   * not null. */
  public FuncDecl func(@Nullable NominalDecl owner, String name,
      AnyFunctionType type, Decl.Attribute... attributes) {
    return add(
        new FuncDecl(name, owner, type, Decl.attributes(attributes)));
  }

  /** Declares an initializer. Its result is the declared type of the owner,
   * or {@code Self} if the owner is a protocol. */
  public ConstructorDecl constructor(NominalDecl owner, Type params,
      Decl.Attribute... attributes) {
    final Type result = owner.isProtocol()
        ? owner.selfType()
        : owner.declaredInterfaceType();
    return add(
        new ConstructorDecl(owner, typeSystem.fnType(params, result),
            Decl.attributes(attributes)));
  }

  /** Declares a variable at module scope, or a property if {@code owner} is
   * not null. */
  public VarDecl var(@Nullable NominalDecl owner, String name, Type type,
      Decl.Attribute... attributes) {
    return add(new VarDecl(name, owner, type, Decl.attributes(attributes)));
  }

  /** Declares a subscript. */
  public SubscriptDecl subscript(NominalDecl owner, Type indices,
      Type element, Decl.Attribute... attributes) {
    final FnType type = typeSystem.fnType(indices, element);
    return add(new SubscriptDecl(owner, type, Decl.attributes(attributes)));
  }

  private <D extends Decl> D add(D decl) {
    if (decl.owner == null) {
      globals.put(decl.name, decl);
    } else {
      decl.owner.addMember(decl);
    }
    return decl;
  }

  // Declaring conformances and special roles

  /** Declares that a type conforms to a protocol. Type witnesses are written
   * in terms of the type's generic parameters. */
  public Conformance conform(NominalDecl decl, NominalDecl protocol,
      Map<String, Type> typeWitnesses) {
    checkArgument(protocol.isProtocol(), "not a protocol: %s", protocol);
    final Conformance conformance =
        new Conformance(decl.declaredInterfaceType(), protocol,
            typeWitnesses);
    conformances.put(decl, conformance);
    return conformance;
  }

  /** Declares that a type conforms to a protocol that has no associated
   * types. */
  public Conformance conform(NominalDecl decl, NominalDecl protocol) {
    return conform(decl, protocol, ImmutableMap.of());
  }

  public void setKnownProtocol(KnownProtocol knownProtocol,
      NominalDecl protocol) {
    checkArgument(protocol.isProtocol(), "not a protocol: %s", protocol);
    knownProtocols.put(knownProtocol, protocol);
  }

  public void setDefaultLiteralType(NominalDecl protocol, Type type) {
    defaultLiteralTypes.put(protocol, type);
  }

  /** Declares that a type can be bridged to Objective-C. */
  public void bridge(NominalDecl decl) {
    bridged.add(decl);
  }

  // SemanticContext methods

  @Override public @Nullable Conformance conformsTo(Type type,
      NominalDecl protocol) {
    checkArgument(protocol.isProtocol(), "not a protocol: %s", protocol);
    final Type t = type.rvalueType();
    if (t instanceof DynamicSelfType) {
      return conformsTo(((DynamicSelfType) t).selfType, protocol);
    }
    if (t instanceof ArchetypeType) {
      final ArchetypeType archetype = (ArchetypeType) t;
      for (NominalDecl p : archetype.conformsTo) {
        if (p.inheritsFrom(protocol)) {
          return new Conformance(t, protocol, ImmutableMap.of());
        }
      }
      return archetype.superclass == null
          ? null
          : conformsTo(archetype.superclass, protocol);
    }
    if (!(t instanceof NominalType)) {
      return null;
    }
    final NominalType nominalType = (NominalType) t;
    if (nominalType.decl.isProtocol()) {
      return nominalType.decl.inheritsFrom(protocol)
          ? new Conformance(t, protocol, ImmutableMap.of())
          : null;
    }
    for (NominalType c = nominalType; c != null;
         c = c.superclass(typeSystem)) {
      final NominalType c2 = c;
      for (Conformance declared : conformances.get(c.decl)) {
        if (declared.protocol.inheritsFrom(protocol)) {
          return new Conformance(t, protocol,
              Maps.transformValues(declared.typeWitnesses(),
                  w -> c2.substitute(typeSystem, w)));
        }
      }
    }
    return null;
  }

  @Override public List<Decl> lookupMember(Type baseType, String name) {
    Type t = baseType.rvalueType();
    if (t instanceof MetatypeType) {
      t = ((MetatypeType) t).instanceType.rvalueType();
    }
    if (t instanceof DynamicSelfType) {
      t = ((DynamicSelfType) t).selfType;
    }
    if (t instanceof ModuleType) {
      return ((ModuleType) t).module.lookupUnqualified(name);
    }
    final Set<Decl> result = new LinkedHashSet<>();
    if (t instanceof ArchetypeType) {
      final ArchetypeType archetype = (ArchetypeType) t;
      if (archetype.superclass != null) {
        lookupInClass(archetype.superclass.nominalDecl(), name, result);
      }
      lookupInProtocols(archetype.conformsTo, name, result);
    } else if (t instanceof NominalType) {
      final NominalDecl decl = ((NominalType) t).decl;
      if (decl == knownProtocols.get(KnownProtocol.DYNAMIC_LOOKUP)) {
        for (NominalDecl d : types.values()) {
          if (d.isClass()) {
            for (Decl member : d.lookupDirect(name)) {
              if (member.isObjC()) {
                result.add(member);
              }
            }
          }
        }
      } else if (decl.isProtocol()) {
        lookupInProtocols(ImmutableList.of(decl), name, result);
      } else {
        lookupInClass(decl, name, result);
        if (result.isEmpty()) {
          final List<NominalDecl> protocols = new ArrayList<>();
          for (NominalDecl d = decl; d != null; d = d.superclassDecl()) {
            for (Conformance conformance : conformances.get(d)) {
              protocols.add(conformance.protocol);
            }
          }
          lookupInProtocols(protocols, name, result);
        }
      }
    }
    return ImmutableList.copyOf(result);
  }

  private static void lookupInClass(@Nullable NominalDecl decl, String name,
      Set<Decl> result) {
    for (NominalDecl d = decl; d != null; d = d.superclassDecl()) {
      result.addAll(d.lookupDirect(name));
    }
  }

  private static void lookupInProtocols(List<NominalDecl> protocols,
      String name, Set<Decl> result) {
    for (NominalDecl protocol : protocols) {
      for (NominalDecl p : protocol.allProtocols()) {
        result.addAll(p.lookupDirect(name));
      }
    }
  }

  @Override public List<Decl> lookupUnqualified(String name) {
    final ImmutableList.Builder<Decl> b = ImmutableList.builder();
    b.addAll(globals.get(name));
    final NominalDecl type = types.get(name);
    if (type != null) {
      b.add(type);
    }
    return b.build();
  }

  @Override public @Nullable NominalDecl getProtocol(
      KnownProtocol knownProtocol) {
    return knownProtocols.get(knownProtocol);
  }

  @Override public @Nullable Type getDefaultLiteralType(
      NominalDecl protocol) {
    return defaultLiteralTypes.get(protocol);
  }

  @Override public List<Type> getTypesConformingTo(NominalDecl protocol) {
    final ImmutableList.Builder<Type> b = ImmutableList.builder();
    for (NominalDecl decl : types.values()) {
      if (!decl.isProtocol()
          && !decl.isGeneric()
          && conformsTo(decl.declaredInterfaceType(), protocol) != null) {
        b.add(decl.declaredInterfaceType());
      }
    }
    return b.build();
  }

  @Override public boolean isBridgedToObjectiveC(Type type) {
    final NominalDecl decl = type.rvalueType().nominalDecl();
    return decl != null && (decl.isClass() || bridged.contains(decl));
  }
}

// End Module.java
