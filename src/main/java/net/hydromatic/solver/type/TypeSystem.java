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
package net.hydromatic.solver.type;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.solver.decl.AssociatedTypeDecl;
import net.hydromatic.solver.decl.GenericSignature;
import net.hydromatic.solver.decl.Module;
import net.hydromatic.solver.decl.NominalDecl;
import org.checkerframework.checker.nullness.qual.Nullable;

/** A table that contains all types in use, indexed by their description
 * (e.g. "{@code (Int) -> Bool}").
 *
 * <p>Every type is created via this table, so structurally equal types are
 * the same object. */
public class TypeSystem {
  final Map<Type.Key, Type> typeByKey = new HashMap<>();

  private @Nullable NominalDecl optionalDecl;
  private @Nullable NominalDecl implicitlyUnwrappedOptionalDecl;

  /** Looks up a type by its key, creating and registering it if it does not
   * exist. */
  public Type typeFor(Type.Key key) {
    Type type = typeByKey.get(key);
    if (type == null) {
      type = key.toType(this);
      final Type previous = typeByKey.putIfAbsent(key, type);
      if (previous != null) {
        type = previous;
      }
    }
    return type;
  }

  /** Returns the number of distinct types registered. */
  public int size() {
    return typeByKey.size();
  }

  /** Creates a nominal type. */
  public NominalType nominalType(NominalDecl decl,
      List<? extends Type> args) {
    checkArgument(decl.isProtocol()
            ? args.isEmpty()
            : args.size() == decl.genericSignature().params.size(),
        "wrong number of arguments for %s: %s", decl, args);
    return (NominalType) typeFor(Keys.nominal(decl, Keys.toKeys(args)));
  }

  /** Creates a nominal type. */
  public NominalType nominalType(NominalDecl decl, Type... args) {
    return nominalType(decl, ImmutableList.copyOf(args));
  }

  /** Creates an unbound generic type. */
  public UnboundGenericType unboundGenericType(NominalDecl decl) {
    checkArgument(decl.isGeneric(), "not generic: %s", decl);
    return (UnboundGenericType) typeFor(Keys.unboundGeneric(decl));
  }

  /** Creates a tuple type with labels. */
  public TupleType tupleType(List<String> labels,
      List<? extends Type> types) {
    return (TupleType) typeFor(Keys.tuple(labels, Keys.toKeys(types)));
  }

  /** Creates a tuple type without labels. */
  public TupleType tupleType(List<? extends Type> types) {
    return tupleType(Collections.nCopies(types.size(), ""), types);
  }

  /** Creates a tuple type without labels. */
  public TupleType tupleType(Type... types) {
    return tupleType(ImmutableList.copyOf(types));
  }

  /** Returns the empty tuple type, {@code Void}. */
  public TupleType voidType() {
    return tupleType(ImmutableList.of());
  }

  /** Creates a function type. */
  public FnType fnType(Type input, Type result) {
    return (FnType) typeFor(Keys.fn(input.key(), result.key()));
  }

  /** Creates a generic function type. */
  public GenericFnType genericFnType(GenericSignature signature, Type input,
      Type result) {
    checkArgument(!signature.isEmpty(), "signature must not be empty");
    return (GenericFnType) typeFor(
        Keys.genericFn(signature, input.key(), result.key()));
  }

  /** Creates an l-value type. */
  public LValueType lvalueType(Type objectType) {
    checkArgument(!objectType.isLValue(), "nested l-value: %s", objectType);
    return (LValueType) typeFor(Keys.lvalue(objectType.key()));
  }

  /** Creates a metatype. */
  public MetatypeType metatypeType(Type instanceType) {
    return (MetatypeType) typeFor(Keys.metatype(instanceType.key()));
  }

  /** Creates a generic parameter type. */
  public GenericParamType genericParam(int depth, int index, String name) {
    return (GenericParamType) typeFor(Keys.genericParam(depth, index, name));
  }

  /** Creates a dependent member type. */
  public DependentMemberType dependentMemberType(Type base,
      AssociatedTypeDecl assocType) {
    return (DependentMemberType) typeFor(
        Keys.dependentMember(base.key(), assocType));
  }

  /** Creates a dynamic {@code Self} type. */
  public DynamicSelfType dynamicSelfType(Type selfType) {
    return (DynamicSelfType) typeFor(Keys.dynamicSelf(selfType.key()));
  }

  /** Returns the type of a module. */
  public ModuleType moduleType(Module module) {
    return (ModuleType) typeFor(Keys.module(module));
  }

  /** Returns the declaration of {@code Optional}, or null if no module has
   * declared it yet. */
  public @Nullable NominalDecl optionalDecl() {
    return optionalDecl;
  }

  /** Returns the declaration of {@code ImplicitlyUnwrappedOptional}, or
   * null if no module has declared it yet. */
  public @Nullable NominalDecl implicitlyUnwrappedOptionalDecl() {
    return implicitlyUnwrappedOptionalDecl;
  }

  /** Registers the declarations of the optional types. */
  public void setOptionalDecls(NominalDecl optionalDecl,
      NominalDecl implicitlyUnwrappedOptionalDecl) {
    checkState(this.optionalDecl == null, "optional types already declared");
    this.optionalDecl = optionalDecl;
    this.implicitlyUnwrappedOptionalDecl = implicitlyUnwrappedOptionalDecl;
  }

  /** Creates the type {@code Optional<T>}. */
  public NominalType optionalType(Type type) {
    checkState(optionalDecl != null, "Optional is not declared");
    return nominalType(optionalDecl, type);
  }

  /** Creates the type {@code ImplicitlyUnwrappedOptional<T>}. */
  public NominalType implicitlyUnwrappedOptionalType(Type type) {
    checkState(implicitlyUnwrappedOptionalDecl != null,
        "ImplicitlyUnwrappedOptional is not declared");
    return nominalType(implicitlyUnwrappedOptionalDecl, type);
  }

  /** If a type is {@code Optional<T>} or
   * {@code ImplicitlyUnwrappedOptional<T>}, returns {@code T}; otherwise
   * returns null. */
  public @Nullable Type optionalObjectType(Type type) {
    if (type instanceof NominalType) {
      final NominalType nominalType = (NominalType) type;
      if (nominalType.decl == optionalDecl
          || nominalType.decl == implicitlyUnwrappedOptionalDecl) {
        return nominalType.arg(0);
      }
    }
    return null;
  }

  /** Replaces generic parameters and archetypes in a type. */
  public Type substitute(Type type, Map<? extends Type, ? extends Type> map) {
    if (map.isEmpty()) {
      return type;
    }
    return type.accept(
        new TypeShuttle(this) {
          @Override public Type visit(GenericParamType genericParamType) {
            final Type type = map.get(genericParamType);
            return type != null ? type : genericParamType;
          }

          @Override public Type visit(ArchetypeType archetypeType) {
            final Type type = map.get(archetypeType);
            return type != null ? type : archetypeType;
          }
        });
  }

  /** Replaces each dynamic {@code Self} type in a type. */
  public Type replaceDynamicSelf(Type type, Type replacement) {
    return type.accept(
        new TypeShuttle(this) {
          @Override public Type visit(DynamicSelfType dynamicSelfType) {
            return replacement;
          }
        });
  }
}

// End TypeSystem.java
