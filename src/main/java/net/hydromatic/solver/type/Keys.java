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

import static java.util.Objects.hash;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.solver.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.solver.ast.Op;
import net.hydromatic.solver.decl.AssociatedTypeDecl;
import net.hydromatic.solver.decl.GenericSignature;
import net.hydromatic.solver.decl.Module;
import net.hydromatic.solver.decl.NominalDecl;

/** Type keys.
 *
 * <p>Declarations, signatures and modules inside keys are compared by
 * identity. */
public class Keys {
  private Keys() {}

  /** Returns a key that identifies a type by object identity. */
  public static Type.Key identity(Type type, String name) {
    return new IdentityKey(type, name);
  }

  /** Returns a key to a nominal type. */
  public static Type.Key nominal(NominalDecl decl,
      List<? extends Type.Key> args) {
    return new NominalKey(decl, ImmutableList.copyOf(args));
  }

  /** Returns a key to an unbound generic type. */
  public static Type.Key unboundGeneric(NominalDecl decl) {
    return new UnboundGenericKey(decl);
  }

  /** Returns a key to a tuple type. */
  public static Type.Key tuple(List<String> labels,
      List<? extends Type.Key> elements) {
    return new TupleKey(ImmutableList.copyOf(labels),
        ImmutableList.copyOf(elements));
  }

  /** Returns a key to a function type. */
  public static Type.Key fn(Type.Key input, Type.Key result) {
    return new FnKey(input, result);
  }

  /** Returns a key to a generic function type. */
  public static Type.Key genericFn(GenericSignature signature,
      Type.Key input, Type.Key result) {
    return new GenericFnKey(signature, input, result);
  }

  /** Returns a key to an l-value type. */
  public static Type.Key lvalue(Type.Key objectKey) {
    return new WrapperKey(Op.LVALUE_TYPE, objectKey);
  }

  /** Returns a key to a metatype. */
  public static Type.Key metatype(Type.Key instanceKey) {
    return new WrapperKey(Op.METATYPE, instanceKey);
  }

  /** Returns a key to the dynamic {@code Self} type. */
  public static Type.Key dynamicSelf(Type.Key selfKey) {
    return new WrapperKey(Op.DYNAMIC_SELF, selfKey);
  }

  /** Returns a key to a generic parameter. */
  public static Type.Key genericParam(int depth, int index, String name) {
    return new GenericParamKey(depth, index, name);
  }

  /** Returns a key to a dependent member type. */
  public static Type.Key dependentMember(Type.Key base,
      AssociatedTypeDecl assocType) {
    return new DependentMemberKey(base, assocType);
  }

  /** Returns a key to the type of a module. */
  public static Type.Key module(Module module) {
    return new ModuleKey(module);
  }

  /** Converts a list of types to a list of keys. */
  public static List<Type.Key> toKeys(List<? extends Type> types) {
    return transformEager(types, Type::key);
  }

  /** Converts a list of keys to a list of types. */
  static List<Type> toTypes(TypeSystem typeSystem,
      List<? extends Type.Key> keys) {
    return transformEager(keys, typeSystem::typeFor);
  }

  /** Key that identifies a type by object identity. */
  private static class IdentityKey extends Type.Key {
    private final Type type;
    private final String name;

    IdentityKey(Type type, String name) {
      super(type.op());
      this.type = requireNonNull(type);
      this.name = requireNonNull(name);
    }

    @Override public int hashCode() {
      return System.identityHashCode(type);
    }

    @Override public boolean equals(Object obj) {
      return obj == this
          || obj instanceof IdentityKey
          && ((IdentityKey) obj).type == type;
    }

    @Override StringBuilder describe(StringBuilder buf) {
      return buf.append(name);
    }

    @Override public Type toType(TypeSystem typeSystem) {
      return type;
    }
  }

  /** Key of a nominal type. */
  private static class NominalKey extends Type.Key {
    private final NominalDecl decl;
    private final ImmutableList<Type.Key> args;

    NominalKey(NominalDecl decl, ImmutableList<Type.Key> args) {
      super(Op.NOMINAL_TYPE);
      this.decl = requireNonNull(decl);
      this.args = requireNonNull(args);
    }

    @Override public int hashCode() {
      return hash(System.identityHashCode(decl), args);
    }

    @Override public boolean equals(Object obj) {
      return obj == this
          || obj instanceof NominalKey
          && ((NominalKey) obj).decl == decl
          && ((NominalKey) obj).args.equals(args);
    }

    @Override StringBuilder describe(StringBuilder buf) {
      buf.append(decl.name);
      if (!args.isEmpty()) {
        buf.append('<');
        for (int i = 0; i < args.size(); i++) {
          args.get(i).describe(buf.append(i > 0 ? ", " : ""));
        }
        buf.append('>');
      }
      return buf;
    }

    @Override public Type toType(TypeSystem typeSystem) {
      return new NominalType(decl,
          ImmutableList.copyOf(toTypes(typeSystem, args)));
    }
  }

  /** Key of an unbound generic type. */
  private static class UnboundGenericKey extends Type.Key {
    private final NominalDecl decl;

    UnboundGenericKey(NominalDecl decl) {
      super(Op.UNBOUND_GENERIC_TYPE);
      this.decl = requireNonNull(decl);
    }

    @Override public int hashCode() {
      return System.identityHashCode(decl);
    }

    @Override public boolean equals(Object obj) {
      return obj == this
          || obj instanceof UnboundGenericKey
          && ((UnboundGenericKey) obj).decl == decl;
    }

    @Override StringBuilder describe(StringBuilder buf) {
      return buf.append(decl.name);
    }

    @Override public Type toType(TypeSystem typeSystem) {
      return new UnboundGenericType(decl);
    }
  }

  /** Key of a tuple type. */
  private static class TupleKey extends Type.Key {
    private final ImmutableList<String> labels;
    private final ImmutableList<Type.Key> elements;

    TupleKey(ImmutableList<String> labels, ImmutableList<Type.Key> elements) {
      super(Op.TUPLE_TYPE);
      this.labels = labels;
      this.elements = elements;
    }

    @Override public int hashCode() {
      return hash(labels, elements);
    }

    @Override public boolean equals(Object obj) {
      return obj == this
          || obj instanceof TupleKey
          && ((TupleKey) obj).labels.equals(labels)
          && ((TupleKey) obj).elements.equals(elements);
    }

    @Override StringBuilder describe(StringBuilder buf) {
      buf.append('(');
      for (int i = 0; i < elements.size(); i++) {
        if (i > 0) {
          buf.append(", ");
        }
        if (!labels.get(i).isEmpty()) {
          buf.append(labels.get(i)).append(": ");
        }
        elements.get(i).describe(buf);
      }
      return buf.append(')');
    }

    @Override public Type toType(TypeSystem typeSystem) {
      return new TupleType(labels,
          ImmutableList.copyOf(toTypes(typeSystem, elements)));
    }
  }

  /** Key of a function type. */
  private static class FnKey extends Type.Key {
    final Type.Key input;
    final Type.Key result;

    FnKey(Type.Key input, Type.Key result) {
      this(Op.FUNCTION_TYPE, input, result);
    }

    FnKey(Op op, Type.Key input, Type.Key result) {
      super(op);
      this.input = requireNonNull(input);
      this.result = requireNonNull(result);
    }

    @Override public int hashCode() {
      return hash(op, input, result);
    }

    @Override public boolean equals(Object obj) {
      return obj == this
          || obj instanceof FnKey
          && ((FnKey) obj).op == op
          && ((FnKey) obj).input.equals(input)
          && ((FnKey) obj).result.equals(result);
    }

    @Override StringBuilder describe(StringBuilder buf) {
      input.describe(buf).append(" -> ");
      return result.describe(buf);
    }

    @Override public Type toType(TypeSystem typeSystem) {
      return new FnType(typeSystem.typeFor(input),
          typeSystem.typeFor(result));
    }
  }

  /** Key of a generic function type. */
  private static class GenericFnKey extends FnKey {
    private final GenericSignature signature;

    GenericFnKey(GenericSignature signature, Type.Key input,
        Type.Key result) {
      super(Op.GENERIC_FUNCTION_TYPE, input, result);
      this.signature = requireNonNull(signature);
    }

    @Override public int hashCode() {
      return hash(System.identityHashCode(signature), input, result);
    }

    @Override public boolean equals(Object obj) {
      return obj == this
          || obj instanceof GenericFnKey
          && ((GenericFnKey) obj).signature == signature
          && ((GenericFnKey) obj).input.equals(input)
          && ((GenericFnKey) obj).result.equals(result);
    }

    @Override StringBuilder describe(StringBuilder buf) {
      return super.describe(buf.append(signature).append(' '));
    }

    @Override public Type toType(TypeSystem typeSystem) {
      return new GenericFnType(signature, typeSystem.typeFor(input),
          typeSystem.typeFor(result));
    }
  }

  /** Key of a type that wraps one other type: an l-value, a metatype or a
   * dynamic {@code Self}. */
  private static class WrapperKey extends Type.Key {
    private final Type.Key key;

    WrapperKey(Op op, Type.Key key) {
      super(op);
      this.key = requireNonNull(key);
    }

    @Override public int hashCode() {
      return hash(op, key);
    }

    @Override public boolean equals(Object obj) {
      return obj == this
          || obj instanceof WrapperKey
          && ((WrapperKey) obj).op == op
          && ((WrapperKey) obj).key.equals(key);
    }

    @Override StringBuilder describe(StringBuilder buf) {
      switch (op) {
      case LVALUE_TYPE:
        return key.describe(buf.append("@lvalue "));
      case DYNAMIC_SELF:
        return buf.append("Self");
      default:
        if (key.op == Op.FUNCTION_TYPE) {
          return key.describe(buf.append('(')).append(").Type");
        }
        return key.describe(buf).append(".Type");
      }
    }

    @Override public Type toType(TypeSystem typeSystem) {
      final Type type = typeSystem.typeFor(key);
      switch (op) {
      case LVALUE_TYPE:
        return new LValueType(type);
      case DYNAMIC_SELF:
        return new DynamicSelfType(type);
      default:
        return new MetatypeType(type);
      }
    }
  }

  /** Key of a generic parameter. */
  private static class GenericParamKey extends Type.Key {
    private final int depth;
    private final int index;
    private final String name;

    GenericParamKey(int depth, int index, String name) {
      super(Op.GENERIC_PARAM);
      this.depth = depth;
      this.index = index;
      this.name = requireNonNull(name);
    }

    @Override public int hashCode() {
      return hash(depth, index, name);
    }

    @Override public boolean equals(Object obj) {
      return obj == this
          || obj instanceof GenericParamKey
          && ((GenericParamKey) obj).depth == depth
          && ((GenericParamKey) obj).index == index
          && ((GenericParamKey) obj).name.equals(name);
    }

    @Override StringBuilder describe(StringBuilder buf) {
      return buf.append(name);
    }

    @Override public Type toType(TypeSystem typeSystem) {
      return new GenericParamType(depth, index, name);
    }
  }

  /** Key of a dependent member type. */
  private static class DependentMemberKey extends Type.Key {
    private final Type.Key base;
    private final AssociatedTypeDecl assocType;

    DependentMemberKey(Type.Key base, AssociatedTypeDecl assocType) {
      super(Op.DEPENDENT_MEMBER);
      this.base = requireNonNull(base);
      this.assocType = requireNonNull(assocType);
    }

    @Override public int hashCode() {
      return hash(base, System.identityHashCode(assocType));
    }

    @Override public boolean equals(Object obj) {
      return obj == this
          || obj instanceof DependentMemberKey
          && ((DependentMemberKey) obj).base.equals(base)
          && ((DependentMemberKey) obj).assocType == assocType;
    }

    @Override StringBuilder describe(StringBuilder buf) {
      return base.describe(buf).append('.').append(assocType.name);
    }

    @Override public Type toType(TypeSystem typeSystem) {
      return new DependentMemberType(typeSystem.typeFor(base), assocType);
    }
  }

  /** Key of the type of a module. */
  private static class ModuleKey extends Type.Key {
    private final Module module;

    ModuleKey(Module module) {
      super(Op.MODULE_TYPE);
      this.module = requireNonNull(module);
    }

    @Override public int hashCode() {
      return System.identityHashCode(module);
    }

    @Override public boolean equals(Object obj) {
      return obj == this
          || obj instanceof ModuleKey
          && ((ModuleKey) obj).module == module;
    }

    @Override StringBuilder describe(StringBuilder buf) {
      return buf.append("module<").append(module.name).append('>');
    }

    @Override public Type toType(TypeSystem typeSystem) {
      return new ModuleType(module);
    }
  }
}

// End Keys.java
