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
package net.hydromatic.solver.compile;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.solver.ast.Expr;
import net.hydromatic.solver.ast.ExprVisitor;
import net.hydromatic.solver.constraint.Constraint;
import net.hydromatic.solver.constraint.ConstraintKind;
import net.hydromatic.solver.constraint.ConstraintLocator;
import net.hydromatic.solver.constraint.ConstraintLocator.PathElement;
import net.hydromatic.solver.constraint.ConstraintLocator.PathKind;
import net.hydromatic.solver.constraint.ConstraintSystem;
import net.hydromatic.solver.constraint.OverloadChoice;
import net.hydromatic.solver.decl.Decl;
import net.hydromatic.solver.decl.KnownProtocol;
import net.hydromatic.solver.decl.NominalDecl;
import net.hydromatic.solver.type.FnType;
import net.hydromatic.solver.type.TupleType;
import net.hydromatic.solver.type.Type;
import net.hydromatic.solver.type.TypeSystem;
import net.hydromatic.solver.type.TypeVariable;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Generates the constraints for an expression.
 *
 * <p>Each {@code visit} method generates the constraints of an expression
 * and returns its type, usually a type variable. {@link #generate(Expr)}
 * also stores that type in the expression, so that once the system is solved
 * the type can be simplified in place.
 */
public class ConstraintGenerator extends ExprVisitor<Type> {
  private final ConstraintSystem cs;
  private final Environment env;
  private final TypeSystem typeSystem;

  public ConstraintGenerator(ConstraintSystem cs, Environment env) {
    this.cs = requireNonNull(cs);
    this.env = requireNonNull(env);
    this.typeSystem = cs.typeSystem;
  }

  /** Generates constraints for an expression and its sub-expressions, and
   * returns its type. */
  public Type generate(Expr expr) {
    final Type type = expr.accept(this);
    expr.setType(type);
    return type;
  }

  private ConstraintLocator locator(Expr expr, PathKind... kinds) {
    final List<PathElement> path = new ArrayList<>();
    for (PathKind kind : kinds) {
      path.add(PathElement.of(kind));
    }
    return cs.getConstraintLocator(expr, path);
  }

  @Override public Type visit(Expr.Literal literal) {
    final KnownProtocol knownProtocol;
    switch (literal.op) {
    case INT_LITERAL:
      knownProtocol = KnownProtocol.INTEGER_LITERAL_CONVERTIBLE;
      break;
    case FLOAT_LITERAL:
      knownProtocol = KnownProtocol.FLOAT_LITERAL_CONVERTIBLE;
      break;
    case STRING_LITERAL:
      knownProtocol = KnownProtocol.STRING_LITERAL_CONVERTIBLE;
      break;
    case BOOL_LITERAL:
      knownProtocol = KnownProtocol.BOOLEAN_LITERAL_CONVERTIBLE;
      break;
    default:
      throw new AssertionError(literal.op);
    }
    final NominalDecl protocol = cs.context.getProtocol(knownProtocol);
    if (protocol == null) {
      throw new TypeException("literal " + literal + " cannot be used: "
          + "protocol " + knownProtocol + " is not defined", literal.pos);
    }
    final ConstraintLocator locator = locator(literal);
    final TypeVariable typeVariable =
        cs.createTypeVariable(locator,
            TypeVariable.Option.PREFERS_SUBTYPE_BINDING);
    typeVariable.setLiteralProtocol(protocol);
    cs.addConstraint(ConstraintKind.CONFORMS_TO, typeVariable,
        protocol.declaredInterfaceType(), locator);
    return typeVariable;
  }

  @Override public Type visit(Expr.NameRef nameRef) {
    final List<Decl> decls = env.lookup(nameRef.name);
    switch (decls.size()) {
    case 0:
      throw new TypeException("use of unresolved identifier '"
          + nameRef.name + "'", nameRef.pos);
    case 1:
      return declRef(nameRef, decls.get(0), false);
    default:
      return overloadedDeclRef(nameRef, decls);
    }
  }

  @Override public Type visit(Expr.DeclRef declRef) {
    return declRef(declRef, declRef.decl, declRef.specialized);
  }

  @Override public Type visit(Expr.OverloadedDeclRef overloadedDeclRef) {
    return overloadedDeclRef(overloadedDeclRef, overloadedDeclRef.decls);
  }

  private Type declRef(Expr expr, Decl decl, boolean specialized) {
    final ConstraintLocator locator = locator(expr);
    final TypeVariable typeVariable =
        cs.createTypeVariable(locator,
            TypeVariable.Option.CAN_BIND_TO_LVALUE);
    cs.resolveOverload(locator, typeVariable,
        OverloadChoice.decl(null, decl, specialized));
    return typeVariable;
  }

  private Type overloadedDeclRef(Expr expr, List<Decl> decls) {
    final ConstraintLocator locator = locator(expr);
    final TypeVariable typeVariable =
        cs.createTypeVariable(locator,
            TypeVariable.Option.CAN_BIND_TO_LVALUE);
    final List<OverloadChoice> choices = new ArrayList<>();
    for (Decl decl : decls) {
      choices.add(OverloadChoice.decl(null, decl, false));
    }
    cs.addOverloadSet(typeVariable, choices, locator);
    return typeVariable;
  }

  @Override public Type visit(Expr.MemberRef memberRef) {
    final Type baseType = generate(memberRef.base);
    final ConstraintLocator locator = locator(memberRef, PathKind.MEMBER);
    final TypeVariable typeVariable =
        cs.createTypeVariable(locator,
            TypeVariable.Option.CAN_BIND_TO_LVALUE);
    cs.addConstraint(
        Constraint.member(ConstraintKind.VALUE_MEMBER, baseType,
            typeVariable, memberRef.name, locator));
    return typeVariable;
  }

  @Override public Type visit(Expr.UnresolvedMember unresolvedMember) {
    // The base type of ".name" is not written; it is the type that the
    // context expects.
    final TypeVariable baseType =
        cs.createTypeVariable(
            locator(unresolvedMember, PathKind.MEMBER_REF_BASE));
    final ConstraintLocator memberLocator =
        locator(unresolvedMember, PathKind.UNRESOLVED_MEMBER);
    final TypeVariable memberType =
        cs.createTypeVariable(memberLocator,
            TypeVariable.Option.CAN_BIND_TO_LVALUE);
    cs.addConstraint(
        Constraint.member(ConstraintKind.UNRESOLVED_VALUE_MEMBER,
            typeSystem.metatypeType(baseType), memberType,
            unresolvedMember.name, memberLocator));

    Type resultType = memberType;
    if (unresolvedMember.arg != null) {
      final Type argType = generate(unresolvedMember.arg);
      resultType =
          cs.createTypeVariable(
              locator(unresolvedMember, PathKind.APPLY_FUNCTION));
      cs.addConstraint(ConstraintKind.APPLICABLE_FUNCTION,
          typeSystem.fnType(argType, resultType), memberType,
          locator(unresolvedMember, PathKind.APPLY_FUNCTION));
    }
    cs.addConstraint(ConstraintKind.CONVERSION, resultType, baseType,
        locator(unresolvedMember, PathKind.RVALUE_ADJUSTMENT));
    return baseType;
  }

  @Override public Type visit(Expr.Apply apply) {
    final Type fnType = generate(apply.fn);
    final Type argType = generate(apply.arg);
    final TypeVariable resultType =
        cs.createTypeVariable(locator(apply, PathKind.APPLY_FUNCTION));
    favorMatchingOverloads(apply.fn, argType);
    cs.addConstraint(ConstraintKind.APPLICABLE_FUNCTION,
        typeSystem.fnType(argType, resultType), fnType, locator(apply));
    return resultType;
  }

  /** If the callee is overloaded, marks as favored the overloads whose
   * parameters have exactly the types that the arguments will have if
   * nothing else constrains them. */
  private void favorMatchingOverloads(Expr fn, Type argType) {
    final List<Type> argTypes = argumentTypes(argType);
    if (argTypes == null) {
      return;
    }
    final ConstraintLocator locator = locator(fn);
    for (Constraint constraint : cs.getInactiveConstraints()) {
      if (constraint.kind != ConstraintKind.DISJUNCTION
          || constraint.locator != locator) {
        continue;
      }
      for (Constraint disjunct : constraint.nested()) {
        final OverloadChoice choice = disjunct.overloadChoice();
        if (choice.isDecl()
            && choice.decl().interfaceType() instanceof FnType) {
          final FnType type = (FnType) choice.decl().interfaceType();
          if (argTypes.equals(argumentTypes(type.input))) {
            disjunct.setFavored(true);
          }
        }
      }
    }
  }

  /** Returns the types that the elements of an argument will have if nothing
   * else constrains them, or null if any of them is unknown. */
  private @Nullable List<Type> argumentTypes(Type argType) {
    final List<Type> types = argType instanceof TupleType
        ? ((TupleType) argType).elementTypes
        : ImmutableList.of(argType);
    final ImmutableList.Builder<Type> b = ImmutableList.builder();
    for (Type type : types) {
      if (type instanceof TypeVariable) {
        final NominalDecl protocol = ((TypeVariable) type).literalProtocol();
        final Type defaultType = protocol == null
            ? null
            : cs.context.getDefaultLiteralType(protocol);
        if (defaultType == null) {
          return null;
        }
        b.add(defaultType);
      } else if (type.hasTypeVariable()) {
        return null;
      } else {
        b.add(type.rvalueType());
      }
    }
    return b.build();
  }

  @Override public Type visit(Expr.Tuple tuple) {
    final List<Type> types = new ArrayList<>();
    for (Expr element : tuple.elements) {
      types.add(generate(element));
    }
    if (types.size() == 1 && tuple.labels.get(0).isEmpty()) {
      // A parenthesized expression has the type of its content.
      return types.get(0);
    }
    return typeSystem.tupleType(tuple.labels, types);
  }

  @Override public Type visit(Expr.Coerce coerce) {
    final Type type = generate(coerce.expr);
    cs.addConstraint(ConstraintKind.CONVERSION, type, coerce.targetType,
        locator(coerce));
    return coerce.targetType;
  }

  @Override public Type visit(Expr.CheckedCast checkedCast) {
    final Type type = generate(checkedCast.expr);
    cs.addConstraint(ConstraintKind.CHECKED_CAST, type,
        checkedCast.targetType,
        locator(checkedCast, PathKind.CHECKED_CAST_OPERAND));
    return typeSystem.optionalType(checkedCast.targetType);
  }

  @Override public Type visit(Expr.ForceValue forceValue) {
    final Type type = generate(forceValue.expr);
    final ConstraintLocator locator = locator(forceValue);
    final TypeVariable objectType = cs.createTypeVariable(locator);
    cs.addConstraint(ConstraintKind.OPTIONAL_OBJECT, type, objectType,
        locator);
    return objectType;
  }

  @Override public Type visit(Expr.Assign assign) {
    final Type destType = generate(assign.dest);
    final Type sourceType = generate(assign.source);
    final ConstraintLocator destLocator =
        locator(assign, PathKind.ASSIGN_DEST);
    final TypeVariable objectType = cs.createTypeVariable(destLocator);
    cs.addConstraint(ConstraintKind.BIND, destType,
        typeSystem.lvalueType(objectType), destLocator);
    cs.addConstraint(ConstraintKind.CONVERSION, sourceType, objectType,
        locator(assign, PathKind.ASSIGN_SOURCE));
    return typeSystem.voidType();
  }
}

// End ConstraintGenerator.java
