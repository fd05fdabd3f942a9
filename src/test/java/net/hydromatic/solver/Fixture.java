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
package net.hydromatic.solver;

import static net.hydromatic.solver.ast.ExprBuilder.expr;

import com.google.common.collect.ImmutableList;
import net.hydromatic.solver.ast.Expr;
import net.hydromatic.solver.ast.Pos;
import net.hydromatic.solver.decl.Decl;
import net.hydromatic.solver.decl.KnownProtocol;
import net.hydromatic.solver.decl.Module;
import net.hydromatic.solver.decl.NominalDecl;
import net.hydromatic.solver.decl.VarDecl;
import net.hydromatic.solver.type.FnType;
import net.hydromatic.solver.type.TupleType;
import net.hydromatic.solver.type.Type;
import net.hydromatic.solver.type.TypeSystem;

/**
 * A module that declares the types that most tests need.
 *
 * <p>It declares {@code Int}, {@code Double}, {@code String} and
 * {@code Bool}, the literal protocols (each with a default type), the
 * protocols {@code Equatable} and {@code AnyObject}, and classes
 * {@code Base} and {@code Derived}. Each test creates its own fixture, and
 * adds the declarations it needs.
 */
public class Fixture {
  public final TypeSystem typeSystem = new TypeSystem();
  public final Module module = new Module("test", typeSystem);

  public final NominalDecl integerLiteral =
      module.protocol("IntegerLiteralConvertible");
  public final NominalDecl floatLiteral =
      module.protocol("FloatLiteralConvertible");
  public final NominalDecl stringLiteral =
      module.protocol("StringLiteralConvertible");
  public final NominalDecl booleanLiteral =
      module.protocol("BooleanLiteralConvertible");
  public final NominalDecl equatable = module.protocol("Equatable");
  public final NominalDecl anyObject = module.protocol("AnyObject");

  public final NominalDecl intDecl = module.struct("Int");
  public final NominalDecl doubleDecl = module.struct("Double");
  public final NominalDecl stringDecl = module.struct("String");
  public final NominalDecl boolDecl = module.struct("Bool");
  public final NominalDecl baseDecl = module.classDecl("Base", null);
  public final NominalDecl derivedDecl =
      module.classDecl("Derived", baseDecl);

  public final Type intType = intDecl.declaredInterfaceType();
  public final Type doubleType = doubleDecl.declaredInterfaceType();
  public final Type stringType = stringDecl.declaredInterfaceType();
  public final Type boolType = boolDecl.declaredInterfaceType();
  public final Type baseType = baseDecl.declaredInterfaceType();
  public final Type derivedType = derivedDecl.declaredInterfaceType();
  public final Type equatableType = equatable.declaredInterfaceType();
  public final Type anyObjectType = anyObject.declaredInterfaceType();

  public Fixture() {
    module.setKnownProtocol(KnownProtocol.INTEGER_LITERAL_CONVERTIBLE,
        integerLiteral);
    module.setKnownProtocol(KnownProtocol.FLOAT_LITERAL_CONVERTIBLE,
        floatLiteral);
    module.setKnownProtocol(KnownProtocol.STRING_LITERAL_CONVERTIBLE,
        stringLiteral);
    module.setKnownProtocol(KnownProtocol.BOOLEAN_LITERAL_CONVERTIBLE,
        booleanLiteral);
    module.setKnownProtocol(KnownProtocol.DYNAMIC_LOOKUP, anyObject);

    module.setDefaultLiteralType(integerLiteral, intType);
    module.setDefaultLiteralType(floatLiteral, doubleType);
    module.setDefaultLiteralType(stringLiteral, stringType);
    module.setDefaultLiteralType(booleanLiteral, boolType);

    module.conform(intDecl, integerLiteral);
    module.conform(intDecl, equatable);
    module.conform(doubleDecl, integerLiteral);
    module.conform(doubleDecl, floatLiteral);
    module.conform(doubleDecl, equatable);
    module.conform(stringDecl, stringLiteral);
    module.conform(stringDecl, equatable);
    module.conform(boolDecl, booleanLiteral);
    module.conform(baseDecl, anyObject);
  }

  public TupleType tuple(Type... types) {
    return typeSystem.tupleType(types);
  }

  /** Creates a tuple type with one labeled element. */
  public TupleType labeled(String label, Type type) {
    return typeSystem.tupleType(ImmutableList.of(label),
        ImmutableList.of(type));
  }

  public FnType fn(Type input, Type result) {
    return typeSystem.fnType(input, result);
  }

  public Type optional(Type type) {
    return typeSystem.optionalType(type);
  }

  public Type lvalue(Type type) {
    return typeSystem.lvalueType(type);
  }

  /** Declares a global variable. */
  public VarDecl var(String name, Type type, Decl.Attribute... attributes) {
    return module.var(null, name, type, attributes);
  }

  // Expressions. All are at position zero unless a test says otherwise.

  public static Expr.Literal intLiteral(long value) {
    return expr.intLiteral(Pos.ZERO, value);
  }

  public static Expr.Literal stringLiteral(String value) {
    return expr.stringLiteral(Pos.ZERO, value);
  }

  public static Expr.NameRef name(String name) {
    return expr.name(Pos.ZERO, name);
  }

  public static Expr.Apply apply(Expr fn, Expr... args) {
    return expr.apply(Pos.ZERO, fn, args);
  }

  public static Expr.MemberRef member(Expr base, String name) {
    return expr.member(Pos.ZERO, base, name);
  }
}

// End Fixture.java
