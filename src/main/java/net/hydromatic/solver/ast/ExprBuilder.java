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
package net.hydromatic.solver.ast;

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import net.hydromatic.solver.decl.Decl;
import net.hydromatic.solver.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds expressions. */
public enum ExprBuilder {
  /**
   * The singleton instance of the expression builder. The short name is
   * convenient for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  expr;

  /** Creates an integer literal. */
  public Expr.Literal intLiteral(Pos pos, long value) {
    return new Expr.Literal(pos, Op.INT_LITERAL, BigDecimal.valueOf(value));
  }

  /** Creates a floating-point literal. */
  public Expr.Literal floatLiteral(Pos pos, BigDecimal value) {
    return new Expr.Literal(pos, Op.FLOAT_LITERAL, value);
  }

  /** Creates a string literal. */
  public Expr.Literal stringLiteral(Pos pos, String value) {
    return new Expr.Literal(pos, Op.STRING_LITERAL, value);
  }

  /** Creates a {@code boolean} literal. */
  public Expr.Literal boolLiteral(Pos pos, boolean value) {
    return new Expr.Literal(pos, Op.BOOL_LITERAL, value);
  }

  /** Creates a reference to a name that will be looked up in the
   * environment. */
  public Expr.NameRef name(Pos pos, String name) {
    return new Expr.NameRef(pos, name);
  }

  /** Creates a reference to a declaration. */
  public Expr.DeclRef declRef(Pos pos, Decl decl) {
    return new Expr.DeclRef(pos, decl, false);
  }

  /** Creates a reference to a declaration with explicit generic
   * arguments. */
  public Expr.DeclRef specializedDeclRef(Pos pos, Decl decl) {
    return new Expr.DeclRef(pos, decl, true);
  }

  /** Creates a reference to one of several declarations. */
  public Expr.OverloadedDeclRef overloadedDeclRef(Pos pos,
      List<? extends Decl> decls) {
    return new Expr.OverloadedDeclRef(pos, decls);
  }

  /** Creates a reference to one of several declarations. */
  public Expr.OverloadedDeclRef overloadedDeclRef(Pos pos, Decl... decls) {
    return overloadedDeclRef(pos, Arrays.asList(decls));
  }

  /** Creates a member reference, "base.name". */
  public Expr.MemberRef member(Pos pos, Expr base, String name) {
    return new Expr.MemberRef(pos.plus(base.pos), base, name);
  }

  /** Creates an implicit member reference, ".name". */
  public Expr.UnresolvedMember unresolvedMember(Pos pos, String name) {
    return new Expr.UnresolvedMember(pos, name, null);
  }

  /** Creates an implicit member reference that is called,
   * ".name(args)". */
  public Expr.UnresolvedMember unresolvedMember(Pos pos, String name,
      @Nullable Expr arg) {
    return new Expr.UnresolvedMember(pos, name, arg);
  }

  /** Creates a call, "fn(args)". The arguments are wrapped in a tuple. */
  public Expr.Apply apply(Pos pos, Expr fn, Expr... args) {
    return new Expr.Apply(pos.plus(fn.pos), fn, tuple(pos, args));
  }

  /** Creates a call whose argument is a given expression, typically a
   * tuple. */
  public Expr.Apply applyTo(Pos pos, Expr fn, Expr arg) {
    return new Expr.Apply(pos.plus(fn.pos), fn, arg);
  }

  /** Creates a tuple of unlabeled elements. */
  public Expr.Tuple tuple(Pos pos, Expr... elements) {
    return new Expr.Tuple(pos,
        Collections.nCopies(elements.length, ""), Arrays.asList(elements));
  }

  /** Creates a tuple with labels. */
  public Expr.Tuple tuple(Pos pos, List<String> labels,
      List<? extends Expr> elements) {
    return new Expr.Tuple(pos, labels, elements);
  }

  /** Creates a tuple with one labeled element. */
  public Expr.Tuple labeled(Pos pos, String label, Expr element) {
    return new Expr.Tuple(pos, ImmutableList.of(label),
        ImmutableList.of(element));
  }

  /** Creates a coercion, "e as T". */
  public Expr.Coerce coerce(Pos pos, Expr e, Type type) {
    return new Expr.Coerce(pos.plus(e.pos), e, type);
  }

  /** Creates a checked cast, "e as? T". */
  public Expr.CheckedCast checkedCast(Pos pos, Expr e, Type type) {
    return new Expr.CheckedCast(pos.plus(e.pos), e, type);
  }

  /** Creates a forced unwrap, "e!". */
  public Expr.ForceValue forceValue(Pos pos, Expr e) {
    return new Expr.ForceValue(pos.plus(e.pos), e);
  }

  /** Creates an assignment, "dest = source". */
  public Expr.Assign assign(Pos pos, Expr dest, Expr source) {
    return new Expr.Assign(pos.plus(dest.pos).plus(source.pos), dest, source);
  }
}

// End ExprBuilder.java
