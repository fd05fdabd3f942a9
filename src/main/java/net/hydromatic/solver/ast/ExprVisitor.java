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

/** Visits expressions.
 *
 * <p>The default implementation of each method visits the children of the
 * expression and returns null.
 *
 * @param <R> Return type */
public class ExprVisitor<R> {
  /** Visits each child of an expression. */
  protected R visitChildren(Expr expr) {
    expr.children().forEach(child -> child.accept(this));
    return null;
  }

  public R visit(Expr.Literal literal) {
    return visitChildren(literal);
  }

  public R visit(Expr.NameRef nameRef) {
    return visitChildren(nameRef);
  }

  public R visit(Expr.DeclRef declRef) {
    return visitChildren(declRef);
  }

  public R visit(Expr.OverloadedDeclRef overloadedDeclRef) {
    return visitChildren(overloadedDeclRef);
  }

  public R visit(Expr.MemberRef memberRef) {
    return visitChildren(memberRef);
  }

  public R visit(Expr.UnresolvedMember unresolvedMember) {
    return visitChildren(unresolvedMember);
  }

  public R visit(Expr.Apply apply) {
    return visitChildren(apply);
  }

  public R visit(Expr.Tuple tuple) {
    return visitChildren(tuple);
  }

  public R visit(Expr.Coerce coerce) {
    return visitChildren(coerce);
  }

  public R visit(Expr.CheckedCast checkedCast) {
    return visitChildren(checkedCast);
  }

  public R visit(Expr.ForceValue forceValue) {
    return visitChildren(forceValue);
  }

  public R visit(Expr.Assign assign) {
    return visitChildren(assign);
  }
}

// End ExprVisitor.java
