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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.solver.decl.Decl;
import net.hydromatic.solver.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Expression.
 *
 * <p>Each expression has a slot for its type. The slot is empty until the
 * expression has been type-checked; then it holds the type that the solution
 * gives the expression.
 *
 * <p>Expressions are compared by identity. A
 * {@link net.hydromatic.solver.constraint.ConstraintLocator} uses an
 * expression as its anchor. */
public abstract class Expr {
  public final Pos pos;
  public final Op op;
  private @Nullable Type type;

  protected Expr(Pos pos, Op op) {
    this.pos = requireNonNull(pos);
    this.op = requireNonNull(op);
    checkArgument(!op.isType(), "not an expression: %s", op);
  }

  /** Returns the type of this expression, or null if it has not been
   * assigned. */
  public @Nullable Type getType() {
    return type;
  }

  /** Assigns the type of this expression. */
  public void setType(Type type) {
    this.type = requireNonNull(type);
  }

  @Override public final String toString() {
    return unparse(new StringBuilder()).toString();
  }

  /** Writes this expression as source text. */
  abstract StringBuilder unparse(StringBuilder buf);

  /** Writes this expression, in parentheses if it is not atomic. */
  StringBuilder unparseChild(StringBuilder buf) {
    if (op.atom) {
      return unparse(buf);
    }
    return unparse(buf.append('(')).append(')');
  }

  /** Accepts a visitor, calling the {@code visit} method appropriate to the
   * type of this expression. */
  public abstract <R> R accept(ExprVisitor<R> visitor);

  /** Returns the immediate sub-expressions. */
  public abstract List<Expr> children();

  /** Literal. The value is a {@link java.math.BigDecimal},
   * {@link String} or {@link Boolean}. */
  public static class Literal extends Expr {
    public final Object value;

    Literal(Pos pos, Op op, Object value) {
      super(pos, op);
      checkArgument(op.isLiteral(), "not a literal: %s", op);
      this.value = requireNonNull(value);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      if (op == Op.STRING_LITERAL) {
        return buf.append('"').append(value).append('"');
      }
      return buf.append(value);
    }

    @Override public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override public List<Expr> children() {
      return ImmutableList.of();
    }
  }

  /** Reference to a name that has not yet been resolved to declarations. */
  public static class NameRef extends Expr {
    public final String name;

    NameRef(Pos pos, String name) {
      super(pos, Op.NAME_REF);
      this.name = requireNonNull(name);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      return buf.append(name);
    }

    @Override public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override public List<Expr> children() {
      return ImmutableList.of();
    }
  }

  /** Reference to a single declaration. */
  public static class DeclRef extends Expr {
    public final Decl decl;
    /** Whether the reference has explicit generic arguments. */
    public final boolean specialized;

    DeclRef(Pos pos, Decl decl, boolean specialized) {
      super(pos, Op.DECL_REF);
      this.decl = requireNonNull(decl);
      this.specialized = specialized;
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      return buf.append(decl.name);
    }

    @Override public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override public List<Expr> children() {
      return ImmutableList.of();
    }
  }

  /** Reference to a name that denotes several declarations. */
  public static class OverloadedDeclRef extends Expr {
    public final ImmutableList<Decl> decls;

    OverloadedDeclRef(Pos pos, List<? extends Decl> decls) {
      super(pos, Op.OVERLOADED_DECL_REF);
      this.decls = ImmutableList.copyOf(decls);
      checkArgument(!this.decls.isEmpty(), "no declarations");
    }

    /** Returns the name shared by the declarations. */
    public String name() {
      return decls.get(0).name;
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      return buf.append(name());
    }

    @Override public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override public List<Expr> children() {
      return ImmutableList.of();
    }
  }

  /** Member reference, "base.name". */
  public static class MemberRef extends Expr {
    public final Expr base;
    public final String name;

    MemberRef(Pos pos, Expr base, String name) {
      super(pos, Op.MEMBER_REF);
      this.base = requireNonNull(base);
      this.name = requireNonNull(name);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      return base.unparseChild(buf).append('.').append(name);
    }

    @Override public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override public List<Expr> children() {
      return ImmutableList.of(base);
    }
  }

  /** Reference to a member whose base type comes from the context,
   * ".name" or ".name(arg)". */
  public static class UnresolvedMember extends Expr {
    public final String name;
    public final @Nullable Expr arg;

    UnresolvedMember(Pos pos, String name, @Nullable Expr arg) {
      super(pos, Op.UNRESOLVED_MEMBER);
      this.name = requireNonNull(name);
      this.arg = arg;
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      buf.append('.').append(name);
      return arg == null ? buf : arg.unparseChild(buf);
    }

    @Override public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override public List<Expr> children() {
      return arg == null ? ImmutableList.of() : ImmutableList.of(arg);
    }
  }

  /** Application of a function to an argument, "fn(arg)". */
  public static class Apply extends Expr {
    public final Expr fn;
    public final Expr arg;

    Apply(Pos pos, Expr fn, Expr arg) {
      super(pos, Op.APPLY);
      this.fn = requireNonNull(fn);
      this.arg = requireNonNull(arg);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      fn.unparseChild(buf);
      if (arg.op == Op.TUPLE) {
        return arg.unparse(buf);
      }
      return arg.unparse(buf.append('(')).append(')');
    }

    @Override public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override public List<Expr> children() {
      return ImmutableList.of(fn, arg);
    }
  }

  /** Tuple, "(x: e1, e2)". An empty label means that the element is
   * unlabeled. */
  public static class Tuple extends Expr {
    public final ImmutableList<String> labels;
    public final ImmutableList<Expr> elements;

    Tuple(Pos pos, List<String> labels, List<? extends Expr> elements) {
      super(pos, Op.TUPLE);
      this.labels = ImmutableList.copyOf(labels);
      this.elements = ImmutableList.copyOf(elements);
      checkArgument(this.labels.size() == this.elements.size(),
          "labels and elements must have the same size");
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      buf.append('(');
      for (int i = 0; i < elements.size(); i++) {
        if (i > 0) {
          buf.append(", ");
        }
        if (!labels.get(i).isEmpty()) {
          buf.append(labels.get(i)).append(": ");
        }
        elements.get(i).unparse(buf);
      }
      return buf.append(')');
    }

    @Override public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override public List<Expr> children() {
      return elements;
    }
  }

  /** Coercion to a type, "e as T". */
  public static class Coerce extends Expr {
    public final Expr expr;
    public final Type targetType;

    Coerce(Pos pos, Expr expr, Type targetType) {
      super(pos, Op.COERCE);
      this.expr = requireNonNull(expr);
      this.targetType = requireNonNull(targetType);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      return expr.unparseChild(buf).append(op.padded).append(targetType);
    }

    @Override public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override public List<Expr> children() {
      return ImmutableList.of(expr);
    }
  }

  /** Checked cast, "e as? T", whose value is an optional. */
  public static class CheckedCast extends Expr {
    public final Expr expr;
    public final Type targetType;

    CheckedCast(Pos pos, Expr expr, Type targetType) {
      super(pos, Op.CHECKED_CAST);
      this.expr = requireNonNull(expr);
      this.targetType = requireNonNull(targetType);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      return expr.unparseChild(buf).append(op.padded).append(targetType);
    }

    @Override public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override public List<Expr> children() {
      return ImmutableList.of(expr);
    }
  }

  /** Forced unwrap of an optional, "e!". */
  public static class ForceValue extends Expr {
    public final Expr expr;

    ForceValue(Pos pos, Expr expr) {
      super(pos, Op.FORCE_VALUE);
      this.expr = requireNonNull(expr);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      return expr.unparseChild(buf).append('!');
    }

    @Override public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override public List<Expr> children() {
      return ImmutableList.of(expr);
    }
  }

  /** Assignment, "dest = source". */
  public static class Assign extends Expr {
    public final Expr dest;
    public final Expr source;

    Assign(Pos pos, Expr dest, Expr source) {
      super(pos, Op.ASSIGN);
      this.dest = requireNonNull(dest);
      this.source = requireNonNull(source);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      return source.unparse(dest.unparse(buf).append(op.padded));
    }

    @Override public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override public List<Expr> children() {
      return ImmutableList.of(dest, source);
    }
  }
}

// End Expr.java
