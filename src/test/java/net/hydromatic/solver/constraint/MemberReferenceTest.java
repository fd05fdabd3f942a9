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
package net.hydromatic.solver.constraint;

import static net.hydromatic.solver.Fixture.name;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;

import net.hydromatic.solver.Fixture;
import net.hydromatic.solver.decl.ConstructorDecl;
import net.hydromatic.solver.decl.Decl;
import net.hydromatic.solver.decl.FuncDecl;
import net.hydromatic.solver.decl.NominalDecl;
import net.hydromatic.solver.decl.SubscriptDecl;
import net.hydromatic.solver.type.Type;
import net.hydromatic.solver.type.TypeVariable;
import org.junit.jupiter.api.Test;

/** Tests for references to members, and for binding overload choices, in a
 * {@link ConstraintSystem}. */
public class MemberReferenceTest {
  final Fixture f = new Fixture();
  final ConstraintSystem cs = new ConstraintSystem(f.module);

  private Type memberRefType(Type baseType, Decl decl,
      boolean isDynamicResult) {
    return cs.getTypeOfMemberReference(baseType, decl, false,
        isDynamicResult, null).refType;
  }

  @Test void testSubscript() {
    final NominalDecl table = f.module.classDecl("Table", null);
    final SubscriptDecl subscript =
        f.module.subscript(table, f.tuple(f.intType), f.stringType);
    final Type tableType = table.declaredInterfaceType();
    assertThat(memberRefType(tableType, subscript, false),
        sameInstance(f.fn(f.tuple(f.intType), f.stringType)));

    // Found by dynamic lookup, the element is implicitly unwrapped
    assertThat(memberRefType(tableType, subscript, true),
        sameInstance(
            f.fn(f.tuple(f.intType),
                f.typeSystem.implicitlyUnwrappedOptionalType(
                    f.stringType))));
  }

  /** The element of an optional subscript requirement is optional. */
  @Test void testOptionalSubscript() {
    final NominalDecl lookup = f.module.protocol("Lookup");
    final SubscriptDecl subscript =
        f.module.subscript(lookup, f.tuple(f.intType), f.stringType,
            Decl.Attribute.OPTIONAL);
    assertThat(
        memberRefType(lookup.declaredInterfaceType(), subscript, false),
        sameInstance(f.fn(f.tuple(f.intType), f.optional(f.stringType))));
  }

  /** A method that returns {@code Self} returns the type of its base. */
  @Test void testDynamicSelf() {
    final FuncDecl copy =
        f.module.func(f.baseDecl, "copy",
            f.fn(f.tuple(), f.typeSystem.dynamicSelfType(f.baseType)),
            Decl.Attribute.DYNAMIC_SELF);
    assertThat(memberRefType(f.derivedType, copy, false),
        sameInstance(f.fn(f.tuple(), f.derivedType)));
    assertThat(memberRefType(f.baseType, copy, false),
        sameInstance(f.fn(f.tuple(), f.baseType)));
  }

  /** Calling a protocol's initializer through a metatype creates a value
   * of the metatype's instance type. */
  @Test void testProtocolConstructor() {
    final NominalDecl p = f.module.protocol("P");
    final ConstructorDecl init = f.module.constructor(p, f.tuple());
    final TypeVariable v = cs.createTypeVariable(null);
    assertThat(memberRefType(f.typeSystem.metatypeType(v), init, false),
        sameInstance(f.fn(f.tuple(), v)));
  }

  /** A type declaration chosen as a type binds to the type itself; chosen
   * as a value, it binds to the metatype. */
  @Test void testResolveTypeDecl() {
    final ConstraintLocator locator = cs.getConstraintLocator(name("Int"));
    final TypeVariable v = cs.createTypeVariable(null);
    final OverloadChoice choice = OverloadChoice.typeDecl(null, f.intDecl);
    assertThat(cs.resolveOverload(locator, v, choice), is(true));
    assertThat(cs.simplifyType(v), sameInstance(f.intType));
    final ResolvedOverload overload =
        cs.getResolvedOverloads().get(locator);
    assertThat(overload.choice, sameInstance(choice));
    assertThat(overload.choice.kind, is(OverloadChoice.Kind.TYPE_DECL));
    assertThat(overload.refType, sameInstance(f.intType));

    final ConstraintLocator locator2 =
        cs.getConstraintLocator(name("Int"));
    final TypeVariable v2 = cs.createTypeVariable(null);
    assertThat(
        cs.resolveOverload(locator2, v2,
            OverloadChoice.decl(null, f.intDecl, false)),
        is(true));
    assertThat(cs.simplifyType(v2),
        sameInstance(f.typeSystem.metatypeType(f.intType)));
    assertThat(cs.getResolvedOverloads().size(), is(2));
  }

  @Test void testResolveBaseType() {
    final ConstraintLocator locator = cs.getConstraintLocator(name("s"));
    final TypeVariable v = cs.createTypeVariable(null);
    final OverloadChoice choice = OverloadChoice.baseType(f.stringType);
    assertThat(cs.resolveOverload(locator, v, choice), is(true));
    assertThat(cs.simplifyType(v), sameInstance(f.stringType));
    final ResolvedOverload overload = cs.getResolvedOverloads().head();
    assertThat(overload.locator, sameInstance(locator));
    assertThat(overload.choice.kind, is(OverloadChoice.Kind.BASE_TYPE));
    assertThat(overload.refType, sameInstance(f.stringType));
    assertThat(overload.openedFullType, sameInstance(f.stringType));
  }

  /** A reference to an optional protocol requirement has optional type. */
  @Test void testResolveOptionalRequirement() {
    final NominalDecl q = f.module.protocol("Q");
    final FuncDecl m =
        f.module.func(q, "m", f.fn(f.tuple(), f.intType),
            Decl.Attribute.OPTIONAL);
    final ConstraintLocator locator = cs.getConstraintLocator(name("q"));
    final TypeVariable v = cs.createTypeVariable(null);
    assertThat(
        cs.resolveOverload(locator, v,
            OverloadChoice.decl(q.declaredInterfaceType(), m, false)),
        is(true));
    final Type optionalFn = f.optional(f.fn(f.tuple(), f.intType));
    assertThat(cs.getResolvedOverloads().get(locator).refType,
        sameInstance(optionalFn));
    assertThat(cs.simplifyType(v), sameInstance(optionalFn));
  }
}

// End MemberReferenceTest.java
