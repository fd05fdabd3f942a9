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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsNull.nullValue;
import static org.hamcrest.core.IsSame.sameInstance;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.hydromatic.solver.Fixture;
import net.hydromatic.solver.decl.GenericSignature;
import net.hydromatic.solver.decl.NominalDecl;
import org.junit.jupiter.api.Test;

/** Tests for {@link TypeSystem} and the types it creates. */
public class TypeSystemTest {
  final Fixture f = new Fixture();
  final TypeSystem typeSystem = f.typeSystem;

  /** Structurally equal types are the same object. */
  @Test void testInterning() {
    final Type t1 = f.fn(f.tuple(f.intType, f.stringType), f.boolType);
    final Type t2 =
        typeSystem.fnType(
            typeSystem.tupleType(ImmutableList.of(f.intType, f.stringType)),
            f.boolType);
    assertThat(t1, sameInstance(t2));
    assertThat(f.optional(f.intType), sameInstance(f.optional(f.intType)));
    assertThat(f.tuple(), sameInstance(typeSystem.voidType()));

    // Labels are part of a tuple type's identity
    assertThat(f.labeled("x", f.intType) == f.tuple(f.intType), is(false));
  }

  @Test void testDescribe() {
    assertThat(f.intType.toString(), is("Int"));
    assertThat(f.tuple().toString(), is("()"));
    assertThat(f.fn(f.tuple(), f.intType).toString(), is("() -> Int"));
    assertThat(f.fn(f.tuple(f.intType), f.stringType).toString(),
        is("(Int) -> String"));
    assertThat(
        typeSystem.tupleType(ImmutableList.of("x", ""),
            ImmutableList.of(f.intType, f.doubleType)).toString(),
        is("(x: Int, Double)"));
    assertThat(f.optional(f.intType).toString(), is("Optional<Int>"));
    assertThat(f.lvalue(f.intType).toString(), is("@lvalue Int"));
    assertThat(typeSystem.metatypeType(f.intType).toString(),
        is("Int.Type"));
    assertThat(
        typeSystem.metatypeType(f.fn(f.tuple(), f.intType)).toString(),
        is("(() -> Int).Type"));
    assertThat(f.module.moduleType().toString(), is("module<test>"));
  }

  @Test void testLValue() {
    final Type t = f.lvalue(f.intType);
    assertThat(t.isLValue(), is(true));
    assertThat(t.rvalueType(), sameInstance(f.intType));
    assertThat(f.intType.rvalueType(), sameInstance(f.intType));
    assertThat(f.intType.isLValue(), is(false));
  }

  @Test void testOptionalObjectType() {
    assertThat(typeSystem.optionalObjectType(f.optional(f.intType)),
        sameInstance(f.intType));
    assertThat(
        typeSystem.optionalObjectType(
            typeSystem.implicitlyUnwrappedOptionalType(f.stringType)),
        sameInstance(f.stringType));
    assertThat(typeSystem.optionalObjectType(f.intType), nullValue());
  }

  @Test void testSubstitute() {
    final GenericParamType t = f.module.genericParams("T").get(0);
    final Type fn = f.fn(f.tuple(t), f.optional(t));
    final Type fn2 =
        typeSystem.substitute(fn, ImmutableMap.of(t, f.intType));
    assertThat(fn2,
        sameInstance(f.fn(f.tuple(f.intType), f.optional(f.intType))));

    // A type that does not mention T is returned unchanged
    final Type fn3 = f.fn(f.tuple(), f.intType);
    assertThat(typeSystem.substitute(fn3, ImmutableMap.of(t, f.stringType)),
        sameInstance(fn3));
  }

  @Test void testGenericTypes() {
    final NominalDecl box = f.module.struct("Box", "T");
    assertThat(box.isGeneric(), is(true));
    assertThat(box.declaredInterfaceType().toString(), is("Box<T>"));
    final GenericParamType t = box.genericSignature().params.get(0);
    final Type boxInt = typeSystem.nominalType(box, f.intType);
    assertThat(boxInt.toString(), is("Box<Int>"));
    assertThat(boxInt.nominalDecl(), sameInstance(box));

    final Type id =
        typeSystem.genericFnType(GenericSignature.of(t), f.tuple(t), t);
    assertThat(id.toString(), is("<T> (T) -> T"));
  }

  @Test void testSuperclass() {
    final NominalType derived = (NominalType) f.derivedType;
    assertThat(derived.superclass(typeSystem), sameInstance(f.baseType));
    assertThat(((NominalType) f.baseType).superclass(typeSystem),
        nullValue());
    assertThat(f.derivedDecl.isSubclassOf(f.baseDecl), is(true));
    assertThat(f.baseDecl.isSubclassOf(f.derivedDecl), is(false));
  }
}

// End TypeSystemTest.java
