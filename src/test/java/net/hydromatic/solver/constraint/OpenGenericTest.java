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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;

import com.google.common.collect.ImmutableList;
import java.util.HashMap;
import java.util.Map;
import net.hydromatic.solver.Fixture;
import net.hydromatic.solver.decl.AssociatedTypeDecl;
import net.hydromatic.solver.decl.FuncDecl;
import net.hydromatic.solver.decl.GenericSignature;
import net.hydromatic.solver.decl.NominalDecl;
import net.hydromatic.solver.decl.Requirement;
import net.hydromatic.solver.type.FnType;
import net.hydromatic.solver.type.GenericParamType;
import net.hydromatic.solver.type.Type;
import net.hydromatic.solver.type.TypeVariable;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.junit.jupiter.api.Test;

/** Tests for opening generic signatures and types in a
 * {@link ConstraintSystem}. */
public class OpenGenericTest {
  final Fixture f = new Fixture();
  final ConstraintSystem cs = new ConstraintSystem(f.module);
  final GenericParamType t = f.module.genericParams("T").get(0);

  @Test void testOpenGeneric() {
    final GenericSignature signature =
        GenericSignature.of(ImmutableList.of(t),
            ImmutableList.of(Requirement.conformance(t, f.equatableType)));
    final Map<Type, TypeVariable> replacements = new HashMap<>();
    cs.openGeneric(signature, false, null, replacements);

    final TypeVariable v = cs.getTypeVariables().get(0);
    assertThat(cs.getTypeVariables().size(), is(1));
    assertThat(replacements.get(t), sameInstance(v));
    assertThat(replacements.get(signature.archetype(t)), sameInstance(v));
    assertThat(v.archetype(), sameInstance(signature.archetype(t)));
    assertThat(cs.getInactiveConstraints().size(), is(1));
    assertThat(cs.getInactiveConstraints().get(0).toString(),
        is("$T0 conforms to Equatable"));

    final Type opened =
        cs.openType(f.fn(f.tuple(t), f.optional(t)), replacements, null);
    assertThat(opened.toString(), is("($T0) -> Optional<$T0>"));
  }

  /** Each reference to a generic function opens it afresh. */
  @Test void testReferenceToGenericFunction() {
    final FuncDecl id =
        f.module.func(null, "id",
            f.typeSystem.genericFnType(GenericSignature.of(t), f.tuple(t),
                t));
    final ConstraintSystem.OpenedReference r1 =
        cs.getTypeOfReference(id, false, null);
    final ConstraintSystem.OpenedReference r2 =
        cs.getTypeOfReference(id, false, null);
    assertThat(r1.refType.toString(), is("($T0) -> $T0"));
    assertThat(r2.refType.toString(), is("($T1) -> $T1"));
    assertThat(r1.refType instanceof FnType, is(true));
  }

  /** An associated type of an opened parameter becomes one type variable,
   * however many times the type mentions it. */
  @Test void testMemberTypeIsMemoized() {
    final NominalDecl container = f.module.protocol("Container");
    final AssociatedTypeDecl element =
        f.module.associatedType(container, "Element",
            ImmutableList.of(f.equatable), null);
    final GenericParamType c = f.module.genericParams("C").get(0);
    final GenericSignature signature =
        GenericSignature.of(ImmutableList.of(c),
            ImmutableList.of(
                Requirement.conformance(c,
                    container.declaredInterfaceType())));
    final Type cElement = f.typeSystem.dependentMemberType(c, element);
    final Map<Type, TypeVariable> replacements = new HashMap<>();
    cs.openGeneric(signature, false, null, replacements);
    final Type opened =
        cs.openType(f.fn(f.tuple(cElement, cElement), cElement),
            replacements, null);

    // $T0 is C, $T1 is C.Element
    assertThat(opened.toString(), is("($T1, $T1) -> $T1"));
    assertThat(cs.getTypeVariables().size(), is(2));
    int typeMemberCount = 0;
    int conformsToCount = 0;
    for (Constraint constraint : cs.getInactiveConstraints()) {
      if (constraint.kind == ConstraintKind.TYPE_MEMBER) {
        ++typeMemberCount;
      } else if (constraint.kind == ConstraintKind.CONFORMS_TO) {
        ++conformsToCount;
      }
    }
    assertThat(typeMemberCount, is(1));
    assertThat(conformsToCount, is(2));

    // Opening again in the same system reuses the member type variable
    final Type opened2 = cs.openType(cElement, replacements, null);
    assertThat(opened2, sameInstance(cs.getTypeVariables().get(1)));
  }

  /** An opener can tie a parameter to a known type. */
  @Test void testOpener() {
    final DependentTypeOpener opener =
        new DependentTypeOpener() {
          @Override public @Nullable Type openedGenericParameter(
              GenericParamType param, TypeVariable typeVariable) {
            return param == t ? f.intType : null;
          }
        };
    final Map<Type, TypeVariable> replacements = new HashMap<>();
    cs.openGeneric(GenericSignature.of(t), false, opener, replacements);
    final TypeVariable v = replacements.get(t);
    assertThat(cs.getFixedType(v), sameInstance(f.intType));
  }

  /** A protocol's requirement that {@code Self} conforms to it can be
   * skipped. */
  @Test void testSkipProtocolSelfConstraint() {
    final Map<Type, TypeVariable> replacements = new HashMap<>();
    cs.openGeneric(f.equatable.genericSignature(), true, null, replacements);
    assertThat(cs.getInactiveConstraints().isEmpty(), is(true));
    cs.openGeneric(f.equatable.genericSignature(), false, null,
        new HashMap<>());
    assertThat(cs.getInactiveConstraints().size(), is(1));
  }
}

// End OpenGenericTest.java
