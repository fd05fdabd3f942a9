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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.solver.type.Type;
import net.hydromatic.solver.type.TypeVariable;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Graph whose nodes are the type variables of a constraint system and whose
 * edges are the constraints that mention them.
 *
 * <p>The graph lets the system find the constraints that may be affected
 * when a type variable is bound or merged with another, and records which
 * type variables are in the same equivalence class.
 *
 * <p>Nodes are created on demand. Every change is recorded on the system's
 * trail.
 */
public class ConstraintGraph {
  private final ConstraintSystem cs;
  private final Trail trail;
  private final Map<TypeVariable, Node> nodes = new HashMap<>();

  ConstraintGraph(ConstraintSystem cs, Trail trail) {
    this.cs = requireNonNull(cs);
    this.trail = requireNonNull(trail);
  }

  /** Returns the number of nodes. */
  public int size() {
    return nodes.size();
  }

  private Node node(TypeVariable typeVariable) {
    Node node = nodes.get(typeVariable);
    if (node == null) {
      node = new Node(typeVariable);
      nodes.put(typeVariable, node);
      trail.record(() -> nodes.remove(typeVariable));
    }
    return node;
  }

  private @Nullable Node lookup(TypeVariable typeVariable) {
    return nodes.get(typeVariable);
  }

  /** Returns the constraints that mention a type variable directly. */
  public List<Constraint> getConstraints(TypeVariable typeVariable) {
    final Node node = lookup(typeVariable);
    return node == null
        ? ImmutableList.of()
        : ImmutableList.copyOf(node.constraints);
  }

  /** Returns the members of the equivalence class of a type variable,
   * representative first. */
  public List<TypeVariable> getEquivalenceClass(TypeVariable typeVariable) {
    final TypeVariable rep = cs.getRepresentative(typeVariable);
    final Node node = lookup(rep);
    return node == null
        ? ImmutableList.of(rep)
        : ImmutableList.copyOf(node.equivalenceClass);
  }

  /** Adds a constraint, linking it to each type variable it mentions. */
  void addConstraint(Constraint constraint) {
    for (TypeVariable typeVariable : constraint.typeVariables()) {
      final List<Constraint> constraints = node(typeVariable).constraints;
      constraints.add(constraint);
      trail.record(() -> constraints.remove(constraints.size() - 1));
    }
  }

  /** Removes a constraint. */
  void removeConstraint(Constraint constraint) {
    for (TypeVariable typeVariable : constraint.typeVariables()) {
      final Node node = lookup(typeVariable);
      if (node == null) {
        continue;
      }
      final int i = indexOf(node.constraints, constraint);
      if (i >= 0) {
        node.constraints.remove(i);
        trail.record(() -> node.constraints.add(i, constraint));
      }
    }
  }

  private static int indexOf(List<Constraint> constraints,
      Constraint constraint) {
    for (int i = 0; i < constraints.size(); i++) {
      if (constraints.get(i) == constraint) {
        return i;
      }
    }
    return -1;
  }

  /** Merges the equivalence class of {@code other} into that of
   * {@code rep}. */
  void mergeNodes(TypeVariable rep, TypeVariable other) {
    final List<TypeVariable> equivalenceClass = node(rep).equivalenceClass;
    final int size = equivalenceClass.size();
    equivalenceClass.addAll(node(other).equivalenceClass);
    trail.record(() ->
        equivalenceClass.subList(size, equivalenceClass.size()).clear());
  }

  /** Records that a type variable has been bound to a type, so that the
   * variable's constraints are revisited when any type variable in the type
   * is bound. */
  void bindTypeVariable(TypeVariable typeVariable, Type fixedType) {
    for (TypeVariable v : fixedType.typeVariables()) {
      final TypeVariable rep = cs.getRepresentative(v);
      if (rep == typeVariable) {
        continue;
      }
      final Set<TypeVariable> fixedBindings = node(rep).fixedBindings;
      if (fixedBindings.add(typeVariable)) {
        trail.record(() -> fixedBindings.remove(typeVariable));
      }
    }
  }

  /** Returns the constraints that mention any type variable in the
   * equivalence class of a given type variable. */
  public List<Constraint> gatherConstraints(TypeVariable typeVariable) {
    final Set<Constraint> constraints = new LinkedHashSet<>();
    gather(typeVariable, constraints);
    return ImmutableList.copyOf(constraints);
  }

  /** Returns the constraints that may become simpler when a type variable
   * is bound: its own constraints, and those of type variables whose fixed
   * types mention it. */
  List<Constraint> gatherAffectedConstraints(TypeVariable typeVariable) {
    final Set<Constraint> constraints = new LinkedHashSet<>();
    gather(typeVariable, constraints);
    for (TypeVariable v : getEquivalenceClass(typeVariable)) {
      final Node node = lookup(v);
      if (node != null) {
        for (TypeVariable dependent : node.fixedBindings) {
          gather(dependent, constraints);
        }
      }
    }
    return ImmutableList.copyOf(constraints);
  }

  private void gather(TypeVariable typeVariable, Set<Constraint> constraints) {
    for (TypeVariable v : getEquivalenceClass(typeVariable)) {
      final Node node = lookup(v);
      if (node != null) {
        constraints.addAll(node.constraints);
      }
    }
  }

  /** Returns the type variable that stands for a member type of a type
   * variable, or null if none has been created. */
  @Nullable TypeVariable lookupMemberType(TypeVariable base, String name) {
    for (TypeVariable v : getEquivalenceClass(base)) {
      final Node node = lookup(v);
      if (node != null) {
        final TypeVariable member = node.memberTypes.get(name);
        if (member != null) {
          return member;
        }
      }
    }
    return null;
  }

  /** Records the type variable that stands for a member type of a type
   * variable. */
  void setMemberType(TypeVariable base, String name, TypeVariable member) {
    final Map<String, TypeVariable> memberTypes =
        node(cs.getRepresentative(base)).memberTypes;
    memberTypes.put(name, member);
    trail.record(() -> memberTypes.remove(name));
  }

  /** Node of the graph. */
  private static class Node {
    final TypeVariable typeVariable;
    final List<Constraint> constraints = new ArrayList<>();
    /** Members of the equivalence class; meaningful only for the
     * representative. */
    final List<TypeVariable> equivalenceClass = new ArrayList<>();
    /** Type variables whose fixed types mention this one. */
    final Set<TypeVariable> fixedBindings = new LinkedHashSet<>();
    final Map<String, TypeVariable> memberTypes = new HashMap<>();

    Node(TypeVariable typeVariable) {
      this.typeVariable = typeVariable;
      equivalenceClass.add(typeVariable);
    }

    @Override public String toString() {
      return typeVariable + " " + constraints;
    }
  }
}

// End ConstraintGraph.java
