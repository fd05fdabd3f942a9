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

import static com.google.common.base.Preconditions.checkArgument;
import static net.hydromatic.solver.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.UnaryOperator;
import net.hydromatic.solver.ast.Op;

/** Tuple type, such as {@code (x: Int, String)}.
 *
 * <p>Each element has a label, the empty string if it is not labeled. The
 * empty tuple is {@code Void}. */
public class TupleType extends BaseType {
  public final ImmutableList<String> labels;
  public final ImmutableList<Type> elementTypes;

  TupleType(ImmutableList<String> labels, ImmutableList<Type> elementTypes) {
    super(Op.TUPLE_TYPE, anyHasTypeVariable(elementTypes));
    checkArgument(labels.size() == elementTypes.size());
    this.labels = labels;
    this.elementTypes = elementTypes;
  }

  @Override public Key key() {
    return Keys.tuple(labels, Keys.toKeys(elementTypes));
  }

  @Override public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override public TupleType copy(TypeSystem typeSystem,
      UnaryOperator<Type> transform) {
    final List<Type> elementTypes2 = transformEager(elementTypes, transform);
    return elementTypes2.equals(elementTypes)
        ? this
        : typeSystem.tupleType(labels, elementTypes2);
  }

  public int size() {
    return elementTypes.size();
  }

  public String label(int i) {
    return labels.get(i);
  }

  public Type elementType(int i) {
    return elementTypes.get(i);
  }

  /** Returns the index of the element with a given label, or -1. */
  public int indexOf(String label) {
    return label.isEmpty() ? -1 : labels.indexOf(label);
  }
}

// End TupleType.java
