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

import java.util.function.UnaryOperator;
import net.hydromatic.solver.ast.Op;

/** Generic parameter, identified by its depth (0 for the outermost generic
 * context) and its index within that context. */
public class GenericParamType extends BaseType {
  public final int depth;
  public final int index;
  public final String name;

  GenericParamType(int depth, int index, String name) {
    super(Op.GENERIC_PARAM, false);
    this.depth = depth;
    this.index = index;
    this.name = name;
  }

  @Override public Key key() {
    return Keys.genericParam(depth, index, name);
  }

  @Override public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override public GenericParamType copy(TypeSystem typeSystem,
      UnaryOperator<Type> transform) {
    return this;
  }

  /** Returns whether this is the {@code Self} parameter of a protocol. */
  public boolean isProtocolSelf() {
    return depth == 0 && index == 0 && name.equals("Self");
  }
}

// End GenericParamType.java
