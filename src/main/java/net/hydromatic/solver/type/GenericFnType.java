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
import net.hydromatic.solver.decl.GenericSignature;

/** The type of a generic function, such as {@code <T> (T) -> T}.
 *
 * <p>The input and result types are written in terms of the signature's
 * generic parameters. A reference to the function opens the signature,
 * producing a {@link FnType}. */
public class GenericFnType extends BaseType implements AnyFunctionType {
  public final GenericSignature signature;
  public final Type input;
  public final Type result;

  GenericFnType(GenericSignature signature, Type input, Type result) {
    super(Op.GENERIC_FUNCTION_TYPE,
        input.hasTypeVariable() || result.hasTypeVariable());
    this.signature = signature;
    this.input = input;
    this.result = result;
  }

  @Override public Key key() {
    return Keys.genericFn(signature, input.key(), result.key());
  }

  @Override public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override public GenericFnType copy(TypeSystem typeSystem,
      UnaryOperator<Type> transform) {
    final Type input2 = transform.apply(input);
    final Type result2 = transform.apply(result);
    return input2 == input && result2 == result
        ? this
        : typeSystem.genericFnType(signature, input2, result2);
  }

  @Override public Type input() {
    return input;
  }

  @Override public Type result() {
    return result;
  }
}

// End GenericFnType.java
