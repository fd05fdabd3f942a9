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
package net.hydromatic.solver.decl;

import java.util.Collection;
import net.hydromatic.solver.type.AnyFunctionType;
import net.hydromatic.solver.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Declaration of a function or method.
 *
 * <p>The interface type is a {@link net.hydromatic.solver.type.FnType}, or a
 * {@link net.hydromatic.solver.type.GenericFnType} if the function has its
 * own generic parameters. */
public class FuncDecl extends Decl {
  public FuncDecl(String name, @Nullable NominalDecl owner,
      AnyFunctionType interfaceType, Collection<Attribute> attributes) {
    super(name, owner, attributes);
    setInterfaceType(interfaceType);
  }

  /** Returns whether this function is an operator, such as {@code +}. */
  public boolean isOperator() {
    return !Character.isJavaIdentifierStart(name.charAt(0));
  }

  @Override public String selector() {
    return selector(name, interfaceType());
  }

  @Override public Type resultInterfaceType() {
    return ((AnyFunctionType) interfaceType()).result();
  }
}

// End FuncDecl.java
