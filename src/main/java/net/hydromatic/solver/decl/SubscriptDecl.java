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
import net.hydromatic.solver.type.FnType;
import net.hydromatic.solver.type.Type;

/** Declaration of a subscript.
 *
 * <p>The interface type is a function from the index tuple to the element
 * type. */
public class SubscriptDecl extends Decl {
  public SubscriptDecl(NominalDecl owner, FnType interfaceType,
      Collection<Attribute> attributes) {
    super("subscript", owner, attributes);
    setInterfaceType(interfaceType);
  }

  /** Returns the type of the index tuple. */
  public Type indexType() {
    return ((FnType) interfaceType()).input;
  }

  /** Returns the element type. */
  public Type elementType() {
    return ((FnType) interfaceType()).result;
  }

  @Override public String selector() {
    return selector(name, interfaceType());
  }

  @Override public Type resultInterfaceType() {
    return elementType();
  }
}

// End SubscriptDecl.java
