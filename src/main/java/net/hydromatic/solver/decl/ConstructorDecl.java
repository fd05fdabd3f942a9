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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Collection;
import net.hydromatic.solver.type.AnyFunctionType;
import net.hydromatic.solver.type.Type;

/** Declaration of an initializer of a nominal type.
 *
 * <p>The interface type maps the parameters to the declared type of the
 * owner. */
public class ConstructorDecl extends Decl {
  public ConstructorDecl(NominalDecl owner, AnyFunctionType interfaceType,
      Collection<Attribute> attributes) {
    super("init", owner, attributes);
    checkArgument(!attributes.contains(Attribute.STATIC),
        "constructor cannot be static");
    setInterfaceType(interfaceType);
  }

  @Override public boolean isInstanceMember() {
    return false;
  }

  @Override public String selector() {
    return selector(name, interfaceType());
  }

  @Override public Type resultInterfaceType() {
    return ((AnyFunctionType) interfaceType()).result();
  }
}

// End ConstructorDecl.java
