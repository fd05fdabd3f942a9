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
import net.hydromatic.solver.decl.Module;

/** Type of a reference to a module, whose members are the module's
 * declarations. */
public class ModuleType extends BaseType {
  public final Module module;

  ModuleType(Module module) {
    super(Op.MODULE_TYPE, false);
    this.module = module;
  }

  @Override public Key key() {
    return Keys.module(module);
  }

  @Override public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override public ModuleType copy(TypeSystem typeSystem,
      UnaryOperator<Type> transform) {
    return this;
  }
}

// End ModuleType.java
