/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package chalk.chc.ast;

import chalk.chc.common.lang.Type;

/**
 * Declaration of a variable with an initial value, e.g.
 * <code>let x: int = 5;</code> or <code>mut y: float = 2.0;</code>
 */
public class VarDecl extends Statement {
  private final String name;
  private final Type type;
  private final Expression value;
  private final boolean mutable;

  public VarDecl(String name, Type type, Expression value, boolean mutable,
                 Integer line) {
    super(line);
    this.name = name;
    this.type = type;
    this.value = value;
    this.mutable = mutable;
  }

  public String name() {
    return name;
  }

  public Type type() {
    return type;
  }

  public Expression value() {
    return value;
  }

  public boolean isMutable() {
    return mutable;
  }

  @Override
  public <R, E extends Exception> R accept(StatementVisitor<R, E> visitor)
      throws E {
    return visitor.visitVarDecl(this);
  }

  @Override
  public String toString() {
    return (mutable ? "mut " : "let ") + name + ": " + type + " = " + value;
  }
}
