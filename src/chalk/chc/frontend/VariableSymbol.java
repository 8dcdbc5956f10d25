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
package chalk.chc.frontend;

import chalk.chc.common.lang.Type;

/**
 * A declared variable or function parameter
 */
public class VariableSymbol extends Symbol {
  private final Type type;
  private final boolean mutable;

  public VariableSymbol(String name, Type type, boolean mutable) {
    super(name);
    this.type = type;
    this.mutable = mutable;
  }

  public Type type() {
    return type;
  }

  public boolean isMutable() {
    return mutable;
  }

  @Override
  public DefKind kind() {
    return DefKind.VARIABLE;
  }

  @Override
  public String toString() {
    return (mutable ? "mut " : "") + name + ": " + type;
  }
}
