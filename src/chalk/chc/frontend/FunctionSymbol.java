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

import java.util.List;

import com.google.common.collect.ImmutableList;

import chalk.chc.ast.FuncDef.Param;
import chalk.chc.common.lang.Type;

/**
 * Signature of a declared function
 */
public class FunctionSymbol extends Symbol {
  private final List<Param> params;
  private final Type returnType;

  public FunctionSymbol(String name, List<Param> params, Type returnType) {
    super(name);
    this.params = ImmutableList.copyOf(params);
    this.returnType = returnType;
  }

  public List<Param> params() {
    return params;
  }

  public Type returnType() {
    return returnType;
  }

  @Override
  public DefKind kind() {
    return DefKind.FUNCTION;
  }

  @Override
  public String toString() {
    return "fn " + name + params + " -> " + returnType;
  }
}
