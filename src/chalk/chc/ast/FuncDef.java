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

import java.util.List;

import com.google.common.collect.ImmutableList;

import chalk.chc.common.lang.Type;

/**
 * Function definition
 */
public class FuncDef extends Statement {
  private final String name;
  private final List<Param> params;
  private final Type returnType;
  private final List<Statement> body;

  public FuncDef(String name, List<Param> params, Type returnType,
                 List<? extends Statement> body, Integer line) {
    super(line);
    this.name = name;
    this.params = ImmutableList.copyOf(params);
    this.returnType = returnType;
    this.body = ImmutableList.copyOf(body);
  }

  public String name() {
    return name;
  }

  public List<Param> params() {
    return params;
  }

  public Type returnType() {
    return returnType;
  }

  public List<Statement> body() {
    return body;
  }

  @Override
  public <R, E extends Exception> R accept(StatementVisitor<R, E> visitor)
      throws E {
    return visitor.visitFuncDef(this);
  }

  @Override
  public String toString() {
    return "fn " + name + params + " -> " + returnType;
  }

  /**
   * A named, typed formal parameter
   */
  public static class Param {
    private final String name;
    private final Type type;

    public Param(String name, Type type) {
      this.name = name;
      this.type = type;
    }

    public String name() {
      return name;
    }

    public Type type() {
      return type;
    }

    @Override
    public String toString() {
      return name + ": " + type;
    }
  }
}
