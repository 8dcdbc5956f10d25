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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * Function call.  Arguments are in call order.
 */
public class Call extends Expression {
  private final String function;
  private final List<Expression> args;

  public Call(String function, List<? extends Expression> args, Integer line) {
    super(line);
    this.function = function;
    this.args = ImmutableList.copyOf(args);
  }

  public String function() {
    return function;
  }

  public List<Expression> args() {
    return args;
  }

  @Override
  public <R, E extends Exception> R accept(ExprVisitor<R, E> visitor)
      throws E {
    return visitor.visitCall(this);
  }

  @Override
  public String toString() {
    return function + "(" + Joiner.on(", ").join(args) + ")";
  }
}
