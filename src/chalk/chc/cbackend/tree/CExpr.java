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

package chalk.chc.cbackend.tree;

/**
 * A C expression.  Expressions are embedded in statements, so are
 * never indented.
 * */
public abstract class CExpr extends CTree
{
  /**
   * Render a list of expressions separated by commas
   */
  public static void appendList(StringBuilder sb,
                                Iterable<? extends CExpr> exprs)
  {
    boolean first = true;
    for (CExpr expr: exprs)
    {
      if (first)
        first = false;
      else
        sb.append(", ");
      expr.appendTo(sb);
    }
  }
}
