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

import chalk.chc.common.exceptions.ChcRuntimeError;

public class IfStatement extends CTree
{
  CExpr condition;
  Sequence thenBlock;
  /** null if there is no else branch */
  Sequence elseBlock;

  public IfStatement(CExpr condition, Sequence thenBlock, Sequence elseBlock)
  {
    this.condition = condition;
    this.thenBlock = thenBlock;
    this.elseBlock = elseBlock;
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    if (thenBlock == null) {
      throw new ChcRuntimeError("if: no then block found");
    }
    indent(sb);
    sb.append("if (");
    condition.appendTo(sb);
    sb.append(") ");
    thenBlock.setIndentation(indentation);
    thenBlock.appendToAsBlock(sb);
    if (elseBlock != null) {
      sb.append(" else ");
      elseBlock.setIndentation(indentation);
      elseBlock.appendToAsBlock(sb);
    }
    sb.append("\n");
  }
}
