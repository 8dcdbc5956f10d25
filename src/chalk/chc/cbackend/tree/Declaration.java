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
 * Variable declaration with initializer, e.g.
 * const int x = 5;
 * */
public class Declaration extends CTree
{
  boolean isConst;
  String type;
  String name;
  CExpr init;

  public Declaration(boolean isConst, String type, String name, CExpr init)
  {
    this.isConst = isConst;
    this.type = type;
    this.name = name;
    this.init = init;
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    indent(sb);
    if (isConst)
      sb.append("const ");
    sb.append(type);
    sb.append(' ');
    sb.append(name);
    sb.append(" = ");
    init.appendTo(sb);
    sb.append(";\n");
  }
}
