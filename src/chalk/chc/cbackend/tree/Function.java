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

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * C function definition
 * */
public class Function extends CTree
{
  String returnType;
  String name;
  /** Parameter declarations, e.g. "int x" */
  List<String> params;
  Sequence body;

  public Function(String returnType, String name, List<String> params,
                  Sequence body)
  {
    this.returnType = returnType;
    this.name = name;
    this.params = new ArrayList<String>(params);
    this.body = body;
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    indent(sb);
    sb.append(returnType);
    sb.append(' ');
    sb.append(name);
    sb.append('(');
    sb.append(StringUtils.join(params, ", "));
    sb.append(") ");
    body.setIndentation(indentation);
    body.appendToAsBlock(sb);
    sb.append("\n");
  }
}
