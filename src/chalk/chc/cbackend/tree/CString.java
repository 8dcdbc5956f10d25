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
 * C string literal.  The contents are emitted between double quotes
 * as given: escape sequences must already be in C form.
 * */
public class CString extends CExpr
{
  String value;

  public CString(String value)
  {
    this.value = value;
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    sb.append('"');
    sb.append(value);
    sb.append('"');
  }
}
