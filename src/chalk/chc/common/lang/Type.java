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
package chalk.chc.common.lang;

import java.util.HashMap;
import java.util.Map;

/**
 * The closed set of Chalk types.  Each type knows its source name and
 * the C type it is represented as.
 */
public enum Type {
  INT("int", "int"),
  FLOAT("float", "float"),
  STRING("string", "char*"),
  /** C has no boolean type in the headers we include */
  BOOL("bool", "int"),
  VOID("void", "void");

  private static final Map<String, Type> byName = new HashMap<String, Type>();

  static {
    for (Type t: values()) {
      byName.put(t.typeName, t);
    }
  }

  private final String typeName;
  private final String cType;

  private Type(String typeName, String cType) {
    this.typeName = typeName;
    this.cType = cType;
  }

  /**
   * @return name as written in Chalk source
   */
  public String typeName() {
    return typeName;
  }

  /**
   * @return C type used to represent values of this type
   */
  public String cType() {
    return cType;
  }

  public boolean isNumeric() {
    return this == INT || this == FLOAT;
  }

  /**
   * Lookup type by source name.  Case-sensitive.
   * @param name
   * @return the type, or null if no type has that name
   */
  public static Type fromName(String name) {
    return byName.get(name);
  }

  @Override
  public String toString() {
    return typeName;
  }
}
