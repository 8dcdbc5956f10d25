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

import java.util.HashMap;
import java.util.Map;

/**
 * Names defined in one lexical region
 */
public class Scope {
  private final Map<String, Symbol> symbols = new HashMap<String, Symbol>();

  /**
   * @return the symbol previously bound to the name in this scope,
   *         or null
   */
  public Symbol define(String name, Symbol symbol) {
    return symbols.put(name, symbol);
  }

  public Symbol lookup(String name) {
    return symbols.get(name);
  }

  public boolean isDefined(String name) {
    return symbols.containsKey(name);
  }

  @Override
  public String toString() {
    return symbols.keySet().toString();
  }
}
