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

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.Lists;

import chalk.chc.common.exceptions.ChcRuntimeError;

/**
 * Stack of scopes, innermost last.  The bottom scope is the global
 * scope, which is never popped.  Lookup walks from the innermost
 * scope outwards, so inner definitions shadow outer ones.
 */
public class ScopeStack {
  private final List<Scope> scopes = new ArrayList<Scope>();

  public ScopeStack() {
    scopes.add(new Scope());
  }

  public void pushScope() {
    scopes.add(new Scope());
  }

  public void popScope() {
    if (scopes.size() <= 1) {
      throw new ChcRuntimeError("Attempted to pop global scope");
    }
    scopes.remove(scopes.size() - 1);
  }

  /**
   * Bind name in the innermost scope, replacing any binding of the same
   * name in that scope
   * @return the replaced symbol, or null
   */
  public Symbol define(String name, Symbol symbol) {
    return currentScope().define(name, symbol);
  }

  /**
   * @return innermost symbol with this name, or null if not defined
   */
  public Symbol lookup(String name) {
    for (Scope scope: Lists.reverse(scopes)) {
      Symbol sym = scope.lookup(name);
      if (sym != null) {
        return sym;
      }
    }
    return null;
  }

  public boolean isDefinedInCurrentScope(String name) {
    return currentScope().isDefined(name);
  }

  /**
   * @return number of scopes above the global scope
   */
  public int depth() {
    return scopes.size() - 1;
  }

  private Scope currentScope() {
    return scopes.get(scopes.size() - 1);
  }

  @Override
  public String toString() {
    return scopes.toString();
  }
}
