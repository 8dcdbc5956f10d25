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

import chalk.chc.common.Settings;
import chalk.chc.common.exceptions.InvalidOptionException;

/**
 * Optional extra checks for the semantic analyzer.  All of them are off
 * by default.
 */
public class AnalysisOptions {
  /** if and while conditions must be bool */
  public final boolean strictConditions;
  /** bare return not allowed in functions returning a value */
  public final boolean strictReturns;
  /** a name may only be defined once per scope */
  public final boolean rejectRedefinition;

  public static final AnalysisOptions DEFAULTS =
                              new AnalysisOptions(false, false, false);

  public AnalysisOptions(boolean strictConditions, boolean strictReturns,
                         boolean rejectRedefinition) {
    this.strictConditions = strictConditions;
    this.strictReturns = strictReturns;
    this.rejectRedefinition = rejectRedefinition;
  }

  public static AnalysisOptions fromSettings() throws InvalidOptionException {
    return new AnalysisOptions(
        Settings.getBoolean(Settings.STRICT_CONDITIONS),
        Settings.getBoolean(Settings.STRICT_RETURNS),
        Settings.getBoolean(Settings.REJECT_REDEFINITION));
  }

  @Override
  public String toString() {
    return "strictConditions=" + strictConditions +
           " strictReturns=" + strictReturns +
           " rejectRedefinition=" + rejectRedefinition;
  }
}
