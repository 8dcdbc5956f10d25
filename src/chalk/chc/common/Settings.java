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
package chalk.chc.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import chalk.chc.common.exceptions.InvalidOptionException;

/**
 * General compiler settings
 *
 * Settings are Java properties with defaults set here.  Any of them
 * may be overridden with a system property of the same name.
 * */
public class Settings
{
  public static final String INPUT_FILENAME = "chc.input_filename";
  public static final String OUTPUT_FILENAME = "chc.output_filename";

  public static final String LOG_FILE = "chc.log.file";
  public static final String LOG_TRACE = "chc.log.trace";

  /* Require if and while conditions to be bool */
  public static final String STRICT_CONDITIONS =
                                  "chc.semantic.strict-conditions";
  /* Reject bare return in functions with a non-void return type */
  public static final String STRICT_RETURNS = "chc.semantic.strict-returns";
  /* Reject a second definition of a name in the same scope */
  public static final String REJECT_REDEFINITION =
                                  "chc.semantic.reject-redefinition";

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    // Set defaults here
    defaults.setProperty(INPUT_FILENAME, "");
    defaults.setProperty(OUTPUT_FILENAME, "");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    defaults.setProperty(STRICT_CONDITIONS, "false");
    defaults.setProperty(STRICT_RETURNS, "false");
    defaults.setProperty(REJECT_REDEFINITION, "false");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initChcProperties() throws InvalidOptionException {
    for (String key: properties.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
    validateProperties();
  }

  public static void set(String key, String value) {
    properties.setProperty(key, value);
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
  }

  public static List<String> getKeys() {
    ArrayList<String> keys;
    keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  private static void validateProperties() throws InvalidOptionException {
    getBoolean(LOG_TRACE);
    getBoolean(STRICT_CONDITIONS);
    getBoolean(STRICT_RETURNS);
    getBoolean(REJECT_REDEFINITION);
  }

  public static boolean getBoolean(String key)
                  throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }

    String lStrVal = strVal.toLowerCase();
    if (lStrVal.equals("true")) {
      return true;
    } else if (lStrVal.equals("false")) {
      return false;
    } else {
      throw new InvalidOptionException(
          "option string for " + key + " must be true or false, but was '" +
              strVal + "'");
    }
  }
}
