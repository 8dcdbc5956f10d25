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

import java.io.IOException;

import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import chalk.chc.common.exceptions.InvalidOptionException;

public class Logging
{
  private static final String CHC_LOGGER_NAME = "chalk.chc";

  private static final String LOG_PATTERN = "%-5p %m%n";

  public static Logger getChcLogger()
  {
    return Logger.getLogger(CHC_LOGGER_NAME);
  }

  /**
   * Configure logging.  Warnings and errors always go to stderr.
   * @param logfile if non-empty, log debug output to this file
   * @param trace if true, log trace output to the log file
   * @return the compiler logger
   * @throws InvalidOptionException if the log file cannot be opened
   */
  public static Logger setupLogging(String logfile, boolean trace)
      throws InvalidOptionException
  {
    Logger chcLogger = getChcLogger();
    chcLogger.removeAllAppenders();
    chcLogger.setAdditivity(false);

    Layout layout = new PatternLayout(LOG_PATTERN);
    ConsoleAppender console = new ConsoleAppender(layout,
                                          ConsoleAppender.SYSTEM_ERR);
    console.setThreshold(Level.WARN);
    chcLogger.addAppender(console);

    if (logfile != null && logfile.length() > 0) {
      try {
        FileAppender file = new FileAppender(layout, logfile, false);
        chcLogger.addAppender(file);
      } catch (IOException e) {
        throw new InvalidOptionException("Could not open log file " +
                                         logfile + ": " + e.getMessage());
      }
      chcLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    } else {
      chcLogger.setLevel(Level.WARN);
    }
    // Even if logging is disabled, this must be valid:
    return chcLogger;
  }
}
