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

import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import chalk.chc.ast.Node;
import chalk.chc.ast.antlr.ChalkParser;
import chalk.chc.common.Logging;

/**
 * Helper functions to augment log messages with contextual information about
 * the current line.
 *
 */
public class LogHelper {
  static final Logger logger = Logging.getChcLogger();

  /**
   * @param tokenNum token number from AST
   * @return descriptive string containing token name, or token number if
   *        unknown token type
   */
  public static String tokName(int tokenNum) {
    if (tokenNum < 0 || tokenNum > ChalkParser.tokenNames.length - 1) {
      return "Invalid token number (" + tokenNum + ")";
    } else {
      return ChalkParser.tokenNames[tokenNum];
    }
  }

  public static void debug(int indent, Node node, String msg) {
    log(indent, Level.DEBUG, location(node), msg);
  }

  public static void trace(int indent, Node node, String msg) {
    log(indent, Level.TRACE, location(node), msg);
  }

  public static void log(int indent, Level level, String location,
                         String msg) {
    if (!logger.isEnabledFor(level)) {
      return;
    }
    StringBuilder sb = new StringBuilder(256);
    sb.append(location);
    for (int i = 0; i < indent; i++)
      sb.append(' ');
    sb.append(msg);
    logger.log(level, sb.toString());
  }

  private static String location(Node node) {
    if (node == null || node.getLine() == null) {
      return "";
    }
    return "line " + node.getLine() + ": ";
  }
}
