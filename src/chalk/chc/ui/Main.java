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

package chalk.chc.ui;

import java.io.File;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.log4j.Logger;

import chalk.chc.common.Logging;
import chalk.chc.common.Settings;
import chalk.chc.common.exceptions.ChcFatal;
import chalk.chc.common.exceptions.InvalidOptionException;
import chalk.chc.frontend.AnalysisOptions;

/**
 * Command line interface to chc compiler.  Some compiler options
 * are passed indirectly through Java properties.  See Settings.java
 * for handling of these options.
 */
public class Main {
  private static final String CHECK_FLAG = "c";
  private static final String UPDATE_FLAG = "u";
  private static final String HELP_FLAG = "h";

  static final String INPUT_EXT = ".ch";
  static final String OUTPUT_EXT = ".c";

  public static void main(String[] args) {

    Args chcArgs = processArgs(args);

    try {
      Settings.initChcProperties();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up options: " + ex.getMessage());
      System.exit(ExitCode.ERROR_COMMAND.code());
    }
    recordArgValues(chcArgs);

    Logger logger = null;
    AnalysisOptions options = null;
    try {
      logger = setupLogging();
      options = AnalysisOptions.fromSettings();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up logging: " + ex.getMessage());
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    File inputFile = new File(chcArgs.inputFilename);
    if (!inputFile.isFile() || !inputFile.canRead()) {
      System.err.println("Input file \"" + inputFile + "\" is not readable");
      System.exit(ExitCode.ERROR_IO.code());
    }

    File finalOutput = null;
    if (!chcArgs.checkOnly) {
      finalOutput = new File(selectOutputFilename(chcArgs.inputFilename,
                                                  chcArgs.outputFilename));
      if (skipCompile(chcArgs, inputFile, finalOutput)) {
        System.exit(ExitCode.SUCCESS.code());
      }
    }

    try {
      ChalkCompiler chc = new ChalkCompiler(logger, options);
      chc.compile(inputFile, finalOutput);
    } catch (ChcFatal ex) {
      System.exit(ex.exitCode);
    }
  }

  private static Options initOptions() {
    Options opts = new Options();
    opts.addOption(CHECK_FLAG, "check", false,
                   "Check the program without generating C");
    opts.addOption(UPDATE_FLAG, "update", false,
                   "Update output only if out of date");
    opts.addOption(HELP_FLAG, "help", false, "Print this message");
    return opts;
  }

  private static Args processArgs(String[] args) {
    Options opts = initOptions();

    CommandLine cmd = null;
    try {
      CommandLineParser parser = new DefaultParser();
      cmd = parser.parse(opts, args);
    } catch (ParseException ex) {
      // Use Apache CLI-provided messages
      System.err.println(ex.getMessage());
      usage(opts);
      System.exit(ExitCode.ERROR_COMMAND.code());
      return null;
    }

    if (cmd.hasOption(HELP_FLAG)) {
      usage(opts);
      System.exit(ExitCode.SUCCESS.code());
    }

    String[] remainingArgs = cmd.getArgs();
    if (remainingArgs.length < 1 || remainingArgs.length > 2) {
      System.err.println("Expected input file and optional output file, " +
              "but got " + remainingArgs.length + " arguments");
      usage(opts);
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    String input = remainingArgs[0];
    String output = null;
    if (remainingArgs.length == 2) {
      output = remainingArgs[1];
    }
    return new Args(input, output, cmd.hasOption(CHECK_FLAG),
                    cmd.hasOption(UPDATE_FLAG));
  }

  /**
   * Store in properties for later logging
   */
  private static void recordArgValues(Args args) {
    Settings.set(Settings.INPUT_FILENAME, args.inputFilename);
    if (args.outputFilename != null) {
      Settings.set(Settings.OUTPUT_FILENAME, args.outputFilename);
    }
  }

  /**
   * Check conditions for skipping compilation entirely
   */
  private static boolean skipCompile(Args args, File infile, File outfile) {
    if (args.updateOutput && outfile.exists() &&
        !olderThan(outfile, infile)) {
      Logging.getChcLogger().debug("Output up to date. Done.");
      return true;
    }
    return false;
  }

  private static boolean olderThan(File file1, File file2) {
    long modTime1 = file1.lastModified();
    long modTime2 = file2.lastModified();
    return modTime1 < modTime2;
  }

  /**
   * @param outputFilename explicit output name, or null
   * @return output name, by default the input name with the Chalk
   *         extension replaced by .c
   */
  static String selectOutputFilename(String inputFilename,
                                     String outputFilename) {
    if (outputFilename != null) {
      return outputFilename;
    }
    String prefix;
    if (inputFilename.endsWith(INPUT_EXT)) {
      prefix = inputFilename.substring(0,
                        inputFilename.length() - INPUT_EXT.length());
    } else {
      prefix = inputFilename;
    }
    return prefix + OUTPUT_EXT;
  }

  private static Logger setupLogging() throws InvalidOptionException {
    String logfile = Settings.get(Settings.LOG_FILE);
    boolean trace = Settings.getBoolean(Settings.LOG_TRACE);
    return Logging.setupLogging(logfile, trace);
  }

  private static void usage(Options opts) {
    HelpFormatter fmt = new HelpFormatter();
    fmt.printHelp("chc [options] <input.ch> [output.c]", opts);
  }

  private static class Args {
    public final String inputFilename;
    public final String outputFilename;
    public final boolean checkOnly;
    public final boolean updateOutput;

    public Args(String inputFilename, String outputFilename,
                boolean checkOnly, boolean updateOutput) {
      this.inputFilename = inputFilename;
      this.outputFilename = outputFilename;
      this.checkOnly = checkOnly;
      this.updateOutput = updateOutput;
    }
  }
}
