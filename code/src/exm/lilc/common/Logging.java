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

package exm.lilc.common;

import java.io.IOException;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Appender;
import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.lilc.common.exceptions.InvalidOptionException;

public class Logging
{
  private static final String LILC_LOGGER_NAME = "exm.lilc";

  private static final String LOG_PATTERN = "%-5p %c{1} - %m%n";

  public static Logger getLilcLogger()
  {
    return Logger.getLogger(LILC_LOGGER_NAME);
  }

  /**
   * Send LILC log output to a file, or to stderr if no file is given.
   * A file gets DEBUG messages, stderr only gets warnings unless
   * trace is on.
   * @param logfile may be null or empty
   * @param trace if true, log everything at TRACE level
   * @return the LILC logger
   * @throws InvalidOptionException if the log file can't be opened
   */
  public static Logger setupLogging(String logfile, boolean trace)
                                          throws InvalidOptionException
  {
    Logger lilcLogger = getLilcLogger();
    lilcLogger.removeAllAppenders();
    lilcLogger.setAdditivity(false);

    Layout layout = new PatternLayout(LOG_PATTERN);
    Appender appender;
    Level level;
    if (StringUtils.isEmpty(logfile)) {
      appender = new ConsoleAppender(layout, ConsoleAppender.SYSTEM_ERR);
      level = trace ? Level.TRACE : Level.WARN;
    } else {
      try {
        appender = new FileAppender(layout, logfile, false);
      } catch (IOException e) {
        throw new InvalidOptionException("Could not open log file \"" +
                                      logfile + "\": " + e.getMessage());
      }
      level = trace ? Level.TRACE : Level.DEBUG;
    }
    lilcLogger.addAppender(appender);
    lilcLogger.setLevel(level);
    return lilcLogger;
  }

  /**
   * Set up logging from the current settings
   */
  public static Logger setupLogging() throws InvalidOptionException
  {
    String logfile = Settings.get(Settings.LOG_FILE);
    boolean trace = Settings.getBoolean(Settings.LOG_TRACE);
    return setupLogging(logfile, trace);
  }
}
