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

package exm.lilc.unparse;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;

import com.google.common.base.Preconditions;

import exm.lilc.ast.ProgramNode;
import exm.lilc.common.Settings;
import exm.lilc.common.exceptions.InvalidOptionException;
import exm.lilc.common.exceptions.LilcRuntimeError;

/**
 * Writes a program tree back out as Lil' C source.
 *
 * The caller owns any stream passed in: it is flushed but not closed.
 * I/O errors are passed back to the caller unchanged, in which case the
 * output may hold a truncated program and should be thrown away.
 */
public class Unparser {

  private final Logger logger;

  /** Spaces written per level of nesting */
  private final int indentWidth;

  public Unparser(Logger logger) {
    this(logger, Settings.DEFAULT_INDENT_WIDTH);
  }

  public Unparser(Logger logger, int indentWidth) {
    Preconditions.checkArgument(indentWidth >= 0,
                  "indent width must not be negative: %s", indentWidth);
    this.logger = Preconditions.checkNotNull(logger);
    this.indentWidth = indentWidth;
  }

  /**
   * Create an unparser using the indent width from the current settings.
   * Unparsers created earlier are not affected.
   * @throws InvalidOptionException if the indent width setting is bad
   */
  public static Unparser fromSettings(Logger logger)
                                    throws InvalidOptionException {
    int width = Settings.getIndentWidth();
    logger.debug("Unparser indent width: " + width);
    return new Unparser(logger, width);
  }

  public int getIndentWidth() {
    return indentWidth;
  }

  public String unparse(ProgramNode program) {
    StringBuilder sb = new StringBuilder(4 * 1024);
    try {
      unparse(program, sb);
    } catch (IOException e) {
      throw new LilcRuntimeError("I/O error while unparsing into " +
                                 "string buffer", e);
    }
    return sb.toString();
  }

  /**
   * Unparse the program starting at indent level 0
   */
  public void unparse(ProgramNode program, Appendable out)
                                                  throws IOException {
    Preconditions.checkNotNull(program);
    logger.debug("Unparsing program with " +
                 program.declList().size() + " global declarations");
    program.unparse(out, 0, indentWidth);
    logger.debug("Unparsing done");
  }

  /**
   * Write the program as UTF-8 text to the stream
   */
  public void unparse(ProgramNode program, OutputStream output)
                                                  throws IOException {
    String text = unparse(program);
    if (logger.isTraceEnabled()) {
      logger.trace("Unparsed program:\n" + text);
    }
    Writer w = new OutputStreamWriter(output, StandardCharsets.UTF_8);
    w.write(text);
    // Check everything is flushed to underlying stream
    w.flush();
    logger.debug("Wrote " + text.length() + " characters");
  }

  /**
   * Write the program to a file, creating parent directories as needed
   */
  public void unparse(ProgramNode program, File file) throws IOException {
    logger.debug("Unparsing to " + file.getPath());
    OutputStream output = FileUtils.openOutputStream(file);
    try {
      unparse(program, output);
    } finally {
      output.close();
    }
  }
}
