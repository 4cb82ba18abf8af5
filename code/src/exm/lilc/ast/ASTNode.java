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

package exm.lilc.ast;

import java.io.IOException;

import org.apache.commons.lang3.StringUtils;

import exm.lilc.common.Settings;
import exm.lilc.common.exceptions.LilcRuntimeError;

/**
 * The ASTNode class hierarchy represents all Lil' C constructs
 * produced by the parser.
 *
 * Every node can write itself back out as source text.  Nodes hold
 * no rendering state: the nesting level and the indent width are both
 * passed down through unparse(), so a tree can be unparsed any number
 * of times, from any number of threads, with the same result.
 *
 * Children are fixed at construction and owned by exactly one parent.
 */
public abstract class ASTNode
{
  /**
   * Write this node as source text.
   * @param out sink for the text, any exception it throws is passed on
   * @param indent nesting level of the enclosing block
   * @param indentWidth spaces written per level of nesting
   * @throws IOException
   */
  public abstract void unparse(Appendable out, int indent, int indentWidth)
                                                throws IOException;

  /**
   * Write this node with the default indent width
   */
  public final void unparse(Appendable out, int indent) throws IOException
  {
    unparse(out, indent, Settings.DEFAULT_INDENT_WIDTH);
  }

  /**
   * Write the whitespace that starts a line at the given nesting level
   */
  public static void doIndent(Appendable out, int indent, int indentWidth)
                                                throws IOException
  {
    out.append(StringUtils.repeat(' ', indent * indentWidth));
  }

  @Override
  public String toString()
  {
    StringBuilder sb = new StringBuilder(256);
    try {
      unparse(sb, 0);
    } catch (IOException e) {
      throw new LilcRuntimeError("I/O error while unparsing into " +
                                 "string buffer", e);
    }
    return sb.toString();
  }
}
