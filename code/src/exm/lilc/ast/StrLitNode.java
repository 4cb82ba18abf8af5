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

import com.google.common.base.Preconditions;

import exm.lilc.tokens.StrLitToken;

/**
 * String literal, written back exactly as the lexer saw it,
 * quotes and escapes included
 */
public class StrLitNode extends ExpNode
{
  private final String text;
  private final int line;
  private final int column;

  public StrLitNode(StrLitToken token)
  {
    Preconditions.checkNotNull(token);
    this.text = token.value();
    this.line = token.line();
    this.column = token.column();
  }

  public String text()
  {
    return text;
  }

  public int line()
  {
    return line;
  }

  public int column()
  {
    return column;
  }

  @Override
  public void unparse(Appendable out, int indent, int indentWidth)
                                                throws IOException
  {
    out.append(text);
  }
}
