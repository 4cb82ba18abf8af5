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

/**
 * Assignment expression.  Parenthesised when it appears inside another
 * expression, e.g. (x = (y = 1)), and written bare as a statement.
 */
public class AssignNode extends ExpNode
{
  private final ExpNode lhs;
  private final ExpNode rhs;

  public AssignNode(ExpNode lhs, ExpNode rhs)
  {
    this.lhs = Preconditions.checkNotNull(lhs);
    this.rhs = Preconditions.checkNotNull(rhs);
  }

  public ExpNode lhs()
  {
    return lhs;
  }

  public ExpNode rhs()
  {
    return rhs;
  }

  @Override
  public void unparse(Appendable out, int indent, int indentWidth)
                                                throws IOException
  {
    out.append('(');
    unparseNoParens(out, indentWidth);
    out.append(')');
  }

  /**
   * Write as lhs = rhs with no enclosing parentheses
   */
  public void unparseNoParens(Appendable out, int indentWidth)
                                                throws IOException
  {
    lhs.unparse(out, 0, indentWidth);
    out.append(" = ");
    rhs.unparse(out, 0, indentWidth);
  }
}
