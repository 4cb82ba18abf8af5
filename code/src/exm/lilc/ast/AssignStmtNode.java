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
 * Assignment used as a statement: x = 1;
 */
public class AssignStmtNode extends StmtNode
{
  private final AssignNode assign;

  public AssignStmtNode(AssignNode assign)
  {
    this.assign = Preconditions.checkNotNull(assign);
  }

  public AssignNode assign()
  {
    return assign;
  }

  @Override
  public void unparse(Appendable out, int indent, int indentWidth)
                                                throws IOException
  {
    doIndent(out, indent, indentWidth);
    // top-level assignment needs no parentheses
    assign.unparseNoParens(out, indentWidth);
    out.append(";\n");
  }
}
