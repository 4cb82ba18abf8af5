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
 * If-then-else construct
 *
 * E.g.
 * if (x) {
 *     ...
 * } else {
 *     ...
 * }
 */
public class IfElseStmtNode extends StmtNode
{
  private final ExpNode condition;
  private final DeclListNode thenDecls;
  private final StmtListNode thenStmts;
  private final DeclListNode elseDecls;
  private final StmtListNode elseStmts;

  public IfElseStmtNode(ExpNode condition,
        DeclListNode thenDecls, StmtListNode thenStmts,
        DeclListNode elseDecls, StmtListNode elseStmts)
  {
    this.condition = Preconditions.checkNotNull(condition);
    this.thenDecls = Preconditions.checkNotNull(thenDecls);
    this.thenStmts = Preconditions.checkNotNull(thenStmts);
    this.elseDecls = Preconditions.checkNotNull(elseDecls);
    this.elseStmts = Preconditions.checkNotNull(elseStmts);
  }

  public ExpNode condition()
  {
    return condition;
  }

  public DeclListNode thenDecls()
  {
    return thenDecls;
  }

  public StmtListNode thenStmts()
  {
    return thenStmts;
  }

  public DeclListNode elseDecls()
  {
    return elseDecls;
  }

  public StmtListNode elseStmts()
  {
    return elseStmts;
  }

  @Override
  public void unparse(Appendable out, int indent, int indentWidth)
                                                throws IOException
  {
    doIndent(out, indent, indentWidth);
    out.append("if (");
    condition.unparse(out, 0, indentWidth);
    out.append(") {\n");
    unparseBlock(out, indent, indentWidth, thenDecls, thenStmts);
    out.append(" else {\n");
    unparseBlock(out, indent, indentWidth, elseDecls, elseStmts);
    out.append('\n');
  }
}
