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
 * Local declarations followed by statements.  The enclosing function
 * supplies the braces and the deeper indentation.
 */
public class FnBodyNode extends ASTNode
{
  private final DeclListNode declList;
  private final StmtListNode stmtList;

  public FnBodyNode(DeclListNode declList, StmtListNode stmtList)
  {
    this.declList = Preconditions.checkNotNull(declList);
    this.stmtList = Preconditions.checkNotNull(stmtList);
  }

  public DeclListNode declList()
  {
    return declList;
  }

  public StmtListNode stmtList()
  {
    return stmtList;
  }

  @Override
  public void unparse(Appendable out, int indent, int indentWidth)
                                                throws IOException
  {
    declList.unparse(out, indent, indentWidth);
    stmtList.unparse(out, indent, indentWidth);
  }
}
