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

/**
 * A statement.  Statements start on a new line at the current
 * indentation and end with a newline.
 */
public abstract class StmtNode extends ASTNode
{
  StmtNode() {
  }

  /**
   * Write the body of a compound statement one level deeper,
   * followed by the closing brace back at the statement's level.
   * The caller has already written the opening brace.
   */
  static void unparseBlock(Appendable out, int indent, int indentWidth,
              DeclListNode declList, StmtListNode stmtList)
                                                throws IOException
  {
    declList.unparse(out, indent + 1, indentWidth);
    stmtList.unparse(out, indent + 1, indentWidth);
    doIndent(out, indent, indentWidth);
    out.append('}');
  }
}
