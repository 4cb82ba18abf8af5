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
 * Function definition
 *
 * E.g.
 * int add(int a, int b) {
 *     return (a + b);
 * }
 */
public class FnDeclNode extends DeclNode
{
  private final TypeNode returnType;
  private final IdNode id;
  private final FormalsListNode formals;
  private final FnBodyNode body;

  public FnDeclNode(TypeNode returnType, IdNode id,
                    FormalsListNode formals, FnBodyNode body)
  {
    this.returnType = Preconditions.checkNotNull(returnType);
    this.id = Preconditions.checkNotNull(id);
    this.formals = Preconditions.checkNotNull(formals);
    this.body = Preconditions.checkNotNull(body);
  }

  public TypeNode returnType()
  {
    return returnType;
  }

  public IdNode id()
  {
    return id;
  }

  public FormalsListNode formals()
  {
    return formals;
  }

  public FnBodyNode body()
  {
    return body;
  }

  @Override
  public void unparse(Appendable out, int indent, int indentWidth)
                                                throws IOException
  {
    doIndent(out, indent, indentWidth);
    returnType.unparse(out, 0, indentWidth);
    out.append(' ');
    id.unparse(out, 0, indentWidth);
    out.append('(');
    formals.unparse(out, 0, indentWidth);
    out.append(") {\n");
    body.unparse(out, indent + 1, indentWidth);
    doIndent(out, indent, indentWidth);
    // blank line between top-level definitions
    out.append("}\n\n");
  }
}
