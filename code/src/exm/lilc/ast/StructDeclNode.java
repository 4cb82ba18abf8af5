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
 * Struct definition
 *
 * E.g.
 * struct Point {
 *     int x;
 *     int y;
 * };
 */
public class StructDeclNode extends DeclNode
{
  private final IdNode id;
  private final DeclListNode fields;

  public StructDeclNode(IdNode id, DeclListNode fields)
  {
    this.id = Preconditions.checkNotNull(id);
    this.fields = Preconditions.checkNotNull(fields);
  }

  public IdNode id()
  {
    return id;
  }

  public DeclListNode fields()
  {
    return fields;
  }

  @Override
  public void unparse(Appendable out, int indent, int indentWidth)
                                                throws IOException
  {
    doIndent(out, indent, indentWidth);
    out.append("struct ");
    id.unparse(out, 0, indentWidth);
    out.append(" {\n");
    fields.unparse(out, indent + 1, indentWidth);
    doIndent(out, indent, indentWidth);
    out.append("};\n\n");
  }
}
