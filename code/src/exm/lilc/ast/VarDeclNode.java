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
 * Variable declaration: int x;
 *
 * The size is NOT_STRUCT for ordinary variables.  Any other value is
 * kept for later phases and written back as a suffix: int x[10];
 */
public class VarDeclNode extends DeclNode
{
  public static final int NOT_STRUCT = -1;

  private final TypeNode type;
  private final IdNode id;
  private final int size;

  public VarDeclNode(TypeNode type, IdNode id, int size)
  {
    this.type = Preconditions.checkNotNull(type);
    this.id = Preconditions.checkNotNull(id);
    this.size = size;
  }

  public TypeNode type()
  {
    return type;
  }

  public IdNode id()
  {
    return id;
  }

  public int size()
  {
    return size;
  }

  public boolean hasSize()
  {
    return size != NOT_STRUCT;
  }

  @Override
  public void unparse(Appendable out, int indent, int indentWidth)
                                                throws IOException
  {
    doIndent(out, indent, indentWidth);
    type.unparse(out, 0, indentWidth);
    out.append(' ');
    id.unparse(out, 0, indentWidth);
    if (hasSize()) {
      out.append('[');
      out.append(Integer.toString(size));
      out.append(']');
    }
    out.append(";\n");
  }
}
