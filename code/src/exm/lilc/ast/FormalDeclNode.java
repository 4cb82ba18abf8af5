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
 * One formal parameter.  Written inline as part of the function header.
 */
public class FormalDeclNode extends DeclNode
{
  private final TypeNode type;
  private final IdNode id;

  public FormalDeclNode(TypeNode type, IdNode id)
  {
    this.type = Preconditions.checkNotNull(type);
    this.id = Preconditions.checkNotNull(id);
  }

  public TypeNode type()
  {
    return type;
  }

  public IdNode id()
  {
    return id;
  }

  @Override
  public void unparse(Appendable out, int indent, int indentWidth)
                                                throws IOException
  {
    type.unparse(out, 0, indentWidth);
    out.append(' ');
    id.unparse(out, 0, indentWidth);
  }
}
