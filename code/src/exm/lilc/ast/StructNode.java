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
 * Reference to a struct type by name: struct Point
 *
 * Only the name is held, the definition is looked up by later phases.
 */
public class StructNode extends TypeNode
{
  private final IdNode id;

  public StructNode(IdNode id)
  {
    this.id = Preconditions.checkNotNull(id);
  }

  public IdNode id()
  {
    return id;
  }

  @Override
  public void unparse(Appendable out, int indent, int indentWidth)
                                                throws IOException
  {
    out.append("struct ");
    id.unparse(out, 0, indentWidth);
  }
}
