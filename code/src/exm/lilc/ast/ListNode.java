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
import java.util.Iterator;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Common base for nodes with a possibly empty sequence of children of
 * one kind.  The sequence is copied at construction, so changes to the
 * builder's list afterwards have no effect on the node.
 */
public abstract class ListNode<T extends ASTNode> extends ASTNode
{
  private final ImmutableList<T> members;

  /**
   * @param members may be empty but must not contain null
   */
  ListNode(List<? extends T> members)
  {
    this.members = ImmutableList.copyOf(members);
  }

  public List<T> members()
  {
    return members;
  }

  public int size()
  {
    return members.size();
  }

  public boolean isEmpty()
  {
    return members.isEmpty();
  }

  /**
   * Unparse each member in turn at the same indentation
   */
  void unparseEach(Appendable out, int indent, int indentWidth)
                                                throws IOException
  {
    for (T member: members) {
      member.unparse(out, indent, indentWidth);
    }
  }

  /**
   * Unparse members inline with separator between them
   */
  void unparseSeparated(Appendable out, int indent, int indentWidth,
                        String separator) throws IOException
  {
    Iterator<T> it = members.iterator();
    while (it.hasNext())
    {
      it.next().unparse(out, indent, indentWidth);
      if (it.hasNext())
        out.append(separator);
    }
  }
}
