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
 * Infix operator applied to two operands.
 *
 * Every binary expression is written fully parenthesised,
 * e.g. ((a + b) * c), so that the text parses back to the same tree
 * whatever the precedence and associativity of the operators.
 */
public class BinaryExpNode extends ExpNode
{
  public static enum BinaryOp {
    PLUS("+"),
    MINUS("-"),
    TIMES("*"),
    DIVIDE("/"),
    AND("&&"),
    OR("||"),
    EQUALS("=="),
    NOT_EQUALS("!="),
    LESS("<"),
    GREATER(">"),
    LESS_EQ("<="),
    GREATER_EQ(">=");

    private final String token;

    private BinaryOp(String token) {
      this.token = token;
    }

    public String token() {
      return token;
    }
  }

  private final BinaryOp op;
  private final ExpNode lhs;
  private final ExpNode rhs;

  public BinaryExpNode(BinaryOp op, ExpNode lhs, ExpNode rhs)
  {
    this.op = Preconditions.checkNotNull(op);
    this.lhs = Preconditions.checkNotNull(lhs);
    this.rhs = Preconditions.checkNotNull(rhs);
  }

  public BinaryOp op()
  {
    return op;
  }

  public ExpNode lhs()
  {
    return lhs;
  }

  public ExpNode rhs()
  {
    return rhs;
  }

  @Override
  public void unparse(Appendable out, int indent, int indentWidth)
                                                throws IOException
  {
    out.append('(');
    lhs.unparse(out, 0, indentWidth);
    out.append(' ');
    out.append(op.token());
    out.append(' ');
    rhs.unparse(out, 0, indentWidth);
    out.append(')');
  }
}
