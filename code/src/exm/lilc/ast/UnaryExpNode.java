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
 * Prefix operator applied to one operand, always parenthesised: (-x)
 */
public class UnaryExpNode extends ExpNode
{
  public static enum UnaryOp {
    MINUS("-"),
    NOT("!");

    private final String token;

    private UnaryOp(String token) {
      this.token = token;
    }

    /** Operator as written in source */
    public String token() {
      return token;
    }
  }

  private final UnaryOp op;
  private final ExpNode operand;

  public UnaryExpNode(UnaryOp op, ExpNode operand)
  {
    this.op = Preconditions.checkNotNull(op);
    this.operand = Preconditions.checkNotNull(operand);
  }

  public static UnaryExpNode minus(ExpNode operand) {
    return new UnaryExpNode(UnaryOp.MINUS, operand);
  }

  public static UnaryExpNode not(ExpNode operand) {
    return new UnaryExpNode(UnaryOp.NOT, operand);
  }

  public UnaryOp op()
  {
    return op;
  }

  public ExpNode operand()
  {
    return operand;
  }

  @Override
  public void unparse(Appendable out, int indent, int indentWidth)
                                                throws IOException
  {
    out.append('(');
    out.append(op.token());
    operand.unparse(out, 0, indentWidth);
    out.append(')');
  }
}
