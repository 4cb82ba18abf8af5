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

import static exm.lilc.ast.Nodes.args;
import static exm.lilc.ast.Nodes.binary;
import static exm.lilc.ast.Nodes.id;
import static exm.lilc.ast.Nodes.intLit;
import static exm.lilc.ast.Nodes.strLit;
import static org.junit.Assert.assertEquals;

import org.junit.Test;

import exm.lilc.ast.BinaryExpNode.BinaryOp;
import exm.lilc.tokens.IdToken;
import exm.lilc.tokens.IntLitToken;

public class ExpNodeTest {

  @Test
  public void testLeaves() {
    assertEquals("42", intLit(42).toString());
    assertEquals("\"hi\\n\"", strLit("\"hi\\n\"").toString());
    assertEquals("true", new TrueNode().toString());
    assertEquals("false", new FalseNode().toString());
    assertEquals("count", id("count").toString());
  }

  @Test
  public void testIdCopiesToken() {
    IdNode id = new IdNode(new IdToken("total", 7, 12));
    assertEquals("total", id.name());
    assertEquals(7, id.line());
    assertEquals(12, id.column());
  }

  @Test
  public void testExpressionsIgnoreIndent() throws Exception {
    StringBuilder sb = new StringBuilder();
    binary(BinaryOp.PLUS, id("a"), intLit(1)).unparse(sb, 3);
    assertEquals("Expressions must not indent", "(a + 1)", sb.toString());
  }

  @Test
  public void testAllBinaryOperators() {
    String[] expected = {"+", "-", "*", "/", "&&", "||",
                         "==", "!=", "<", ">", "<=", ">="};
    BinaryOp[] ops = BinaryOp.values();
    assertEquals(expected.length, ops.length);
    for (int i = 0; i < ops.length; i++) {
      assertEquals("(x " + expected[i] + " y)",
                   binary(ops[i], id("x"), id("y")).toString());
    }
  }

  @Test
  public void testNestedBinaryFullyParenthesised() {
    // (a + b) * c and a + (b * c) must come out differently
    ExpNode left = binary(BinaryOp.TIMES,
        binary(BinaryOp.PLUS, id("a"), id("b")), id("c"));
    ExpNode right = binary(BinaryOp.PLUS,
        id("a"), binary(BinaryOp.TIMES, id("b"), id("c")));
    assertEquals("((a + b) * c)", left.toString());
    assertEquals("(a + (b * c))", right.toString());

    ExpNode leftAssoc = binary(BinaryOp.MINUS,
        binary(BinaryOp.MINUS, id("a"), id("b")), id("c"));
    assertEquals("((a - b) - c)", leftAssoc.toString());
  }

  @Test
  public void testUnary() {
    assertEquals("(-x)", UnaryExpNode.minus(id("x")).toString());
    assertEquals("(!done)", UnaryExpNode.not(id("done")).toString());
    assertEquals("(-(-x))",
        UnaryExpNode.minus(UnaryExpNode.minus(id("x"))).toString());
    assertEquals("(!(a && b))", UnaryExpNode.not(
        binary(BinaryOp.AND, id("a"), id("b"))).toString());
  }

  @Test
  public void testDotAccess() {
    DotAccessNode dot = new DotAccessNode(id("p"), id("x"));
    assertEquals("p.x", dot.toString());
    assertEquals("a.b.c",
        new DotAccessNode(new DotAccessNode(id("a"), id("b")), id("c"))
            .toString());
  }

  @Test
  public void testAssignInExpression() {
    AssignNode inner = new AssignNode(id("y"), intLit(1));
    assertEquals("(y = 1)", inner.toString());
    assertEquals("(x = (y = 1))",
        new AssignNode(id("x"), inner).toString());
  }

  @Test
  public void testCall() {
    assertEquals("f()", new CallExpNode(id("f"), args()).toString());
    assertEquals("max(a, (b + 1), \"s\")",
        new CallExpNode(id("max"), args(id("a"),
            binary(BinaryOp.PLUS, id("b"), intLit(1)),
            strLit("\"s\""))).toString());
  }

  @Test
  public void testNegatedLiteral() {
    assertEquals("(-5)", UnaryExpNode.minus(intLit(5)).toString());
  }

  @Test(expected=IllegalArgumentException.class)
  public void testNegativeLiteral() {
    new IntLitToken(-5, 1, 1);
  }

  @Test(expected=NullPointerException.class)
  public void testNullOperand() {
    new BinaryExpNode(BinaryOp.PLUS, id("a"), null);
  }

  @Test(expected=NullPointerException.class)
  public void testNullOperator() {
    new UnaryExpNode(null, id("a"));
  }
}
