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
import static exm.lilc.ast.Nodes.assign;
import static exm.lilc.ast.Nodes.binary;
import static exm.lilc.ast.Nodes.decls;
import static exm.lilc.ast.Nodes.id;
import static exm.lilc.ast.Nodes.intLit;
import static exm.lilc.ast.Nodes.intVar;
import static exm.lilc.ast.Nodes.noDecls;
import static exm.lilc.ast.Nodes.noStmts;
import static exm.lilc.ast.Nodes.stmts;
import static exm.lilc.ast.Nodes.strLit;
import static exm.lilc.ast.Nodes.write;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.IOException;

import org.junit.Test;

import exm.lilc.ast.BinaryExpNode.BinaryOp;

public class StmtNodeTest {

  private static String unparse(ASTNode node, int indent)
                                            throws IOException {
    StringBuilder sb = new StringBuilder();
    node.unparse(sb, indent);
    return sb.toString();
  }

  @Test
  public void testAssign() throws IOException {
    assertEquals("Statement assignment is not parenthesised",
        "    x = 1;\n", unparse(assign(id("x"), intLit(1)), 1));
    assertEquals("x = (y = 2);\n",
        unparse(assign(id("x"), new AssignNode(id("y"), intLit(2))), 0));
  }

  @Test
  public void testSimpleStatements() throws IOException {
    assertEquals("i++;\n", unparse(new PostIncStmtNode(id("i")), 0));
    assertEquals("        i--;\n",
                 unparse(new PostDecStmtNode(id("i")), 2));
    assertEquals("cin >> p.x;\n", unparse(new ReadStmtNode(
        new DotAccessNode(id("p"), id("x"))), 0));
    assertEquals("cout << \"hello\";\n",
        unparse(write(strLit("\"hello\"")), 0));
    assertEquals("    f(1, x);\n", unparse(new CallStmtNode(
        new CallExpNode(id("f"), args(intLit(1), id("x")))), 1));
  }

  @Test
  public void testReturn() throws IOException {
    ReturnStmtNode bare = new ReturnStmtNode();
    assertFalse(bare.hasValue());
    assertEquals("return;\n", unparse(bare, 0));

    ReturnStmtNode value = new ReturnStmtNode(
        binary(BinaryOp.PLUS, id("a"), id("b")));
    assertTrue(value.hasValue());
    assertEquals("    return (a + b);\n", unparse(value, 1));
  }

  @Test
  public void testIf() throws IOException {
    IfStmtNode stmt = new IfStmtNode(
        binary(BinaryOp.LESS, id("x"), intLit(10)),
        decls(intVar("y")),
        stmts(assign(id("y"), id("x"))));
    assertEquals(
        "    if ((x < 10)) {\n" +
        "        int y;\n" +
        "        y = x;\n" +
        "    }\n", unparse(stmt, 1));
  }

  @Test
  public void testEmptyBlock() throws IOException {
    IfStmtNode stmt = new IfStmtNode(new TrueNode(), noDecls(), noStmts());
    assertEquals("if (true) {\n}\n", unparse(stmt, 0));

    WhileStmtNode loop = new WhileStmtNode(new FalseNode(),
                                           noDecls(), noStmts());
    assertEquals("  while (false) {\n  }\n", unparseWidth(loop, 1, 2));
  }

  @Test
  public void testIfElse() throws IOException {
    IfElseStmtNode stmt = new IfElseStmtNode(id("done"),
        noDecls(), stmts(write(intLit(1))),
        decls(intVar("z")), stmts(write(id("z"))));
    assertEquals(
        "if (done) {\n" +
        "    cout << 1;\n" +
        "} else {\n" +
        "    int z;\n" +
        "    cout << z;\n" +
        "}\n", unparse(stmt, 0));
  }

  @Test
  public void testNestedIndentation() throws IOException {
    // Body one level deeper, back to the same level after the brace
    WhileStmtNode loop = new WhileStmtNode(id("go"), noDecls(),
        stmts(
          new IfStmtNode(id("x"), noDecls(),
              stmts(new PostDecStmtNode(id("x")))),
          assign(id("go"), new FalseNode())));
    StmtListNode body = stmts(loop, write(id("x")));
    assertEquals(
        "    while (go) {\n" +
        "        if (x) {\n" +
        "            x--;\n" +
        "        }\n" +
        "        go = false;\n" +
        "    }\n" +
        "    cout << x;\n", unparse(body, 1));
  }

  @Test(expected=NullPointerException.class)
  public void testNullBody() {
    new WhileStmtNode(id("x"), noDecls(), null);
  }

  private static String unparseWidth(ASTNode node, int indent, int width)
                                                    throws IOException {
    StringBuilder sb = new StringBuilder();
    node.unparse(sb, indent, width);
    return sb.toString();
  }
}
