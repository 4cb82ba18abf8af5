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

import static exm.lilc.ast.Nodes.binary;
import static exm.lilc.ast.Nodes.decls;
import static exm.lilc.ast.Nodes.formals;
import static exm.lilc.ast.Nodes.id;
import static exm.lilc.ast.Nodes.intVar;
import static exm.lilc.ast.Nodes.noDecls;
import static exm.lilc.ast.Nodes.noStmts;
import static exm.lilc.ast.Nodes.stmts;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.IOException;

import org.junit.Test;

import exm.lilc.ast.BinaryExpNode.BinaryOp;

public class DeclNodeTest {

  @Test
  public void testTypes() {
    assertEquals("int", new IntNode().toString());
    assertEquals("bool", new BoolNode().toString());
    assertEquals("void", new VoidNode().toString());
    assertEquals("struct Point", new StructNode(id("Point")).toString());
  }

  @Test
  public void testVarDeclNotStruct() {
    VarDeclNode decl = intVar("x");
    assertFalse(decl.hasSize());
    assertEquals("No suffix for NOT_STRUCT", "int x;\n", decl.toString());
  }

  @Test
  public void testVarDeclWithSize() throws IOException {
    VarDeclNode decl = new VarDeclNode(new StructNode(id("Point")),
                                       id("pts"), 10);
    assertTrue(decl.hasSize());
    assertEquals(10, decl.size());
    StringBuilder sb = new StringBuilder();
    decl.unparse(sb, 1);
    assertEquals("    struct Point pts[10];\n", sb.toString());

    VarDeclNode zero = new VarDeclNode(new BoolNode(), id("b"), 0);
    assertEquals("Only NOT_STRUCT suppresses the suffix",
                 "bool b[0];\n", zero.toString());
  }

  @Test
  public void testFormals() {
    FormalDeclNode a = new FormalDeclNode(new IntNode(), id("a"));
    assertEquals("int a", a.toString());
    assertEquals("", formals().toString());
    assertEquals("int a, bool b", formals(a,
        new FormalDeclNode(new BoolNode(), id("b"))).toString());
  }

  @Test
  public void testFnDecl() {
    FnDeclNode fn = new FnDeclNode(new IntNode(), id("add"),
        formals(new FormalDeclNode(new IntNode(), id("a")),
                new FormalDeclNode(new IntNode(), id("b"))),
        new FnBodyNode(decls(intVar("sum")),
            stmts(Nodes.assign(id("sum"),
                               binary(BinaryOp.PLUS, id("a"), id("b"))),
                  new ReturnStmtNode(id("sum")))));
    assertEquals(
        "int add(int a, int b) {\n" +
        "    int sum;\n" +
        "    sum = (a + b);\n" +
        "    return sum;\n" +
        "}\n" +
        "\n", fn.toString());
  }

  @Test
  public void testEmptyFnDecl() {
    FnDeclNode fn = new FnDeclNode(new VoidNode(), id("nop"), formals(),
                                   new FnBodyNode(noDecls(), noStmts()));
    assertEquals("void nop() {\n}\n\n", fn.toString());
  }

  @Test
  public void testStructDecl() {
    StructDeclNode decl = new StructDeclNode(id("Pair"),
        decls(intVar("first"),
              new VarDeclNode(new BoolNode(), id("second"),
                              VarDeclNode.NOT_STRUCT)));
    assertEquals(2, decl.fields().size());
    assertEquals(
        "struct Pair {\n" +
        "    int first;\n" +
        "    bool second;\n" +
        "};\n" +
        "\n", decl.toString());
  }

  @Test(expected=NullPointerException.class)
  public void testNullType() {
    new VarDeclNode(null, id("x"), VarDeclNode.NOT_STRUCT);
  }
}
