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

import java.util.Arrays;
import java.util.Collections;

import exm.lilc.tokens.IdToken;
import exm.lilc.tokens.IntLitToken;
import exm.lilc.tokens.StrLitToken;

/**
 * Shorthand for building trees in tests, standing in for the parser
 */
public class Nodes {

  public static IdNode id(String name) {
    return new IdNode(new IdToken(name, 1, 1));
  }

  public static IntLitNode intLit(int value) {
    return new IntLitNode(new IntLitToken(value, 1, 1));
  }

  public static StrLitNode strLit(String text) {
    return new StrLitNode(new StrLitToken(text, 1, 1));
  }

  public static BinaryExpNode binary(BinaryExpNode.BinaryOp op,
                                     ExpNode lhs, ExpNode rhs) {
    return new BinaryExpNode(op, lhs, rhs);
  }

  public static VarDeclNode intVar(String name) {
    return new VarDeclNode(new IntNode(), id(name), VarDeclNode.NOT_STRUCT);
  }

  public static DeclListNode decls(DeclNode... decls) {
    return new DeclListNode(Arrays.asList(decls));
  }

  public static StmtListNode stmts(StmtNode... stmts) {
    return new StmtListNode(Arrays.asList(stmts));
  }

  public static DeclListNode noDecls() {
    return new DeclListNode(Collections.<DeclNode>emptyList());
  }

  public static StmtListNode noStmts() {
    return new StmtListNode(Collections.<StmtNode>emptyList());
  }

  public static ExpListNode args(ExpNode... exps) {
    return new ExpListNode(Arrays.asList(exps));
  }

  public static FormalsListNode formals(FormalDeclNode... formals) {
    return new FormalsListNode(Arrays.asList(formals));
  }

  public static AssignStmtNode assign(ExpNode lhs, ExpNode rhs) {
    return new AssignStmtNode(new AssignNode(lhs, rhs));
  }

  public static WriteStmtNode write(ExpNode exp) {
    return new WriteStmtNode(exp);
  }
}
