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

package exm.lilc.unparse;

import static exm.lilc.ast.ProgramNodeTest.POINT_PROGRAM;
import static exm.lilc.ast.ProgramNodeTest.pointProgram;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.FilterOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;
import org.junit.After;
import org.junit.AfterClass;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import exm.lilc.ast.DeclListNode;
import exm.lilc.ast.DeclNode;
import exm.lilc.ast.FnBodyNode;
import exm.lilc.ast.FnDeclNode;
import exm.lilc.ast.FormalDeclNode;
import exm.lilc.ast.FormalsListNode;
import exm.lilc.ast.IdNode;
import exm.lilc.ast.ProgramNode;
import exm.lilc.ast.StmtListNode;
import exm.lilc.ast.StmtNode;
import exm.lilc.ast.StrLitNode;
import exm.lilc.ast.VoidNode;
import exm.lilc.ast.WriteStmtNode;
import exm.lilc.common.Logging;
import exm.lilc.common.Settings;
import exm.lilc.tokens.IdToken;
import exm.lilc.tokens.StrLitToken;

public class UnparserTest {

  private static Logger logger;

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  @BeforeClass
  public static void setupLogging() throws Exception {
    logger = Logging.setupLogging("", true);
  }

  @After
  public void resetSettings() {
    Settings.reset();
  }

  @AfterClass
  public static void quietLogging() throws Exception {
    Logging.setupLogging(null, false);
  }

  @Test
  public void testUnparseToString() {
    assertEquals(POINT_PROGRAM, new Unparser(logger).unparse(pointProgram()));
  }

  @Test
  public void testUnparseToStream() throws IOException {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    CloseTracker output = new CloseTracker(bytes);
    new Unparser(logger).unparse(greeting(), output);

    assertFalse("Caller's stream must stay open", output.closed);
    assertEquals(
        "void greet() {\n" +
        "    cout << \"héllo\";\n" +
        "}\n" +
        "\n", new String(bytes.toByteArray(), StandardCharsets.UTF_8));
  }

  @Test
  public void testUnparseToFile() throws IOException {
    File out = new File(tmp.getRoot(), "gen/point.lc");
    new Unparser(logger).unparse(pointProgram(), out);
    assertEquals(POINT_PROGRAM,
        FileUtils.readFileToString(out, StandardCharsets.UTF_8));
  }

  @Test
  public void testFromSettings() throws Exception {
    Settings.set(Settings.INDENT_WIDTH, "2");
    Unparser unparser = Unparser.fromSettings(logger);
    assertEquals(2, unparser.getIndentWidth());
    assertEquals(
        "struct Point {\n" +
        "  int x;\n" +
        "  int y;\n" +
        "};\n" +
        "\n" +
        "void main() {\n" +
        "  int a;\n" +
        "  cout << a;\n" +
        "}\n" +
        "\n", unparser.unparse(pointProgram()));
  }

  @Test
  public void testLaterSettingsLeaveUnparserAlone() throws Exception {
    Unparser unparser = new Unparser(logger);
    String before = unparser.unparse(pointProgram());

    Settings.set(Settings.INDENT_WIDTH, "1");
    Unparser narrow = Unparser.fromSettings(logger);

    assertEquals(before, unparser.unparse(pointProgram()));
    assertEquals(POINT_PROGRAM, pointProgram().toString());
    assertEquals(
        "struct Point {\n" +
        " int x;\n" +
        " int y;\n" +
        "};\n" +
        "\n" +
        "void main() {\n" +
        " int a;\n" +
        " cout << a;\n" +
        "}\n" +
        "\n", narrow.unparse(pointProgram()));
  }

  @Test(expected=IllegalArgumentException.class)
  public void testNegativeIndentWidth() {
    new Unparser(logger, -1);
  }

  @Test(expected=NullPointerException.class)
  public void testNullProgram() throws IOException {
    new Unparser(logger).unparse((ProgramNode) null, new StringBuilder());
  }

  private static ProgramNode greeting() {
    StmtNode write = new WriteStmtNode(
        new StrLitNode(new StrLitToken("\"héllo\"", 2, 13)));
    FnDeclNode greet = new FnDeclNode(new VoidNode(),
        new IdNode(new IdToken("greet", 1, 6)),
        new FormalsListNode(Collections.<FormalDeclNode>emptyList()),
        new FnBodyNode(new DeclListNode(Collections.<DeclNode>emptyList()),
                       new StmtListNode(Arrays.asList(write))));
    return new ProgramNode(
        new DeclListNode(Arrays.<DeclNode>asList(greet)));
  }

  private static class CloseTracker extends FilterOutputStream {
    boolean closed = false;

    CloseTracker(ByteArrayOutputStream out) {
      super(out);
    }

    @Override
    public void close() throws IOException {
      closed = true;
      super.close();
    }
  }
}
