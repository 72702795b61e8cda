////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.pikels.analysis;

import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.tomaszrup.pikels.config.BranchMergeMode;
import com.tomaszrup.pikels.parser.PikeTokenizer;
import com.tomaszrup.pikels.parser.TokenizationException;

class UninitializedVariableAnalyzerTests {
	private static final String FILE = "test.pike";

	private UninitializedVariableAnalyzer analyzer;

	@BeforeEach
	void setup() {
		analyzer = new UninitializedVariableAnalyzer();
	}

	private List<UninitializedVariableDiagnostic> analyze(String code) {
		return analyzer.analyze(code, FILE);
	}

	private static void assertSingle(List<UninitializedVariableDiagnostic> diagnostics, String variable,
			VariableState state) {
		Assertions.assertEquals(1, diagnostics.size(), diagnostics.toString());
		Assertions.assertEquals(variable, diagnostics.get(0).getVariable());
		Assertions.assertEquals(state.getWireName(), diagnostics.get(0).getState());
	}

	// ------------------------------------------------------------------
	// Reference scenarios
	// ------------------------------------------------------------------

	@Test
	void testReadBeforeAssignment() {
		List<UninitializedVariableDiagnostic> diagnostics = analyze("string s; write(s);");

		assertSingle(diagnostics, "s", VariableState.UNINITIALIZED);
		UninitializedVariableDiagnostic diagnostic = diagnostics.get(0);
		Assertions.assertTrue(diagnostic.getMessage().contains("used before being initialized"));
		Assertions.assertEquals(1, diagnostic.getPosition().getLine());
		Assertions.assertEquals(16, diagnostic.getPosition().getCharacter());
		Assertions.assertEquals(FILE, diagnostic.getPosition().getFile());
		Assertions.assertEquals("warning", diagnostic.getSeverity());
		Assertions.assertEquals("uninitialized-variable", diagnostic.getSource());
		Assertions.assertEquals("string", diagnostic.getType());
	}

	@Test
	void testParameterizedTypeWithInitializer() {
		Assertions.assertTrue(analyze("array(int) a = ({}); write(a);").isEmpty());
	}

	@Test
	void testAssignmentInIfWithoutElse() {
		List<UninitializedVariableDiagnostic> diagnostics = analyze(
				"void f(int x) { string s; if (x) { s = \"y\"; } write(s); }");

		assertSingle(diagnostics, "s", VariableState.MAYBE_INITIALIZED);
		Assertions.assertTrue(diagnostics.get(0).getMessage().contains("may be uninitialized"));
		Assertions.assertEquals(52, diagnostics.get(0).getPosition().getCharacter());
	}

	// ------------------------------------------------------------------
	// Basic properties
	// ------------------------------------------------------------------

	@Test
	void testRepeatedReadsReportOnce() {
		assertSingle(analyze("string s; write(s); write(s); return s;"), "s", VariableState.UNINITIALIZED);
	}

	@Test
	void testInitializerPreventsDiagnostic() {
		Assertions.assertTrue(analyze("string s = \"x\"; write(s);").isEmpty());
	}

	@Test
	void testAssignmentPreventsDiagnostic() {
		Assertions.assertTrue(analyze("mapping m; m = ([]); write(m);").isEmpty());
	}

	@Test
	void testCompoundAssignmentCountsAsAssignment() {
		Assertions.assertTrue(analyze("string s; s += \"x\"; write(s);").isEmpty());
	}

	@Test
	void testForeachBindingsAreExempt() {
		Assertions.assertTrue(analyze(
				"array arr = ({}); foreach (arr; int i; mixed v) { write(v); write(i); }").isEmpty());
	}

	@Test
	void testForeachRebindsExistingVariable() {
		Assertions.assertTrue(analyze(
				"array arr = ({}); string item; foreach (arr, item) { write(item); }").isEmpty());
	}

	@Test
	void testForeachIterationExpressionIsRead() {
		assertSingle(analyze("array arr; foreach (arr; int i; mixed v) { }"), "arr", VariableState.UNINITIALIZED);
	}

	@Test
	void testParametersAreExempt() {
		Assertions.assertTrue(analyze("void f(string s) { write(s); }").isEmpty());
	}

	@Test
	void testPrimitiveTypesAreExempt() {
		Assertions.assertTrue(analyze("int x; float y; write(x + y);").isEmpty());
	}

	@Test
	void testElseStartsFromStateBeforeIf() {
		assertSingle(analyze("string x; if (c) { x = \"1\"; } else { write(x); }"), "x",
				VariableState.UNINITIALIZED);
	}

	@Test
	void testSscanfOutputsAreInitialized() {
		Assertions.assertTrue(analyze(
				"string s = \"1 2\"; string a, b; sscanf(s, \"%s %s\", a, b); write(a); write(b);").isEmpty());
	}

	@Test
	void testSscanfInputIsStillRead() {
		assertSingle(analyze("string s; string a; sscanf(s, \"%s\", a); write(a);"), "s",
				VariableState.UNINITIALIZED);
	}

	// ------------------------------------------------------------------
	// Branch merging
	// ------------------------------------------------------------------

	@Test
	void testBothArmsAssign() {
		Assertions.assertTrue(analyze(
				"string s; if (c) { s = \"a\"; } else { s = \"b\"; } write(s);").isEmpty());
	}

	@Test
	void testOnlyElseAssigns() {
		assertSingle(analyze("string s; if (c) { write(1); } else { s = \"b\"; } write(s);"), "s",
				VariableState.MAYBE_INITIALIZED);
	}

	@Test
	void testElseIfChainAssigningEverywhere() {
		Assertions.assertTrue(analyze(
				"string s; if (a) s = \"1\"; else if (b) s = \"2\"; else s = \"3\"; write(s);").isEmpty());
	}

	@Test
	void testElseIfChainWithoutFinalElse() {
		assertSingle(analyze("string s; if (a) s = \"1\"; else if (b) s = \"2\"; write(s);"), "s",
				VariableState.MAYBE_INITIALIZED);
	}

	@Test
	void testLastWrittenModeKeepsElseState() {
		UninitializedVariableAnalyzer lastWritten = new UninitializedVariableAnalyzer(new PikeTokenizer(),
				BranchMergeMode.LAST_WRITTEN);
		Assertions.assertEquals(BranchMergeMode.LAST_WRITTEN, lastWritten.getMergeMode());

		String code = "string s; if (c) { write(1); } else { s = \"b\"; } write(s);";
		Assertions.assertTrue(lastWritten.analyze(code, FILE).isEmpty());
		Assertions.assertEquals(1, analyze(code).size());
	}

	@Test
	void testLastWrittenModeStillJoinsWithoutElse() {
		UninitializedVariableAnalyzer lastWritten = new UninitializedVariableAnalyzer(new PikeTokenizer(),
				BranchMergeMode.LAST_WRITTEN);
		assertSingle(lastWritten.analyze("string s; if (c) { s = \"a\"; } write(s);", FILE), "s",
				VariableState.MAYBE_INITIALIZED);
	}

	@Test
	void testReturningThenArmDoesNotContribute() {
		assertSingle(analyze("void f(int c) { string s; if (c) { s = \"a\"; return; } write(s); }"), "s",
				VariableState.UNINITIALIZED);
	}

	@Test
	void testReturningElseArmDoesNotContribute() {
		Assertions.assertTrue(analyze(
				"void f(int c) { string s; if (c) { s = \"a\"; } else { return; } write(s); }").isEmpty());
	}

	@Test
	void testErrorCallTerminatesArm() {
		Assertions.assertTrue(analyze(
				"void f(int c) { string s; if (!c) error(\"no\"); s = \"a\"; write(s); }").isEmpty());
		Assertions.assertTrue(analyze(
				"void f(int c) { string s; if (c) { s = \"a\"; } else { error(\"no\"); } write(s); }").isEmpty());
	}

	@Test
	void testReturnInNestedBlockDoesNotTerminateArm() {
		assertSingle(analyze(
				"void f(int c, int d) { string s; if (c) { if (d) { return; } s = \"a\"; } write(s); }"), "s",
				VariableState.MAYBE_INITIALIZED);
	}

	@Test
	void testLoopBreakInElseArmDoesNotTerminateArm() {
		assertSingle(analyze(
				"void f(int c, array x) { string s; if (c) { s = \"a\"; } else { while (c) break; } write(s); }"),
				"s", VariableState.MAYBE_INITIALIZED);
	}

	@Test
	void testLoopBreakInThenArmDoesNotTerminateArm() {
		assertSingle(analyze("string s; if (a) { while (x) break; s = \"y\"; } write(s);"), "s",
				VariableState.MAYBE_INITIALIZED);
		assertSingle(analyze("void f(int c) { string s; if (c) for (;;) break; else s = \"b\"; write(s); }"),
				"s", VariableState.MAYBE_INITIALIZED);
	}

	@Test
	void testBreakOfEnclosingLoopTerminatesArm() {
		Assertions.assertTrue(analyze(
				"void f(int c) { string s; while (c) { if (c > 1) { s = \"a\"; } else break; write(s); } }")
				.isEmpty());
	}

	@Test
	void testCatchBlockIsConditional() {
		assertSingle(analyze("string s; catch { s = \"a\"; } write(s);"), "s", VariableState.MAYBE_INITIALIZED);
	}

	@Test
	void testAssignmentBeforeCatchSurvives() {
		Assertions.assertTrue(analyze("string s = \"x\"; catch { s = \"a\"; } write(s);").isEmpty());
	}

	// ------------------------------------------------------------------
	// Declarations
	// ------------------------------------------------------------------

	@Test
	void testDeclarationListTracksEveryName() {
		assertSingle(analyze("string a = \"x\", b; write(a); write(b);"), "b", VariableState.UNINITIALIZED);
	}

	@Test
	void testUnionTypes() {
		Assertions.assertTrue(analyze("string|int x; write(x);").isEmpty());
		assertSingle(analyze("string|array y; write(y);"), "y", VariableState.UNINITIALIZED);
	}

	@Test
	void testBlockScopedDeclarationGoesOutOfScope() {
		Assertions.assertTrue(analyze("{ string s; } write(s);").isEmpty());
	}

	@Test
	void testShadowingInNestedBlock() {
		assertSingle(analyze("string s = \"a\"; { string s; write(s); } write(s);"), "s",
				VariableState.UNINITIALIZED);
	}

	@Test
	void testIndexingReadsTheContainer() {
		assertSingle(analyze("mapping m; write(m[\"k\"]);"), "m", VariableState.UNINITIALIZED);
	}

	@Test
	void testMemberAccessIsNotALocalUse() {
		List<UninitializedVariableDiagnostic> diagnostics = analyze(
				"object o = Foo(); string s; o->s = \"x\"; write(o->s); write(s);");
		assertSingle(diagnostics, "s", VariableState.UNINITIALIZED);
		Assertions.assertEquals(59, diagnostics.get(0).getPosition().getCharacter());
	}

	@Test
	void testCommentsAndStringsAreIgnored() {
		Assertions.assertTrue(analyze("string s; // write(s);\n/* write(s); */ write(\"s\"); s = \"\";").isEmpty());
	}

	// ------------------------------------------------------------------
	// Activations
	// ------------------------------------------------------------------

	@Test
	void testFunctionsHaveOwnTables() {
		List<UninitializedVariableDiagnostic> diagnostics = analyze(
				"string g;\nvoid f() {\n  string s;\n  write(s);\n}\nvoid h() {\n  write(g);\n}");
		assertSingle(diagnostics, "s", VariableState.UNINITIALIZED);
		Assertions.assertEquals(4, diagnostics.get(0).getPosition().getLine());
		Assertions.assertEquals(8, diagnostics.get(0).getPosition().getCharacter());
	}

	@Test
	void testParametersOfClassTypedFunctionsAreExempt() {
		Assertions.assertTrue(analyze("Stdio.File open_it(string path) { return Stdio.File(path); }").isEmpty());
		Assertions.assertTrue(analyze("Foo make(string name, mapping opts) { write(name); write(opts); }").isEmpty());
	}

	@Test
	void testLocalsOfClassTypedFunctionsAreChecked() {
		assertSingle(analyze("Stdio.File open_it(string path) { string mode; return Stdio.File(path, mode); }"),
				"mode", VariableState.UNINITIALIZED);
	}

	@Test
	void testLambdaBody() {
		assertSingle(analyze("function f = lambda(string x) { string t; write(x); write(t); };"), "t",
				VariableState.UNINITIALIZED);
	}

	@Test
	void testClassBodyAndMethods() {
		List<UninitializedVariableDiagnostic> diagnostics = analyze(
				"class Greeter(string name) {\n"
						+ "  string greet() { return \"Hello \" + name; }\n"
						+ "  void broken() { string s; write(s); }\n"
						+ "}");
		assertSingle(diagnostics, "s", VariableState.UNINITIALIZED);
		Assertions.assertEquals(3, diagnostics.get(0).getPosition().getLine());
	}

	@Test
	void testDiagnosticsAreOrderedByPosition() {
		List<UninitializedVariableDiagnostic> diagnostics = analyze(
				"void outer() {\n  void inner() { string a; write(a); }\n  string b; write(b);\n}\nstring c; write(c);");
		Assertions.assertEquals(3, diagnostics.size());
		Assertions.assertEquals("a", diagnostics.get(0).getVariable());
		Assertions.assertEquals("b", diagnostics.get(1).getVariable());
		Assertions.assertEquals("c", diagnostics.get(2).getVariable());
	}

	@Test
	void testDeepNestingDoesNotOverflow() {
		int depth = 3000;
		StringBuilder code = new StringBuilder();
		for (int i = 0; i < depth; i++) {
			code.append("lambda() {\n");
		}
		code.append("string s; write(s);\n");
		for (int i = 0; i < depth; i++) {
			code.append("};\n");
		}
		assertSingle(analyze(code.toString()), "s", VariableState.UNINITIALIZED);
	}

	// ------------------------------------------------------------------
	// Degradation
	// ------------------------------------------------------------------

	@Test
	void testTokenizationFailureYieldsNoDiagnostics() {
		Assertions.assertTrue(analyze("string s; write(s); string t = \"unterminated;").isEmpty());
	}

	@Test
	void testAnalyzeSourceReportsTokenizationFailure() {
		Assertions.assertThrows(TokenizationException.class,
				() -> analyzer.analyzeSource("/* open", FILE));
	}

	@Test
	void testUnbalancedInputStillAnalyzed() {
		assertSingle(analyze("void f() { string s; write(s);"), "s", VariableState.UNINITIALIZED);
		assertSingle(analyze("} string s; write(s); }"), "s", VariableState.UNINITIALIZED);
	}

	@Test
	void testEmptyInput() {
		Assertions.assertTrue(analyze("").isEmpty());
	}
}
