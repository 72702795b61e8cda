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
import org.junit.jupiter.api.Test;

import com.tomaszrup.pikels.parser.PikeTokenizer;
import com.tomaszrup.pikels.parser.Token;
import com.tomaszrup.pikels.parser.TokenizationException;

class DefinitionBoundaryDetectorTests {

	private static List<Token> tokenize(String source) throws TokenizationException {
		return new PikeTokenizer().tokenize(source);
	}

	@Test
	void testFunctionDefinition() throws Exception {
		List<Token> tokens = tokenize("int add(int a, int b) { return a + b; }");
		Assertions.assertTrue(DefinitionBoundaryDetector.isFunctionDefinitionAt(tokens, 0, tokens.size()));
		DefinitionBoundary boundary = DefinitionBoundaryDetector.findFunctionDefinition(tokens, 0, tokens.size());
		Assertions.assertEquals(DefinitionBoundary.Kind.FUNCTION, boundary.getKind());
		Assertions.assertEquals("add", boundary.getName());
		Assertions.assertEquals("(", tokens.get(boundary.getParamsOpen()).getText());
		Assertions.assertEquals(")", tokens.get(boundary.getParamsClose()).getText());
		Assertions.assertEquals("{", tokens.get(boundary.getBodyOpen()).getText());
		Assertions.assertEquals(tokens.size() - 1, boundary.getBodyClose());
		Assertions.assertTrue(boundary.hasBalancedBody());
	}

	@Test
	void testFunctionWithModifiersAndParameterizedReturnType() throws Exception {
		List<Token> tokens = tokenize("protected static array(string) names() { return ({}); }");
		DefinitionBoundary boundary = DefinitionBoundaryDetector.findFunctionDefinition(tokens, 0, tokens.size());
		Assertions.assertNotNull(boundary);
		Assertions.assertEquals("names", boundary.getName());
	}

	@Test
	void testFunctionWithClassReturnType() throws Exception {
		List<Token> tokens = tokenize("Stdio.File open_it(string path) { return Stdio.File(path); }");
		DefinitionBoundary boundary = DefinitionBoundaryDetector.findFunctionDefinition(tokens, 0, tokens.size());
		Assertions.assertNotNull(boundary);
		Assertions.assertEquals("open_it", boundary.getName());
		List<VariableRecord> parameters = DefinitionBoundaryDetector.extractParameterBindings(tokens,
				boundary.getParamsOpen(), boundary.getParamsClose(), 1);
		Assertions.assertEquals(1, parameters.size());
		Assertions.assertEquals("path", parameters.get(0).getName());

		List<Token> plain = tokenize("Foo make(string name) { }");
		Assertions.assertEquals("make",
				DefinitionBoundaryDetector.findFunctionDefinition(plain, 0, plain.size()).getName());
	}

	@Test
	void testStatementsAreNotDefinitions() throws Exception {
		List<Token> elseIf = tokenize("else if (x) { }");
		Assertions.assertFalse(DefinitionBoundaryDetector.isFunctionDefinitionAt(elseIf, 0, elseIf.size()));
		List<Token> call = tokenize("Stdio.File(path);");
		Assertions.assertFalse(DefinitionBoundaryDetector.isFunctionDefinitionAt(call, 0, call.size()));
		List<Token> local = tokenize("Foo foo;");
		Assertions.assertFalse(DefinitionBoundaryDetector.isFunctionDefinitionAt(local, 0, local.size()));
	}

	@Test
	void testPrototypeIsNotDefinition() throws Exception {
		List<Token> tokens = tokenize("int add(int a, int b);");
		Assertions.assertFalse(DefinitionBoundaryDetector.isFunctionDefinitionAt(tokens, 0, tokens.size()));
	}

	@Test
	void testVariableDeclarationIsNotDefinition() throws Exception {
		List<Token> tokens = tokenize("string s = name();");
		Assertions.assertFalse(DefinitionBoundaryDetector.isFunctionDefinitionAt(tokens, 0, tokens.size()));
	}

	@Test
	void testUnbalancedBodyIsReported() throws Exception {
		List<Token> tokens = tokenize("void run() { if (x) {");
		DefinitionBoundary boundary = DefinitionBoundaryDetector.findFunctionDefinition(tokens, 0, tokens.size());
		Assertions.assertNotNull(boundary);
		Assertions.assertFalse(boundary.hasBalancedBody());
	}

	@Test
	void testLambdaDefinition() throws Exception {
		List<Token> tokens = tokenize("lambda(string s) { write(s); }");
		Assertions.assertTrue(DefinitionBoundaryDetector.isLambdaDefinitionAt(tokens, 0, tokens.size()));
		DefinitionBoundary boundary = DefinitionBoundaryDetector.findLambdaDefinition(tokens, 0, tokens.size());
		Assertions.assertEquals(DefinitionBoundary.Kind.LAMBDA, boundary.getKind());
	}

	@Test
	void testLambdaWithoutParametersIsRejected() throws Exception {
		List<Token> tokens = tokenize("lambda { }");
		Assertions.assertFalse(DefinitionBoundaryDetector.isLambdaDefinitionAt(tokens, 0, tokens.size()));
	}

	@Test
	void testClassDefinitionWithParameters() throws Exception {
		List<Token> tokens = tokenize("class Point(int x, int y) { }");
		DefinitionBoundary boundary = DefinitionBoundaryDetector.findClassDefinition(tokens, 0, tokens.size());
		Assertions.assertEquals(DefinitionBoundary.Kind.CLASS, boundary.getKind());
		Assertions.assertEquals("Point", boundary.getName());
		List<VariableRecord> bindings = DefinitionBoundaryDetector.extractParameterBindings(tokens,
				boundary.getParamsOpen(), boundary.getParamsClose(), 1);
		Assertions.assertEquals(2, bindings.size());
	}

	@Test
	void testClassDefinitionWithoutParameters() throws Exception {
		List<Token> tokens = tokenize("class Empty { }");
		DefinitionBoundary boundary = DefinitionBoundaryDetector.findClassDefinition(tokens, 0, tokens.size());
		Assertions.assertEquals(TokenNavigator.NOT_FOUND, boundary.getParamsOpen());
		Assertions.assertTrue(DefinitionBoundaryDetector.extractParameterBindings(tokens,
				boundary.getParamsOpen(), boundary.getParamsClose(), 1).isEmpty());
	}

	@Test
	void testExtractParameterBindings() throws Exception {
		List<Token> tokens = tokenize("void f(mapping(string:int) m, string|int key, string ... rest) { }");
		DefinitionBoundary boundary = DefinitionBoundaryDetector.findFunctionDefinition(tokens, 0, tokens.size());
		List<VariableRecord> bindings = DefinitionBoundaryDetector.extractParameterBindings(tokens,
				boundary.getParamsOpen(), boundary.getParamsClose(), 1);

		Assertions.assertEquals(3, bindings.size());
		Assertions.assertEquals("m", bindings.get(0).getName());
		Assertions.assertEquals("mapping(string:int)", bindings.get(0).getDeclaredType());
		Assertions.assertEquals("key", bindings.get(1).getName());
		Assertions.assertEquals("rest", bindings.get(2).getName());
		for (VariableRecord binding : bindings) {
			Assertions.assertEquals(VariableState.INITIALIZED, binding.getState());
			Assertions.assertFalse(binding.needsInitCheck());
			Assertions.assertEquals(1, binding.getScopeDepth());
		}
	}
}
