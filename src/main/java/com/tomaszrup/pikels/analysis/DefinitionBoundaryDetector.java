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
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.pikels.analysis;

import java.util.ArrayList;
import java.util.List;

import com.tomaszrup.pikels.parser.Token;

/**
 * Lookahead recognizers for the constructs that open a new variable
 * scope with its own table: function definitions, lambdas and classes.
 */
public final class DefinitionBoundaryDetector {

	private DefinitionBoundaryDetector() {
	}

	/**
	 * Matches {@code [modifiers] <type> <name> ( ... )} followed by a body
	 * block at {@code index}. The return type is a type keyword or a class
	 * name such as {@code Stdio.File}.
	 */
	public static boolean isFunctionDefinitionAt(List<Token> tokens, int index, int end) {
		return findFunctionDefinition(tokens, index, end) != null;
	}

	/**
	 * Matches {@code lambda ( ... )} followed by a body block.
	 */
	public static boolean isLambdaDefinitionAt(List<Token> tokens, int index, int end) {
		return findLambdaDefinition(tokens, index, end) != null;
	}

	/**
	 * @return the boundary of the function definition at {@code index}, or
	 *         {@code null}. The body close is {@link TokenNavigator#NOT_FOUND}
	 *         when the body is unbalanced.
	 */
	public static DefinitionBoundary findFunctionDefinition(List<Token> tokens, int index, int end) {
		int cursor = TokenNavigator.findNextMeaningful(tokens, index, end);
		while (cursor != TokenNavigator.NOT_FOUND && TokenClassifier.isModifier(tokens.get(cursor).getText())) {
			cursor = TokenNavigator.findNextMeaningful(tokens, cursor + 1, end);
		}
		if (cursor == TokenNavigator.NOT_FOUND) {
			return null;
		}
		String typeText = tokens.get(cursor).getText();
		int afterType;
		if (TokenClassifier.isTypeKeyword(typeText)) {
			afterType = DeclarationRecognizer.parseType(tokens, cursor, end, new StringBuilder());
		} else if (TokenClassifier.isTypeName(typeText)) {
			afterType = skipQualifiedName(tokens, cursor, end);
		} else {
			return null;
		}
		if (afterType == TokenNavigator.NOT_FOUND) {
			return null;
		}
		int nameIndex = TokenNavigator.findNextMeaningful(tokens, afterType, end);
		if (nameIndex == TokenNavigator.NOT_FOUND) {
			return null;
		}
		String name = tokens.get(nameIndex).getText();
		if (!TokenClassifier.isIdentifier(name) || TokenClassifier.isTypeKeyword(name)
				|| TokenClassifier.isReservedWord(name)) {
			return null;
		}
		return parametersAndBody(tokens, DefinitionBoundary.Kind.FUNCTION, name, nameIndex + 1, end, true);
	}

	/**
	 * @return the index just past a name such as {@code Foo},
	 *         {@code Stdio.File} or {@code Module::Type}
	 */
	static int skipQualifiedName(List<Token> tokens, int first, int end) {
		int cursor = first + 1;
		while (true) {
			int separator = TokenNavigator.findNextMeaningful(tokens, cursor, end);
			if (separator == TokenNavigator.NOT_FOUND) {
				return cursor;
			}
			String text = tokens.get(separator).getText();
			if (!".".equals(text) && !"::".equals(text)) {
				return cursor;
			}
			int part = TokenNavigator.findNextMeaningful(tokens, separator + 1, end);
			if (part == TokenNavigator.NOT_FOUND || !TokenClassifier.isIdentifier(tokens.get(part).getText())) {
				return TokenNavigator.NOT_FOUND;
			}
			cursor = part + 1;
		}
	}

	public static DefinitionBoundary findLambdaDefinition(List<Token> tokens, int index, int end) {
		int keyword = TokenNavigator.findNextMeaningful(tokens, index, end);
		if (keyword == TokenNavigator.NOT_FOUND || !"lambda".equals(tokens.get(keyword).getText())) {
			return null;
		}
		return parametersAndBody(tokens, DefinitionBoundary.Kind.LAMBDA, "lambda", keyword + 1, end, true);
	}

	/**
	 * Matches {@code class [Name] [( ... )]} followed by a body block. Class
	 * parameters become bindings of the class body.
	 */
	public static DefinitionBoundary findClassDefinition(List<Token> tokens, int index, int end) {
		int keyword = TokenNavigator.findNextMeaningful(tokens, index, end);
		if (keyword == TokenNavigator.NOT_FOUND || !"class".equals(tokens.get(keyword).getText())) {
			return null;
		}
		int cursor = keyword + 1;
		String name = "";
		int next = TokenNavigator.findNextMeaningful(tokens, cursor, end);
		if (next != TokenNavigator.NOT_FOUND && TokenClassifier.isIdentifier(tokens.get(next).getText())) {
			name = tokens.get(next).getText();
			cursor = next + 1;
		}
		return parametersAndBody(tokens, DefinitionBoundary.Kind.CLASS, name, cursor, end, false);
	}

	private static DefinitionBoundary parametersAndBody(List<Token> tokens, DefinitionBoundary.Kind kind,
			String name, int from, int end, boolean parametersRequired) {
		int open = TokenNavigator.findNextMeaningful(tokens, from, end);
		if (open == TokenNavigator.NOT_FOUND) {
			return null;
		}
		int paramsOpen = TokenNavigator.NOT_FOUND;
		int paramsClose = TokenNavigator.NOT_FOUND;
		int bodyOpen = open;
		if ("(".equals(tokens.get(open).getText())) {
			paramsOpen = open;
			paramsClose = TokenNavigator.findMatchingParen(tokens, open, end);
			if (paramsClose == TokenNavigator.NOT_FOUND) {
				return null;
			}
			bodyOpen = TokenNavigator.findNextMeaningful(tokens, paramsClose + 1, end);
		} else if (parametersRequired) {
			return null;
		}
		if (bodyOpen == TokenNavigator.NOT_FOUND || !"{".equals(tokens.get(bodyOpen).getText())) {
			return null;
		}
		int bodyClose = TokenNavigator.findMatchingBrace(tokens, bodyOpen, end);
		return new DefinitionBoundary(kind, name, paramsOpen, paramsClose, bodyOpen, bodyClose);
	}

	/**
	 * Splits the parameter list between {@code paramsOpen} and
	 * {@code paramsClose} at top-level commas and returns an initialized
	 * binding for every segment that parses as a declaration.
	 *
	 * @param scopeDepth depth the bindings are declared at
	 */
	public static List<VariableRecord> extractParameterBindings(List<Token> tokens, int paramsOpen,
			int paramsClose, int scopeDepth) {
		List<VariableRecord> bindings = new ArrayList<>();
		if (paramsOpen == TokenNavigator.NOT_FOUND || paramsClose == TokenNavigator.NOT_FOUND) {
			return bindings;
		}
		int nesting = 0;
		int segmentStart = paramsOpen + 1;
		for (int i = paramsOpen + 1; i <= paramsClose; i++) {
			String text = tokens.get(i).getText();
			boolean boundary = i == paramsClose || (nesting == 0 && ",".equals(text));
			if (boundary) {
				Declaration declaration = DeclarationRecognizer.tryParseDeclaration(tokens, segmentStart, i);
				if (declaration.isDeclaration()) {
					Token nameToken = tokens.get(declaration.getNameIndex());
					bindings.add(VariableRecord.binding(declaration.getName(), declaration.getType(),
							nameToken.getLine(), nameToken.getColumn(), scopeDepth));
				}
				segmentStart = i + 1;
			} else if ("(".equals(text) || "[".equals(text) || "{".equals(text)) {
				nesting++;
			} else if (")".equals(text) || "]".equals(text) || "}".equals(text)) {
				nesting--;
			}
		}
		return bindings;
	}
}
