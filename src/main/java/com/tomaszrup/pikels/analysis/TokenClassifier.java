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

import java.util.Set;

/**
 * Pure predicates over token text.
 */
public final class TokenClassifier {

	private static final Set<String> TYPE_KEYWORDS = Set.of(
			"void", "int", "float", "string", "array", "mapping", "multiset",
			"object", "function", "program", "mixed", "auto", "zero");

	/** Types whose zero value is unsafe to read. */
	private static final Set<String> NEEDS_INIT_TYPES = Set.of(
			"string", "array", "mapping", "multiset", "object", "function", "mixed");

	private static final Set<String> ASSIGNMENT_OPERATORS = Set.of(
			"=", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "<<=", ">>=", "||=", "&&=");

	private static final Set<String> MODIFIERS = Set.of(
			"public", "private", "protected", "static", "final", "inline",
			"local", "optional", "variant");

	private static final Set<String> RESERVED_WORDS = Set.of(
			"if", "else", "for", "foreach", "while", "do", "switch", "case", "default",
			"return", "break", "continue", "throw", "catch", "gauge", "class", "lambda",
			"inherit", "import", "typedef", "constant", "enum");

	private static final Set<String> MEMBER_ACCESS_OPERATORS = Set.of(".", "->", "::");

	private TokenClassifier() {
	}

	public static boolean isTypeKeyword(String text) {
		return TYPE_KEYWORDS.contains(text);
	}

	/** First character is a letter or underscore. */
	public static boolean isIdentifier(String text) {
		if (text == null || text.isEmpty()) {
			return false;
		}
		char first = text.charAt(0);
		return Character.isLetter(first) || first == '_';
	}

	/**
	 * Statement keywords and other words that can never name a type or a
	 * function.
	 */
	public static boolean isReservedWord(String text) {
		return RESERVED_WORDS.contains(text);
	}

	/** An identifier that may name a class or program used as a type. */
	public static boolean isTypeName(String text) {
		return isIdentifier(text) && !isReservedWord(text) && !isModifier(text) && !isTypeKeyword(text);
	}

	public static boolean isAssignmentOperator(String text) {
		return ASSIGNMENT_OPERATORS.contains(text);
	}

	public static boolean isModifier(String text) {
		return MODIFIERS.contains(text);
	}

	public static boolean isMemberAccessOperator(String text) {
		return MEMBER_ACCESS_OPERATORS.contains(text);
	}

	/**
	 * Whether a variable declared with {@code declaredType} must be assigned
	 * before it is read. Parameterized spellings such as {@code array(int)}
	 * match on their base keyword. A union type needs a check only if every
	 * member does, since a primitive member accepts the zero value.
	 */
	public static boolean needsInitCheck(String declaredType) {
		if (declaredType == null || declaredType.isEmpty()) {
			return false;
		}
		int depth = 0;
		int memberStart = 0;
		for (int i = 0; i < declaredType.length(); i++) {
			char c = declaredType.charAt(i);
			if (c == '(') {
				depth++;
			} else if (c == ')') {
				depth--;
			} else if (c == '|' && depth == 0) {
				if (!isNeedsInitMember(declaredType.substring(memberStart, i))) {
					return false;
				}
				memberStart = i + 1;
			}
		}
		return isNeedsInitMember(declaredType.substring(memberStart));
	}

	private static boolean isNeedsInitMember(String member) {
		String trimmed = member.trim();
		int paren = trimmed.indexOf('(');
		String base = paren >= 0 ? trimmed.substring(0, paren).trim() : trimmed;
		return NEEDS_INIT_TYPES.contains(base);
	}
}
