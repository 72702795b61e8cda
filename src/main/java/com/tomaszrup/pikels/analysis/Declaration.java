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

/**
 * Result of {@link DeclarationRecognizer#tryParseDeclaration}.
 */
public final class Declaration {

	/** Returned when the token window does not start a declaration. */
	public static final Declaration NONE = new Declaration(false, null, null, false, -1, -1);

	private final boolean declaration;
	private final String name;
	private final String type;
	private final boolean hasInitializer;
	private final int nameIndex;
	private final int endIndex;

	private Declaration(boolean declaration, String name, String type, boolean hasInitializer,
			int nameIndex, int endIndex) {
		this.declaration = declaration;
		this.name = name;
		this.type = type;
		this.hasInitializer = hasInitializer;
		this.nameIndex = nameIndex;
		this.endIndex = endIndex;
	}

	static Declaration of(String name, String type, boolean hasInitializer, int nameIndex) {
		return new Declaration(true, name, type, hasInitializer, nameIndex, nameIndex + 1);
	}

	public boolean isDeclaration() {
		return declaration;
	}

	public String getName() {
		return name;
	}

	public String getType() {
		return type;
	}

	public boolean hasInitializer() {
		return hasInitializer;
	}

	/** Index of the token holding the declared name. */
	public int getNameIndex() {
		return nameIndex;
	}

	/**
	 * Index just past the declared name. The initializer expression, if any,
	 * starts at the first meaningful token from here.
	 */
	public int getEndIndex() {
		return endIndex;
	}

	@Override
	public String toString() {
		if (!declaration) {
			return "Declaration[none]";
		}
		return "Declaration[" + type + " " + name + (hasInitializer ? " = ..." : "") + "]";
	}
}
