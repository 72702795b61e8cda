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
 * A variable tracked by the flow scanner. Owned by the {@link ScopeTable} of
 * the activation that declared it; only {@link #getState() state} and the
 * init-check flag change after declaration.
 */
public class VariableRecord {

	private final String name;
	private final String declaredType;
	private final int declarationLine;
	private final int declarationColumn;
	private final int scopeDepth;
	private VariableState state;
	private boolean needsInitCheck;

	public VariableRecord(String name, String declaredType, VariableState state,
			int declarationLine, int declarationColumn, int scopeDepth, boolean needsInitCheck) {
		this.name = name;
		this.declaredType = declaredType;
		this.state = state;
		this.declarationLine = declarationLine;
		this.declarationColumn = declarationColumn;
		this.scopeDepth = scopeDepth;
		this.needsInitCheck = needsInitCheck;
	}

	/**
	 * Creates a binding that is always initialized and never checked, as used
	 * for parameters and loop variables.
	 */
	public static VariableRecord binding(String name, String declaredType, int declarationLine,
			int declarationColumn, int scopeDepth) {
		return new VariableRecord(name, declaredType, VariableState.INITIALIZED,
				declarationLine, declarationColumn, scopeDepth, false);
	}

	public String getName() {
		return name;
	}

	public String getDeclaredType() {
		return declaredType;
	}

	public VariableState getState() {
		return state;
	}

	public void setState(VariableState state) {
		this.state = state;
	}

	public int getDeclarationLine() {
		return declarationLine;
	}

	public int getDeclarationColumn() {
		return declarationColumn;
	}

	public int getScopeDepth() {
		return scopeDepth;
	}

	public boolean needsInitCheck() {
		return needsInitCheck;
	}

	public void setNeedsInitCheck(boolean needsInitCheck) {
		this.needsInitCheck = needsInitCheck;
	}

	@Override
	public String toString() {
		return declaredType + " " + name + " [" + state + ", depth=" + scopeDepth
				+ (needsInitCheck ? ", checked" : "") + "]";
	}
}
