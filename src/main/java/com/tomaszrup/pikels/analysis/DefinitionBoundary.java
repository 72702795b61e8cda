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
 * Token indices of a function, lambda or class definition. Parameter
 * indices are {@link TokenNavigator#NOT_FOUND} for a class without
 * parameters.
 */
public final class DefinitionBoundary {

	public enum Kind {
		FUNCTION, LAMBDA, CLASS
	}

	private final Kind kind;
	private final String name;
	private final int paramsOpen;
	private final int paramsClose;
	private final int bodyOpen;
	private final int bodyClose;

	DefinitionBoundary(Kind kind, String name, int paramsOpen, int paramsClose, int bodyOpen, int bodyClose) {
		this.kind = kind;
		this.name = name;
		this.paramsOpen = paramsOpen;
		this.paramsClose = paramsClose;
		this.bodyOpen = bodyOpen;
		this.bodyClose = bodyClose;
	}

	public Kind getKind() {
		return kind;
	}

	public String getName() {
		return name;
	}

	public int getParamsOpen() {
		return paramsOpen;
	}

	public int getParamsClose() {
		return paramsClose;
	}

	public int getBodyOpen() {
		return bodyOpen;
	}

	public int getBodyClose() {
		return bodyClose;
	}

	public boolean hasBalancedBody() {
		return bodyClose != TokenNavigator.NOT_FOUND;
	}

	@Override
	public String toString() {
		return "DefinitionBoundary[" + kind + " " + name + " body=" + bodyOpen + ".." + bodyClose + "]";
	}
}
