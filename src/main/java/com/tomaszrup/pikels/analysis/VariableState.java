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
 * Initialization state of a tracked variable at the current program point.
 */
public enum VariableState {
	/** Declared without an initializer and never assigned since. */
	UNINITIALIZED("uninitialized"),
	/** Assigned on some, but not all, paths reaching this point. */
	MAYBE_INITIALIZED("maybe_init"),
	/** Assigned on every path reaching this point. */
	INITIALIZED("initialized"),
	/** A diagnostic was already emitted for this variable; stop tracking it. */
	UNKNOWN("unknown");

	private final String wireName;

	VariableState(String wireName) {
		this.wireName = wireName;
	}

	/** Name used in the JSON payload of a diagnostic. */
	public String getWireName() {
		return wireName;
	}

	/**
	 * Whether reading a needs-init variable in this state is reported.
	 */
	public boolean isRisky() {
		switch (this) {
			case UNINITIALIZED:
			case MAYBE_INITIALIZED:
				return true;
			case INITIALIZED:
			case UNKNOWN:
				return false;
			default:
				throw new IllegalStateException("Unhandled state " + this);
		}
	}

	/**
	 * Combines the states reached along two control-flow paths that meet.
	 * {@code UNKNOWN} absorbs everything so that a variable already reported
	 * stays silent.
	 */
	public VariableState join(VariableState other) {
		if (this == UNKNOWN || other == UNKNOWN) {
			return UNKNOWN;
		}
		if (this == other) {
			return this;
		}
		return MAYBE_INITIALIZED;
	}
}
