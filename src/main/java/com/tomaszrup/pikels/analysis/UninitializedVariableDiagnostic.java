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

import java.util.Objects;

/**
 * A read of a variable that may not hold a value yet. Field names match the
 * JSON payload returned to clients.
 */
public final class UninitializedVariableDiagnostic {

	public static final String SEVERITY_WARNING = "warning";
	public static final String SOURCE = "uninitialized-variable";

	private final String message;
	private final String severity;
	private final SourcePosition position;
	private final String variable;
	private final String type;
	private final String state;
	private final String source;

	public UninitializedVariableDiagnostic(String message, SourcePosition position, String variable,
			String type, VariableState state) {
		this.message = message;
		this.severity = SEVERITY_WARNING;
		this.position = position;
		this.variable = variable;
		this.type = type;
		this.state = state.getWireName();
		this.source = SOURCE;
	}

	/**
	 * Builds the diagnostic for a read of {@code record} while it is in
	 * {@code state}, which must be risky.
	 */
	public static UninitializedVariableDiagnostic forRead(VariableRecord record, VariableState state,
			SourcePosition position) {
		return new UninitializedVariableDiagnostic(messageFor(record.getName(), state), position,
				record.getName(), record.getDeclaredType(), state);
	}

	static String messageFor(String name, VariableState state) {
		if (state == VariableState.MAYBE_INITIALIZED) {
			return "Variable '" + name + "' may be uninitialized";
		}
		return "Variable '" + name + "' is used before being initialized";
	}

	public String getMessage() {
		return message;
	}

	public String getSeverity() {
		return severity;
	}

	public SourcePosition getPosition() {
		return position;
	}

	public String getVariable() {
		return variable;
	}

	/** Declared type of the variable, e.g. {@code array(int)}. */
	public String getType() {
		return type;
	}

	/** Wire name of the state the variable was in when read. */
	public String getState() {
		return state;
	}

	public String getSource() {
		return source;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof UninitializedVariableDiagnostic)) {
			return false;
		}
		UninitializedVariableDiagnostic other = (UninitializedVariableDiagnostic) o;
		return Objects.equals(message, other.message) && Objects.equals(position, other.position)
				&& Objects.equals(variable, other.variable) && Objects.equals(type, other.type)
				&& Objects.equals(state, other.state);
	}

	@Override
	public int hashCode() {
		return Objects.hash(message, position, variable, type, state);
	}

	@Override
	public String toString() {
		return position + " " + message;
	}
}
