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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Snapshots and restores variable states around conditional branches.
 */
public final class BranchStateManager {

	private BranchStateManager() {
	}

	/**
	 * @return an unmodifiable copy of the state of every visible record
	 */
	public static Map<String, VariableState> snapshot(ScopeTable table) {
		Map<String, VariableState> states = new LinkedHashMap<>();
		for (VariableRecord record : table.visibleRecords()) {
			states.put(record.getName(), record.getState());
		}
		return Collections.unmodifiableMap(states);
	}

	/**
	 * Overwrites the state of each record named in the snapshot. Records the
	 * snapshot does not mention (declared after it was taken) are left alone,
	 * as are snapshot names that are no longer in scope.
	 */
	public static void restore(ScopeTable table, Map<String, VariableState> snapshot) {
		for (Map.Entry<String, VariableState> entry : snapshot.entrySet()) {
			VariableRecord record = table.lookup(entry.getKey());
			if (record != null) {
				record.setState(entry.getValue());
			}
		}
	}

	/**
	 * Sets every record named in {@code other} to the join of its current
	 * state and the state recorded in {@code other}.
	 */
	public static void joinInto(ScopeTable table, Map<String, VariableState> other) {
		for (Map.Entry<String, VariableState> entry : other.entrySet()) {
			VariableRecord record = table.lookup(entry.getKey());
			if (record != null) {
				record.setState(record.getState().join(entry.getValue()));
			}
		}
	}
}
