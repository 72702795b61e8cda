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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Live variable table of one activation (the file, a class body, or a
 * function/lambda body).
 *
 * <p>A name declared again in a nested block shadows the outer record until
 * that block closes; lookups always see the innermost record.</p>
 */
public class ScopeTable {

	private final Map<String, Deque<VariableRecord>> records = new LinkedHashMap<>();

	public ScopeTable() {
	}

	/**
	 * Creates a table pre-populated with the given bindings.
	 */
	public ScopeTable(Collection<VariableRecord> seed) {
		for (VariableRecord record : seed) {
			declare(record);
		}
	}

	public void declare(VariableRecord record) {
		records.computeIfAbsent(record.getName(), key -> new ArrayDeque<>()).push(record);
	}

	/**
	 * @return the innermost record for {@code name}, or {@code null} if the
	 *         name is not tracked
	 */
	public VariableRecord lookup(String name) {
		Deque<VariableRecord> stack = records.get(name);
		return stack != null ? stack.peek() : null;
	}

	public boolean contains(String name) {
		return lookup(name) != null;
	}

	/**
	 * Sets the innermost record for {@code name} to
	 * {@link VariableState#INITIALIZED}. Unknown names are ignored.
	 */
	public void markInitialized(String name) {
		VariableRecord record = lookup(name);
		if (record != null) {
			record.setState(VariableState.INITIALIZED);
		}
	}

	/**
	 * Drops every record declared at {@code scopeDepth} or in a block nested
	 * below it. Called when the block at that depth closes.
	 *
	 * @return the number of records removed
	 */
	public int removeAtOrBelow(int scopeDepth) {
		int removed = 0;
		Iterator<Map.Entry<String, Deque<VariableRecord>>> it = records.entrySet().iterator();
		while (it.hasNext()) {
			Deque<VariableRecord> stack = it.next().getValue();
			while (!stack.isEmpty() && stack.peek().getScopeDepth() >= scopeDepth) {
				stack.pop();
				removed++;
			}
			if (stack.isEmpty()) {
				it.remove();
			}
		}
		return removed;
	}

	/** The innermost record of every tracked name, in declaration order. */
	public List<VariableRecord> visibleRecords() {
		List<VariableRecord> visible = new ArrayList<>(records.size());
		for (Deque<VariableRecord> stack : records.values()) {
			visible.add(stack.peek());
		}
		return visible;
	}

	public int size() {
		return records.size();
	}

	public boolean isEmpty() {
		return records.isEmpty();
	}
}
