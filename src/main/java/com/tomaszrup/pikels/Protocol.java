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
package com.tomaszrup.pikels;

/**
 * Shared constants for custom extension↔server protocol messages.
 */
public final class Protocol {

	private Protocol() {
	}

	/**
	 * Custom protocol contract version between the editor extension and server.
	 */
	public static final String VERSION = "1";

	public static final String REQUEST_ANALYZE_UNINITIALIZED = "pike/analyzeUninitialized";
	public static final String REQUEST_GET_PROTOCOL_VERSION = "pike/getProtocolVersion";

	/** File name used when an analysis request does not name one. */
	public static final String DEFAULT_FILENAME = "input.pike";
}
