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
package com.tomaszrup.pikels.util;

import java.net.URI;
import java.util.Map;

import org.slf4j.MDC;

/**
 * Manages the SLF4J MDC key {@code "document"} so that every log line
 * written while a document is handled carries its file name.
 *
 * <pre>{@code
 * MdcDocumentContext.setDocument(uri);
 * try {
 *     // log calls here include [Foo.pike]
 * } finally {
 *     MdcDocumentContext.clear();
 * }
 * }</pre>
 *
 * <p>Use {@link #wrap(Runnable)} to carry the context into a pool thread.</p>
 */
public final class MdcDocumentContext {

	/** MDC key used in the logback pattern via {@code %X{document}}. */
	public static final String MDC_KEY = "document";

	private MdcDocumentContext() {
	}

	/**
	 * Sets the MDC key to the last path segment of {@code uri}.
	 */
	public static void setDocument(URI uri) {
		MDC.put(MDC_KEY, label(uri));
	}

	public static void setDocument(String name) {
		MDC.put(MDC_KEY, name == null || name.isEmpty() ? "unknown" : name);
	}

	static String label(URI uri) {
		if (uri == null) {
			return "unknown";
		}
		String path = uri.getPath() != null ? uri.getPath() : uri.toString();
		int slash = path.lastIndexOf('/');
		String name = slash >= 0 ? path.substring(slash + 1) : path;
		return name.isEmpty() ? uri.toString() : name;
	}

	public static void clear() {
		MDC.remove(MDC_KEY);
	}

	/**
	 * @return the current MDC context map, or null if empty
	 */
	public static Map<String, String> snapshot() {
		return MDC.getCopyOfContextMap();
	}

	public static void restore(Map<String, String> contextMap) {
		if (contextMap != null) {
			MDC.setContextMap(contextMap);
		} else {
			MDC.clear();
		}
	}

	/**
	 * Wraps a task so that it runs with the MDC context of the calling
	 * thread. The executing thread's own context is restored afterwards.
	 */
	public static Runnable wrap(Runnable task) {
		Map<String, String> callerContext = snapshot();
		return () -> {
			Map<String, String> previousContext = snapshot();
			restore(callerContext);
			try {
				task.run();
			} finally {
				restore(previousContext);
			}
		};
	}
}
