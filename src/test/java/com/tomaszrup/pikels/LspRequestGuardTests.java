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
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.pikels;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class LspRequestGuardTests {

	private final LspRequestGuard guard = new LspRequestGuard();

	@Test
	void testSuccessfulRequestPassesThrough() throws Exception {
		String value = guard.failSoftRequest("test/request", "target",
				() -> CompletableFuture.completedFuture("ok"), "fallback").get(5, TimeUnit.SECONDS);
		Assertions.assertEquals("ok", value);
	}

	@Test
	void testSynchronousFailureReturnsFallback() throws Exception {
		String value = guard.<String>failSoftRequest("test/request", "target", () -> {
			throw new IllegalStateException("boom");
		}, "fallback").get(5, TimeUnit.SECONDS);
		Assertions.assertEquals("fallback", value);
	}

	@Test
	void testAsynchronousFailureReturnsFallback() throws Exception {
		CompletableFuture<String> failing = new CompletableFuture<>();
		failing.completeExceptionally(new CompletionException(new IllegalArgumentException("bad")));
		String value = guard.failSoftRequest("test/request", "target", () -> failing, "fallback")
				.get(5, TimeUnit.SECONDS);
		Assertions.assertEquals("fallback", value);
	}

	@Test
	void testNullFutureReturnsFallback() throws Exception {
		String value = guard.<String>failSoftRequest("test/request", "target", () -> null, "fallback")
				.get(5, TimeUnit.SECONDS);
		Assertions.assertEquals("fallback", value);
	}

	@Test
	void testSummarizeThrowable() {
		Assertions.assertEquals("<null>", LspRequestGuard.summarizeThrowable(null));
		Assertions.assertEquals("java.lang.IllegalStateException",
				LspRequestGuard.summarizeThrowable(new IllegalStateException()));
		Assertions.assertEquals("java.lang.IllegalStateException: boom",
				LspRequestGuard.summarizeThrowable(new IllegalStateException("boom")));
	}

	@Test
	void testUnwrapRequestThrowable() {
		IllegalStateException root = new IllegalStateException("root");
		Assertions.assertSame(root, LspRequestGuard.unwrapRequestThrowable(new CompletionException(root)));
		Assertions.assertSame(root, LspRequestGuard.unwrapRequestThrowable(root));
	}
}
