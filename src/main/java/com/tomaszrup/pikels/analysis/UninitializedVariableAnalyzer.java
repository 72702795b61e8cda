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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.pikels.analysis.position.OrdinalOccurrencePositionResolver;
import com.tomaszrup.pikels.analysis.position.PositionResolver;
import com.tomaszrup.pikels.analysis.position.TokenColumnPositionResolver;
import com.tomaszrup.pikels.config.BranchMergeMode;
import com.tomaszrup.pikels.parser.PikeTokenizer;
import com.tomaszrup.pikels.parser.Token;
import com.tomaszrup.pikels.parser.TokenizationException;
import com.tomaszrup.pikels.parser.Tokenizer;

/**
 * Entry point of the uninitialized-variable analysis. Stateless between
 * calls and safe to share across threads; every call builds its own scope
 * tables.
 */
public class UninitializedVariableAnalyzer {

	private static final Logger logger = LoggerFactory.getLogger(UninitializedVariableAnalyzer.class);

	private final Tokenizer tokenizer;
	private final BranchMergeMode mergeMode;

	public UninitializedVariableAnalyzer() {
		this(new PikeTokenizer(), BranchMergeMode.JOIN);
	}

	public UninitializedVariableAnalyzer(Tokenizer tokenizer, BranchMergeMode mergeMode) {
		this.tokenizer = tokenizer;
		this.mergeMode = mergeMode;
	}

	public BranchMergeMode getMergeMode() {
		return mergeMode;
	}

	/**
	 * Analyzes source text. A file that cannot be tokenized yields no
	 * diagnostics; callers that want to report the tokenizer failure should
	 * use {@link #analyzeSource(String, String)}.
	 */
	public List<UninitializedVariableDiagnostic> analyze(String code, String filename) {
		try {
			return analyzeSource(code, filename);
		} catch (TokenizationException e) {
			logger.debug("Skipping analysis of {}: {}", filename, e.getMessage());
			return Collections.emptyList();
		}
	}

	/**
	 * @throws TokenizationException if the source cannot be tokenized
	 */
	public List<UninitializedVariableDiagnostic> analyzeSource(String code, String filename)
			throws TokenizationException {
		List<Token> tokens = tokenizer.tokenize(code);
		return analyze(tokens, Arrays.asList(code.split("\n", -1)), filename);
	}

	/**
	 * Analyzes an already tokenized file.
	 *
	 * @param lines the source split on {@code '\n'}, used to recover columns
	 *              for tokens that carry none
	 */
	public List<UninitializedVariableDiagnostic> analyze(List<Token> tokens, List<String> lines, String filename) {
		long start = System.nanoTime();
		PositionResolver positions = new TokenColumnPositionResolver(tokens,
				new OrdinalOccurrencePositionResolver(tokens, lines));
		FlowScanner scanner = new FlowScanner(tokens, positions, filename, mergeMode);
		List<UninitializedVariableDiagnostic> diagnostics = scanner.scan();
		if (logger.isDebugEnabled()) {
			logger.debug("Analyzed {} ({} tokens, {} activations) in {} ms: {} diagnostic(s)",
					filename, tokens.size(), scanner.getActivationCount(),
					(System.nanoTime() - start) / 1_000_000, diagnostics.size());
		}
		return diagnostics;
	}
}
