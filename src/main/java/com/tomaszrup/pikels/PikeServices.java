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

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.eclipse.lsp4j.DidChangeConfigurationParams;
import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidChangeWatchedFilesParams;
import org.eclipse.lsp4j.DidCloseTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.DidSaveTextDocumentParams;
import org.eclipse.lsp4j.PublishDiagnosticsParams;
import org.eclipse.lsp4j.services.LanguageClient;
import org.eclipse.lsp4j.services.LanguageClientAware;
import org.eclipse.lsp4j.services.TextDocumentService;
import org.eclipse.lsp4j.services.WorkspaceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.pikels.analysis.UninitializedVariableAnalyzer;
import com.tomaszrup.pikels.analysis.UninitializedVariableDiagnostic;
import com.tomaszrup.pikels.config.AnalyzerSettings;
import com.tomaszrup.pikels.config.BranchMergeMode;
import com.tomaszrup.pikels.diagnostics.DiagnosticHandler;
import com.tomaszrup.pikels.parser.PikeTokenizer;
import com.tomaszrup.pikels.parser.TokenizationException;
import com.tomaszrup.pikels.parser.Tokenizer;
import com.tomaszrup.pikels.util.FileContentsTracker;
import com.tomaszrup.pikels.util.MdcDocumentContext;

/**
 * Thin facade implementing the LSP {@link TextDocumentService},
 * {@link WorkspaceService}, and {@link LanguageClientAware} interfaces.
 * Every open document is revalidated when it is opened, changed (debounced)
 * or saved, and its uninitialized-variable diagnostics are published to the
 * client.
 */
public class PikeServices implements TextDocumentService, WorkspaceService, LanguageClientAware {
	private static final Logger logger = LoggerFactory.getLogger(PikeServices.class);

	private final FileContentsTracker fileContentsTracker = new FileContentsTracker();
	private final DiagnosticHandler diagnosticHandler = new DiagnosticHandler();
	private final Map<BranchMergeMode, UninitializedVariableAnalyzer> analyzers = new EnumMap<>(BranchMergeMode.class);
	private final AtomicReference<LanguageClient> languageClient = new AtomicReference<>();

	// --- Shared executor pools (owned by PikeLanguageServer) ---

	private final ScheduledExecutorService schedulingPool;
	private final ExecutorService analysisPool;

	/**
	 * Pending debounced validation per document. A newer change replaces and
	 * cancels the previous future.
	 */
	private final ConcurrentHashMap<URI, ScheduledFuture<?>> pendingValidations = new ConcurrentHashMap<>();

	private final LspRequestGuard requestGuard = new LspRequestGuard();
	private final ConfigurationChangeHandler configChangeHandler;

	public PikeServices(ExecutorPools executorPools) {
		this(executorPools, new PikeTokenizer());
	}

	PikeServices(ExecutorPools executorPools, Tokenizer tokenizer) {
		this.schedulingPool = executorPools.getSchedulingPool();
		this.analysisPool = executorPools.getAnalysisPool();
		for (BranchMergeMode mode : BranchMergeMode.values()) {
			analyzers.put(mode, new UninitializedVariableAnalyzer(tokenizer, mode));
		}
		this.configChangeHandler = new ConfigurationChangeHandler(AnalyzerSettings.defaults());
		this.configChangeHandler.setSettingsChangeListener((previous, updated) -> {
			if (!previous.equals(updated)) {
				logger.info("Analyzer settings changed: {}", updated);
			}
			revalidateOpenDocuments();
		});
	}

	// --- Lifecycle / wiring ---

	@Override
	public void connect(LanguageClient client) {
		this.languageClient.set(client);
	}

	public AnalyzerSettings getSettings() {
		return configChangeHandler.getSettings();
	}

	/** Settings from {@code initializationOptions}; nothing is revalidated. */
	public void setSettings(AnalyzerSettings settings) {
		configChangeHandler.setSettings(settings);
	}

	FileContentsTracker getFileContentsTracker() {
		return fileContentsTracker;
	}

	public void shutdown() {
		// Pool shutdown is handled centrally by ExecutorPools.shutdownAll()
		for (ScheduledFuture<?> pending : pendingValidations.values()) {
			pending.cancel(false);
		}
		pendingValidations.clear();
	}

	// --- TextDocumentService notifications ---

	@Override
	public void didOpen(DidOpenTextDocumentParams params) {
		fileContentsTracker.didOpen(params);
		URI uri = URI.create(params.getTextDocument().getUri());
		MdcDocumentContext.setDocument(uri);
		try {
			validateSafely("didOpen", uri);
		} finally {
			MdcDocumentContext.clear();
		}
	}

	@Override
	public void didChange(DidChangeTextDocumentParams params) {
		URI uri = null;
		try {
			fileContentsTracker.didChange(params);
			uri = URI.create(params.getTextDocument().getUri());
			MdcDocumentContext.setDocument(uri);
			if (logger.isDebugEnabled()) {
				logger.debug("didChange version={} changeCount={}", params.getTextDocument().getVersion(),
						params.getContentChanges() != null ? params.getContentChanges().size() : 0);
			}
			scheduleValidation(uri);
		} catch (Exception e) {
			logger.warn("Unexpected exception during didChange for {}: {}", uri, e.getMessage());
			logger.debug("didChange exception details", e);
		} finally {
			MdcDocumentContext.clear();
		}
	}

	private void scheduleValidation(URI uri) {
		long delay = configChangeHandler.getSettings().getDiagnosticDelayMillis();
		ScheduledFuture<?> newFuture = schedulingPool.schedule(
				() -> analysisPool.execute(() -> validateSafely("didChange", uri)),
				delay,
				TimeUnit.MILLISECONDS);
		ScheduledFuture<?> prev = pendingValidations.put(uri, newFuture);
		if (prev != null) {
			prev.cancel(false);
		}
	}

	@Override
	public void didClose(DidCloseTextDocumentParams params) {
		fileContentsTracker.didClose(params);
		URI uri = URI.create(params.getTextDocument().getUri());
		ScheduledFuture<?> pending = pendingValidations.remove(uri);
		if (pending != null) {
			pending.cancel(false);
		}
		LanguageClient client = languageClient.get();
		if (client != null) {
			client.publishDiagnostics(diagnosticHandler.emptyParams(uri));
		}
	}

	@Override
	public void didSave(DidSaveTextDocumentParams params) {
		URI uri = URI.create(params.getTextDocument().getUri());
		if (params.getText() != null && fileContentsTracker.isOpen(uri)) {
			fileContentsTracker.setContents(uri, params.getText());
		}
		MdcDocumentContext.setDocument(uri);
		try {
			validateSafely("didSave", uri);
		} finally {
			MdcDocumentContext.clear();
		}
	}

	// --- WorkspaceService notifications ---

	@Override
	public void didChangeWatchedFiles(DidChangeWatchedFilesParams params) {
		// only open documents are analyzed; files on disk are not watched
	}

	@Override
	public void didChangeConfiguration(DidChangeConfigurationParams params) {
		try {
			configChangeHandler.handleConfigurationChange(params.getSettings());
		} catch (Exception e) {
			logger.warn("Failed to apply configuration change: {}", e.getMessage());
			logger.debug("didChangeConfiguration exception details", e);
		}
	}

	private void revalidateOpenDocuments() {
		for (URI uri : fileContentsTracker.getOpenURIs()) {
			MdcDocumentContext.setDocument(uri);
			try {
				analysisPool.execute(() -> validateSafely("configuration", uri));
			} finally {
				MdcDocumentContext.clear();
			}
		}
	}

	// --- Validation ---

	private void validateSafely(String trigger, URI uri) {
		try {
			validateDocument(uri);
		} catch (LinkageError e) {
			logger.warn("Linkage error during {} for {}: {}", trigger, uri, e.toString());
			logger.debug("{} LinkageError details", trigger, e);
		} catch (VirtualMachineError e) {
			logger.error("VirtualMachineError during {} for {}: {}", trigger, uri, e.toString());
			// Swallow to keep the LSP connection alive
		} catch (Exception e) {
			logger.warn("Unexpected exception during {} for {}: {}", trigger, uri, e.getMessage());
			logger.debug("{} exception details", trigger, e);
		}
	}

	/**
	 * Analyzes the current contents of {@code uri} and publishes the result.
	 * Nothing is published if the document was closed or edited while the
	 * analysis ran; the newer edit has its own validation.
	 */
	void validateDocument(URI uri) {
		LanguageClient client = languageClient.get();
		String text = fileContentsTracker.getContents(uri);
		if (client == null || text == null) {
			return;
		}
		AnalyzerSettings settings = configChangeHandler.getSettings();
		if (!settings.isEnabled()) {
			client.publishDiagnostics(diagnosticHandler.emptyParams(uri));
			return;
		}
		long size = text.getBytes(StandardCharsets.UTF_8).length;
		if (size > settings.getMaxFileSizeBytes()) {
			logger.debug("Skipping analysis, {} bytes exceeds the limit of {}", size, settings.getMaxFileSizeBytes());
			client.publishDiagnostics(diagnosticHandler.emptyParams(uri));
			return;
		}

		Integer version = fileContentsTracker.getVersion(uri);
		List<UninitializedVariableDiagnostic> found;
		TokenizationException failure = null;
		try {
			found = analyzers.get(settings.getBranchMergeMode()).analyzeSource(text, uri.toString());
		} catch (TokenizationException e) {
			logger.debug("Tokenization failed at {}:{}: {}", e.getLine(), e.getColumn(), e.getMessage());
			found = Collections.emptyList();
			failure = e;
		}

		if (!fileContentsTracker.isOpen(uri)) {
			// closed while the analysis ran
			return;
		}
		if (!Objects.equals(version, fileContentsTracker.getVersion(uri))
				|| !text.equals(fileContentsTracker.getContents(uri))) {
			logger.debug("Dropping stale diagnostics for version {}, document is now at version {}", version,
					fileContentsTracker.getVersion(uri));
			return;
		}
		PublishDiagnosticsParams publish = diagnosticHandler.buildPublishParams(uri, version, text, found, failure,
				settings.getMaxNumberOfProblems());
		client.publishDiagnostics(publish);
	}

	// --- Custom requests ---

	/**
	 * Analyzes source text that need not belong to an open document. A
	 * request without code, or with code that cannot be tokenized, yields an
	 * empty result.
	 */
	public CompletableFuture<AnalyzeUninitializedResult> analyzeUninitialized(AnalyzeUninitializedParams params) {
		String filename = params == null || params.getFilename() == null || params.getFilename().isEmpty()
				? Protocol.DEFAULT_FILENAME
				: params.getFilename();
		return requestGuard.failSoftRequest(Protocol.REQUEST_ANALYZE_UNINITIALIZED, filename, () -> {
			if (params == null || params.getCode() == null) {
				logger.debug("{} without code", Protocol.REQUEST_ANALYZE_UNINITIALIZED);
				return CompletableFuture.completedFuture(AnalyzeUninitializedResult.empty());
			}
			UninitializedVariableAnalyzer analyzer = analyzers.get(configChangeHandler.getSettings().getBranchMergeMode());
			MdcDocumentContext.setDocument(filename);
			try {
				return CompletableFuture.supplyAsync(
						() -> new AnalyzeUninitializedResult(analyzer.analyze(params.getCode(), filename)),
						analysisPool);
			} finally {
				MdcDocumentContext.clear();
			}
		}, AnalyzeUninitializedResult.empty());
	}
}
