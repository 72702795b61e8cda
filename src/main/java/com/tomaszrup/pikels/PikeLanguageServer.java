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

import org.eclipse.lsp4j.InitializeParams;
import org.eclipse.lsp4j.InitializeResult;
import org.eclipse.lsp4j.SaveOptions;
import org.eclipse.lsp4j.ServerCapabilities;
import org.eclipse.lsp4j.ServerInfo;
import org.eclipse.lsp4j.TextDocumentSyncKind;
import org.eclipse.lsp4j.TextDocumentSyncOptions;
import org.eclipse.lsp4j.jsonrpc.Launcher;
import org.eclipse.lsp4j.jsonrpc.services.JsonRequest;
import org.eclipse.lsp4j.services.LanguageClient;
import org.eclipse.lsp4j.services.LanguageClientAware;
import org.eclipse.lsp4j.services.LanguageServer;
import org.eclipse.lsp4j.services.TextDocumentService;
import org.eclipse.lsp4j.services.WorkspaceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.pikels.config.AnalyzerSettings;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.logging.Level;

public class PikeLanguageServer implements LanguageServer, LanguageClientAware {

    private static final Logger logger = LoggerFactory.getLogger(PikeLanguageServer.class);

    static final int DEFAULT_TCP_PORT = 5007;

    public static void main(String[] args) throws IOException {
        // Install a global uncaught-exception handler so that unexpected
        // exceptions on any thread are logged instead of silently killing
        // the JVM process.
        Thread.setDefaultUncaughtExceptionHandler((thread, throwable) -> {
            System.err.println("[FATAL] Uncaught exception on thread " + thread.getName());
            throwable.printStackTrace(System.err);
            logger.error("Uncaught exception on thread {}: {}",
                    thread.getName(), throwable.getMessage(), throwable);
        });

        // Suppress "Unmatched cancel notification for request id" warnings
        // from LSP4J's RemoteEndpoint.
        java.util.logging.Logger.getLogger("org.eclipse.lsp4j.jsonrpc.RemoteEndpoint")
                .setLevel(Level.SEVERE);
        if (args.length > 0 && "--tcp".equals(args[0])) {
            int port = DEFAULT_TCP_PORT;
            if (args.length > 1) {
                try {
                    port = Integer.parseInt(args[1]);
                } catch (NumberFormatException e) {
                    logger.error("Invalid port number: {}", args[1]);
                    System.exit(1);
                }
            }

            try (ServerSocket serverSocket = new ServerSocket(port, 50, InetAddress.getLoopbackAddress())) {
                logger.info("Pike Language Server listening on port {} (localhost only)", port);
                try (Socket socket = serverSocket.accept()) {
                    logger.info("Client connected.");

                    InputStream in = socket.getInputStream();
                    OutputStream out = socket.getOutputStream();
                    startServer(in, out);
                }
            }
        } else {
            logger.info("Pike Language Server starting in stdio mode.");
            InputStream in = System.in;
            OutputStream out = System.out;
            startServer(in, out);
        }
    }

    private static void startServer(InputStream in, OutputStream out) {
        // Redirect System.out to System.err to avoid corrupting the communication channel
        System.setOut(new PrintStream(System.err));

        PikeLanguageServer server = new PikeLanguageServer();
        Launcher<LanguageClient> launcher = Launcher.createLauncher(server, LanguageClient.class, in, out);
        server.connect(launcher.getRemoteProxy());

        // Block the main (non-daemon) thread on the listener future; all
        // pool threads are daemons.
        Future<Void> future = launcher.startListening();
        try {
            future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Language server listener interrupted");
        } catch (ExecutionException e) {
            logger.error("Language server listener terminated with error: {}",
                    e.getCause() != null ? e.getCause().getMessage() : e.getMessage(), e);
        }
    }

    /** Shared executor pools for all server components. */
    private final ExecutorPools executorPools;
    private final PikeServices pikeServices;
    private final LspRequestGuard requestGuard = new LspRequestGuard();

    public PikeLanguageServer() {
        this(new ExecutorPools());
    }

    PikeLanguageServer(ExecutorPools executorPools) {
        this.executorPools = executorPools;
        this.pikeServices = new PikeServices(executorPools);
    }

    @Override
    public CompletableFuture<InitializeResult> initialize(InitializeParams params) {
        AnalyzerSettings settings = InitializationOptionsParser.parse(
                params.getInitializationOptions(), pikeServices.getSettings());
        pikeServices.setSettings(settings);
        logger.info("Initialized with {}", settings);

        TextDocumentSyncOptions syncOptions = new TextDocumentSyncOptions();
        syncOptions.setOpenClose(true);
        syncOptions.setChange(TextDocumentSyncKind.Incremental);
        syncOptions.setSave(new SaveOptions(false));

        ServerCapabilities serverCapabilities = new ServerCapabilities();
        serverCapabilities.setTextDocumentSync(syncOptions);

        InitializeResult initializeResult = new InitializeResult(serverCapabilities);
        initializeResult.setServerInfo(new ServerInfo("pike-language-server", Protocol.VERSION));
        return CompletableFuture.completedFuture(initializeResult);
    }

    @Override
    public CompletableFuture<Object> shutdown() {
        pikeServices.shutdown();
        executorPools.shutdownAll();
        return CompletableFuture.completedFuture(new Object());
    }

    @Override
    public void exit() {
        System.exit(0);
    }

    /**
     * Custom LSP request: analyze a piece of source for uninitialized
     * variable uses without opening it as a document.
     *
     * @param params {@code code} and an optional {@code filename}
     * @return the diagnostics, empty when the request fails
     */
    @JsonRequest(Protocol.REQUEST_ANALYZE_UNINITIALIZED)
    public CompletableFuture<AnalyzeUninitializedResult> analyzeUninitialized(AnalyzeUninitializedParams params) {
        return pikeServices.analyzeUninitialized(params);
    }

    /**
     * Custom LSP request: the version of the custom protocol spoken by this
     * server, so the extension can detect a mismatch.
     */
    @JsonRequest(Protocol.REQUEST_GET_PROTOCOL_VERSION)
    public CompletableFuture<String> getProtocolVersion() {
        return requestGuard.failSoftRequest(Protocol.REQUEST_GET_PROTOCOL_VERSION, "server",
                () -> CompletableFuture.completedFuture(Protocol.VERSION), Protocol.VERSION);
    }

    @Override
    public TextDocumentService getTextDocumentService() {
        return pikeServices;
    }

    @Override
    public WorkspaceService getWorkspaceService() {
        return pikeServices;
    }

    @Override
    public void connect(LanguageClient client) {
        pikeServices.connect(client);
    }
}
