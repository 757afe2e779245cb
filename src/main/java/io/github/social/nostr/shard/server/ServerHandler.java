package io.github.social.nostr.shard.server;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

import io.github.social.nostr.shard.security.ServerSocketFactoryBuilder;
import io.github.social.nostr.shard.utilities.AppProperties;
import io.github.social.nostr.shard.utilities.LogService;
import io.github.social.nostr.shard.websocket.Websocket;

public class ServerHandler implements Runnable {
	private final LogService logger = LogService.getInstance(getClass().getCanonicalName());

	private final ExecutorService clientPool;
	private final Websocket websocketHandler;
	private final AdminHandler adminHandler;
	private final String relayInformation;

	private ServerSocket server;

	ServerHandler(
			final ExecutorService clientPool,
			final Websocket websocketHandler,
			final AdminHandler adminHandler,
			final String relayInformation) {
		this.clientPool = clientPool;
		this.websocketHandler = websocketHandler;
		this.adminHandler = adminHandler;
		this.relayInformation = relayInformation;
	}

	void stop() {
		this.websocketHandler.onServerShutdown();

		try {
			if(server != null && !server.isClosed()) {
				server.close();
				logger.info("[Server] stopped.");
			}
		} catch(IOException e) {
			logger.warning("{}: {}", e.getClass().getCanonicalName(), e.getMessage());
		}
	}

	static final long m1MB = 1000000;

	@Override
	public void run() {
		try {
			start();
		} catch(InterruptedException failure) {
			Thread.currentThread().interrupt();
		} catch(RuntimeException failure) {
			logger.error("[Server] could not start: {}", failure.getMessage());
		}
	}

	private void start() throws InterruptedException {
		Runtime.getRuntime().addShutdownHook(new Thread(()-> stop()));

		final boolean isTls = AppProperties.isTls();

		final int port = isTls ? AppProperties.getTlsPort() : AppProperties.getPort();
		try {
			this.server = ServerSocketFactoryBuilder.newFactory(isTls).createServerSocket(port);
			logger.info("[Server] startup completed.");
		} catch(IOException cause) {
			throw new IllegalStateException(cause);
		}

		final String host = AppProperties.getHost();

		logger.info("[Server] listening on port {}.", port);

		CompletableFuture.runAsync(websocketHandler::onServerStartup);

		while(true) {
			final Socket client;
			try {
				client = server.accept();
			} catch(IOException e) {
				if( server.isClosed() ) return;

				logger.warningf(
					"[Server] failure serving HTTP request%n%s: %s",
					e.getClass().getCanonicalName(),
					e.getMessage());
				Thread.sleep(5000);
				continue;
			}

			final long freeMemory = Runtime.getRuntime().freeMemory();

			if( freeMemory < m1MB ) {
				logger.warning("[Server] Connection denied due to low memory.");
				try {
					client.close();
				} catch(IOException failure) {
					logger.debug("[Server] socket close failure: {}", failure.getMessage());
				}

				continue;
			}

			clientPool.submit(new ClientHandler(
				host,
				port,
				isTls,
				client,
				websocketHandler,
				adminHandler,
				relayInformation
			));
		}
	}
}
