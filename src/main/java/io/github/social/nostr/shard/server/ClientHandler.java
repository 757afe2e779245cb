package io.github.social.nostr.shard.server;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketAddress;
import java.net.SocketTimeoutException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

import io.github.social.nostr.shard.exceptions.CloseConnectionException;
import io.github.social.nostr.shard.misc.IncomingData;
import io.github.social.nostr.shard.types.HttpMethod;
import io.github.social.nostr.shard.types.HttpStatus;
import io.github.social.nostr.shard.types.Opcode;
import io.github.social.nostr.shard.utilities.AppProperties;
import io.github.social.nostr.shard.utilities.LogService;
import io.github.social.nostr.shard.websocket.BinaryMessage;
import io.github.social.nostr.shard.websocket.TextMessage;
import io.github.social.nostr.shard.websocket.Websocket;
import io.github.social.nostr.shard.websocket.WebsocketException;

import static io.github.social.nostr.shard.utilities.Utils.secWebsocketAccept;

/**
 * One accepted socket: HTTP/1.1 request handling, websocket upgrade and the
 * websocket frame codec (RFC 6455).
 */
public class ClientHandler implements Runnable {
	private final LogService logger = LogService.getInstance(getClass().getCanonicalName());

	private final ScheduledExecutorService pingService = Executors.newScheduledThreadPool(1);

	// inbound frames of this connection are handled one at a time, in arrival order
	private final ExecutorService websocketEventService = Executors.newSingleThreadExecutor();

	// outbound frames of this connection are written one at a time, in submission order
	private final ExecutorService clientBroadcaster = Executors.newSingleThreadExecutor();

	private final WebsocketContext websocketContext = new WebsocketContext() {
		public byte send(final String message) {
			try {
				clientBroadcaster.submit(() -> {
					if(interrupt) return;

					logger.debug("[WS] Server -> Client [{}] {}", remoteAddress, message);

					try {
						sendWebsocketDataClient(message);
					} catch (IOException e) {
						logger.warning("[WS] could not write to client [{}]: {}", remoteAddress, e.getMessage());
					}
				});
			} catch(RejectedExecutionException e) {
				logger.debug("[WS] client [{}] gone, message dropped.", remoteAddress);
			}

			return 0;
		}

		public String getRemoteAddress()  {
			return remoteAddress;
		}

		public String getUserAgent() {
			return userAgent;
		}

		public String getUrl() {
			return websocketUrl;
		}

		public byte requestClose() {
			try {
				clientBroadcaster.submit(() -> {
					if(interrupt) return;
					try {
						sendWebsocketCloseFrame((short) 1000);
					} catch (IOException e) {
						logger.warning("[WS] could not send CLOSE frame to [{}]: {}", remoteAddress, e.getMessage());
					}
					interrupt = true;
				});
			} catch(RejectedExecutionException e) {
				interrupt = true;
			}

			return 0;
		}

	};

	private InputStream in;
	private OutputStream out;

	private String userAgent;
	private String remoteAddress = "0.0.0.0";
	private String websocketUrl;

	private final Socket client;
	private final Websocket websocketHandler;
	private final AdminHandler adminHandler;
	private final String relayInformation;
	private final String serverHost;
	private final int serverPort;
	private final boolean isServerTls;

	public ClientHandler(
			final String serverHost,
			final int serverPort,
			final boolean isServerTls,
			final Socket c,
			final Websocket websocketHandler,
			final AdminHandler adminHandler,
			final String relayInformation
	) {
		this.client = c;
		this.serverHost = serverHost;
		this.serverPort = serverPort;
		this.websocketHandler = websocketHandler;
		this.adminHandler = adminHandler;
		this.relayInformation = relayInformation;
		this.isServerTls = isServerTls;
	}

	private volatile boolean interrupt = false;

	private boolean websocket = false;

	static final int MAX_TIMEOUT_MILLIS = 10000;
	static final int SOCKET_TIMEOUT_MILLIS = 50;

	static final long MAX_MESSAGE_BYTES = 512 * 1024;

	static final int RETRY_AFTER_SECOND = AppProperties.getMaintenanceRetryAfterSecond();

	@Override
	public void run() {
		try {
			this.process();
		} catch(IOException failure) {
			logger.warning("[Server] Client [{}] failure: {}", remoteAddress, failure.getMessage());
		}
	}

	private void process() throws IOException {
		this.startStreams();
		this.handleStream();
		this.endStreams();
	}

	private void startStreams() throws IOException {
		final SocketAddress clientSocketAddress = client.getRemoteSocketAddress();
		Optional.ofNullable(clientSocketAddress).ifPresent(sk -> {
			this.remoteAddress = ((InetSocketAddress) sk).getAddress().getHostAddress();
		});

		try {
			this.client.setSoTimeout(SOCKET_TIMEOUT_MILLIS);
			this.in = client.getInputStream();
			this.out = client.getOutputStream();
		} catch(IOException failure) {
			logger.warning(
				"Client startup error.\n> Class: {}\n> Message: {}",
				failure.getClass().getCanonicalName(), failure.getMessage());

			this.client.close();
			throw failure;
		}
	}

	private synchronized byte sendBytes(final byte[] rawData) throws IOException {
		this.out.write(rawData);

		return 0;
	}

	private synchronized byte flushStream() throws IOException {
		this.out.flush();

		return 0;
	}

	private void handleStream() {
		while(true) {
			try {
				this.handle();

				if( ! interrupt ) continue;
			} catch (CloseConnectionException failure) {
				logger.info("[Server] Connection will be closed.");
			} catch (IOException failure) {
				logger.warning(
					"I/O error.\n> Class: {}\n> Message: {}",
					failure.getClass().getCanonicalName(),
					failure.getMessage());

				this.notifyWebsocketFailure(failure);
			} catch (RuntimeException failure) {
				logger.error(
					"Unpredictable error occured.\n> Class: {}\n> Message: {}",
					failure.getClass().getCanonicalName(),
					failure.getMessage());

				this.notifyWebsocketFailure(failure);
			}

			break;
		}

		this.notifyWebsocketClosure();

		this.pingService.shutdown();
		this.websocketEventService.shutdown();
	}

	private void endStreams() {
		this.clientBroadcaster.shutdown();
		try {
			this.clientBroadcaster.awaitTermination(1, TimeUnit.SECONDS);
		} catch(InterruptedException e) {
			Thread.currentThread().interrupt();
		}

		try {
			if( !this.client.isClosed() ) {
				client.close();
			}
		} catch (IOException e) {
			logger.debug("[Server] socket close failure: {}", e.getMessage());
		}

		logger.info("[Server] Client connection terminated.");
	}

	private static final String CRLF = "\r\n";
	private static final byte[] CRLF_RAW = CRLF.getBytes(StandardCharsets.US_ASCII);

	static final String ADMIN_BASE_PATH = "/admin/";

	private HttpMethod requestMethod = null;
	private String requestTarget = null;
	private String requestPath = null;

	private final Map<String, List<String>> httpRequestHeaders = new LinkedHashMap<>();
	private final Map<String, List<String>> httpResponseHeaders = new LinkedHashMap<>();
	private final ByteArrayOutputStream httpResponseBody = new ByteArrayOutputStream();

	private void cleanup() {
		this.requestMethod = null;
		this.requestTarget = null;
		this.requestPath = null;
		this.httpRequestHeaders.clear();
		this.httpResponseHeaders.clear();
		this.httpResponseBody.reset();
	}

	private byte handle() throws IOException {
		if(this.websocket) {
			return this.consumeWebsocketClientPacket();
		} else {
			return this.handleHttpStream();
		}
	}

	private byte handleHttpStream() throws IOException {
		this.cleanup();

		this.startHandleHttpRequest();

		if (this.requestMethod != null) {
			this.continueHandleHttpRequest();
		}
		this.flushStream();

		return this.checkCloseConnection();
	}

	private byte checkCloseConnection() {
		if( this.websocket ) return 0;

		final List<String> connectionHeader = this.httpRequestHeaders
			.getOrDefault("connection", Collections.emptyList());

		final boolean closeAfterEnd = connectionHeader.stream().anyMatch(q -> "close".equalsIgnoreCase(q));

		if( connectionHeader.isEmpty() || closeAfterEnd ) this.interrupt = true;

		return 0;
	}

	private final byte[] incomingBytes = new byte[4096];

	private final IncomingData incomingData = new IncomingData();

	private void startHandleHttpRequest() throws IOException {
		this.incomingData.reset();

		final ByteArrayOutputStream httpData = new ByteArrayOutputStream();

		final int[] lastOctets = new int[] {0, 0, 0, 0};

		long totalTimeout = 0;

		while(true) {
			if(this.interrupt) return;

			try {
				final int bytesRead = this.in.read(this.incomingBytes);
				if(bytesRead < 0) throw new CloseConnectionException();
				if(bytesRead == 0) continue;

				this.incomingData.write(this.incomingBytes, 0, bytesRead);
			} catch(SocketTimeoutException timeout) {
				totalTimeout += SOCKET_TIMEOUT_MILLIS;
				if(totalTimeout >= MAX_TIMEOUT_MILLIS) {
					logger.warning("[Server] client connect reached max allowed timeout.");
					throw new CloseConnectionException();
				}

				continue;
			}

			totalTimeout = 0;

			while(this.incomingData.remaining() > 0) {
				final byte octet = this.incomingData.next();
				httpData.write(octet);

				lastOctets[0] = lastOctets[1];
				lastOctets[1] = lastOctets[2];
				lastOctets[2] = lastOctets[3];
				lastOctets[3] = octet;

				if (	lastOctets[0] == '\r'
					&&	lastOctets[1] == '\n'
					&&	lastOctets[2] == '\r'
					&&	lastOctets[3] == '\n'
				) {
					this.incomingData.shrink();
					this.parseRequestHeader(httpData.toByteArray());
					return;
				}
			}

			if( httpData.size() > MAX_MESSAGE_BYTES ) {
				this.sendBadRequest("Request header too large");
				throw new CloseConnectionException();
			}
		}

	}

	private byte continueHandleHttpRequest() throws IOException {
		if( this.requestPath.startsWith(ADMIN_BASE_PATH) ) {
			return this.handleAdminRequest();
		}

		if( !"/".equals(this.requestPath) ) {
			return this.sendResourceNotFound();
		}

		switch (this.requestMethod) {
		case OPTIONS:
			return this.sendOkOptions();
		case GET:
			return this.checkSwitchingProtocol();
		default:
			return this.sendMethodNotAllowed();
		}
	}

	private byte handleAdminRequest() throws IOException {
		final AdminHandler.AdminResponse response = this.adminHandler.handle(
			this.requestMethod,
			this.requestPath,
			this.firstHeader("authorization"));

		logger.info("[Server] [Admin] {} {} from {}: {}", requestMethod, requestPath, remoteAddress, response.getStatus());

		final byte[] raw = response.getBody().getBytes(StandardCharsets.UTF_8);

		this.sendStatusLine(response.getStatus());
		this.sendDateHeader();
		if( response.getStatus().code() == HttpStatus.UNAUTHORIZED.code() ) {
			this.sendBytes(("WWW-Authenticate: Bearer" + CRLF).getBytes(StandardCharsets.US_ASCII));
		}
		this.sendContentHeader("application/json; charset=UTF-8", raw.length);
		this.sendConnectionCloseHeader();
		this.mountHeadersTermination();

		return this.sendBytes(raw);
	}

	private String firstHeader(final String name) {
		final List<String> values = this.httpRequestHeaders.get(name);

		return values == null || values.isEmpty() ? null : values.get(0);
	}

	private List<String> header(final String name) {
		return Optional
			.ofNullable(this.httpRequestHeaders.get(name))
			.orElse(Collections.emptyList());
	}

	static final String CRLF_RE = "\\r\\n";
	static final Pattern URI_PATTERN = Pattern.compile("^\\/\\S*$");

	private byte parseRequestHeader(final byte[] raw) throws IOException {
		final String data = new String(raw, StandardCharsets.US_ASCII)
			.replaceAll("\\r\\n[\\s\\t]+", "\u0000\u0000\u0000");
		final String[] entries = data.split(CRLF_RE);

		int startLine = 0;
		while(startLine < entries.length && entries[startLine].replaceAll("[\\s\\t]", "").isEmpty()) {
			++startLine;
		}

		if (startLine == entries.length) {
			return sendBadRequest("Invalid HTTP Request");
		}

		final String methodLine = entries[startLine];
		final String[] methodContent = methodLine.split("\\s");
		if (methodContent.length != 3) {
			return sendBadRequest("Invalid HTTP Method Sintax");
		}

		logger.info("[Server] {}", methodLine);

		final String httpVersion = methodContent[2];
		if ( ! "HTTP/1.1".equalsIgnoreCase(httpVersion) ) {
			return sendVersionNotSupported();
		}

		final HttpMethod httpMethod = HttpMethod.from(methodContent[0]);
		if (httpMethod == null) {
			return this.sendMethodNotAllowed();
		}

		final String target = methodContent[1];
		if ( ! URI_PATTERN.matcher(target).matches() ) {
			return this.sendBadRequest("HTTP URI must be a relative path.");
		}

		for (int i = startLine + 1; i < entries.length; ++i) {
			final String entry = entries[i];
			final int colon = entry.indexOf(':');
			if (colon <= 0) continue;

			final String header = entry.substring(0, colon).trim().toLowerCase(Locale.ROOT);
			final String value = entry
				.substring(colon + 1)
				.trim()
				.replaceAll("[\u0000]{3}", "\r\n ");

			this.httpRequestHeaders.computeIfAbsent(header, key -> new LinkedList<>()).add(value);
		}

		final StringBuilder originDebug = new StringBuilder("");
		originDebug.append("[Server] Client identification");
		originDebug.append(String.format("%n> Remote Address: %s", this.remoteAddress));

		header("user-agent").forEach(q -> {
			userAgent = q;
			originDebug.append(String.format("%n> User-Agent: %s", q));
		});
		header("origin").forEach(q -> originDebug.append(String.format("%n> Origin: %s", q)));

		logger.info("{}", originDebug);

		this.requestMethod = httpMethod;
		this.requestTarget = target;
		this.requestPath = target.contains("?") ? target.substring(0, target.indexOf('?')) : target;

		return 0;
	}

	private static final String gmt() {
		final DateTimeFormatter RFC_1123_DATE_TIME = DateTimeFormatter
			.ofPattern("EEE, dd MMM yyyy HH:mm:ss 'GMT'", Locale.US);
		final ZonedDateTime dt = ZonedDateTime.now(ZoneId.of("GMT"));

		return dt.format(RFC_1123_DATE_TIME);
	}

	private byte sendStatusLine(final HttpStatus status) throws IOException {
		final String statusLine = "HTTP/1.1 " + status.code() + " " + status.text();
		logger.info("[Server] StatusLine: {}", statusLine);

		return this.sendBytes((statusLine + CRLF).getBytes(StandardCharsets.US_ASCII));
	}

	private byte sendDateHeader() throws IOException {
		return this.sendBytes(String.format("Date: %s%s", gmt(), CRLF).getBytes(StandardCharsets.US_ASCII));
	}

	private byte sendContentHeader(final String type, final int length) throws IOException {
		this.sendBytes(("Content-Type: " + type + CRLF).getBytes(StandardCharsets.US_ASCII));
		this.sendBytes(("Content-Length: " + length + CRLF).getBytes(StandardCharsets.US_ASCII));

		return 0;
	}

	private byte sendPoweredByHeader() throws IOException {
		return this.sendBytes(("X-Powered-By: nostr-protocol" + CRLF).getBytes(StandardCharsets.US_ASCII));
	}

	private byte sendAccessControlAllowOriginHeader() throws IOException{
		this.sendBytes(("Access-Control-Allow-Origin: *" + CRLF).getBytes(StandardCharsets.US_ASCII));
		this.sendBytes(("Access-Control-Allow-Headers: *" + CRLF).getBytes(StandardCharsets.US_ASCII));
		this.sendBytes(("Access-Control-Allow-Methods: GET, OPTIONS" + CRLF).getBytes(StandardCharsets.US_ASCII));

		return 0;
	}

	private byte sendUpgradeWebsocketHeader() throws IOException {
		return this.sendBytes(("Upgrade: websocket" + CRLF).getBytes(StandardCharsets.US_ASCII));
	}

	private byte sendSecWebsocketVersionHeader() throws IOException {
		return this.sendBytes(("Sec-Websocket-Version: 13" + CRLF).getBytes(StandardCharsets.US_ASCII));
	}

	private byte sendSecWebsocketAcceptHeader(final String secWebsocketKey) throws IOException {
		final String secWebsocketAcceptValue = secWebsocketAccept(secWebsocketKey);
		return this.sendBytes(("Sec-Websocket-Accept: " + secWebsocketAcceptValue + CRLF).getBytes(StandardCharsets.US_ASCII));
	}

	private byte sendConnectionUpgraderHeader() throws IOException {
		return this.sendBytes(("Connection: Upgrade" + CRLF).getBytes(StandardCharsets.US_ASCII));
	}

	private byte sendConnectionCloseHeader() throws IOException {
		this.interrupt = true;
		return this.sendBytes(("Connection: close" + CRLF).getBytes(StandardCharsets.US_ASCII));
	}

	private byte sendOkOptions() throws IOException {
		this.sendStatusLine(HttpStatus.NO_CONTENT);
		this.sendDateHeader();
		this.sendAccessControlAllowOriginHeader();
		this.sendBytes(("Allow: OPTIONS, GET" + CRLF).getBytes(StandardCharsets.US_ASCII));
		this.sendConnectionCloseHeader();

		return this.mountHeadersTermination();
	}

	private byte prepareRelayInformation() throws IOException {
		final byte[] raw = this.relayInformation.getBytes(StandardCharsets.UTF_8);

		this.httpResponseHeaders.put("Content-Type", Arrays.asList("application/nostr+json; charset=UTF-8"));
		this.httpResponseHeaders.put("Content-Length", Arrays.asList(Integer.toString(raw.length)));
		this.httpResponseBody.write(raw);

		return 0;
	}

	private byte prepareIndexText() throws IOException {
		final byte[] raw = "Please use a Nostr client to connect.".getBytes(StandardCharsets.UTF_8);

		this.httpResponseHeaders.put("Content-Type", Arrays.asList("text/plain; charset=UTF-8"));
		this.httpResponseHeaders.put("Content-Length", Arrays.asList(Integer.toString(raw.length)));
		this.httpResponseBody.write(raw);

		return 0;
	}

	private byte sendCustomHeaders() throws IOException {
		for (final Map.Entry<String, List<String>> entry : this.httpResponseHeaders.entrySet()) {
			for (final String value : entry.getValue()) {
				sendBytes((entry.getKey() + ": " + value + CRLF).getBytes(StandardCharsets.US_ASCII));
			}
		}

		return 0;
	}

	private byte mountCustomBody() throws IOException {
		return this.sendBytes(this.httpResponseBody.toByteArray());
	}

	private byte mountHeadersTermination() throws IOException {
		return this.sendBytes(CRLF_RAW);
	}

	private byte sendBadRequest(final String cause) throws IOException {
		this.sendStatusLine(HttpStatus.BAD_REQUEST);
		this.sendDateHeader();

		final byte[] raw = cause.getBytes(StandardCharsets.US_ASCII);

		this.sendContentHeader("text/plain", raw.length);
		this.sendConnectionCloseHeader();
		this.mountHeadersTermination();

		return this.sendBytes(raw);
	}

	private byte sendResourceNotFound() throws IOException {
		final byte[] raw = "The requested resource could not be found".getBytes(StandardCharsets.US_ASCII);

		this.sendStatusLine(HttpStatus.NOT_FOUND);
		this.sendDateHeader();
		this.sendContentHeader("text/plain", raw.length);
		this.sendConnectionCloseHeader();
		this.mountHeadersTermination();

		return this.sendBytes(raw);
	}

	private byte sendVersionNotSupported() throws IOException {
		this.sendStatusLine(HttpStatus.HTTP_VERSION_NOT_SUPPORTED);
		this.sendDateHeader();
		this.sendConnectionCloseHeader();

		return this.mountHeadersTermination();
	}

	private byte sendMethodNotAllowed() throws IOException {
		this.sendStatusLine(HttpStatus.METHOD_NOT_ALLOWED);
		this.sendDateHeader();
		this.sendConnectionCloseHeader();

		return this.mountHeadersTermination();
	}

	private byte sendServiceUnavailable() throws IOException {
		final byte[] raw = "Relay under maintenance".getBytes(StandardCharsets.US_ASCII);

		this.sendStatusLine(HttpStatus.SERVICE_UNAVAILABLE);
		this.sendDateHeader();
		this.sendBytes(("Retry-After: " + RETRY_AFTER_SECOND + CRLF).getBytes(StandardCharsets.US_ASCII));
		this.sendContentHeader("text/plain", raw.length);
		this.sendConnectionCloseHeader();
		this.mountHeadersTermination();

		return this.sendBytes(raw);
	}

	private byte checkSwitchingProtocol() throws IOException {
		final List<String> accept = header("accept");
		final List<String> upgrade = header("upgrade");
		final List<String> connection = header("connection");
		final List<String> secWebsocketKey = header("sec-websocket-key");
		final List<String> secWebsocketVersion = header("sec-websocket-version");

		final boolean upgradeRequested = connection
			.stream()
			.anyMatch(value -> value.toLowerCase(Locale.ROOT).contains("upgrade"));

		final HttpStatus status;
		if( !upgradeRequested ) {
			status = HttpStatus.OK;
		} else if( upgrade.isEmpty() ) {
			status = HttpStatus.UPGRADE_REQUIRED;
		} else if( ! "websocket".equalsIgnoreCase(upgrade.get(0))
				|| ! secWebsocketVersion.contains("13")
				|| secWebsocketKey.isEmpty() ) {
			status = HttpStatus.BAD_REQUEST;
		} else if( this.websocketHandler.isRefusingConnections() ) {
			logger.info("[Server] [Maintenance] upgrade refused for {}", remoteAddress);
			return this.sendServiceUnavailable();
		} else {
			status = HttpStatus.SWITCHING_PROTOCOL;
		}

		this.sendStatusLine(status);
		this.sendDateHeader();
		this.sendPoweredByHeader();
		this.sendAccessControlAllowOriginHeader();

		if( status == HttpStatus.UPGRADE_REQUIRED ) {
			this.sendUpgradeWebsocketHeader();
		} else if( status == HttpStatus.BAD_REQUEST && ! secWebsocketVersion.contains("13") ) {
			this.sendSecWebsocketVersionHeader();
		}

		if( status == HttpStatus.SWITCHING_PROTOCOL ) {
			this.sendConnectionUpgraderHeader();
			this.sendUpgradeWebsocketHeader();
			this.sendSecWebsocketAcceptHeader(secWebsocketKey.get(0));

			this.websocket = true;
			this.websocketUrl = this.connectionUrl();
		} else if( status == HttpStatus.OK ) {
			final boolean nostrJson = accept
				.stream()
				.anyMatch(value -> value.contains("application/nostr+json"));

			if( nostrJson ) {
				this.prepareRelayInformation();
			} else {
				this.prepareIndexText();
			}

			this.sendCustomHeaders();
			this.sendConnectionCloseHeader();
		} else {
			this.sendBytes(("Content-Length: 0" + CRLF).getBytes(StandardCharsets.US_ASCII));
			this.sendConnectionCloseHeader();
		}

		this.mountHeadersTermination();

		if( this.websocket ) {
			this.flushStream();
			this.scheduleWebsocketPingClient();
			this.notifyWebsocketOpening();
		}

		return this.mountCustomBody();
	}

	private String connectionUrl() {
		final String host = Optional
			.ofNullable(this.firstHeader("host"))
			.orElse(this.serverHost + ":" + this.serverPort);

		return (this.isServerTls ? "wss" : "ws") + "://" + host + this.requestTarget;
	}

	private void notifyWebsocketOpening() {
		this.websocketContext.connect();
		this.websocketEventService.submit(() -> this.websocketHandler.onOpen(this.websocketContext));
	}

	private void notifyWebsocketFailure(final Exception failure) {
		if(this.websocket) {
			this.websocketContext.disconnect();
			final WebsocketException wsException = new WebsocketException(failure).setContext(this.websocketContext);
			this.websocketEventService.submit(() -> this.websocketHandler.onError(wsException));
		}
	}

	private void notifyWebsocketClosure() {
		if(this.websocket) {
			this.websocketContext.disconnect();
			this.websocketEventService.submit(() -> this.websocketHandler.onClose(this.websocketContext));
		}
	}

	private void notifyWebsocketTextMessage(final byte[] data) {
		this.websocketEventService.submit(() -> this.websocketHandler.onMessage(this.websocketContext, new TextMessage(data)));
	}

	private void notifyWebsocketBinaryMessage(final byte[] data) {
		this.websocketEventService.submit(() -> this.websocketHandler.onMessage(this.websocketContext, new BinaryMessage(data)));
	}

	static final int CLIENT_LIVENESS_MILLIS = AppProperties.getClientPingSecond() * 1000;
	private void scheduleWebsocketPingClient() {
		this.pingService.scheduleAtFixedRate(
			() -> {
				try {
					this.websocketPingClientEventFired();
				} catch (IOException e) {
					logger.warning("[WS] PING to [{}] failed: {}", remoteAddress, e.getMessage());
				}
			},
			CLIENT_LIVENESS_MILLIS,
			CLIENT_LIVENESS_MILLIS,
			TimeUnit.MILLISECONDS
		);
		logger.info("[WS] PING client liveness set to {}ms.", CLIENT_LIVENESS_MILLIS);
	}

	static final long MAX_PACKET_RECEIVED_TIMEOUT_MILLIS = 300000;

	private final AtomicInteger pingCounter = new AtomicInteger();
	private byte websocketPingClientEventFired() throws IOException {
		if(Thread.currentThread().isInterrupted()) return 0;

		final long timeDiff = System.currentTimeMillis() - this.lastPacketReceivedTime;

		if ( timeDiff < CLIENT_LIVENESS_MILLIS ) return 0;

		if( timeDiff > MAX_PACKET_RECEIVED_TIMEOUT_MILLIS ) {
			if(this.interrupt) return 0;

			return this.requestCloseDueInactivity();
		}

		final int c = pingCounter.getAndIncrement();
		if( c == 0 ) {
			logger.infof("[WS] Server -> Client [%s]: Hey, are you on?", this.remoteAddress);
		} else {
			logger.infof("[WS] Server -> Client [%s]: It seems you are off. Are you on?", this.remoteAddress);
		}

		return this.sendWebsocketPingClient();
	}

	private byte requestCloseDueInactivity() throws IOException {
		final ByteBuffer closeCode = ByteBuffer.allocate(2);
		closeCode.putShort((short)1000);

		final ByteArrayOutputStream message = new ByteArrayOutputStream();
		message.write(closeCode.array());
		message.write("Closed due to inactivity".getBytes(StandardCharsets.UTF_8));

		logger.infof("[WS] Server -> Client [%s]: Send CLOSE frame due to client inactivity.", this.remoteAddress);
		this.sendWebsocketCloseFrame(message.toByteArray());
		this.interrupt = true;

		return 0;
	}

	private byte fetchWebsocketData() throws IOException {
		this.incomingData.shrink();

		while(true) {
			if(this.interrupt) return 0;

			try {
				final int bytesRead = this.in.read(this.incomingBytes);
				if( bytesRead < 0 ) throw new CloseConnectionException();
				if( bytesRead == 0 ) continue;

				this.incomingData.write(this.incomingBytes, 0, bytesRead);
			} catch(SocketTimeoutException timeout) {
				continue;
			}

			break;
		}

		return 0;
	}

	static final int CHECK_FIN = 0;
	static final int PAYLOAD_LENGTH = 1;
	static final int MASKING = 2;
	static final int PAYLOAD_CONSUMPTION = 3;

	static final int FIN_ON  = 0b10000000;

	static final byte OPCODE_BITSPACE_FLAG = 0b00001111;

	static final int UNMASK = 0b01111111;

	private volatile long lastPacketReceivedTime = System.currentTimeMillis();

	private byte consumeWebsocketClientPacket() throws IOException {
		final ByteArrayOutputStream message = new ByteArrayOutputStream();
		final ByteArrayOutputStream controlMessage = new ByteArrayOutputStream();

		int stage = CHECK_FIN;

		boolean isFinal = false;

		int opcode = -1;
		Opcode currentOpcode = null;

		long payloadLength = 0;
		int nextBytes = 0;

		final int[] decoder = new int[4];
		int decoderIndex = 0;

		fetchRawData:
		while(true) {
			if( this.incomingData.remaining() == 0 ) {
				this.fetchWebsocketData();
			}
			if(this.interrupt) return 0;

			do {
				final byte octet = this.incomingData.next();

				if( stage == CHECK_FIN ) {
					isFinal = (octet & FIN_ON) == FIN_ON;
					currentOpcode = Opcode.byCode(octet & OPCODE_BITSPACE_FLAG);

					if(currentOpcode.isReserved()) {
						logger.warning("[WS] Parsing error. Aborting connection at all");
						this.interrupt = true;
						return 0;
					}

					if(opcode == -1) {
						opcode = currentOpcode.code();
					}
					stage = PAYLOAD_LENGTH;
					continue;
				}

				if( stage == PAYLOAD_LENGTH ) {
					if( nextBytes == 0 ) {
						final int byteCheck = octet & UNMASK;

						if( byteCheck <= 125 ) {
							payloadLength = byteCheck;
						} else {
							payloadLength = 0;
							nextBytes = byteCheck == 126 ? 2 : 8;
							continue;
						}
					} else {
						payloadLength = (payloadLength << 8) | (octet & 0xFF);
						if( --nextBytes > 0 ) continue;
					}

					if( payloadLength < 0 || message.size() + payloadLength > MAX_MESSAGE_BYTES ) {
						logger.warning("[WS] Client [{}] message exceeds {} bytes.", remoteAddress, MAX_MESSAGE_BYTES);
						this.sendWebsocketCloseFrame((short) 1009);
						this.interrupt = true;
						return 0;
					}

					decoderIndex = 0;
					stage = MASKING;
					continue;
				}

				if( stage == MASKING ) {
					decoder[decoderIndex++] = octet;
					if(decoderIndex == decoder.length) {
						decoderIndex = 0;

						if(payloadLength == 0) {
							if( isFinal ) break fetchRawData;

							stage = CHECK_FIN;
							continue;
						}
						stage = PAYLOAD_CONSUMPTION;
					}
					continue;
				}

				if( stage == PAYLOAD_CONSUMPTION ) {
					// unmasking: XOR with the rotating 4-byte key
					final int decoded = (octet ^ decoder[decoderIndex++ % decoder.length]);

					if( currentOpcode.isControl() ) {
						controlMessage.write(decoded);
					} else {
						message.write(decoded);
					}

					if( --payloadLength == 0 ) {
						if( isFinal ) break fetchRawData;

						stage = CHECK_FIN;
					}
				}

			} while(this.incomingData.remaining() > 0);

		}

		this.lastPacketReceivedTime = System.currentTimeMillis();
		pingCounter.set(0);

		if( opcode == Opcode.OPCODE_TEXT.code() ) {
			this.notifyWebsocketTextMessage(message.toByteArray());
		}

		if( opcode == Opcode.OPCODE_BINARY.code() ) {
			this.notifyWebsocketBinaryMessage(message.toByteArray());
		}

		if( opcode == Opcode.OPCODE_PONG.code() ) {
			logger.debug("[WS] Client [{}] -> Server: I'm on!", this.remoteAddress);
			return 0;
		}

		if( opcode == Opcode.OPCODE_PING.code() ) {
			logger.debug("[WS] Client [{}] -> Server: Hey, are you on?", this.remoteAddress);
			return this.sendWebsocketPongClient(controlMessage.toByteArray());
		}

		if( opcode == Opcode.OPCODE_CLOSE.code() ) {
			final short closeCode = parseCode(controlMessage.toByteArray());
			logger.info("[WS] Client sent CLOSE frame with code {}.", closeCode);

			if( this.interrupt ) return 0;

			this.sendWebsocketCloseFrame(controlMessage.toByteArray());

			this.interrupt = true;
		}

		return 0;
	}

	private short parseCode(final byte[] raw) {
		final ByteBuffer code = ByteBuffer.wrap(raw);

		final short closeCode = raw.length >= 2 ? code.getShort() : 0;

		if( raw.length > 2 ) {
			final byte[] message = Arrays.copyOfRange(raw, 2, raw.length);
			logger.info(
				"[Server] Client send CLOSE frame with code {} and message {}",
				closeCode, new String(message, StandardCharsets.UTF_8));
		}

		return closeCode;
	}

	private byte sendWebsocketDataClient(final String message) throws IOException {
		final byte[] rawData = message.getBytes(StandardCharsets.UTF_8);

		return this.sendWebsocketClientRawData(Opcode.OPCODE_TEXT.code(), rawData);
	}

	// https://www.rfc-editor.org/rfc/rfc6455#section-7.4
	private byte sendWebsocketCloseFrame(short code) throws IOException {
		final ByteBuffer bb = ByteBuffer.allocate(2);
		bb.putShort(code);

		return this.sendWebsocketCloseFrame(bb.array());
	}

	private byte sendWebsocketCloseFrame(byte[] raw) throws IOException {
		return this.sendWebsocketClientRawData(Opcode.OPCODE_CLOSE.code(), raw);
	}

	private byte sendWebsocketPingClient() throws IOException {
		final byte[] message = "Liveness".getBytes(StandardCharsets.UTF_8);

		return this.sendWebsocketClientRawData(Opcode.OPCODE_PING.code(), message);
	}

	private byte sendWebsocketPongClient(final byte[] rawData) throws IOException {
		return this.sendWebsocketClientRawData(Opcode.OPCODE_PONG.code(), rawData);
	}

	private synchronized byte sendWebsocketClientRawData(final byte opcode, final byte[] rawData) throws IOException {
		this.sendBytes(WebsocketFrames.header(opcode, rawData.length));
		this.sendBytes(rawData);

		return this.flushStream();
	}

}
