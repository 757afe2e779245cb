package io.github.social.nostr.shard.utilities;

public final class Constants {
	public static final String PROPERTY_HOST  = 
		"nostr.server.host";
	public static final String PROPERTY_PORT  = 
		"nostr.server.port";
	public static final String PROPERTY_TLS_PORT = 
		"nostr.server.tls.port";
	public static final String PROPERTY_TLS_ACTIVE = 
		"nostr.server.tls";
	public static final String PROPERTY_KEYSTORE_PATH = 
		"nostr.server.tls.keystore";
	public static final String PROPERTY_KEYSTORE_PASS = 
		"nostr.server.tls.keystore.pass";
	public static final String PROPERTY_CLIENT_PING_SECOND = 
		"nostr.websocket.client.ping.second";
	public static final String PROPERTY_NIR_FULLPATH = 
		"nostr.nir.fullpath";

	public static final String PROPERTY_AUTH_TIMEOUT_SECOND = 
		"nostr.auth.timeout.second";
	public static final String PROPERTY_AUTH_LIMIT = 
		"nostr.auth.limit";
	public static final String PROPERTY_DEFAULT_LIMIT = 
		"nostr.query.default-limit";
	public static final String PROPERTY_CREATED_AT_TOLERANCE_SECOND = 
		"nostr.event.created-at.tolerance.second";

	public static final String PROPERTY_REPOSITORY_TYPE = 
		"nostr.repository.type";
	public static final String PROPERTY_SUBSCRIPTION_STORE_TYPE = 
		"nostr.subscription.store.type";
	public static final String PROPERTY_PRUNE_INTERVAL_SECOND = 
		"nostr.prune.interval.second";
	public static final String PROPERTY_PRUNE_BATCH_SIZE = 
		"nostr.prune.batch-size";
	public static final String PROPERTY_MAINTENANCE_RETRY_AFTER = 
		"nostr.maintenance.retry-after.second";
	public static final String PROPERTY_ADMIN_TOKEN = 
		"nostr.admin.token";

	public static final String PROPERTY_REDIS_HOST = 
		"redis.host";
	public static final String PROPERTY_REDIS_PORT = 
		"redis.port";
	public static final String PROPERTY_REDIS_PASS = 
		"redis.pass";

	public static final String PROPERTY_MONGODB_HOST = 
		"mongodb.host";
	public static final String PROPERTY_MONGODB_PORT = 
		"mongodb.port";
	public static final String PROPERTY_MONGODB_DATABASE = 
		"mongodb.database";

	public static final String ENV_HOST = 
		"NOSTR_SERVER_HOST";
	public static final String ENV_PORT = 
		"NOSTR_SERVER_PORT";
	public static final String ENV_TLS_PORT = 
		"NOSTR_SERVER_TLS_PORT";
	public static final String ENV_TLS_ACTIVE = 
		"NOSTR_SERVER_TLS";
	public static final String ENV_KEYSTORE_PATH = 
		"NOSTR_SERVER_TLS_KEYSTORE";
	public static final String ENV_KEYSTORE_PASS = 
		"NOSTR_SERVER_TLS_KEYSTORE_PASS";
	public static final String ENV_CLIENT_PING_SECOND = 
		"NOSTR_WEBSOCKET_CLIENT_PING_SECOND";
	public static final String ENV_NIR_FULLPATH = 
		"NOSTR_NIR_FULLPATH";

	public static final String ENV_AUTH_TIMEOUT_SECOND = 
		"NOSTR_AUTH_TIMEOUT_SECOND";
	public static final String ENV_AUTH_LIMIT = 
		"NOSTR_AUTH_LIMIT";
	public static final String ENV_DEFAULT_LIMIT = 
		"NOSTR_QUERY_DEFAULT_LIMIT";
	public static final String ENV_CREATED_AT_TOLERANCE_SECOND = 
		"NOSTR_EVENT_CREATED_AT_TOLERANCE_SECOND";

	public static final String ENV_REPOSITORY_TYPE = 
		"NOSTR_REPOSITORY_TYPE";
	public static final String ENV_SUBSCRIPTION_STORE_TYPE = 
		"NOSTR_SUBSCRIPTION_STORE_TYPE";
	public static final String ENV_PRUNE_INTERVAL_SECOND = 
		"NOSTR_PRUNE_INTERVAL_SECOND";
	public static final String ENV_PRUNE_BATCH_SIZE = 
		"NOSTR_PRUNE_BATCH_SIZE";
	public static final String ENV_MAINTENANCE_RETRY_AFTER = 
		"NOSTR_MAINTENANCE_RETRY_AFTER_SECOND";
	public static final String ENV_ADMIN_TOKEN = 
		"NOSTR_ADMIN_TOKEN";

	public static final String ENV_REDIS_HOST = 
		"REDIS_HOST";
	public static final String ENV_REDIS_PORT = 
		"REDIS_PORT";
	public static final String ENV_REDIS_PASS = 
		"REDIS_PASS";

	public static final String ENV_MONGODB_HOST = 
		"MONGODB_HOST";
	public static final String ENV_MONGODB_PORT = 
		"MONGODB_PORT";
	public static final String ENV_MONGODB_DATABASE = 
		"MONGODB_DATABASE";

	public static final String WEBSOCKET_UUID = "258EAFA5-E914-47DA-95CA-C5AB0DC85B11";

	public static final String NIR_RESOURCE = "/META-INF/resources/nir.json";

	private Constants() { /***/ }

}
