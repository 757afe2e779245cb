package io.github.social.nostr.shard.utilities;

import static io.github.social.nostr.shard.utilities.Utils.nullValue;

/**
 * Process configuration: JVM system property first, then environment variable, then default.
 */
public final class AppProperties {
	private AppProperties() { /***/ }

	private static final String DEFAULT_HOST = "localhost";
	private static final String DEFAULT_PORT = "8080";
	private static final String DEFAULT_TLS_PORT = "8443";
	private static final String DEFAULT_TLS_ACTIVE = "false";
	private static final String DEFAULT_KEYSTORE_PASS = "changeit";
	private static final String DEFAULT_CLIENT_PING_SECOND = "60";
	private static final String DEFAULT_NIR_PATH = "/var/www/docs/nir.json";

	private static final String DEFAULT_AUTH_TIMEOUT_SECOND = "600";
	private static final String DEFAULT_AUTH_LIMIT = "5";
	private static final String DEFAULT_DEFAULT_LIMIT = "50";
	private static final String DEFAULT_CREATED_AT_TOLERANCE_SECOND = "600";

	private static final String DEFAULT_REPOSITORY_TYPE = "document";
	private static final String DEFAULT_SUBSCRIPTION_STORE_TYPE = "cache";
	private static final String DEFAULT_PRUNE_INTERVAL_SECOND = "300";
	private static final String DEFAULT_PRUNE_BATCH_SIZE = "2000";
	private static final String DEFAULT_MAINTENANCE_RETRY_AFTER = "3600";

	private static final String DEFAULT_REDIS_HOST = "localhost";
	private static final String DEFAULT_REDIS_PORT = "6379";
	private static final String DEFAULT_REDIS_PASS = "";

	private static final String DEFAULT_MONGODB_HOST = "localhost";
	private static final String DEFAULT_MONGODB_PORT = "27017";
	private static final String DEFAULT_MONGODB_DATABASE = "nostr";

	private static String resolve(final String property, final String env, final String defaultValue) {
		return nullValue(System.getProperty(property), System.getenv(env), defaultValue);
	}

	public static String getHost() {
		return resolve(Constants.PROPERTY_HOST, Constants.ENV_HOST, DEFAULT_HOST);
	}

	public static int getPort() {
		return Integer.parseInt(resolve(Constants.PROPERTY_PORT, Constants.ENV_PORT, DEFAULT_PORT));
	}

	public static int getTlsPort() {
		return Integer.parseInt(resolve(Constants.PROPERTY_TLS_PORT, Constants.ENV_TLS_PORT, DEFAULT_TLS_PORT));
	}

	public static boolean isTls() {
		return Boolean.parseBoolean(resolve(Constants.PROPERTY_TLS_ACTIVE, Constants.ENV_TLS_ACTIVE, DEFAULT_TLS_ACTIVE));
	}

	/**
	 * Keystore file; {@code null} means the bundled {@code /keystore} resource.
	 */
	public static String getKeystorePath() {
		final String path = System.getProperty(Constants.PROPERTY_KEYSTORE_PATH);
		return path != null ? path : System.getenv(Constants.ENV_KEYSTORE_PATH);
	}

	public static String getKeystoreSecret() {
		return resolve(Constants.PROPERTY_KEYSTORE_PASS, Constants.ENV_KEYSTORE_PASS, DEFAULT_KEYSTORE_PASS);
	}

	public static int getClientPingSecond() {
		return Integer.parseInt(resolve(
			Constants.PROPERTY_CLIENT_PING_SECOND,
			Constants.ENV_CLIENT_PING_SECOND,
			DEFAULT_CLIENT_PING_SECOND));
	}

	public static String getNirFullpath() {
		return resolve(Constants.PROPERTY_NIR_FULLPATH, Constants.ENV_NIR_FULLPATH, DEFAULT_NIR_PATH);
	}

	public static int getAuthTimeoutSecond() {
		return Integer.parseInt(resolve(
			Constants.PROPERTY_AUTH_TIMEOUT_SECOND,
			Constants.ENV_AUTH_TIMEOUT_SECOND,
			DEFAULT_AUTH_TIMEOUT_SECOND));
	}

	public static int getAuthLimit() {
		return Integer.parseInt(resolve(Constants.PROPERTY_AUTH_LIMIT, Constants.ENV_AUTH_LIMIT, DEFAULT_AUTH_LIMIT));
	}

	public static int getDefaultLimit() {
		return Integer.parseInt(resolve(Constants.PROPERTY_DEFAULT_LIMIT, Constants.ENV_DEFAULT_LIMIT, DEFAULT_DEFAULT_LIMIT));
	}

	public static int getCreatedAtToleranceSecond() {
		return Integer.parseInt(resolve(
			Constants.PROPERTY_CREATED_AT_TOLERANCE_SECOND,
			Constants.ENV_CREATED_AT_TOLERANCE_SECOND,
			DEFAULT_CREATED_AT_TOLERANCE_SECOND));
	}

	public static String getRepositoryType() {
		return resolve(Constants.PROPERTY_REPOSITORY_TYPE, Constants.ENV_REPOSITORY_TYPE, DEFAULT_REPOSITORY_TYPE);
	}

	public static String getSubscriptionStoreType() {
		return resolve(
			Constants.PROPERTY_SUBSCRIPTION_STORE_TYPE,
			Constants.ENV_SUBSCRIPTION_STORE_TYPE,
			DEFAULT_SUBSCRIPTION_STORE_TYPE);
	}

	public static int getPruneIntervalSecond() {
		return Integer.parseInt(resolve(
			Constants.PROPERTY_PRUNE_INTERVAL_SECOND,
			Constants.ENV_PRUNE_INTERVAL_SECOND,
			DEFAULT_PRUNE_INTERVAL_SECOND));
	}

	public static int getPruneBatchSize() {
		return Integer.parseInt(resolve(
			Constants.PROPERTY_PRUNE_BATCH_SIZE,
			Constants.ENV_PRUNE_BATCH_SIZE,
			DEFAULT_PRUNE_BATCH_SIZE));
	}

	public static int getMaintenanceRetryAfterSecond() {
		return Integer.parseInt(resolve(
			Constants.PROPERTY_MAINTENANCE_RETRY_AFTER,
			Constants.ENV_MAINTENANCE_RETRY_AFTER,
			DEFAULT_MAINTENANCE_RETRY_AFTER));
	}

	/**
	 * Bearer token for the administrative endpoints; empty disables them.
	 */
	public static String getAdminToken() {
		return resolve(Constants.PROPERTY_ADMIN_TOKEN, Constants.ENV_ADMIN_TOKEN, "");
	}

	public static String getRedisHost() {
		return resolve(Constants.PROPERTY_REDIS_HOST, Constants.ENV_REDIS_HOST, DEFAULT_REDIS_HOST);
	}

	public static int getRedisPort() {
		return Integer.parseInt(resolve(Constants.PROPERTY_REDIS_PORT, Constants.ENV_REDIS_PORT, DEFAULT_REDIS_PORT));
	}

	public static String getRedisSecret() {
		return resolve(Constants.PROPERTY_REDIS_PASS, Constants.ENV_REDIS_PASS, DEFAULT_REDIS_PASS);
	}

	public static String getMongoDbHost() {
		return resolve(Constants.PROPERTY_MONGODB_HOST, Constants.ENV_MONGODB_HOST, DEFAULT_MONGODB_HOST);
	}

	public static int getMongoDbPort() {
		return Integer.parseInt(resolve(Constants.PROPERTY_MONGODB_PORT, Constants.ENV_MONGODB_PORT, DEFAULT_MONGODB_PORT));
	}

	public static String getMongoDbDatabase() {
		return resolve(Constants.PROPERTY_MONGODB_DATABASE, Constants.ENV_MONGODB_DATABASE, DEFAULT_MONGODB_DATABASE);
	}

}
