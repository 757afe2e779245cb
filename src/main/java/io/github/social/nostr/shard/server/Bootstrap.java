package io.github.social.nostr.shard.server;

import java.io.IOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import io.github.social.nostr.shard.datasource.CacheDS;
import io.github.social.nostr.shard.datasource.DocumentDS;
import io.github.social.nostr.shard.def.IEventRepository;
import io.github.social.nostr.shard.def.IRegistrationService;
import io.github.social.nostr.shard.def.ISubscriptionStore;
import io.github.social.nostr.shard.message.RelayServices;
import io.github.social.nostr.shard.service.CacheSubscriptionStore;
import io.github.social.nostr.shard.service.EventDocumentRepository;
import io.github.social.nostr.shard.service.MemoryEventRepository;
import io.github.social.nostr.shard.service.MemorySubscriptionStore;
import io.github.social.nostr.shard.service.RegistrationDocumentService;
import io.github.social.nostr.shard.service.StaticRegistrationService;
import io.github.social.nostr.shard.specs.RelayInformation;
import io.github.social.nostr.shard.specs.RelayPolicy;
import io.github.social.nostr.shard.utilities.AppProperties;
import io.github.social.nostr.shard.utilities.LogService;

public class Bootstrap {
	static final Bootstrap bootstrap = new Bootstrap();
	static final ExecutorService serverPool = Executors.newSingleThreadExecutor();
	static final ExecutorService clientPool = Executors.newCachedThreadPool();

	static final String MEMORY = "memory";

	private final LogService logger = LogService.getInstance(getClass().getCanonicalName());

	public static void main(String[] args) throws Exception {
		bootstrap.start();
	}

	private void start() throws IOException {
		final RelayInformation information = RelayInformation.load(AppProperties.getNirFullpath());
		final RelayPolicy policy = RelayPolicy.from(information);

		final NostrService nostr = new NostrService(
			services(policy),
			AppProperties.getPruneIntervalSecond(),
			AppProperties.getPruneBatchSize());

		final ServerHandler serverHandler = new ServerHandler(
			clientPool,
			new WebsocketHandler(nostr),
			new AdminHandler(nostr, AppProperties.getAdminToken()),
			information.toJson());

		serverPool.submit(serverHandler);
	}

	private RelayServices services(final RelayPolicy policy) {
		final boolean memoryRepository = isMemory(AppProperties.getRepositoryType());
		final boolean memoryStore = isMemory(AppProperties.getSubscriptionStoreType());

		final CacheDS cache = memoryRepository && memoryStore ? null : CacheDS.fromProperties();
		final DocumentDS document = memoryRepository ? null : DocumentDS.fromProperties();

		final IEventRepository repository = memoryRepository
			? new MemoryEventRepository(policy)
			: new EventDocumentRepository(policy, cache, document);

		final IRegistrationService registration = memoryRepository
			? StaticRegistrationService.openToAll()
			: new RegistrationDocumentService(document);

		final ISubscriptionStore subscriptionStore = memoryStore
			? new MemorySubscriptionStore()
			: new CacheSubscriptionStore(cache);

		logger.info(
			"[Server] repository: {}; subscription store: {}",
			repository.getClass().getSimpleName(),
			subscriptionStore.getClass().getSimpleName());

		return RelayServices.builder()
			.policy(policy)
			.repository(repository)
			.registration(registration)
			.subscriptionStore(subscriptionStore)
			.build();
	}

	private static boolean isMemory(final String type) {
		return MEMORY.equalsIgnoreCase(type);
	}

}
