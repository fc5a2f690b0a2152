package com.example.couchbaseconnect.core.couchbase;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import com.example.couchbaseconnect.core.connection.ConnectionException;
import com.example.couchbaseconnect.core.connection.ConnectionManager;
import com.example.couchbaseconnect.core.history.ChatMessage;
import com.example.couchbaseconnect.core.history.SessionHistory;
import com.example.couchbaseconnect.core.history.SessionHistoryStore;
import com.example.couchbaseconnect.core.secrets.Credentials;
import com.example.couchbaseconnect.core.secrets.SecretsManagerCredentialSupplier;
import com.example.couchbaseconnect.core.storage.Keyspace;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.condition.DisabledIfSystemProperty;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.couchbase.BucketDefinition;
import org.testcontainers.couchbase.CouchbaseContainer;
import org.testcontainers.utility.DockerImageName;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;

@DisabledIfSystemProperty(named = "tests.integration.disable", matches = "true")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class CouchbaseSessionHistoryIT {

  private static final String BUCKET = "n8n";
  private static final String SECRET_ID = "couchbase/it";

  private CouchbaseContainer couchbase;
  private GenericContainer<?> localstack;
  private SecretsManagerClient smClient;
  private SecretsManagerCredentialSupplier credentialSupplier;
  private ConnectionManager manager;
  private SessionHistoryStore store;

  @BeforeAll
  void startContainersAndSeedSecret() {
    assumeTrue(dockerAvailable(), "Docker not available, skipping test");

    couchbase =
        new CouchbaseContainer(DockerImageName.parse("couchbase/server:7.2.4"))
            .withBucket(new BucketDefinition(BUCKET));
    couchbase.start();

    localstack =
        new GenericContainer<>(DockerImageName.parse("localstack/localstack:3"))
            .withExposedPorts(4566)
            .withEnv("SERVICES", "secretsmanager");
    localstack.start();

    smClient = buildLocalstackClient();
    smClient.createSecret(
        r -> r.name(SECRET_ID).secretString(secretJson(couchbase.getPassword())));
    credentialSupplier =
        SecretsManagerCredentialSupplier.builder()
            .client(smClient)
            .cacheTtl(Duration.ofMinutes(1))
            .build();

    manager =
        ConnectionManager.builder()
            .connector(new CouchbaseStorageConnector())
            .connectTimeout(Duration.ofSeconds(30))
            .idleTimeout(Duration.ofMinutes(5))
            .build();
    store = new SessionHistoryStore(Keyspace.defaults(BUCKET));
  }

  @AfterEach
  void resetBetweenTests() {
    if (credentialSupplier != null) credentialSupplier.invalidateAll();
    if (smClient != null)
      smClient.putSecretValue(
          r -> r.secretId(SECRET_ID).secretString(secretJson(couchbase.getPassword())));
  }

  @AfterAll
  void cleanup() {
    if (manager != null) manager.shutdown();
    if (credentialSupplier != null) credentialSupplier.close();

    if (smClient != null)
      try {
        smClient.close();
      } catch (Exception ignored) {
      }
    if (localstack != null) localstack.stop();
    if (couchbase != null) couchbase.stop();
  }

  @Nested
  @DisplayName("Chat History")
  class ChatHistory {

    @Test
    @DisplayName("Should append, read and clear a session through a cached connection")
    void shouldRoundTripSession() {
      final var handle = manager.acquire(credentialSupplier, SECRET_ID);

      store.addMessage(handle, "it-session", ChatMessage.human("m1"));
      store.addMessage(handle, "it-session", ChatMessage.ai("m2"));

      assertEquals(
          List.of(ChatMessage.human("m1"), ChatMessage.ai("m2")),
          store.getMessages(handle, "it-session"));
      assertEquals(2, store.getMessageWindow(handle, "it-session", 1).size());

      store.clear(handle, "it-session");
      assertEquals(List.of(), store.getMessages(handle, "it-session"));
      assertSame(handle, manager.acquire(credentialSupplier, SECRET_ID));
    }

    @Test
    @DisplayName("Should keep every message when two writers create a session concurrently")
    void shouldKeepConcurrentFirstWrites() throws Exception {
      final var credentials =
          new Credentials(
              couchbase.getConnectionString(), couchbase.getUsername(), couchbase.getPassword());
      final var start = new CountDownLatch(1);
      final var executor = Executors.newFixedThreadPool(4);
      try {
        final var futures = new ArrayList<Future<?>>();
        for (var i = 0; i < 4; i++) {
          final var history = SessionHistory.of(store, manager, credentials, "race-session");
          final var message = ChatMessage.human("writer-" + i);
          futures.add(
              executor.submit(
                  () -> {
                    start.await();
                    history.addMessage(message);
                    return null;
                  }));
        }
        start.countDown();
        for (final var f : futures) f.get(60, TimeUnit.SECONDS);
      } finally {
        executor.shutdownNow();
      }

      final var messages =
          SessionHistory.of(store, manager, credentials, "race-session").getMessages();
      assertEquals(4, messages.size());
      for (var i = 0; i < 4; i++) assertTrue(messages.contains(ChatMessage.human("writer-" + i)));
    }
  }

  @Nested
  @DisplayName("Credential Rotation")
  class CredentialRotation {

    @Test
    @DisplayName("Should reconnect when the secret changes and report rejected credentials")
    void shouldReconnectOnRotation() {
      manager.acquire(credentialSupplier, SECRET_ID);

      smClient.putSecretValue(r -> r.secretId(SECRET_ID).secretString(secretJson("wrong")));
      credentialSupplier.invalidate(SECRET_ID);

      assertThrows(
          ConnectionException.class, () -> manager.acquire(credentialSupplier, SECRET_ID));
      assertFalse(manager.hasActiveConnection());
    }
  }

  private String secretJson(final String password) {
    return """
        {"connectionString": "%s", "username": "%s", "password": "%s"}
        """
        .formatted(couchbase.getConnectionString(), couchbase.getUsername(), password);
  }

  private boolean dockerAvailable() {
    try {
      DockerClientFactory.instance().client();
      return true;
    } catch (final Throwable t) {
      return false;
    }
  }

  private SecretsManagerClient buildLocalstackClient() {
    final var endpoint =
        "http://%s:%d".formatted(localstack.getHost(), localstack.getMappedPort(4566));
    return SecretsManagerClient.builder()
        .endpointOverride(URI.create(endpoint))
        .region(Region.US_EAST_1)
        .credentialsProvider(
            StaticCredentialsProvider.create(AwsBasicCredentials.create("test", "test")))
        .build();
  }
}
