package com.acme.relay.dispatch;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.acme.relay.directive.Directive;
import com.acme.relay.registry.ProjectDescriptor;
import com.acme.relay.registry.ProjectRegistry;
import com.acme.relay.spi.InMemoryQueueStore;
import com.acme.relay.spi.QueueStore;
import com.acme.relay.spi.QueueStoreException;
import com.acme.relay.workorder.WorkOrderEncoder;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for Dispatcher.
 *
 * <p>Coverage areas:
 * - Successful dispatch for every action
 * - Validation and lookup failures never touch the store
 * - Target queue override vs default
 * - Store failures surface as DeliveryFailedException
 * - Concurrent dispatch from several threads
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("Dispatcher Unit Tests")
class DispatcherTest {

  private static final String DEFAULT_QUEUE = "poppit:notifications";

  private static final ProjectRegistry REGISTRY =
      ProjectRegistry.of(
          new ProjectDescriptor(
              "org/app",
              "/srv/app",
              List.of("start.sh"),
              List.of("stop.sh"),
              List.of("stop.sh", "start.sh"),
              null),
          new ProjectDescriptor(
              "org/custom", "/srv/custom", List.of("up.sh"), List.of(), null, "custom:queue"),
          new ProjectDescriptor("org/blank", "/srv/blank", null, null, null, ""));

  @Mock private QueueStore store;

  private Dispatcher dispatcher;

  @BeforeEach
  void setUp() {
    dispatcher = new Dispatcher(REGISTRY, new WorkOrderEncoder(), store, DEFAULT_QUEUE);
  }

  @Nested
  @DisplayName("Successful dispatch")
  class SuccessTests {

    @ParameterizedTest
    @CsvSource({
      "'{\"up\":\"org/app\"}',      service-up,      '[\"start.sh\"]'",
      "'{\"down\":\"org/app\"}',    service-down,    '[\"stop.sh\"]'",
      "'{\"restart\":\"org/app\"}', service-restart, '[\"stop.sh\",\"start.sh\"]'"
    })
    @DisplayName("Should append one work order per directive")
    void testEachAction(String directive, String type, String commands) {
      DispatchResult result = dispatcher.dispatch(directive);

      String expected =
          "{\"repo\":\"org/app\",\"branch\":\"refs/heads/main\",\"type\":\""
              + type
              + "\",\"dir\":\"/srv/app\",\"commands\":"
              + commands
              + "}";
      verify(store).append(DEFAULT_QUEUE, expected);
      verifyNoMoreInteractions(store);
      assertThat(result.payload()).isEqualTo(expected);
      assertThat(result.targetQueue()).isEqualTo(DEFAULT_QUEUE);
      assertThat(result.workOrder().type()).isEqualTo(type);
    }

    @Test
    @DisplayName("Should write to the project's override queue")
    void testOverrideQueue() {
      DispatchResult result = dispatcher.dispatch(Directive.up("org/custom"));

      verify(store).append(eq("custom:queue"), anyString());
      assertThat(result.targetQueue()).isEqualTo("custom:queue");
    }

    @Test
    @DisplayName("Should fall back to the default queue when the override is empty")
    void testEmptyOverride() {
      dispatcher.dispatch(Directive.down("org/blank"));

      verify(store).append(eq(DEFAULT_QUEUE), anyString());
    }

    @Test
    @DisplayName("Should forward an empty command list rather than reject the directive")
    void testEmptyCommandList() {
      DispatchResult result = dispatcher.dispatch(Directive.restart("org/custom"));

      assertThat(result.workOrder().commands()).isEmpty();
      assertThat(result.payload()).endsWith("\"commands\":[]}");
      verify(store).append("custom:queue", result.payload());
    }
  }

  @Nested
  @DisplayName("Rejected directives")
  class RejectionTests {

    @Test
    @DisplayName("Should reject a directive with no action and not write")
    void testNoAction() {
      assertThatThrownBy(() -> dispatcher.dispatch("{}"))
          .isInstanceOf(InvalidDirectiveException.class);

      verifyNoInteractions(store);
    }

    @Test
    @DisplayName("Should reject a directive with two actions and not write")
    void testTwoActions() {
      assertThatThrownBy(() -> dispatcher.dispatch(new Directive("org/app", null, "org/app")))
          .isInstanceOf(InvalidDirectiveException.class);

      verifyNoInteractions(store);
    }

    @Test
    @DisplayName("Should reject malformed JSON and not write")
    void testMalformed() {
      assertThatThrownBy(() -> dispatcher.dispatch("{\"up\":"))
          .isInstanceOf(InvalidDirectiveException.class);

      verifyNoInteractions(store);
    }

    @Test
    @DisplayName("Should reject an unknown repository and not write")
    void testUnknownRepository() {
      assertThatThrownBy(() -> dispatcher.dispatch(Directive.down("org/missing")))
          .isInstanceOf(UnknownRepositoryException.class)
          .hasMessage("no configuration found for repository: org/missing");

      verifyNoInteractions(store);
    }
  }

  @Nested
  @DisplayName("Delivery failures")
  class DeliveryTests {

    @Test
    @DisplayName("Should surface store failures as DeliveryFailedException without retrying")
    void testStoreFailure() {
      QueueStoreException cause = new QueueStoreException("Connection refused", null);
      doThrow(cause).when(store).append(anyString(), anyString());

      assertThatThrownBy(() -> dispatcher.dispatch(Directive.up("org/app")))
          .isInstanceOf(DeliveryFailedException.class)
          .hasMessage("failed to push notification to poppit:notifications: Connection refused")
          .hasCause(cause);

      verify(store, times(1)).append(anyString(), anyString());
    }
  }

  @Nested
  @DisplayName("Concurrency")
  class ConcurrencyTests {

    @Test
    @DisplayName("Should dispatch concurrently without losing or corrupting work orders")
    void testConcurrentDispatch() throws Exception {
      InMemoryQueueStore memory = new InMemoryQueueStore();
      Dispatcher shared = new Dispatcher(REGISTRY, new WorkOrderEncoder(), memory, DEFAULT_QUEUE);
      int threads = 8;
      int perThread = 50;
      ExecutorService pool = Executors.newFixedThreadPool(threads);
      CountDownLatch go = new CountDownLatch(1);
      List<Future<?>> futures = new ArrayList<>();

      try {
        for (int t = 0; t < threads; t++) {
          Callable<Void> task =
              () -> {
                go.await();
                for (int i = 0; i < perThread; i++) {
                  shared.dispatch(Directive.up("org/app"));
                }
                return null;
              };
          futures.add(pool.submit(task));
        }
        go.countDown();
        for (Future<?> f : futures) {
          f.get(10, TimeUnit.SECONDS);
        }
      } finally {
        pool.shutdownNow();
      }

      List<String> written = memory.contents(DEFAULT_QUEUE);
      assertThat(written).hasSize(threads * perThread);
      assertThat(written).allMatch(p -> p.equals(written.get(0)));
    }
  }
}
