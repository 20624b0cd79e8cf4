package io.github.isoflow.dispatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import io.github.isoflow.model.DispatchMode;
import org.junit.jupiter.api.Test;

class ActionDispatchersTest {

  @Test
  void create() {
    final DirectActionDispatcher direct = mock(DirectActionDispatcher.class);
    final QueuedActionDispatcher queued = mock(QueuedActionDispatcher.class);
    final ActionDispatchers dispatchers = new ActionDispatchers(() -> direct, () -> queued);

    assertThat(dispatchers.create(DispatchMode.DIRECT)).isSameAs(direct);
    assertThat(dispatchers.create(DispatchMode.QUEUED)).isSameAs(queued);
  }

}
