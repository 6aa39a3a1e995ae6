package net.lanplay.mDNS;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import net.lanplay.mDNS.ServiceSessionException.REASON;
import org.junit.jupiter.api.Test;

class ServiceSessionExceptionTest {

  @Test
  void messageWithoutContextIsPlain() {
    ServiceSessionException e = new ServiceSessionException(REASON.ENGINE_CLOSED, "closed");

    assertThat(e.getMessage()).isEqualTo("closed");
    assertThat(e.getOperation()).isNull();
  }

  @Test
  void contextNamesTheCallAndTheService() {
    IOException cause = new IOException("bind failed");
    ServiceSessionException e = new ServiceSessionException(REASON.ENGINE_UNAVAILABLE,
        "no socket", cause).withContext("advertise", "_mygame._tcp.local.", "Game Server A");

    assertThat(e.getMessage()).isEqualTo(
        "advertise(\"Game Server A\", _mygame._tcp.local.) failed [ENGINE_UNAVAILABLE]: no socket");
    assertThat(e.getCause()).isSameAs(cause);
    assertThat(e.isEngineUnavailable()).isTrue();
  }

  @Test
  void firstContextWins() {
    ServiceSessionException e = new ServiceSessionException(REASON.NAME_CONFLICT, "taken")
        .withContext("advertise", "_mygame._tcp.local.", "Game Server A")
        .withContext("process", null, null);

    assertThat(e.getOperation()).isEqualTo("advertise");
    assertThat(e.getServiceType()).isEqualTo("_mygame._tcp.local.");
    assertThat(e.getInstanceName()).isEqualTo("Game Server A");
    assertThat(e.isEngineUnavailable()).isFalse();
  }

  @Test
  void blockedMulticastCountsAsUnavailable() {
    assertThat(new ServiceSessionException(REASON.MULTICAST_BLOCKED, "join failed")
        .isEngineUnavailable()).isTrue();
  }
}
