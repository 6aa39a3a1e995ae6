package net.lanplay.mDNS.utils;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ListenerProcessorTest {

  interface Greeter {
    void greet(String name);
  }

  @Test
  void dispatchesToEveryListenerInOrder() {
    List<String> calls = new ArrayList<>();
    ListenerProcessor<Greeter> processor = new ListenerProcessor<>(Greeter.class);
    processor.registerListener(name -> calls.add("first " + name));
    processor.registerListener(name -> calls.add("second " + name));

    processor.getDispatcher().greet("peer");

    assertThat(calls).containsExactly("first peer", "second peer");
  }

  @Test
  void failingListenerDoesNotStopTheOthers() {
    List<String> calls = new ArrayList<>();
    ListenerProcessor<Greeter> processor = new ListenerProcessor<>(Greeter.class);
    processor.registerListener(name -> {
      throw new IllegalStateException("boom");
    });
    processor.registerListener(calls::add);

    processor.getDispatcher().greet("peer");

    assertThat(calls).containsExactly("peer");
  }

  @Test
  void stopDispatchHaltsDelivery() {
    List<String> calls = new ArrayList<>();
    ListenerProcessor<Greeter> processor = new ListenerProcessor<>(Greeter.class);
    processor.registerListener(name -> {
      calls.add("first");
      throw new ListenerProcessor.StopDispatchException();
    });
    processor.registerListener(name -> calls.add("second"));

    processor.getDispatcher().greet("peer");

    assertThat(calls).containsExactly("first");
  }

  @Test
  void registersAListenerOnceAndUnregistersIt() {
    List<String> calls = new ArrayList<>();
    Greeter greeter = calls::add;
    ListenerProcessor<Greeter> processor = new ListenerProcessor<>(Greeter.class);

    assertThat(processor.registerListener(greeter)).isSameAs(greeter);
    processor.registerListener(greeter);
    processor.getDispatcher().greet("once");
    assertThat(processor.unregisterListener(greeter)).isSameAs(greeter);
    processor.getDispatcher().greet("never");

    assertThat(calls).containsExactly("once");
    assertThat(processor.hasListeners()).isFalse();
    assertThat(processor.unregisterListener(greeter)).isNull();
    assertThat(processor.registerListener(null)).isNull();
  }

  @Test
  void requiresAnInterface() {
    assertThatThrownBy(() -> new ListenerProcessor<>(String.class))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
