package io.topologycache.cache;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class CounterTest {

    @Test
    void testIncrAndDelete() {
        Counter counter = new Counter();

        assertThat(counter.incr("node-a")).isEqualTo(1);
        assertThat(counter.incr("node-a")).isEqualTo(2);
        assertThat(counter.isSet("node-a")).isTrue();
        assertThat(counter.len()).isEqualTo(1);

        counter.delete("node-a");
        assertThat(counter.isSet("node-a")).isFalse();
        assertThat(counter.len()).isZero();

        // deleting a missing key is harmless
        counter.delete("node-b");
        assertThat(counter.keys()).isEmpty();
    }

    @Test
    void testCopyIsIndependent() {
        Counter counter = new Counter();
        counter.incr("node-a");

        Counter copy = counter.copy();
        copy.incr("node-b");
        counter.delete("node-a");

        assertThat(copy.keys()).containsExactlyInAnyOrder("node-a", "node-b");
        assertThat(counter.keys()).isEmpty();
    }
}
