package io.topologycache.enums;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class CacheResyncMethodTest {

    @Test
    void testFromString() {
        assertThat(CacheResyncMethod.fromString("Autodetect")).isEqualTo(CacheResyncMethod.AUTODETECT);
        assertThat(CacheResyncMethod.fromString(" allresources ")).isEqualTo(CacheResyncMethod.ALL_RESOURCES);
        assertThat(CacheResyncMethod.fromString("ONLY_EXCLUSIVE_RESOURCES")).isEqualTo(CacheResyncMethod.ONLY_EXCLUSIVE_RESOURCES);
        assertThat(CacheResyncMethod.fromString("unknown")).isNull();
        assertThat(CacheResyncMethod.fromString(null)).isNull();
    }

    @Test
    void testOtherModesFromString() {
        assertThat(CacheInformerMode.fromString("shared")).isEqualTo(CacheInformerMode.SHARED);
        assertThat(CacheInformerMode.fromString("x")).isNull();
        assertThat(ForeignPodsDetectMode.fromString("OnlyExclusiveResources"))
                .isEqualTo(ForeignPodsDetectMode.ONLY_EXCLUSIVE_RESOURCES);
        assertThat(ForeignPodsDetectMode.fromString("none")).isEqualTo(ForeignPodsDetectMode.NONE);
    }
}
