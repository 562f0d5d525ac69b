package com.fastbatch.core.metric;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BatchMeterRegistryProviderTest {

    @Test
    void noRegistries_bindsInMemoryFallback() {
        // when
        BatchMeterRegistryProvider provider = new BatchMeterRegistryProvider(List.of());

        // then
        assertThat(provider.getBoundRegistries()).singleElement().isInstanceOf(SimpleMeterRegistry.class);
        provider.getRegistry().counter("batch.test").increment();
        assertThat(provider.getBoundRegistries().get(0).get("batch.test").counter().count()).isEqualTo(1.0);
    }

    @Test
    void nestedCompositesAreFlattened_andDuplicatesBoundOnce() {
        // given
        SimpleMeterRegistry a = new SimpleMeterRegistry();
        SimpleMeterRegistry b = new SimpleMeterRegistry();
        CompositeMeterRegistry inner = new CompositeMeterRegistry();
        inner.add(b);
        CompositeMeterRegistry outer = new CompositeMeterRegistry();
        outer.add(a);
        outer.add(inner);

        // when
        BatchMeterRegistryProvider provider = new BatchMeterRegistryProvider(Arrays.asList(outer, a, null, b));

        // then
        assertThat(provider.getBoundRegistries()).containsExactlyInAnyOrder(a, b);
        provider.getRegistry().counter("batch.tasks").increment(2);
        for (MeterRegistry leaf : List.of(a, b)) {
            assertThat(leaf.get("batch.tasks").counter().count()).isEqualTo(2.0);
        }
    }

    @Test
    void nullList_treatedAsEmpty() {
        BatchMeterRegistryProvider provider = new BatchMeterRegistryProvider(null);

        assertThat(provider.getBoundRegistries()).hasSize(1);
    }
}
