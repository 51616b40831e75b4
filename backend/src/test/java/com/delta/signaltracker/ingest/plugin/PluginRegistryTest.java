package com.delta.signaltracker.ingest.plugin;

import com.delta.signaltracker.ingest.model.CompanyTarget;
import com.delta.signaltracker.ingest.model.RawRecord;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PluginRegistryTest {

    @Test
    void registeringTheSameNameTwiceFails() {
        PluginRegistry registry = new PluginRegistry();
        registry.register("news", NamedPlugin::new);

        assertThatThrownBy(() -> registry.register(" news ", NamedPlugin::new))
            .isInstanceOf(DuplicatePluginException.class)
            .hasMessageContaining("news");
    }

    @Test
    void blankNamesAreRejected() {
        PluginRegistry registry = new PluginRegistry();

        assertThatThrownBy(() -> registry.register("  ", NamedPlugin::new))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unknownNamesFailBeforeAnythingIsInstantiated() {
        PluginRegistry registry = new PluginRegistry();
        AtomicInteger created = new AtomicInteger();
        registry.register("news", name -> {
            created.incrementAndGet();
            return new NamedPlugin(name);
        });
        registry.register("profile", NamedPlugin::new);

        assertThatThrownBy(() -> registry.resolve(List.of("news", "blog", "forum")))
            .isInstanceOf(UnknownPluginException.class)
            .hasMessageContaining("blog")
            .hasMessageContaining("news")
            .satisfies(e -> assertThat(((UnknownPluginException) e).unknownNames()).containsExactly("blog", "forum"));
        assertThat(created.get()).isZero();
    }

    @Test
    void resolvesInRequestOrderAndCollapsesDuplicates() {
        PluginRegistry registry = new PluginRegistry();
        registry.register("news", NamedPlugin::new);
        registry.register("profile", NamedPlugin::new);
        registry.register("jobs", NamedPlugin::new);

        List<SourcePlugin> plugins = registry.resolve(List.of("profile", "news", "profile"));

        assertThat(plugins.stream().map(SourcePlugin::name).collect(Collectors.toList()))
            .containsExactly("profile", "news");
        assertThat(registry.registeredNames()).containsExactly("jobs", "news", "profile");
        assertThat(registry.isRegistered("jobs")).isTrue();
        assertThat(registry.isRegistered("blog")).isFalse();
    }

    @Test
    void namesAreCaseSensitiveAndTrimmed() {
        PluginRegistry registry = new PluginRegistry();
        registry.register("News", NamedPlugin::new);
        registry.register("news", NamedPlugin::new);

        assertThat(registry.resolve(List.of(" News ", "news")))
            .extracting(SourcePlugin::name)
            .containsExactly("News", "news");
    }

    @Test
    void factoryReturningAnotherNameIsRejected() {
        PluginRegistry registry = new PluginRegistry();
        registry.register("news", name -> new NamedPlugin("other"));

        assertThatThrownBy(() -> registry.resolve(List.of("news")))
            .isInstanceOf(IllegalStateException.class);
    }

    private static final class NamedPlugin implements SourcePlugin {
        private final String name;

        private NamedPlugin(String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public Stream<RawRecord> fetch(CompanyTarget target, Instant since) {
            return Stream.empty();
        }
    }
}
