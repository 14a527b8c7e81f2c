package com.prefixdict.data;

import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.AbstractResource;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VocabularyLoaderTest {

    private DictionaryStore store;

    @BeforeEach
    void setUp() {
        store = new DictionaryStore(Caffeine.newBuilder().build(), new SimpleMeterRegistry());
    }

    @Test
    void loadsWordsSkippingHeaderCommentsAndBlankLines() throws Exception {
        String csv = "word\n# comment\ng\n\ngo\ngo\n语言\n\"\"\n\" spaced \"\n";
        VocabularyLoader loader = loader("classpath:unused.csv", true);

        int read = loader.load(new ByteArrayResource(csv.getBytes(StandardCharsets.UTF_8)));

        assertThat(read).isEqualTo(6);
        assertThat(store.wordCount()).isEqualTo(5);
        assertThat(store.contains("go")).isTrue();
        assertThat(store.contains("语言")).isTrue();
        assertThat(store.contains("")).isTrue();
        assertThat(store.contains(" spaced ")).isTrue();
        assertThat(store.contains("# comment")).isFalse();
        assertThat(store.contains("word")).isFalse();
    }

    @Test
    void runLoadsConfiguredClasspathResource() throws Exception {
        loader("classpath:test-vocabulary.csv", true).run();

        assertThat(store.contains("golang")).isTrue();
        assertThat(store.prefixesOf("golang")).containsExactly("g", "go", "golang");
    }

    @Test
    void missingResourceLeavesDictionaryEmpty() throws Exception {
        loader("classpath:does-not-exist.csv", true).run();

        assertThat(store.wordCount()).isZero();
    }

    @Test
    void disabledLoaderDoesNothing() throws Exception {
        loader("classpath:test-vocabulary.csv", false).run();

        assertThat(store.wordCount()).isZero();
    }

    @Test
    void unreadableResourceFailsLoad() {
        VocabularyLoader loader = loader("classpath:unused.csv", true);

        assertThatThrownBy(() -> loader.load(new UnreadableResource()))
                .isInstanceOf(IOException.class)
                .hasMessage("disk gone");
        assertThat(store.wordCount()).isZero();
    }

    @Test
    void unreadableResourceAbortsRun() {
        DefaultResourceLoader resourceLoader = new DefaultResourceLoader() {
            @Override
            public Resource getResource(String location) {
                return new UnreadableResource();
            }
        };
        VocabularyLoader loader = new VocabularyLoader(resourceLoader, store, "classpath:vocabulary.csv", true);

        assertThatThrownBy(loader::run).isInstanceOf(IOException.class);
        assertThat(store.wordCount()).isZero();
    }

    private VocabularyLoader loader(String location, boolean enabled) {
        return new VocabularyLoader(new DefaultResourceLoader(), store, location, enabled);
    }

    // exists but cannot be opened
    private static class UnreadableResource extends AbstractResource {
        @Override
        public boolean exists() {
            return true;
        }

        @Override
        public String getDescription() {
            return "unreadable vocabulary";
        }

        @Override
        public InputStream getInputStream() throws IOException {
            throw new IOException("disk gone");
        }
    }
}
