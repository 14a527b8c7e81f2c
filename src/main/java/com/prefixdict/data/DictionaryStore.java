package com.prefixdict.data;

import com.github.benmanes.caffeine.cache.Cache;
import com.prefixdict.dictionary.PrefixDictionary;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Application-wide owner of the {@link PrefixDictionary}.
 *
 * <p>The dictionary itself is not synchronized; this service puts inserts behind the write lock
 * and queries behind the read lock. Prefix results are cached until the vocabulary changes.
 */
@Slf4j
@Service
public class DictionaryStore {

    private final PrefixDictionary dictionary = new PrefixDictionary();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Cache<String, List<String>> prefixCache;

    private final Counter containsQueries;
    private final Counter prefixQueries;
    private final Counter cacheHits;
    private final Counter cacheMisses;
    private final Counter inserts;

    public DictionaryStore(@Qualifier("prefixCache") Cache<String, List<String>> prefixCache,
                           MeterRegistry meterRegistry) {
        this.prefixCache = prefixCache;
        this.containsQueries = meterRegistry.counter("prefixdict.queries", "op", "contains");
        this.prefixQueries = meterRegistry.counter("prefixdict.queries", "op", "prefixes");
        this.cacheHits = meterRegistry.counter("prefixdict.cache", "result", "hit");
        this.cacheMisses = meterRegistry.counter("prefixdict.cache", "result", "miss");
        this.inserts = meterRegistry.counter("prefixdict.inserts");
    }

    /**
     * @return true if the word was not stored before
     */
    public boolean insert(String word) {
        Objects.requireNonNull(word, "word");
        boolean added;
        lock.writeLock().lock();
        try {
            int before = dictionary.size();
            dictionary.insert(word);
            added = dictionary.size() > before;
            if (added) {
                prefixCache.invalidateAll();
                log.debug("Prefix cache flushed after inserting {}", word);
            }
        } finally {
            lock.writeLock().unlock();
        }
        inserts.increment();
        return added;
    }

    /**
     * Inserts every word under a single write lock.
     *
     * @return the number of words that were not stored before
     * @throws IllegalArgumentException if the collection contains null
     */
    public int insertAll(Collection<String> words) {
        Objects.requireNonNull(words, "words");
        for (String word : words) {
            if (word == null) {
                throw new IllegalArgumentException("words must not contain null");
            }
        }
        int added;
        lock.writeLock().lock();
        try {
            int before = dictionary.size();
            for (String word : words) {
                dictionary.insert(word);
            }
            added = dictionary.size() - before;
            if (added > 0) {
                prefixCache.invalidateAll();
                log.debug("Prefix cache flushed after inserting {} new words", added);
            }
        } finally {
            lock.writeLock().unlock();
        }
        inserts.increment(words.size());
        log.debug("Inserted {} new of {} words", added, words.size());
        return added;
    }

    public boolean contains(String word) {
        Objects.requireNonNull(word, "word");
        containsQueries.increment();
        lock.readLock().lock();
        try {
            return dictionary.contains(word);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Stored words that prefix {@code word}, shortest first. The returned list is unmodifiable
     * and may be shared with other callers.
     */
    public List<String> prefixesOf(String word) {
        Objects.requireNonNull(word, "word");
        prefixQueries.increment();
        List<String> cached = prefixCache.getIfPresent(word);
        if (cached != null) {
            cacheHits.increment();
            return cached;
        }
        cacheMisses.increment();
        List<String> result;
        lock.readLock().lock();
        try {
            result = List.copyOf(dictionary.prefixesOf(word));
            // filled under the read lock; inserts flush under the write lock
            prefixCache.put(word, result);
        } finally {
            lock.readLock().unlock();
        }
        return result;
    }

    public Iterator<String> iterPrefixes(String word) {
        lock.readLock().lock();
        try {
            return dictionary.iterPrefixes(word);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int compact() {
        lock.writeLock().lock();
        try {
            return dictionary.compact();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int wordCount() {
        lock.readLock().lock();
        try {
            return dictionary.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Stats stats() {
        return new Stats(wordCount(), containsQueries.count(), prefixQueries.count(),
                cacheHits.count(), cacheMisses.count());
    }

    @Getter
    @AllArgsConstructor
    public static class Stats {
        private final int words;
        private final double containsQueries;
        private final double prefixQueries;
        private final double cacheHits;
        private final double cacheMisses;
    }
}
