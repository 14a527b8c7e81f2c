package com.prefixdict.data;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the dictionary at start-up from a CSV word list with a single {@code word} column.
 * Lines starting with {@code #} and blank lines are skipped; values are taken verbatim.
 */
@Slf4j
@Component
public class VocabularyLoader implements CommandLineRunner {

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader("word")
            .setSkipHeaderRecord(true)
            .setCommentMarker('#')
            .setIgnoreEmptyLines(true)
            .build();

    private final ResourceLoader resourceLoader;
    private final DictionaryStore store;
    private final String location;
    private final boolean enabled;

    public VocabularyLoader(ResourceLoader resourceLoader,
                            DictionaryStore store,
                            @Value("${prefixdict.vocabulary.location:classpath:vocabulary.csv}") String location,
                            @Value("${prefixdict.vocabulary.enabled:true}") boolean enabled) {
        this.resourceLoader = resourceLoader;
        this.store = store;
        this.location = location;
        this.enabled = enabled;
    }

    @Override
    public void run(String... args) throws IOException {
        if (!enabled) {
            log.info("Vocabulary loading disabled, starting with an empty dictionary");
            return;
        }
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("Vocabulary {} not found, starting with an empty dictionary", location);
            return;
        }
        load(resource);
    }

    /**
     * Reads every record of the resource and inserts it into the store.
     *
     * @return the number of records read, duplicates included
     */
    public int load(Resource resource) throws IOException {
        long t0 = System.nanoTime();
        List<String> words = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8));
             CSVParser csvParser = new CSVParser(reader, FORMAT)) {
            for (CSVRecord csvRecord : csvParser) {
                words.add(csvRecord.get("word"));
            }
        }
        int added = store.insertAll(words);
        long ms = (System.nanoTime() - t0) / 1_000_000;
        log.info("Loaded {} records ({} new words) from {} in {} ms",
                words.size(), added, resource.getDescription(), ms);
        return words.size();
    }
}
