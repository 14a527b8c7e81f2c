package com.prefixdict.controller;

import com.prefixdict.data.DictionaryStore;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

@RestController
@RequestMapping("/api")
public class DictionaryController {

    private final DictionaryStore store;

    @Autowired
    public DictionaryController(DictionaryStore store) {
        this.store = store;
    }

    @GetMapping("/contains")
    public ResponseEntity<ContainsResponse> contains(@RequestParam(value = "word", defaultValue = "") String word) {
        return ResponseEntity.ok(new ContainsResponse(word, store.contains(word)));
    }

    @GetMapping("/prefixes")
    public ResponseEntity<PrefixesResponse> prefixes(@RequestParam(value = "word", defaultValue = "") String word) {
        return ResponseEntity.ok(new PrefixesResponse(word, store.prefixesOf(word)));
    }

    @GetMapping("/prefixes/stream")
    public ResponseEntity<PrefixesResponse> streamPrefixes(@RequestParam(value = "word", defaultValue = "") String word) {
        Iterator<String> it = store.iterPrefixes(word);
        List<String> out = new ArrayList<>();
        it.forEachRemaining(out::add);
        return ResponseEntity.ok(new PrefixesResponse(word, out));
    }

    @PostMapping("/words")
    public ResponseEntity<AddWordsResponse> addWords(@RequestBody AddWordsRequest req) {
        if (req == null || req.getWords() == null) {
            throw new IllegalArgumentException("words is required");
        }
        int added = store.insertAll(req.getWords());
        return ResponseEntity.ok(new AddWordsResponse(req.getWords().size(), added, store.wordCount()));
    }

    @PostMapping("/compact")
    public ResponseEntity<CompactResponse> compact() {
        return ResponseEntity.ok(new CompactResponse(store.compact()));
    }

    @GetMapping("/stats")
    public ResponseEntity<DictionaryStore.Stats> stats() {
        return ResponseEntity.ok(store.stats());
    }

    // DTOs
    @Getter
    @Setter
    @NoArgsConstructor
    public static class AddWordsRequest {
        private List<String> words;
    }

    @Getter
    @AllArgsConstructor
    public static class ContainsResponse {
        private final String word;
        private final boolean contains;
    }

    @Getter
    @AllArgsConstructor
    public static class PrefixesResponse {
        private final String word;
        private final List<String> prefixes;
    }

    @Getter
    @AllArgsConstructor
    public static class AddWordsResponse {
        private final int received;
        private final int added;
        private final int total;
    }

    @Getter
    @AllArgsConstructor
    public static class CompactResponse {
        private final int mergedBranches;
    }
}
