package com.example.FinSolve.config;

import com.example.FinSolve.index.DocumentIndex;
import com.example.FinSolve.index.InMemoryDocumentIndex;
import com.example.FinSolve.model.DepartmentTag;
import com.example.FinSolve.model.Fragment;
import com.example.FinSolve.util.TextChunker;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Loads {@code <location>/<department>/*.md} into the in-memory index at startup.
 * The directory name is the department tag of every fragment below it.
 * Requires {@code finsolve.index.store=in-memory}; the pgvector table is populated outside the service.
 */
@Component
@ConditionalOnProperty(prefix = "finsolve.corpus", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
public class CorpusLoader implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(CorpusLoader.class);

    private final DocumentIndex index;
    private final EmbeddingModel embeddingModel;
    private final FinSolveProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        if (!(index instanceof InMemoryDocumentIndex inMemoryIndex)) {
            throw new IllegalStateException("finsolve.corpus.enabled=true requires finsolve.index.store=in-memory, "
                    + "but the active index is " + index.getClass().getSimpleName());
        }
        Path root = Paths.get(properties.getCorpus().getLocation());
        if (!Files.isDirectory(root)) {
            log.warn("Corpus directory not found, index stays empty: {}", root.toAbsolutePath());
            return;
        }
        List<Fragment> fragments = load(root);
        inMemoryIndex.addAll(fragments);
        log.info("Loaded {} fragments from {}", fragments.size(), root.toAbsolutePath());
    }

    List<Fragment> load(Path root) {
        List<Fragment> fragments = new ArrayList<>();
        for (DepartmentTag department : DepartmentTag.values()) {
            Path dir = root.resolve(department.label());
            if (!Files.isDirectory(dir)) {
                continue;
            }
            for (Path file : markdownFiles(dir)) {
                fragments.addAll(chunkFile(file, department));
            }
        }
        return fragments;
    }

    private List<Fragment> chunkFile(Path file, DepartmentTag department) {
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            Instant updatedAt = Files.getLastModifiedTime(file).toInstant();
            String fileName = file.getFileName().toString();
            List<String> chunks = TextChunker.split(
                    content,
                    properties.getCorpus().getChunkSize(),
                    properties.getCorpus().getChunkOverlap()
            );

            List<Fragment> fragments = new ArrayList<>(chunks.size());
            for (int i = 0; i < chunks.size(); i++) {
                String chunk = chunks.get(i);
                fragments.add(new Fragment(
                        department.label() + "/" + fileName + "#" + i,
                        chunk,
                        embeddingModel.embed(chunk),
                        department,
                        fileName,
                        updatedAt
                ));
            }
            log.debug("Chunked {} into {} fragments ({})", fileName, fragments.size(), department.label());
            return fragments;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read corpus file " + file, e);
        }
    }

    private static List<Path> markdownFiles(Path dir) {
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".md"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list corpus directory " + dir, e);
        }
    }
}
