package com.pgscratch.database.schema;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Where schema SQL comes from. A source expands into one or more {@link SchemaScript}s, in the
 * order they must be applied.
 */
public interface SchemaSource {

    /** File extension a migrations directory entry must carry to be applied. */
    String SQL_EXTENSION = ".sql";

    /**
     * Reads this source.
     *
     * @return scripts in application order
     * @throws IOException if anything cannot be found or read
     */
    List<SchemaScript> read() throws IOException;

    /** A single file applied verbatim. */
    static SchemaSource file(Path path) {
        return new SchemaFile(path);
    }

    /**
     * Every {@value #SQL_EXTENSION} file under {@code directory}, at any depth, ordered by full
     * path. Name migrations {@code 0001_init.sql}, {@code 0002_users.sql}, ... to order them.
     */
    static SchemaSource migrations(Path directory) {
        return new MigrationsDirectory(directory);
    }

    /** A classpath resource applied verbatim, e.g. {@code "db/schema.sql"}. */
    static SchemaSource classpath(String resource) {
        return new ClasspathResource(resource);
    }

    record SchemaFile(Path path) implements SchemaSource {

        public SchemaFile {
            if (path == null) {
                throw new IllegalArgumentException("path must not be null");
            }
        }

        @Override
        public List<SchemaScript> read() throws IOException {
            return List.of(new SchemaScript(path.toString(), Files.readString(path)));
        }
    }

    record MigrationsDirectory(Path directory) implements SchemaSource {

        public MigrationsDirectory {
            if (directory == null) {
                throw new IllegalArgumentException("directory must not be null");
            }
        }

        @Override
        public List<SchemaScript> read() throws IOException {
            List<Path> files;
            try (Stream<Path> walk = Files.walk(directory)) {
                files = walk
                        .filter(Files::isRegularFile)
                        .filter(p -> p.getFileName().toString().endsWith(SQL_EXTENSION))
                        .sorted(Comparator.comparing(Path::toString))
                        .collect(Collectors.toList());
            }
            List<SchemaScript> scripts = new ArrayList<>(files.size());
            for (Path file : files) {
                scripts.add(new SchemaScript(file.toString(), Files.readString(file)));
            }
            return List.copyOf(scripts);
        }
    }

    record ClasspathResource(String resource) implements SchemaSource {

        public ClasspathResource {
            if (resource == null || resource.isBlank()) {
                throw new IllegalArgumentException("resource must not be null or blank");
            }
        }

        @Override
        public List<SchemaScript> read() throws IOException {
            ClassLoader loader = Thread.currentThread().getContextClassLoader();
            if (loader == null) {
                loader = SchemaSource.class.getClassLoader();
            }
            try (InputStream is = loader.getResourceAsStream(resource)) {
                if (is == null) {
                    throw new IOException("classpath resource not found: " + resource);
                }
                String sql = new String(is.readAllBytes(), StandardCharsets.UTF_8);
                return List.of(new SchemaScript("classpath:" + resource, sql));
            }
        }
    }
}
