package org.jkconfig.frontend.source;

import org.jkconfig.api.KconfigException;
import org.jkconfig.api.KconfigSyntaxException;
import org.jkconfig.api.SourceInfo;
import org.jkconfig.config.Environment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Resolves the files named by {@code source} statements and keeps the stack of files
 * currently being parsed.
 * <p>
 * Relative names are looked up below {@code srctree} when it is set, else below the working
 * directory. Names are recorded as written, so locations stay relative to the source tree.
 */
public class SourceResolver {

    private static final Logger LOG = LoggerFactory.getLogger(SourceResolver.class);

    private record OpenFile(SourceReader reader, Path path, SourceInfo includedFrom) {}

    private final Optional<String> srctree;
    private final Deque<OpenFile> stack = new ArrayDeque<>();

    /**
     * @param environment The environment providing {@code srctree}.
     */
    public SourceResolver(Environment environment) {
        this.srctree = environment.srctree();
    }

    /**
     * @param fileName A file name as written in a Kconfig file.
     * @return The path the file is read from.
     */
    public Path resolve(String fileName) {
        Path path = Path.of(fileName);
        if (!path.isAbsolute() && srctree.isPresent()) {
            return Path.of(srctree.get()).resolve(path);
        }
        return path;
    }

    public boolean exists(String fileName) {
        return Files.isRegularFile(resolve(fileName));
    }

    /**
     * Joins a name given to {@code rsource} with the directory of the file containing the statement.
     *
     * @param includingFile The name of the including file.
     * @param fileName The name given to the statement.
     * @return The name relative to the source tree.
     */
    public static String relativeTo(String includingFile, String fileName) {
        if (fileName.startsWith("/")) {
            return fileName;
        }
        int slash = includingFile.lastIndexOf('/');
        return slash < 0 ? fileName : includingFile.substring(0, slash + 1) + fileName;
    }

    /**
     * Opens a file and makes it the current one.
     *
     * @param fileName The file name as written.
     * @param includedFrom The location of the {@code source} statement, or {@code null} for the top-level file.
     * @return The reader for the file.
     * @throws KconfigSyntaxException if the file is already being parsed.
     * @throws KconfigException if the file cannot be read.
     */
    public SourceReader enter(String fileName, SourceInfo includedFrom) throws KconfigException {
        Path path = resolve(fileName);
        Path normalized = path.toAbsolutePath().normalize();
        for (OpenFile open : stack) {
            if (open.path().equals(normalized)) {
                throw new KconfigSyntaxException("recursive 'source' of '" + fileName + "' detected. Check that "
                        + "environment variables are set correctly.\nInclude path:\n" + includePath(), includedFrom);
            }
        }
        try {
            SourceReader reader = SourceReader.open(path, fileName);
            stack.push(new OpenFile(reader, normalized, includedFrom));
            LOG.debug("Parsing {}", path);
            return reader;
        } catch (IOException e) {
            throw new KconfigException("'" + fileName + "' not found (in '" + path + "'). Check that environment "
                    + "variables are set correctly (e.g. $srctree, which is "
                    + srctree.map(s -> "'" + s + "'").orElse("unset") + ")", includedFrom, e);
        }
    }

    /**
     * Closes the current file and returns to the including one.
     */
    public void leave() {
        OpenFile file = stack.pop();
        LOG.debug("Done parsing {}", file.path());
    }

    /**
     * @return The reader of the file currently being parsed.
     */
    public SourceReader current() {
        OpenFile top = stack.peek();
        return top == null ? null : top.reader();
    }

    private String includePath() {
        List<String> entries = new ArrayList<>();
        Iterator<OpenFile> outermostFirst = stack.descendingIterator();
        while (outermostFirst.hasNext()) {
            SourceInfo includedFrom = outermostFirst.next().includedFrom();
            if (includedFrom != null) {
                entries.add(includedFrom.toString());
            }
        }
        return String.join("\n", entries);
    }
}
