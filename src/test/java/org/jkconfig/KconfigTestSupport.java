package org.jkconfig;

import org.jkconfig.api.KconfigException;
import org.jkconfig.config.Environment;

import java.io.IOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Helpers for building configurations from inline Kconfig text or from the fixture trees
 * under {@code src/test/resources/kconfig}.
 */
public final class KconfigTestSupport {

    private KconfigTestSupport() {
    }

    /**
     * Writes {@code text} to {@code dir/Kconfig} and parses it with {@code srctree} set to {@code dir}.
     */
    public static Kconfig parse(Path dir, String text) throws IOException, KconfigException {
        return parse(dir, text, Map.of());
    }

    /**
     * Like {@link #parse(Path, String)}, with extra environment variables.
     */
    public static Kconfig parse(Path dir, String text, Map<String, String> variables)
            throws IOException, KconfigException {
        write(dir, "Kconfig", text);
        return Kconfig.builder()
                .filename("Kconfig")
                .environment(environment(dir, variables))
                .build();
    }

    /**
     * Builds an environment with {@code srctree} pointing at {@code dir}.
     */
    public static Environment environment(Path dir, Map<String, String> variables) {
        Map<String, String> all = new HashMap<>(variables);
        all.put(Environment.SRCTREE, dir.toString());
        return Environment.of(all);
    }

    public static Path write(Path dir, String name, String content) throws IOException {
        Path file = dir.resolve(name);
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        return Files.writeString(file, content, StandardCharsets.UTF_8);
    }

    /**
     * @param name A directory below {@code src/test/resources/kconfig}.
     * @return Its location on the test classpath.
     */
    public static Path fixture(String name) {
        URL url = KconfigTestSupport.class.getResource("/kconfig/" + name);
        if (url == null) {
            throw new IllegalArgumentException("No such fixture: " + name);
        }
        try {
            return Path.of(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid fixture location: " + url, e);
        }
    }
}
