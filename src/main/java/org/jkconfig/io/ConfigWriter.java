package org.jkconfig.io;

import org.jkconfig.Kconfig;
import org.jkconfig.api.KconfigException;
import org.jkconfig.model.Expressions;
import org.jkconfig.model.MenuNode;
import org.jkconfig.model.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Writes the current values of a {@link Kconfig} as a {@code .config} file, in menu tree order.
 * Visible menus and comments become comment blocks.
 */
public class ConfigWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigWriter.class);

    private final Kconfig kconfig;

    public ConfigWriter(Kconfig kconfig) {
        this.kconfig = kconfig;
    }

    /**
     * @param file The file to write.
     * @param header Text written before the symbol values.
     * @throws KconfigException if the file cannot be written.
     */
    public void write(Path file, String header) throws KconfigException {
        try {
            Files.writeString(file, header + render(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new KconfigException("could not write configuration file '" + file + "'", e);
        }
        LOG.info("Configuration written to {}", file);
    }

    /**
     * @return The symbol values and comment blocks, without a header.
     */
    public String render() {
        StringBuilder out = new StringBuilder();
        Set<Symbol> written = Collections.newSetFromMap(new IdentityHashMap<>());
        for (MenuNode node : kconfig.nodes()) {
            if (node.getItem() instanceof Symbol symbol) {
                if (written.add(symbol)) {
                    out.append(symbol.getConfigString());
                }
            } else if (isCommentBlock(node)) {
                out.append("\n#\n# ").append(node.getPrompt().text()).append("\n#\n");
            }
        }
        return out.toString();
    }

    private static boolean isCommentBlock(MenuNode node) {
        if (Expressions.value(node.getDependency()) == 0) {
            return false;
        }
        return switch (node.getKind()) {
            case MENU -> Expressions.value(node.getVisibleIf()) != 0;
            case COMMENT -> true;
            default -> false;
        };
    }
}
